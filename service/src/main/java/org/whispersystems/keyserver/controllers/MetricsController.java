/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.controllers;

import io.dropwizard.auth.Auth;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.whispersystems.keyserver.auth.AuthenticatedUser;
import org.whispersystems.keyserver.entities.AggregateMetrics;
import org.whispersystems.keyserver.metrics.MetricsAggregator;

@Path("/v1/metrics")
@io.swagger.v3.oas.annotations.tags.Tag(name = "Metrics")
public class MetricsController {

  private final MetricsAggregator metricsAggregator;

  public MetricsController(final MetricsAggregator metricsAggregator) {
    this.metricsAggregator = metricsAggregator;
  }

  @GET
  @Produces(MediaType.APPLICATION_JSON)
  @Operation(summary = "Get aggregate metrics",
      description = "Reports prekey pool health, delivery and group statistics. Briefly cached. Operators only.")
  @ApiResponse(responseCode = "200", description = "Sections that could not be computed are null.",
      useReturnTypeSchema = true)
  @ApiResponse(responseCode = "403", description = "The caller is not an operator.")
  public AggregateMetrics getMetrics(@Auth final AuthenticatedUser auth) {
    if (!auth.isOperator()) {
      throw new KeyServerException(ErrorCode.FORBIDDEN, "Operator access required");
    }

    return metricsAggregator.getMetrics();
  }
}
