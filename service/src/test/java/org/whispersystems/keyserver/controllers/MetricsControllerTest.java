/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keyserver.controllers;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import io.dropwizard.testing.junit5.ResourceExtension;
import jakarta.ws.rs.core.Response;
import java.time.Instant;
import org.glassfish.jersey.test.grizzly.GrizzlyWebTestContainerFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.whispersystems.keyserver.auth.AuthenticatedUser;
import org.whispersystems.keyserver.entities.AggregateMetrics;
import org.whispersystems.keyserver.mappers.KeyServerExceptionMapper;
import org.whispersystems.keyserver.metrics.MetricsAggregator;
import org.whispersystems.keyserver.tests.util.AuthHelper;
import org.whispersystems.keyserver.util.SystemMapper;

@ExtendWith(DropwizardExtensionsSupport.class)
class MetricsControllerTest {

  private static final MetricsAggregator metricsAggregator = mock(MetricsAggregator.class);

  private static final ResourceExtension resources = ResourceExtension.builder()
      .setMapper(SystemMapper.jsonMapper())
      .addProvider(AuthHelper.getAuthFilter())
      .addProvider(new AuthValueFactoryProvider.Binder<>(AuthenticatedUser.class))
      .setTestContainerFactory(new GrizzlyWebTestContainerFactory())
      .addResource(new KeyServerExceptionMapper())
      .addResource(new MetricsController(metricsAggregator))
      .build();

  @AfterEach
  void teardown() {
    reset(metricsAggregator);
  }

  @Test
  void operatorGetsMetrics() {
    when(metricsAggregator.getMetrics()).thenReturn(new AggregateMetrics(Instant.parse("2024-03-01T12:00:00Z"),
        new AggregateMetrics.Connections(true, 2, 3), null, null, null, null,
        new AggregateMetrics.DeviceCounts(4, 1), null));

    final JsonNode response = resources.getJerseyTest()
        .target("/v1/metrics")
        .request()
        .header("Authorization", AuthHelper.getAuthHeader(AuthHelper.OPERATOR_USER_ID))
        .get(JsonNode.class);

    assertThat(response.get("generatedAt").asText()).isEqualTo("2024-03-01T12:00:00Z");
    assertThat(response.get("devices").get("active").asInt()).isEqualTo(4);
    assertThat(response.has("delivery")).isTrue();
    assertThat(response.get("delivery").isNull()).isTrue();
  }

  @Test
  void nonOperatorForbidden() {
    try (final Response response = resources.getJerseyTest()
        .target("/v1/metrics")
        .request()
        .header("Authorization", AuthHelper.getAuthHeader(AuthHelper.VALID_USER_ID))
        .get()) {

      assertThat(response.getStatus()).isEqualTo(403);
      assertThat(response.getHeaderString(KeyServerExceptionMapper.ERROR_CODE_HEADER)).isEqualTo("FORBIDDEN");
    }

    verifyNoInteractions(metricsAggregator);
  }
}
