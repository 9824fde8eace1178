/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keyserver.controllers;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import io.dropwizard.testing.junit5.ResourceExtension;
import jakarta.ws.rs.client.Entity;
import jakarta.ws.rs.core.Response;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.glassfish.jersey.test.grizzly.GrizzlyWebTestContainerFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.whispersystems.keyserver.auth.AuthenticatedUser;
import org.whispersystems.keyserver.entities.CreateInviteRequest;
import org.whispersystems.keyserver.entities.InviteListResponse;
import org.whispersystems.keyserver.entities.InviteResponse;
import org.whispersystems.keyserver.entities.JoinGroupRequest;
import org.whispersystems.keyserver.entities.JoinGroupResponse;
import org.whispersystems.keyserver.mappers.KeyServerExceptionMapper;
import org.whispersystems.keyserver.storage.GroupInvite;
import org.whispersystems.keyserver.storage.GroupInvitesManager;
import org.whispersystems.keyserver.storage.InviteType;
import org.whispersystems.keyserver.tests.util.AuthHelper;
import org.whispersystems.keyserver.util.SystemMapper;

@ExtendWith(DropwizardExtensionsSupport.class)
class GroupInvitesControllerTest {

  private static final UUID GROUP_ID = UUID.randomUUID();
  private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

  private static final GroupInvitesManager groupInvitesManager = mock(GroupInvitesManager.class);

  private static final ResourceExtension resources = ResourceExtension.builder()
      .setMapper(SystemMapper.jsonMapper())
      .addProvider(AuthHelper.getAuthFilter())
      .addProvider(new AuthValueFactoryProvider.Binder<>(AuthenticatedUser.class))
      .setTestContainerFactory(new GrizzlyWebTestContainerFactory())
      .addResource(new KeyServerExceptionMapper())
      .addResource(new GroupInvitesController(groupInvitesManager))
      .build();

  @AfterEach
  void teardown() {
    reset(groupInvitesManager);
  }

  @Test
  void createInvite() {
    final GroupInvite invite = invite(InviteType.DIRECT, AuthHelper.VALID_USER_ID_TWO);

    when(groupInvitesManager.createInvite(AuthHelper.VALID_USER_ID, GROUP_ID, InviteType.DIRECT,
        AuthHelper.VALID_USER_ID_TWO, null, 1))
        .thenReturn(invite);

    final InviteResponse response = resources.getJerseyTest()
        .target("/v1/invites/groups/" + GROUP_ID)
        .request()
        .header("Authorization", AuthHelper.getAuthHeader(AuthHelper.VALID_USER_ID))
        .post(Entity.json(Map.of("type", "direct", "targetUserId", AuthHelper.VALID_USER_ID_TWO, "maxUses", 1)),
            InviteResponse.class);

    assertThat(response).isEqualTo(InviteResponse.fromInvite(invite));
    assertThat(response.type()).isEqualTo("direct");
  }

  @Test
  void createInviteRequiresType() {
    try (final Response response = resources.getJerseyTest()
        .target("/v1/invites/groups/" + GROUP_ID)
        .request()
        .header("Authorization", AuthHelper.getAuthHeader(AuthHelper.VALID_USER_ID))
        .post(Entity.json(new CreateInviteRequest(null, null, null, null)))) {

      assertThat(response.getStatus()).isEqualTo(422);
    }
  }

  @Test
  void listAndRevokeInvites() {
    final GroupInvite invite = invite(InviteType.LINK, null);

    when(groupInvitesManager.listInvites(AuthHelper.VALID_USER_ID, GROUP_ID)).thenReturn(List.of(invite));

    final InviteListResponse list = resources.getJerseyTest()
        .target("/v1/invites/groups/" + GROUP_ID)
        .request()
        .header("Authorization", AuthHelper.getAuthHeader(AuthHelper.VALID_USER_ID))
        .get(InviteListResponse.class);

    assertThat(list.invites()).containsExactly(InviteResponse.fromInvite(invite));

    try (final Response response = resources.getJerseyTest()
        .target("/v1/invites/groups/" + GROUP_ID + "/" + invite.id())
        .request()
        .header("Authorization", AuthHelper.getAuthHeader(AuthHelper.VALID_USER_ID))
        .delete()) {

      assertThat(response.getStatus()).isEqualTo(204);
    }

    verify(groupInvitesManager).revokeInvite(AuthHelper.VALID_USER_ID, GROUP_ID, invite.id());
  }

  @Test
  void join() {
    when(groupInvitesManager.joinByCode(AuthHelper.VALID_USER_ID_TWO, "AbCd2345"))
        .thenReturn(new GroupInvitesManager.JoinResult(GROUP_ID, 3, true));

    final JoinGroupResponse response = resources.getJerseyTest()
        .target("/v1/invites/join")
        .request()
        .header("Authorization", AuthHelper.getAuthHeader(AuthHelper.VALID_USER_ID_TWO))
        .post(Entity.json(new JoinGroupRequest("AbCd2345")), JoinGroupResponse.class);

    assertThat(response).isEqualTo(new JoinGroupResponse(GROUP_ID, 3, true));
  }

  @Test
  void joinExpired() {
    when(groupInvitesManager.joinByCode(AuthHelper.VALID_USER_ID_TWO, "AbCd2345"))
        .thenThrow(new KeyServerException(ErrorCode.INVITE_EXPIRED, "Invite has expired"));

    try (final Response response = resources.getJerseyTest()
        .target("/v1/invites/join")
        .request()
        .header("Authorization", AuthHelper.getAuthHeader(AuthHelper.VALID_USER_ID_TWO))
        .post(Entity.json(new JoinGroupRequest("AbCd2345")))) {

      assertThat(response.getStatus()).isEqualTo(410);
      assertThat(response.getHeaderString(KeyServerExceptionMapper.ERROR_CODE_HEADER)).isEqualTo("INVITE_EXPIRED");
    }
  }

  private static GroupInvite invite(final InviteType type, final Long targetUserId) {
    return new GroupInvite(UUID.randomUUID(), GROUP_ID, AuthHelper.VALID_USER_ID, type, "AbCd2345",
        NOW.plusSeconds(3600), 1, 0, targetUserId, NOW);
  }
}
