/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keyserver.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.whispersystems.keyserver.storage.KeysManagerTest.assertError;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.whispersystems.keyserver.configuration.GroupsConfiguration;
import org.whispersystems.keyserver.controllers.ErrorCode;
import org.whispersystems.keyserver.controllers.KeyServerException;
import org.whispersystems.keyserver.push.EventPublisher;
import org.whispersystems.keyserver.push.LiveEvents;
import org.whispersystems.keyserver.util.TestClock;

class GroupsManagerTest {

  @RegisterExtension
  final H2DatabaseExtension DATABASE = new H2DatabaseExtension();

  private static final long OWNER = 1;
  private static final long ADMIN = 2;
  private static final long MEMBER = 3;
  private static final long OUTSIDER = 4;

  private final TestClock clock = TestClock.pinned(Instant.parse("2024-03-01T12:00:00Z"));

  private GroupsConfiguration configuration;
  private Groups groups;
  private Devices devices;
  private EventPublisher eventPublisher;
  private GroupsManager groupsManager;

  @BeforeEach
  void setUp() {
    DATABASE.createUser(OWNER);
    DATABASE.createUser(ADMIN);
    DATABASE.createUser(MEMBER);
    DATABASE.createUser(OUTSIDER);

    configuration = new GroupsConfiguration();

    final FaultTolerantDatabase database = DATABASE.getDatabase();

    groups = new Groups(database);
    devices = new Devices(database);
    eventPublisher = mock(EventPublisher.class);
    when(eventPublisher.publish(anyString(), any())).thenReturn(CompletableFuture.completedFuture(null));

    groupsManager = new GroupsManager(database, groups, new SenderKeys(database),
        new DevicesManager(database, devices, clock), new HostRelationshipDirectory(database), eventPublisher,
        configuration, clock);
  }

  @Test
  void createGroup() {
    final Group group = groupsManager.createGroup(OWNER, "Climbing", "Weekend trips");

    assertThat(group.epoch()).isZero();
    assertThat(group.maxParticipants()).isEqualTo(configuration.getMaxParticipants());
    assertThat(groupsManager.listMembers(OWNER, group.id()))
        .singleElement()
        .satisfies(participant -> {
          assertThat(participant.userId()).isEqualTo(OWNER);
          assertThat(participant.role()).isEqualTo(GroupRole.OWNER);
        });
    assertThat(groupsManager.listGroups(OWNER, 10, 0)).extracting(Group::id).containsExactly(group.id());
  }

  @Test
  void epochAdvancesOncePerMembershipChange() {
    final UUID groupId = groupsManager.createGroup(OWNER, "Climbing", null).id();

    final GroupsManager.AddMembersResult added = groupsManager.addMembers(OWNER, groupId, List.of(ADMIN, MEMBER));
    assertThat(added.addedUserIds()).containsExactly(ADMIN, MEMBER);
    assertThat(added.epoch()).isEqualTo(1);

    final GroupsManager.AddMembersResult repeated = groupsManager.addMembers(OWNER, groupId, List.of(ADMIN, 404L));
    assertThat(repeated.addedUserIds()).isEmpty();
    assertThat(repeated.epoch()).isEqualTo(1);

    groupsManager.promoteMember(OWNER, groupId, ADMIN);
    groupsManager.muteGroup(MEMBER, groupId, clock.instant().plusSeconds(3600));
    assertThat(epoch(groupId)).isEqualTo(1);

    assertThat(groupsManager.removeMember(ADMIN, groupId, MEMBER)).isEqualTo(2);
    assertThat(groupsManager.addMembers(ADMIN, groupId, List.of(MEMBER)).epoch()).isEqualTo(3);
    assertThat(groupsManager.banUser(ADMIN, groupId, MEMBER, "spam")).isEqualTo(4);

    assertThat(groupsManager.unbanUser(OWNER, groupId, MEMBER)).isTrue();
    assertThat(epoch(groupId)).isEqualTo(4);

    assertThat(groupsManager.leaveGroup(ADMIN, groupId)).isEqualTo(5);

    assertThat(groupsManager.listMembers(OWNER, groupId))
        .extracting(GroupParticipant::userId)
        .containsExactly(OWNER);

    verify(eventPublisher).publish(LiveEvents.groupChannel(groupId),
        new LiveEvents.EpochChanged(groupId, 1, GroupsManager.REASON_MEMBERS_ADDED));
    verify(eventPublisher).publish(LiveEvents.groupChannel(groupId),
        new LiveEvents.EpochChanged(groupId, 2, GroupsManager.REASON_MEMBER_REMOVED));
    verify(eventPublisher).publish(LiveEvents.groupChannel(groupId),
        new LiveEvents.EpochChanged(groupId, 4, GroupsManager.REASON_MEMBER_BANNED));
    verify(eventPublisher).publish(LiveEvents.groupChannel(groupId),
        new LiveEvents.EpochChanged(groupId, 5, GroupsManager.REASON_MEMBER_LEFT));
  }

  @Test
  void bannedUsersAreSkippedUntilUnbanned() {
    final UUID groupId = groupsManager.createGroup(OWNER, "Climbing", null).id();

    groupsManager.banUser(OWNER, groupId, OUTSIDER, null);

    assertThat(groupsManager.addMembers(OWNER, groupId, List.of(OUTSIDER)).addedUserIds()).isEmpty();
    assertError(() -> groupsManager.getGroup(OUTSIDER, groupId), ErrorCode.NOT_MEMBER);

    groupsManager.unbanUser(OWNER, groupId, OUTSIDER);
    assertError(() -> groupsManager.getGroup(OUTSIDER, groupId), ErrorCode.NOT_MEMBER);

    assertThat(groupsManager.addMembers(OWNER, groupId, List.of(OUTSIDER)).addedUserIds()).containsExactly(OUTSIDER);
    assertThat(groupsManager.getGroup(OUTSIDER, groupId).id()).isEqualTo(groupId);
  }

  @Test
  void addMembersRespectsCapacity() {
    configuration.setMaxParticipants(3);

    final UUID groupId = groupsManager.createGroup(OWNER, "Climbing", null).id();
    groupsManager.addMembers(OWNER, groupId, List.of(ADMIN));

    assertError(() -> groupsManager.addMembers(OWNER, groupId, List.of(MEMBER, OUTSIDER)), ErrorCode.GROUP_FULL);

    assertThat(epoch(groupId)).isEqualTo(1);
    assertThat(groupsManager.listMembers(OWNER, groupId)).hasSize(2);

    assertThat(groupsManager.addMembers(OWNER, groupId, List.of(MEMBER)).epoch()).isEqualTo(2);
  }

  @Test
  void roleChecks() {
    final UUID groupId = groupsManager.createGroup(OWNER, "Climbing", null).id();
    groupsManager.addMembers(OWNER, groupId, List.of(ADMIN, MEMBER));
    groupsManager.promoteMember(OWNER, groupId, ADMIN);

    assertError(() -> groupsManager.addMembers(MEMBER, groupId, List.of(OUTSIDER)), ErrorCode.FORBIDDEN);
    assertError(() -> groupsManager.addMembers(OUTSIDER, groupId, List.of(OUTSIDER)), ErrorCode.NOT_MEMBER);
    assertError(() -> groupsManager.removeMember(ADMIN, groupId, OWNER), ErrorCode.FORBIDDEN);
    assertError(() -> groupsManager.banUser(ADMIN, groupId, OWNER, null), ErrorCode.FORBIDDEN);
    assertError(() -> groupsManager.removeMember(ADMIN, groupId, OUTSIDER), ErrorCode.NOT_FOUND);
    assertError(() -> groupsManager.leaveGroup(OWNER, groupId), ErrorCode.FORBIDDEN);
    assertError(() -> groupsManager.demoteAdmin(ADMIN, groupId, ADMIN), ErrorCode.FORBIDDEN);
    assertError(() -> groupsManager.closeGroup(ADMIN, groupId), ErrorCode.FORBIDDEN);
    assertError(() -> groupsManager.getGroup(OWNER, UUID.randomUUID()), ErrorCode.NOT_FOUND);

    assertThat(epoch(groupId)).isEqualTo(1);
    verify(eventPublisher, never()).publish(LiveEvents.groupChannel(groupId),
        new LiveEvents.EpochChanged(groupId, 2, GroupsManager.REASON_MEMBER_REMOVED));
  }

  @Test
  void transferOwnershipAndClose() {
    final UUID groupId = groupsManager.createGroup(OWNER, "Climbing", null).id();
    groupsManager.addMembers(OWNER, groupId, List.of(ADMIN));

    groupsManager.transferOwnership(OWNER, groupId, ADMIN);

    assertThat(groups.getParticipant(groupId, ADMIN)).hasValueSatisfying(
        participant -> assertThat(participant.role()).isEqualTo(GroupRole.OWNER));
    assertThat(groups.getParticipant(groupId, OWNER)).hasValueSatisfying(
        participant -> assertThat(participant.role()).isEqualTo(GroupRole.ADMIN));

    assertError(() -> groupsManager.closeGroup(OWNER, groupId), ErrorCode.FORBIDDEN);

    assertThat(groupsManager.closeGroup(ADMIN, groupId).closed()).isTrue();
    assertThat(groupsManager.closeGroup(ADMIN, groupId).closed()).isTrue();

    assertError(() -> groupsManager.addMembers(ADMIN, groupId, List.of(MEMBER)), ErrorCode.GROUP_CLOSED);
    assertError(() -> groupsManager.updateGroup(ADMIN, groupId, "Renamed", null), ErrorCode.GROUP_CLOSED);
  }

  @Test
  void updateGroup() {
    final UUID groupId = groupsManager.createGroup(OWNER, "Climbing", null).id();
    groupsManager.addMembers(OWNER, groupId, List.of(MEMBER));

    clock.pin(clock.instant().plusSeconds(60));

    final Group updated = groupsManager.updateGroup(OWNER, groupId, "Bouldering", "Indoors");

    assertThat(updated.title()).isEqualTo("Bouldering");
    assertThat(updated.about()).isEqualTo("Indoors");
    assertThat(updated.updatedAt()).isEqualTo(clock.instant());
    assertThat(updated.epoch()).isEqualTo(1);

    assertError(() -> groupsManager.updateGroup(MEMBER, groupId, "Mine", null), ErrorCode.FORBIDDEN);
  }

  @Test
  void senderKeysFollowCurrentEpoch() {
    final UUID groupId = groupsManager.createGroup(OWNER, "Climbing", null).id();
    final UUID deviceId = createDevice(OWNER);

    groupsManager.recordSenderKey(OWNER, groupId, deviceId, "sender-key-0", 0, 0);
    groupsManager.recordSenderKey(OWNER, groupId, deviceId, "sender-key-0", 7, 0);

    assertThat(groupsManager.listSenderKeys(OWNER, groupId))
        .singleElement()
        .satisfies(record -> assertThat(record.chainIndex()).isEqualTo(7));

    groupsManager.addMembers(OWNER, groupId, List.of(MEMBER));

    assertThat(groupsManager.listSenderKeys(OWNER, groupId)).isEmpty();

    assertThatThrownBy(() -> groupsManager.recordSenderKey(OWNER, groupId, deviceId, "sender-key-0", 8, 0))
        .isInstanceOfSatisfying(KeyServerException.class, e -> {
          assertThat(e.getCode()).isEqualTo(ErrorCode.EPOCH_STALE);
          assertThat(e.getContext()).containsEntry(KeyServerException.CURRENT_EPOCH_HEADER, "1");
        });

    assertError(() -> groupsManager.recordSenderKey(MEMBER, groupId, deviceId, "sender-key-1", 0, 1),
        ErrorCode.FORBIDDEN);
  }

  @Test
  void publishFailureDoesNotFailMembershipChange() {
    when(eventPublisher.publish(anyString(), any())).thenThrow(new IllegalStateException("unavailable"));

    final UUID groupId = groupsManager.createGroup(OWNER, "Climbing", null).id();

    assertThat(groupsManager.addMembers(OWNER, groupId, List.of(MEMBER)).epoch()).isEqualTo(1);
    assertThat(epoch(groupId)).isEqualTo(1);
  }

  @Test
  void disabled() {
    configuration.setEnabled(false);

    assertError(() -> groupsManager.createGroup(OWNER, "Climbing", null), ErrorCode.DISABLED);
  }

  private long epoch(final UUID groupId) {
    return groups.get(groupId).orElseThrow().epoch();
  }

  private UUID createDevice(final long userId) {
    final UUID deviceId = UUID.randomUUID();

    DATABASE.getDatabase().useTransaction(handle ->
        devices.create(handle, new Device(deviceId, userId, "phone", DeviceStatus.ACTIVE, clock.instant(), null)));

    return deviceId;
  }
}
