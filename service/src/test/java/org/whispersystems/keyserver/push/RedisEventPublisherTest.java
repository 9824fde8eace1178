/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keyserver.push;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import io.lettuce.core.RedisException;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.async.RedisAsyncCommands;
import io.lettuce.core.api.sync.RedisCommands;
import io.lettuce.core.codec.StringCodec;
import io.lettuce.core.output.IntegerOutput;
import io.lettuce.core.protocol.AsyncCommand;
import io.lettuce.core.protocol.Command;
import io.lettuce.core.protocol.CommandType;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.whispersystems.keyserver.redis.FaultTolerantRedisClient;
import org.whispersystems.keyserver.util.SystemMapper;

class RedisEventPublisherTest {

  private RedisCommands<String, String> commands;
  private RedisAsyncCommands<String, String> asyncCommands;
  private FaultTolerantRedisClient redisClient;
  private RedisEventPublisher eventPublisher;

  @BeforeEach
  @SuppressWarnings("unchecked")
  void setUp() {
    commands = mock(RedisCommands.class);
    asyncCommands = mock(RedisAsyncCommands.class);

    final StatefulRedisConnection<String, String> connection = mock(StatefulRedisConnection.class);
    when(connection.sync()).thenReturn(commands);
    when(connection.async()).thenReturn(asyncCommands);

    redisClient = mock(FaultTolerantRedisClient.class);
    when(redisClient.withConnection(any())).thenAnswer(invocation ->
        invocation.<Function<StatefulRedisConnection<String, String>, ?>>getArgument(0).apply(connection));

    eventPublisher = new RedisEventPublisher(redisClient);
  }

  @Test
  void publish() throws Exception {
    when(asyncCommands.publish(anyString(), anyString())).thenReturn(publishResult(2L, null));

    final UUID groupId = UUID.randomUUID();

    eventPublisher.publish(LiveEvents.groupChannel(groupId), new LiveEvents.EpochChanged(groupId, 3, "member_left"))
        .toCompletableFuture()
        .join();

    final ArgumentCaptor<String> payloadCaptor = ArgumentCaptor.forClass(String.class);
    verify(asyncCommands).publish(eq("grp:" + groupId), payloadCaptor.capture());

    final JsonNode payload = SystemMapper.jsonMapper().readTree(payloadCaptor.getValue());

    assertThat(payload.get("type").asText()).isEqualTo("epoch_changed");
    assertThat(payload.get("groupId").asText()).isEqualTo(groupId.toString());
    assertThat(payload.get("newEpoch").asLong()).isEqualTo(3);
    assertThat(payload.get("reason").asText()).isEqualTo("member_left");
  }

  @Test
  void publishFailureCompletesExceptionally() {
    when(asyncCommands.publish(anyString(), anyString()))
        .thenReturn(publishResult(null, new RedisException("connection reset")));

    final CompletableFuture<Void> published =
        eventPublisher.publish(LiveEvents.userChannel(1111), Map.of("type", "test")).toCompletableFuture();

    assertThat(published).isCompletedExceptionally();
  }

  @Test
  void publishWhenUnavailable() {
    when(redisClient.withConnection(any())).thenThrow(new RedisException("circuit open"));

    assertThat(eventPublisher.publish(LiveEvents.userChannel(1111), Map.of("type", "test")).toCompletableFuture())
        .isCompletedExceptionally();
  }

  @Test
  void connectionStats() {
    when(commands.pubsubChannels(LiveEvents.USER_CHANNEL_PREFIX + "*")).thenReturn(List.of("dm:user:1", "dm:user:2"));
    when(commands.pubsubNumsub("dm:user:1", "dm:user:2")).thenReturn(Map.of("dm:user:1", 1L, "dm:user:2", 3L));

    assertThat(eventPublisher.getConnectionStats()).hasValue(new ConnectionStats(2, 4));
  }

  @Test
  void connectionStatsWithoutSubscribers() {
    when(commands.pubsubChannels(anyString())).thenReturn(List.of());

    assertThat(eventPublisher.getConnectionStats()).hasValue(new ConnectionStats(0, 0));
  }

  @Test
  void connectionStatsUnavailable() {
    when(redisClient.withConnection(any())).thenThrow(new RedisException("circuit open"));

    assertThat(eventPublisher.getConnectionStats()).isEmpty();
  }

  private static AsyncCommand<String, String, Long> publishResult(final Long receivers, final Throwable failure) {
    final AsyncCommand<String, String, Long> command =
        new AsyncCommand<>(new Command<>(CommandType.PUBLISH, new IntegerOutput<>(StringCodec.UTF8)));

    if (failure != null) {
      command.completeExceptionally(failure);
    } else {
      command.complete(receivers);
    }

    return command;
  }
}
