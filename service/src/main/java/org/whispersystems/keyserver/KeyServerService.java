/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keyserver;

import io.dropwizard.auth.AuthDynamicFeature;
import io.dropwizard.auth.AuthFilter;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.auth.basic.BasicCredentialAuthFilter;
import io.dropwizard.auth.basic.BasicCredentials;
import io.dropwizard.configuration.EnvironmentVariableSubstitutor;
import io.dropwizard.configuration.SubstitutingSourceProvider;
import io.dropwizard.core.Application;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import io.dropwizard.db.DataSourceFactory;
import io.dropwizard.jdbi3.JdbiFactory;
import io.dropwizard.migrations.MigrationsBundle;
import java.time.Clock;
import java.util.List;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whispersystems.keyserver.auth.AuthenticatedUser;
import org.whispersystems.keyserver.auth.CallerTokenAuthenticator;
import org.whispersystems.keyserver.auth.CallerTokens;
import org.whispersystems.keyserver.controllers.ConversationsController;
import org.whispersystems.keyserver.controllers.DevicesController;
import org.whispersystems.keyserver.controllers.GroupInvitesController;
import org.whispersystems.keyserver.controllers.GroupsController;
import org.whispersystems.keyserver.controllers.KeysController;
import org.whispersystems.keyserver.controllers.MessagesController;
import org.whispersystems.keyserver.controllers.MetricsController;
import org.whispersystems.keyserver.identity.RelationshipDirectory;
import org.whispersystems.keyserver.limits.RateLimiters;
import org.whispersystems.keyserver.mappers.KeyServerExceptionMapper;
import org.whispersystems.keyserver.mappers.RateLimitExceededExceptionMapper;
import org.whispersystems.keyserver.metrics.MetricsAggregator;
import org.whispersystems.keyserver.push.RedisEventPublisher;
import org.whispersystems.keyserver.redis.FaultTolerantRedisClient;
import org.whispersystems.keyserver.storage.Conversations;
import org.whispersystems.keyserver.storage.ConversationsManager;
import org.whispersystems.keyserver.storage.Devices;
import org.whispersystems.keyserver.storage.DevicesManager;
import org.whispersystems.keyserver.storage.FaultTolerantDatabase;
import org.whispersystems.keyserver.storage.GroupInvites;
import org.whispersystems.keyserver.storage.GroupInvitesManager;
import org.whispersystems.keyserver.storage.Groups;
import org.whispersystems.keyserver.storage.GroupsManager;
import org.whispersystems.keyserver.storage.HostRelationshipDirectory;
import org.whispersystems.keyserver.storage.KeyAccessPolicy;
import org.whispersystems.keyserver.storage.KeyBundles;
import org.whispersystems.keyserver.storage.KeysManager;
import org.whispersystems.keyserver.storage.Messages;
import org.whispersystems.keyserver.storage.MessagesManager;
import org.whispersystems.keyserver.storage.OneTimePreKeys;
import org.whispersystems.keyserver.storage.SenderKeys;
import org.whispersystems.keyserver.storage.Statistics;
import org.whispersystems.keyserver.util.InviteCodeGenerator;
import org.whispersystems.keyserver.util.SystemMapper;

public class KeyServerService extends Application<KeyServerConfiguration> {

  private static final Logger log = LoggerFactory.getLogger(KeyServerService.class);

  @Override
  public void initialize(final Bootstrap<KeyServerConfiguration> bootstrap) {
    // Initializing SystemMapper here because parsing of the main application config happens before `run()` method is called.
    SystemMapper.configureMapper(bootstrap.getObjectMapper());

    bootstrap.setConfigurationSourceProvider(
        new SubstitutingSourceProvider(bootstrap.getConfigurationSourceProvider(),
            new EnvironmentVariableSubstitutor(true)));

    bootstrap.addBundle(new MigrationsBundle<>() {
      @Override
      public DataSourceFactory getDataSourceFactory(final KeyServerConfiguration configuration) {
        return configuration.getDataSourceFactory();
      }

      @Override
      public String getMigrationsFileName() {
        return "keyserverdb.xml";
      }
    });
  }

  @Override
  public String getName() {
    return "key-server";
  }

  @Override
  public void run(final KeyServerConfiguration config, final Environment environment) {
    final Clock clock = Clock.systemUTC();

    final Jdbi jdbi = new JdbiFactory().build(environment, config.getDataSourceFactory(), "keyserverdb");
    final FaultTolerantDatabase database =
        new FaultTolerantDatabase("keyserver_database", jdbi, config.getDatabaseCircuitBreakerConfiguration());

    final Devices devices = new Devices(database);
    final KeyBundles keyBundles = new KeyBundles(database);
    final OneTimePreKeys oneTimePreKeys = new OneTimePreKeys(database);
    final Conversations conversations = new Conversations(database);
    final Groups groups = new Groups(database);
    final GroupInvites groupInvites = new GroupInvites(database);
    final SenderKeys senderKeys = new SenderKeys(database);
    final Messages messages = new Messages(database);
    final Statistics statistics = new Statistics(database);

    final RelationshipDirectory relationshipDirectory = new HostRelationshipDirectory(database);
    final KeyAccessPolicy keyAccessPolicy = new KeyAccessPolicy(relationshipDirectory, conversations, groups);

    final FaultTolerantRedisClient redisClient = new FaultTolerantRedisClient("events", config.getRedisConfiguration());
    final RedisEventPublisher eventPublisher = new RedisEventPublisher(redisClient);
    environment.lifecycle().manage(eventPublisher);

    final RateLimiters rateLimiters = RateLimiters.create(config.getRateLimitsConfiguration(), messages, clock);

    final DevicesManager devicesManager = new DevicesManager(database, devices, clock);
    final KeysManager keysManager = new KeysManager(database, devices, keyBundles, oneTimePreKeys,
        relationshipDirectory, keyAccessPolicy, config.getKeysConfiguration(), clock);
    final ConversationsManager conversationsManager =
        new ConversationsManager(database, conversations, devices, relationshipDirectory, clock);
    final GroupsManager groupsManager = new GroupsManager(database, groups, senderKeys, devicesManager,
        relationshipDirectory, eventPublisher, config.getGroupsConfiguration(), clock);
    final GroupInvitesManager groupInvitesManager = new GroupInvitesManager(database, groupInvites, groups,
        groupsManager, relationshipDirectory, config.getGroupsConfiguration(),
        new InviteCodeGenerator(config.getGroupsConfiguration().getInviteCodeLength()), clock);
    final MessagesManager messagesManager = new MessagesManager(database, messages, conversations, groups,
        devicesManager, relationshipDirectory, rateLimiters, eventPublisher, config.getMessagesConfiguration(), clock);
    final MetricsAggregator metricsAggregator = new MetricsAggregator(statistics, eventPublisher,
        config.getKeysConfiguration(), config.getAggregateMetricsConfiguration(), clock);

    final AuthFilter<BasicCredentials, AuthenticatedUser> callerAuthFilter =
        new BasicCredentialAuthFilter.Builder<AuthenticatedUser>()
            .setAuthenticator(new CallerTokenAuthenticator(
                new CallerTokens(config.getCallerAuthConfiguration(), clock), relationshipDirectory))
            .buildAuthFilter();

    environment.jersey().register(new AuthDynamicFeature(callerAuthFilter));
    environment.jersey().register(new AuthValueFactoryProvider.Binder<>(AuthenticatedUser.class));

    List.of(
        new KeysController(keysManager),
        new DevicesController(devicesManager),
        new ConversationsController(conversationsManager),
        new GroupsController(groupsManager),
        new GroupInvitesController(groupInvitesManager),
        new MessagesController(messagesManager),
        new MetricsController(metricsAggregator)
    ).forEach(controller -> environment.jersey().register(controller));

    List.of(
        new KeyServerExceptionMapper(),
        new RateLimitExceededExceptionMapper()
    ).forEach(exceptionMapper -> environment.jersey().register(exceptionMapper));

    log.info("Key server started; keys enabled: {}, groups enabled: {}, messages enabled: {}",
        config.getKeysConfiguration().isEnabled(),
        config.getGroupsConfiguration().isEnabled(),
        config.getMessagesConfiguration().isEnabled());
  }

  public static void main(final String[] args) throws Exception {
    new KeyServerService().run(args);
  }
}
