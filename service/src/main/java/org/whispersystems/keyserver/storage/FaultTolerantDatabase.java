/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage;

import static org.whispersystems.keyserver.metrics.MetricsUtil.name;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Tags;
import java.util.function.Consumer;
import java.util.function.Function;
import org.jdbi.v3.core.HandleCallback;
import org.jdbi.v3.core.HandleConsumer;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.transaction.TransactionIsolationLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whispersystems.keyserver.configuration.CircuitBreakerConfiguration;
import org.whispersystems.keyserver.controllers.KeyServerException;

public class FaultTolerantDatabase {

  private static final Logger logger = LoggerFactory.getLogger(FaultTolerantDatabase.class);

  private static final String CIRCUIT_BREAKER_OPEN_GAUGE_NAME = name(FaultTolerantDatabase.class, "circuitBreakerOpen");

  private final Jdbi           database;
  private final CircuitBreaker circuitBreaker;

  public FaultTolerantDatabase(String name, Jdbi database, CircuitBreakerConfiguration circuitBreakerConfiguration) {
    this.database       = database;
    this.circuitBreaker = CircuitBreaker.of(name,
        circuitBreakerConfiguration.toCircuitBreakerConfig(throwable -> throwable instanceof KeyServerException
            || UniqueConstraintViolations.isUniqueViolation(throwable)));

    this.circuitBreaker.getEventPublisher().onStateTransition(event ->
        logger.warn("Database circuit breaker {} changed state: {}", name, event.getStateTransition()));

    Metrics.gauge(CIRCUIT_BREAKER_OPEN_GAUGE_NAME, Tags.of("name", name), circuitBreaker,
        breaker -> breaker.getState() == CircuitBreaker.State.OPEN ? 1 : 0);
  }

  public void use(Consumer<Jdbi> consumer) {
    this.circuitBreaker.executeRunnable(() -> consumer.accept(database));
  }

  public <T> T with(Function<Jdbi, T> consumer) {
    return this.circuitBreaker.executeSupplier(() -> consumer.apply(database));
  }

  /**
   * Runs the callback in a single read-committed transaction; a failure anywhere in the callback rolls back every
   * write it made.
   */
  @SuppressWarnings("unchecked")
  public <T, X extends Exception> T inTransaction(HandleCallback<T, X> callback) throws X {
    try {
      return this.circuitBreaker.executeCheckedSupplier(
          () -> database.inTransaction(TransactionIsolationLevel.READ_COMMITTED, callback));
    } catch (RuntimeException | Error e) {
      throw e;
    } catch (Throwable t) {
      // the callback's own checked exception is the only other thing that can escape
      throw (X) t;
    }
  }

  public <X extends Exception> void useTransaction(HandleConsumer<X> consumer) throws X {
    inTransaction(handle -> {
      consumer.useHandle(handle);
      return null;
    });
  }

  public Jdbi getDatabase() {
    return database;
  }
}
