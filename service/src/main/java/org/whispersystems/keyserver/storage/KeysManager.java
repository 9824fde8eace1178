/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage;

import static org.whispersystems.keyserver.metrics.MetricsUtil.name;

import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import jakarta.ws.rs.core.Response;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import javax.annotation.Nullable;
import org.jdbi.v3.core.HandleCallback;
import org.jdbi.v3.core.statement.UnableToExecuteStatementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whispersystems.keyserver.configuration.KeysConfiguration;
import org.whispersystems.keyserver.controllers.ErrorCode;
import org.whispersystems.keyserver.controllers.KeyServerException;
import org.whispersystems.keyserver.identity.RelationshipDirectory;
import org.whispersystems.keyserver.util.Constants;

/**
 * Publishes, serves and hands out device key material: key bundles and the one-time prekey pools behind them.
 */
public class KeysManager {

  private static final Logger logger = LoggerFactory.getLogger(KeysManager.class);
  private static final Logger auditLogger = LoggerFactory.getLogger(Constants.AUDIT_LOGGER_NAME);

  private static final Timer UPLOAD_TIMER = Metrics.timer(name(KeysManager.class, "upload"));
  private static final Timer CLAIM_TIMER = Metrics.timer(name(KeysManager.class, "claim"));
  private static final String IDENTITY_CHANGE_COUNTER_NAME = name(KeysManager.class, "identityChange");
  private static final String CLAIM_COUNTER_NAME = name(KeysManager.class, "claim");
  private static final String OUTCOME_TAG_NAME = "outcome";

  static final String IDENTITY_CHANGE_BLOCK_REASON = "identity_change_block";

  private final FaultTolerantDatabase database;
  private final Devices devices;
  private final KeyBundles keyBundles;
  private final OneTimePreKeys oneTimePreKeys;
  private final RelationshipDirectory relationshipDirectory;
  private final KeyAccessPolicy keyAccessPolicy;
  private final KeysConfiguration configuration;
  private final Clock clock;

  public record UploadResult(UUID deviceId, long bundleVersion, int prekeysStored) {
  }

  /**
   * @param nextPreKey the lowest-numbered unclaimed prekey, reported but not claimed
   */
  public record DevicePreKeys(Device device, KeyBundle bundle, int prekeysAvailable,
                              Optional<OneTimePreKey> nextPreKey) {
  }

  public record ClaimedPreKey(UUID deviceId, long prekeyId, String publicKey, int prekeysRemaining) {
  }

  public record PreKeyStatus(UUID deviceId, int available, int poolSize, PreKeyWatermark watermark,
                             Optional<Duration> signedPreKeyAge, boolean rotationDue) {
  }

  private record UploadOutcome(UploadResult result, int recentIdentityChanges, boolean blocked) {
  }

  public KeysManager(final FaultTolerantDatabase database,
      final Devices devices,
      final KeyBundles keyBundles,
      final OneTimePreKeys oneTimePreKeys,
      final RelationshipDirectory relationshipDirectory,
      final KeyAccessPolicy keyAccessPolicy,
      final KeysConfiguration configuration,
      final Clock clock) {

    this.database = database;
    this.devices = devices;
    this.keyBundles = keyBundles;
    this.oneTimePreKeys = oneTimePreKeys;
    this.relationshipDirectory = relationshipDirectory;
    this.keyAccessPolicy = keyAccessPolicy;
    this.configuration = configuration;
    this.clock = clock;
  }

  /**
   * Creates or replaces a device's key bundle and its pool of unclaimed one-time prekeys. A missing device id creates
   * a new device for the caller.
   * <p>
   * If the identity key differs from the one on record, the change is appended to the device's audit trail. Once the
   * number of changes inside the configured window reaches the block threshold, the device is revoked instead and the
   * upload fails with {@code IDENTITY_CHANGE_BLOCKED}; the revocation is committed, the new bundle is not.
   */
  public UploadResult uploadKeyBundle(final long callerId,
      @Nullable final UUID deviceId,
      final String name,
      final String identityKey,
      final String signedPreKey,
      final String signedPreKeySignature,
      final List<String> preKeys) {

    requireEnabled();

    if (preKeys.isEmpty() || preKeys.size() > configuration.getPrekeyPoolSize()) {
      throw new KeyServerException(ErrorCode.INVALID_REQUEST,
          "Between 1 and " + configuration.getPrekeyPoolSize() + " prekeys are required");
    }

    requireBase64(identityKey, "identityKey");
    requireBase64(signedPreKey, "signedPreKey");
    requireBase64(signedPreKeySignature, "signedPreKeySignature");
    preKeys.forEach(preKey -> requireBase64(preKey, "preKeys"));

    final UUID targetDeviceId = deviceId != null ? deviceId : UUID.randomUUID();

    final HandleCallback<UploadOutcome, RuntimeException> upload = handle -> {
      final Instant now = clock.instant();

      final Device device = devices.getForUpdate(handle, targetDeviceId).orElseGet(() -> {
        final Device created = new Device(targetDeviceId, callerId, name, DeviceStatus.ACTIVE, now, now);
        devices.create(handle, created);
        return created;
      });

      if (!device.isOwnedBy(callerId)) {
        throw new KeyServerException(ErrorCode.FORBIDDEN, "Device is not owned by caller");
      }

      if (!device.isActive()) {
        throw DevicesManager.revokedDeviceUse(device, Response.Status.FORBIDDEN);
      }

      devices.updateNameAndLastSeen(handle, device.id(), name, now);

      final Optional<KeyBundle> existingBundle = keyBundles.get(handle, device.id());
      int recentIdentityChanges = 0;

      if (existingBundle.isPresent() && !existingBundle.get().identityKey().equals(identityKey)) {
        devices.appendIdentityChangeEvent(handle, device, IdentityChangeReason.IDENTITY_CHANGE, now);
        recentIdentityChanges = devices.countIdentityChangesSince(handle, device.id(),
            now.minus(configuration.getIdentityChangeWindow()));

        if (recentIdentityChanges >= configuration.getIdentityChangeBlockThreshold()) {
          devices.revoke(handle, device, IDENTITY_CHANGE_BLOCK_REASON, now);
          devices.appendIdentityChangeEvent(handle, device, IdentityChangeReason.IDENTITY_CHANGE_BLOCK, now);

          return new UploadOutcome(new UploadResult(device.id(), existingBundle.get().bundleVersion(), 0),
              recentIdentityChanges, true);
        }
      }

      final KeyBundle bundle = new KeyBundle(device.id(), identityKey, signedPreKey, signedPreKeySignature,
          existingBundle.map(b -> b.bundleVersion() + 1).orElse(1L), preKeys.size(), now);

      if (existingBundle.isPresent()) {
        keyBundles.update(handle, bundle);
      } else {
        keyBundles.insert(handle, bundle);
      }

      oneTimePreKeys.replaceUnclaimed(handle, device.id(), preKeys, now);

      return new UploadOutcome(new UploadResult(device.id(), bundle.bundleVersion(), preKeys.size()),
          recentIdentityChanges, false);
    };

    final UploadOutcome outcome = UPLOAD_TIMER.record(() -> {
      try {
        return database.inTransaction(upload);
      } catch (final UnableToExecuteStatementException e) {
        if (deviceId == null || !UniqueConstraintViolations.isUniqueViolation(e)) {
          throw e;
        }

        // a concurrent first upload for the same device id created it first; the retry finds and locks that row
        logger.debug("Device {} was created concurrently; retrying upload", deviceId);
        return database.inTransaction(upload);
      }
    });

    if (outcome.blocked()) {
      auditLogger.warn("Revoked device {} of user {} after {} identity key changes", outcome.result().deviceId(),
          callerId, outcome.recentIdentityChanges());
      Metrics.counter(IDENTITY_CHANGE_COUNTER_NAME, OUTCOME_TAG_NAME, "blocked").increment();

      throw new KeyServerException(ErrorCode.IDENTITY_CHANGE_BLOCKED,
          "Too many identity key changes; device has been revoked");
    }

    if (outcome.recentIdentityChanges() > 0) {
      final boolean alert = outcome.recentIdentityChanges() >= configuration.getIdentityChangeAlertThreshold();

      if (alert) {
        auditLogger.warn("Device {} of user {} changed identity key {} times within {}", outcome.result().deviceId(),
            callerId, outcome.recentIdentityChanges(), configuration.getIdentityChangeWindow());
      } else {
        auditLogger.info("Device {} of user {} changed identity key", outcome.result().deviceId(), callerId);
      }

      Metrics.counter(IDENTITY_CHANGE_COUNTER_NAME, OUTCOME_TAG_NAME, alert ? "alert" : "changed").increment();
    }

    return outcome.result();
  }

  /**
   * Returns the key bundles of the target's active devices.
   *
   * @param knownBundleVersion the newest bundle version the caller has seen; if any device has a newer one the call
   *                           fails with {@code BUNDLE_STALE} and the authoritative version
   */
  public List<DevicePreKeys> getKeyBundles(final long callerId, final long targetUserId,
      @Nullable final Long knownBundleVersion) {

    requireEnabled();

    if (callerId != targetUserId && !relationshipDirectory.exists(targetUserId)) {
      throw new KeyServerException(ErrorCode.NOT_FOUND, "User not found");
    }

    keyAccessPolicy.checkAccess(callerId, targetUserId);

    final List<DeviceKeyBundle> bundles = keyBundles.getActiveBundles(targetUserId);

    if (knownBundleVersion != null) {
      final long newestVersion = bundles.stream()
          .mapToLong(deviceKeyBundle -> deviceKeyBundle.bundle().bundleVersion())
          .max()
          .orElse(0);

      if (newestVersion > knownBundleVersion) {
        throw KeyServerException.bundleStale(newestVersion);
      }
    }

    return bundles.stream()
        .map(deviceKeyBundle -> new DevicePreKeys(deviceKeyBundle.device(), deviceKeyBundle.bundle(),
            oneTimePreKeys.countUnclaimed(deviceKeyBundle.device().id()),
            oneTimePreKeys.peekUnclaimed(deviceKeyBundle.device().id())))
        .toList();
  }

  /**
   * Claims one specific unclaimed prekey of a device. Concurrent claims of the same prekey have exactly one winner;
   * the device's remaining count is recomputed from the pool after every successful claim.
   */
  public ClaimedPreKey claimPreKey(final long callerId, final UUID deviceId, final long preKeyId) {
    requireEnabled();

    final Device device = devices.get(deviceId)
        .orElseThrow(() -> new KeyServerException(ErrorCode.NOT_FOUND, "Device not found"));

    if (!device.isActive()) {
      throw DevicesManager.revokedDeviceUse(device, Response.Status.CONFLICT);
    }

    keyAccessPolicy.checkAccess(callerId, device.ownerUserId());

    try {
      final ClaimedPreKey claimed = CLAIM_TIMER.record(() -> database.inTransaction(handle -> {
        final Optional<KeyBundle> bundle = keyBundles.getForUpdate(handle, deviceId);
        final boolean won = oneTimePreKeys.claim(handle, deviceId, preKeyId, callerId, clock.instant());
        final int remaining = oneTimePreKeys.countUnclaimed(handle, deviceId);

        if (!won) {
          if (remaining == 0) {
            throw KeyServerException.prekeysExhausted(bundle.map(KeyBundle::bundleVersion).orElse(0L));
          }

          throw new KeyServerException(ErrorCode.PREKEY_NOT_FOUND, "Prekey not found or already claimed");
        }

        if (bundle.isPresent()) {
          keyBundles.setPrekeysRemaining(handle, deviceId, remaining);
        }

        final OneTimePreKey preKey = oneTimePreKeys.get(handle, preKeyId).orElseThrow();

        return new ClaimedPreKey(deviceId, preKey.id(), preKey.publicKey(), remaining);
      }));

      Metrics.counter(CLAIM_COUNTER_NAME, OUTCOME_TAG_NAME, "claimed").increment();

      return claimed;
    } catch (final KeyServerException e) {
      Metrics.counter(CLAIM_COUNTER_NAME, OUTCOME_TAG_NAME, e.getCode().name().toLowerCase()).increment();
      throw e;
    }
  }

  public PreKeyStatus getPreKeyStatus(final long callerId, final UUID deviceId) {
    final Device device = devices.get(deviceId)
        .filter(d -> d.isOwnedBy(callerId))
        .orElseThrow(() -> new KeyServerException(ErrorCode.NOT_FOUND, "Device not found"));

    final int available = oneTimePreKeys.countUnclaimed(device.id());
    final Optional<Duration> signedPreKeyAge = keyBundles.get(device.id())
        .map(bundle -> Duration.between(bundle.updatedAt(), clock.instant()));

    return new PreKeyStatus(device.id(),
        available,
        configuration.getPrekeyPoolSize(),
        PreKeyWatermark.of(available, configuration.getLowWatermark(), configuration.getCriticalWatermark()),
        signedPreKeyAge,
        signedPreKeyAge.map(age -> age.compareTo(configuration.getSignedPreKeyRotation()) >= 0).orElse(false));
  }

  private void requireEnabled() {
    if (!configuration.isEnabled()) {
      throw new KeyServerException(ErrorCode.DISABLED, "End-to-end encryption keys are disabled");
    }
  }

  private static void requireBase64(final String value, final String field) {
    try {
      Base64.getDecoder().decode(value);
    } catch (final IllegalArgumentException e) {
      throw new KeyServerException(ErrorCode.INVALID_REQUEST, field + " is not valid base64");
    }
  }
}
