package com.cario.qr.app.service;

import com.cario.qr.app.model.GeneratedArtifact;
import com.cario.qr.app.model.StorageStatus;
import com.cario.qr.app.model.StorageUploadOutcome;
import com.cario.qr.app.storage.StorageProvider;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.log4j.Log4j2;

/**
 * Copies generated artifacts to the two storage providers.
 *
 * <p>Uploads run sequentially, primary first. Each provider call is isolated: a failure is logged
 * and counted and the next provider is still attempted. Nothing is retried; a provider that failed
 * is simply tried again for the next artifact.
 *
 * <p>{@link #replicateInBackground} hands the work to the replication executor and returns at once,
 * so the HTTP response never waits for storage.
 */
@Log4j2
public class StorageReplicator implements AutoCloseable {

  private final StorageProvider primary;
  private final StorageProvider secondary;
  private final Executor replicationExecutor;
  private final MeterRegistry meterRegistry;

  public StorageReplicator(
      StorageProvider primary,
      StorageProvider secondary,
      Executor replicationExecutor,
      MeterRegistry meterRegistry) {
    this.primary = Objects.requireNonNull(primary, "primary provider must not be null");
    this.secondary = Objects.requireNonNull(secondary, "secondary provider must not be null");
    this.replicationExecutor =
        Objects.requireNonNull(replicationExecutor, "replicationExecutor must not be null");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
  }

  /** Probes both providers. Never throws; unreachable providers end up disabled. */
  public void initialize() {
    log.info("storage.init starting providers={},{}", primary.name(), secondary.name());
    for (StorageProvider provider : providers()) {
      try {
        provider.initialize();
      } catch (RuntimeException e) {
        log.error("storage.init provider={} crashed msg={}", provider.name(), e.getMessage(), e);
      }
    }
    if (!primary.isEnabled() && !secondary.isEnabled()) {
      log.warn("storage.init no cloud storage available; artifacts are served from memory only");
    }
  }

  /**
   * Uploads the artifact to both providers, primary then secondary.
   *
   * @return provider name to signed URL; the URL is {@code null} when the provider is disabled or
   *     the upload failed
   */
  public Map<String, String> replicate(GeneratedArtifact artifact) {
    Map<String, String> urls = new LinkedHashMap<>();
    for (StorageProvider provider : providers()) {
      StorageUploadOutcome outcome = uploadTo(provider, artifact);
      urls.put(provider.name(), outcome.getSignedUrl());
    }
    log.info(
        "storage.replicate done id={} {}={} {}={}",
        artifact.getId(),
        primary.name(),
        urls.get(primary.name()) != null,
        secondary.name(),
        urls.get(secondary.name()) != null);
    return Collections.unmodifiableMap(urls);
  }

  /** Schedules {@link #replicate} on the replication executor. Returns without waiting. */
  public void replicateInBackground(GeneratedArtifact artifact) {
    try {
      replicationExecutor.execute(() -> replicate(artifact));
    } catch (RejectedExecutionException e) {
      log.warn("storage.replicate rejected id={} msg={}", artifact.getId(), e.getMessage());
      counter("storage.replications.rejected", "all", "rejected").increment();
    }
  }

  /**
   * Deletes the artifact's object from both providers.
   *
   * @return provider name to whether the delete call succeeded
   */
  public Map<String, Boolean> delete(GeneratedArtifact artifact) {
    Map<String, Boolean> results = new LinkedHashMap<>();
    for (StorageProvider provider : providers()) {
      boolean deleted;
      try {
        deleted = provider.delete(artifact.getId(), artifact.getFormat());
      } catch (RuntimeException e) {
        log.error(
            "storage.delete provider={} id={} msg={}",
            provider.name(),
            artifact.getId(),
            e.getMessage());
        deleted = false;
      }
      results.put(provider.name(), deleted);
    }
    return Collections.unmodifiableMap(results);
  }

  /** Schedules {@link #delete} on the replication executor. */
  public void deleteInBackground(GeneratedArtifact artifact) {
    try {
      replicationExecutor.execute(() -> delete(artifact));
    } catch (RejectedExecutionException e) {
      log.warn("storage.delete rejected id={} msg={}", artifact.getId(), e.getMessage());
    }
  }

  public StorageStatus status() {
    return new StorageStatus(
        primary.isEnabled(),
        secondary.isEnabled(),
        primary.isEnabled() ? primary.location() : null,
        secondary.isEnabled() ? secondary.location() : null);
  }

  /** Provider name to enablement, in upload order. */
  public Map<String, Boolean> providerStates() {
    Map<String, Boolean> states = new LinkedHashMap<>();
    for (StorageProvider provider : providers()) {
      states.put(provider.name(), provider.isEnabled());
    }
    return states;
  }

  @Override
  public void close() {
    for (StorageProvider provider : providers()) {
      try {
        provider.close();
      } catch (RuntimeException e) {
        log.warn("storage.close provider={} msg={}", provider.name(), e.getMessage());
      }
    }
    log.info("storage.close completed");
  }

  // ------------------ Internals ------------------

  private StorageUploadOutcome uploadTo(StorageProvider provider, GeneratedArtifact artifact) {
    if (!provider.isEnabled()) {
      StorageUploadOutcome skipped =
          StorageUploadOutcome.skipped(provider.name(), artifact.getId());
      recordUploadMetrics(provider, skipped);
      return skipped;
    }
    long t0 = System.nanoTime();
    StorageUploadOutcome outcome;
    try {
      String url = provider.upload(artifact.getId(), artifact.getBytes(), artifact.getFormat());
      // null means the provider disabled itself after the check above
      outcome =
          url == null
              ? StorageUploadOutcome.skipped(provider.name(), artifact.getId())
              : StorageUploadOutcome.succeeded(
                  provider.name(), artifact.getId(), url, elapsedMs(t0));
    } catch (RuntimeException e) {
      outcome =
          StorageUploadOutcome.failed(
              provider.name(), artifact.getId(), e.getMessage(), elapsedMs(t0));
      log.error(
          "storage.upload failed provider={} id={} durationMs={} msg={}",
          provider.name(),
          artifact.getId(),
          outcome.getDurationMs(),
          e.getMessage());
    }
    recordUploadMetrics(provider, outcome);
    return outcome;
  }

  private void recordUploadMetrics(StorageProvider provider, StorageUploadOutcome outcome) {
    String status = outcome.status();
    counter("storage.uploads", provider.name(), status).increment();
    Timer.builder("storage.upload.duration")
        .tag("provider", provider.name())
        .tag("status", status)
        .register(meterRegistry)
        .record(Duration.ofMillis(outcome.getDurationMs()));
  }

  private Counter counter(String name, String provider, String status) {
    return Counter.builder(name)
        .tag("provider", provider)
        .tag("status", status)
        .register(meterRegistry);
  }

  private List<StorageProvider> providers() {
    return List.of(primary, secondary);
  }

  private static long elapsedMs(long t0) {
    return (System.nanoTime() - t0) / 1_000_000;
  }
}
