package com.cario.qr.app.service;

import com.cario.qr.app.model.HealthReport;
import com.cario.qr.app.storage.AzureBlobStorageProvider;
import com.cario.qr.app.storage.S3StorageProvider;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Health, readiness and liveness.
 *
 * <p>Overall status: {@code unhealthy} when the generator probe fails, {@code degraded} when the
 * generator works but a storage provider is unavailable, {@code healthy} otherwise. Readiness only
 * depends on the generator. A periodic refresh keeps {@link #lastReport()} current; until the
 * first check it reports {@code initializing}.
 */
@Log4j2
public class HealthService {

  static final String QR_GENERATOR = "qr_generator";
  static final String API = "api";
  static final String AWS_S3 = "aws_s3";
  static final String AZURE_BLOB = "azure_blob";

  private final QrGenerationService generationService;
  private final StorageReplicator replicator;
  private final String version;
  private final Clock clock;
  private final Instant startedAt;

  private volatile HealthReport lastReport;
  private volatile boolean lastCheckCrashed;

  public HealthService(
      QrGenerationService generationService,
      StorageReplicator replicator,
      String version,
      Clock clock) {
    this.generationService =
        Objects.requireNonNull(generationService, "generationService must not be null");
    this.replicator = Objects.requireNonNull(replicator, "replicator must not be null");
    this.version = version;
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.startedAt = clock.instant();
    this.lastReport =
        HealthReport.builder()
            .status(HealthReport.INITIALIZING)
            .timestamp(startedAt.toString())
            .version(version)
            .build();
  }

  /** Runs every check now and remembers the result. */
  public HealthReport checkHealth() {
    long t0 = System.nanoTime();
    boolean generatorOk = generationService.probe();
    Map<String, Boolean> storage = replicator.providerStates();

    Map<String, String> services = new LinkedHashMap<>();
    services.put(QR_GENERATOR, generatorOk ? HealthReport.HEALTHY : HealthReport.UNHEALTHY);
    services.put(API, HealthReport.HEALTHY);
    services.put(AWS_S3, availability(storage.get(S3StorageProvider.NAME)));
    services.put(AZURE_BLOB, availability(storage.get(AzureBlobStorageProvider.NAME)));

    String status;
    if (!generatorOk) {
      status = HealthReport.UNHEALTHY;
    } else if (services.containsValue(HealthReport.UNAVAILABLE)) {
      status = HealthReport.DEGRADED;
    } else {
      status = HealthReport.HEALTHY;
    }

    Instant now = clock.instant();
    HealthReport report =
        HealthReport.builder()
            .status(status)
            .timestamp(now.toString())
            .version(version)
            .uptimeSeconds(Duration.between(startedAt, now).toMillis() / 1000.0)
            .checkDurationMs((System.nanoTime() - t0) / 1_000_000.0)
            .services(Map.copyOf(services))
            .build();
    lastReport = report;
    return report;
  }

  /** Ready when the generator can produce a QR code. */
  public boolean isReady() {
    boolean ready = generationService.probe();
    log.debug("health.ready ready={}", ready);
    return ready;
  }

  /** Alive unless the most recent periodic check itself crashed. */
  public boolean isAlive() {
    return !lastCheckCrashed;
  }

  public HealthReport lastReport() {
    return lastReport;
  }

  public double uptimeSeconds() {
    return Duration.between(startedAt, clock.instant()).toMillis() / 1000.0;
  }

  @Scheduled(
      fixedDelayString = "${qr.health.interval:PT60S}",
      initialDelayString = "${qr.health.initial-delay:PT5S}")
  public void refresh() {
    try {
      HealthReport report = checkHealth();
      lastCheckCrashed = false;
      if (HealthReport.HEALTHY.equals(report.getStatus())) {
        log.debug("health.refresh status={}", report.getStatus());
      } else {
        log.warn("health.refresh status={} services={}", report.getStatus(), report.getServices());
      }
    } catch (RuntimeException e) {
      lastCheckCrashed = true;
      log.error("health.refresh crashed msg={}", e.getMessage(), e);
    }
  }

  private static String availability(Boolean enabled) {
    return Boolean.TRUE.equals(enabled) ? HealthReport.HEALTHY : HealthReport.UNAVAILABLE;
  }
}
