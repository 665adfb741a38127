package com.cario.qr.app.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.cario.qr.app.model.HealthReport;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HealthServiceTest {

  private QrGenerationService generator;
  private StorageReplicator replicator;
  private HealthService health;

  @BeforeEach
  void setUp() {
    generator = mock(QrGenerationService.class);
    replicator = mock(StorageReplicator.class);
    health =
        new HealthService(
            generator,
            replicator,
            "1.0.0",
            Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC));
  }

  @Test
  void startsInitializing() {
    assertThat(health.lastReport().getStatus()).isEqualTo(HealthReport.INITIALIZING);
    assertThat(health.isAlive()).isTrue();
  }

  @Test
  void allChecksPassingIsHealthy() {
    when(generator.probe()).thenReturn(true);
    when(replicator.providerStates()).thenReturn(Map.of("aws", true, "azure", true));

    HealthReport report = health.checkHealth();

    assertThat(report.getStatus()).isEqualTo(HealthReport.HEALTHY);
    assertThat(report.getVersion()).isEqualTo("1.0.0");
    assertThat(report.getServices())
        .containsOnly(
            entry("qr_generator", "healthy"),
            entry("api", "healthy"),
            entry("aws_s3", "healthy"),
            entry("azure_blob", "healthy"));
    assertThat(health.lastReport()).isSameAs(report);
  }

  @Test
  void missingStorageIsDegraded() {
    when(generator.probe()).thenReturn(true);
    when(replicator.providerStates()).thenReturn(Map.of("aws", false, "azure", true));

    HealthReport report = health.checkHealth();

    assertThat(report.getStatus()).isEqualTo(HealthReport.DEGRADED);
    assertThat(report.getServices()).containsEntry("aws_s3", "unavailable");
  }

  @Test
  void failingGeneratorIsUnhealthyAndNotReady() {
    when(generator.probe()).thenReturn(false);
    when(replicator.providerStates()).thenReturn(Map.of("aws", true, "azure", true));

    assertThat(health.checkHealth().getStatus()).isEqualTo(HealthReport.UNHEALTHY);
    assertThat(health.isReady()).isFalse();
  }

  @Test
  void crashingRefreshMarksNotAlive() {
    when(generator.probe()).thenThrow(new IllegalStateException("boom"));

    health.refresh();
    assertThat(health.isAlive()).isFalse();

    when(generator.probe()).thenReturn(true);
    when(replicator.providerStates()).thenReturn(Map.of("aws", true, "azure", true));
    health.refresh();
    assertThat(health.isAlive()).isTrue();
  }
}
