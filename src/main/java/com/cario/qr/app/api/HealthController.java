package com.cario.qr.app.api;

import com.cario.qr.app.config.QrServiceProperties;
import com.cario.qr.app.model.HealthReport;
import com.cario.qr.app.model.StorageStatus;
import com.cario.qr.app.service.HealthService;
import com.cario.qr.app.service.StorageReplicator;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Service banner, health probes, storage status and the Prometheus scrape endpoint. */
@Log4j2
@RestController
@RequiredArgsConstructor
public class HealthController {

  /** Prometheus text exposition format 0.0.4. */
  static final String PROMETHEUS_CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

  private final HealthService healthService;
  private final StorageReplicator replicator;
  private final PrometheusMeterRegistry prometheusRegistry;
  private final QrServiceProperties props;

  @GetMapping(path = "/", produces = MediaType.APPLICATION_JSON_VALUE)
  public Map<String, String> root() {
    Map<String, String> body = new LinkedHashMap<>();
    body.put("message", "Multi-Cloud QR Code Generator API");
    body.put("version", props.getVersion());
    body.put("health", "/health");
    body.put("metrics", "/metrics");
    return body;
  }

  @GetMapping(path = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
  public HealthReport health() {
    return healthService.checkHealth();
  }

  @GetMapping(path = "/health/ready", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Map<String, String>> ready() {
    if (healthService.isReady()) {
      return ResponseEntity.ok(Map.of("status", "ready"));
    }
    log.warn("health.ready not ready");
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of("status", "not_ready", "detail", "Service not ready"));
  }

  @GetMapping(path = "/health/live", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Map<String, Object>> live() {
    Map<String, Object> body = new LinkedHashMap<>();
    boolean alive = healthService.isAlive();
    body.put("status", alive ? "alive" : "dead");
    body.put("timestamp", Instant.now().toEpochMilli() / 1000.0);
    body.put("uptime_seconds", healthService.uptimeSeconds());
    return alive
        ? ResponseEntity.ok(body)
        : ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
  }

  @GetMapping(path = "/storage/status", produces = MediaType.APPLICATION_JSON_VALUE)
  public StorageStatus storageStatus() {
    return replicator.status();
  }

  @GetMapping(path = "/metrics")
  public ResponseEntity<String> metrics() {
    return ResponseEntity.ok()
        .contentType(MediaType.parseMediaType(PROMETHEUS_CONTENT_TYPE))
        .body(prometheusRegistry.scrape());
  }
}
