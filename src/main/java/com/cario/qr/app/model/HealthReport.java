package com.cario.qr.app.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Body of {@code GET /health}. */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HealthReport {

  public static final String HEALTHY = "healthy";
  public static final String DEGRADED = "degraded";
  public static final String UNHEALTHY = "unhealthy";
  public static final String UNAVAILABLE = "unavailable";
  public static final String INITIALIZING = "initializing";

  String status;
  String timestamp;
  String version;

  @JsonProperty("uptime_seconds")
  Double uptimeSeconds;

  @JsonProperty("check_duration_ms")
  Double checkDurationMs;

  Map<String, String> services;
}
