package com.cario.qr.app.model;

import lombok.Builder;
import lombok.Value;

/** Result of pushing one artifact to one storage provider. Logged, never persisted. */
@Value
@Builder
public class StorageUploadOutcome {
  String provider;
  String artifactId;
  boolean success;
  boolean skipped; // provider disabled, no call made
  String signedUrl; // null unless success
  String error; // null on success
  long durationMs;

  public static StorageUploadOutcome succeeded(
      String provider, String artifactId, String signedUrl, long durationMs) {
    return StorageUploadOutcome.builder()
        .provider(provider)
        .artifactId(artifactId)
        .success(true)
        .signedUrl(signedUrl)
        .durationMs(durationMs)
        .build();
  }

  public static StorageUploadOutcome skipped(String provider, String artifactId) {
    return StorageUploadOutcome.builder()
        .provider(provider)
        .artifactId(artifactId)
        .skipped(true)
        .error("provider disabled")
        .build();
  }

  public static StorageUploadOutcome failed(
      String provider, String artifactId, String error, long durationMs) {
    return StorageUploadOutcome.builder()
        .provider(provider)
        .artifactId(artifactId)
        .error(error)
        .durationMs(durationMs)
        .build();
  }

  /** Metric tag for this outcome. */
  public String status() {
    if (success) {
      return "success";
    }
    return skipped ? "skipped" : "failure";
  }
}
