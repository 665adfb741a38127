package com.cario.qr.app.model;

import java.time.Instant;
import java.util.Base64;
import java.util.Objects;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * A rendered QR code produced by one successful generation.
 *
 * <p>Instances never change after construction:
 *
 * <ul>
 *   <li>{@code id}: random UUID, used as cache key and as the stem of the storage object name.
 *   <li>{@code sourceData}: the encoded payload.
 *   <li>{@code format}: PNG, SVG or PDF.
 *   <li>{@code sizeParameter} / {@code borderParameter}: pixel scale per module and quiet-zone
 *       width in modules.
 *   <li>{@code errorCorrection}: redundancy level used by the encoder.
 *   <li>{@code symbolVersion}: QR version the encoder selected for the payload.
 *   <li>{@code bytes}: the rendered file.
 *   <li>{@code createdAt}: generation time stamp.
 * </ul>
 *
 * <p>Defensive copies are made of the byte content on the way in and on the way out, so cached
 * artifacts cannot be altered by callers.
 */
@Value
public class GeneratedArtifact {

  String id;
  String sourceData;
  OutputFormat format;
  int sizeParameter;
  int borderParameter;
  ErrorCorrection errorCorrection;
  int symbolVersion;

  @ToString.Exclude byte[] bytes;

  Instant createdAt;

  @Builder
  private GeneratedArtifact(
      String id,
      String sourceData,
      OutputFormat format,
      int sizeParameter,
      int borderParameter,
      ErrorCorrection errorCorrection,
      int symbolVersion,
      byte[] bytes,
      Instant createdAt) {
    this.id = Objects.requireNonNull(id, "id must not be null");
    this.sourceData = Objects.requireNonNull(sourceData, "sourceData must not be null");
    this.format = Objects.requireNonNull(format, "format must not be null");
    this.sizeParameter = sizeParameter;
    this.borderParameter = borderParameter;
    this.errorCorrection = errorCorrection == null ? ErrorCorrection.M : errorCorrection;
    this.symbolVersion = symbolVersion;
    this.bytes = Objects.requireNonNull(bytes, "bytes must not be null").clone();
    this.createdAt = createdAt == null ? Instant.now() : createdAt;
  }

  /**
   * Returns a copy of the rendered file.
   *
   * @return new array holding the artifact bytes
   */
  public byte[] getBytes() {
    return bytes.clone();
  }

  public int getSizeBytes() {
    return bytes.length;
  }

  /** Inline preview of the rendered file. */
  public String base64() {
    return Base64.getEncoder().encodeToString(bytes);
  }

  public String contentType() {
    return format.contentType();
  }

  /** File name used for downloads, e.g. {@code 3f2a...c1.png}. */
  public String fileName() {
    return id + "." + format.extension();
  }
}
