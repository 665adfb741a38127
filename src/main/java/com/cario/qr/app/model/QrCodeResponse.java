package com.cario.qr.app.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/** Response returned for every generated QR code. Batch responses omit the inline preview. */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QrCodeResponse {

  String id;
  String data;
  String format;
  int size;

  @JsonProperty("download_url")
  String downloadUrl;

  @JsonProperty("qr_code_base64")
  String qrCodeBase64;

  @JsonProperty("created_at")
  String createdAt;

  public static QrCodeResponse from(GeneratedArtifact artifact, boolean includePreview) {
    return QrCodeResponse.builder()
        .id(artifact.getId())
        .data(artifact.getSourceData())
        .format(artifact.getFormat().name())
        .size(artifact.getSizeParameter())
        .downloadUrl("/qr/download/" + artifact.getId())
        .qrCodeBase64(includePreview ? artifact.base64() : null)
        .createdAt(artifact.getCreatedAt().toString())
        .build();
  }
}
