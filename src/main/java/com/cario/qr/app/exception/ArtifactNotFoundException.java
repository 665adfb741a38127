package com.cario.qr.app.exception;

/** No generated artifact is cached under the requested id. Mapped to HTTP 404. */
public class ArtifactNotFoundException extends QrServiceException {

  private final String artifactId;

  public ArtifactNotFoundException(String artifactId) {
    super("QR code " + artifactId + " not found");
    this.artifactId = artifactId;
  }

  public String getArtifactId() {
    return artifactId;
  }
}
