package com.cario.qr.app.exception;

/**
 * A storage provider call failed. Raised by the provider adapters and always caught by the
 * replicator, so it never reaches an HTTP caller.
 */
public class StorageException extends QrServiceException {

  private final String provider;

  public StorageException(String provider, String message, Throwable cause) {
    super(provider + ": " + message, cause);
    this.provider = provider;
  }

  public String getProvider() {
    return provider;
  }
}
