package com.cario.qr.app.exception;

/**
 * Base type for every error raised by the QR code service.
 *
 * <p>All project exceptions are unchecked. The API layer maps each subtype to an HTTP status in
 * {@code ApiExceptionHandler}.
 */
public class QrServiceException extends RuntimeException {

  public QrServiceException(String message) {
    super(message);
  }

  public QrServiceException(String message, Throwable cause) {
    super(message, cause);
  }
}
