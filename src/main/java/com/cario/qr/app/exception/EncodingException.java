package com.cario.qr.app.exception;

/**
 * Payload cannot be encoded as a QR symbol: it is empty, or it exceeds the capacity of a version 40
 * symbol at the requested error-correction level. Mapped to HTTP 422.
 */
public class EncodingException extends QrServiceException {

  public EncodingException(String message) {
    super(message);
  }

  public EncodingException(String message, Throwable cause) {
    super(message, cause);
  }
}
