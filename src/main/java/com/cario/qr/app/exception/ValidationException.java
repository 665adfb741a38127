package com.cario.qr.app.exception;

/** Request shape or range is invalid. Mapped to HTTP 400. */
public class ValidationException extends QrServiceException {

  public ValidationException(String message) {
    super(message);
  }
}
