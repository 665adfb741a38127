package com.cario.qr.app.exception;

/** The render pool and its queue are full; the request was not started. */
public class CapacityExceededException extends QrServiceException {

  public CapacityExceededException(String message, Throwable cause) {
    super(message, cause);
  }
}
