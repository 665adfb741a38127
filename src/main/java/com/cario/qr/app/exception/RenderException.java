package com.cario.qr.app.exception;

/** Unsupported render option or an image writer failure. */
public class RenderException extends QrServiceException {

  public RenderException(String message) {
    super(message);
  }

  public RenderException(String message, Throwable cause) {
    super(message, cause);
  }
}
