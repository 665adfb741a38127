package com.cario.qr.app.model;

import com.cario.qr.app.exception.RenderException;
import com.google.zxing.qrcode.decoder.ErrorCorrectionLevel;
import java.util.Locale;

/** QR redundancy tiers. */
public enum ErrorCorrection {
  L(ErrorCorrectionLevel.L), // ~7%
  M(ErrorCorrectionLevel.M), // ~15%
  Q(ErrorCorrectionLevel.Q), // ~25%
  H(ErrorCorrectionLevel.H); // ~30%

  private final ErrorCorrectionLevel zxingLevel;

  ErrorCorrection(ErrorCorrectionLevel zxingLevel) {
    this.zxingLevel = zxingLevel;
  }

  public ErrorCorrectionLevel zxingLevel() {
    return zxingLevel;
  }

  /**
   * Case-insensitive lookup; {@code null} or blank means {@link #M}. Unknown levels fail with a
   * {@link RenderException}, like the other render options.
   */
  public static ErrorCorrection from(String value) {
    if (value == null || value.isBlank()) {
      return M;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new RenderException("Unsupported error correction level: " + value);
    }
  }
}
