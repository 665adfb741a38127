package com.cario.qr.app.model;

import com.cario.qr.app.exception.RenderException;
import java.util.Locale;

/** Output encodings supported by the renderer. */
public enum OutputFormat {
  /** Raster image. */
  PNG("image/png", "png"),
  /** Vector path document. */
  SVG("image/svg+xml", "svg"),
  /** Single-page paginated document embedding the raster image. */
  PDF("application/pdf", "pdf");

  private final String contentType;
  private final String extension;

  OutputFormat(String contentType, String extension) {
    this.contentType = contentType;
    this.extension = extension;
  }

  public String contentType() {
    return contentType;
  }

  public String extension() {
    return extension;
  }

  /**
   * Case-insensitive lookup. Unknown values are rejected rather than rendered as PNG.
   *
   * @throws RenderException when {@code value} is blank or not a supported format
   */
  public static OutputFormat from(String value) {
    if (value == null || value.isBlank()) {
      throw new RenderException("Output format is required");
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new RenderException("Unsupported output format: " + value);
    }
  }
}
