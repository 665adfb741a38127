package com.cario.qr.app.model;

import com.cario.qr.app.exception.RenderException;
import java.util.Locale;

/** Glyph drawn for each dark module. Does not affect the encoded content. */
public enum ModuleStyle {
  NONE,
  ROUNDED,
  CIRCLE;

  /** {@code null} or blank means {@link #NONE}; {@code circular} is accepted as an alias. */
  public static ModuleStyle from(String value) {
    if (value == null || value.isBlank()) {
      return NONE;
    }
    String v = value.trim().toUpperCase(Locale.ROOT);
    if ("CIRCULAR".equals(v)) {
      return CIRCLE;
    }
    try {
      return valueOf(v);
    } catch (IllegalArgumentException e) {
      throw new RenderException("Unsupported module style: " + value);
    }
  }
}
