package com.cario.qr.app.util;

import com.cario.qr.app.exception.RenderException;
import java.awt.Color;
import java.util.Locale;
import java.util.Map;

/** Colour strings accepted by the API: CSS names, {@code #rgb} and {@code #rrggbb}. */
public final class ColorParser {

  private static final Map<String, Color> NAMED =
      Map.ofEntries(
          Map.entry("black", Color.BLACK),
          Map.entry("white", Color.WHITE),
          Map.entry("red", new Color(0xFF0000)),
          Map.entry("green", new Color(0x008000)),
          Map.entry("lime", new Color(0x00FF00)),
          Map.entry("blue", new Color(0x0000FF)),
          Map.entry("navy", new Color(0x000080)),
          Map.entry("yellow", new Color(0xFFFF00)),
          Map.entry("orange", new Color(0xFFA500)),
          Map.entry("purple", new Color(0x800080)),
          Map.entry("maroon", new Color(0x800000)),
          Map.entry("teal", new Color(0x008080)),
          Map.entry("gray", new Color(0x808080)),
          Map.entry("grey", new Color(0x808080)),
          Map.entry("darkgray", new Color(0xA9A9A9)),
          Map.entry("lightgray", new Color(0xD3D3D3)),
          Map.entry("brown", new Color(0xA52A2A)),
          Map.entry("pink", new Color(0xFFC0CB)),
          Map.entry("transparent", new Color(0, 0, 0, 0)));

  private ColorParser() {}

  public static Color parse(String value) {
    if (value == null || value.isBlank()) {
      throw new RenderException("Colour must not be blank");
    }
    String v = value.trim().toLowerCase(Locale.ROOT);
    Color named = NAMED.get(v);
    if (named != null) {
      return named;
    }
    if (v.startsWith("#")) {
      String hex = v.substring(1);
      if (hex.length() == 3) {
        char r = hex.charAt(0);
        char g = hex.charAt(1);
        char b = hex.charAt(2);
        hex = new String(new char[] {r, r, g, g, b, b});
      }
      if (hex.length() == 6 && hex.chars().allMatch(c -> Character.digit(c, 16) >= 0)) {
        return new Color(Integer.parseInt(hex, 16));
      }
    }
    throw new RenderException("Unsupported colour: " + value);
  }

  /** {@code #rrggbb}, or {@code none} for a fully transparent colour. */
  public static String toHex(Color color) {
    if (color.getAlpha() == 0) {
      return "none";
    }
    return String.format("#%02x%02x%02x", color.getRed(), color.getGreen(), color.getBlue());
  }
}
