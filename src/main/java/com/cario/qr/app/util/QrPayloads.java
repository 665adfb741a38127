package com.cario.qr.app.util;

import java.util.Locale;

/** Builders for structured QR payloads (Wi-Fi credentials, contact cards, links). */
public final class QrPayloads {

  private QrPayloads() {}

  /**
   * Wi-Fi network configuration in the {@code WIFI:} format understood by phone cameras.
   *
   * @param security {@code WPA}, {@code WEP} or {@code nopass}; {@code null} means WPA
   */
  public static String wifi(String ssid, String password, String security, boolean hidden) {
    String sec = (security == null || security.isBlank()) ? "WPA" : security.trim();
    return "WIFI:T:"
        + sec
        + ";S:"
        + escapeWifi(ssid)
        + ";P:"
        + escapeWifi(password == null ? "" : password)
        + ";H:"
        + (hidden ? "true" : "false")
        + ";;";
  }

  /** vCard 3.0 with name, phone, e-mail and organisation. Blank optional fields stay empty. */
  public static String vcard(String name, String phone, String email, String organization) {
    return "BEGIN:VCARD\n"
        + "VERSION:3.0\n"
        + "FN:" + nullToEmpty(name) + "\n"
        + "TEL:" + nullToEmpty(phone) + "\n"
        + "EMAIL:" + nullToEmpty(email) + "\n"
        + "ORG:" + nullToEmpty(organization) + "\n"
        + "END:VCARD";
  }

  /** Adds {@code https://} when the link has no http(s) scheme. */
  public static String url(String url) {
    String u = url.trim();
    String lower = u.toLowerCase(Locale.ROOT);
    if (lower.startsWith("http://") || lower.startsWith("https://")) {
      return u;
    }
    return "https://" + u;
  }

  // Reserved in the WIFI: grammar: backslash, semicolon, comma, colon, double quote.
  private static String escapeWifi(String s) {
    StringBuilder sb = new StringBuilder(s.length());
    for (char c : s.toCharArray()) {
      if (c == '\\' || c == ';' || c == ',' || c == ':' || c == '"') {
        sb.append('\\');
      }
      sb.append(c);
    }
    return sb.toString();
  }

  private static String nullToEmpty(String s) {
    return s == null ? "" : s;
  }
}
