package com.cario.qr.app.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class QrPayloadsTest {

  @Test
  void wifiEscapesReservedCharacters() {
    assertThat(QrPayloads.wifi("My;Net", "p:a,s\"s\\", "WEP", true))
        .isEqualTo("WIFI:T:WEP;S:My\\;Net;P:p\\:a\\,s\\\"s\\\\;H:true;;");
  }

  @Test
  void wifiDefaultsToWpa() {
    assertThat(QrPayloads.wifi("Home", null, null, false))
        .isEqualTo("WIFI:T:WPA;S:Home;P:;H:false;;");
  }

  @Test
  void vcardHasAllFields() {
    assertThat(QrPayloads.vcard("Jane Doe", "+1 555", "jane@example.com", null))
        .isEqualTo(
            "BEGIN:VCARD\nVERSION:3.0\nFN:Jane Doe\nTEL:+1 555\n"
                + "EMAIL:jane@example.com\nORG:\nEND:VCARD");
  }

  @Test
  void urlKeepsExistingScheme() {
    assertThat(QrPayloads.url("example.com/a")).isEqualTo("https://example.com/a");
    assertThat(QrPayloads.url(" http://example.com ")).isEqualTo("http://example.com");
    assertThat(QrPayloads.url("HTTPS://Example.com")).isEqualTo("HTTPS://Example.com");
  }
}
