package com.cario.qr.app.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.cario.qr.app.exception.EncodingException;
import com.cario.qr.app.exception.RenderException;
import com.cario.qr.app.model.ErrorCorrection;
import com.cario.qr.app.model.ModuleMatrix;
import org.junit.jupiter.api.Test;

class QrEncoderTest {

  private final QrEncoder encoder = new QrEncoder();

  @Test
  void shortPayloadUsesVersionOne() {
    ModuleMatrix matrix = encoder.encode("hello", ErrorCorrection.M);

    assertThat(matrix.version()).isEqualTo(1);
    assertThat(matrix.dimension()).isEqualTo(21);
    // finder pattern corners
    assertThat(matrix.isDark(0, 0)).isTrue();
    assertThat(matrix.isDark(20, 0)).isTrue();
    assertThat(matrix.isDark(0, 20)).isTrue();
  }

  @Test
  void versionGrowsWithPayloadAndErrorCorrection() {
    ModuleMatrix small = encoder.encode("x".repeat(50), ErrorCorrection.L);
    ModuleMatrix sameAtH = encoder.encode("x".repeat(50), ErrorCorrection.H);
    ModuleMatrix large = encoder.encode("x".repeat(500), ErrorCorrection.L);

    assertThat(sameAtH.version()).isGreaterThan(small.version());
    assertThat(large.version()).isGreaterThan(small.version());
    assertThat(large.dimension()).isEqualTo(17 + 4 * large.version());
  }

  @Test
  void maximumAlphanumericPayloadFitsVersionForty() {
    ModuleMatrix matrix = encoder.encode("A".repeat(4296), ErrorCorrection.L);

    assertThat(matrix.version()).isEqualTo(40);
    assertThat(matrix.dimension()).isEqualTo(177);
  }

  @Test
  void oversizePayloadIsRejectedNotTruncated() {
    assertThatThrownBy(() -> encoder.encode("A".repeat(4297), ErrorCorrection.L))
        .isInstanceOf(EncodingException.class)
        .hasMessageContaining("4297");

    assertThatThrownBy(() -> encoder.encode("a".repeat(2000), ErrorCorrection.H))
        .isInstanceOf(EncodingException.class);
  }

  @Test
  void emptyPayloadIsRejected() {
    assertThatThrownBy(() -> encoder.encode("", ErrorCorrection.M))
        .isInstanceOf(EncodingException.class);
    assertThatThrownBy(() -> encoder.encode(null, ErrorCorrection.M))
        .isInstanceOf(EncodingException.class);
  }

  @Test
  void errorCorrectionParsingMatchesOtherRenderOptions() {
    assertThat(ErrorCorrection.from("q")).isEqualTo(ErrorCorrection.Q);
    assertThat(ErrorCorrection.from(" ")).isEqualTo(ErrorCorrection.M);
    assertThatThrownBy(() -> ErrorCorrection.from("Z"))
        .isInstanceOf(RenderException.class)
        .hasMessageContaining("Z");
  }

  @Test
  void whitespacePayloadIsEncoded() {
    assertThat(encoder.encode(" ", ErrorCorrection.M).version()).isEqualTo(1);
  }

  @Test
  void missingLevelDefaultsToMedium() {
    assertThat(encoder.encode("hello", null).version())
        .isEqualTo(encoder.encode("hello", ErrorCorrection.M).version());
  }
}
