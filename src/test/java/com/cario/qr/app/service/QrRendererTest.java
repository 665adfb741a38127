package com.cario.qr.app.service;

import static com.cario.qr.app.QrTestSupport.decodePdf;
import static com.cario.qr.app.QrTestSupport.decodePng;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.cario.qr.app.exception.RenderException;
import com.cario.qr.app.model.ErrorCorrection;
import com.cario.qr.app.model.ModuleMatrix;
import com.cario.qr.app.model.ModuleStyle;
import com.cario.qr.app.model.OutputFormat;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import javax.imageio.ImageIO;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class QrRendererTest {

  private final QrEncoder encoder = new QrEncoder();
  private final QrRenderer renderer = new QrRenderer();

  private byte[] render(String data, ErrorCorrection ec, OutputFormat format) {
    return renderer.render(
        encoder.encode(data, ec), format, 10, 4, "black", "white", ModuleStyle.NONE);
  }

  @ParameterizedTest
  @EnumSource(ErrorCorrection.class)
  void pngDecodesAtEveryLevel(ErrorCorrection ec) {
    assertThat(decodePng(render("https://example.com/path?q=1", ec, OutputFormat.PNG)))
        .isEqualTo("https://example.com/path?q=1");
  }

  @Test
  void pngHasQuietZoneAndScale() throws Exception {
    byte[] png = render("hello", ErrorCorrection.M, OutputFormat.PNG);
    BufferedImage image = ImageIO.read(new ByteArrayInputStream(png));

    // version 1: 21 modules + 2 * 4 border, 10 px each
    assertThat(image.getWidth()).isEqualTo(290);
    assertThat(image.getHeight()).isEqualTo(290);
    assertThat(new Color(image.getRGB(5, 5))).isEqualTo(Color.WHITE);
    assertThat(new Color(image.getRGB(45, 45))).isEqualTo(Color.BLACK);
  }

  @Test
  void utf8PayloadRoundTrips() {
    String data = "héllo wörld ✓ 日本語";
    assertThat(decodePng(render(data, ErrorCorrection.Q, OutputFormat.PNG))).isEqualTo(data);
  }

  @Test
  void pdfIsSinglePageAndDecodes() throws Exception {
    byte[] pdf = render("pdf payload", ErrorCorrection.M, OutputFormat.PDF);

    assertThat(new String(pdf, 0, 5, StandardCharsets.US_ASCII)).isEqualTo("%PDF-");
    try (PDDocument document = PDDocument.load(pdf)) {
      assertThat(document.getNumberOfPages()).isEqualTo(1);
      assertThat(document.getPage(0).getMediaBox().getWidth()).isEqualTo(290f);
    }
    assertThat(decodePdf(pdf)).isEqualTo("pdf payload");
  }

  @Test
  void svgUsesModuleViewBoxAndPixelSize() {
    String svg =
        new String(render("hello", ErrorCorrection.M, OutputFormat.SVG), StandardCharsets.UTF_8);

    assertThat(svg)
        .startsWith("<?xml")
        .contains("viewBox=\"0 0 29 29\"")
        .contains("width=\"290\"")
        .contains("fill=\"#ffffff\"")
        .contains("<path fill=\"#000000\"")
        .contains("crispEdges");
  }

  @Test
  void svgHonoursColoursAndStyle() {
    ModuleMatrix matrix = encoder.encode("styled", ErrorCorrection.M);
    String svg =
        new String(
            renderer.render(
                matrix, OutputFormat.SVG, 4, 2, "#1a2b3c", "transparent", ModuleStyle.CIRCLE),
            StandardCharsets.UTF_8);

    assertThat(svg).contains("fill=\"#1a2b3c\"").contains("fill=\"none\"").contains("a.5 .5");
    assertThat(svg).doesNotContain("crispEdges");
  }

  @Test
  void styledModulesKeepCentresDark() throws Exception {
    ModuleMatrix matrix = encoder.encode("round", ErrorCorrection.M);
    for (ModuleStyle style : new ModuleStyle[] {ModuleStyle.ROUNDED, ModuleStyle.CIRCLE}) {
      byte[] png = renderer.render(matrix, OutputFormat.PNG, 10, 4, "navy", "white", style);
      BufferedImage image = ImageIO.read(new ByteArrayInputStream(png));

      // centre of the top-left finder module
      assertThat(new Color(image.getRGB(45, 45))).isEqualTo(new Color(0x000080));
    }
    byte[] circles =
        renderer.render(matrix, OutputFormat.PNG, 10, 4, "navy", "white", ModuleStyle.CIRCLE);
    BufferedImage image = ImageIO.read(new ByteArrayInputStream(circles));
    // corner of the same module stays background around a circular glyph
    assertThat(new Color(image.getRGB(40, 40))).isEqualTo(Color.WHITE);
  }

  @Test
  void unsupportedInputsRaiseRenderException() {
    ModuleMatrix matrix = encoder.encode("x", ErrorCorrection.M);

    assertThatThrownBy(
            () ->
                renderer.render(
                    matrix, OutputFormat.PNG, 10, 4, "not-a-colour", "white", ModuleStyle.NONE))
        .isInstanceOf(RenderException.class)
        .hasMessageContaining("not-a-colour");
    assertThatThrownBy(
            () -> renderer.render(matrix, OutputFormat.PNG, 0, 4, "black", "white", null))
        .isInstanceOf(RenderException.class);
    assertThatThrownBy(() -> renderer.render(matrix, null, 10, 4, "black", "white", null))
        .isInstanceOf(RenderException.class);
    assertThatThrownBy(() -> ModuleStyle.from("hexagon")).isInstanceOf(RenderException.class);
    assertThatThrownBy(() -> OutputFormat.from("GIF")).isInstanceOf(RenderException.class);
  }
}
