package com.cario.qr.app.service;

import com.cario.qr.app.exception.RenderException;
import com.cario.qr.app.model.ModuleMatrix;
import com.cario.qr.app.model.ModuleStyle;
import com.cario.qr.app.model.OutputFormat;
import com.cario.qr.app.util.ColorParser;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.awt.image.IndexColorModel;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import javax.imageio.ImageIO;
import lombok.extern.log4j.Log4j2;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;

/**
 * Renders a {@link ModuleMatrix} as PNG, SVG or PDF.
 *
 * <p>Every module becomes a {@code scale x scale} pixel block and the symbol is surrounded by a
 * quiet zone of {@code border} modules. The module style only changes the glyph drawn for dark
 * modules. Stateless and thread-safe; runs on the render worker pool.
 */
@Log4j2
public class QrRenderer {

  public byte[] render(
      ModuleMatrix matrix,
      OutputFormat format,
      int scale,
      int border,
      String fillColor,
      String backColor,
      ModuleStyle style) {

    if (format == null) {
      throw new RenderException("Output format is required");
    }
    if (scale < 1) {
      throw new RenderException("Module scale must be at least 1 pixel, got " + scale);
    }
    if (border < 0) {
      throw new RenderException("Border must not be negative, got " + border);
    }
    Color fill = ColorParser.parse(fillColor);
    Color back = ColorParser.parse(backColor);
    ModuleStyle glyph = style == null ? ModuleStyle.NONE : style;

    switch (format) {
      case PNG:
        return writePng(rasterize(matrix, scale, border, fill, back, glyph));
      case SVG:
        return writeSvg(matrix, scale, border, fill, back, glyph);
      case PDF:
        return writePdf(rasterize(matrix, scale, border, fill, back, glyph));
      default:
        throw new RenderException("Unsupported output format: " + format);
    }
  }

  // ------------------ Raster ------------------

  BufferedImage rasterize(
      ModuleMatrix matrix, int scale, int border, Color fill, Color back, ModuleStyle style) {
    int modules = matrix.dimension() + 2 * border;
    long side = (long) modules * scale;
    if (side > Integer.MAX_VALUE / side) {
      throw new RenderException("Image of " + side + "x" + side + " pixels is too large");
    }
    int px = (int) side;

    BufferedImage image;
    if (style == ModuleStyle.NONE) {
      // two-colour palette: one bit per pixel keeps large symbols cheap
      image = new BufferedImage(px, px, BufferedImage.TYPE_BYTE_BINARY, palette(back, fill));
    } else {
      image = new BufferedImage(px, px, BufferedImage.TYPE_INT_ARGB);
    }

    Graphics2D g = image.createGraphics();
    try {
      g.setColor(back);
      g.fillRect(0, 0, px, px);
      g.setColor(fill);
      if (style != ModuleStyle.NONE) {
        g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
      }
      for (int y = 0; y < matrix.dimension(); y++) {
        for (int x = 0; x < matrix.dimension(); x++) {
          if (!matrix.isDark(x, y)) {
            continue;
          }
          int left = (x + border) * scale;
          int top = (y + border) * scale;
          switch (style) {
            case ROUNDED:
              g.fillRoundRect(left, top, scale, scale, scale / 2, scale / 2);
              break;
            case CIRCLE:
              g.fillOval(left, top, scale, scale);
              break;
            default:
              g.fillRect(left, top, scale, scale);
          }
        }
      }
    } finally {
      g.dispose();
    }
    return image;
  }

  private static IndexColorModel palette(Color back, Color fill) {
    byte[] r = {(byte) back.getRed(), (byte) fill.getRed()};
    byte[] gr = {(byte) back.getGreen(), (byte) fill.getGreen()};
    byte[] b = {(byte) back.getBlue(), (byte) fill.getBlue()};
    byte[] a = {(byte) back.getAlpha(), (byte) fill.getAlpha()};
    return new IndexColorModel(1, 2, r, gr, b, a);
  }

  private static byte[] writePng(BufferedImage image) {
    try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
      if (!ImageIO.write(image, "png", baos)) {
        throw new RenderException("No PNG image writer available");
      }
      return baos.toByteArray();
    } catch (IOException e) {
      throw new RenderException("Failed to write PNG: " + e.getMessage(), e);
    }
  }

  // ------------------ Vector ------------------

  private static byte[] writeSvg(
      ModuleMatrix matrix, int scale, int border, Color fill, Color back, ModuleStyle style) {
    int modules = matrix.dimension() + 2 * border;
    long px = (long) modules * scale;

    StringBuilder path = new StringBuilder();
    for (int y = 0; y < matrix.dimension(); y++) {
      int x = 0;
      while (x < matrix.dimension()) {
        if (!matrix.isDark(x, y)) {
          x++;
          continue;
        }
        int top = y + border;
        if (style == ModuleStyle.NONE) {
          // merge horizontal runs into one rectangle
          int start = x;
          while (x < matrix.dimension() && matrix.isDark(x, y)) {
            x++;
          }
          int run = x - start;
          path.append('M').append(start + border).append(' ').append(top);
          path.append('h').append(run).append("v1h-").append(run).append('z');
        } else {
          int left = x + border;
          if (style == ModuleStyle.CIRCLE) {
            path.append('M').append(left).append(' ').append(top).append(".5");
            path.append("a.5 .5 0 1 0 1 0a.5 .5 0 1 0 -1 0z");
          } else {
            path.append('M').append(left).append(".25 ").append(top);
            path.append("h.5a.25 .25 0 0 1 .25 .25v.5a.25 .25 0 0 1 -.25 .25");
            path.append("h-.5a.25 .25 0 0 1 -.25 -.25v-.5a.25 .25 0 0 1 .25 -.25z");
          }
          x++;
        }
      }
    }

    StringBuilder svg = new StringBuilder(path.length() + 512);
    svg.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
    svg.append("<svg xmlns=\"http://www.w3.org/2000/svg\" version=\"1.1\"");
    svg.append(" width=\"").append(px).append("\" height=\"").append(px).append('"');
    svg.append(" viewBox=\"0 0 ").append(modules).append(' ').append(modules).append('"');
    if (style == ModuleStyle.NONE) {
      svg.append(" shape-rendering=\"crispEdges\"");
    }
    svg.append(">\n");
    svg.append("<rect width=\"100%\" height=\"100%\" fill=\"")
        .append(ColorParser.toHex(back))
        .append("\"/>\n");
    svg.append("<path fill=\"").append(ColorParser.toHex(fill)).append("\" d=\"");
    svg.append(path).append("\"/>\n");
    svg.append("</svg>\n");
    return svg.toString().getBytes(StandardCharsets.UTF_8);
  }

  // ------------------ Document ------------------

  private static byte[] writePdf(BufferedImage image) {
    try (PDDocument document = new PDDocument();
        ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
      float w = image.getWidth();
      float h = image.getHeight();
      PDPage page = new PDPage(new PDRectangle(w, h));
      document.addPage(page);

      PDImageXObject xObject = LosslessFactory.createFromImage(document, image);
      try (PDPageContentStream content = new PDPageContentStream(document, page)) {
        content.drawImage(xObject, 0, 0, w, h);
      }
      document.save(baos);
      return baos.toByteArray();
    } catch (IOException e) {
      throw new RenderException("Failed to write PDF: " + e.getMessage(), e);
    }
  }
}
