package com.cario.qr.app;

import com.google.zxing.BinaryBitmap;
import com.google.zxing.ChecksumException;
import com.google.zxing.DecodeHintType;
import com.google.zxing.FormatException;
import com.google.zxing.NotFoundException;
import com.google.zxing.Result;
import com.google.zxing.client.j2se.BufferedImageLuminanceSource;
import com.google.zxing.common.HybridBinarizer;
import com.google.zxing.qrcode.QRCodeReader;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;
import javax.imageio.ImageIO;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.PDFRenderer;

/** Decoding helpers shared by the rendering and generation tests. */
public final class QrTestSupport {

  private QrTestSupport() {}

  public static String decodePng(byte[] png) {
    try {
      return decode(ImageIO.read(new ByteArrayInputStream(png)));
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public static String decodePdf(byte[] pdf) {
    try (PDDocument document = PDDocument.load(pdf)) {
      BufferedImage page = new PDFRenderer(document).renderImageWithDPI(0, 144);
      return decode(page);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public static String decode(BufferedImage image) {
    BinaryBitmap bitmap =
        new BinaryBitmap(new HybridBinarizer(new BufferedImageLuminanceSource(image)));
    try {
      Result result =
          new QRCodeReader().decode(bitmap, Map.of(DecodeHintType.TRY_HARDER, Boolean.TRUE));
      return result.getText();
    } catch (NotFoundException | ChecksumException | FormatException e) {
      throw new AssertionError("QR code could not be decoded", e);
    }
  }
}
