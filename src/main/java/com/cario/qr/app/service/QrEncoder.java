package com.cario.qr.app.service;

import com.cario.qr.app.exception.EncodingException;
import com.cario.qr.app.model.ErrorCorrection;
import com.cario.qr.app.model.ModuleMatrix;
import com.google.zxing.EncodeHintType;
import com.google.zxing.WriterException;
import com.google.zxing.qrcode.encoder.ByteMatrix;
import com.google.zxing.qrcode.encoder.Encoder;
import com.google.zxing.qrcode.encoder.QRCode;
import java.nio.charset.StandardCharsets;
import java.util.BitSet;
import java.util.EnumMap;
import java.util.Map;
import lombok.extern.log4j.Log4j2;

/**
 * Turns a payload into a QR module matrix. Stateless and thread-safe.
 *
 * <p>The smallest symbol version (1..40) that holds the payload at the requested error-correction
 * level is selected automatically. Payloads outside ISO-8859-1 are encoded as UTF-8 with an ECI
 * header so they decode back unchanged.
 */
@Log4j2
public class QrEncoder {

  public ModuleMatrix encode(String data, ErrorCorrection errorCorrection) {
    if (data == null || data.isEmpty()) {
      throw new EncodingException("QR payload must not be empty");
    }
    ErrorCorrection level = errorCorrection == null ? ErrorCorrection.M : errorCorrection;

    Map<EncodeHintType, Object> hints = new EnumMap<>(EncodeHintType.class);
    if (!StandardCharsets.ISO_8859_1.newEncoder().canEncode(data)) {
      hints.put(EncodeHintType.CHARACTER_SET, StandardCharsets.UTF_8.name());
    }

    QRCode code;
    try {
      code = Encoder.encode(data, level.zxingLevel(), hints);
    } catch (WriterException e) {
      log.warn(
          "qr.encode rejected length={} ecLevel={} msg={}", data.length(), level, e.getMessage());
      throw new EncodingException(
          "Payload of "
              + data.length()
              + " characters exceeds QR capacity at error correction "
              + level,
          e);
    }

    ByteMatrix matrix = code.getMatrix();
    int dimension = matrix.getWidth();
    BitSet dark = new BitSet(dimension * dimension);
    for (int y = 0; y < dimension; y++) {
      for (int x = 0; x < dimension; x++) {
        if (matrix.get(x, y) == 1) {
          dark.set(y * dimension + x);
        }
      }
    }
    int version = code.getVersion().getVersionNumber();
    log.debug("qr.encode ok length={} ecLevel={} version={}", data.length(), level, version);
    return new ModuleMatrix(dimension, version, dark);
  }
}
