package com.cario.qr.app.model;

import java.util.BitSet;

/**
 * Square grid of QR modules without quiet zone. {@code true} is a dark module.
 *
 * <p>Instances are immutable; the encoder is the only producer.
 */
public final class ModuleMatrix {

  private final int dimension;
  private final int version;
  private final BitSet dark;

  public ModuleMatrix(int dimension, int version, BitSet dark) {
    if (dimension <= 0) {
      throw new IllegalArgumentException("dimension must be positive");
    }
    this.dimension = dimension;
    this.version = version;
    this.dark = (BitSet) dark.clone();
  }

  /** Number of modules per side. */
  public int dimension() {
    return dimension;
  }

  /** QR symbol version (1..40) chosen by the encoder. */
  public int version() {
    return version;
  }

  public boolean isDark(int x, int y) {
    if (x < 0 || y < 0 || x >= dimension || y >= dimension) {
      return false;
    }
    return dark.get(y * dimension + x);
  }

  public int darkCount() {
    return dark.cardinality();
  }
}
