package hwelab.util;

import java.math.BigInteger;

/** Two's complement helpers on BigInteger bit patterns. */
public class BitMath {
  /** 2^width - 1 */
  public static BigInteger mask(int width) {
    if (width < 0)
      throw new IllegalArgumentException("width must be non-negative");
    return BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE);
  }

  /** Truncates a value to its low width bits (non-negative result). */
  public static BigInteger toUnsigned(BigInteger value, int width) { return value.and(mask(width)); }

  /** Interprets the low width bits of a value as a two's complement number. */
  public static BigInteger toSigned(BigInteger value, int width) {
    if (width == 0)
      return BigInteger.ZERO;
    BigInteger bits = toUnsigned(value, width);
    if (bits.testBit(width - 1))
      return bits.subtract(BigInteger.ONE.shiftLeft(width));
    return bits;
  }

  /** (value &gt;&gt; lo) &amp; mask(hi - lo + 1) */
  public static BigInteger extract(BigInteger value, int hi, int lo) { return value.shiftRight(lo).and(mask(hi - lo + 1)); }
}
