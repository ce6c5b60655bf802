package netgen.util;

import java.math.BigInteger;

public class Bits {
  /**
   * Renders the low {@code width} bits of a value, most significant bit first. Negative values come out in two's complement.
   */
  public static String toBits(BigInteger value, int width) {
    if (width < 0)
      throw new IllegalArgumentException();
    if (width == 0)
      return "";
    BigInteger mask = BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE);
    String bits = value.and(mask).toString(2);
    return "0".repeat(width - bits.length()) + bits;
  }

  public static String toBits(long value, int width) { return toBits(BigInteger.valueOf(value), width); }
}
