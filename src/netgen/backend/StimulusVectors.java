package netgen.backend;

import java.math.BigInteger;
import java.util.List;
import java.util.Random;
import netgen.netlist.BaseType;
import netgen.util.Bits;

/**
 * Deterministic pseudo-random input vectors. The output is a pure function of the seed, the vector count and the ordered list of input
 * types: values are drawn port by port within a vector, then vector by vector, from one generator.
 */
public class StimulusVectors {
  public static final long DEFAULT_SEED = 0;
  public static final int DEFAULT_COUNT = 100;

  private final long seed;
  private final int count;

  public StimulusVectors() { this(DEFAULT_SEED, DEFAULT_COUNT); }

  public StimulusVectors(long seed, int count) {
    if (count < 0)
      throw new IllegalArgumentException("Vector count must not be negative, got " + count);
    this.seed = seed;
    this.count = count;
  }

  /**
   * Renders all vectors, one line each, every line terminated by a newline.
   * @throws UnsupportedStimulusTypeException if any input type has no drawing rule; checked before drawing
   */
  public String generate(List<BaseType> inputTypes) throws UnsupportedStimulusTypeException {
    for (BaseType type : inputTypes)
      requireSupported(type);
    Random random = new Random(seed);
    StringBuilder text = new StringBuilder();
    for (int i = 0; i < count; ++i) {
      for (BaseType type : inputTypes)
        text.append(draw(random, type));
      text.append("\n");
    }
    return text.toString();
  }

  /** One value of the given type as a big-endian bit string of the type's width. */
  static String draw(Random random, BaseType type) {
    int width = type.getWidth();
    switch (type.getKind()) {
    case BOOL:
    case CONTROL_BIT:
      return random.nextBoolean() ? "1" : "0";
    case CLOCK:
    case RESET:
      return "0";
    case UNSIGNED:
      return Bits.toBits(new BigInteger(width, random), width);
    case SIGNED:
      // uniform over [-2^(w-1), 2^(w-1)-1]
      return Bits.toBits(new BigInteger(width, random).subtract(BigInteger.ONE.shiftLeft(width - 1)), width);
    default:
      throw new IllegalStateException("No stimulus rule for " + type);
    }
  }

  private static void requireSupported(BaseType type) throws UnsupportedStimulusTypeException {
    if (type.getKind() == BaseType.Kind.TABLE)
      throw new UnsupportedStimulusTypeException(type);
  }
}
