package netgen.netlist;

/**
 * Operation-specific parameter attached to an {@link Node.Operation}. The known kinds cover integers, text and bit strings; anything
 * else is carried in an {@link Opaque} wrapper that backends are free to ignore.
 */
public interface Metadata {
  record IntValue(long value) implements Metadata {
    @Override
    public String toString() {
      return Long.toString(value);
    }
  }

  record Text(String value) implements Metadata {
    @Override
    public String toString() {
      return value;
    }
  }

  /** Bit string of '0'/'1' characters, most significant bit first. */
  record Bits(String value) implements Metadata {
    public Bits {
      if (!value.chars().allMatch(c -> c == '0' || c == '1'))
        throw new IllegalArgumentException("Illegal character in bit string '" + value + "'. Allowed characters are '0', '1'");
    }
    @Override
    public String toString() {
      return value;
    }
  }

  record Opaque(Object value) implements Metadata {
    @Override
    public String toString() {
      return "<opaque " + (value == null ? "null" : value.getClass().getSimpleName()) + ">";
    }
  }
}
