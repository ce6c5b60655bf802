package netgen.netlist;

import java.util.Objects;

/**
 * Hardware type of a port. Every type has a fixed bit width; the opaque table type has none.
 */
public final class BaseType {
  public enum Kind {
    BOOL("B"),
    CONTROL_BIT("CB"),
    CLOCK("CLK"),
    RESET("RST"),
    SIGNED("S"),
    UNSIGNED("U"),
    TABLE("T");

    private final String shortName;
    Kind(String shortName) { this.shortName = shortName; }
  }

  public static final BaseType BOOL = new BaseType(Kind.BOOL, 1);
  public static final BaseType CONTROL_BIT = new BaseType(Kind.CONTROL_BIT, 1);
  public static final BaseType CLOCK = new BaseType(Kind.CLOCK, 1);
  public static final BaseType RESET = new BaseType(Kind.RESET, 1);
  public static final BaseType TABLE = new BaseType(Kind.TABLE, 0);

  private final Kind kind;
  private final int width;

  private BaseType(Kind kind, int width) {
    this.kind = kind;
    this.width = width;
  }

  public static BaseType signed(int width) {
    if (width <= 0)
      throw new IllegalArgumentException("signed width must be positive, got " + width);
    return new BaseType(Kind.SIGNED, width);
  }
  public static BaseType unsigned(int width) {
    if (width <= 0)
      throw new IllegalArgumentException("unsigned width must be positive, got " + width);
    return new BaseType(Kind.UNSIGNED, width);
  }

  public Kind getKind() { return kind; }

  /** Number of bits a value of this type occupies on a bus. */
  public int getWidth() { return width; }

  public boolean isClock() { return kind == Kind.CLOCK; }
  public boolean isReset() { return kind == Kind.RESET; }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    BaseType other = (BaseType)obj;
    return kind == other.kind && width == other.width;
  }
  @Override
  public int hashCode() {
    return Objects.hash(kind, width);
  }
  @Override
  public String toString() {
    if (kind == Kind.SIGNED || kind == Kind.UNSIGNED)
      return kind.shortName + " " + width;
    return kind.shortName;
  }
}
