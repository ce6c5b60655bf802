package netgen.signal;

import java.util.function.Function;
import netgen.netlist.BaseType;
import netgen.reify.CircuitBuilder;
import netgen.reify.Signal;

/**
 * Optional values: a data signal packed with an enable bit that says whether the data is valid. The enable bit is the most
 * significant bit of the packed signal.
 */
public final class Enabled {
  private Enabled() {}

  /** The two halves of an enabled signal. */
  public record Unpacked(Signal enabled, Signal value) {}

  /** Combines an enable bit and a data signal. */
  public static Signal packEnabled(Signal en, Signal value) {
    if (en.getType().getWidth() != 1)
      throw new IllegalArgumentException("enable must be a single bit, got " + en.getType());
    return Signals.pack(en, value);
  }

  public static Signal isEnabled(Signal enabled) {
    int top = enabled.getType().getWidth() - 1;
    return Signals.slice(enabled, top, top);
  }

  /** The data part; undefined when the signal is not enabled. */
  public static Signal enabledVal(Signal enabled, BaseType valueType) {
    return Signals.slice(enabled, enabled.getType().getWidth() - 2, 0, valueType);
  }

  /** Splits an enabled signal into its enable bit and its data. */
  public static Unpacked unpackEnabled(Signal enabled, BaseType valueType) {
    if (enabled.getType().getWidth() != valueType.getWidth() + 1)
      throw new IllegalArgumentException(enabled.getType() + " does not hold an enabled " + valueType);
    return new Unpacked(isEnabled(enabled), enabledVal(enabled, valueType));
  }

  /** Always enabled. */
  public static Signal enabledS(Signal value) { return packEnabled(value.getBuilder().constant(BaseType.BOOL, 1), value); }

  /** Never enabled. */
  public static Signal disabledS(CircuitBuilder builder, BaseType valueType) {
    return packEnabled(builder.constant(BaseType.BOOL, 0), builder.constant(valueType, 0));
  }

  /** Applies a combinational function to the data, keeping the enable bit. */
  public static Signal mapEnabled(Signal enabled, BaseType valueType, Function<Signal, Signal> f) {
    Unpacked parts = unpackEnabled(enabled, valueType);
    return packEnabled(parts.enabled(), f.apply(parts.value()));
  }
}
