package netgen.examples;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import netgen.netlist.BaseType;
import netgen.reify.Circuit;
import netgen.reify.CircuitBuilder;
import netgen.reify.Signal;
import netgen.signal.Enabled;
import netgen.signal.Signals;

/**
 * Named example circuits, selectable from the command line. Each entry builds a fresh circuit on the given builder.
 */
public class ExampleCircuits {
  private static final Map<String, Function<CircuitBuilder, Circuit>> catalog = new LinkedHashMap<>();

  static {
    catalog.put("halfadder", ExampleCircuits::halfAdder);
    catalog.put("fulladder", ExampleCircuits::fullAdder);
    catalog.put("counter", ExampleCircuits::counter);
    catalog.put("mux", ExampleCircuits::mux);
    catalog.put("decoder", ExampleCircuits::decoder);
    catalog.put("accumulator", ExampleCircuits::accumulator);
    catalog.put("enabled", ExampleCircuits::enabled);
  }

  private ExampleCircuits() {}

  public static Set<String> GetNames() { return Collections.unmodifiableSet(catalog.keySet()); }

  public static Optional<Circuit> Get(String name, CircuitBuilder builder) {
    return Optional.ofNullable(catalog.get(name)).map(factory -> factory.apply(builder));
  }

  /** (sum, carry) of two bits. */
  public static Circuit halfAdder(CircuitBuilder builder) {
    return Circuit.fn(BaseType.BOOL, BaseType.BOOL, (a, b) -> Circuit.tuple(Signals.xor2(a, b), Signals.and2(a, b)));
  }

  /** (sum, carry, a xor b); the partial sum is shared between sum and carry. */
  public static Circuit fullAdder(CircuitBuilder builder) {
    return Circuit.fn(BaseType.BOOL, BaseType.BOOL, BaseType.BOOL, (a, b, cin) -> {
      Signal partial = Signals.xor2(a, b);
      Signal sum = Signals.xor2(partial, cin);
      Signal carry = Signals.or2(Signals.and2(a, b), Signals.and2(partial, cin));
      return Circuit.tuple(sum, carry, partial);
    });
  }

  /** 4-bit counter that increments while enabled. */
  public static Circuit counter(CircuitBuilder builder) {
    BaseType u4 = BaseType.unsigned(4);
    return Circuit.clocked(
        (clk, rst)
            -> Circuit.fn(BaseType.BOOL,
                          en -> Circuit.of(Signals.register(clk, rst, 0, u4, q -> Signals.mux2(en, Signals.add(q, builder.constant(u4, 1)), q)))));
  }

  public static Circuit mux(CircuitBuilder builder) {
    BaseType u8 = BaseType.unsigned(8);
    return Circuit.fn(BaseType.BOOL, u8, u8, (sel, a, b) -> Circuit.of(Signals.mux2(sel, a, b)));
  }

  /** One-hot decoder of a 2-bit value. */
  public static Circuit decoder(CircuitBuilder builder) {
    Map<Long, Long> mapping = new LinkedHashMap<>();
    for (long i = 0; i < 4; ++i)
      mapping.put(i, 1L << i);
    return Circuit.fn(BaseType.unsigned(2), x -> Circuit.of(Signals.table(x, BaseType.unsigned(4), mapping)));
  }

  /** Signed 8-bit running sum. */
  public static Circuit accumulator(CircuitBuilder builder) {
    BaseType s8 = BaseType.signed(8);
    return Circuit.clocked((clk, rst) -> Circuit.fn(s8, x -> Circuit.of(Signals.register(clk, rst, 0, s8, acc -> Signals.add(acc, x)))));
  }

  /** Increments a 4-bit value and keeps its enable bit. */
  public static Circuit enabled(CircuitBuilder builder) {
    BaseType u4 = BaseType.unsigned(4);
    return Circuit.fn(BaseType.BOOL, u4,
                      (en, value)
                          -> Circuit.of(Enabled.mapEnabled(Enabled.packEnabled(en, value), u4,
                                                           v -> Signals.add(v, builder.constant(u4, 1)))));
  }
}
