package netgen.signal;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import netgen.netlist.BaseType;
import netgen.netlist.DrivenPort;
import netgen.netlist.Metadata;
import netgen.netlist.Name;
import netgen.netlist.Node;
import netgen.netlist.Port;
import netgen.netlist.Var;
import netgen.reify.CallKey;
import netgen.reify.CircuitBuilder;
import netgen.reify.Signal;

/**
 * Minimal set of signal primitives used to build example circuits and tests.
 * Every call instantiates one node under a fresh {@link CallKey} unless a key is passed to {@link #primitive}.
 */
public final class Signals {
  public static final Name AND2 = Name.of("and2");
  public static final Name OR2 = Name.of("or2");
  public static final Name XOR2 = Name.of("xor2");
  public static final Name NOT = Name.of("not");
  public static final Name ADD = Name.of("add");
  public static final Name SUB = Name.of("sub");
  public static final Name EQ = Name.of("eq");
  public static final Name MUX2 = Name.of("mux2");
  public static final Name REGISTER = Name.of("register");
  public static final Name PACK = Name.of("pack");
  public static final Name SLICE = Name.of("slice");

  /** Metadata key of a register's reset value. */
  public static final String DEFAULT = "def";
  public static final String HIGH = "hi";
  public static final String LOW = "lo";

  static final Var OUT = Var.named("o0");

  private Signals() {}

  /**
   * Instantiates a single-output primitive with inputs {@code i0, i1, ...} and output {@code o0}.
   * @param key call identity; passing an equal key again returns the node created first
   */
  public static Signal primitive(CallKey key, Name name, BaseType outType, Map<String, Metadata> metadata, Signal... inputs) {
    if (inputs.length == 0)
      throw new IllegalArgumentException("Primitive " + name + " needs at least one input");
    CircuitBuilder builder = inputs[0].getBuilder();
    List<DrivenPort<Integer>> ports = new ArrayList<>();
    for (int i = 0; i < inputs.length; ++i)
      ports.add(builder.bind(Var.named("i" + i), inputs[i]));
    return builder.instantiate(key, Node.operation(name, List.of(new Port(OUT, outType)), ports, metadata));
  }

  private static Signal binary(Name name, Signal a, Signal b) {
    requireSameType(name, a, b);
    return primitive(CallKey.fresh(name.getBase()), name, a.getType(), Map.of(), a, b);
  }

  public static Signal and2(Signal a, Signal b) { return binary(AND2, a, b); }
  public static Signal or2(Signal a, Signal b) { return binary(OR2, a, b); }
  public static Signal xor2(Signal a, Signal b) { return binary(XOR2, a, b); }
  public static Signal add(Signal a, Signal b) { return binary(ADD, a, b); }
  public static Signal sub(Signal a, Signal b) { return binary(SUB, a, b); }

  public static Signal not(Signal a) { return primitive(CallKey.fresh("not"), NOT, a.getType(), Map.of(), a); }

  public static Signal eq(Signal a, Signal b) {
    requireSameType(EQ, a, b);
    return primitive(CallKey.fresh("eq"), EQ, BaseType.BOOL, Map.of(), a, b);
  }

  /** Selects {@code a} when {@code sel} is high, else {@code b}. */
  public static Signal mux2(Signal sel, Signal a, Signal b) {
    if (sel.getType().getWidth() != 1)
      throw new IllegalArgumentException("mux2 select must be a single bit, got " + sel.getType());
    requireSameType(MUX2, a, b);
    return primitive(CallKey.fresh("mux2"), MUX2, a.getType(), Map.of(), sel, a, b);
  }

  /**
   * Concatenates signals, first argument in the most significant position.
   */
  public static Signal pack(Signal... parts) {
    int width = 0;
    for (Signal part : parts)
      width += part.getType().getWidth();
    return primitive(CallKey.fresh("pack"), PACK, BaseType.unsigned(width), Map.of(), parts);
  }

  /** Bits {@code hi} down to {@code lo} of a signal; a single bit is typed boolean. */
  public static Signal slice(Signal x, int hi, int lo) {
    return slice(x, hi, lo, hi == lo ? BaseType.BOOL : BaseType.unsigned(hi - lo + 1));
  }

  public static Signal slice(Signal x, int hi, int lo, BaseType type) {
    if (lo < 0 || hi < lo || hi >= x.getType().getWidth())
      throw new IllegalArgumentException("Slice " + hi + " downto " + lo + " is out of range for " + x.getType());
    if (type.getWidth() != hi - lo + 1)
      throw new IllegalArgumentException("Slice of " + (hi - lo + 1) + " bits cannot be typed " + type);
    LinkedHashMap<String, Metadata> metadata = new LinkedHashMap<>();
    metadata.put(HIGH, new Metadata.IntValue(hi));
    metadata.put(LOW, new Metadata.IntValue(lo));
    return primitive(CallKey.fresh("slice"), SLICE, type, metadata, x);
  }

  /**
   * A lookup table mapping input values to output values; unmapped inputs produce zero.
   */
  public static Signal table(Signal in, BaseType outType, Map<Long, Long> mapping) {
    List<Node.TableCase> cases = new ArrayList<>();
    mapping.forEach((from, to) -> cases.add(new Node.TableCase(from, Long.toString(from), to, Long.toString(to))));
    CircuitBuilder builder = in.getBuilder();
    return builder.instantiate(CallKey.fresh("table"), Node.table(new Port(OUT, outType), builder.bind(Var.named("i0"), in), cases));
  }

  /**
   * A clocked register whose next value may depend on its own output.
   * @param next computes the next state from the current register output
   * @return the register output
   */
  public static Signal register(Signal clk, Signal rst, long init, BaseType type, Function<Signal, Signal> next) {
    CircuitBuilder builder = clk.getBuilder();
    int id = builder.allocate(CallKey.fresh("register"));
    Signal q = builder.forward(id, OUT, type);
    Signal d = next.apply(q);
    if (!d.getType().equals(type))
      throw new IllegalArgumentException("register of type " + type + " cannot take a next value of type " + d.getType());
    List<DrivenPort<Integer>> inputs =
        List.of(builder.bind(Var.named("clk"), clk), builder.bind(Var.named("rst"), rst), builder.bind(Var.named("i0"), d));
    builder.define(id, Node.operation(REGISTER, List.of(new Port(OUT, type)), inputs, Map.of(DEFAULT, new Metadata.IntValue(init))));
    return q;
  }

  /** One-cycle delay. */
  public static Signal delay(Signal clk, Signal rst, long init, Signal d) { return register(clk, rst, init, d.getType(), q -> d); }

  private static void requireSameType(Name name, Signal a, Signal b) {
    if (!a.getType().equals(b.getType()))
      throw new IllegalArgumentException(name + " needs operands of equal type, got " + a.getType() + " and " + b.getType());
  }
}
