package netgen.reify;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import netgen.netlist.BaseType;
import netgen.netlist.DrivenPort;
import netgen.netlist.Driver;
import netgen.netlist.Name;
import netgen.netlist.Node;
import netgen.netlist.Port;
import netgen.netlist.Var;

/**
 * Binds the arguments of a circuit to input pads and reduces its result to a single typed driver.
 *
 * Function layers consume names from the input name pool; clock/reset layers use the reserved names {@code clk}/{@code rst} (then
 * {@code clk1}/{@code rst1}, ...). A tuple result is wrapped into one {@link #TOP} node whose inputs are the tuple elements.
 */
public class PortExtractor {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Name of the synthetic node flattening tuple results; never part of a reified netlist. */
  public static final Name TOP = new Name("netgen", "top");

  public static final int MIN_TUPLE = 2;
  public static final int MAX_TUPLE = 4;

  /**
   * The single typed result of a circuit.
   * @param arity number of circuit outputs this result stands for (the tuple width, or 1)
   */
  public record Extraction(BaseType type, Driver<Integer> driver, int arity) {}

  private final CircuitBuilder builder;
  private final ReifyOptions options;
  private int nextInput = 0;
  private int clockLayers = 0;

  private PortExtractor(CircuitBuilder builder, ReifyOptions options) {
    this.builder = builder;
    this.options = options;
  }

  /**
   * Extracts the result of a circuit.
   * @param builder the builder owning every signal of the circuit
   * @param circuit the circuit value
   * @param options name pools
   * @return the result type and driver
   * @throws ShapeException if the circuit is not of a supported shape
   */
  public static Extraction extract(CircuitBuilder builder, Circuit circuit, ReifyOptions options) throws ShapeException {
    return new PortExtractor(builder, options).descend(circuit);
  }

  private Extraction descend(Circuit circuit) throws ShapeException {
    if (circuit == null)
      throw new ShapeException("Circuit value is missing");
    if (circuit instanceof Circuit.Single) {
      Signal signal = checked(((Circuit.Single)circuit).getSignal(), "result");
      return new Extraction(signal.getType(), signal.getDriver(), 1);
    }
    if (circuit instanceof Circuit.Tuple)
      return wrap(((Circuit.Tuple)circuit).getElements());
    if (circuit instanceof Circuit.Lambda) {
      Circuit.Lambda lambda = (Circuit.Lambda)circuit;
      int index = nextInput++;
      String name = options.inputName(index).orElseThrow(
          () -> new ShapeException("Circuit takes more inputs than the " + index + " input name(s) supplied"));
      logger.trace("Binding argument {} to pad {}", index, name);
      return descend(lambda.getBody().apply(builder.pad(Var.named(name), lambda.getArgType())));
    }
    Circuit.Clocked clocked = (Circuit.Clocked)circuit;
    String suffix = clockLayers == 0 ? "" : Integer.toString(clockLayers);
    ++clockLayers;
    Signal clk = builder.pad(Var.named("clk" + suffix), BaseType.CLOCK);
    Signal rst = builder.pad(Var.named("rst" + suffix), BaseType.RESET);
    return descend(clocked.getBody().apply(clk, rst));
  }

  private Extraction wrap(List<Signal> elements) throws ShapeException {
    if (elements.size() < MIN_TUPLE || elements.size() > MAX_TUPLE)
      throw new ShapeException("Tuples of " + elements.size() + " signals are not supported, expected " + MIN_TUPLE + " to " + MAX_TUPLE);
    List<DrivenPort<Integer>> inputs = new ArrayList<>();
    int width = 0;
    for (int i = 0; i < elements.size(); ++i) {
      Signal element = checked(elements.get(i), "tuple element " + i);
      inputs.add(new DrivenPort<>(Var.named("i" + i), element.getType(), element.getDriver()));
      width += element.getType().getWidth();
    }
    if (width == 0)
      throw new ShapeException("Tuple result has no bits");
    BaseType type = BaseType.unsigned(width);
    Var out = Var.named("o0");
    Signal top = builder.instantiate(CallKey.fresh("top"), Node.operation(TOP, List.of(new Port(out, type)), inputs, Map.of()));
    return new Extraction(type, top.getDriver(), elements.size());
  }

  private Signal checked(Signal signal, String what) throws ShapeException {
    if (signal == null)
      throw new ShapeException("Circuit " + what + " is missing");
    if (signal.getBuilder() != builder)
      throw new ShapeException("Circuit " + what + " was created by a different builder");
    return signal;
  }
}
