package netgen.netlist;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The externally visible ports of a circuit as seen by an HDL backend. Clock and reset pads are taken out of the data inputs and paired
 * by declaration order.
 */
public class PortList {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** A clock pad and the reset pad it is paired with. */
  public record ClockReset(Port clock, Port reset) {}

  private final List<Port> inputs;
  private final List<Port> outputs;
  private final List<ClockReset> clockResets;

  public PortList(List<Port> inputs, List<Port> outputs, List<ClockReset> clockResets) {
    this.inputs = List.copyOf(inputs);
    this.outputs = List.copyOf(outputs);
    this.clockResets = List.copyOf(clockResets);
  }

  /**
   * Derives the port list of a netlist.
   * Pairing is positional: the n-th clock goes with the n-th reset. With unequal counts only the common prefix is paired, the rest is
   * dropped with a warning.
   */
  public static PortList of(Netlist netlist) {
    List<Port> inputs = netlist.getInputs()
                            .stream()
                            .filter(port -> !port.type().isClock() && !port.type().isReset())
                            .collect(Collectors.toList());
    List<Port> clocks = netlist.getInputs().stream().filter(port -> port.type().isClock()).collect(Collectors.toList());
    List<Port> resets = netlist.getInputs().stream().filter(port -> port.type().isReset()).collect(Collectors.toList());
    if (clocks.size() != resets.size())
      logger.warn("Found {} clock(s) but {} reset(s); only the first {} will be paired", clocks.size(), resets.size(),
                  Math.min(clocks.size(), resets.size()));
    List<ClockReset> pairs = new ArrayList<>();
    for (int i = 0; i < Math.min(clocks.size(), resets.size()); ++i)
      pairs.add(new ClockReset(clocks.get(i), resets.get(i)));
    List<Port> outputs = netlist.getOutputs().stream().map(DrivenPort::port).collect(Collectors.toList());
    return new PortList(inputs, outputs, pairs);
  }

  /** Data inputs in declaration order; no clocks or resets. */
  public List<Port> getInputs() { return inputs; }
  public List<Port> getOutputs() { return outputs; }
  public List<ClockReset> getClockResets() { return clockResets; }

  public List<BaseType> getInputTypes() { return inputs.stream().map(Port::type).collect(Collectors.toList()); }

  /** Sum of all data input widths. */
  public int getInputWidth() { return inputs.stream().mapToInt(port -> port.type().getWidth()).sum(); }
  /** Sum of all output widths. */
  public int getOutputWidth() { return outputs.stream().mapToInt(port -> port.type().getWidth()).sum(); }
}
