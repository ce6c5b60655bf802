package netgen.backend;

import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import netgen.netlist.PortList;
import netgen.util.VHDL;

/**
 * Renders the testbench entity and architecture of a circuit. All data inputs are driven from one flattened input bus and all outputs
 * observed on one flattened output bus; clock/reset pairs are tied to the shared clk and rst signals.
 */
public class TestbenchVHDL {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final String INPUT_BUS = "input";
  public static final String OUTPUT_BUS = "output";

  private final VHDL vhdl;
  private final String name;
  private final PortList ports;
  private final BusLayout inputLayout;
  private final BusLayout outputLayout;
  private final StimulusProcess stimulus;

  public TestbenchVHDL(String name, PortList ports, int halfPeriodNs) { this(new VHDL(), name, ports, halfPeriodNs); }

  public TestbenchVHDL(VHDL vhdl, String name, PortList ports, int halfPeriodNs) {
    this.vhdl = vhdl;
    this.name = name;
    this.ports = ports;
    this.inputLayout = BusLayout.of(INPUT_BUS, ports.getInputs());
    this.outputLayout = BusLayout.of(OUTPUT_BUS, ports.getOutputs());
    this.stimulus = new StimulusProcess(vhdl, name, inputLayout.getWidth(), outputLayout.getWidth(), halfPeriodNs);
  }

  public BusLayout getInputLayout() { return inputLayout; }
  public BusLayout getOutputLayout() { return outputLayout; }

  public String render() { return entity() + architecture(); }

  /** The testbench entity; it has no ports of its own. */
  public String entity() {
    return "library ieee;\n"
        + "use ieee.std_logic_1164.all;\n"
        + "use ieee.std_logic_textio.all;\n"
        + "library std;\n"
        + "use std.textio.all;\n"
        + "library work;\n"
        + "entity " + name + "_tb is\n"
        + "begin\n"
        + "end entity " + name + "_tb;\n";
  }

  public String architecture() {
    String tab = vhdl.tab;
    StringBuilder text = new StringBuilder();
    text.append("architecture sim of " + name + "_tb is\n");
    text.append(tab + "signal clk, rst : std_logic;\n");
    text.append(tab + "constant input_size : integer := " + inputLayout.getWidth() + ";\n");
    text.append(tab + "constant output_size : integer := " + outputLayout.getWidth() + ";\n");
    text.append(tab + "signal " + INPUT_BUS + " : " + vhdl.BusType(inputLayout.getWidth()) + ";\n");
    text.append(tab + "signal " + OUTPUT_BUS + " : " + vhdl.BusType(outputLayout.getWidth()) + ";\n");
    text.append("begin\n");
    text.append(stimulus.render());
    text.append(dut());
    text.append("end architecture sim;\n");
    return text.toString();
  }

  /** The device-under-test instantiation. */
  public String dut() {
    String tab = vhdl.tab;
    return "dut: entity work." + name + "\n"
        + "port map (\n"
        + tab + String.join(",\n" + tab, portAssigns()) + "\n"
        + ");\n";
  }

  /**
   * Port associations in declaration order: data inputs, outputs, then clock/reset pairs.
   */
  public List<String> portAssigns() {
    List<String> assigns = new ArrayList<>();
    assigns.addAll(inputLayout.associations());
    assigns.addAll(outputLayout.associations());
    for (PortList.ClockReset pair : ports.getClockResets()) {
      assigns.add(pair.clock().var().identifier() + " => clk");
      assigns.add(pair.reset().var().identifier() + " => rst");
    }
    if (ports.getClockResets().size() > 1)
      logger.warn("Testbench for {} drives {} clock/reset pairs from a single clock", name, ports.getClockResets().size());
    return assigns;
  }
}
