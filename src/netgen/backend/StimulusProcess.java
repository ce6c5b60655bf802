package netgen.backend;

import netgen.util.VHDL;

/**
 * Emits the testbench control process. The process goes through four phases in order: idle (clock low), reset (one reset pulse with
 * one clock pulse), loop (one clock cycle per line of the input vector file, capturing the output bus into the output file) and halt.
 */
public class StimulusProcess {
  public enum Phase { IDLE, RESET, LOOP, HALT }

  private final VHDL vhdl;
  private final String name;
  private final int inputWidth;
  private final int outputWidth;
  private final String delay;

  /**
   * @param name circuit name; the vector files are {@code <name>.input} and {@code <name>.output}
   * @param inputWidth width of the flattened input bus
   * @param outputWidth width of the flattened output bus
   * @param halfPeriodNs duration of every wait, in ns
   */
  public StimulusProcess(VHDL vhdl, String name, int inputWidth, int outputWidth, int halfPeriodNs) {
    this.vhdl = vhdl;
    this.name = name;
    this.inputWidth = inputWidth;
    this.outputWidth = outputWidth;
    this.delay = halfPeriodNs + " ns";
  }

  public String inputFile() { return name + "_input"; }
  public String outputFile() { return name + "_output"; }

  public String render() {
    String tab = vhdl.tab;
    StringBuilder text = new StringBuilder();
    text.append("runtest: process is\n");
    text.append(tab + "file " + inputFile() + " : text open read_mode is \"" + name + ".input\";\n");
    text.append(tab + "file " + outputFile() + " : text open write_mode is \"" + name + ".output\";\n");
    text.append(tab + "variable line_in, line_out : line;\n");
    text.append(tab + "variable input_var : " + vhdl.BusType(inputWidth) + ";\n");
    text.append(tab + "variable output_var : " + vhdl.BusType(outputWidth) + ";\n");
    text.append("begin\n");
    for (Phase phase : Phase.values())
      text.append(vhdl.AlignText(tab, phase(phase)));
    text.append("end process;\n");
    return text.toString();
  }

  /** Statements of one phase, unindented. */
  public String phase(Phase phase) {
    String tab = vhdl.tab;
    switch (phase) {
    case IDLE:
      return "clk <= '0';\n"
          + "wait for " + delay + ";\n";
    case RESET:
      return "rst <= '1', '0' after " + delay + ";\n"
          + "clk <= '1', '0' after " + delay + ";\n"
          + "wait for " + delay + ";\n";
    case LOOP:
      return "while not endfile(" + inputFile() + ") loop\n"
          + tab + "readline(" + inputFile() + ", line_in);\n"
          + tab + "read(line_in, input_var);\n"
          + tab + "input <= input_var;\n"
          + tab + "clk <= '1';\n"
          + tab + "wait for " + delay + ";\n"
          + tab + "clk <= '0';\n"
          + tab + "output_var := output;\n"
          + tab + "write(line_out, output_var);\n"
          + tab + "writeline(" + outputFile() + ", line_out);\n"
          + tab + "wait for " + delay + ";\n"
          + "end loop;\n";
    default:
      return "wait;\n";
    }
  }
}
