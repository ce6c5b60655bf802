package netgen.backend;

/**
 * Simulator driver script: fresh work library, compile design and testbench, run the testbench with full signal capture, exit.
 */
public class SimScript {
  private SimScript() {}

  public static String render(String name) {
    return "vlib work\n"
        + "vcom " + name + ".vhd\n"
        + "vcom " + name + "_tb.vhd\n"
        + "vsim " + name + "_tb\n"
        + "add wave -r *\n"
        + "run -all\n"
        + "quit\n";
  }
}
