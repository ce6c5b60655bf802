package netgen.util;

import netgen.netlist.BaseType;

/**
 * Small VHDL text helpers shared by the testbench and design emitters.
 */
public class VHDL {
  public String tab = "    ";

  public VHDL() {}
  public VHDL(FileWriter toFile) { tab = toFile.tab; }

  /**
   * Port or signal type: std_logic for single bits, a descending std_logic_vector otherwise.
   */
  public String SignalType(BaseType type) {
    if (type.getWidth() == 1)
      return "std_logic";
    return "std_logic_vector(" + (type.getWidth() - 1) + " downto 0)";
  }

  /**
   * Type of a flattened bus: ascending, so that index 0 is the leftmost (most significant) bit.
   */
  public String BusType(int width) { return "std_logic_vector(0 to " + (width - 1) + ")"; }

  /**
   * Literal of the given width: a character literal for single bits, else a bit-string literal.
   */
  public String Literal(long value, int width) {
    if (width == 1)
      return "'" + (value & 1) + "'";
    return "\"" + Bits.toBits(value, width) + "\"";
  }

  /**
   * Generates text like : signal name : std_logic_vector(3 downto 0);
   */
  public String CreateDeclSig(String name, BaseType type) { return "signal " + name + " : " + SignalType(type) + ";\n"; }

  public String CreateText1or0(String new_signal, String condition) {
    return new_signal + " <= '1' when (" + condition + ") else '0';\n";
  }

  /**
   * Wraps a statement list in a process; with clk set, the body runs on the rising clock edge.
   */
  public String CreateInProc(boolean clk, String clock, String text) {
    int i = 1;
    String sensitivity = "all";
    String clockEdge = "";
    String endclockEdge = "";
    if (clk) {
      sensitivity = clock;
      clockEdge = tab + "if rising_edge(" + clock + ") then\n";
      i++;
      endclockEdge = tab + "end if;\n";
    }
    return "process (" + sensitivity + ") begin\n" + clockEdge + AlignText(tab.repeat(i), text) + endclockEdge + "end process;\n";
  }

  /**
   * Prefixes every non-empty line of text with the alignment.
   */
  public String AlignText(String alignment, String text) {
    if (text.isEmpty())
      return text;
    StringBuilder aligned = new StringBuilder();
    for (String line : text.split("\n", -1)) {
      if (!line.isEmpty())
        aligned.append(alignment).append(line);
      aligned.append("\n");
    }
    String result = aligned.toString();
    // split keeps the empty tail after a trailing newline
    return text.endsWith("\n") ? result.substring(0, result.length() - 1) : result;
  }
}
