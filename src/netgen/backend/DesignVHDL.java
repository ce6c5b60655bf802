package netgen.backend;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import netgen.netlist.BaseType;
import netgen.netlist.DrivenPort;
import netgen.netlist.Driver;
import netgen.netlist.Metadata;
import netgen.netlist.Name;
import netgen.netlist.Netlist;
import netgen.netlist.Node;
import netgen.netlist.Port;
import netgen.netlist.Var;
import netgen.signal.Signals;
import netgen.util.VHDL;

/**
 * Renders a netlist as a synthesizable VHDL entity. Each node output becomes a signal {@code n<id>_<port>}; the primitives from
 * {@link Signals} become concurrent assignments (registers a clocked process), lookup tables become selected assignments and any
 * other operation is instantiated as an entity of the same base name, from the library named by its namespace or else from work,
 * with its metadata as generics.
 */
public class DesignVHDL {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final VHDL vhdl;
  private final String name;
  private final Netlist netlist;

  public DesignVHDL(String name, Netlist netlist) { this(new VHDL(), name, netlist); }

  public DesignVHDL(VHDL vhdl, String name, Netlist netlist) {
    this.vhdl = vhdl;
    this.name = name;
    this.netlist = netlist;
  }

  public String render() {
    StringBuilder libraries = new StringBuilder();
    for (String library : libraries())
      libraries.append("library " + library + ";\n");
    return "library ieee;\n"
        + "use ieee.std_logic_1164.all;\n"
        + "use ieee.numeric_std.all;\n" + libraries + entity() + architecture();
  }

  /** Namespaces of qualified operations, in first-use order. */
  List<String> libraries() {
    return netlist.getNodes()
        .values()
        .stream()
        .filter(node -> node instanceof Node.Operation)
        .map(node -> ((Node.Operation<Integer>)node).getName())
        .filter(Name::isQualified)
        .map(Name::getNamespace)
        .distinct()
        .collect(Collectors.toList());
  }

  public String entity() {
    String tab = vhdl.tab;
    List<String> ports = new ArrayList<>();
    for (Port input : netlist.getInputs())
      ports.add(input.var().identifier() + " : in " + vhdl.SignalType(input.type()));
    for (DrivenPort<Integer> output : netlist.getOutputs())
      ports.add(output.var().identifier() + " : out " + vhdl.SignalType(output.type()));
    StringBuilder text = new StringBuilder("entity " + name + " is\n");
    if (!ports.isEmpty())
      text.append(tab + "port (\n" + tab + tab + String.join(";\n" + tab + tab, ports) + "\n" + tab + ");\n");
    text.append("end entity " + name + ";\n");
    return text.toString();
  }

  public String architecture() {
    StringBuilder declarations = new StringBuilder();
    StringBuilder body = new StringBuilder();
    for (Map.Entry<Integer, Node<Integer>> entry : netlist.getNodes().entrySet()) {
      int id = entry.getKey();
      Node<Integer> node = entry.getValue();
      for (Port output : node.getOutputs())
        declarations.append(vhdl.CreateDeclSig(signalName(id, output.var()), output.type()));
      body.append(statement(id, node));
    }
    for (DrivenPort<Integer> output : netlist.getOutputs())
      body.append(output.var().identifier() + " <= " + expression(output.driver(), output.type()) + ";\n");
    return "architecture rtl of " + name + " is\n" + vhdl.AlignText(vhdl.tab, declarations.toString()) + "begin\n"
        + vhdl.AlignText(vhdl.tab, body.toString()) + "end architecture rtl;\n";
  }

  public static String signalName(int id, Var port) { return "n" + id + "_" + port.identifier(); }

  /**
   * The VHDL expression for a driver read at the given type. Constants become literals of that width.
   */
  public String expression(Driver<Integer> driver, BaseType type) {
    if (driver instanceof Driver.NodeOutput) {
      Driver.NodeOutput<Integer> nodeOutput = (Driver.NodeOutput<Integer>)driver;
      return signalName(nodeOutput.getNode(), nodeOutput.getPort());
    }
    if (driver instanceof Driver.Constant)
      return vhdl.Literal(((Driver.Constant<Integer>)driver).getValue(), type.getWidth());
    return driver.padVar().map(Var::identifier).orElseThrow(() -> new IllegalArgumentException("Cannot render driver " + driver));
  }

  private String expression(DrivenPort<Integer> input) { return expression(input.driver(), input.type()); }

  String statement(int id, Node<Integer> node) {
    if (node instanceof Node.LookupTable)
      return table(id, (Node.LookupTable<Integer>)node);
    Node.Operation<Integer> operation = (Node.Operation<Integer>)node;
    if (operation.getName().isQualified() || operation.getOutputs().size() != 1)
      return instance(id, operation);
    List<DrivenPort<Integer>> in = operation.getInputs();
    Port out = operation.getOutputs().get(0);
    String target = signalName(id, out.var());
    switch (operation.getName().getBase()) {
    case "and2":
      return target + " <= " + expression(in.get(0)) + " and " + expression(in.get(1)) + ";\n";
    case "or2":
      return target + " <= " + expression(in.get(0)) + " or " + expression(in.get(1)) + ";\n";
    case "xor2":
      return target + " <= " + expression(in.get(0)) + " xor " + expression(in.get(1)) + ";\n";
    case "not":
      return target + " <= not " + expression(in.get(0)) + ";\n";
    case "add":
      return arithmetic(target, out.type(), "+", in);
    case "sub":
      return arithmetic(target, out.type(), "-", in);
    case "eq":
      return vhdl.CreateText1or0(target, expression(in.get(0)) + " = " + expression(in.get(1)));
    case "mux2":
      return target + " <= " + expression(in.get(1)) + " when " + expression(in.get(0)) + " = '1' else " + expression(in.get(2)) + ";\n";
    case "pack":
      return target + " <= " + in.stream().map(this::expression).collect(Collectors.joining(" & ")) + ";\n";
    case "slice":
      return slice(target, operation, in.get(0));
    case "register":
      return register(target, operation);
    default:
      return instance(id, operation);
    }
  }

  private String arithmetic(String target, BaseType type, String op, List<DrivenPort<Integer>> in) {
    if (type.getWidth() == 1)
      return target + " <= " + expression(in.get(0)) + " xor " + expression(in.get(1)) + ";\n";
    String cast = type.getKind() == BaseType.Kind.SIGNED ? "signed" : "unsigned";
    return target + " <= std_logic_vector(" + operand(cast, in.get(0)) + " " + op + " " + operand(cast, in.get(1)) + ");\n";
  }

  private String operand(String cast, DrivenPort<Integer> input) {
    if (input.driver() instanceof Driver.Constant)
      return cast + "'(" + expression(input) + ")";
    return cast + "(" + expression(input) + ")";
  }

  private String slice(String target, Node.Operation<Integer> operation, DrivenPort<Integer> source) {
    int hi = intMetadata(operation, Signals.HIGH);
    int lo = intMetadata(operation, Signals.LOW);
    if (source.driver() instanceof Driver.Constant) {
      long value = ((Driver.Constant<Integer>)source.driver()).getValue() >>> lo;
      return target + " <= " + vhdl.Literal(value, hi - lo + 1) + ";\n";
    }
    String base = expression(source);
    if (source.type().getWidth() == 1)
      return target + " <= " + base + ";\n";
    if (hi == lo)
      return target + " <= " + base + "(" + hi + ");\n";
    return target + " <= " + base + "(" + hi + " downto " + lo + ");\n";
  }

  private String register(String target, Node.Operation<Integer> operation) {
    List<DrivenPort<Integer>> in = operation.getInputs();
    BaseType type = operation.getOutputs().get(0).type();
    long init = operation.getMetadata(Signals.DEFAULT).map(meta -> ((Metadata.IntValue)meta).value()).orElse(0L);
    String body = "if " + expression(in.get(1)) + " = '1' then\n"
                  + vhdl.tab + target + " <= " + vhdl.Literal(init, type.getWidth()) + ";\n"
                  + "else\n"
                  + vhdl.tab + target + " <= " + expression(in.get(2)) + ";\n"
                  + "end if;\n";
    return vhdl.CreateInProc(true, expression(in.get(0)), body);
  }

  private String table(int id, Node.LookupTable<Integer> table) {
    Port out = table.getOutput();
    int inWidth = table.getInput().type().getWidth();
    int outWidth = out.type().getWidth();
    StringBuilder text = new StringBuilder("with " + expression(table.getInput()) + " select " + signalName(id, out.var()) + " <=\n");
    for (Node.TableCase tableCase : table.getCases())
      text.append(vhdl.tab + vhdl.Literal(tableCase.outPattern(), outWidth) + " when " + vhdl.Literal(tableCase.inPattern(), inWidth)
                  + ",\n");
    text.append(vhdl.tab + (outWidth == 1 ? "'0'" : "(others => '0')") + " when others;\n");
    return text.toString();
  }

  private String instance(int id, Node.Operation<Integer> operation) {
    logger.debug("Instantiating {} as an external entity", operation.getName());
    List<String> assigns = new ArrayList<>();
    for (DrivenPort<Integer> input : operation.getInputs())
      assigns.add(input.var().identifier() + " => " + expression(input));
    for (Port output : operation.getOutputs())
      assigns.add(output.var().identifier() + " => " + signalName(id, output.var()));
    Name opName = operation.getName();
    String library = opName.isQualified() ? opName.getNamespace() : "work";
    List<String> generics = new ArrayList<>();
    operation.getMetadata().forEach((key, meta) -> {
      String value = generic(meta);
      if (value != null)
        generics.add(key + " => " + value);
    });
    String genericMap = generics.isEmpty() ? "" : "generic map (\n" + vhdl.tab + String.join(",\n" + vhdl.tab, generics) + "\n)\n";
    return "inst_" + id + ": entity " + library + "." + opName.getBase() + "\n" + genericMap
        + "port map (\n" + vhdl.tab + String.join(",\n" + vhdl.tab, assigns) + "\n);\n";
  }

  /** The generic actual for a metadata value, null for opaque values. */
  private static String generic(Metadata meta) {
    if (meta instanceof Metadata.IntValue)
      return Long.toString(((Metadata.IntValue)meta).value());
    if (meta instanceof Metadata.Text)
      return "\"" + ((Metadata.Text)meta).value().replace("\"", "\"\"") + "\"";
    if (meta instanceof Metadata.Bits)
      return "\"" + ((Metadata.Bits)meta).value() + "\"";
    return null;
  }

  private static int intMetadata(Node.Operation<Integer> operation, String key) {
    Metadata meta = operation.getMetadata(key).orElseThrow(() -> new IllegalArgumentException(operation.getName() + " has no " + key));
    return (int)((Metadata.IntValue)meta).value();
  }
}
