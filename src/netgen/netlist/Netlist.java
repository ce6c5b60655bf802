package netgen.netlist;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Result of reification: an immutable node table plus the primary inputs and outputs of the circuit.
 * Node ids are only meaningful within one instance.
 */
public class Netlist {
  private static final String BAR = "-".repeat(78) + "\n";

  private final Map<Integer, Node<Integer>> nodes;
  private final List<Port> inputs;
  private final List<DrivenPort<Integer>> outputs;

  public Netlist(Map<Integer, Node<Integer>> nodes, List<Port> inputs, List<DrivenPort<Integer>> outputs) {
    this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
    this.inputs = List.copyOf(inputs);
    this.outputs = List.copyOf(outputs);
  }

  /** Node table in discovery order. */
  public Map<Integer, Node<Integer>> getNodes() { return nodes; }
  public Optional<Node<Integer>> getNode(int id) { return Optional.ofNullable(nodes.get(id)); }
  /** Primary inputs, deduplicated, in first-discovery order. */
  public List<Port> getInputs() { return inputs; }
  /** Primary outputs in declaration order. */
  public List<DrivenPort<Integer>> getOutputs() { return outputs; }

  /** Ordered types of the primary inputs. */
  public List<BaseType> getInputTypes() { return inputs.stream().map(Port::type).collect(Collectors.toList()); }

  /**
   * Derives the port list used by the HDL backends.
   */
  public PortList portList() { return PortList.of(this); }

  /**
   * Returns an equivalent netlist whose node ids are 0..n-1 following the table order.
   */
  public Netlist renumber() {
    HashMap<Integer, Integer> newIds = new HashMap<>();
    for (Integer id : nodes.keySet())
      newIds.put(id, newIds.size());
    Function<Integer, Integer> rename = id -> {
      Integer newId = newIds.get(id);
      if (newId == null)
        throw new IllegalStateException("Reference to node " + id + " outside the node table");
      return newId;
    };
    LinkedHashMap<Integer, Node<Integer>> renumbered = new LinkedHashMap<>();
    nodes.forEach((id, node) -> renumbered.put(newIds.get(id), node.map(rename)));
    return new Netlist(renumbered, inputs, outputs.stream().map(output -> output.map(rename)).collect(Collectors.toList()));
  }

  /**
   * Verifies that every node reference points at a node of this table and at one of its declared outputs with a matching type.
   * @throws ResolutionException for the first dangling or mistyped reference
   */
  public void check() throws ResolutionException {
    for (Node<Integer> node : nodes.values()) {
      for (DrivenPort<Integer> input : node.getInputs())
        checkDriver(input.driver(), input.type(), id -> nodes.get(id));
    }
    for (DrivenPort<Integer> output : outputs)
      checkDriver(output.driver(), output.type(), id -> nodes.get(id));
  }

  /**
   * Checks one driver against a node lookup. Pads and constants always resolve.
   * @param driver the driver to check
   * @param expected the type of the consuming port
   * @param lookup node lookup; returns null for unknown ids
   * @throws ResolutionException if the referenced node or port does not exist or has another type
   */
  public static void checkDriver(Driver<Integer> driver, BaseType expected, Function<Integer, Node<Integer>> lookup)
      throws ResolutionException {
    if (!(driver instanceof Driver.NodeOutput))
      return;
    Driver.NodeOutput<Integer> nodeOutput = (Driver.NodeOutput<Integer>)driver;
    Node<Integer> node = lookup.apply(nodeOutput.getNode());
    if (node == null)
      throw new ResolutionException("Driver does not resolve to an operation or lookup table", driver);
    Optional<BaseType> declared = node.outputType(nodeOutput.getPort());
    if (declared.isEmpty())
      throw new ResolutionException("Driver refers to an output the node does not declare", driver);
    if (!declared.get().equals(expected))
      throw new ResolutionException("Driver type " + declared.get() + " does not match port type " + expected, driver);
  }

  /**
   * Renders inputs, outputs and every node with its ports, for diagnostics and snapshot testing.
   */
  public String dump() {
    StringBuilder text = new StringBuilder();
    text.append(BAR).append(header("Inputs")).append(BAR);
    for (Port input : inputs)
      text.append(input.var()).append(" : ").append(input.type()).append("\n");
    text.append(BAR).append(header("Outputs")).append(BAR);
    for (DrivenPort<Integer> output : outputs)
      text.append(output.var()).append(" <- ").append(showDriver(output.driver(), output.type())).append("\n");
    text.append(BAR).append(header("Entities")).append(BAR);
    nodes.forEach((id, node) -> text.append(showNode(id, node)).append("\n"));
    text.append(BAR);
    return text.toString();
  }

  private static String header(String title) { return String.format("-- %-73s--", title) + "\n"; }

  private static String showDriver(Driver<Integer> driver, BaseType type) { return driver.render() + ":" + type; }

  private static String showNode(int id, Node<Integer> node) {
    StringBuilder text = new StringBuilder();
    if (node instanceof Node.Operation) {
      Node.Operation<Integer> operation = (Node.Operation<Integer>)node;
      text.append("(").append(id).append(") ").append(operation.getName()).append("\n");
      for (Port output : operation.getOutputs())
        text.append("      out ").append(output.var()).append(":").append(output.type()).append("\n");
      for (DrivenPort<Integer> input : operation.getInputs())
        text.append("      in  ").append(input.var()).append(" <- ").append(showDriver(input.driver(), input.type())).append("\n");
      operation.getMetadata().forEach((key, value) -> text.append("      meta ").append(key).append(" = ").append(value).append("\n"));
    } else {
      Node.LookupTable<Integer> table = (Node.LookupTable<Integer>)node;
      text.append("(").append(id).append(") TABLE \n");
      text.append("      out ").append(table.getOutput().var()).append(":").append(table.getOutput().type()).append("\n");
      DrivenPort<Integer> input = table.getInput();
      text.append("      in  ").append(input.var()).append(" <- ").append(showDriver(input.driver(), input.type())).append("\n");
      for (Node.TableCase tableCase : table.getCases())
        text.append("      case ").append(tableCase.inLabel()).append(" -> ").append(tableCase.outLabel()).append("\n");
    }
    return text.toString();
  }

  @Override
  public String toString() {
    return "Netlist(" + nodes.size() + " nodes, inputs " + inputs + ", outputs " +
        outputs.stream().map(output -> output.var().toString()).collect(Collectors.toList()) + ")";
  }
}
