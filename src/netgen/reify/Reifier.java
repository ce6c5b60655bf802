package netgen.reify;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import netgen.netlist.BaseType;
import netgen.netlist.DrivenPort;
import netgen.netlist.Driver;
import netgen.netlist.Netlist;
import netgen.netlist.Node;
import netgen.netlist.Port;
import netgen.netlist.ResolutionException;
import netgen.netlist.Var;

/**
 * Turns a circuit into an explicit {@link Netlist}, preserving sharing exactly.
 *
 * Starting at the circuit outputs, one depth-first walk visits every reachable node id once; an id that was already visited is a
 * terminal, which makes feedback loops finite. The table is produced in discovery order and renumbered densely.
 */
public class Reifier {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private Reifier() {}

  public static Netlist reify(CircuitBuilder builder, Circuit circuit) throws ShapeException, ResolutionException {
    return reify(builder, circuit, ReifyOptions.defaults());
  }

  /**
   * Reifies a circuit.
   * @param builder the builder that created every signal of the circuit
   * @param circuit the circuit value
   * @param options input/output names and debug flag
   * @return the netlist
   * @throws ShapeException if the circuit shape is unsupported or the name lists are too short
   * @throws ResolutionException if a driver does not resolve to a node, or the result is a bare input pad
   */
  public static Netlist reify(CircuitBuilder builder, Circuit circuit, ReifyOptions options) throws ShapeException, ResolutionException {
    PortExtractor.Extraction result = PortExtractor.extract(builder, circuit, options);
    List<String> outputNames = new ArrayList<>();
    for (int i = 0; i < result.arity(); ++i) {
      int supplied = i;
      outputNames.add(options.outputName(i).orElseThrow(
          () -> new ShapeException("Circuit has " + result.arity() + " outputs but only " + supplied + " output name(s) were supplied")));
    }

    Driver<Integer> root = result.driver();
    Netlist netlist;
    if (root instanceof Driver.Constant) {
      netlist = new Netlist(Map.of(), List.of(), List.of(new DrivenPort<>(Var.named(outputNames.get(0)), result.type(), root)));
    } else if (root instanceof Driver.NodeOutput) {
      int rootId = ((Driver.NodeOutput<Integer>)root).getNode();
      Node<Integer> rootNode =
          builder.definition(rootId).orElseThrow(() -> new ResolutionException("Circuit result does not resolve to a node", root));
      List<DrivenPort<Integer>> outputs = new ArrayList<>();
      if (isTopWrapper(rootNode)) {
        List<DrivenPort<Integer>> elements = rootNode.getInputs();
        for (int i = 0; i < elements.size(); ++i)
          outputs.add(new DrivenPort<>(Var.named(outputNames.get(i)), elements.get(i).type(), elements.get(i).driver()));
      } else {
        outputs.add(new DrivenPort<>(Var.named(outputNames.get(0)), result.type(), root));
      }
      Map<Integer, Node<Integer>> table = walk(builder, outputs);
      netlist = new Netlist(table, collectInputs(table, outputs), outputs).renumber();
    } else {
      throw new ResolutionException("Circuit result does not resolve to an operation, lookup table or constant", root);
    }

    logger.debug("Reified circuit with {} node(s) ({} allocated), {} input(s), {} output(s)", netlist.getNodes().size(),
                 builder.getAllocatedCount(), netlist.getInputs().size(), netlist.getOutputs().size());
    if (options.isDebug())
      logger.info("Reified circuit\n{}", netlist.dump());
    return netlist;
  }

  /**
   * Depth-first walk from the given consumers. Visits each node id once, in pre-order, and checks every node reference on the way.
   */
  static Map<Integer, Node<Integer>> walk(CircuitBuilder builder, List<DrivenPort<Integer>> roots) throws ResolutionException {
    LinkedHashMap<Integer, Node<Integer>> table = new LinkedHashMap<>();
    Deque<DrivenPort<Integer>> stack = new ArrayDeque<>();
    for (int i = roots.size() - 1; i >= 0; --i)
      stack.push(roots.get(i));
    while (!stack.isEmpty()) {
      DrivenPort<Integer> consumer = stack.pop();
      Driver<Integer> driver = consumer.driver();
      if (driver.reference().isEmpty())
        continue;
      int id = driver.reference().get();
      final Node<Integer> node = builder.definition(id).orElse(null);
      if (node == null)
        throw new ResolutionException("Driver refers to a node that was reserved but never defined", driver);
      if (isTopWrapper(node))
        throw new ResolutionException("Driver refers to a result wrapper", driver);
      Netlist.checkDriver(driver, consumer.type(), ref -> node);
      if (table.containsKey(id))
        continue;
      logger.trace("Visiting node {}", id);
      table.put(id, node);
      List<DrivenPort<Integer>> inputs = node.getInputs();
      for (int i = inputs.size() - 1; i >= 0; --i)
        stack.push(inputs.get(i));
    }
    return table;
  }

  /**
   * Collects every pad read by a retained node or an output, first discovery wins.
   */
  static List<Port> collectInputs(Map<Integer, Node<Integer>> table, List<DrivenPort<Integer>> outputs) {
    LinkedHashMap<Var, BaseType> found = new LinkedHashMap<>();
    List<DrivenPort<Integer>> consumers = new ArrayList<>();
    table.values().forEach(node -> consumers.addAll(node.getInputs()));
    consumers.addAll(outputs);
    for (DrivenPort<Integer> consumer : consumers) {
      consumer.driver().padVar().ifPresent(var -> {
        BaseType known = found.putIfAbsent(var, consumer.type());
        if (known != null && !known.equals(consumer.type()))
          logger.warn("Pad {} is read as {} and as {}; keeping {}", var, known, consumer.type(), known);
      });
    }
    return found.entrySet().stream().map(entry -> new Port(entry.getKey(), entry.getValue())).collect(Collectors.toList());
  }

  private static boolean isTopWrapper(Node<Integer> node) {
    return node instanceof Node.Operation && ((Node.Operation<Integer>)node).getName().equals(PortExtractor.TOP);
  }
}
