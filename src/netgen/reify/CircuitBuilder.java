package netgen.reify;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Optional;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import netgen.netlist.BaseType;
import netgen.netlist.DrivenPort;
import netgen.netlist.Driver;
import netgen.netlist.Node;
import netgen.netlist.Var;

/**
 * Allocation arena for one circuit under construction.
 *
 * Every primitive consults the allocation table with its {@link CallKey} before minting a node id, so a repeated call identity maps to
 * the same node. Primitives hand out {@link Signal}s holding a {@code NodeOutput} driver, never the node itself. A node may be
 * reserved before it is defined; referencing the reserved id from its own inputs ties a feedback loop.
 */
public class CircuitBuilder {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final HashMap<CallKey, Integer> allocation = new HashMap<>();
  private final HashMap<Integer, Node<Integer>> definitions = new HashMap<>();
  private int nextId = 0;

  /**
   * Returns the node id allocated for a call identity, minting a fresh one on first use.
   * @param key the call identity
   * @return the node id
   */
  public int allocate(CallKey key) {
    Integer id = allocation.get(key);
    if (id == null) {
      id = nextId++;
      allocation.put(key, id);
      logger.trace("Allocated node {} for {}", id, key.getLabel());
    }
    return id;
  }

  /**
   * Attaches a node to a previously allocated id. Redefining an id with an equal node is a no-op.
   * @throws IllegalArgumentException if the id was never allocated or the node references unallocated ids
   * @throws IllegalStateException if the id already carries a different node
   */
  public void define(int id, Node<Integer> node) {
    if (id < 0 || id >= nextId)
      throw new IllegalArgumentException("Node id " + id + " was not allocated by this builder");
    Node<Integer> existing = definitions.get(id);
    if (existing != null) {
      if (!existing.equals(node))
        throw new IllegalStateException("Node " + id + " is already defined as " + existing);
      return;
    }
    for (Integer ref : node.references()) {
      if (ref < 0 || ref >= nextId)
        throw new IllegalArgumentException("Node " + id + " references id " + ref + " that was not allocated by this builder");
    }
    definitions.put(id, node);
  }

  public boolean isDefined(int id) { return definitions.containsKey(id); }

  /**
   * Allocates (or reuses) the node for a call and defines it if it is new.
   * @return a signal for the first declared output of the node stored under that key
   */
  public Signal instantiate(CallKey key, Node<Integer> node) {
    if (node.getOutputs().isEmpty())
      throw new IllegalArgumentException("Cannot instantiate a node without outputs: " + node);
    int id = allocate(key);
    if (!isDefined(id))
      define(id, node);
    Node<Integer> actual = definitions.get(id);
    return output(id, actual.getOutputs().get(0).var());
  }

  /**
   * A signal for a named output of a defined node.
   */
  public Signal output(int id, Var port) {
    Node<Integer> node = definitions.get(id);
    if (node == null)
      throw new IllegalStateException("Node " + id + " is not defined yet");
    BaseType type =
        node.outputType(port).orElseThrow(() -> new IllegalArgumentException("Node " + id + " does not declare output " + port));
    return new Signal(this, type, Driver.nodeOutput(id, port));
  }

  /**
   * A signal for an output of a node that is allocated but possibly not yet defined. Used to close feedback loops.
   */
  public Signal forward(int id, Var port, BaseType type) {
    if (id < 0 || id >= nextId)
      throw new IllegalArgumentException("Node id " + id + " was not allocated by this builder");
    return new Signal(this, type, Driver.nodeOutput(id, port));
  }

  public Signal pad(Var var, BaseType type) { return new Signal(this, type, Driver.pad(var)); }

  public Signal pathPad(BaseType type, int... path) {
    return new Signal(this, type, Driver.pathPad(Arrays.stream(path).boxed().collect(Collectors.toList())));
  }

  public Signal constant(BaseType type, long value) { return new Signal(this, type, Driver.constant(value)); }

  /**
   * Binds a signal to a typed input port of a node under construction.
   * @throws IllegalArgumentException if the signal belongs to another builder
   */
  public DrivenPort<Integer> bind(Var var, Signal signal) {
    requireOwned(signal);
    return new DrivenPort<>(var, signal.getType(), signal.getDriver());
  }

  void requireOwned(Signal signal) {
    if (signal.getBuilder() != this)
      throw new IllegalArgumentException("Signal " + signal + " was created by another builder");
  }

  Optional<Node<Integer>> definition(int id) { return Optional.ofNullable(definitions.get(id)); }

  /** Number of ids allocated so far, including ones that are not reachable from any root. */
  public int getAllocatedCount() { return nextId; }
}
