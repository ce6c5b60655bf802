package netgen.netlist;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * A node of a netlist: either a named operation or a lookup table.
 * Traversal over node references works uniformly through {@link #map(Function)} and {@link #fold(Object, BiFunction)}, so code outside
 * this package never needs to distinguish the variants to walk a graph.
 *
 * @param <T> the type used to reference other nodes from the drivers of this node
 */
public abstract class Node<T> {
  private Node() {}

  public static <T> Operation<T> operation(Name name, List<Port> outputs, List<DrivenPort<T>> inputs) {
    return new Operation<>(name, outputs, inputs, Map.of());
  }
  public static <T> Operation<T> operation(Name name, List<Port> outputs, List<DrivenPort<T>> inputs, Map<String, Metadata> metadata) {
    return new Operation<>(name, outputs, inputs, metadata);
  }
  public static <T> LookupTable<T> table(Port output, DrivenPort<T> input, List<TableCase> cases) {
    return new LookupTable<>(output, input, cases);
  }

  /** Declared outputs in order. */
  public abstract List<Port> getOutputs();
  /** Declared inputs in order, each with its driver. */
  public abstract List<DrivenPort<T>> getInputs();

  /**
   * Maps every node reference embedded in this node's drivers, keeping all other structure.
   */
  public abstract <U> Node<U> map(Function<? super T, ? extends U> f);

  /**
   * Folds over every node reference of this node, in input order.
   */
  public <A> A fold(A init, BiFunction<A, ? super T, A> f) {
    A acc = init;
    for (DrivenPort<T> input : getInputs())
      acc = input.driver().fold(acc, f);
    return acc;
  }

  /** All referenced nodes in input order, duplicates included. */
  public List<T> references() {
    return fold(new ArrayList<T>(), (list, ref) -> {
      list.add(ref);
      return list;
    });
  }

  /** Type of the declared output with the given var. */
  public Optional<BaseType> outputType(Var var) {
    return getOutputs().stream().filter(port -> port.var().equals(var)).map(Port::type).findFirst();
  }

  public static final class Operation<T> extends Node<T> {
    private final Name name;
    private final List<Port> outputs;
    private final List<DrivenPort<T>> inputs;
    private final Map<String, Metadata> metadata;

    private Operation(Name name, List<Port> outputs, List<DrivenPort<T>> inputs, Map<String, Metadata> metadata) {
      this.name = Objects.requireNonNull(name);
      this.outputs = List.copyOf(outputs);
      this.inputs = List.copyOf(inputs);
      this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public Name getName() { return name; }
    public Map<String, Metadata> getMetadata() { return metadata; }
    public Optional<Metadata> getMetadata(String key) { return Optional.ofNullable(metadata.get(key)); }
    @Override
    public List<Port> getOutputs() {
      return outputs;
    }
    @Override
    public List<DrivenPort<T>> getInputs() {
      return inputs;
    }
    @Override
    public <U> Operation<U> map(Function<? super T, ? extends U> f) {
      return new Operation<U>(name, outputs, inputs.stream().map(input -> input.<U>map(f)).collect(Collectors.toList()), metadata);
    }
    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Operation))
        return false;
      Operation<?> other = (Operation<?>)obj;
      return name.equals(other.name) && outputs.equals(other.outputs) && inputs.equals(other.inputs) && metadata.equals(other.metadata);
    }
    @Override
    public int hashCode() {
      return Objects.hash(name, outputs, inputs, metadata);
    }
    @Override
    public String toString() {
      return name + outputs.stream().map(Port::toString).collect(Collectors.joining(", ", "(", ")"));
    }
  }

  public static final class LookupTable<T> extends Node<T> {
    private final Port output;
    private final DrivenPort<T> input;
    private final List<TableCase> cases;

    private LookupTable(Port output, DrivenPort<T> input, List<TableCase> cases) {
      this.output = Objects.requireNonNull(output);
      this.input = Objects.requireNonNull(input);
      this.cases = List.copyOf(cases);
    }

    public Port getOutput() { return output; }
    public DrivenPort<T> getInput() { return input; }
    /** The value mapping; exhaustiveness and disjointness are not checked. */
    public List<TableCase> getCases() { return cases; }
    @Override
    public List<Port> getOutputs() {
      return List.of(output);
    }
    @Override
    public List<DrivenPort<T>> getInputs() {
      return List.of(input);
    }
    @Override
    public <U> LookupTable<U> map(Function<? super T, ? extends U> f) {
      return new LookupTable<U>(output, input.map(f), cases);
    }
    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof LookupTable))
        return false;
      LookupTable<?> other = (LookupTable<?>)obj;
      return output.equals(other.output) && input.equals(other.input) && cases.equals(other.cases);
    }
    @Override
    public int hashCode() {
      return Objects.hash(output, input, cases);
    }
    @Override
    public String toString() {
      return "TABLE(" + output + ")";
    }
  }

  /**
   * One row of a lookup table: input pattern and its label, output pattern and its label.
   */
  public record TableCase(long inPattern, String inLabel, long outPattern, String outLabel) {}
}
