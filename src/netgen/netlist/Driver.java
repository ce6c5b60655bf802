package netgen.netlist;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Describes what feeds a port: an output of another node, a primary input pad, or a literal.
 *
 * @param <T> the type used to reference nodes (an allocated id during and after reification)
 */
public abstract class Driver<T> {
  private Driver() {}

  public static <T> Driver<T> nodeOutput(T node, Var port) { return new NodeOutput<>(node, port); }
  public static <T> Driver<T> pad(Var var) { return new Pad<>(var); }
  public static <T> Driver<T> pathPad(List<Integer> path) { return new PathPad<>(path); }
  public static <T> Driver<T> constant(long value) { return new Constant<>(value); }

  /**
   * Replaces the node reference (if any) while keeping everything else.
   */
  public abstract <U> Driver<U> map(Function<? super T, ? extends U> f);

  /**
   * Folds over the node reference of this driver. Drivers without a node reference return acc unchanged.
   */
  public <A> A fold(A acc, BiFunction<A, ? super T, A> f) {
    return acc;
  }

  /** The referenced node, for {@link NodeOutput} drivers. */
  public Optional<T> reference() { return Optional.empty(); }

  /**
   * The pad this driver reads from, for {@link Pad} and {@link PathPad} drivers.
   */
  public Optional<Var> padVar() { return Optional.empty(); }

  /**
   * Renders the driver for diagnostics: {@code 3.o0}, {@code i0}, {@code <_1_2>} or a literal.
   */
  public abstract String render();

  @Override
  public String toString() {
    return render();
  }

  public static final class NodeOutput<T> extends Driver<T> {
    private final T node;
    private final Var port;
    private NodeOutput(T node, Var port) {
      this.node = Objects.requireNonNull(node);
      this.port = Objects.requireNonNull(port);
    }
    public T getNode() { return node; }
    public Var getPort() { return port; }
    @Override
    public <U> Driver<U> map(Function<? super T, ? extends U> f) {
      return new NodeOutput<U>(f.apply(node), port);
    }
    @Override
    public <A> A fold(A acc, BiFunction<A, ? super T, A> f) {
      return f.apply(acc, node);
    }
    @Override
    public Optional<T> reference() {
      return Optional.of(node);
    }
    @Override
    public String render() {
      return node + "." + port;
    }
    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof NodeOutput))
        return false;
      NodeOutput<?> other = (NodeOutput<?>)obj;
      return node.equals(other.node) && port.equals(other.port);
    }
    @Override
    public int hashCode() {
      return Objects.hash(node, port);
    }
  }

  public static final class Pad<T> extends Driver<T> {
    private final Var var;
    private Pad(Var var) { this.var = Objects.requireNonNull(var); }
    public Var getVar() { return var; }
    @SuppressWarnings("unchecked")
    @Override
    public <U> Driver<U> map(Function<? super T, ? extends U> f) {
      return (Driver<U>)this;
    }
    @Override
    public Optional<Var> padVar() {
      return Optional.of(var);
    }
    @Override
    public String render() {
      return var.toString();
    }
    @Override
    public boolean equals(Object obj) {
      return obj instanceof Pad && ((Pad<?>)obj).var.equals(var);
    }
    @Override
    public int hashCode() {
      return var.hashCode();
    }
  }

  public static final class PathPad<T> extends Driver<T> {
    private final List<Integer> path;
    private PathPad(List<Integer> path) { this.path = List.copyOf(path); }
    public List<Integer> getPath() { return path; }
    @SuppressWarnings("unchecked")
    @Override
    public <U> Driver<U> map(Function<? super T, ? extends U> f) {
      return (Driver<U>)this;
    }
    @Override
    public Optional<Var> padVar() {
      return Optional.of(Var.path(path));
    }
    @Override
    public String render() {
      return Var.path(path).toString();
    }
    @Override
    public boolean equals(Object obj) {
      return obj instanceof PathPad && ((PathPad<?>)obj).path.equals(path);
    }
    @Override
    public int hashCode() {
      return path.hashCode();
    }
  }

  public static final class Constant<T> extends Driver<T> {
    private final long value;
    private Constant(long value) { this.value = value; }
    public long getValue() { return value; }
    @SuppressWarnings("unchecked")
    @Override
    public <U> Driver<U> map(Function<? super T, ? extends U> f) {
      return (Driver<U>)this;
    }
    @Override
    public String render() {
      return Long.toString(value);
    }
    @Override
    public boolean equals(Object obj) {
      return obj instanceof Constant && ((Constant<?>)obj).value == value;
    }
    @Override
    public int hashCode() {
      return Long.hashCode(value);
    }
  }
}
