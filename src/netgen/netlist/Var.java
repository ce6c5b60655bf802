package netgen.netlist;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Identifier of a port or pad. Either a chosen name, a numeric path generated to disambiguate a synthesized sharing point, or no
 * name at all.
 */
public abstract class Var {
  private Var() {}

  public static Var named(String name) { return new Named(name); }
  public static Var path(int... path) { return new Path(Arrays.stream(path).boxed().collect(Collectors.toList())); }
  public static Var path(List<Integer> path) { return new Path(path); }
  public static Var none() { return None.INSTANCE; }

  /**
   * Returns a form of this var that is a legal HDL identifier.
   */
  public abstract String identifier();

  public static final class Named extends Var {
    private final String name;
    private Named(String name) { this.name = Objects.requireNonNull(name); }
    public String getName() { return name; }
    @Override
    public String identifier() {
      return name;
    }
    @Override
    public boolean equals(Object obj) {
      return obj instanceof Named && ((Named)obj).name.equals(name);
    }
    @Override
    public int hashCode() {
      return name.hashCode();
    }
    @Override
    public String toString() {
      return name;
    }
  }

  public static final class Path extends Var {
    private final List<Integer> path;
    private Path(List<Integer> path) { this.path = List.copyOf(path); }
    public List<Integer> getPath() { return path; }
    @Override
    public String identifier() {
      return "pad" + path.stream().map(p -> "_" + p).collect(Collectors.joining());
    }
    @Override
    public boolean equals(Object obj) {
      return obj instanceof Path && ((Path)obj).path.equals(path);
    }
    @Override
    public int hashCode() {
      return 31 * path.hashCode() + 7;
    }
    @Override
    public String toString() {
      return "<" + path.stream().map(p -> "_" + p).collect(Collectors.joining()) + ">";
    }
  }

  public static final class None extends Var {
    private static final None INSTANCE = new None();
    private None() {}
    @Override
    public String identifier() {
      return "novar";
    }
    @Override
    public String toString() {
      return "NoVar";
    }
  }
}
