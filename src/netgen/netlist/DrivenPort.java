package netgen.netlist;

import java.util.function.Function;

/**
 * A typed port together with the driver feeding it: a node input or a primary output of a netlist.
 */
public record DrivenPort<T>(Var var, BaseType type, Driver<T> driver) {
  public <U> DrivenPort<U> map(Function<? super T, ? extends U> f) {
    return new DrivenPort<U>(var, type, driver.map(f));
  }

  /** Strips the driver. */
  public Port port() { return new Port(var, type); }
}
