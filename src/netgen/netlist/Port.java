package netgen.netlist;

/**
 * A typed port without a driver: a node output or a primary input of a netlist.
 */
public record Port(Var var, BaseType type) {
  @Override
  public String toString() {
    return var + " : " + type;
  }
}
