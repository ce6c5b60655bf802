package netgen.reify;

import java.util.Objects;
import netgen.netlist.BaseType;
import netgen.netlist.Driver;

/**
 * A typed value inside a circuit under construction. It only carries a lightweight handle (the driver) into the builder that owns it.
 */
public final class Signal {
  private final CircuitBuilder builder;
  private final BaseType type;
  private final Driver<Integer> driver;

  Signal(CircuitBuilder builder, BaseType type, Driver<Integer> driver) {
    this.builder = Objects.requireNonNull(builder);
    this.type = Objects.requireNonNull(type);
    this.driver = Objects.requireNonNull(driver);
  }

  public CircuitBuilder getBuilder() { return builder; }
  public BaseType getType() { return type; }
  public Driver<Integer> getDriver() { return driver; }

  @Override
  public String toString() {
    return driver.render() + ":" + type;
  }
}
