package netgen.netlist;

import netgen.NetGenException;

/**
 * Thrown when a driver does not resolve to an operation, a lookup table or a constant.
 */
public class ResolutionException extends NetGenException {
  private static final long serialVersionUID = 1L;

  private final String driver;

  public ResolutionException(String message, Driver<?> driver) {
    super(message + ": " + driver.render());
    this.driver = driver.render();
  }

  /** The offending driver, rendered. */
  public String getDriver() { return driver; }
}
