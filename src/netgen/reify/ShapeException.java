package netgen.reify;

import netgen.NetGenException;

/**
 * Thrown when a circuit value lies outside the supported set of shapes. Always raised before any graph walk.
 */
public class ShapeException extends NetGenException {
  private static final long serialVersionUID = 1L;

  public ShapeException(String message) { super(message); }
}
