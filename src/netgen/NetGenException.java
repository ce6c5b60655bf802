package netgen;

/**
 * Base of all domain errors raised while reifying a circuit or generating its artifacts.
 */
public class NetGenException extends Exception {
  private static final long serialVersionUID = 1L;

  public NetGenException(String message) { super(message); }
  public NetGenException(String message, Throwable cause) { super(message, cause); }
}
