package netgen.reify;

import java.util.Objects;

/**
 * Stable identity of one primitive call, used as key of the {@link CircuitBuilder} allocation table. Two calls presenting equal keys
 * share one node.
 */
public final class CallKey {
  private final Object token;
  private final String label;

  private CallKey(Object token, String label) {
    this.token = Objects.requireNonNull(token);
    this.label = label;
  }

  /**
   * A key equal only to itself.
   * @param label human-readable tag for log output
   */
  public static CallKey fresh(String label) { return new CallKey(new Object(), label); }

  /**
   * A key equal to every other key created from an equal token. Lets a combinator present the same identity on repeated evaluation.
   */
  public static CallKey of(Object token) { return new CallKey(token, String.valueOf(token)); }

  public String getLabel() { return label; }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof CallKey && ((CallKey)obj).token.equals(token);
  }
  @Override
  public int hashCode() {
    return token.hashCode();
  }
  @Override
  public String toString() {
    return "CallKey(" + label + ")";
  }
}
