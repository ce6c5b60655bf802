package netgen.reify;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import netgen.netlist.BaseType;

/**
 * A circuit value in one of the supported shapes: a single signal, a tuple of signals, a function from a signal to a circuit, or a
 * function from a clock and reset pair to a circuit. Functions nest arbitrarily.
 */
public abstract class Circuit {
  private Circuit() {}

  public static Circuit of(Signal signal) { return new Single(signal); }

  /** A tuple leaf. Only 2 to 4 elements are reifiable; other arities are rejected during extraction. */
  public static Circuit tuple(Signal... signals) { return new Tuple(Arrays.asList(signals)); }

  public static Circuit fn(BaseType argType, Function<Signal, Circuit> body) { return new Lambda(argType, body); }

  /** Curried two-argument function; consumes two input names. */
  public static Circuit fn(BaseType a, BaseType b, BiFunction<Signal, Signal, Circuit> body) {
    return fn(a, x -> fn(b, y -> body.apply(x, y)));
  }

  public interface Fn3 {
    Circuit apply(Signal a, Signal b, Signal c);
  }

  /** Curried three-argument function; consumes three input names. */
  public static Circuit fn(BaseType a, BaseType b, BaseType c, Fn3 body) {
    return fn(a, x -> fn(b, y -> fn(c, z -> body.apply(x, y, z))));
  }

  /** A function of a clock and a reset; both are bound to reserved pad names. */
  public static Circuit clocked(BiFunction<Signal, Signal, Circuit> body) { return new Clocked(body); }

  public static final class Single extends Circuit {
    private final Signal signal;
    private Single(Signal signal) { this.signal = signal; }
    public Signal getSignal() { return signal; }
  }

  public static final class Tuple extends Circuit {
    private final List<Signal> elements;
    private Tuple(List<Signal> elements) { this.elements = elements; }
    /** Elements in order; may contain nulls, which extraction rejects. */
    public List<Signal> getElements() { return elements; }
  }

  public static final class Lambda extends Circuit {
    private final BaseType argType;
    private final Function<Signal, Circuit> body;
    private Lambda(BaseType argType, Function<Signal, Circuit> body) {
      this.argType = Objects.requireNonNull(argType);
      this.body = Objects.requireNonNull(body);
    }
    public BaseType getArgType() { return argType; }
    public Function<Signal, Circuit> getBody() { return body; }
  }

  public static final class Clocked extends Circuit {
    private final BiFunction<Signal, Signal, Circuit> body;
    private Clocked(BiFunction<Signal, Signal, Circuit> body) { this.body = Objects.requireNonNull(body); }
    public BiFunction<Signal, Signal, Circuit> getBody() { return body; }
  }
}
