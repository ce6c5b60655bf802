package netgen.reify;

import java.util.List;
import java.util.Optional;

/**
 * Options of one reification call: explicit input and output pad names and the debug dump flag.
 * Without explicit names, inputs are called {@code i0, i1, ...} and outputs {@code o0, o1, ...}.
 */
public final class ReifyOptions {
  private static final ReifyOptions DEFAULTS = new ReifyOptions(null, null, false);

  private final List<String> inputNames;
  private final List<String> outputNames;
  private final boolean debug;

  private ReifyOptions(List<String> inputNames, List<String> outputNames, boolean debug) {
    this.inputNames = inputNames;
    this.outputNames = outputNames;
    this.debug = debug;
  }

  public static ReifyOptions defaults() { return DEFAULTS; }

  public ReifyOptions withInputNames(List<String> names) { return new ReifyOptions(List.copyOf(names), outputNames, debug); }
  public ReifyOptions withOutputNames(List<String> names) { return new ReifyOptions(inputNames, List.copyOf(names), debug); }
  public ReifyOptions withDebug(boolean debug) { return new ReifyOptions(inputNames, outputNames, debug); }

  /** Name of the input pad bound at the given position, or empty if an explicit name list is exhausted. */
  public Optional<String> inputName(int index) { return pick(inputNames, "i", index); }
  /** Name of the output at the given position, or empty if an explicit name list is exhausted. */
  public Optional<String> outputName(int index) { return pick(outputNames, "o", index); }

  public boolean isDebug() { return debug; }

  private static Optional<String> pick(List<String> names, String prefix, int index) {
    if (names == null)
      return Optional.of(prefix + index);
    return index < names.size() ? Optional.of(names.get(index)) : Optional.empty();
  }

  @Override
  public String toString() {
    return "ReifyOptions(inputs=" + (inputNames == null ? "default" : inputNames) +
        ", outputs=" + (outputNames == null ? "default" : outputNames) + ", debug=" + debug + ")";
  }
}
