package netgen.ui;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import netgen.reify.ReifyOptions;

/**
 * Data-Class to hold tool options.
 */
public class NetGenConfig {

  /** Names for the circuit's arguments, in order; missing entries default to i0, i1, ... */
  public List<String> input_names = new ArrayList<>();
  /** Names for the circuit's results, in order; missing entries default to o0, o1, ... */
  public List<String> output_names = new ArrayList<>();
  public boolean debug_reify = false;

  public long seed = 0;
  public int vector_count = 100;
  public int half_period_ns = 10;

  public boolean write_netlist_yaml = false;

  /** Reification options; an empty name list keeps the default names. */
  public ReifyOptions toReifyOptions() {
    ReifyOptions options = ReifyOptions.defaults().withDebug(debug_reify);
    if (input_names != null && !input_names.isEmpty())
      options = options.withInputNames(input_names);
    if (output_names != null && !output_names.isEmpty())
      options = options.withOutputNames(output_names);
    return options;
  }

  /**
   * Reads a config from a YAML file. Keys not present in the file keep their defaults.
   */
  public static NetGenConfig load(File file) throws IOException {
    try (InputStream in = new FileInputStream(file)) {
      return load(in);
    }
  }

  /**
   * @throws org.yaml.snakeyaml.error.YAMLException if the document is malformed or has keys of the wrong type
   * @throws IllegalArgumentException if a value is out of range, see {@link #validate()}
   */
  public static NetGenConfig load(InputStream in) {
    Yaml yaml = new Yaml(new Constructor(NetGenConfig.class, new LoaderOptions()));
    NetGenConfig config = yaml.load(in);
    // an empty document yields null
    if (config == null)
      config = new NetGenConfig();
    config.validate();
    return config;
  }

  /**
   * Rejects values that cannot produce a usable testbench.
   * @throws IllegalArgumentException for a negative vector count or a half period below 1 ns
   */
  public void validate() {
    if (vector_count < 0)
      throw new IllegalArgumentException("vector_count must not be negative, got " + vector_count);
    if (half_period_ns <= 0)
      throw new IllegalArgumentException("half_period_ns must be positive, got " + half_period_ns);
  }
}
