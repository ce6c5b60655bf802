package netgen;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import netgen.backend.NetlistYaml;
import netgen.backend.StimulusVectors;
import netgen.backend.TestbenchGenerator;
import netgen.netlist.Netlist;
import netgen.netlist.ResolutionException;
import netgen.reify.Circuit;
import netgen.reify.CircuitBuilder;
import netgen.reify.Reifier;
import netgen.reify.ShapeException;
import netgen.ui.NetGenConfig;
import netgen.util.FileWriter;

/**
 * Entry point for library use: reifies a circuit and writes its simulation artifacts according to a {@link NetGenConfig}.
 */
public class NetGen {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Environment variable naming the default base directory for generated files. */
  public static final String SIM_PATH_ENV = "NETGEN_SIM_PATH";

  private NetGenConfig cfg = new NetGenConfig();

  public void setConfig(NetGenConfig cfg) { this.cfg = cfg; }
  public NetGenConfig getConfig() { return cfg; }

  public Netlist reify(CircuitBuilder builder, Circuit circuit) throws ShapeException, ResolutionException {
    return Reifier.reify(builder, circuit, cfg.toReifyOptions());
  }

  /**
   * Reifies the circuit and writes all artifacts into {@code <baseDir>/<name>}.
   *
   * @return the written files
   * @throws NetGenException if the circuit cannot be reified or has inputs without a stimulus rule
   * @throws IOException if writing fails
   */
  public List<Path> generate(String name, CircuitBuilder builder, Circuit circuit, Path baseDir) throws NetGenException, IOException {
    Netlist netlist = reify(builder, circuit);
    logger.info("Reified {}: {} node(s), {} input(s), {} output(s)", name, netlist.getNodes().size(), netlist.getInputs().size(),
                netlist.getOutputs().size());
    return generate(name, netlist, baseDir);
  }

  /**
   * Writes all artifacts of an already reified netlist into {@code <baseDir>/<name>}.
   */
  public List<Path> generate(String name, Netlist netlist, Path baseDir) throws NetGenException, IOException {
    Path outDir = baseDir.resolve(name);
    FileWriter toFile = new FileWriter(outDir.toString());
    new TestbenchGenerator(new StimulusVectors(cfg.seed, cfg.vector_count), cfg.half_period_ns).render(name, netlist, toFile);
    if (cfg.write_netlist_yaml)
      toFile.UpdateContent(name + "_netlist.yaml", NetlistYaml.dump(netlist));
    return toFile.WriteFiles();
  }

  /** {@value #SIM_PATH_ENV} if set, else the system temporary directory. */
  public static Path defaultBaseDir() {
    String simPath = System.getenv(SIM_PATH_ENV);
    if (simPath != null && !simPath.isEmpty())
      return Paths.get(simPath);
    return Paths.get(System.getProperty("java.io.tmpdir"));
  }
}
