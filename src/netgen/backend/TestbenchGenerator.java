package netgen.backend;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import netgen.netlist.Netlist;
import netgen.netlist.PortList;
import netgen.util.FileWriter;
import netgen.util.VHDL;

/**
 * Writes the simulation artifacts of one circuit into a directory: {@code <name>.vhd}, {@code <name>_tb.vhd}, {@code <name>.input}
 * and {@code <name>.do}.
 */
public class TestbenchGenerator {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final StimulusVectors vectors;
  private final int halfPeriodNs;

  public TestbenchGenerator() { this(new StimulusVectors(), 10); }

  public TestbenchGenerator(StimulusVectors vectors, int halfPeriodNs) {
    if (halfPeriodNs <= 0)
      throw new IllegalArgumentException("Half period must be positive, got " + halfPeriodNs + " ns");
    this.vectors = vectors;
    this.halfPeriodNs = halfPeriodNs;
  }

  /**
   * Renders all artifacts, then writes them. Nothing is written if rendering fails; a failing write leaves earlier files in place.
   *
   * @return the written files
   */
  public List<Path> generate(String name, Netlist netlist, Path outDir) throws UnsupportedStimulusTypeException, IOException {
    FileWriter toFile = new FileWriter(outDir.toString());
    render(name, netlist, toFile);
    return toFile.WriteFiles();
  }

  /**
   * Registers the content of every artifact with the writer without touching the file system.
   */
  public void render(String name, Netlist netlist, FileWriter toFile) throws UnsupportedStimulusTypeException {
    PortList ports = netlist.portList();
    // vectors first, so that an unsupported input type fails before anything is registered
    String input = vectors.generate(ports.getInputTypes());
    VHDL vhdl = new VHDL(toFile);
    logger.debug("Rendering {} with {} input bit(s) and {} output bit(s)", name, ports.getInputWidth(), ports.getOutputWidth());
    toFile.UpdateContent(name + ".vhd", new DesignVHDL(vhdl, name, netlist).render());
    toFile.UpdateContent(name + "_tb.vhd", new TestbenchVHDL(vhdl, name, ports, halfPeriodNs).render());
    toFile.UpdateContent(name + ".input", input);
    toFile.UpdateContent(name + ".do", SimScript.render(name));
    logger.debug("Rendered {}", toFile.GetFiles());
  }
}
