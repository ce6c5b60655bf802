package netgen.ui;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;
import org.yaml.snakeyaml.error.YAMLException;
import netgen.NetGen;
import netgen.NetGenException;
import netgen.examples.ExampleCircuits;
import netgen.netlist.Netlist;
import netgen.reify.Circuit;
import netgen.reify.CircuitBuilder;

public class NetGenCmd {
  // logging
  protected static Logger logger = LogManager.getLogger();

  public static final int EXIT_OK = 0;
  public static final int EXIT_FAILED = 1;
  public static final int EXIT_USAGE = -1;

  // object and function for help text generation
  private static HelpFormatter helper = new HelpFormatter();
  private static int printHelp(Options options) {
    helper.printHelp("netgencmd - reify an example circuit and generate its VHDL testbench", options);
    return EXIT_USAGE;
  }

  // entrypoint
  public static void main(String[] args) {
    // initialize logging
    // get builder to create new appender
    ConfigurationBuilder<BuiltConfiguration> builder = ConfigurationBuilderFactory.newConfigurationBuilder();
    // generate appender for stdout writing
    AppenderComponentBuilder appenderBuilder =
        builder.newAppender("Stdout", "CONSOLE").addAttribute("target", ConsoleAppender.Target.SYSTEM_OUT);
    // set printing layout
    appenderBuilder.add(builder.newLayout("PatternLayout").addAttribute("pattern", "%-5level: %msg%n%throwable"));
    // create the appender and root logger for the defined pattern
    builder.add(appenderBuilder);
    builder.add(builder.newRootLogger(Level.OFF).add(builder.newAppenderRef("Stdout")));
    // initialize logging and generate logger for current class
    Configurator.initialize(builder.build());
    logger = LogManager.getLogger();

    System.exit(run(args));
  }

  static Options createOptions() {
    Options options = new Options();
    options.addOption(Option.builder("c")
                          .longOpt("circuit")
                          .argName("circuit name")
                          .hasArg()
                          .required(true)
                          .desc("Example circuit to generate. Must be one of: " + ExampleCircuits.GetNames())
                          .build());
    options.addOption(Option.builder("o")
                          .longOpt("outdir")
                          .argName("directory")
                          .hasArg()
                          .required(false)
                          .desc("Directory to generate output-files in; a <circuit> subdirectory is created. Defaults to $"
                                + NetGen.SIM_PATH_ENV + " or the temporary directory")
                          .build());
    options.addOption(Option.builder("f")
                          .longOpt("config")
                          .argName("config.yaml")
                          .hasArg()
                          .required(false)
                          .desc("YAML-file with tool options (port names, seed, vector count, half period)")
                          .build());
    options.addOption(Option.builder("d").longOpt("dump").required(false).desc("Print the reified netlist").build());
    options.addOption(Option.builder("h").longOpt("help").required(false).desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Print debug information and enable -v").build());
    return options;
  }

  /**
   * Runs the tool without exiting the JVM.
   * @return the process exit code: 0 on success, 1 if generation failed, -1 on a usage error
   */
  static int run(String[] args) {
    Options options = createOptions();
    CommandLineParser parser = new DefaultParser();

    //////////   collect options   //////////
    String circuitName;
    Path baseDir;
    NetGenConfig cfg = new NetGenConfig();
    boolean dump;
    try {
      // parse the command line arguments
      CommandLine line = parser.parse(options, args);

      // print help if requested
      if (line.hasOption("h"))
        return printHelp(options);

      circuitName = line.getOptionValue("c");
      baseDir = line.hasOption("o") ? Paths.get(line.getOptionValue("o")) : NetGen.defaultBaseDir();
      dump = line.hasOption("d");
      if (line.hasOption("f"))
        cfg = NetGenConfig.load(new File(line.getOptionValue("f")));

      // set verbosity of printing
      Level logLvl = Level.INFO;
      if (line.hasOption("q"))
        logLvl = Level.OFF;
      if (line.hasOption("v"))
        logLvl = Level.DEBUG;
      if (line.hasOption("vv"))
        logLvl = Level.TRACE;
      Configurator.setAllLevels(LogManager.getRootLogger().getName(), logLvl);
    } catch (ParseException exp) {
      // parsing failed - raise error to user
      System.err.println(exp.getMessage());
      return printHelp(options);
    } catch (IOException e) {
      System.err.println("Cannot read config file: " + e.getMessage());
      return printHelp(options);
    } catch (YAMLException | IllegalArgumentException e) {
      System.err.println("Invalid config file: " + e.getMessage());
      return printHelp(options);
    }

    CircuitBuilder builder = new CircuitBuilder();
    Optional<Circuit> circuit = ExampleCircuits.Get(circuitName, builder);
    if (circuit.isEmpty()) {
      System.err.println("Unknown circuit " + circuitName);
      return printHelp(options);
    }

    //////////   reify and generate   //////////
    NetGen netgen = new NetGen();
    netgen.setConfig(cfg);
    try {
      Netlist netlist = netgen.reify(builder, circuit.get());
      if (dump)
        System.out.print(netlist.dump());
      List<Path> written = netgen.generate(circuitName, netlist, baseDir);
      logger.info("Generated {} file(s) for {}", written.size(), circuitName);
    } catch (NetGenException e) {
      logger.error("Generating {} failed: {}", circuitName, e.getMessage());
      return EXIT_FAILED;
    } catch (IOException e) {
      logger.error("Writing {} failed", circuitName, e);
      return EXIT_FAILED;
    }
    return EXIT_OK;
  }
}
