package netgen.ui;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class NetGenCmdTest {
  @TempDir Path tmp;

  @Test
  void testGeneratesCircuit() throws Exception {
    int code = NetGenCmd.run(new String[] {"-q", "-c", "decoder", "-o", tmp.toString()});
    Assertions.assertEquals(NetGenCmd.EXIT_OK, code);
    Assertions.assertTrue(Files.isRegularFile(tmp.resolve("decoder/decoder.vhd")));
    Assertions.assertTrue(Files.isRegularFile(tmp.resolve("decoder/decoder.do")));
    Assertions.assertFalse(Files.exists(tmp.resolve("decoder/decoder_netlist.yaml")));
  }

  @Test
  void testConfigFile() throws Exception {
    Path cfg = tmp.resolve("cfg.yaml");
    Files.writeString(cfg, "vector_count: 4\nwrite_netlist_yaml: true\noutput_names: [sum, carry]\n");
    int code = NetGenCmd.run(new String[] {"-q", "-c", "halfadder", "-o", tmp.toString(), "-f", cfg.toString(), "-d"});
    Assertions.assertEquals(NetGenCmd.EXIT_OK, code);
    Assertions.assertEquals(4, Files.readAllLines(tmp.resolve("halfadder/halfadder.input")).size());
    Assertions.assertTrue(Files.readString(tmp.resolve("halfadder/halfadder_netlist.yaml")).contains("carry"));
    Assertions.assertTrue(Files.readString(tmp.resolve("halfadder/halfadder_tb.vhd")).contains("carry => output(1)"));
  }

  @Test
  void testShapeErrorFails() throws Exception {
    Path cfg = tmp.resolve("cfg.yaml");
    Files.writeString(cfg, "output_names: [only_one]\n");
    Assertions.assertEquals(NetGenCmd.EXIT_FAILED, NetGenCmd.run(new String[] {"-q", "-c", "halfadder", "-o", tmp.toString(), "-f", cfg.toString()}));
  }

  @Test
  void testUsageErrors() {
    Assertions.assertEquals(NetGenCmd.EXIT_USAGE, NetGenCmd.run(new String[] {}));
    Assertions.assertEquals(NetGenCmd.EXIT_USAGE, NetGenCmd.run(new String[] {"-q", "-c", "nope"}));
    Assertions.assertEquals(NetGenCmd.EXIT_USAGE, NetGenCmd.run(new String[] {"-h", "-c", "mux"}));
    Assertions.assertEquals(NetGenCmd.EXIT_USAGE,
                            NetGenCmd.run(new String[] {"-q", "-c", "mux", "-f", tmp.resolve("missing.yaml").toString()}));
  }

  @ParameterizedTest
  @ValueSource(strings = {"seed: [unclosed\n", "vector_count: many\n", "vector_count: -1\n", "half_period_ns: 0\n",
                          "half_period_ns: -5\n", "no_such_key: 1\n"})
  void testInvalidConfig(String yaml) throws Exception {
    Path cfg = tmp.resolve("cfg.yaml");
    Files.writeString(cfg, yaml);
    Path out = tmp.resolve("out");
    Assertions.assertEquals(NetGenCmd.EXIT_USAGE,
                            NetGenCmd.run(new String[] {"-q", "-c", "halfadder", "-o", out.toString(), "-f", cfg.toString()}));
    Assertions.assertFalse(Files.exists(out));
  }
}
