package netgen.ui;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import netgen.reify.ReifyOptions;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.yaml.snakeyaml.error.YAMLException;

class NetGenConfigTest {
  @TempDir Path tmp;

  static NetGenConfig parse(String yaml) { return NetGenConfig.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8))); }

  @Test
  void testDefaults() {
    NetGenConfig cfg = new NetGenConfig();
    Assertions.assertEquals(0, cfg.seed);
    Assertions.assertEquals(100, cfg.vector_count);
    Assertions.assertEquals(10, cfg.half_period_ns);
    Assertions.assertFalse(cfg.write_netlist_yaml);
    ReifyOptions options = cfg.toReifyOptions();
    Assertions.assertEquals("i3", options.inputName(3).get());
    Assertions.assertEquals("o0", options.outputName(0).get());
    Assertions.assertFalse(options.isDebug());
  }

  @Test
  void testPartialFileKeepsDefaults() {
    NetGenConfig cfg = parse("seed: 7\nvector_count: 5\ninput_names: [a, b]\n");
    Assertions.assertEquals(7, cfg.seed);
    Assertions.assertEquals(5, cfg.vector_count);
    Assertions.assertEquals(10, cfg.half_period_ns);
    Assertions.assertEquals(List.of("a", "b"), cfg.input_names);
    ReifyOptions options = cfg.toReifyOptions();
    Assertions.assertEquals("b", options.inputName(1).get());
    Assertions.assertTrue(options.inputName(2).isEmpty());
    Assertions.assertEquals("o1", options.outputName(1).get());
  }

  @Test
  void testEmptyDocument() {
    Assertions.assertEquals(100, parse("").vector_count);
  }

  @Test
  void testLoadFile() throws Exception {
    Path file = tmp.resolve("cfg.yaml");
    Files.writeString(file, "debug_reify: true\nwrite_netlist_yaml: true\nhalf_period_ns: 3\n");
    NetGenConfig cfg = NetGenConfig.load(file.toFile());
    Assertions.assertTrue(cfg.write_netlist_yaml);
    Assertions.assertTrue(cfg.toReifyOptions().isDebug());
    Assertions.assertEquals(3, cfg.half_period_ns);
  }

  @Test
  void testRangeChecks() {
    Assertions.assertEquals(0, parse("vector_count: 0\n").vector_count);
    Assertions.assertThrows(IllegalArgumentException.class, () -> parse("vector_count: -1\n"));
    Assertions.assertThrows(IllegalArgumentException.class, () -> parse("half_period_ns: 0\n"));
    Assertions.assertThrows(YAMLException.class, () -> parse("seed: [unclosed\n"));
  }
}
