package netgen.backend;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import netgen.examples.ExampleCircuits;
import netgen.netlist.BaseType;
import netgen.netlist.DrivenPort;
import netgen.netlist.Driver;
import netgen.netlist.Netlist;
import netgen.netlist.Port;
import netgen.netlist.Var;
import netgen.reify.CircuitBuilder;
import netgen.reify.Reifier;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TestbenchGeneratorTest {
  @TempDir Path tmp;

  static Netlist halfAdder() throws Exception {
    CircuitBuilder builder = new CircuitBuilder();
    return Reifier.reify(builder, ExampleCircuits.halfAdder(builder));
  }

  @Test
  void testWritesAllArtifacts() throws Exception {
    Path dir = tmp.resolve("halfadder");
    List<Path> written = new TestbenchGenerator().generate("halfadder", halfAdder(), dir);
    Assertions.assertEquals(List.of(dir.resolve("halfadder.vhd"), dir.resolve("halfadder_tb.vhd"), dir.resolve("halfadder.input"),
                                    dir.resolve("halfadder.do")),
                            written);
    for (Path file : written)
      Assertions.assertTrue(Files.isRegularFile(file), file.toString());

    List<String> vectors = Files.readAllLines(dir.resolve("halfadder.input"), StandardCharsets.UTF_8);
    Assertions.assertEquals(100, vectors.size());
    Assertions.assertTrue(vectors.stream().allMatch(line -> line.matches("[01]{2}")));

    String tb = Files.readString(dir.resolve("halfadder_tb.vhd"));
    Assertions.assertTrue(tb.contains("entity halfadder_tb is"));
    Assertions.assertTrue(tb.contains("i1 => input(1)"));
    Assertions.assertEquals(SimScript.render("halfadder"), Files.readString(dir.resolve("halfadder.do")));
  }

  @Test
  void testOutputIsReproducible() throws Exception {
    new TestbenchGenerator().generate("ha", halfAdder(), tmp.resolve("a"));
    new TestbenchGenerator().generate("ha", halfAdder(), tmp.resolve("b"));
    for (String file : List.of("ha.vhd", "ha_tb.vhd", "ha.input", "ha.do"))
      Assertions.assertEquals(Files.readString(tmp.resolve("a").resolve(file)), Files.readString(tmp.resolve("b").resolve(file)), file);
  }

  @Test
  void testConfiguredVectors() throws Exception {
    Path dir = tmp.resolve("small");
    new TestbenchGenerator(new StimulusVectors(9, 3), 4).generate("ha", halfAdder(), dir);
    Assertions.assertEquals(3, Files.readAllLines(dir.resolve("ha.input")).size());
    Assertions.assertTrue(Files.readString(dir.resolve("ha_tb.vhd")).contains("wait for 4 ns;"));
  }

  @Test
  void testRejectsNonPositiveHalfPeriod() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> new TestbenchGenerator(new StimulusVectors(), 0));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new TestbenchGenerator(new StimulusVectors(), -10));
  }

  @Test
  void testUnsupportedInputWritesNothing() {
    Netlist netlist = new Netlist(Map.of(), List.of(new Port(Var.named("t"), BaseType.TABLE)),
                                  List.of(new DrivenPort<>(Var.named("o0"), BaseType.BOOL, Driver.constant(0))));
    Path dir = tmp.resolve("bad");
    Assertions.assertThrows(UnsupportedStimulusTypeException.class, () -> new TestbenchGenerator().generate("bad", netlist, dir));
    Assertions.assertFalse(Files.exists(dir));
  }
}
