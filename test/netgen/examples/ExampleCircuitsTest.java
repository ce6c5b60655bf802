package netgen.examples;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import netgen.NetGen;
import netgen.netlist.BaseType;
import netgen.netlist.Netlist;
import netgen.netlist.PortList;
import netgen.reify.CircuitBuilder;
import netgen.reify.Reifier;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ExampleCircuitsTest {
  @TempDir Path tmp;

  static Netlist reify(String name) throws Exception {
    CircuitBuilder builder = new CircuitBuilder();
    return Reifier.reify(builder, ExampleCircuits.Get(name, builder).get());
  }

  @Test
  void testCatalog() {
    Assertions.assertEquals(List.of("halfadder", "fulladder", "counter", "mux", "decoder", "accumulator", "enabled"),
                            List.copyOf(ExampleCircuits.GetNames()));
    Assertions.assertTrue(ExampleCircuits.Get("nope", new CircuitBuilder()).isEmpty());
  }

  @ParameterizedTest
  @ValueSource(strings = {"halfadder", "fulladder", "counter", "mux", "decoder", "accumulator", "enabled"})
  void testEveryExampleGenerates(String name) throws Exception {
    Netlist netlist = reify(name);
    netlist.check();
    Assertions.assertFalse(netlist.getOutputs().isEmpty());
    CircuitBuilder builder = new CircuitBuilder();
    List<Path> written = new NetGen().generate(name, builder, ExampleCircuits.Get(name, builder).get(), tmp);
    Assertions.assertEquals(4, written.size());
    Assertions.assertTrue(Files.isRegularFile(tmp.resolve(name).resolve(name + "_tb.vhd")));
  }

  @Test
  void testFullAdderSharesPartialSum() throws Exception {
    Netlist netlist = reify("fulladder");
    Assertions.assertEquals(5, netlist.getNodes().size());
    Assertions.assertEquals(3, netlist.getOutputs().size());
    Assertions.assertEquals(3, netlist.getInputs().size());
  }

  @Test
  void testCounterPorts() throws Exception {
    PortList ports = reify("counter").portList();
    Assertions.assertEquals(List.of(BaseType.BOOL), ports.getInputTypes());
    Assertions.assertEquals(1, ports.getClockResets().size());
    Assertions.assertEquals(4, ports.getOutputWidth());
  }

  @Test
  void testMuxPorts() throws Exception {
    PortList ports = reify("mux").portList();
    Assertions.assertEquals(17, ports.getInputWidth());
    Assertions.assertEquals(8, ports.getOutputWidth());
  }
}
