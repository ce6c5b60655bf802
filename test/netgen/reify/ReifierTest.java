package netgen.reify;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import netgen.backend.DesignVHDL;
import netgen.netlist.BaseType;
import netgen.netlist.DrivenPort;
import netgen.netlist.Driver;
import netgen.netlist.Netlist;
import netgen.netlist.Node;
import netgen.netlist.Port;
import netgen.netlist.ResolutionException;
import netgen.netlist.Var;
import netgen.signal.Signals;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ReifierTest {
  static final BaseType U4 = BaseType.unsigned(4);

  static long referencesTo(Netlist netlist, int id) {
    return netlist.getNodes().values().stream().flatMap(node -> node.references().stream()).filter(ref -> ref == id).count();
  }

  @Test
  void testSharing() throws Exception {
    CircuitBuilder builder = new CircuitBuilder();
    Circuit circuit = Circuit.fn(U4, U4, (a, b) -> {
      Signal sum = Signals.add(a, b);
      return Circuit.tuple(Signals.xor2(sum, a), Signals.and2(sum, b));
    });
    Netlist netlist = Reifier.reify(builder, circuit);
    Assertions.assertEquals(3, netlist.getNodes().size());
    List<Integer> adders = netlist.getNodes()
                               .entrySet()
                               .stream()
                               .filter(entry -> ((Node.Operation<Integer>)entry.getValue()).getName().equals(Signals.ADD))
                               .map(entry -> entry.getKey())
                               .collect(Collectors.toList());
    Assertions.assertEquals(1, adders.size());
    Assertions.assertEquals(2, referencesTo(netlist, adders.get(0)));
    netlist.check();
  }

  @Test
  void testPathPadBecomesInput() throws Exception {
    CircuitBuilder builder = new CircuitBuilder();
    Circuit circuit = Circuit.fn(BaseType.BOOL, a -> Circuit.of(Signals.and2(a, builder.pathPad(BaseType.BOOL, 1, 2))));
    Netlist netlist = Reifier.reify(builder, circuit);
    Assertions.assertEquals(List.of(new Port(Var.named("i0"), BaseType.BOOL), new Port(Var.path(1, 2), BaseType.BOOL)),
                            netlist.getInputs());
    Assertions.assertEquals(Driver.pathPad(List.of(1, 2)), netlist.getNode(0).get().getInputs().get(1).driver());
    netlist.check();

    String text = new DesignVHDL("p", netlist).render();
    Assertions.assertTrue(text.contains("pad_1_2 : in std_logic"), text);
    Assertions.assertTrue(text.contains("n0_o0 <= i0 and pad_1_2;\n"), text);
  }

  @Test
  void testFeedbackLoopTerminates() throws Exception {
    CircuitBuilder builder = new CircuitBuilder();
    Circuit circuit = Circuit.clocked((clk, rst) -> Circuit.of(Signals.register(clk, rst, 0, U4, q -> Signals.add(q, builder.constant(U4, 1)))));
    Netlist netlist = Reifier.reify(builder, circuit);
    Assertions.assertEquals(2, netlist.getNodes().size());
    // register first, its next-state adder second, and the adder reads the register
    Assertions.assertEquals(List.of(1), netlist.getNode(0).get().references());
    Assertions.assertEquals(List.of(0), netlist.getNode(1).get().references());
    Assertions.assertEquals(List.of(new Port(Var.named("clk"), BaseType.CLOCK), new Port(Var.named("rst"), BaseType.RESET)),
                            netlist.getInputs());
    netlist.check();
  }

  @Test
  void testInputDedupAndOrder() throws Exception {
    CircuitBuilder builder = new CircuitBuilder();
    Circuit circuit = Circuit.fn(U4, U4, (a, b) -> Circuit.of(Signals.add(b, Signals.add(a, b))));
    Netlist netlist = Reifier.reify(builder, circuit);
    // i1 is read first by the outer adder
    Assertions.assertEquals(List.of(new Port(Var.named("i1"), U4), new Port(Var.named("i0"), U4)), netlist.getInputs());
  }

  @Test
  void testSameInputTwice() throws Exception {
    CircuitBuilder builder = new CircuitBuilder();
    Netlist netlist = Reifier.reify(builder, Circuit.fn(U4, a -> Circuit.of(Signals.add(a, a))));
    Assertions.assertEquals(List.of(new Port(Var.named("i0"), U4)), netlist.getInputs());
  }

  @Test
  void testWrapperFlattening() throws Exception {
    CircuitBuilder builder = new CircuitBuilder();
    Signal[] elements = new Signal[3];
    Circuit circuit = Circuit.fn(BaseType.BOOL, BaseType.BOOL, (a, b) -> {
      elements[0] = Signals.xor2(a, b);
      elements[1] = Signals.and2(a, b);
      elements[2] = Signals.or2(a, b);
      return Circuit.tuple(elements);
    });
    Netlist netlist = Reifier.reify(builder, circuit);
    Assertions.assertEquals(3, netlist.getNodes().size());
    Assertions.assertTrue(netlist.getNodes().values().stream().noneMatch(
        node -> ((Node.Operation<Integer>)node).getName().equals(PortExtractor.TOP)));
    List<DrivenPort<Integer>> outputs = netlist.getOutputs();
    Assertions.assertEquals(List.of(Var.named("o0"), Var.named("o1"), Var.named("o2")),
                            outputs.stream().map(DrivenPort::var).collect(Collectors.toList()));
    // outputs keep the element order
    List<String> names = outputs.stream()
                             .map(output -> netlist.getNode(output.driver().reference().get()).get())
                             .map(node -> ((Node.Operation<Integer>)node).getName().getBase())
                             .collect(Collectors.toList());
    Assertions.assertEquals(List.of("xor2", "and2", "or2"), names);
    Assertions.assertTrue(outputs.stream().allMatch(output -> output.type().equals(BaseType.BOOL)));
  }

  @Test
  void testConstantResult() throws Exception {
    CircuitBuilder builder = new CircuitBuilder();
    Netlist netlist = Reifier.reify(builder, Circuit.of(builder.constant(U4, 5)));
    Assertions.assertTrue(netlist.getNodes().isEmpty());
    Assertions.assertTrue(netlist.getInputs().isEmpty());
    Assertions.assertEquals(List.of(new DrivenPort<Integer>(Var.named("o0"), U4, Driver.constant(5))), netlist.getOutputs());
  }

  @Test
  void testBarePadResult() {
    CircuitBuilder builder = new CircuitBuilder();
    ResolutionException e =
        Assertions.assertThrows(ResolutionException.class, () -> Reifier.reify(builder, Circuit.fn(U4, a -> Circuit.of(a))));
    Assertions.assertEquals("i0", e.getDriver());
  }

  @Test
  void testReservedButUndefinedNode() {
    CircuitBuilder builder = new CircuitBuilder();
    int id = builder.allocate(CallKey.fresh("never"));
    Signal ghost = builder.forward(id, Var.named("o0"), U4);
    Assertions.assertThrows(ResolutionException.class, () -> Reifier.reify(builder, Circuit.of(ghost)));
    Assertions.assertThrows(ResolutionException.class,
                            () -> Reifier.reify(builder, Circuit.of(Signals.add(ghost, builder.constant(U4, 1)))));
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 5, 6})
  void testUnsupportedTupleArity(int arity) {
    CircuitBuilder builder = new CircuitBuilder();
    Signal[] elements = Collections.nCopies(arity, builder.constant(BaseType.BOOL, 1)).toArray(new Signal[0]);
    Assertions.assertThrows(ShapeException.class, () -> Reifier.reify(builder, Circuit.tuple(elements)));
  }

  @Test
  void testMissingTupleElement() {
    CircuitBuilder builder = new CircuitBuilder();
    Assertions.assertThrows(ShapeException.class, () -> Reifier.reify(builder, Circuit.tuple(builder.constant(U4, 1), null)));
    Assertions.assertThrows(ShapeException.class, () -> Reifier.reify(builder, Circuit.fn(U4, a -> null)));
  }

  @Test
  void testForeignBuilder() {
    CircuitBuilder builder = new CircuitBuilder();
    CircuitBuilder other = new CircuitBuilder();
    Assertions.assertThrows(ShapeException.class, () -> Reifier.reify(builder, Circuit.of(other.constant(U4, 1))));
  }

  @Test
  void testNamedPorts() throws Exception {
    CircuitBuilder builder = new CircuitBuilder();
    ReifyOptions options = ReifyOptions.defaults().withInputNames(List.of("a", "b")).withOutputNames(List.of("sum", "carry"));
    Netlist netlist = Reifier.reify(
        builder, Circuit.fn(BaseType.BOOL, BaseType.BOOL, (a, b) -> Circuit.tuple(Signals.xor2(a, b), Signals.and2(a, b))), options);
    Assertions.assertEquals(List.of(Var.named("a"), Var.named("b")),
                            netlist.getInputs().stream().map(Port::var).collect(Collectors.toList()));
    Assertions.assertEquals(List.of(Var.named("sum"), Var.named("carry")),
                            netlist.getOutputs().stream().map(DrivenPort::var).collect(Collectors.toList()));
  }

  @Test
  void testExhaustedNames() {
    Circuit adder = Circuit.fn(U4, U4, (a, b) -> Circuit.of(Signals.add(a, b)));
    Assertions.assertThrows(ShapeException.class,
                            () -> Reifier.reify(new CircuitBuilder(), adder, ReifyOptions.defaults().withInputNames(List.of("a"))));

    CircuitBuilder builder = new CircuitBuilder();
    Circuit pair = Circuit.tuple(builder.constant(U4, 1), builder.constant(U4, 2));
    Assertions.assertThrows(ShapeException.class,
                            () -> Reifier.reify(builder, pair, ReifyOptions.defaults().withOutputNames(Arrays.asList("x"))));
  }

  @Test
  void testNestedClockDomains() throws Exception {
    CircuitBuilder builder = new CircuitBuilder();
    Circuit circuit = Circuit.clocked(
        (clk, rst)
            -> Circuit.clocked((clk1, rst1)
                                   -> Circuit.fn(U4, x -> Circuit.of(Signals.delay(clk1, rst1, 0, Signals.delay(clk, rst, 0, x))))));
    Netlist netlist = Reifier.reify(builder, circuit);
    List<String> names = netlist.getInputs().stream().map(port -> port.var().identifier()).collect(Collectors.toList());
    Assertions.assertEquals(List.of("clk1", "rst1", "clk", "rst", "i0"), names);
    Assertions.assertEquals(2, netlist.portList().getClockResets().size());
  }

  @Test
  void testUnreachableNodesAreDropped() throws Exception {
    CircuitBuilder builder = new CircuitBuilder();
    Netlist netlist = Reifier.reify(builder, Circuit.fn(U4, U4, (a, b) -> {
      Signals.sub(a, b);
      return Circuit.of(Signals.add(a, b));
    }));
    Assertions.assertEquals(1, netlist.getNodes().size());
    Assertions.assertEquals(2, builder.getAllocatedCount());
  }
}
