package netgen.backend;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import netgen.netlist.DrivenPort;
import netgen.netlist.Netlist;
import netgen.netlist.Node;
import netgen.netlist.Port;

/**
 * YAML export of a netlist: top-level keys {@code inputs}, {@code outputs} and {@code nodes}. Types and drivers are written in their
 * dump notation ({@code U 4}, {@code 3.o0}).
 */
public class NetlistYaml {
  private NetlistYaml() {}

  public static Map<String, Object> toMap(Netlist netlist) {
    Map<String, Object> root = new LinkedHashMap<>();
    List<Object> inputs = new ArrayList<>();
    for (Port input : netlist.getInputs())
      inputs.add(port(input));
    root.put("inputs", inputs);
    List<Object> outputs = new ArrayList<>();
    for (DrivenPort<Integer> output : netlist.getOutputs())
      outputs.add(drivenPort(output));
    root.put("outputs", outputs);
    List<Object> nodes = new ArrayList<>();
    netlist.getNodes().forEach((id, node) -> nodes.add(node(id, node)));
    root.put("nodes", nodes);
    return root;
  }

  public static String dump(Netlist netlist) {
    DumperOptions options = new DumperOptions();
    options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    return new Yaml(options).dump(toMap(netlist));
  }

  private static Map<String, Object> node(int id, Node<Integer> node) {
    Map<String, Object> entry = new LinkedHashMap<>();
    entry.put("id", id);
    if (node instanceof Node.LookupTable) {
      Node.LookupTable<Integer> table = (Node.LookupTable<Integer>)node;
      entry.put("kind", "table");
      entry.put("output", port(table.getOutput()));
      entry.put("input", drivenPort(table.getInput()));
      List<Object> cases = new ArrayList<>();
      for (Node.TableCase tableCase : table.getCases()) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("in", tableCase.inPattern());
        row.put("out", tableCase.outPattern());
        cases.add(row);
      }
      entry.put("cases", cases);
      return entry;
    }
    Node.Operation<Integer> operation = (Node.Operation<Integer>)node;
    entry.put("kind", "operation");
    entry.put("name", operation.getName().toString());
    List<Object> outputs = new ArrayList<>();
    for (Port output : operation.getOutputs())
      outputs.add(port(output));
    entry.put("outputs", outputs);
    List<Object> inputs = new ArrayList<>();
    for (DrivenPort<Integer> input : operation.getInputs())
      inputs.add(drivenPort(input));
    entry.put("inputs", inputs);
    if (!operation.getMetadata().isEmpty()) {
      Map<String, Object> metadata = new LinkedHashMap<>();
      operation.getMetadata().forEach((key, value) -> metadata.put(key, value.toString()));
      entry.put("metadata", metadata);
    }
    return entry;
  }

  private static Map<String, Object> port(Port port) {
    Map<String, Object> entry = new LinkedHashMap<>();
    entry.put("var", port.var().toString());
    entry.put("type", port.type().toString());
    return entry;
  }

  private static Map<String, Object> drivenPort(DrivenPort<Integer> port) {
    Map<String, Object> entry = port(port.port());
    entry.put("driver", port.driver().render());
    return entry;
  }
}
