package netgen.backend;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import netgen.netlist.Port;

/**
 * Partition of a flattened bus into contiguous per-port slices, in port order. Offset 0 is the leftmost bit of the bus and the most
 * significant bit of the first port.
 */
public class BusLayout {
  public record Slice(Port port, int offset, int width) {
    /** The slice as a VHDL name: one indexed bit for 1-bit ports, an ascending range otherwise. */
    public String range(String bus) {
      if (width == 1)
        return bus + "(" + offset + ")";
      return bus + "(" + offset + " to " + (offset + width - 1) + ")";
    }
  }

  private final String bus;
  private final List<Slice> slices;
  private final int width;

  private BusLayout(String bus, List<Slice> slices, int width) {
    this.bus = bus;
    this.slices = slices;
    this.width = width;
  }

  public static BusLayout of(String bus, List<Port> ports) {
    List<Slice> slices = new ArrayList<>();
    int offset = 0;
    for (Port port : ports) {
      int width = port.type().getWidth();
      slices.add(new Slice(port, offset, width));
      offset += width;
    }
    return new BusLayout(bus, List.copyOf(slices), offset);
  }

  public String getBus() { return bus; }
  public List<Slice> getSlices() { return slices; }
  /** Declared bus width: the sum of all port widths. */
  public int getWidth() { return width; }

  /** Port map associations like {@code i0 => input(0 to 3)}. */
  public List<String> associations() {
    return slices.stream().map(slice -> slice.port().var().identifier() + " => " + slice.range(bus)).collect(Collectors.toList());
  }
}
