package netgen.backend;

import netgen.NetGenException;
import netgen.netlist.BaseType;

/** Thrown when an input port has a type for which no random stimulus can be drawn. */
public class UnsupportedStimulusTypeException extends NetGenException {
  private static final long serialVersionUID = 1L;

  private final BaseType type;

  public UnsupportedStimulusTypeException(BaseType type) {
    super("No stimulus rule for input type " + type);
    this.type = type;
  }

  public BaseType getType() { return type; }
}
