package netgen.netlist;

import java.util.Objects;

/**
 * Namespaced identifier of an operation kind. An empty namespace means the name is unqualified.
 */
public final class Name implements Comparable<Name> {
  private final String namespace;
  private final String base;

  public Name(String namespace, String base) {
    this.namespace = Objects.requireNonNull(namespace);
    this.base = Objects.requireNonNull(base);
  }

  /** Creates an unqualified name. */
  public static Name of(String base) { return new Name("", base); }

  public String getNamespace() { return namespace; }
  public String getBase() { return base; }
  public boolean isQualified() { return !namespace.isEmpty(); }

  @Override
  public int compareTo(Name other) {
    int cmp = namespace.compareTo(other.namespace);
    return cmp != 0 ? cmp : base.compareTo(other.base);
  }
  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    Name other = (Name)obj;
    return namespace.equals(other.namespace) && base.equals(other.base);
  }
  @Override
  public int hashCode() {
    return Objects.hash(namespace, base);
  }
  @Override
  public String toString() {
    return namespace.isEmpty() ? base : namespace + "::" + base;
  }
}
