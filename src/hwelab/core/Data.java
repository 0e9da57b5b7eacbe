package hwelab.core;

import hwelab.ir.Width;
import java.util.List;

/**
 * Base of all hardware values: leaves ({@link Element}) and aggregates ({@link Record}).
 */
public abstract class Data {
  private Binding binding = Binding.UNBOUND;
  private int id = -1;
  private String name = null;

  public Binding getBinding() { return binding; }
  public boolean isBound() { return binding.isBound(); }

  /** Only called through {@link Binding#bind(Data, Binding)}. */
  void setBinding(Binding binding) {
    this.binding = binding;
    binding.getOwner().ifPresent(owner -> this.id = owner.nextId());
  }

  /** The id assigned by the owning elaboration, -1 if none. */
  public int getId() { return id; }

  /**
   * Assigns a signal name. Aggregates pass 'name.field' on to their fields.
   * @param name the name
   * @return this
   */
  public Data suggestName(String name) {
    this.name = name;
    return this;
  }

  public String getName() { return name; }

  /** The name used to refer to this node in the IR. */
  public String getRefName() {
    if (name != null)
      return name;
    if (id >= 0)
      return "_T_" + id;
    return "?";
  }

  /** The leaves of this value in construction order. */
  public abstract List<Element> flatten();

  /** A new, unbound value of the same shape and widths. */
  public abstract Data cloneType();

  /** The total width over all leaves. */
  public abstract Width getWidth();

  /** Type string such as UInt&lt;4&gt;. */
  public abstract String typeString();

  public boolean isLit() { return false; }

  @Override
  public String toString() {
    return typeString() + "(" + getRefName() + ")";
  }
}
