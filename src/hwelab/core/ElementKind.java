package hwelab.core;

/** The closed set of leaf variants. */
public enum ElementKind {
  UINT("UInt"),
  SINT("SInt"),
  /** width-1 unsigned, literal values 0/1 */
  BOOL("Bool");

  public final String typeName;

  private ElementKind(String typeName) { this.typeName = typeName; }

  public boolean isNumeric() { return this != BOOL; }
}
