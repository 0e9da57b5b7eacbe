package hwelab.core;

import hwelab.ir.Width;
import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Leaf hardware value: an unsigned, signed or boolean bit vector with a width and an optional literal payload.
 * Created through {@link Elements} or as the result of an operator; never changes variant or width.
 */
public final class Element extends Data {
  private final ElementKind kind;
  private final Width width;
  /** Numeric literal value (signed for SINT), null if not a literal */
  private final BigInteger literal;

  Element(ElementKind kind, Width width, BigInteger literal) {
    if (kind == ElementKind.BOOL && !width.equals(Width.known(1)))
      throw new IllegalArgumentException("Bool must have width 1 (got " + width + ")");
    this.kind = kind;
    this.width = width;
    this.literal = literal;
  }

  public ElementKind getKind() { return kind; }

  @Override
  public Width getWidth() {
    return width;
  }

  @Override
  public boolean isLit() {
    return literal != null;
  }

  public Optional<BigInteger> getLitOption() { return Optional.ofNullable(literal); }

  /**
   * Returns the literal value.
   * Throws an IllegalStateException if this is not a literal.
   */
  public BigInteger getLitValue() {
    if (literal == null)
      throw new IllegalStateException(this + " is not a literal");
    return literal;
  }

  @Override
  public List<Element> flatten() {
    return List.of(this);
  }

  @Override
  public Element cloneType() {
    return new Element(kind, width, null);
  }

  /** A new unbound element of the same variant with another width; Bool is always width 1. */
  public Element cloneTypeWidth(Width w) {
    if (kind == ElementKind.BOOL)
      return new Element(kind, Width.known(1), null);
    return new Element(kind, w, null);
  }

  @Override
  public String typeString() {
    if (kind == ElementKind.BOOL)
      return kind.typeName;
    return kind.typeName + width;
  }

  @Override
  public String getRefName() {
    if (literal != null)
      return typeString() + "(" + literal + ")";
    return super.getRefName();
  }
}
