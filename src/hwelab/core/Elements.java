package hwelab.core;

import hwelab.ir.Width;
import hwelab.util.BitMath;
import java.math.BigInteger;

/**
 * Factories for leaf types and literals.
 * Types are unbound until declared as port, wire or register; literals are bound on creation.
 */
public class Elements {

  /** UInt type with inferred width. */
  public static Element uint() { return new Element(ElementKind.UINT, Width.unknown(), null); }
  /** UInt type with fixed width. */
  public static Element uint(int width) { return uint(Width.known(width)); }
  public static Element uint(Width width) { return new Element(ElementKind.UINT, width, null); }

  /** SInt type with inferred width. */
  public static Element sint() { return new Element(ElementKind.SINT, Width.unknown(), null); }
  public static Element sint(int width) { return sint(Width.known(width)); }
  public static Element sint(Width width) { return new Element(ElementKind.SINT, width, null); }

  public static Element bool() { return new Element(ElementKind.BOOL, Width.known(1), null); }

  /** UInt literal; the width is the minimal one for the value. */
  public static Element uintLit(long value) { return uintLit(BigInteger.valueOf(value), Width.unknown()); }
  public static Element uintLit(long value, int width) { return uintLit(BigInteger.valueOf(value), Width.known(width)); }
  public static Element uintLit(BigInteger value, int width) { return uintLit(value, Width.known(width)); }

  /**
   * Creates a UInt literal.
   * @param value non-negative value
   * @param width the width, or unknown to use the minimal width max(bitLength, 1)
   * @return the literal, bound as LITERAL
   */
  public static Element uintLit(BigInteger value, Width width) {
    if (value.signum() < 0)
      throw new IllegalArgumentException("UInt literal must be non-negative (got " + value + ")");
    int minWidth = Math.max(value.bitLength(), 1);
    if (width.isKnown() && width.get() < value.bitLength())
      throw new IllegalArgumentException(String.format("UInt literal %s does not fit in width %d", value, width.get()));
    return bindLit(new Element(ElementKind.UINT, width.isKnown() ? width : Width.known(minWidth), value));
  }

  /** UInt literal from a prefixed string such as "hFF" or "b101"; see {@link LiteralParser}. */
  public static Element uintLit(String literal) {
    LiteralParser.ParsedLiteral parsed = LiteralParser.parse(literal);
    return uintLit(parsed.value, parsed.width);
  }

  /** UInt literal from a prefixed string with a fixed width. */
  public static Element uintLit(String literal, int width) {
    return uintLit(LiteralParser.parse(literal).value, Width.known(width));
  }

  public static Element sintLit(long value) { return sintLit(BigInteger.valueOf(value), Width.unknown()); }
  public static Element sintLit(long value, int width) { return sintLit(BigInteger.valueOf(value), Width.known(width)); }

  /**
   * Creates an SInt literal.
   * @param value the signed value
   * @param width the width, or unknown to use the minimal two's complement width bitLength + 1
   * @return the literal, bound as LITERAL
   */
  public static Element sintLit(BigInteger value, Width width) {
    int minWidth = value.bitLength() + 1;
    if (width.isKnown() && width.get() < minWidth)
      throw new IllegalArgumentException(String.format("SInt literal %s does not fit in width %d", value, width.get()));
    return bindLit(new Element(ElementKind.SINT, width.isKnown() ? width : Width.known(minWidth), value));
  }

  public static Element boolLit(boolean value) {
    return bindLit(new Element(ElementKind.BOOL, Width.known(1), value ? BigInteger.ONE : BigInteger.ZERO));
  }

  /** Literal of the given variant from raw two's complement bits; used for folded results. */
  static Element litFromBits(ElementKind kind, BigInteger bits, int width) {
    switch (kind) {
    case BOOL:
      return boolLit(bits.testBit(0));
    case SINT:
      return sintLit(BitMath.toSigned(bits, width), Width.known(width));
    default:
      return uintLit(BitMath.toUnsigned(bits, width), Width.known(width));
    }
  }

  private static Element bindLit(Element lit) {
    Binding.bind(lit, Binding.LITERAL);
    return lit;
  }
}
