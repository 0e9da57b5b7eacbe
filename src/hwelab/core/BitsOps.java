package hwelab.core;

import hwelab.elab.Builder;
import hwelab.elab.ElaborationException;
import hwelab.elab.ErrorKind;
import hwelab.ir.Arg;
import hwelab.ir.PrimOp;
import hwelab.ir.Width;
import hwelab.util.BitMath;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Operators shared by all leaf variants: bitwise logic, shifts, extraction, concatenation, equality and casts.
 * Every operator checks its node operands and appends one or more commands to the active elaboration.
 */
public class BitsOps {

  static Arg.Ref ref(Data data) { return Arg.ref(data); }
  static Arg.ILit ilit(int value) { return Arg.ilit(value); }

  static void check(Data operand, String what) { Binding.checkSynthesizable(operand, what + " (" + operand + ")"); }

  static Element emit(Element result, PrimOp op, Arg... args) { return Builder.current().pushOp(result, op, args); }

  static ElaborationException typeMismatch(String op, Element a, Element b) {
    return new ElaborationException(ErrorKind.TypeMismatch,
                                    String.format("Operator %s is not defined between %s and %s", op, a.typeString(), b.typeString()));
  }

  static void requireSameKind(String op, Element a, Element b) {
    if (a.getKind() != b.getKind())
      throw typeMismatch(op, a, b);
  }

  static void requireNonNegative(int n, String what) {
    if (n < 0)
      throw new ElaborationException(ErrorKind.NegativeIndex, String.format("Negative %s is illegal (got %d)", what, n));
  }

  /** Result variant of width-changing operations: Bool becomes UInt. */
  static ElementKind resizedKind(ElementKind kind) { return kind == ElementKind.BOOL ? ElementKind.UINT : kind; }

  private static boolean foldLiterals() {
    return Builder.currentOpt().map(builder -> builder.getConfig().literal_fold_extract).orElse(true);
  }

  /**
   * Statically extracts bits hi..lo (inclusive) as a UInt of width hi-lo+1.
   * An invalid range is reported as {@link ErrorKind#InvalidBitRange}; the result is then a 1-bit zero literal.
   */
  public static Element extract(Element x, int hi, int lo) {
    if (hi < lo || lo < 0) {
      Builder.report(ErrorKind.InvalidBitRange, String.format("Invalid bit range (%d,%d) on %s", hi, lo, x));
      return Elements.uintLit(0, 1);
    }
    int w = hi - lo + 1;
    if (x.isLit() && foldLiterals())
      return Elements.uintLit(BitMath.extract(x.getLitValue(), hi, lo), w);
    check(x, "'this'");
    return emit(Elements.uint(w), PrimOp.BITS, ref(x), ilit(hi), ilit(lo));
  }

  /**
   * Statically extracts bit i as a Bool.
   * A negative index is reported as {@link ErrorKind#NegativeIndex}; the result is then false.
   */
  public static Element bit(Element x, int i) {
    if (i < 0) {
      Builder.report(ErrorKind.NegativeIndex, String.format("Negative bit indices are illegal (got %d) on %s", i, x));
      return Elements.boolLit(false);
    }
    if (x.isLit() && foldLiterals())
      return Elements.boolLit(x.getLitValue().testBit(i));
    check(x, "'this'");
    return emit(Elements.bool(), PrimOp.BITS, ref(x), ilit(i), ilit(i));
  }

  /** Dynamically addressed bit. */
  public static Element bit(Element x, Element index) { return bit(dshr(x, index), 0); }

  /** The n most significant bits. */
  public static Element head(Element x, int n) {
    requireNonNegative(n, "head length");
    if (x.getWidth().isKnown() && x.getWidth().get() < n) {
      Builder.report(ErrorKind.InvalidBitRange, String.format("Can't head(%d) for width %d of %s", n, x.getWidth().get(), x));
      return Elements.uintLit(0, 1);
    }
    check(x, "'this'");
    return emit(Elements.uint(n), PrimOp.HEAD, ref(x), ilit(n));
  }

  /** Drops the n most significant bits. */
  public static Element tail(Element x, int n) {
    requireNonNegative(n, "tail length");
    Width w = Width.unknown();
    if (x.getWidth().isKnown()) {
      if (x.getWidth().get() < n) {
        Builder.report(ErrorKind.InvalidBitRange, String.format("Can't tail(%d) for width %d of %s", n, x.getWidth().get(), x));
        return Elements.uintLit(0, 1);
      }
      w = Width.known(x.getWidth().get() - n);
    }
    check(x, "'this'");
    return emit(Elements.uint(w), PrimOp.TAIL, ref(x), ilit(n));
  }

  /** Zero-pads (sign-extends for SInt) up to width n. */
  public static Element pad(Element x, int n) {
    requireNonNegative(n, "pad width");
    check(x, "'this'");
    Width w = x.getWidth().max(Width.known(n));
    return emit(new Element(resizedKind(x.getKind()), w, null), PrimOp.PAD, ref(x), ilit(n));
  }

  /** Concatenation with a forming the most significant part; width w1+w2, UInt. */
  public static Element concat(Element a, Element b) {
    check(a, "'this'");
    check(b, "'other'");
    return emit(Elements.uint(a.getWidth().plus(b.getWidth())), PrimOp.CAT, ref(a), ref(b));
  }

  /** Static left shift; width w+n. */
  public static Element shl(Element x, int n) {
    requireNonNegative(n, "shift amount");
    check(x, "'this'");
    return emit(new Element(resizedKind(x.getKind()), x.getWidth().plus(n), null), PrimOp.SHL, ref(x), ilit(n));
  }

  /** Static right shift; width max(w-n, 0). */
  public static Element shr(Element x, int n) {
    requireNonNegative(n, "shift amount");
    check(x, "'this'");
    return emit(new Element(resizedKind(x.getKind()), x.getWidth().shiftRight(n), null), PrimOp.SHR, ref(x), ilit(n));
  }

  private static void checkShiftAmount(String op, Element x, Element amount) {
    if (amount.getKind() == ElementKind.SINT)
      throw typeMismatch(op, x, amount);
    check(x, "'this'");
    check(amount, "'other'");
  }

  /** Dynamic left shift; width w + 2^ws - 1. */
  public static Element dshl(Element x, Element amount) {
    checkShiftAmount("<<", x, amount);
    Width w;
    try {
      w = x.getWidth().dynamicShiftLeft(amount.getWidth());
    } catch (IllegalArgumentException e) {
      throw new ElaborationException(ErrorKind.WidthMismatch, String.format("Cannot shift %s by %s: %s", x, amount, e.getMessage()));
    }
    return emit(new Element(resizedKind(x.getKind()), w, null), PrimOp.DSHL, ref(x), ref(amount));
  }

  /** Dynamic right shift; width unchanged. */
  public static Element dshr(Element x, Element amount) {
    checkShiftAmount(">>", x, amount);
    return emit(new Element(resizedKind(x.getKind()), x.getWidth(), null), PrimOp.DSHR, ref(x), ref(amount));
  }

  private static Element bitwise(String opName, PrimOp op, Element a, Element b) {
    requireSameKind(opName, a, b);
    check(a, "'this'");
    check(b, "'other'");
    if (a.getKind() == ElementKind.BOOL)
      return emit(Elements.bool(), op, ref(a), ref(b));
    Element result = emit(Elements.uint(a.getWidth().max(b.getWidth())), op, ref(a), ref(b));
    return a.getKind() == ElementKind.SINT ? asSInt(result) : result;
  }

  public static Element and(Element a, Element b) { return bitwise("&", PrimOp.AND, a, b); }
  public static Element or(Element a, Element b) { return bitwise("|", PrimOp.OR, a, b); }
  public static Element xor(Element a, Element b) { return bitwise("^", PrimOp.XOR, a, b); }

  /** Bitwise inversion; width unchanged. */
  public static Element not(Element x) {
    check(x, "'this'");
    if (x.getKind() == ElementKind.BOOL)
      return emit(Elements.bool(), PrimOp.NOT, ref(x));
    Element result = emit(Elements.uint(x.getWidth()), PrimOp.NOT, ref(x));
    return x.getKind() == ElementKind.SINT ? asSInt(result) : result;
  }

  private static Element compare(String opName, PrimOp op, Element a, Element b) {
    requireSameKind(opName, a, b);
    check(a, "'this'");
    check(b, "'other'");
    return emit(Elements.bool(), op, ref(a), ref(b));
  }

  public static Element eq(Element a, Element b) { return compare("===", PrimOp.EQ, a, b); }
  public static Element neq(Element a, Element b) { return compare("=/=", PrimOp.NEQ, a, b); }

  private static Element reduce(PrimOp op, Element x) {
    check(x, "'this'");
    return emit(Elements.bool(), op, ref(x));
  }

  public static Element xorR(Element x) { return reduce(PrimOp.XOR_REDUCE, x); }
  public static Element orR(Element x) { return reduce(PrimOp.OR_REDUCE, x); }
  public static Element andR(Element x) { return reduce(PrimOp.AND_REDUCE, x); }

  /** The bits of x as Bools, least significant first. Requires a known width. */
  public static List<Element> toBools(Element x) {
    if (!x.getWidth().isKnown())
      throw new ElaborationException(ErrorKind.WidthMismatch, "toBools requires a known width, got " + x);
    List<Element> ret = new ArrayList<>();
    for (int i = 0; i < x.getWidth().get(); ++i)
      ret.add(bit(x, i));
    return ret;
  }

  /** Reinterprets the bits as UInt; identity for UInt. */
  public static Element asUInt(Element x) {
    if (x.getKind() == ElementKind.UINT)
      return x;
    check(x, "'this'");
    return emit(Elements.uint(x.getWidth()), PrimOp.AS_UINT, ref(x));
  }

  /** Reinterprets the bits as two's complement SInt; identity for SInt. */
  public static Element asSInt(Element x) {
    if (x.getKind() == ElementKind.SINT)
      return x;
    check(x, "'this'");
    return emit(Elements.sint(x.getWidth()), PrimOp.AS_SINT, ref(x));
  }

  /** Converts a width-1 value to Bool. */
  public static Element asBool(Element x) {
    if (x.getKind() == ElementKind.BOOL)
      return x;
    if (!x.getWidth().equals(Width.known(1)))
      throw new ElaborationException(ErrorKind.WidthMismatch, String.format("Can't convert %s to Bool", x.typeString()));
    return bit(x, 0);
  }

  /** Returns x with bit 'offset' set to dat. */
  public static Element bitSet(Element x, Element offset, Element dat) {
    Element mask = dshl(Elements.uintLit(BigInteger.ONE, 1), offset);
    return Mux.mux(dat, or(x, mask), not(or(not(x), mask)));
  }
}
