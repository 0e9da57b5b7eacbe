package hwelab.core;

import static hwelab.core.BitsOps.check;
import static hwelab.core.BitsOps.emit;
import static hwelab.core.BitsOps.ref;
import static hwelab.core.BitsOps.requireSameKind;
import static hwelab.core.BitsOps.typeMismatch;

import hwelab.elab.ElaborationException;
import hwelab.elab.ErrorKind;
import hwelab.ir.PrimOp;

/** Arithmetic and ordering on UInt and SInt. */
public class NumOps {

  private static void requireNumeric(String op, Element a, Element b) {
    requireSameKind(op, a, b);
    if (!a.getKind().isNumeric())
      throw typeMismatch(op, a, b);
    check(a, "'this'");
    check(b, "'other'");
  }

  private static void requireNumeric(String op, Element x) {
    if (!x.getKind().isNumeric())
      throw new ElaborationException(ErrorKind.TypeMismatch, String.format("Operator %s is not defined on %s", op, x.typeString()));
    check(x, "'this'");
  }

  /** Width-expanding addition; width max(w1,w2)+1. */
  public static Element addGrow(Element a, Element b) {
    requireNumeric("+&", a, b);
    return emit(a.cloneTypeWidth(a.getWidth().max(b.getWidth()).plus(1)), PrimOp.ADD, ref(a), ref(b));
  }

  /** Width-expanding subtraction; width max(w1,w2)+1. */
  public static Element subGrow(Element a, Element b) {
    requireNumeric("-&", a, b);
    return emit(a.cloneTypeWidth(a.getWidth().max(b.getWidth()).plus(1)), PrimOp.SUB, ref(a), ref(b));
  }

  private static Element wrap(Element grown, ElementKind kind) {
    Element dropped = BitsOps.tail(grown, 1);
    return kind == ElementKind.SINT ? BitsOps.asSInt(dropped) : dropped;
  }

  /** Wrapping addition; width max(w1,w2). */
  public static Element add(Element a, Element b) { return wrap(addGrow(a, b), a.getKind()); }
  public static Element addWrap(Element a, Element b) { return add(a, b); }

  /** Wrapping subtraction; width max(w1,w2). */
  public static Element sub(Element a, Element b) { return wrap(subGrow(a, b), a.getKind()); }
  public static Element subWrap(Element a, Element b) { return sub(a, b); }

  /**
   * Multiplication; width w1+w2.
   * Mixing UInt and SInt gives an SInt; the UInt operand is zero-extended first.
   */
  public static Element mul(Element a, Element b) {
    if (a.getKind() != b.getKind() && a.getKind().isNumeric() && b.getKind().isNumeric()) {
      Element sa = a.getKind() == ElementKind.UINT ? zext(a) : a;
      Element sb = b.getKind() == ElementKind.UINT ? zext(b) : b;
      // the zero-extension bit is redundant in the product
      return BitsOps.asSInt(BitsOps.tail(mulSame(sa, sb), 1));
    }
    return mulSame(a, b);
  }

  private static Element mulSame(Element a, Element b) {
    requireNumeric("*", a, b);
    return emit(a.cloneTypeWidth(a.getWidth().plus(b.getWidth())), PrimOp.MUL, ref(a), ref(b));
  }

  /** Division truncating towards zero; width w1. */
  public static Element div(Element a, Element b) {
    requireNumeric("/", a, b);
    return emit(a.cloneTypeWidth(a.getWidth()), PrimOp.DIV, ref(a), ref(b));
  }

  /** Remainder with the sign of the dividend; width w1. */
  public static Element rem(Element a, Element b) {
    requireNumeric("%", a, b);
    return emit(a.cloneTypeWidth(a.getWidth()), PrimOp.REM, ref(a), ref(b));
  }

  private static Element compare(String opName, PrimOp op, Element a, Element b) {
    requireNumeric(opName, a, b);
    return emit(Elements.bool(), op, ref(a), ref(b));
  }

  public static Element lt(Element a, Element b) { return compare("<", PrimOp.LT, a, b); }
  public static Element le(Element a, Element b) { return compare("<=", PrimOp.LEQ, a, b); }
  public static Element gt(Element a, Element b) { return compare(">", PrimOp.GT, a, b); }
  public static Element ge(Element a, Element b) { return compare(">=", PrimOp.GEQ, a, b); }

  /** Wrapping negation 0 - x; width w. */
  public static Element neg(Element x) {
    requireNumeric("unary -", x);
    Element zero = x.getKind() == ElementKind.SINT ? Elements.sintLit(0) : Elements.uintLit(0);
    return sub(zero, x);
  }

  public static Element min(Element a, Element b) { return Mux.mux(lt(a, b), a, b); }
  public static Element max(Element a, Element b) { return Mux.mux(lt(a, b), b, a); }

  /** Absolute value of an SInt as UInt of the same width; identity for UInt. */
  public static Element abs(Element x) {
    requireNumeric("abs", x);
    if (x.getKind() == ElementKind.UINT)
      return x;
    Element negative = lt(x, Elements.sintLit(0));
    return Mux.mux(negative, BitsOps.asUInt(neg(x)), BitsOps.asUInt(x));
  }

  /** Zero-extends a UInt into an SInt one bit wider. */
  public static Element zext(Element x) {
    if (x.getKind() != ElementKind.UINT)
      throw new ElaborationException(ErrorKind.TypeMismatch, "zext is only defined on UInt, got " + x.typeString());
    check(x, "'this'");
    return emit(Elements.sint(x.getWidth().plus(1)), PrimOp.CVT, ref(x));
  }
}
