package hwelab.core;

import hwelab.elab.ElaborationException;
import hwelab.elab.ErrorKind;

/** Logic on Bool values; all results are Bool. */
public class BoolOps {

  private static void requireBool(String op, Element x) {
    if (x.getKind() != ElementKind.BOOL)
      throw new ElaborationException(ErrorKind.TypeMismatch, String.format("Operator %s requires Bool, got %s", op, x.typeString()));
  }

  public static Element and(Element a, Element b) {
    requireBool("&", a);
    requireBool("&", b);
    return BitsOps.and(a, b);
  }

  public static Element or(Element a, Element b) {
    requireBool("|", a);
    requireBool("|", b);
    return BitsOps.or(a, b);
  }

  public static Element xor(Element a, Element b) {
    requireBool("^", a);
    requireBool("^", b);
    return BitsOps.xor(a, b);
  }

  public static Element not(Element x) {
    requireBool("!", x);
    return BitsOps.not(x);
  }

  /** Logical and (&&); same hardware as {@link #and}. */
  public static Element logicalAnd(Element a, Element b) { return and(a, b); }

  /** Logical or (||); same hardware as {@link #or}. */
  public static Element logicalOr(Element a, Element b) { return or(a, b); }
}
