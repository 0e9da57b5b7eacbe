package hwelab.ir;

import java.util.Optional;
import java.util.stream.Stream;

/** Primitive operations of a {@link Command.DefPrim}. */
public enum PrimOp {
  ADD("add"),
  SUB("sub"),
  MUL("mul"),
  DIV("div"),
  REM("rem"),
  LT("lt"),
  LEQ("leq"),
  GT("gt"),
  GEQ("geq"),
  EQ("eq"),
  NEQ("neq"),
  PAD("pad"),
  AS_UINT("asUInt"),
  AS_SINT("asSInt"),
  /** zero-extending conversion UInt to SInt */
  CVT("cvt"),
  SHL("shl"),
  SHR("shr"),
  DSHL("dshl"),
  DSHR("dshr"),
  NOT("not"),
  AND("and"),
  OR("or"),
  XOR("xor"),
  AND_REDUCE("andr"),
  OR_REDUCE("orr"),
  XOR_REDUCE("xorr"),
  CAT("cat"),
  /** args: value, ILit(hi), ILit(lo) */
  BITS("bits"),
  HEAD("head"),
  TAIL("tail"),
  /** args: cond, con, alt */
  MUX("mux");

  public final String serialName;

  private PrimOp(String serialName) { this.serialName = serialName; }

  public static Optional<PrimOp> fromSerialName(String serialName) {
    return Stream.of(PrimOp.values()).filter(op -> op.serialName.equals(serialName)).findAny();
  }
}
