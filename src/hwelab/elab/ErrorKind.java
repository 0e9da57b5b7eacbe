package hwelab.elab;

/** Categories of elaboration errors. */
public enum ErrorKind {
  /** A node's binding is set a second time. */
  AlreadyBound,
  /** An operand is unbound or belongs to another elaboration. */
  NotSynthesizable,
  /** Bit extraction with negative indices or hi &lt; lo. */
  InvalidBitRange,
  /** Negative single-bit index or shift amount. */
  NegativeIndex,
  /** Operation between incompatible variants. */
  TypeMismatch,
  /** Aggregate operation with differing field widths or counts. */
  WidthMismatch,
  /** Unrecognized literal radix prefix or malformed digits. */
  InvalidRadix,
  /** Connect sink is not a wire, register or output port. */
  NotAssignable
}
