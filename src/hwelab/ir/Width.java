package hwelab.ir;

/**
 * Bit width of a hardware value, either known or left for later inference.
 * All combinators propagate the unknown width if any operand is unknown.
 */
public final class Width {
  private static final Width UNKNOWN = new Width(-1);

  /** -1 iff unknown */
  private final int value;

  private Width(int value) { this.value = value; }

  /** @return the unknown width */
  public static Width unknown() { return UNKNOWN; }

  /**
   * Creates a known width.
   * @param n the number of bits, must be non-negative
   * @return the known width
   */
  public static Width known(int n) {
    if (n < 0)
      throw new IllegalArgumentException("Width must be non-negative (got " + n + ")");
    return new Width(n);
  }

  private static Width checked(long n) {
    if (n > Integer.MAX_VALUE)
      throw new IllegalArgumentException("Width overflow (" + n + " bits)");
    return known((int)n);
  }

  public boolean isKnown() { return value >= 0; }

  /**
   * Returns the number of bits.
   * Throws an IllegalStateException if the width is unknown.
   */
  public int get() {
    if (value < 0)
      throw new IllegalStateException("Width is unknown");
    return value;
  }

  public Width plus(Width other) {
    if (!isKnown() || !other.isKnown())
      return UNKNOWN;
    return checked((long)value + other.value);
  }

  public Width plus(int n) {
    if (!isKnown())
      return UNKNOWN;
    return checked((long)value + n);
  }

  public Width max(Width other) {
    if (!isKnown() || !other.isKnown())
      return UNKNOWN;
    return value >= other.value ? this : other;
  }

  /** Width after a static right shift by n: max(w-n, 0). */
  public Width shiftRight(int n) {
    if (!isKnown())
      return UNKNOWN;
    return known(Math.max(value - n, 0));
  }

  /** Width after a dynamic left shift by an amount of width shamt: w + 2^shamt - 1. */
  public Width dynamicShiftLeft(Width shamt) {
    if (!isKnown() || !shamt.isKnown())
      return UNKNOWN;
    if (shamt.value >= 31)
      throw new IllegalArgumentException("Width overflow (dynamic shift amount of " + shamt.value + " bits)");
    return checked((long)value + (1L << shamt.value) - 1);
  }

  @Override
  public int hashCode() {
    return Integer.hashCode(value);
  }
  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    return value == ((Width)obj).value;
  }
  @Override
  public String toString() {
    return isKnown() ? "<" + value + ">" : "";
  }
}
