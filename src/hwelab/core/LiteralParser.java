package hwelab.core;

import hwelab.elab.Builder;
import hwelab.elab.ErrorKind;
import hwelab.ir.Width;
import java.math.BigInteger;

/**
 * Parses prefixed literal strings: b (binary), o (octal), d (decimal), h or x (hex), e.g. "hFF", "b1010_0101".
 * Underscores are separators and ignored.
 */
public class LiteralParser {
  /** Result of a parse: the value and the width implied by the digits (unknown for decimal/octal). */
  public static class ParsedLiteral {
    public final BigInteger value;
    public final Width width;
    public ParsedLiteral(BigInteger value, Width width) {
      this.value = value;
      this.width = width;
    }
    @Override
    public String toString() {
      return value + (width.isKnown() ? " " + width : "");
    }
  }

  /** Returns the radix for a prefix character, or -1 if unrecognized. */
  public static int radixOf(char prefix) {
    switch (prefix) {
    case 'x':
    case 'h':
      return 16;
    case 'd':
      return 10;
    case 'o':
      return 8;
    case 'b':
      return 2;
    default:
      return -1;
    }
  }

  /**
   * Parses a literal string. An unrecognized prefix is reported as {@link ErrorKind#InvalidRadix} and parsing continues in base 2;
   * malformed digits are reported the same way and yield 0.
   * @param literal the literal string
   * @return the parsed value and implied width
   */
  public static ParsedLiteral parse(String literal) {
    if (literal.isEmpty()) {
      Builder.report(ErrorKind.InvalidRadix, "Empty literal string");
      return new ParsedLiteral(BigInteger.ZERO, Width.unknown());
    }
    char prefix = literal.charAt(0);
    String digits = literal.substring(1).replace("_", "");
    int radix = radixOf(prefix);
    if (radix == -1) {
      Builder.report(ErrorKind.InvalidRadix, String.format("Invalid base '%c' in literal \"%s\"", prefix, literal));
      radix = 2;
    }
    BigInteger value;
    if (isDigits(digits, radix)) {
      value = new BigInteger(digits, radix);
    } else {
      Builder.report(ErrorKind.InvalidRadix, String.format("Invalid base-%d digits in literal \"%s\"", radix, literal));
      value = BigInteger.ZERO;
    }
    return new ParsedLiteral(value, parsedWidth(prefix, digits));
  }

  /** True if s is a non-empty run of base-radix digits; signs are not digits. */
  private static boolean isDigits(String s, int radix) {
    if (s.isEmpty())
      return false;
    for (int i = 0; i < s.length(); ++i) {
      if (Character.digit(s.charAt(i), radix) < 0)
        return false;
    }
    return true;
  }

  /** Width implied by the digit count: binary = digits, hex = digits * 4, otherwise unknown. */
  static Width parsedWidth(char prefix, String digits) {
    if (prefix == 'b')
      return Width.known(digits.length());
    if (prefix == 'h' || prefix == 'x')
      return Width.known(digits.length() * 4);
    return Width.unknown();
  }
}
