package io.hyprconf.parser.api;

import java.math.BigInteger;

/**
 * Permissive numeric test used to type barewords.
 *
 * <p>Accepts everything a loosely typed number conversion accepts: optionally signed decimals with
 * fraction and exponent ({@code 12}, {@code -0.5}, {@code .5}, {@code 5.}, {@code 1e-3}),
 * unsigned {@code 0x}/{@code 0o}/{@code 0b} integers and signed {@code Infinity}. Some of these
 * are not what a person reads as a number; the check is intentionally kept this loose so that
 * typing stays stable across parse and re-parse.
 */
public final class NumericLiterals {
  private NumericLiterals() {}

  public static boolean isNumeric(String text) {
    if (text == null) return false;
    String s = text.strip();
    if (s.isEmpty()) return false;
    if (isRadixLiteral(s)) return true;
    int i = 0;
    if (s.charAt(0) == '+' || s.charAt(0) == '-') i++;
    if (s.startsWith("Infinity", i)) return s.length() == i + "Infinity".length();
    int intDigits = countDigits(s, i);
    i += intDigits;
    int fracDigits = 0;
    if (i < s.length() && s.charAt(i) == '.') {
      i++;
      fracDigits = countDigits(s, i);
      i += fracDigits;
    }
    if (intDigits == 0 && fracDigits == 0) return false;
    if (i < s.length() && (s.charAt(i) == 'e' || s.charAt(i) == 'E')) {
      i++;
      if (i < s.length() && (s.charAt(i) == '+' || s.charAt(i) == '-')) i++;
      int expDigits = countDigits(s, i);
      if (expDigits == 0) return false;
      i += expDigits;
    }
    return i == s.length();
  }

  /**
   * Numeric value of a literal accepted by {@link #isNumeric(String)}.
   *
   * @throws NumberFormatException if the literal is not numeric
   */
  public static double toDouble(String text) {
    if (!isNumeric(text)) throw new NumberFormatException("Not a numeric literal: " + text);
    String s = text.strip();
    if (isRadixLiteral(s)) {
      return new BigInteger(s.substring(2), radixOf(s.charAt(1))).doubleValue();
    }
    if (s.endsWith("Infinity")) {
      return s.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
    }
    return Double.parseDouble(s);
  }

  private static boolean isRadixLiteral(String s) {
    if (s.length() < 3 || s.charAt(0) != '0') return false;
    int radix = radixOf(s.charAt(1));
    if (radix < 0) return false;
    for (int i = 2; i < s.length(); i++) {
      if (Character.digit(s.charAt(i), radix) < 0) return false;
    }
    return true;
  }

  private static int radixOf(char prefix) {
    return switch (Character.toLowerCase(prefix)) {
      case 'x' -> 16;
      case 'o' -> 8;
      case 'b' -> 2;
      default -> -1;
    };
  }

  private static int countDigits(String s, int from) {
    int i = from;
    while (i < s.length() && s.charAt(i) >= '0' && s.charAt(i) <= '9') i++;
    return i - from;
  }
}
