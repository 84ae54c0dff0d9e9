package io.hyprconf.parser.api;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class NumericLiteralsTest {

  @ParameterizedTest
  @ValueSource(
      strings = {
        "0", "40", "-2", "+3", "0.5", ".5", "5.", "-.5", "1e3", "1E-3", "2.5e+10", "0x1F",
        "0XFF", "0o17", "0b101", "Infinity", "-Infinity", " 12 "
      })
  void acceptsPermissiveNumbers(String text) {
    assertTrue(NumericLiterals.isNumeric(text), text);
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "", " ", "-", "+", ".", "e3", "1e", "1.2.3", "1:2", "0x", "-0x10", "0b102", "45deg",
        "infinity", "NaN", "1_000", "1 2", "us"
      })
  void rejectsNonNumbers(String text) {
    assertFalse(NumericLiterals.isNumeric(text), text);
  }

  @Test
  void convertsToDouble() {
    assertEquals(40.0, NumericLiterals.toDouble("40"));
    assertEquals(0.5, NumericLiterals.toDouble(".5"));
    assertEquals(5.0, NumericLiterals.toDouble("5."));
    assertEquals(255.0, NumericLiterals.toDouble("0xff"));
    assertEquals(15.0, NumericLiterals.toDouble("0o17"));
    assertEquals(5.0, NumericLiterals.toDouble("0b101"));
    assertEquals(Double.POSITIVE_INFINITY, NumericLiterals.toDouble("+Infinity"));
    assertThrows(NumberFormatException.class, () -> NumericLiterals.toDouble("abc"));
  }

  @Test
  void nullIsNotNumeric() {
    assertFalse(NumericLiterals.isNumeric(null));
  }
}
