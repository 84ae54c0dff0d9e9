package io.hyprconf.parser.api;

import static org.junit.jupiter.api.Assertions.*;

import io.hyprconf.parser.api.ConfigValue.BooleanValue;
import io.hyprconf.parser.api.ConfigValue.NumberValue;
import io.hyprconf.parser.api.ConfigValue.StringValue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ConfigValueTest {

  @Test
  void coercesBooleansExactly() {
    assertEquals(new BooleanValue(true), ConfigValue.coerce("true"));
    assertEquals(new BooleanValue(false), ConfigValue.coerce("false"));
    assertEquals(StringValue.bare("TRUE"), ConfigValue.coerce("TRUE"));
    assertEquals(StringValue.bare("yes"), ConfigValue.coerce("yes"));
  }

  @Test
  void coercesNumbersKeepingLiteral() {
    NumberValue n = assertInstanceOf(NumberValue.class, ConfigValue.coerce("0.50"));
    assertEquals("0.50", n.literal());
    assertEquals(0.5, n.value());
    assertEquals("0.50", n.render());
    assertEquals(31.0, ((NumberValue) ConfigValue.coerce("0x1F")).value());
    assertEquals(Double.NEGATIVE_INFINITY, ((NumberValue) ConfigValue.coerce("-Infinity")).value());
  }

  @Test
  void coercesQuotedLiterals() {
    assertEquals(StringValue.quoted("a b", '"'), ConfigValue.coerce("\"a b\""));
    assertEquals(StringValue.quoted("it's", '"'), ConfigValue.coerce("\"it's\""));
    assertEquals(StringValue.quoted("say \"x\"", '"'), ConfigValue.coerce("\"say \\\"x\\\"\""));
    assertEquals(StringValue.quoted("", '\''), ConfigValue.coerce("''"));
    assertEquals(StringValue.bare("\"a\" \"b\""), ConfigValue.coerce("\"a\" \"b\""));
    assertEquals(StringValue.bare("\"open"), ConfigValue.coerce("\"open"));
    assertEquals(StringValue.bare("\"esc\\\""), ConfigValue.coerce("\"esc\\\""));
  }

  @Test
  void coercesEverythingElseToBareString() {
    assertEquals(StringValue.bare(""), ConfigValue.coerce(""));
    assertEquals(StringValue.bare("us,de"), ConfigValue.coerce("us,de"));
    assertEquals(StringValue.bare("1:2"), ConfigValue.coerce("1:2"));
  }

  @Test
  void quotesFactoryStringsOnlyWhenNeeded() {
    assertEquals(StringValue.bare("us"), ConfigValue.of("us"));
    assertEquals(
        StringValue.bare("SUPER, Q, exec, kitty"), ConfigValue.of("SUPER, Q, exec, kitty"));
    assertEquals(StringValue.quoted("40", '"'), ConfigValue.of("40"));
    assertEquals(StringValue.quoted("true", '"'), ConfigValue.of("true"));
    assertEquals(StringValue.quoted("", '"'), ConfigValue.of(""));
    assertEquals(StringValue.quoted(" padded ", '"'), ConfigValue.of(" padded "));
    assertEquals(StringValue.quoted("a # b", '"'), ConfigValue.of("a # b"));
    assertEquals(StringValue.quoted("{x}", '"'), ConfigValue.of("{x}"));
    assertEquals(StringValue.quoted("it's", '"'), ConfigValue.of("it's"));
  }

  @Test
  void formatsNumbers() {
    assertEquals("40", ConfigValue.of(40).render());
    assertEquals("40", ConfigValue.of(40.0).render());
    assertEquals("0.5", ConfigValue.of(0.5).render());
    assertEquals("-2", ConfigValue.of(-2.0).render());
    assertEquals("true", ConfigValue.of(true).render());
  }

  @Test
  void rendersQuotedStringsWithEscapes() {
    assertEquals("\"a \\\"b\\\" \\\\\"", StringValue.quoted("a \"b\" \\", '"').render());
    assertEquals("'it\\'s'", StringValue.quoted("it's", '\'').render());
    assertEquals("plain text", StringValue.bare("plain text").render());
    assertEquals("plain text", StringValue.quoted("plain text", '"').text());
  }

  @ParameterizedTest
  @ValueSource(chars = {'`', '\n', 'x'})
  void rejectsUnsupportedQuotes(char quote) {
    assertThrows(IllegalArgumentException.class, () -> new StringValue("x", quote));
  }
}
