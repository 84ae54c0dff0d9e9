package io.hyprconf.parser.api;

import java.util.Objects;

/**
 * Value of a property: a string, a number or a boolean.
 *
 * <p>The type is fixed when the value is created, either by the parser from the token kind or by
 * {@link #coerce(String)}, and never re-inferred afterwards.
 */
public sealed interface ConfigValue {

  /** Display text of the value, without quotes. */
  String text();

  /** Text used when the value is written back to a config file. */
  String render();

  /**
   * The one coercion rule for untyped text: {@code true}/{@code false} become booleans, numeric
   * literals (see {@link NumericLiterals}) become numbers, a single fully quoted literal becomes a
   * quoted string and anything else a bare string.
   */
  static ConfigValue coerce(String raw) {
    Objects.requireNonNull(raw, "raw");
    if (raw.equals("true") || raw.equals("false")) return new BooleanValue(raw.equals("true"));
    if (NumericLiterals.isNumeric(raw)) return new NumberValue(raw, NumericLiterals.toDouble(raw));
    StringValue quoted = StringValue.unquote(raw);
    return quoted != null ? quoted : StringValue.bare(raw);
  }

  /** String value that is quoted only if the bare text would not read back as the same string. */
  static ConfigValue of(String text) {
    Objects.requireNonNull(text, "text");
    return StringValue.safeAsBare(text) ? StringValue.bare(text) : StringValue.quoted(text, '"');
  }

  static ConfigValue of(boolean value) {
    return new BooleanValue(value);
  }

  static ConfigValue of(double value) {
    String literal =
        value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15
            ? Long.toString((long) value)
            : Double.toString(value);
    return new NumberValue(literal, value);
  }

  static ConfigValue of(long value) {
    return new NumberValue(Long.toString(value), value);
  }

  record StringValue(String text, char quote) implements ConfigValue {
    public static final char BARE = 0;

    public StringValue {
      Objects.requireNonNull(text, "text");
      if (quote != BARE && quote != '"' && quote != '\'') {
        throw new IllegalArgumentException("Unsupported quote character: " + quote);
      }
    }

    public static StringValue bare(String text) {
      return new StringValue(text, BARE);
    }

    public static StringValue quoted(String text, char quote) {
      return new StringValue(text, quote);
    }

    public boolean isQuoted() {
      return quote != BARE;
    }

    @Override
    public String render() {
      if (quote == BARE) return text;
      StringBuilder sb = new StringBuilder(text.length() + 2).append(quote);
      for (int i = 0; i < text.length(); i++) {
        char c = text.charAt(i);
        if (c == '\\' || c == quote) sb.append('\\');
        sb.append(c);
      }
      return sb.append(quote).toString();
    }

    /** Parses {@code raw} as exactly one quoted literal, or returns null. */
    static StringValue unquote(String raw) {
      if (raw.length() < 2) return null;
      char q = raw.charAt(0);
      if ((q != '"' && q != '\'') || raw.charAt(raw.length() - 1) != q) return null;
      StringBuilder sb = new StringBuilder(raw.length());
      for (int i = 1; i < raw.length() - 1; i++) {
        char c = raw.charAt(i);
        if (c == '\\' && i + 1 < raw.length() - 1) {
          sb.append(raw.charAt(++i));
        } else if (c == '\\' || c == q) {
          // escaped closing quote or an early close: not a single literal
          return null;
        } else {
          sb.append(c);
        }
      }
      return new StringValue(sb.toString(), q);
    }

    static boolean safeAsBare(String text) {
      if (text.isEmpty() || !text.equals(text.strip())) return false;
      for (int i = 0; i < text.length(); i++) {
        char c = text.charAt(i);
        if (c < ' ' || c == '#' || c == '{' || c == '}' || c == '"' || c == '\'') return false;
      }
      return coerce(text) instanceof StringValue s && !s.isQuoted();
    }
  }

  record NumberValue(String literal, double value) implements ConfigValue {
    public NumberValue {
      Objects.requireNonNull(literal, "literal");
    }

    @Override
    public String text() {
      return literal;
    }

    @Override
    public String render() {
      return literal;
    }
  }

  record BooleanValue(boolean value) implements ConfigValue {
    @Override
    public String text() {
      return Boolean.toString(value);
    }

    @Override
    public String render() {
      return text();
    }
  }
}
