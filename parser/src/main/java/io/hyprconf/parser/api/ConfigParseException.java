package io.hyprconf.parser.api;

/**
 * Fatal parse failure. Only two constructs are fatal; everything else the parser absorbs.
 */
public final class ConfigParseException extends IllegalArgumentException {

  public enum Kind {
    /** An identifier that is neither a block name nor followed by {@code =}. */
    MISSING_EQUALS,
    /** A block whose opening brace has no matching closing brace before end of input. */
    UNCLOSED_BLOCK
  }

  private final Kind kind;
  private final int line;
  private final int column;
  private final String tokenType;
  private final String tokenText;

  public ConfigParseException(
      Kind kind, String message, int line, int column, String tokenType, String tokenText) {
    super(
        message
            + " at line "
            + line
            + ", column "
            + column
            + ". Got "
            + tokenType
            + ": \""
            + tokenText
            + "\"");
    this.kind = kind;
    this.line = line;
    this.column = column;
    this.tokenType = tokenType;
    this.tokenText = tokenText;
  }

  public Kind kind() {
    return kind;
  }

  public int line() {
    return line;
  }

  public int column() {
    return column;
  }

  /** Kind of the offending token, e.g. {@code NEWLINE} or {@code EOF}. */
  public String tokenType() {
    return tokenType;
  }

  public String tokenText() {
    return tokenText;
  }
}
