package io.hyprconf.parser.impl;

/**
 * Lexical token.
 *
 * @param type token kind
 * @param text literal text; unescaped content for strings, trimmed text after {@code #} for
 *     comments
 * @param line 1-based line of the first character
 * @param column 1-based column of the first character
 * @param start source offset of the first character
 * @param end source offset after the last character
 */
public record Token(TokenType type, String text, int line, int column, int start, int end) {

  public boolean is(TokenType t) {
    return type == t;
  }

  /** Quote character of a {@link TokenType#STRING} token. */
  public char quote(String source) {
    return source.charAt(start);
  }
}
