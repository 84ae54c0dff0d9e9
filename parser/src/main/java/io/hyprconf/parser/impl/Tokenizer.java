package io.hyprconf.parser.impl;

import io.hyprconf.parser.api.NumericLiterals;
import java.util.ArrayList;
import java.util.List;

/**
 * Scans config text into a flat token list terminated by {@link TokenType#EOF}.
 *
 * <p>The tokenizer never fails: characters it does not recognize are collected into catch-all
 * {@link TokenType#IDENTIFIER} tokens and structural recovery is left to the parser.
 */
public final class Tokenizer {
  private final String input;
  private final List<Token> tokens = new ArrayList<>();
  private int pos = 0;
  private int line = 1;
  private int column = 1;

  private Tokenizer(String input) {
    this.input = input;
  }

  public static List<Token> tokenize(String input) {
    Tokenizer t = new Tokenizer(input);
    t.scan();
    return t.tokens;
  }

  private void scan() {
    while (!eof()) {
      char c = input.charAt(pos);
      if (c == ' ' || c == '\t' || c == '\r') {
        pos++;
        column++;
      } else if (c == '\n') {
        emit(TokenType.NEWLINE, "\n", pos, pos + 1, line, column);
        pos++;
        line++;
        column = 1;
      } else if (c == '#') {
        scanComment();
      } else if (c == '{') {
        single(TokenType.LBRACE, c);
      } else if (c == '}') {
        single(TokenType.RBRACE, c);
      } else if (c == '=') {
        single(TokenType.EQUALS, c);
      } else if (c == '"' || c == '\'') {
        scanString(c);
      } else if (isAlphaNumeric(c) || c == '-' || c == '.') {
        scanWord();
      } else {
        scanOther();
      }
    }
    tokens.add(new Token(TokenType.EOF, "", line, column, pos, pos));
  }

  private void scanComment() {
    int start = pos;
    int startColumn = column;
    pos++; // #
    while (!eof() && input.charAt(pos) != '\n') pos++;
    String text = input.substring(start + 1, pos).trim();
    emit(TokenType.COMMENT, text, start, pos, line, startColumn);
    column += pos - start;
  }

  private void scanString(char quote) {
    int start = pos;
    int startLine = line;
    int startColumn = column;
    StringBuilder value = new StringBuilder();
    pos++;
    column++;
    while (!eof() && input.charAt(pos) != quote) {
      char c = input.charAt(pos);
      if (c == '\\' && pos + 1 < input.length()) {
        pos++;
        column++;
        c = input.charAt(pos);
      }
      value.append(c);
      if (c == '\n') {
        line++;
        column = 1;
      } else {
        column++;
      }
      pos++;
    }
    if (!eof()) {
      pos++; // closing quote
      column++;
    }
    emit(TokenType.STRING, value.toString(), start, pos, startLine, startColumn);
  }

  private void scanWord() {
    int start = pos;
    int startColumn = column;
    while (!eof() && isWordChar(input.charAt(pos))) {
      pos++;
      column++;
    }
    String word = input.substring(start, pos);
    emit(classify(word), word, start, pos, line, startColumn);
  }

  private void scanOther() {
    int start = pos;
    int startColumn = column;
    while (!eof() && !isDelimiter(input.charAt(pos))) {
      pos++;
      column++;
    }
    emit(TokenType.IDENTIFIER, input.substring(start, pos), start, pos, line, startColumn);
  }

  private void single(TokenType type, char c) {
    emit(type, String.valueOf(c), pos, pos + 1, line, column);
    pos++;
    column++;
  }

  private void emit(TokenType type, String text, int start, int end, int atLine, int atColumn) {
    tokens.add(new Token(type, text, atLine, atColumn, start, end));
  }

  /** Bareword classification: boolean, then the permissive numeric test, else identifier. */
  static TokenType classify(String word) {
    if (word.equals("true") || word.equals("false")) return TokenType.BOOLEAN;
    if (NumericLiterals.isNumeric(word)) return TokenType.NUMBER;
    return TokenType.IDENTIFIER;
  }

  private static boolean isAlphaNumeric(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
  }

  private static boolean isWordChar(char c) {
    return isAlphaNumeric(c) || c == '-' || c == '.' || c == '_' || c == ':';
  }

  private static boolean isDelimiter(char c) {
    return c == ' '
        || c == '\t'
        || c == '\n'
        || c == '\r'
        || c == '='
        || c == '{'
        || c == '}'
        || c == '#';
  }

  private boolean eof() {
    return pos >= input.length();
  }
}
