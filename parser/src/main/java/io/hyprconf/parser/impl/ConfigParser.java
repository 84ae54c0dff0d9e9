package io.hyprconf.parser.impl;

import io.hyprconf.parser.api.ConfigParseException;
import io.hyprconf.parser.api.ConfigTree.Block;
import io.hyprconf.parser.api.ConfigTree.Comment;
import io.hyprconf.parser.api.ConfigTree.CommentedProperty;
import io.hyprconf.parser.api.ConfigTree.Node;
import io.hyprconf.parser.api.ConfigTree.Property;
import io.hyprconf.parser.api.ConfigTree.Root;
import io.hyprconf.parser.api.ConfigValue;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive-descent parser over the {@link Tokenizer} output.
 *
 * <pre>
 * config             := statement*
 * statement          := comment | commented_property | property | block
 * property           := IDENTIFIER '=' value [COMMENT]
 * block              := IDENTIFIER '{' statement* '}'
 * commented_property := COMMENT   (when its text splits into "key = value")
 * </pre>
 *
 * Only a property without {@code =} and an unclosed block are fatal; anything else that does not
 * fit the grammar is skipped or kept as a plain comment.
 */
public final class ConfigParser {
  private static final Logger log = LoggerFactory.getLogger(ConfigParser.class);

  private final String source;
  private final List<Token> tokens;
  private int current = 0;

  private ConfigParser(String source, List<Token> tokens) {
    this.source = source;
    this.tokens = tokens;
  }

  public static Root parse(String source) {
    return new ConfigParser(source, Tokenizer.tokenize(source)).parseRoot();
  }

  private Root parseRoot() {
    List<Node> children = new ArrayList<>();
    while (!isAtEnd()) {
      skipNewlines();
      if (isAtEnd()) break;
      Node node = parseStatement();
      if (node != null) children.add(node);
    }
    return new Root(children);
  }

  private Node parseStatement() {
    if (check(TokenType.COMMENT)) {
      return parseCommentOrCommentedProperty(advance());
    }
    if (check(TokenType.IDENTIFIER)) {
      Token name = advance();
      return check(TokenType.LBRACE) ? parseBlock(name) : parseProperty(name);
    }
    Token skipped = advance();
    if (log.isDebugEnabled()) {
      log.debug(
          "Skipping {} '{}' at line {}, column {}",
          skipped.type(),
          skipped.text(),
          skipped.line(),
          skipped.column());
    }
    return null;
  }

  private Node parseCommentOrCommentedProperty(Token token) {
    String text = token.text();
    int eq = text.indexOf('=');
    if (eq < 0) return new Comment(text, token.line());

    String key = text.substring(0, eq).trim();
    if (!isPropertyKey(key)) {
      log.debug("Keeping line {} as a plain comment: no usable key", token.line());
      return new Comment(text, token.line());
    }
    String rest = text.substring(eq + 1);
    int hash = inlineCommentStart(rest);
    String valueText = (hash < 0 ? rest : rest.substring(0, hash)).trim();
    String comment = hash < 0 ? null : rest.substring(hash + 1).trim();
    return new CommentedProperty(key, ConfigValue.coerce(valueText), comment, token.line());
  }

  /** A key must read back as the single identifier that starts a property line. */
  static boolean isPropertyKey(String key) {
    List<Token> tokens = Tokenizer.tokenize(key);
    return tokens.size() == 2
        && tokens.get(0).is(TokenType.IDENTIFIER)
        && tokens.get(1).is(TokenType.EOF);
  }

  private Property parseProperty(Token key) {
    consume(
        TokenType.EQUALS,
        ConfigParseException.Kind.MISSING_EQUALS,
        "Expected = after property name");

    List<Token> valueTokens = new ArrayList<>();
    while (!isAtEnd()
        && !check(TokenType.NEWLINE)
        && !check(TokenType.COMMENT)
        && !check(TokenType.LBRACE)
        && !check(TokenType.RBRACE)) {
      valueTokens.add(advance());
    }
    String comment = check(TokenType.COMMENT) ? advance().text() : null;
    return new Property(key.text(), valueOf(valueTokens), comment, key.line());
  }

  private Block parseBlock(Token name) {
    advance(); // {
    List<Node> children = new ArrayList<>();
    while (!check(TokenType.RBRACE) && !isAtEnd()) {
      skipNewlines();
      if (check(TokenType.RBRACE) || isAtEnd()) break;
      Node node = parseStatement();
      if (node != null) children.add(node);
    }
    consume(
        TokenType.RBRACE,
        ConfigParseException.Kind.UNCLOSED_BLOCK,
        "Expected } to close block '" + name.text() + "' opened at line " + name.line());
    return new Block(name.text(), children, name.line());
  }

  /** Single tokens keep their lexical type; a run of tokens is the raw source text. */
  private ConfigValue valueOf(List<Token> valueTokens) {
    if (valueTokens.isEmpty()) return ConfigValue.StringValue.bare("");
    if (valueTokens.size() > 1) {
      Token first = valueTokens.get(0);
      Token last = valueTokens.get(valueTokens.size() - 1);
      return ConfigValue.StringValue.bare(source.substring(first.start(), last.end()));
    }
    Token t = valueTokens.get(0);
    return switch (t.type()) {
      case STRING -> ConfigValue.StringValue.quoted(t.text(), t.quote(source));
      case NUMBER, BOOLEAN -> ConfigValue.coerce(t.text());
      default -> ConfigValue.StringValue.bare(t.text());
    };
  }

  /** Index of the first {@code #} outside quotes and not preceded by a backslash, or -1. */
  private static int inlineCommentStart(String text) {
    char quote = 0;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '\\') {
        i++;
      } else if (quote != 0) {
        if (c == quote) quote = 0;
      } else if (c == '"' || c == '\'') {
        quote = c;
      } else if (c == '#') {
        return i;
      }
    }
    return -1;
  }

  private void skipNewlines() {
    while (check(TokenType.NEWLINE)) advance();
  }

  private boolean check(TokenType type) {
    return !isAtEnd() && peek().is(type);
  }

  private Token advance() {
    if (!isAtEnd()) current++;
    return tokens.get(current - 1);
  }

  private boolean isAtEnd() {
    return peek().is(TokenType.EOF);
  }

  private Token peek() {
    return tokens.get(current);
  }

  private void consume(TokenType type, ConfigParseException.Kind kind, String message) {
    if (check(type)) {
      advance();
      return;
    }
    throw error(kind, message);
  }

  private ConfigParseException error(ConfigParseException.Kind kind, String message) {
    Token t = peek();
    return new ConfigParseException(
        kind, message, t.line(), t.column(), t.type().name(), t.text());
  }
}
