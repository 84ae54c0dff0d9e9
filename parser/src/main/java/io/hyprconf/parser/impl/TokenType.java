package io.hyprconf.parser.impl;

public enum TokenType {
  IDENTIFIER,
  EQUALS,
  LBRACE,
  RBRACE,
  STRING,
  NUMBER,
  BOOLEAN,
  COMMENT,
  NEWLINE,
  EOF
}
