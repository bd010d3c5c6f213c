package com.evoila.rosetta.common.sql;

/** Lexical token of an SQL-like predicate or expression. */
public record SqlToken(Type type, String text, int position) {

  public enum Type {
    IDENTIFIER,
    QUOTED_IDENTIFIER,
    STRING,
    NUMBER,
    DURATION,
    REGEX,
    OPERATOR,
    LPAREN,
    RPAREN,
    COMMA,
    EOF
  }

  public boolean is(Type expected) {
    return type == expected;
  }

  /** Case-insensitive keyword test for bare identifiers. */
  public boolean isKeyword(String keyword) {
    return type == Type.IDENTIFIER && text.equalsIgnoreCase(keyword);
  }

  public boolean isOperator(String operator) {
    return type == Type.OPERATOR && text.equals(operator);
  }
}
