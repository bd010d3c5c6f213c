package com.evoila.rosetta.promql;

/**
 * Lexical token of PromQL and MetricsQL.
 *
 * @param type token category
 * @param text token text; string literals are unescaped and without quotes
 * @param position offset of the first character in the query
 * @param end offset just past the last character in the query
 */
public record PromQlToken(Type type, String text, int position, int end) {

  public enum Type {
    IDENTIFIER,
    NUMBER,
    DURATION,
    STRING,
    OPERATOR,
    LBRACE,
    RBRACE,
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    COMMA,
    COLON,
    AT,
    EOF
  }

  public boolean is(Type expected) {
    return type == expected;
  }

  public boolean isIdentifier(String name) {
    return type == Type.IDENTIFIER && text.equalsIgnoreCase(name);
  }

  public boolean isOperator(String operator) {
    return type == Type.OPERATOR && text.equals(operator);
  }
}
