package com.evoila.rosetta.common.sql;

import com.evoila.rosetta.common.sql.SqlToken.Type;
import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for the predicate and expression fragments of SQL-like dialects.
 *
 * <p>Single quotes delimit strings, double quotes and backticks delimit identifiers. A number
 * immediately followed by letters ({@code 5m}, {@code 1000ms}) is a duration token. When regex
 * literals are enabled (InfluxQL) a slash following an operator starts a {@code /.../} literal.
 */
public final class SqlTokenizer {

  private static final String[] OPERATORS = {
    "!~*", "=~", "!~", "~*", "==", "!=", "<>", "<=", ">=", "::", "||", "<", ">", "=", "~", "+", "-",
    "*", "/", "%"
  };

  private final String input;
  private final boolean regexLiterals;
  private final List<SqlToken> tokens = new ArrayList<>();
  private int position;

  private SqlTokenizer(String input, boolean regexLiterals) {
    this.input = input;
    this.regexLiterals = regexLiterals;
  }

  /**
   * Tokenizes the input.
   *
   * @throws IllegalArgumentException on an unterminated string or an unexpected character
   */
  public static List<SqlToken> tokenize(String input, boolean regexLiterals) {
    return new SqlTokenizer(input, regexLiterals).run();
  }

  private List<SqlToken> run() {
    while (position < input.length()) {
      char c = input.charAt(position);
      if (Character.isWhitespace(c)) {
        position++;
      } else if (c == '\'') {
        readQuoted(Type.STRING, '\'');
      } else if (c == '"' || c == '`') {
        readQuoted(Type.QUOTED_IDENTIFIER, c);
      } else if (c == '/' && regexLiterals && regexAllowed()) {
        readRegex();
      } else if (Character.isDigit(c)
          || (c == '.'
              && position + 1 < input.length()
              && Character.isDigit(input.charAt(position + 1)))) {
        readNumber();
      } else if (Character.isLetter(c) || c == '_' || c == '$' || c == '@') {
        readIdentifier();
      } else if (c == '(') {
        add(Type.LPAREN, "(", position++);
      } else if (c == ')') {
        add(Type.RPAREN, ")", position++);
      } else if (c == ',') {
        add(Type.COMMA, ",", position++);
      } else {
        readOperator();
      }
    }
    tokens.add(new SqlToken(Type.EOF, "", input.length()));
    return tokens;
  }

  private void add(Type type, String text, int start) {
    tokens.add(new SqlToken(type, text, start));
  }

  private boolean regexAllowed() {
    if (tokens.isEmpty()) {
      return false;
    }
    SqlToken last = tokens.get(tokens.size() - 1);
    return last.is(Type.OPERATOR) || last.is(Type.LPAREN) || last.is(Type.COMMA);
  }

  private void readQuoted(Type type, char quote) {
    int start = position;
    StringBuilder value = new StringBuilder();
    position++;
    while (position < input.length()) {
      char c = input.charAt(position);
      if (c == '\\' && position + 1 < input.length()) {
        value.append(input.charAt(position + 1));
        position += 2;
      } else if (c == quote) {
        if (position + 1 < input.length() && input.charAt(position + 1) == quote) {
          value.append(quote);
          position += 2;
        } else {
          position++;
          add(type, value.toString(), start);
          return;
        }
      } else {
        value.append(c);
        position++;
      }
    }
    throw new IllegalArgumentException("Unterminated quoted text starting at position " + start);
  }

  private void readRegex() {
    int start = position;
    StringBuilder value = new StringBuilder();
    position++;
    while (position < input.length()) {
      char c = input.charAt(position);
      if (c == '\\' && position + 1 < input.length() && input.charAt(position + 1) == '/') {
        value.append('/');
        position += 2;
      } else if (c == '/') {
        position++;
        add(Type.REGEX, value.toString(), start);
        return;
      } else {
        value.append(c);
        position++;
      }
    }
    throw new IllegalArgumentException("Unterminated regex starting at position " + start);
  }

  private void readNumber() {
    int start = position;
    while (position < input.length()
        && (Character.isDigit(input.charAt(position)) || input.charAt(position) == '.')) {
      position++;
    }
    if (position < input.length()
        && (input.charAt(position) == 'e' || input.charAt(position) == 'E')
        && position + 1 < input.length()
        && (Character.isDigit(input.charAt(position + 1))
            || input.charAt(position + 1) == '-'
            || input.charAt(position + 1) == '+')) {
      position += 2;
      while (position < input.length() && Character.isDigit(input.charAt(position))) {
        position++;
      }
      add(Type.NUMBER, input.substring(start, position), start);
      return;
    }
    if (position < input.length() && Character.isLetter(input.charAt(position))) {
      while (position < input.length()
          && (Character.isLetterOrDigit(input.charAt(position))
              || input.charAt(position) == 'µ')) {
        position++;
      }
      add(Type.DURATION, input.substring(start, position), start);
      return;
    }
    add(Type.NUMBER, input.substring(start, position), start);
  }

  private void readIdentifier() {
    int start = position;
    while (position < input.length()) {
      char c = input.charAt(position);
      if (Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '@' || c == '.') {
        position++;
      } else {
        break;
      }
    }
    add(Type.IDENTIFIER, input.substring(start, position), start);
  }

  private void readOperator() {
    for (String operator : OPERATORS) {
      if (input.startsWith(operator, position)) {
        add(Type.OPERATOR, operator, position);
        position += operator.length();
        return;
      }
    }
    throw new IllegalArgumentException(
        "Unexpected character '" + input.charAt(position) + "' at position " + position);
  }
}
