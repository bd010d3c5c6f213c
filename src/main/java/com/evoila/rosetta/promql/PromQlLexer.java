package com.evoila.rosetta.promql;

import com.evoila.rosetta.common.exception.QueryParseException;
import com.evoila.rosetta.common.utils.DurationUtils;
import com.evoila.rosetta.promql.PromQlToken.Type;
import java.util.ArrayList;
import java.util.List;

/** Turns PromQL text into tokens. Comments ({@code # ...}) run to the end of the line. */
public final class PromQlLexer {

  private static final String[] OPERATORS = {
    "==", "!=", "<=", ">=", "=~", "!~", "+", "-", "*", "/", "%", "^", "<", ">", "="
  };

  private final String input;
  private final List<PromQlToken> tokens = new ArrayList<>();
  private int position;

  private PromQlLexer(String input) {
    this.input = input;
  }

  /**
   * Tokenizes a query; the last token is always {@link Type#EOF}.
   *
   * @throws QueryParseException on unterminated strings or unexpected characters
   */
  public static List<PromQlToken> tokenize(String input) {
    PromQlLexer lexer = new PromQlLexer(input);
    lexer.run();
    return lexer.tokens;
  }

  private void run() {
    while (position < input.length()) {
      char c = input.charAt(position);
      if (Character.isWhitespace(c)) {
        position++;
      } else if (c == '#') {
        skipComment();
      } else if (c == '"' || c == '\'' || c == '`') {
        readString(c);
      } else if (Character.isDigit(c)
          || (c == '.'
              && position + 1 < input.length()
              && Character.isDigit(input.charAt(position + 1)))) {
        readNumberOrDuration();
      } else if (Character.isLetter(c) || c == '_') {
        readIdentifier();
      } else if (!readPunctuation(c)) {
        readOperator();
      }
    }
    tokens.add(new PromQlToken(Type.EOF, "", input.length(), input.length()));
  }

  private void skipComment() {
    while (position < input.length() && input.charAt(position) != '\n') {
      position++;
    }
  }

  private void readString(char quote) {
    int start = position++;
    StringBuilder value = new StringBuilder();
    while (position < input.length()) {
      char c = input.charAt(position++);
      if (c == quote) {
        tokens.add(new PromQlToken(Type.STRING, value.toString(), start, position));
        return;
      }
      if (c == '\\' && quote != '`' && position < input.length()) {
        char escaped = input.charAt(position++);
        value.append(
            switch (escaped) {
              case 'n' -> '\n';
              case 't' -> '\t';
              default -> escaped;
            });
      } else {
        value.append(c);
      }
    }
    throw QueryParseException.at("Unterminated string literal", input, start);
  }

  private void readNumberOrDuration() {
    int start = position;
    while (position < input.length()
        && (Character.isLetterOrDigit(input.charAt(position)) || input.charAt(position) == '.')) {
      position++;
    }
    // exponent sign, as in 1e-3
    if (position < input.length()
        && (input.charAt(position) == '-' || input.charAt(position) == '+')
        && (input.charAt(position - 1) == 'e' || input.charAt(position - 1) == 'E')
        && input.substring(start, position - 1).matches("\\d+(\\.\\d*)?")) {
      position++;
      while (position < input.length() && Character.isDigit(input.charAt(position))) {
        position++;
      }
    }
    String text = input.substring(start, position);
    if (isNumber(text)) {
      tokens.add(new PromQlToken(Type.NUMBER, text, start, position));
    } else if (DurationUtils.isDuration(text, DurationUtils.COMPACT_UNITS)) {
      tokens.add(new PromQlToken(Type.DURATION, text, start, position));
    } else {
      throw QueryParseException.at("Invalid number or duration '" + text + "'", input, start);
    }
  }

  static boolean isNumber(String text) {
    return text.matches("(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?")
        || text.matches("0[xX][0-9a-fA-F]+");
  }

  private void readIdentifier() {
    int start = position;
    while (position < input.length()
        && (Character.isLetterOrDigit(input.charAt(position))
            || input.charAt(position) == '_'
            || input.charAt(position) == ':')) {
      position++;
    }
    tokens.add(
        new PromQlToken(Type.IDENTIFIER, input.substring(start, position), start, position));
  }

  private boolean readPunctuation(char c) {
    Type type =
        switch (c) {
          case '{' -> Type.LBRACE;
          case '}' -> Type.RBRACE;
          case '(' -> Type.LPAREN;
          case ')' -> Type.RPAREN;
          case '[' -> Type.LBRACKET;
          case ']' -> Type.RBRACKET;
          case ',' -> Type.COMMA;
          case ':' -> Type.COLON;
          case '@' -> Type.AT;
          default -> null;
        };
    if (type == null) {
      return false;
    }
    tokens.add(new PromQlToken(type, String.valueOf(c), position, position + 1));
    position++;
    return true;
  }

  private void readOperator() {
    for (String operator : OPERATORS) {
      if (input.startsWith(operator, position)) {
        tokens.add(
            new PromQlToken(Type.OPERATOR, operator, position, position + operator.length()));
        position += operator.length();
        return;
      }
    }
    throw QueryParseException.at(
        "Unexpected character '" + input.charAt(position) + "'", input, position);
  }
}
