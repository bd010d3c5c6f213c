package com.evoila.rosetta.common.sql;

import com.evoila.rosetta.common.plan.ComparisonOp;
import com.evoila.rosetta.common.plan.FilterCondition;
import com.evoila.rosetta.common.plan.Value;
import com.evoila.rosetta.common.sql.SqlToken.Type;
import com.evoila.rosetta.common.utils.DurationUtils;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser for boolean predicates of SQL-like dialects.
 *
 * <pre>
 * or        := and (OR and)*
 * and       := not (AND not)*
 * not       := NOT not | '(' or ')' | predicate
 * predicate := column ( op value | [NOT] IN '(' values ')' | [NOT] BETWEEN value AND value
 *                     | IS [NOT] NULL | [NOT] LIKE value | regexOp value )
 * </pre>
 *
 * <p>Only column-versus-literal predicates are representable; anything else (function calls,
 * arithmetic, column-to-column comparisons) is rejected with {@link IllegalArgumentException} so
 * the caller can keep the raw text as a hint instead.
 */
public final class SqlExpressionParser {

  private static final int MAX_DEPTH = 64;

  private final List<SqlToken> tokens;
  private int index;
  private int depth;

  private SqlExpressionParser(List<SqlToken> tokens) {
    this.tokens = tokens;
  }

  /**
   * Parses a predicate.
   *
   * @param text predicate text
   * @param regexLiterals whether {@code /.../} regex literals are allowed
   * @throws IllegalArgumentException if the text is not a supported predicate
   */
  public static FilterCondition parse(String text, boolean regexLiterals) {
    SqlExpressionParser parser =
        new SqlExpressionParser(SqlTokenizer.tokenize(text, regexLiterals));
    FilterCondition condition = parser.parseOr();
    if (!parser.peek().is(Type.EOF)) {
      throw new IllegalArgumentException(
          "Unexpected '" + parser.peek().text() + "' at position " + parser.peek().position());
    }
    return condition;
  }

  private SqlToken peek() {
    return tokens.get(index);
  }

  private SqlToken next() {
    SqlToken token = tokens.get(index);
    if (!token.is(Type.EOF)) {
      index++;
    }
    return token;
  }

  private boolean acceptKeyword(String keyword) {
    if (peek().isKeyword(keyword)) {
      index++;
      return true;
    }
    return false;
  }

  private void expect(Type type) {
    SqlToken token = next();
    if (!token.is(type)) {
      throw new IllegalArgumentException(
          "Expected " + type + " but found '" + token.text() + "' at position " + token.position());
    }
  }

  private FilterCondition parseOr() {
    List<FilterCondition> terms = new ArrayList<>();
    terms.add(parseAnd());
    while (acceptKeyword("OR")) {
      terms.add(parseAnd());
    }
    return terms.size() == 1 ? terms.get(0) : new FilterCondition.Or(terms);
  }

  private FilterCondition parseAnd() {
    List<FilterCondition> terms = new ArrayList<>();
    terms.add(parseNot());
    while (acceptKeyword("AND")) {
      terms.add(parseNot());
    }
    return terms.size() == 1 ? terms.get(0) : new FilterCondition.And(terms);
  }

  private FilterCondition parseNot() {
    if (++depth > MAX_DEPTH) {
      throw new IllegalArgumentException("Predicate nesting too deep");
    }
    try {
      if (acceptKeyword("NOT")) {
        return new FilterCondition.Not(parseNot());
      }
      if (peek().is(Type.LPAREN)) {
        next();
        FilterCondition inner = parseOr();
        expect(Type.RPAREN);
        return inner;
      }
      return parsePredicate();
    } finally {
      depth--;
    }
  }

  private FilterCondition parsePredicate() {
    String column = parseColumn();
    SqlToken token = peek();

    if (token.isKeyword("IS")) {
      next();
      boolean negated = acceptKeyword("NOT");
      if (!acceptKeyword("NULL")) {
        throw new IllegalArgumentException(
            "Expected NULL after IS at position " + token.position());
      }
      return new FilterCondition.IsNull(column, negated);
    }

    boolean negated = acceptKeyword("NOT");
    if (acceptKeyword("IN")) {
      return new FilterCondition.In(column, parseValueList(), negated);
    }
    if (acceptKeyword("BETWEEN")) {
      Value low = parseValue();
      if (!acceptKeyword("AND")) {
        throw new IllegalArgumentException("Expected AND in BETWEEN for column " + column);
      }
      return new FilterCondition.Between(column, low, parseValue(), negated);
    }
    if (acceptKeyword("LIKE") || acceptKeyword("ILIKE")) {
      return new FilterCondition.Comparison(
          column, negated ? ComparisonOp.NOT_LIKE : ComparisonOp.LIKE, parseValue());
    }
    if (acceptKeyword("REGEXP") || acceptKeyword("RLIKE") || acceptKeyword("MATCH")) {
      return new FilterCondition.Regex(column, parseValue().text(), negated);
    }
    if (acceptKeyword("NMATCH")) {
      return new FilterCondition.Regex(column, parseValue().text(), !negated);
    }
    if (negated) {
      throw new IllegalArgumentException("Unexpected NOT after column " + column);
    }

    SqlToken operator = next();
    if (!operator.is(Type.OPERATOR)) {
      throw new IllegalArgumentException(
          "Expected operator after column " + column + " at position " + operator.position());
    }
    return switch (operator.text()) {
      case "=~", "~", "~*" -> new FilterCondition.Regex(column, parseValue().text(), false);
      case "!~", "!~*" -> new FilterCondition.Regex(column, parseValue().text(), true);
      default ->
          new FilterCondition.Comparison(
              column, ComparisonOp.fromSymbol(operator.text()), parseValue());
    };
  }

  private String parseColumn() {
    SqlToken token = next();
    if (token.is(Type.IDENTIFIER) || token.is(Type.QUOTED_IDENTIFIER)) {
      if (peek().is(Type.LPAREN)) {
        throw new IllegalArgumentException(
            "Function call predicates are not supported: " + token.text());
      }
      return token.text();
    }
    throw new IllegalArgumentException(
        "Expected column but found '" + token.text() + "' at position " + token.position());
  }

  private List<Value> parseValueList() {
    expect(Type.LPAREN);
    List<Value> values = new ArrayList<>();
    values.add(parseValue());
    while (peek().is(Type.COMMA)) {
      next();
      values.add(parseValue());
    }
    expect(Type.RPAREN);
    return values;
  }

  private Value parseValue() {
    SqlToken token = next();
    switch (token.type()) {
      case STRING, QUOTED_IDENTIFIER, REGEX:
        return Value.of(token.text());
      case NUMBER:
        return Value.parse(token.text());
      case DURATION:
        return new Value.DurationValue(DurationUtils.parse(token.text()));
      case OPERATOR:
        if (token.text().equals("-") && peek().is(Type.NUMBER)) {
          return Value.parse("-" + next().text());
        }
        break;
      case IDENTIFIER:
        if (token.text().equalsIgnoreCase("NULL")) {
          return Value.nullValue();
        }
        if (token.text().equalsIgnoreCase("TRUE") || token.text().equalsIgnoreCase("FALSE")) {
          return Value.of(Boolean.parseBoolean(token.text()));
        }
        break;
      default:
        break;
    }
    throw new IllegalArgumentException(
        "Expected literal value but found '" + token.text() + "' at position " + token.position());
  }
}
