package com.evoila.rosetta.common.plan;

import lombok.Getter;

/** Binary comparison operators with their SQL spelling. */
@Getter
public enum ComparisonOp {
  EQ("="),
  NOT_EQ("!="),
  LT("<"),
  LT_EQ("<="),
  GT(">"),
  GT_EQ(">="),
  LIKE("LIKE"),
  NOT_LIKE("NOT LIKE");

  private final String symbol;

  ComparisonOp(String symbol) {
    this.symbol = symbol;
  }

  /**
   * Resolve an operator token such as {@code >=} or {@code <>}.
   *
   * @throws IllegalArgumentException if the token is not a comparison operator
   */
  public static ComparisonOp fromSymbol(String token) {
    String normalized = token.trim().toUpperCase();
    return switch (normalized) {
      case "=", "==" -> EQ;
      case "!=", "<>" -> NOT_EQ;
      case "<" -> LT;
      case "<=" -> LT_EQ;
      case ">" -> GT;
      case ">=" -> GT_EQ;
      case "LIKE" -> LIKE;
      case "NOT LIKE" -> NOT_LIKE;
      default -> throw new IllegalArgumentException("Unknown comparison operator: " + token);
    };
  }

  public ComparisonOp negate() {
    return switch (this) {
      case EQ -> NOT_EQ;
      case NOT_EQ -> EQ;
      case LT -> GT_EQ;
      case LT_EQ -> GT;
      case GT -> LT_EQ;
      case GT_EQ -> LT;
      case LIKE -> NOT_LIKE;
      case NOT_LIKE -> LIKE;
    };
  }
}
