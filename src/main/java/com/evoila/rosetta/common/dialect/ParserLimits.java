package com.evoila.rosetta.common.dialect;

/**
 * Input bounds applied by every parser.
 *
 * @param maxDepth maximum nesting of function calls and parenthesized expressions
 * @param maxQueryLength maximum query length in characters
 */
public record ParserLimits(int maxDepth, int maxQueryLength) {

  public static final ParserLimits DEFAULTS = new ParserLimits(64, 10_000);

  public ParserLimits {
    if (maxDepth < 1) {
      throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
    }
    if (maxQueryLength < 1) {
      throw new IllegalArgumentException("maxQueryLength must be positive: " + maxQueryLength);
    }
  }
}
