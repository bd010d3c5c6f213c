package com.evoila.rosetta.common.plan;

public sealed interface GroupByExpr {

  record Column(String name) implements GroupByExpr {}

  record TimeBucket(long intervalMs, String column) implements GroupByExpr {}

  record Tag(String name) implements GroupByExpr {}

  record AllTags() implements GroupByExpr {}

  /** Grouping expression kept verbatim because it has no structural form. */
  record Expression(String text) implements GroupByExpr {}
}
