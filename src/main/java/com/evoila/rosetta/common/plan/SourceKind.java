package com.evoila.rosetta.common.plan;

public sealed interface SourceKind {

  enum Basic implements SourceKind {
    TABLE,
    METRIC,
    MEASUREMENT,
    SUPER_TABLE,
    SUB_TABLE,
    STREAM
  }

  record Subquery(QueryPlan plan) implements SourceKind {}
}
