package com.evoila.rosetta.common.plan;

import java.util.List;

public record Aggregation(
    AggFunction function, String column, List<Value> args, String alias, boolean distinct) {

  public Aggregation {
    args = args == null ? List.of() : List.copyOf(args);
  }

  public static Aggregation of(AggFunction function, String column) {
    return new Aggregation(function, column, List.of(), null, false);
  }

  public static Aggregation of(AggFunction function) {
    return of(function, null);
  }

  public Aggregation withAlias(String newAlias) {
    return new Aggregation(function, column, args, newAlias, distinct);
  }
}
