package com.evoila.rosetta.common.plan;

public record Filter(FilterCondition condition) {

  public static Filter of(FilterCondition condition) {
    return new Filter(condition);
  }

  public static Filter eq(String column, String value) {
    return new Filter(FilterCondition.eq(column, value));
  }
}
