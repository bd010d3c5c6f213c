package com.evoila.rosetta.common.plan;

public record OrderBy(String column, boolean ascending, Boolean nullsFirst) {

  public static OrderBy asc(String column) {
    return new OrderBy(column, true, null);
  }

  public static OrderBy desc(String column) {
    return new OrderBy(column, false, null);
  }
}
