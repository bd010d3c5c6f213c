package com.evoila.rosetta.common.plan;

public record GroupBy(GroupByExpr expr) {

  public static GroupBy column(String name) {
    return new GroupBy(new GroupByExpr.Column(name));
  }

  public static GroupBy tag(String name) {
    return new GroupBy(new GroupByExpr.Tag(name));
  }

  public static GroupBy timeBucket(long intervalMs, String column) {
    return new GroupBy(new GroupByExpr.TimeBucket(intervalMs, column));
  }

  public static GroupBy allTags() {
    return new GroupBy(new GroupByExpr.AllTags());
  }

  public static GroupBy expression(String text) {
    return new GroupBy(new GroupByExpr.Expression(text));
  }
}
