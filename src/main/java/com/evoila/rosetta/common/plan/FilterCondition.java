package com.evoila.rosetta.common.plan;

import java.util.List;

/** Recursive predicate tree. */
public sealed interface FilterCondition {

  static FilterCondition eq(String column, String value) {
    return new Comparison(column, ComparisonOp.EQ, Value.of(value));
  }

  static FilterCondition and(List<FilterCondition> conditions) {
    return conditions.size() == 1 ? conditions.get(0) : new And(conditions);
  }

  /** True for a conjunction with nothing left to test, which every row satisfies. */
  static boolean matchesAll(FilterCondition condition) {
    return condition instanceof And and
        && and.conditions().stream().allMatch(FilterCondition::matchesAll);
  }

  record Comparison(String column, ComparisonOp op, Value value) implements FilterCondition {}

  record Regex(String column, String pattern, boolean negated) implements FilterCondition {}

  record In(String column, List<Value> values, boolean negated) implements FilterCondition {
    public In {
      values = List.copyOf(values);
    }
  }

  record Between(String column, Value low, Value high, boolean negated)
      implements FilterCondition {}

  record IsNull(String column, boolean negated) implements FilterCondition {}

  record And(List<FilterCondition> conditions) implements FilterCondition {
    public And {
      conditions = List.copyOf(conditions);
    }
  }

  record Or(List<FilterCondition> conditions) implements FilterCondition {
    public Or {
      conditions = List.copyOf(conditions);
    }
  }

  record Not(FilterCondition condition) implements FilterCondition {}
}
