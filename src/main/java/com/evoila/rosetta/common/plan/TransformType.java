package com.evoila.rosetta.common.plan;

import java.util.List;

/** Post-aggregation operator. */
public sealed interface TransformType {

  enum Basic implements TransformType {
    ABS,
    CEIL,
    FLOOR,
    SQRT,
    EXP,
    CUMULATIVE_SUM,
    INTERPOLATE,
    LOWER,
    UPPER,
    TRIM
  }

  record Round(Integer digits) implements TransformType {}

  /** Logarithm; a null base means natural logarithm. */
  record Log(Double base) implements TransformType {}

  record Pow(double exponent) implements TransformType {}

  record Derivative(Long unitMs, boolean nonNegative) implements TransformType {}

  record Difference(boolean nonNegative) implements TransformType {}

  record MovingAverage(int points) implements TransformType {}

  record Elapsed(Long unitMs) implements TransformType {}

  record Fill(FillStrategy strategy) implements TransformType {}

  record LabelReplace(String destination, String replacement, String source, String regex)
      implements TransformType {}

  record LabelJoin(String destination, String separator, List<String> sources)
      implements TransformType {
    public LabelJoin {
      sources = List.copyOf(sources);
    }
  }

  record Cast(DataType type) implements TransformType {}

  record Custom(String name, List<Value> args) implements TransformType {
    public Custom {
      args = args == null ? List.of() : List.copyOf(args);
    }
  }
}
