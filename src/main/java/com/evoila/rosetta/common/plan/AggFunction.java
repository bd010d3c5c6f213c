package com.evoila.rosetta.common.plan;

/**
 * Aggregate function applied to a series or column. Parameterless functions are the constants of
 * {@link Basic}; functions carrying a parameter are records.
 */
public sealed interface AggFunction {

  enum Basic implements AggFunction {
    COUNT,
    SUM,
    AVG,
    MIN,
    MAX,
    STDDEV,
    STDDEV_POP,
    STDDEV_SAMP,
    VARIANCE,
    VAR_POP,
    VAR_SAMP,
    FIRST,
    LAST,
    FIRST_ROW,
    LAST_ROW,
    SPREAD,
    MODE,
    MEDIAN,
    RATE,
    IRATE,
    INCREASE,
    DELTA,
    IDELTA,
    DERIV,
    PREDICT_LINEAR,
    RESETS,
    CHANGES,
    TWA,
    INTEGRAL,
    COUNT_DISTINCT,
    HYPER_LOG_LOG,
    HISTOGRAM;

    /** Functions that need a range window over a counter or gauge to be meaningful. */
    public boolean isRangeFunction() {
      return switch (this) {
        case RATE, IRATE, INCREASE, DELTA, IDELTA, DERIV, PREDICT_LINEAR, RESETS, CHANGES -> true;
        default -> false;
      };
    }
  }

  record Percentile(double quantile) implements AggFunction {}

  /** Approximate percentile. */
  record Apercentile(double quantile) implements AggFunction {}

  record HistogramQuantile(double quantile) implements AggFunction {}

  record TopK(int k) implements AggFunction {}

  record BottomK(int k) implements AggFunction {}

  record Sample(int n) implements AggFunction {}

  /** Dialect-specific function without a canonical counterpart. */
  record Custom(String name) implements AggFunction {}
}
