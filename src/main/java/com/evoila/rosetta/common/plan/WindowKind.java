package com.evoila.rosetta.common.plan;

/** Shape of a window. All durations are milliseconds. */
public sealed interface WindowKind {

  /** Tumbling window, or hopping when {@code slidingMs} is set. */
  record Interval(long durationMs, Long offsetMs, Long slidingMs) implements WindowKind {
    public static Interval of(long durationMs) {
      return new Interval(durationMs, null, null);
    }
  }

  /** Look-back range attached to a selector, e.g. {@code [5m]}. */
  record Range(long durationMs) implements WindowKind {}

  record Session(long gapMs, String column) implements WindowKind {}

  record State(String column) implements WindowKind {}

  record Event(FilterCondition start, FilterCondition end) implements WindowKind {}

  record Count(long count, Long sliding) implements WindowKind {}

  record SampleBy(long intervalMs, String align) implements WindowKind {}

  record Rows(Long preceding, Long following) implements WindowKind {}
}
