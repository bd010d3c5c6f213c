package com.evoila.rosetta.common.plan;

/** Time bounds of a query. All values are epoch or duration milliseconds. */
public sealed interface TimeRange {

  record Absolute(long startMs, long endMs) implements TimeRange {}

  /** The last {@code durationMs}, ending at {@code anchorMs} or at evaluation time when null. */
  record Relative(long durationMs, Long anchorMs) implements TimeRange {
    public static Relative of(long durationMs) {
      return new Relative(durationMs, null);
    }
  }

  record Since(long startMs) implements TimeRange {}

  record Until(long endMs) implements TimeRange {}
}
