package com.evoila.rosetta.common.plan;

/** Policy for windows that received no data points. */
public sealed interface FillStrategy {

  enum Basic implements FillStrategy {
    NONE,
    NULL,
    PREVIOUS,
    NEXT,
    LINEAR
  }

  record Constant(Value value) implements FillStrategy {}
}
