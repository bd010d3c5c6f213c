package com.evoila.rosetta.common.plan;

public record Window(WindowKind kind, FillStrategy fill) {

  public static Window of(WindowKind kind) {
    return new Window(kind, null);
  }

  public Window withFill(FillStrategy newFill) {
    return new Window(kind, newFill);
  }
}
