package com.evoila.rosetta.common.plan;

public record Transformation(TransformType type, String column, String alias) {

  public static Transformation of(TransformType type) {
    return new Transformation(type, null, null);
  }
}
