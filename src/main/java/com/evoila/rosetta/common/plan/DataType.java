package com.evoila.rosetta.common.plan;

import java.util.Arrays;
import java.util.Optional;

public enum DataType {
  BOOL,
  INT8,
  INT16,
  INT32,
  INT64,
  UINT8,
  UINT16,
  UINT32,
  UINT64,
  FLOAT32,
  FLOAT64,
  STRING,
  BINARY,
  TIMESTAMP,
  DURATION,
  JSON;

  /** Maps common SQL type names onto the canonical type. */
  public static Optional<DataType> fromSqlName(String name) {
    String normalized = name.trim().toUpperCase();
    return switch (normalized) {
      case "BOOLEAN", "BOOL" -> Optional.of(BOOL);
      case "TINYINT" -> Optional.of(INT8);
      case "SMALLINT" -> Optional.of(INT16);
      case "INT", "INTEGER" -> Optional.of(INT32);
      case "BIGINT", "LONG" -> Optional.of(INT64);
      case "FLOAT", "REAL" -> Optional.of(FLOAT32);
      case "DOUBLE", "DOUBLE PRECISION" -> Optional.of(FLOAT64);
      case "VARCHAR", "TEXT", "NCHAR", "SYMBOL" -> Optional.of(STRING);
      case "VARBINARY", "BYTEA" -> Optional.of(BINARY);
      default ->
          Arrays.stream(values()).filter(type -> type.name().equals(normalized)).findFirst();
    };
  }
}
