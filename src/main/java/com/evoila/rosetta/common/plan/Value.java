package com.evoila.rosetta.common.plan;

import java.util.List;

/** Literal value appearing in filters, aggregation arguments and fill strategies. */
public sealed interface Value {

  static Value nullValue() {
    return NullValue.INSTANCE;
  }

  static Value of(boolean value) {
    return new BoolValue(value);
  }

  static Value of(long value) {
    return new IntValue(value);
  }

  static Value of(double value) {
    return new FloatValue(value);
  }

  static Value of(String value) {
    return new StringValue(value);
  }

  /**
   * Interprets an unquoted literal token: integers, decimals, booleans and {@code null} become
   * typed values, everything else a string.
   */
  static Value parse(String token) {
    if (token == null) {
      return nullValue();
    }
    String trimmed = token.trim();
    if (trimmed.equalsIgnoreCase("null")) {
      return nullValue();
    }
    if (trimmed.equalsIgnoreCase("true") || trimmed.equalsIgnoreCase("false")) {
      return of(Boolean.parseBoolean(trimmed));
    }
    if (trimmed.matches("[-+]?\\d{1,18}")) {
      return of(Long.parseLong(trimmed));
    }
    if (trimmed.matches("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?")) {
      return of(Double.parseDouble(trimmed));
    }
    return of(trimmed);
  }

  /** Raw textual form without any dialect quoting. */
  String text();

  record NullValue() implements Value {
    static final NullValue INSTANCE = new NullValue();

    @Override
    public String text() {
      return "null";
    }
  }

  record BoolValue(boolean value) implements Value {
    @Override
    public String text() {
      return Boolean.toString(value);
    }
  }

  record IntValue(long value) implements Value {
    @Override
    public String text() {
      return Long.toString(value);
    }
  }

  record FloatValue(double value) implements Value {
    @Override
    public String text() {
      if (value == Math.rint(value) && !Double.isInfinite(value)) {
        return Long.toString((long) value);
      }
      return Double.toString(value);
    }
  }

  record StringValue(String value) implements Value {
    @Override
    public String text() {
      return value;
    }
  }

  /** Epoch milliseconds. */
  record TimestampValue(long epochMs) implements Value {
    @Override
    public String text() {
      return Long.toString(epochMs);
    }
  }

  /** Duration in milliseconds. */
  record DurationValue(long durationMs) implements Value {
    @Override
    public String text() {
      return Long.toString(durationMs);
    }
  }

  record ArrayValue(List<Value> values) implements Value {
    public ArrayValue {
      values = values == null ? List.of() : List.copyOf(values);
    }

    @Override
    public String text() {
      return values.stream().map(Value::text).reduce((a, b) -> a + ", " + b).orElse("");
    }
  }
}
