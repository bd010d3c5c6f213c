package com.evoila.rosetta.common.plan;

import java.util.HashMap;
import java.util.Map;

/**
 * Presentation preferences for the result set.
 *
 * @param dialect dialect whose result layout the caller expects, if any
 * @param timestampFormat how timestamps are rendered, defaults to epoch milliseconds
 * @param includeMeta whether series metadata is returned alongside values
 * @param resultType dialect result type such as {@code matrix} or {@code vector}
 * @param options free-form presentation options such as a series alias
 */
public record OutputFormat(
    Dialect dialect,
    TimestampFormat timestampFormat,
    boolean includeMeta,
    String resultType,
    Map<String, String> options) {

  public OutputFormat {
    if (timestampFormat == null) {
      timestampFormat = TimestampFormat.UNIX_MS;
    }
    options = options == null ? Map.of() : Map.copyOf(options);
  }

  public static OutputFormat defaults() {
    return new OutputFormat(null, TimestampFormat.UNIX_MS, false, null, Map.of());
  }

  public OutputFormat withOption(String key, String value) {
    Map<String, String> merged = new HashMap<>(options);
    merged.put(key, value);
    return new OutputFormat(dialect, timestampFormat, includeMeta, resultType, merged);
  }
}
