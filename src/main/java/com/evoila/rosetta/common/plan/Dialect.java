package com.evoila.rosetta.common.plan;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import lombok.Getter;

/**
 * Closed set of query languages understood by the compiler. The lower-case id is used as registry
 * key, in configuration and on the HTTP boundary.
 */
@Getter
public enum Dialect {
  INFLUXQL("influxql", "InfluxQL"),
  FLUX("flux", "Flux"),
  PROMQL("promql", "PromQL"),
  METRICSQL("metricsql", "MetricsQL"),
  TDENGINE("tdengine", "TDengine"),
  TIMESCALEDB("timescaledb", "TimescaleDB", "timescale"),
  QUESTDB("questdb", "QuestDB"),
  CLICKHOUSE("clickhouse", "ClickHouse"),
  DRUID_SQL("druidsql", "Druid SQL", "druid"),
  DRUID_NATIVE("druidnative", "Druid native"),
  OPENTSDB("opentsdb", "OpenTSDB"),
  GRAPHITE("graphite", "Graphite"),
  SQL("sql", "SQL");

  /** -- GETTER -- Identifier used in configuration, registry lookups and endpoints */
  private final String id;

  /** -- GETTER -- Human readable name */
  private final String displayName;

  private final List<String> aliases;

  Dialect(String id, String displayName, String... aliases) {
    this.id = id;
    this.displayName = displayName;
    this.aliases = List.of(aliases);
  }

  /**
   * Parse a dialect from its id or one of its aliases (case-insensitive)
   *
   * @param name the dialect name to parse
   * @return the corresponding Dialect
   * @throws IllegalArgumentException if the name is not recognized
   */
  public static Dialect fromString(String name) {
    if (name == null) {
      throw new IllegalArgumentException("Dialect name cannot be null");
    }
    return find(name).orElseThrow(() -> new IllegalArgumentException("Unknown dialect: " + name));
  }

  public static Optional<Dialect> find(String name) {
    if (name == null) {
      return Optional.empty();
    }
    String normalized = name.trim();
    return Arrays.stream(values())
        .filter(
            dialect ->
                dialect.id.equalsIgnoreCase(normalized)
                    || dialect.aliases.stream()
                        .anyMatch(alias -> alias.equalsIgnoreCase(normalized)))
        .findFirst();
  }

  @Override
  public String toString() {
    return id;
  }
}
