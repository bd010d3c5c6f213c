package com.evoila.rosetta.common.dialect;

import com.evoila.rosetta.common.plan.Dialect;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Heuristic classifier guessing the dialect of a query.
 *
 * <p>Each dialect owns structural signatures (regular expressions, 10 points per match) and
 * literal keywords (case-insensitive substrings, 5 points per match). The highest score wins if it
 * reaches the minimum score. Otherwise ordered fallbacks apply: JSON documents are matched against
 * the JSON request dialects, text starting with SELECT or SHOW is generic SQL, a bare metric name
 * with optional label selector and range is PromQL, and everything else is generic SQL.
 *
 * <p>Equal scores are resolved by {@link #TIE_BREAK_ORDER}: dialects whose signatures are more
 * specific come first, InfluxQL comes late because its SELECT-FROM-WHERE signature also matches
 * most SQL extensions.
 *
 * <p>Detection never fails. Instances are immutable and thread-safe.
 */
@Slf4j
public class DialectDetector {

  public static final int SIGNATURE_WEIGHT = 10;
  public static final int KEYWORD_WEIGHT = 5;
  public static final int DEFAULT_MINIMUM_SCORE = 5;

  static final List<Dialect> TIE_BREAK_ORDER =
      List.of(
          Dialect.METRICSQL,
          Dialect.PROMQL,
          Dialect.FLUX,
          Dialect.TDENGINE,
          Dialect.QUESTDB,
          Dialect.TIMESCALEDB,
          Dialect.CLICKHOUSE,
          Dialect.DRUID_SQL,
          Dialect.DRUID_NATIVE,
          Dialect.OPENTSDB,
          Dialect.GRAPHITE,
          Dialect.INFLUXQL,
          Dialect.SQL);

  private static final Map<Dialect, List<Pattern>> SIGNATURES =
      Map.ofEntries(
          Map.entry(
              Dialect.INFLUXQL,
              List.of(
                  Pattern.compile(
                      "SELECT\\s+.+\\s+FROM\\s+[\"\\w]+\\s+(WHERE|GROUP BY|LIMIT|ORDER BY|FILL|TZ)",
                      Pattern.CASE_INSENSITIVE),
                  Pattern.compile("\\s+GROUP\\s+BY\\s+time\\s*\\(", Pattern.CASE_INSENSITIVE),
                  Pattern.compile(
                      "SHOW\\s+(MEASUREMENTS|TAG KEYS|TAG VALUES|FIELD KEYS|DATABASES|RETENTION"
                          + " POLICIES|SERIES)",
                      Pattern.CASE_INSENSITIVE),
                  Pattern.compile(
                      "CREATE\\s+(DATABASE|RETENTION POLICY|CONTINUOUS QUERY)",
                      Pattern.CASE_INSENSITIVE))),
          Map.entry(
              Dialect.FLUX,
              List.of(
                  Pattern.compile("from\\s*\\(\\s*bucket\\s*:"),
                  Pattern.compile("\\|>\\s*range\\s*\\("),
                  Pattern.compile("\\|>\\s*filter\\s*\\("),
                  Pattern.compile("\\|>\\s*aggregateWindow\\s*\\("),
                  Pattern.compile("\\|>\\s*yield\\s*\\("),
                  Pattern.compile("\\|>\\s*map\\s*\\("))),
          Map.entry(
              Dialect.PROMQL,
              List.of(
                  Pattern.compile("\\w+\\s*\\{[^}]*\\}\\s*(\\[[\\w]+\\])?"),
                  Pattern.compile(
                      "(rate|irate|increase|delta|deriv|predict_linear|histogram_quantile)\\s*\\("),
                  Pattern.compile(
                      "(sum|avg|min|max|count|stddev|topk|bottomk|quantile)"
                          + "\\s*(by|without)\\s*\\("),
                  Pattern.compile("\\s+offset\\s+\\d+[smhdwy]"),
                  Pattern.compile("\\[\\d+[smhdwy]\\]"))),
          Map.entry(
              Dialect.METRICSQL,
              List.of(
                  Pattern.compile(
                      "(range_quantile|range_median|range_avg|range_first|range_last)\\s*\\("),
                  Pattern.compile("(topk_avg|topk_max|topk_min|bottomk_avg)\\s*\\("))),
          Map.entry(
              Dialect.TDENGINE,
              List.of(
                  Pattern.compile("CREATE\\s+STABLE", Pattern.CASE_INSENSITIVE),
                  Pattern.compile("USING\\s+\\w+\\s+TAGS\\s*\\(", Pattern.CASE_INSENSITIVE),
                  Pattern.compile("INTERVAL\\s*\\(\\s*\\d+[smhd]\\s*\\)", Pattern.CASE_INSENSITIVE),
                  Pattern.compile("PARTITION\\s+BY\\s+TBNAME", Pattern.CASE_INSENSITIVE),
                  Pattern.compile(
                      "(STATE_WINDOW|SESSION|EVENT_WINDOW|COUNT_WINDOW)\\s*\\(",
                      Pattern.CASE_INSENSITIVE),
                  Pattern.compile("LAST_ROW\\s*\\(", Pattern.CASE_INSENSITIVE))),
          Map.entry(
              Dialect.TIMESCALEDB,
              List.of(
                  Pattern.compile("time_bucket\\s*\\(", Pattern.CASE_INSENSITIVE),
                  Pattern.compile("time_bucket_gapfill\\s*\\(", Pattern.CASE_INSENSITIVE),
                  Pattern.compile("CREATE\\s+HYPERTABLE", Pattern.CASE_INSENSITIVE),
                  Pattern.compile("(locf|interpolate)\\s*\\(", Pattern.CASE_INSENSITIVE))),
          Map.entry(
              Dialect.QUESTDB,
              List.of(
                  Pattern.compile("SAMPLE\\s+BY", Pattern.CASE_INSENSITIVE),
                  Pattern.compile("LATEST\\s+ON", Pattern.CASE_INSENSITIVE),
                  Pattern.compile("ASOF\\s+JOIN", Pattern.CASE_INSENSITIVE),
                  Pattern.compile("(LT|SPLICE)\\s+JOIN", Pattern.CASE_INSENSITIVE))),
          Map.entry(
              Dialect.CLICKHOUSE,
              List.of(
                  Pattern.compile(
                      "ENGINE\\s*=\\s*"
                          + "(MergeTree|ReplacingMergeTree|SummingMergeTree|AggregatingMergeTree)",
                      Pattern.CASE_INSENSITIVE),
                  Pattern.compile("(toDateTime|toDate|toStartOfHour|toStartOfDay)\\s*\\("),
                  Pattern.compile("arrayJoin\\s*\\("),
                  Pattern.compile("WITH\\s+TOTALS", Pattern.CASE_INSENSITIVE),
                  Pattern.compile("PREWHERE", Pattern.CASE_INSENSITIVE),
                  Pattern.compile("GLOBAL\\s+(IN|JOIN)", Pattern.CASE_INSENSITIVE))),
          Map.entry(
              Dialect.DRUID_SQL,
              List.of(
                  Pattern.compile("__time"),
                  Pattern.compile("FLOOR\\s*\\(\\s*__time", Pattern.CASE_INSENSITIVE),
                  Pattern.compile("TIME_FLOOR\\s*\\(", Pattern.CASE_INSENSITIVE),
                  Pattern.compile("APPROX_COUNT_DISTINCT\\s*\\(", Pattern.CASE_INSENSITIVE))),
          Map.entry(
              Dialect.DRUID_NATIVE,
              List.of(
                  Pattern.compile(
                      "\"queryType\"\\s*:\\s*\"(timeseries|topN|groupBy|scan|search)\""),
                  Pattern.compile("\"dataSource\"\\s*:"),
                  Pattern.compile("\"granularity\"\\s*:"))),
          Map.entry(
              Dialect.OPENTSDB,
              List.of(
                  Pattern.compile("\"queries\"\\s*:\\s*\\["),
                  Pattern.compile("\"metric\"\\s*:\\s*\""),
                  Pattern.compile("\"aggregator\"\\s*:\\s*\"(sum|avg|min|max|count)\""))),
          Map.entry(
              Dialect.GRAPHITE,
              List.of(
                  Pattern.compile("(summarize|derivative|integral|movingAverage|alias)\\s*\\("),
                  Pattern.compile("\\*\\.\\*\\."))));

  private static final Map<Dialect, List<String>> KEYWORDS =
      Map.ofEntries(
          Map.entry(
              Dialect.INFLUXQL,
              List.of(
                  "FILL(",
                  "SLIMIT",
                  "SOFFSET",
                  "TZ(",
                  "INTO",
                  "SHOW MEASUREMENTS",
                  "SHOW TAG",
                  "SHOW FIELD",
                  "GROUP BY time(")),
          Map.entry(
              Dialect.FLUX,
              List.of(
                  "|>",
                  "from(bucket:",
                  "range(",
                  "filter(fn:",
                  "aggregateWindow(",
                  "map(fn:",
                  "pivot(")),
          Map.entry(
              Dialect.PROMQL,
              List.of(
                  "rate(",
                  "irate(",
                  "increase(",
                  "histogram_quantile(",
                  "sum by",
                  "sum without",
                  "avg by",
                  "count by",
                  "__name__",
                  "job=",
                  "instance=")),
          Map.entry(
              Dialect.METRICSQL,
              List.of("range_avg(", "range_median(", "topk_avg(", "keep_metric_names", "rollup(")),
          Map.entry(
              Dialect.TDENGINE,
              List.of(
                  "CREATE STABLE",
                  "USING",
                  "TAGS(",
                  "INTERVAL(",
                  "PARTITION BY",
                  "STATE_WINDOW",
                  "SESSION(",
                  "LAST_ROW(",
                  "TWA(",
                  "SPREAD(",
                  "_wstart",
                  "_wend",
                  "FILL(PREV)",
                  "FILL(LINEAR)",
                  "TBNAME")),
          Map.entry(
              Dialect.TIMESCALEDB,
              List.of(
                  "time_bucket(",
                  "time_bucket_gapfill(",
                  "CREATE HYPERTABLE",
                  "locf(",
                  "interpolate(",
                  "add_retention_policy",
                  "add_compression_policy")),
          Map.entry(
              Dialect.QUESTDB,
              List.of(
                  "SAMPLE BY",
                  "LATEST ON",
                  "ASOF JOIN",
                  "LT JOIN",
                  "SPLICE JOIN",
                  "designated timestamp")),
          Map.entry(
              Dialect.CLICKHOUSE,
              List.of(
                  "MergeTree",
                  "ReplacingMergeTree",
                  "ENGINE=",
                  "toDateTime(",
                  "toStartOfHour(",
                  "arrayJoin(",
                  "PREWHERE",
                  "GLOBAL IN",
                  "WITH TOTALS",
                  "FINAL")),
          Map.entry(
              Dialect.DRUID_SQL,
              List.of(
                  "__time",
                  "TIME_FLOOR(",
                  "TIME_SHIFT(",
                  "APPROX_COUNT_DISTINCT(",
                  "DS_HLL",
                  "DS_THETA")),
          Map.entry(
              Dialect.GRAPHITE,
              List.of(
                  "summarize(",
                  "alias(",
                  "scale(",
                  "offset(",
                  "derivative(",
                  "integral(",
                  "movingAverage(")));

  private static final Pattern BARE_SELECTOR =
      Pattern.compile("^[a-zA-Z_:][a-zA-Z0-9_:]*(\\{.*\\})?(\\[.*\\])?$", Pattern.DOTALL);

  private final int minimumScore;

  public DialectDetector() {
    this(DEFAULT_MINIMUM_SCORE);
  }

  public DialectDetector(int minimumScore) {
    this.minimumScore = minimumScore;
  }

  /** Best guess for the dialect of the query; never fails. */
  public Dialect detect(String query) {
    return detectWithConfidence(query).dialect();
  }

  /**
   * Best guess plus confidence in [0, 1].
   *
   * @param query raw query text, may be null or empty
   * @return detection result, generic SQL with confidence 0 when nothing matched
   */
  public DetectionResult detectWithConfidence(String query) {
    String text = query == null ? "" : query.trim();
    Map<Dialect, Integer> scores = score(text);
    int total = scores.values().stream().mapToInt(Integer::intValue).sum();

    Dialect winner = bestScoring(scores);
    if (winner == null || scores.get(winner) < minimumScore) {
      winner = fallback(text);
    }

    double confidence = total == 0 ? 0.0 : scores.getOrDefault(winner, 0) / (double) total;
    log.debug(
        "Detected dialect {} with confidence {} (scores: {})",
        winner,
        String.format(Locale.ROOT, "%.2f", confidence),
        scores);
    return new DetectionResult(winner, confidence, scores);
  }

  /** Score of every dialect that matched at least one signature or keyword. */
  Map<Dialect, Integer> score(String text) {
    Map<Dialect, Integer> scores = new EnumMap<>(Dialect.class);
    if (text.isEmpty()) {
      return scores;
    }
    String upper = text.toUpperCase(Locale.ROOT);
    for (Dialect dialect : Dialect.values()) {
      int score = 0;
      for (Pattern signature : SIGNATURES.getOrDefault(dialect, List.of())) {
        if (signature.matcher(text).find()) {
          score += SIGNATURE_WEIGHT;
        }
      }
      for (String keyword : KEYWORDS.getOrDefault(dialect, List.of())) {
        if (upper.contains(keyword.toUpperCase(Locale.ROOT))) {
          score += KEYWORD_WEIGHT;
        }
      }
      if (score > 0) {
        scores.put(dialect, score);
      }
    }
    return scores;
  }

  private Dialect bestScoring(Map<Dialect, Integer> scores) {
    Dialect best = null;
    int bestScore = 0;
    for (Dialect dialect : TIE_BREAK_ORDER) {
      int score = scores.getOrDefault(dialect, 0);
      if (score > bestScore) {
        best = dialect;
        bestScore = score;
      }
    }
    return best;
  }

  private Dialect fallback(String text) {
    if (text.startsWith("{") || text.startsWith("[")) {
      if (text.contains("\"queryType\"")) {
        return Dialect.DRUID_NATIVE;
      }
      if (text.contains("\"queries\"") || text.contains("\"metric\"")) {
        return Dialect.OPENTSDB;
      }
    }
    String upper = text.toUpperCase(Locale.ROOT);
    if (upper.startsWith("SELECT") || upper.startsWith("SHOW")) {
      return Dialect.SQL;
    }
    if (BARE_SELECTOR.matcher(text).matches()) {
      return Dialect.PROMQL;
    }
    return Dialect.SQL;
  }
}
