package com.evoila.rosetta.common.utils;

import java.time.Duration;
import java.time.Period;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conversion between dialect duration literals and milliseconds.
 *
 * <p>Supported literal families:
 *
 * <ul>
 *   <li>compact literals such as {@code 5m}, {@code 1h30m}, {@code 250ms} (InfluxQL, Flux, PromQL)
 *       with optional dialect-specific unit tables ({@code a} in TDengine, {@code T} in QuestDB)
 *   <li>SQL interval phrases such as {@code 5 minutes} or {@code 1 HOUR}
 *   <li>ISO-8601 periods such as {@code PT1H} or {@code P1D} (Druid)
 * </ul>
 *
 * <p>Months and years are approximated as 30 and 365 days.
 */
public final class DurationUtils {

  public static final long SECOND = 1_000L;
  public static final long MINUTE = 60 * SECOND;
  public static final long HOUR = 60 * MINUTE;
  public static final long DAY = 24 * HOUR;
  public static final long WEEK = 7 * DAY;
  public static final long MONTH = 30 * DAY;
  public static final long YEAR = 365 * DAY;

  /** Units understood by InfluxQL, Flux, PromQL and Graphite. */
  public static final Map<String, Long> COMPACT_UNITS =
      Map.ofEntries(
          Map.entry("ns", 0L),
          Map.entry("us", 0L),
          Map.entry("µs", 0L),
          Map.entry("u", 0L),
          Map.entry("ms", 1L),
          Map.entry("s", SECOND),
          Map.entry("m", MINUTE),
          Map.entry("h", HOUR),
          Map.entry("d", DAY),
          Map.entry("w", WEEK),
          Map.entry("y", YEAR));

  private static final Pattern COMPACT_PART =
      Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*([a-zA-Zµ]+)");
  private static final Pattern SQL_INTERVAL =
      Pattern.compile("^\\s*(-?\\d+(?:\\.\\d+)?)\\s*([a-zA-Z]+)\\s*$");

  /** Largest whole unit first, used by every compact formatter. */
  private static final long[] FORMAT_STEPS = {DAY, HOUR, MINUTE, SECOND};

  private static final String[] FORMAT_SUFFIXES = {"d", "h", "m", "s"};

  private static final String[] SQL_UNIT_NAMES = {"day", "hour", "minute", "second"};

  private DurationUtils() {
    // Utility class - prevent instantiation
  }

  /**
   * Parses a compact duration literal with the default unit table.
   *
   * @throws IllegalArgumentException if the literal is not a duration
   */
  public static long parse(String literal) {
    return parse(literal, COMPACT_UNITS);
  }

  /**
   * Parses a compact duration literal such as {@code 1h30m} against a unit table mapping a suffix
   * to its length in milliseconds. Sub-millisecond units map to 0 and are resolved from the
   * nanosecond count instead.
   *
   * @throws IllegalArgumentException if the literal is empty, has an unknown unit or trailing text,
   *     or exceeds the range of a {@code long}
   */
  public static long parse(String literal, Map<String, Long> units) {
    if (literal == null || literal.isBlank()) {
      throw new IllegalArgumentException("Empty duration");
    }
    String text = literal.trim();
    Matcher matcher = COMPACT_PART.matcher(text);
    int position = 0;
    double total = 0;
    while (matcher.find()) {
      if (matcher.start() != position) {
        throw new IllegalArgumentException("Invalid duration: " + literal);
      }
      double amount = Double.parseDouble(matcher.group(1));
      total += amount * unitMillis(matcher.group(2), units, literal);
      position = matcher.end();
    }
    if (position == 0 || position != text.length()) {
      throw new IllegalArgumentException("Invalid duration: " + literal);
    }
    return millis(total, literal);
  }

  private static long millis(double total, String literal) {
    if (Math.abs(total) >= Long.MAX_VALUE) {
      throw new IllegalArgumentException("Duration out of range: " + literal);
    }
    return Math.round(total);
  }

  private static double unitMillis(String unit, Map<String, Long> units, String literal) {
    Long millis = units.get(unit);
    if (millis == null) {
      throw new IllegalArgumentException("Unknown duration unit '" + unit + "' in " + literal);
    }
    if (millis > 0) {
      return millis;
    }
    return switch (unit) {
      case "ns" -> 1e-6;
      case "us", "µs", "u" -> 1e-3;
      default -> throw new IllegalArgumentException("Unknown duration unit: " + unit);
    };
  }

  /** Returns true if the text is a compact duration in the given unit table. */
  public static boolean isDuration(String literal, Map<String, Long> units) {
    try {
      parse(literal, units);
      return true;
    } catch (IllegalArgumentException e) {
      return false;
    }
  }

  /**
   * Formats milliseconds as the largest whole unit among days, hours, minutes and seconds, falling
   * back to {@code millisSuffix} for sub-second remainders. Zero renders as {@code 0s}.
   */
  public static String format(long millis, String millisSuffix) {
    if (millis == 0) {
      return "0s";
    }
    for (int i = 0; i < FORMAT_STEPS.length; i++) {
      if (millis % FORMAT_STEPS[i] == 0) {
        return (millis / FORMAT_STEPS[i]) + FORMAT_SUFFIXES[i];
      }
    }
    return millis + millisSuffix;
  }

  /** Compact format with {@code ms} as sub-second unit. */
  public static String format(long millis) {
    return format(millis, "ms");
  }

  /**
   * Parses an SQL interval phrase such as {@code 5 minutes}, {@code '1' HOUR} or the compact form
   * {@code 5m}.
   *
   * @throws IllegalArgumentException if the phrase is not an interval
   */
  public static long parseSqlInterval(String phrase) {
    if (phrase == null) {
      throw new IllegalArgumentException("Empty interval");
    }
    String text = phrase.replace("'", " ").trim();
    Matcher matcher = SQL_INTERVAL.matcher(text);
    if (!matcher.matches()) {
      return parse(text.replace(" ", ""));
    }
    double amount = Double.parseDouble(matcher.group(1));
    return millis(amount * sqlUnitMillis(matcher.group(2)), phrase);
  }

  /** Milliseconds in an SQL interval unit name such as {@code minutes} or {@code HOUR}. */
  public static long sqlUnitMillis(String unit) {
    String normalized = unit.toLowerCase(Locale.ROOT);
    if (normalized.endsWith("s") && normalized.length() > 2 && !normalized.equals("ms")) {
      normalized = normalized.substring(0, normalized.length() - 1);
    }
    return switch (normalized) {
      case "millisecond", "ms", "msec" -> 1L;
      case "second", "sec", "s" -> SECOND;
      case "minute", "min", "m" -> MINUTE;
      case "hour", "hr", "h" -> HOUR;
      case "day", "d" -> DAY;
      case "week", "w" -> WEEK;
      case "month", "mon" -> MONTH;
      case "year", "yr", "y" -> YEAR;
      default -> throw new IllegalArgumentException("Unknown interval unit: " + unit);
    };
  }

  /** Formats milliseconds as an SQL interval phrase such as {@code 5 minutes}. */
  public static String formatSqlInterval(long millis) {
    if (millis != 0) {
      for (int i = 0; i < FORMAT_STEPS.length; i++) {
        if (millis % FORMAT_STEPS[i] == 0) {
          return plural(millis / FORMAT_STEPS[i], SQL_UNIT_NAMES[i]);
        }
      }
    }
    return plural(millis, "millisecond");
  }

  private static String plural(long amount, String unit) {
    return amount + " " + (amount == 1 ? unit : unit + "s");
  }

  /**
   * Parses an ISO-8601 duration ({@code PT1H}) or period ({@code P1D}, {@code P1W}, {@code P1M}).
   *
   * @throws IllegalArgumentException if the text is neither
   */
  public static long parseIsoPeriod(String text) {
    String normalized = text.trim().toUpperCase(Locale.ROOT);
    try {
      return Duration.parse(normalized).toMillis();
    } catch (DateTimeParseException notDuration) {
      try {
        Period period = Period.parse(normalized);
        return period.getYears() * YEAR + period.getMonths() * MONTH + period.getDays() * DAY;
      } catch (DateTimeParseException notPeriod) {
        throw new IllegalArgumentException("Invalid ISO-8601 period: " + text, notPeriod);
      }
    }
  }

  /** Formats milliseconds as an ISO-8601 period, using days where they divide evenly. */
  public static String formatIsoPeriod(long millis) {
    if (millis > 0 && millis % DAY == 0) {
      return "P" + (millis / DAY) + "D";
    }
    return Duration.ofMillis(millis).toString();
  }
}
