package com.evoila.rosetta.common.dialect;

import com.evoila.rosetta.common.exception.QueryParseException;
import com.evoila.rosetta.common.exception.QueryTranslationException;
import com.evoila.rosetta.common.plan.Dialect;
import com.evoila.rosetta.common.plan.QueryPlan;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Read-only lookup from {@link Dialect} to parser and translator, plus the composed parse and
 * translate pipelines.
 *
 * <p>A registry is assembled once and never changes afterwards, so it can be shared by any number
 * of threads without locking. Inside the application it is a bean built from every {@link
 * DialectParser} and {@link DialectTranslator} bean; plain Java callers use {@link #shared()},
 * which lazily assembles one instance from {@code META-INF/services} registrations. Adding a
 * dialect means registering another implementation, never editing this class.
 */
@Slf4j
public final class DialectRegistry {

  private final Map<Dialect, DialectParser> parsers;
  private final Map<Dialect, DialectTranslator> translators;
  private final DialectDetector detector;

  public DialectRegistry(
      Collection<? extends DialectParser> parsers,
      Collection<? extends DialectTranslator> translators,
      DialectDetector detector) {
    Map<Dialect, DialectParser> parserMap = new EnumMap<>(Dialect.class);
    for (DialectParser parser : parsers) {
      DialectParser previous = parserMap.putIfAbsent(parser.dialect(), parser);
      if (previous != null) {
        throw new IllegalStateException(
            "Duplicate parser for dialect "
                + parser.dialect()
                + ": "
                + parser.getClass().getName());
      }
    }
    Map<Dialect, DialectTranslator> translatorMap = new EnumMap<>(Dialect.class);
    for (DialectTranslator translator : translators) {
      DialectTranslator previous =
          translatorMap.putIfAbsent(translator.targetDialect(), translator);
      if (previous != null) {
        throw new IllegalStateException(
            "Duplicate translator for dialect "
                + translator.targetDialect()
                + ": "
                + translator.getClass().getName());
      }
    }
    this.parsers = Collections.unmodifiableMap(parserMap);
    this.translators = Collections.unmodifiableMap(translatorMap);
    this.detector = detector != null ? detector : new DialectDetector();
    log.info(
        "Dialect registry initialized with parsers {} and translators {}",
        this.parsers.keySet(),
        this.translators.keySet());
  }

  /** Registry assembled from {@code META-INF/services} registrations on first use. */
  public static DialectRegistry shared() {
    return SharedHolder.INSTANCE;
  }

  private static final class SharedHolder {
    private static final DialectRegistry INSTANCE = loadFromServiceRegistrations();

    private SharedHolder() {}
  }

  static DialectRegistry loadFromServiceRegistrations() {
    List<DialectParser> parsers = new ArrayList<>();
    ServiceLoader.load(DialectParser.class).forEach(parsers::add);
    List<DialectTranslator> translators = new ArrayList<>();
    ServiceLoader.load(DialectTranslator.class).forEach(translators::add);
    return new DialectRegistry(parsers, translators, new DialectDetector());
  }

  public DialectDetector detector() {
    return detector;
  }

  /** Dialects that can be parsed. */
  public Set<Dialect> supportedDialects() {
    return parsers.keySet();
  }

  /** Dialects that can be rendered. */
  public Set<Dialect> translationTargets() {
    return translators.keySet();
  }

  public Optional<DialectParser> findParser(Dialect dialect) {
    return Optional.ofNullable(parsers.get(dialect));
  }

  public Optional<DialectTranslator> findTranslator(Dialect dialect) {
    return Optional.ofNullable(translators.get(dialect));
  }

  /**
   * Parses a query in an explicitly named dialect.
   *
   * @throws QueryParseException if the dialect has no parser or the text does not parse
   */
  public QueryPlan parse(Dialect dialect, String query) {
    DialectParser parser =
        findParser(dialect)
            .orElseThrow(() -> new QueryParseException("Unsupported dialect: " + dialect));
    return parser.parse(query);
  }

  /**
   * Detects the dialect, then parses.
   *
   * @throws QueryParseException if the detected dialect has no parser or the text does not parse
   */
  public QueryPlan parseAuto(String query) {
    return parseAutoWithConfidence(query).plan();
  }

  /** Detects the dialect, then parses, reporting the detected dialect and confidence. */
  public ParsedQuery parseAutoWithConfidence(String query) {
    DetectionResult detection = detector.detectWithConfidence(query);
    QueryPlan plan = parse(detection.dialect(), query);
    return new ParsedQuery(plan, detection.dialect(), detection.confidence());
  }

  /**
   * Renders a plan in the target dialect.
   *
   * @throws QueryTranslationException if no translator is registered for the target
   */
  public String translate(QueryPlan plan, Dialect target) {
    DialectTranslator translator =
        findTranslator(target)
            .orElseThrow(
                () ->
                    new QueryTranslationException(
                        "No translator for dialect: " + target, String.valueOf(target)));
    return translator.translate(plan);
  }

  /**
   * Parses a query (in {@code source}, or auto-detected when null) and renders it in {@code
   * target}. Parse failures are reported as translation failures carrying the parse error as
   * cause.
   *
   * @throws QueryTranslationException if parsing or translation fails
   */
  public String translateQuery(String query, Dialect source, Dialect target) {
    QueryPlan plan;
    try {
      plan = source != null ? parse(source, query) : parseAuto(query);
    } catch (QueryParseException e) {
      throw new QueryTranslationException("Parse error: " + e.getMessage(), e);
    }
    return translate(plan, target);
  }

  public String translateQuery(String query, Dialect target) {
    return translateQuery(query, null, target);
  }
}
