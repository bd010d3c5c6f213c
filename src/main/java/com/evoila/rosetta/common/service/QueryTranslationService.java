package com.evoila.rosetta.common.service;

import com.evoila.rosetta.common.dialect.DetectionResult;
import com.evoila.rosetta.common.dialect.DialectRegistry;
import com.evoila.rosetta.common.dialect.ParsedQuery;
import com.evoila.rosetta.common.exception.QueryCompilationException;
import com.evoila.rosetta.common.model.DetectionResponse;
import com.evoila.rosetta.common.model.DialectInfo;
import com.evoila.rosetta.common.model.ParseResponse;
import com.evoila.rosetta.common.model.TranslationResponse;
import com.evoila.rosetta.common.plan.Dialect;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point of the web layer into the registry. Resolves dialect names, logs every translation
 * and maps results to response models; compilation errors are logged and rethrown unchanged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryTranslationService {

  static final double EXPLICIT_CONFIDENCE = 1.0;

  private final DialectRegistry registry;

  public List<DialectInfo> dialects() {
    return Arrays.stream(Dialect.values())
        .map(
            dialect ->
                new DialectInfo(
                    dialect.getId(),
                    dialect.getDisplayName(),
                    dialect.getAliases(),
                    registry.supportedDialects().contains(dialect),
                    registry.translationTargets().contains(dialect)))
        .toList();
  }

  public DetectionResponse detect(String query) {
    DetectionResult result = registry.detector().detectWithConfidence(query);
    Map<String, Integer> scores = new LinkedHashMap<>();
    result.scores().forEach((dialect, score) -> scores.put(dialect.getId(), score));
    log.debug("Detected {} with confidence {}", result.dialect(), result.confidence());
    return new DetectionResponse(result.dialect().getId(), result.confidence(), scores);
  }

  /**
   * Parses the query in the named dialect, or the detected one when no name is given.
   *
   * @throws IllegalArgumentException if the query is missing or the dialect name is unknown
   */
  public ParseResponse parse(String query, String dialect) {
    requireQuery(query);
    ParsedQuery parsed = parseQuery(query, dialect);
    return new ParseResponse(
        parsed.dialect().getId(), parsed.confidence(), parsed.plan().toString());
  }

  /**
   * Parses the query and renders it in the target dialect.
   *
   * @throws IllegalArgumentException if the query or target is missing or a name is unknown
   */
  public TranslationResponse translate(String query, String source, String target) {
    requireQuery(query);
    if (isBlank(target)) {
      throw new IllegalArgumentException("Target dialect is required");
    }
    Dialect targetDialect = Dialect.fromString(target);
    try {
      ParsedQuery parsed = parseQuery(query, source);
      String translated = registry.translate(parsed.plan(), targetDialect);
      log.info(
          "Translated {} query to {} (confidence {}): '{}' -> '{}'",
          parsed.dialect(),
          targetDialect,
          parsed.confidence(),
          query,
          translated);
      return new TranslationResponse(
          parsed.dialect().getId(), targetDialect.getId(), parsed.confidence(), translated);
    } catch (QueryCompilationException e) {
      log.warn("Translation to {} failed for '{}': {}", targetDialect, query, e.getMessage());
      throw e;
    }
  }

  private ParsedQuery parseQuery(String query, String dialect) {
    if (isBlank(dialect)) {
      return registry.parseAutoWithConfidence(query);
    }
    Dialect source = Dialect.fromString(dialect);
    return new ParsedQuery(registry.parse(source, query), source, EXPLICIT_CONFIDENCE);
  }

  private static void requireQuery(String query) {
    if (isBlank(query)) {
      throw new IllegalArgumentException("Query is required");
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
