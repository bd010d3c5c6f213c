package com.evoila.rosetta.common.sql;

import com.evoila.rosetta.common.utils.StringParser;
import com.evoila.rosetta.common.utils.StringParser.KeywordMatch;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A SELECT statement split into its top-level clauses. Keywords nested in parentheses or quotes
 * (sub-queries, {@code EXTRACT(x FROM y)}, string literals) never start a clause.
 *
 * @param clauses clause text keyed by its normalized keyword, in order of appearance
 * @param repeated clauses whose keyword appeared more than once, with the ignored text
 */
public record SqlStatement(Map<String, String> clauses, List<String> repeated) {

  public SqlStatement {
    clauses = Collections.unmodifiableMap(new LinkedHashMap<>(clauses));
    repeated = List.copyOf(repeated);
  }

  /**
   * Splits a statement at the given clause keywords. The first occurrence of each keyword wins,
   * later duplicates are reported in {@link #repeated()}.
   */
  public static SqlStatement split(String text, List<String> keywords) {
    return split(text, keywords, Set.of());
  }

  /**
   * Like {@link #split(String, List)}, but a keyword from {@code functionNames} followed directly
   * by {@code (} is a function call in an expression and does not start a clause.
   */
  public static SqlStatement split(String text, List<String> keywords, Set<String> functionNames) {
    List<KeywordMatch> matches =
        StringParser.findTopLevelKeywords(text, keywords).stream()
            .filter(match -> !isCall(text, match, functionNames))
            .toList();
    Map<String, String> clauses = new LinkedHashMap<>();
    List<String> repeated = new ArrayList<>();
    for (int i = 0; i < matches.size(); i++) {
      KeywordMatch match = matches.get(i);
      int end = i + 1 < matches.size() ? matches.get(i + 1).start() : text.length();
      String key = normalize(match.keyword());
      String content = text.substring(match.end(), end).trim();
      if (clauses.containsKey(key)) {
        repeated.add(key + " " + content);
      } else {
        clauses.put(key, content);
      }
    }
    return new SqlStatement(clauses, repeated);
  }

  private static boolean isCall(String text, KeywordMatch match, Set<String> functionNames) {
    return functionNames.contains(normalize(match.keyword()))
        && match.end() < text.length()
        && text.charAt(match.end()) == '(';
  }

  private static String normalize(String keyword) {
    return keyword.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
  }

  public Optional<String> clause(String keyword) {
    return Optional.ofNullable(clauses.get(normalize(keyword)));
  }

  public boolean has(String keyword) {
    return clauses.containsKey(normalize(keyword));
  }

  /**
   * Splits a WHERE clause into its top-level AND-ed conjuncts. The AND belonging to a BETWEEN is
   * not a separator. A clause with a top-level OR is returned whole because splitting it would
   * change precedence.
   */
  public static List<String> splitConjuncts(String where) {
    List<KeywordMatch> matches =
        StringParser.findTopLevelKeywords(where, List.of("AND", "OR", "BETWEEN"));
    if (matches.stream().anyMatch(match -> match.keyword().equals("OR"))) {
      return List.of(where.trim());
    }
    List<String> conjuncts = new ArrayList<>();
    int start = 0;
    boolean pendingBetween = false;
    for (KeywordMatch match : matches) {
      if (match.keyword().equals("BETWEEN")) {
        pendingBetween = true;
      } else if (pendingBetween) {
        pendingBetween = false;
      } else {
        addConjunct(conjuncts, where.substring(start, match.start()));
        start = match.end();
      }
    }
    addConjunct(conjuncts, where.substring(start));
    return conjuncts;
  }

  private static void addConjunct(List<String> conjuncts, String raw) {
    String conjunct = raw.trim();
    while (conjunct.length() > 1
        && conjunct.startsWith("(")
        && StringParser.findClosing(conjunct, 0) == conjunct.length() - 1) {
      conjunct = conjunct.substring(1, conjunct.length() - 1).trim();
    }
    if (!conjunct.isEmpty()) {
      conjuncts.add(conjunct);
    }
  }
}
