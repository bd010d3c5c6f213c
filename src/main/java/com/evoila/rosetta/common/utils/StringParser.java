package com.evoila.rosetta.common.utils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;

/**
 * Quote and bracket aware scanning helpers shared by the dialect parsers.
 *
 * <p>All operations skip over single, double and back-quoted strings (with backslash escapes) and
 * track nesting of {@code ()}, {@code []} and {@code {}} so that separators and keywords inside
 * function arguments or label selectors are never mistaken for top-level ones. A {@code /.../}
 * regex literal right after a {@code =~} or {@code !~} operator is skipped like a string.
 *
 * <p>Protects against oversized input: splitting stops with an {@link IllegalArgumentException}
 * once {@value #MAX_PARTS} parts have been produced.
 */
@Slf4j
public final class StringParser {

  private static final int MAX_PARTS = 1000; // Prevent memory exhaustion

  private StringParser() {
    // Utility class - prevent instantiation
  }

  /**
   * Splits by a separator that appears at nesting depth zero and outside quotes. Parts are trimmed
   * and empty parts are dropped.
   *
   * <p>Examples: - splitTopLevel("a, f(b, c), 'x,y'", ',') → ["a", "f(b, c)", "'x,y'"] -
   * splitTopLevel("from(bucket: \"b\") |> range(start: -1h)", '|') splits pipe stages when
   * combined with {@link #splitPipeline(String)}
   *
   * @throws IllegalArgumentException on unbalanced brackets or unterminated quotes
   */
  public static List<String> splitTopLevel(String input, char separator) {
    List<String> parts = new ArrayList<>();
    if (input == null || input.isBlank()) {
      return parts;
    }
    ScanState state = new ScanState(input);
    int partStart = 0;
    for (int i = 0; i < input.length(); i++) {
      char c = input.charAt(i);
      if (c == separator && state.atTopLevel()) {
        addPart(parts, input.substring(partStart, i));
        partStart = i + 1;
        continue;
      }
      state.advance(i, c);
    }
    state.requireBalanced();
    addPart(parts, input.substring(partStart));
    return parts;
  }

  /**
   * Splits on whitespace outside quotes and brackets, so {@code "my table" AS t} yields three
   * words.
   *
   * @throws IllegalArgumentException on unbalanced brackets or unterminated quotes
   */
  public static List<String> splitWords(String input) {
    List<String> words = new ArrayList<>();
    if (input == null || input.isBlank()) {
      return words;
    }
    ScanState state = new ScanState(input);
    int wordStart = 0;
    for (int i = 0; i < input.length(); i++) {
      char c = input.charAt(i);
      if (Character.isWhitespace(c) && state.atTopLevel()) {
        addPart(words, input.substring(wordStart, i));
        wordStart = i + 1;
        continue;
      }
      state.advance(i, c);
    }
    state.requireBalanced();
    addPart(words, input.substring(wordStart));
    return words;
  }

  /**
   * Splits a Flux pipeline on top-level {@code |>} operators.
   *
   * @throws IllegalArgumentException on unbalanced brackets or unterminated quotes
   */
  public static List<String> splitPipeline(String input) {
    List<String> stages = new ArrayList<>();
    ScanState state = new ScanState(input);
    int stageStart = 0;
    for (int i = 0; i < input.length(); i++) {
      char c = input.charAt(i);
      if (c == '|' && state.atTopLevel() && i + 1 < input.length() && input.charAt(i + 1) == '>') {
        addPart(stages, input.substring(stageStart, i));
        stageStart = i + 2;
        i++;
        continue;
      }
      state.advance(i, c);
    }
    state.requireBalanced();
    addPart(stages, input.substring(stageStart));
    return stages;
  }

  private static void addPart(List<String> parts, String raw) {
    String part = raw.trim();
    if (!part.isEmpty()) {
      parts.add(part);
    }
    if (parts.size() > MAX_PARTS) {
      throw new IllegalArgumentException("Too many parts, max allowed: " + MAX_PARTS);
    }
  }

  /**
   * Finds the bracket closing the one at {@code openIndex}.
   *
   * @return index of the matching closing bracket, or -1 if it is never closed
   */
  public static int findClosing(String text, int openIndex) {
    ScanState state = new ScanState(text);
    for (int i = openIndex; i < text.length(); i++) {
      state.advance(i, text.charAt(i));
      if (state.depth == 0 && !state.inQuotes) {
        return i;
      }
    }
    return -1;
  }

  /**
   * Finds a keyword (case-insensitive, whole word, any whitespace between its words) at nesting
   * depth zero and outside quotes, starting the search at {@code from}.
   *
   * @return start index of the keyword, or -1
   */
  public static int indexOfTopLevelKeyword(String text, String keyword, int from) {
    String[] words = keyword.trim().split("\\s+");
    ScanState state = new ScanState(text);
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (i >= from && state.atTopLevel() && isWordStart(text, i)) {
        int end = matchWords(text, i, words);
        if (end > 0) {
          return i;
        }
      }
      state.advance(i, c);
    }
    return -1;
  }

  /** Keyword occurrence found by {@link #findTopLevelKeywords(String, List)}. */
  public record KeywordMatch(String keyword, int start, int end) {}

  /**
   * Finds every top-level occurrence of the given keywords, left to right. Where several keywords
   * match at the same position the longest one wins, so {@code GROUP BY} is preferred over a
   * hypothetical {@code GROUP}.
   */
  public static List<KeywordMatch> findTopLevelKeywords(String text, List<String> keywords) {
    List<String[]> split = new ArrayList<>();
    for (String keyword : keywords) {
      split.add(keyword.trim().split("\\s+"));
    }
    List<KeywordMatch> matches = new ArrayList<>();
    ScanState state = new ScanState(text);
    for (int i = 0; i < text.length(); i++) {
      if (state.atTopLevel() && isWordStart(text, i)) {
        KeywordMatch best = null;
        for (int k = 0; k < keywords.size(); k++) {
          int end = matchWords(text, i, split.get(k));
          if (end > 0 && (best == null || end > best.end())) {
            best = new KeywordMatch(keywords.get(k), i, end);
          }
        }
        if (best != null) {
          matches.add(best);
          for (int j = i; j < best.end(); j++) {
            state.advance(j, text.charAt(j));
          }
          i = best.end() - 1;
          continue;
        }
      }
      state.advance(i, text.charAt(i));
    }
    return matches;
  }

  /**
   * Matches a sequence of words at {@code start}.
   *
   * @return index just past the last word, or -1 if the words do not match there
   */
  public static int matchWords(String text, int start, String[] words) {
    int position = start;
    for (int w = 0; w < words.length; w++) {
      if (w > 0) {
        int afterSpace = skipWhitespace(text, position);
        if (afterSpace == position) {
          return -1;
        }
        position = afterSpace;
      }
      String word = words[w];
      if (!text.regionMatches(true, position, word, 0, word.length())) {
        return -1;
      }
      position += word.length();
    }
    if (position < text.length() && isIdentifierChar(text.charAt(position))) {
      return -1;
    }
    return position;
  }

  public static int skipWhitespace(String text, int position) {
    int i = position;
    while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
      i++;
    }
    return i;
  }

  private static boolean isWordStart(String text, int i) {
    return isIdentifierChar(text.charAt(i)) && (i == 0 || !isIdentifierChar(text.charAt(i - 1)));
  }

  public static boolean isIdentifierChar(char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }

  /** Removes one pair of matching surrounding quotes ({@code "}, {@code '} or backtick). */
  public static String unquote(String text) {
    if (text == null) {
      return null;
    }
    String trimmed = text.trim();
    if (trimmed.length() >= 2) {
      char first = trimmed.charAt(0);
      char last = trimmed.charAt(trimmed.length() - 1);
      if (first == last && (first == '"' || first == '\'' || first == '`')) {
        return trimmed
            .substring(1, trimmed.length() - 1)
            .replace("\\" + first, String.valueOf(first));
      }
    }
    return trimmed;
  }

  public static boolean isQuoted(String text) {
    String trimmed = text.trim();
    return trimmed.length() >= 2
        && (trimmed.charAt(0) == '"' || trimmed.charAt(0) == '\'' || trimmed.charAt(0) == '`')
        && trimmed.charAt(trimmed.length() - 1) == trimmed.charAt(0);
  }

  /** Upper-cased leading word of a statement, or an empty string. */
  public static String leadingKeyword(String text) {
    String trimmed = text.trim();
    int end = 0;
    while (end < trimmed.length() && isIdentifierChar(trimmed.charAt(end))) {
      end++;
    }
    return trimmed.substring(0, end).toUpperCase(Locale.ROOT);
  }

  /** Tracks quoting and nesting while walking a string left to right. */
  private static class ScanState {
    private final String text;
    private final StringBuilder brackets = new StringBuilder();
    private int depth = 0;
    private boolean inQuotes = false;
    private char quoteChar = 0;
    private boolean escaped = false;
    private int quoteStart = -1;
    private char lastSignificant = 0;

    ScanState(String text) {
      this.text = text;
    }

    boolean atTopLevel() {
      return depth == 0 && !inQuotes;
    }

    void advance(int index, char c) {
      if (inQuotes) {
        handleQuotedChar(c);
        return;
      }
      boolean regexStart = c == '/' && lastSignificant == '~';
      if (!Character.isWhitespace(c)) {
        lastSignificant = c;
      }
      if (c == '"' || c == '\'' || c == '`' || regexStart) {
        inQuotes = true;
        quoteChar = c;
        quoteStart = index;
      } else if (c == '(' || c == '[' || c == '{') {
        brackets.append(c);
        depth++;
      } else if (c == ')' || c == ']' || c == '}') {
        handleClose(index, c);
      }
    }

    private void handleQuotedChar(char c) {
      if (escaped) {
        escaped = false;
      } else if (c == '\\') {
        escaped = true;
      } else if (c == quoteChar) {
        inQuotes = false;
        quoteChar = 0;
      }
    }

    private void handleClose(int index, char c) {
      if (depth == 0) {
        log.debug("StringParser: Unmatched closing '{}' at position {}", c, index);
        throw new IllegalArgumentException(
            "Unmatched '" + c + "' at position " + index + " in: " + text);
      }
      char open = brackets.charAt(brackets.length() - 1);
      if (!matches(open, c)) {
        throw new IllegalArgumentException(
            "Mismatched '" + open + "' and '" + c + "' at position " + index);
      }
      brackets.setLength(brackets.length() - 1);
      depth--;
    }

    private static boolean matches(char open, char close) {
      return (open == '(' && close == ')')
          || (open == '[' && close == ']')
          || (open == '{' && close == '}');
    }

    void requireBalanced() {
      if (inQuotes) {
        throw new IllegalArgumentException(
            (quoteChar == '/' ? "Unterminated regex" : "Unterminated string")
                + " starting at position "
                + quoteStart);
      }
      if (depth != 0) {
        throw new IllegalArgumentException(
            "Unclosed '" + brackets.charAt(brackets.length() - 1) + "'");
      }
    }
  }
}
