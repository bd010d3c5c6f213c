package com.evoila.rosetta.common.exception;

import java.util.Optional;

/**
 * Front-end failure: a mandatory clause is missing, the statement shape is not recognized for the
 * requested dialect, or a sub-expression is malformed.
 */
public class QueryParseException extends QueryCompilationException {

  private final Integer position;
  private final Integer line;
  private final Integer column;

  public QueryParseException(String message) {
    this(message, null, null, null);
  }

  public QueryParseException(String message, Throwable cause) {
    super(message, cause);
    this.position = null;
    this.line = null;
    this.column = null;
  }

  public QueryParseException(String message, Integer position, Integer line, Integer column) {
    super(message);
    this.position = position;
    this.line = line;
    this.column = column;
  }

  /**
   * Creates an exception pointing at a character offset of the query, deriving the 1-based line
   * and column from it.
   */
  public static QueryParseException at(String message, String query, int position) {
    int line = 1;
    int column = 1;
    int limit = Math.min(position, query == null ? 0 : query.length());
    for (int i = 0; i < limit; i++) {
      if (query.charAt(i) == '\n') {
        line++;
        column = 1;
      } else {
        column++;
      }
    }
    return new QueryParseException(message, position, line, column);
  }

  public Optional<Integer> getPosition() {
    return Optional.ofNullable(position);
  }

  public Optional<Integer> getLine() {
    return Optional.ofNullable(line);
  }

  public Optional<Integer> getColumn() {
    return Optional.ofNullable(column);
  }

  @Override
  public String toString() {
    if (line != null && column != null) {
      return "Parse error at " + line + ":" + column + ": " + getMessage();
    }
    return "Parse error: " + getMessage();
  }
}
