package com.evoila.rosetta.common.exception;

/** Base class for failures surfaced to callers of the parse and translate operations. */
public abstract class QueryCompilationException extends RuntimeException {

  protected QueryCompilationException(String message) {
    super(message);
  }

  protected QueryCompilationException(String message, Throwable cause) {
    super(message, cause);
  }
}
