package com.evoila.rosetta.common.exception;

import java.util.Optional;

/** Back-end failure, typically a target dialect without a registered translator. */
public class QueryTranslationException extends QueryCompilationException {

  private final String unsupportedFeature;

  public QueryTranslationException(String message) {
    super(message);
    this.unsupportedFeature = null;
  }

  public QueryTranslationException(String message, Throwable cause) {
    super(message, cause);
    this.unsupportedFeature = null;
  }

  public QueryTranslationException(String message, String unsupportedFeature) {
    super(message);
    this.unsupportedFeature = unsupportedFeature;
  }

  public Optional<String> getUnsupportedFeature() {
    return Optional.ofNullable(unsupportedFeature);
  }

  @Override
  public String toString() {
    if (unsupportedFeature != null) {
      return "Translation error: " + getMessage() + " (unsupported: " + unsupportedFeature + ")";
    }
    return "Translation error: " + getMessage();
  }
}
