package com.evoila.rosetta.common.utils;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A function call expression {@code name(arg, ...)} whose closing parenthesis ends the expression.
 *
 * @param name function name as written
 * @param argumentText raw text between the parentheses
 * @param arguments top-level arguments, trimmed
 */
public record FunctionCall(String name, String argumentText, List<String> arguments) {

  private static final Pattern CALL_START = Pattern.compile("^([A-Za-z_][\\w.]*)\\s*\\(");

  public FunctionCall {
    arguments = List.copyOf(arguments);
  }

  /**
   * Recognizes {@code expression} as a single function call.
   *
   * @return the call, or empty if the expression is not exactly one call
   * @throws IllegalArgumentException if the argument list is unbalanced
   */
  public static Optional<FunctionCall> parse(String expression) {
    String text = expression.trim();
    Matcher matcher = CALL_START.matcher(text);
    if (!matcher.find()) {
      return Optional.empty();
    }
    int open = matcher.end() - 1;
    int close = StringParser.findClosing(text, open);
    if (close < 0) {
      throw new IllegalArgumentException("Unclosed argument list of " + matcher.group(1));
    }
    if (close != text.length() - 1) {
      return Optional.empty();
    }
    String argumentText = text.substring(open + 1, close);
    return Optional.of(
        new FunctionCall(
            matcher.group(1), argumentText, StringParser.splitTopLevel(argumentText, ',')));
  }

  public String lowerName() {
    return name.toLowerCase(Locale.ROOT);
  }

  public Optional<String> argument(int index) {
    return index < arguments.size() ? Optional.of(arguments.get(index)) : Optional.empty();
  }
}
