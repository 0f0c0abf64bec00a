package com.ospicorp.filingmetrics.ticker;

import java.util.List;

public class InvalidTickerException extends RuntimeException {
  public static final String ERROR_CODE = "INVALID_TICKER";

  private final String input;
  private final List<String> suggestions;

  public InvalidTickerException(String input, String reason, List<String> suggestions) {
    super(reason);
    this.input = input;
    this.suggestions = List.copyOf(suggestions);
  }

  public String errorCode() {
    return ERROR_CODE;
  }

  public String input() {
    return input;
  }

  public String reason() {
    return getMessage();
  }

  public List<String> suggestions() {
    return suggestions;
  }
}
