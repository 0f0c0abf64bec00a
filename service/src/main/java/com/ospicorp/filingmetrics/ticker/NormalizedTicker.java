package com.ospicorp.filingmetrics.ticker;

import java.util.List;

/**
 * Ticker in the form used by the SEC ticker index, with any notes about rewrites applied to the
 * raw input.
 */
public record NormalizedTicker(String symbol, List<String> notes) {

  public NormalizedTicker {
    notes = List.copyOf(notes);
  }

  @Override
  public String toString() {
    return symbol;
  }
}
