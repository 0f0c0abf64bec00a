package com.ospicorp.filingmetrics.ticker;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Canonicalizes user supplied ticker symbols. Share-class suffixes are written with a hyphen
 * ({@code BRK-A}), which is how the SEC ticker index lists them.
 */
public final class TickerNormalizer {
  private static final Pattern VALID = Pattern.compile("^[A-Z]{1,5}(-[A-Z])?$");
  private static final Pattern DOT_SUFFIX = Pattern.compile("^([A-Z]{1,5})\\.([A-Z])$");
  private static final int MAX_RAW_LENGTH = 10;

  private final Map<String, String> corrections;

  public TickerNormalizer(Map<String, String> corrections) {
    this.corrections = Map.copyOf(corrections);
  }

  public NormalizedTicker normalize(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new InvalidTickerException(raw, "Ticker symbol required", List.of());
    }
    String ticker = raw.strip().toUpperCase(Locale.ROOT);
    if (ticker.length() > MAX_RAW_LENGTH || ticker.chars().anyMatch(Character::isWhitespace)) {
      throw new InvalidTickerException(raw,
          "'" + raw.strip() + "' doesn't look like a ticker symbol. Try 'AAPL' or 'MSFT'",
          suggestionsFor(ticker));
    }

    List<String> notes = new ArrayList<>();
    String corrected = corrections.get(ticker);
    if (corrected != null && !corrected.equals(ticker)) {
      notes.add("Converted " + ticker + " to " + corrected);
      ticker = corrected;
    }

    var dotted = DOT_SUFFIX.matcher(ticker);
    if (dotted.matches()) {
      String hyphenated = dotted.group(1) + '-' + dotted.group(2);
      notes.add("Converted " + ticker + " to " + hyphenated);
      ticker = hyphenated;
    }

    if (!VALID.matcher(ticker).matches()) {
      throw new InvalidTickerException(raw, "'" + ticker + "' is not a valid ticker format",
          suggestionsFor(ticker));
    }
    return new NormalizedTicker(ticker, notes);
  }

  private static List<String> suggestionsFor(String ticker) {
    List<String> suggestions = new ArrayList<>();
    if (ticker.chars().anyMatch(Character::isWhitespace)) {
      suggestions.add("Use the ticker symbol (e.g., 'AAPL') rather than the company name");
    }
    if (ticker.length() > 5) {
      suggestions.add("Most ticker symbols are 1-5 letters (AAPL, MSFT, GOOGL)");
    }
    if (ticker.chars().anyMatch(Character::isDigit)) {
      suggestions.add("Ticker symbols contain letters only");
    }
    return suggestions;
  }
}
