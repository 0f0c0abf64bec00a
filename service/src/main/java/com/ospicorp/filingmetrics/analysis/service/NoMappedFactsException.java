package com.ospicorp.filingmetrics.analysis.service;

import com.ospicorp.filingmetrics.facts.model.Metric;

public class NoMappedFactsException extends RuntimeException {
  public static final String ERROR_CODE = "NO_MAPPED_FACTS";

  private final String ticker;
  private final Metric metric;

  public NoMappedFactsException(String ticker, Metric metric) {
    super("No usable " + metric + " data reported for " + ticker);
    this.ticker = ticker;
    this.metric = metric;
  }

  public String errorCode() {
    return ERROR_CODE;
  }

  public String ticker() {
    return ticker;
  }

  public Metric metric() {
    return metric;
  }
}
