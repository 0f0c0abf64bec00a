package com.ospicorp.filingmetrics.analysis.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.LocalDate;

/** Flat rendering of a {@link GrowthResult} for tabular exports. */
@JsonPropertyOrder({"ticker", "metric", "kind", "from", "fromEnd", "to", "toEnd", "fromValue",
    "toValue", "rate", "caveat", "display"})
public record GrowthRow(
    String ticker,
    String metric,
    String kind,
    String from,
    LocalDate fromEnd,
    String to,
    LocalDate toEnd,
    Double fromValue,
    Double toValue,
    Double rate,
    String caveat,
    String display
) {

  public static GrowthRow of(String ticker, GrowthResult result) {
    return new GrowthRow(
        ticker,
        result.metric().name(),
        result.kind().name(),
        result.fromPeriod().fiscalPeriodLabel(),
        result.fromPeriod().periodEnd(),
        result.toPeriod().fiscalPeriodLabel(),
        result.toPeriod().periodEnd(),
        result.fromValue(),
        result.toValue(),
        result.rate(),
        result.caveat().name(),
        result.display());
  }
}
