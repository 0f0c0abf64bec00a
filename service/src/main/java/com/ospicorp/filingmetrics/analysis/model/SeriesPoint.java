package com.ospicorp.filingmetrics.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.filingmetrics.facts.model.FrameType;
import java.time.LocalDate;

public record SeriesPoint(
    String label,
    FrameType frame,
    @JsonProperty("period_end") LocalDate periodEnd,
    Double value
) {

  static SeriesPoint of(PeriodKey key, Double value) {
    return new SeriesPoint(key.fiscalPeriodLabel(), key.frameType(), key.periodEnd(), value);
  }
}
