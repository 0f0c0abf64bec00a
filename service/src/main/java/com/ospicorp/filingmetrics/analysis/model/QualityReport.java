package com.ospicorp.filingmetrics.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.filingmetrics.facts.model.Metric;
import java.util.List;

public record QualityReport(
    Metric metric,
    @JsonProperty("expected_periods") int expectedPeriods,
    @JsonProperty("present_periods") int presentPeriods,
    @JsonProperty("missing_period_labels") List<String> missingPeriodLabels,
    @JsonProperty("completeness_ratio") double completenessRatio
) {

  public QualityReport {
    missingPeriodLabels = List.copyOf(missingPeriodLabels);
  }
}
