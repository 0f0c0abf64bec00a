package com.ospicorp.filingmetrics.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDate;
import java.util.List;

public record CompanyAnalysis(
    String ticker,
    List<String> notes,
    @JsonProperty("as_of") LocalDate asOf,
    List<MetricAnalysis> metrics,
    List<String> warnings
) {

  public CompanyAnalysis {
    notes = List.copyOf(notes);
    metrics = List.copyOf(metrics);
    warnings = List.copyOf(warnings);
  }
}
