package com.ospicorp.filingmetrics.analysis.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.filingmetrics.facts.model.Metric;
import java.util.List;

public record MetricAnalysis(
    Metric metric,
    MetricStatus status,
    @JsonIgnore OrganizedSeries series,
    List<GrowthResult> growth,
    @JsonProperty("annual_quality") QualityReport annualQuality,
    @JsonProperty("quarterly_quality") QualityReport quarterlyQuality
) {

  public MetricAnalysis {
    growth = List.copyOf(growth);
  }

  @JsonProperty("unit")
  public String unit() {
    return series.unit();
  }

  @JsonProperty("points")
  public List<SeriesPoint> points() {
    return series.points();
  }
}
