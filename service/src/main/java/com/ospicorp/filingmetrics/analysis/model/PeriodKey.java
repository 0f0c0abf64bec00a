package com.ospicorp.filingmetrics.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.filingmetrics.facts.model.FrameType;
import com.ospicorp.filingmetrics.facts.model.Metric;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.Objects;

public record PeriodKey(
    Metric metric,
    @JsonProperty("frame") FrameType frameType,
    @JsonProperty("period_end") LocalDate periodEnd,
    @JsonProperty("label") String fiscalPeriodLabel
) implements Comparable<PeriodKey> {

  private static final Comparator<PeriodKey> ORDER = Comparator
      .comparing(PeriodKey::metric)
      .thenComparing(PeriodKey::frameType)
      .thenComparing(PeriodKey::periodEnd)
      .thenComparing(PeriodKey::fiscalPeriodLabel);

  public PeriodKey {
    Objects.requireNonNull(metric, "metric");
    Objects.requireNonNull(frameType, "frameType");
    Objects.requireNonNull(periodEnd, "periodEnd");
    Objects.requireNonNull(fiscalPeriodLabel, "fiscalPeriodLabel");
  }

  @Override
  public int compareTo(PeriodKey other) {
    return ORDER.compare(this, other);
  }
}
