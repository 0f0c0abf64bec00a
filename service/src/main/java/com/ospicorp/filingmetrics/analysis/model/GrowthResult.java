package com.ospicorp.filingmetrics.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.filingmetrics.facts.model.Metric;
import java.util.Locale;
import java.util.Objects;

/**
 * Growth between two periods of a metric. {@code rate} is null exactly when {@code caveat} is
 * not {@link GrowthCaveat#NONE}; a null rate means "not computable" and is never a zero.
 */
public record GrowthResult(
    Metric metric,
    GrowthKind kind,
    @JsonProperty("from_period") PeriodKey fromPeriod,
    @JsonProperty("to_period") PeriodKey toPeriod,
    Double rate,
    GrowthCaveat caveat,
    @JsonProperty("from_value") Double fromValue,
    @JsonProperty("to_value") Double toValue
) {

  public GrowthResult {
    Objects.requireNonNull(metric, "metric");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(fromPeriod, "fromPeriod");
    Objects.requireNonNull(toPeriod, "toPeriod");
    Objects.requireNonNull(caveat, "caveat");
    if ((rate == null) == (caveat == GrowthCaveat.NONE)) {
      throw new IllegalArgumentException(
          "rate must be null iff caveat is not NONE (rate=" + rate + ", caveat=" + caveat + ")");
    }
  }

  public static GrowthResult computed(Metric metric, GrowthKind kind, PeriodKey from, PeriodKey to,
      double rate, double fromValue, double toValue) {
    return new GrowthResult(metric, kind, from, to, rate, GrowthCaveat.NONE, fromValue, toValue);
  }

  public static GrowthResult notComputable(Metric metric, GrowthKind kind, PeriodKey from,
      PeriodKey to, GrowthCaveat caveat, Double fromValue, Double toValue) {
    return new GrowthResult(metric, kind, from, to, null, caveat, fromValue, toValue);
  }

  public boolean isComputed() {
    return caveat == GrowthCaveat.NONE;
  }

  /** Short rendering: a percentage, or a qualitative label when no rate exists. */
  @JsonProperty("display")
  public String display() {
    return switch (caveat) {
      case NONE -> String.format(Locale.ROOT, "%.1f%%", rate * 100d);
      case SIGN_FLIP -> signFlipDisplay();
      case ZERO_BASE, INSUFFICIENT_DATA -> "N/A";
    };
  }

  @JsonProperty("note")
  public String note() {
    return switch (caveat) {
      case NONE -> "";
      case SIGN_FLIP -> signFlipNote();
      case ZERO_BASE -> "Cannot calculate growth from or to a zero value";
      case INSUFFICIENT_DATA -> "Missing value for " + (fromValue == null
          ? fromPeriod.fiscalPeriodLabel()
          : toPeriod.fiscalPeriodLabel());
    };
  }

  private String signFlipDisplay() {
    if (fromValue != null && toValue != null) {
      if (fromValue < 0 && toValue > 0) {
        return "Turnaround";
      }
      if (fromValue > 0 && toValue < 0) {
        return "Negative";
      }
    }
    return "Loss";
  }

  private String signFlipNote() {
    if (fromValue != null && toValue != null) {
      if (fromValue < 0 && toValue > 0) {
        return "From loss to profit";
      }
      if (fromValue > 0 && toValue < 0) {
        return "From profit to loss";
      }
    }
    return "Compound growth is undefined for negative values";
  }
}
