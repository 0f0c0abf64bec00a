package com.ospicorp.filingmetrics.facts.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * One reported value as published in a filing. A null {@code periodStart} marks an instant
 * (balance sheet) fact.
 */
public record RawFact(
    String conceptName,
    Double value,
    String unit,
    LocalDate periodStart,
    LocalDate periodEnd,
    LocalDate filedAt,
    FrameType frameType
) {

  public RawFact {
    Objects.requireNonNull(conceptName, "conceptName");
    Objects.requireNonNull(periodEnd, "periodEnd");
    Objects.requireNonNull(filedAt, "filedAt");
    Objects.requireNonNull(frameType, "frameType");
  }

  public boolean isInstant() {
    return periodStart == null;
  }

  /** Inclusive length of the reporting span in days, or 0 for instant facts. */
  public long spanDays() {
    if (periodStart == null) {
      return 0;
    }
    return ChronoUnit.DAYS.between(periodStart, periodEnd) + 1;
  }
}
