package com.ospicorp.filingmetrics.analysis.service;

import com.ospicorp.filingmetrics.facts.model.FrameType;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;

/**
 * Fiscal period labels derived only from a period end date and its frame. Period ends in the
 * first week of a month (52/53-week calendars) belong to the preceding month.
 */
public final class FiscalPeriods {
  static final int LATE_CLOSE_DAYS = 7;

  private FiscalPeriods() {
  }

  public static String label(LocalDate periodEnd, FrameType frame) {
    return labelForIndex(index(periodEnd, frame), frame);
  }

  /** Sequential slot number: the fiscal year for annual frames, year * 4 + quarter - 1 otherwise. */
  public static int index(LocalDate periodEnd, FrameType frame) {
    LocalDate effective = effectiveDate(periodEnd);
    return switch (frame) {
      case ANNUAL -> effective.getYear();
      case QUARTERLY -> effective.getYear() * 4 + (effective.getMonthValue() - 1) / 3;
    };
  }

  public static String labelForIndex(int index, FrameType frame) {
    return switch (frame) {
      case ANNUAL -> "FY" + index;
      case QUARTERLY -> "Q" + (Math.floorMod(index, 4) + 1) + " " + Math.floorDiv(index, 4);
    };
  }

  /** Calendar end of a slot, used when a period has to be named but was never reported. */
  public static LocalDate nominalEnd(int index, FrameType frame) {
    return switch (frame) {
      case ANNUAL -> LocalDate.of(index, 12, 31);
      case QUARTERLY -> LocalDate.of(Math.floorDiv(index, 4), Math.floorMod(index, 4) * 3 + 3, 1)
          .with(TemporalAdjusters.lastDayOfMonth());
    };
  }

  private static LocalDate effectiveDate(LocalDate periodEnd) {
    int day = periodEnd.getDayOfMonth();
    return day <= LATE_CLOSE_DAYS ? periodEnd.minusDays(day) : periodEnd;
  }
}
