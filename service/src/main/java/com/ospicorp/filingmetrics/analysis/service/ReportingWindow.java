package com.ospicorp.filingmetrics.analysis.service;

import com.ospicorp.filingmetrics.facts.model.FrameType;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/** Default expected period labels for quality assessment, oldest first. */
public final class ReportingWindow {
  private ReportingWindow() {
  }

  /** The {@code years} fiscal years preceding the year of {@code asOf}. */
  public static List<String> trailingFiscalYears(LocalDate asOf, int years) {
    List<String> labels = new ArrayList<>(Math.max(years, 0));
    for (int year = asOf.getYear() - years; year < asOf.getYear(); year++) {
      labels.add(FiscalPeriods.labelForIndex(year, FrameType.ANNUAL));
    }
    return labels;
  }

  /** The {@code quarters} calendar quarters preceding the quarter containing {@code asOf}. */
  public static List<String> trailingQuarters(LocalDate asOf, int quarters) {
    int current = asOf.getYear() * 4 + (asOf.getMonthValue() - 1) / 3;
    List<String> labels = new ArrayList<>(Math.max(quarters, 0));
    for (int index = current - quarters; index < current; index++) {
      labels.add(FiscalPeriods.labelForIndex(index, FrameType.QUARTERLY));
    }
    return labels;
  }
}
