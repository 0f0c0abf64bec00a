package com.ospicorp.filingmetrics.analysis.service;

import com.ospicorp.filingmetrics.analysis.model.GrowthCaveat;
import com.ospicorp.filingmetrics.analysis.model.GrowthKind;
import com.ospicorp.filingmetrics.analysis.model.GrowthResult;
import com.ospicorp.filingmetrics.analysis.model.OrganizedSeries;
import com.ospicorp.filingmetrics.analysis.model.PeriodKey;
import com.ospicorp.filingmetrics.facts.model.FrameType;
import com.ospicorp.filingmetrics.facts.model.Metric;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Year-over-year, quarter-over-quarter and compound annual growth for an organized series.
 * Every requested pair yields one result, oldest first; pairs that cannot be expressed as a rate
 * carry a caveat and a null rate.
 */
public final class GrowthCalculator {
  public static final int DEFAULT_CAGR_YEARS = 5;
  static final int MIN_CAGR_YEARS = 2;
  static final int RATE_SCALE = 6;

  private static final Comparator<GrowthResult> OLDEST_FIRST = Comparator
      .comparing((GrowthResult r) -> r.toPeriod().periodEnd())
      .thenComparing(r -> r.fromPeriod().periodEnd())
      .thenComparing(GrowthResult::kind);

  private GrowthCalculator() {
  }

  public record Outcome(Double rate, GrowthCaveat caveat) {
    static Outcome of(double rate) {
      return new Outcome(normalize(rate), GrowthCaveat.NONE);
    }

    static Outcome caveat(GrowthCaveat caveat) {
      return new Outcome(null, caveat);
    }
  }

  public static List<GrowthResult> compute(OrganizedSeries series, Metric metric) {
    return compute(series, metric, DEFAULT_CAGR_YEARS);
  }

  public static List<GrowthResult> compute(OrganizedSeries series, Metric metric,
      int maxCagrYears) {
    if (series.metric() != metric) {
      throw new IllegalArgumentException(
          "Series for " + series.metric() + " cannot be used to compute " + metric);
    }
    List<GrowthResult> out = new ArrayList<>();
    NavigableMap<Integer, Map.Entry<PeriodKey, Double>> years = slots(series, FrameType.ANNUAL);
    NavigableMap<Integer, Map.Entry<PeriodKey, Double>> quarters =
        slots(series, FrameType.QUARTERLY);

    adjacent(metric, years, FrameType.ANNUAL, GrowthKind.YOY, out);
    adjacent(metric, quarters, FrameType.QUARTERLY, GrowthKind.QOQ, out);
    compound(metric, years, maxCagrYears, out);

    out.sort(OLDEST_FIRST);
    return out;
  }

  /** Simple growth against the absolute base, so the sign of the rate follows the direction. */
  public static Outcome simpleGrowth(Double start, Double end) {
    if (start == null || end == null || !Double.isFinite(start) || !Double.isFinite(end)) {
      return Outcome.caveat(GrowthCaveat.INSUFFICIENT_DATA);
    }
    if (start == 0d) {
      return Outcome.caveat(GrowthCaveat.ZERO_BASE);
    }
    if (end != 0d && Math.signum(start) != Math.signum(end)) {
      return Outcome.caveat(GrowthCaveat.SIGN_FLIP);
    }
    return Outcome.of((end - start) / Math.abs(start));
  }

  /**
   * Compound growth over {@code years}; defined only for two positive endpoints. Exactly one zero
   * endpoint is {@link GrowthCaveat#ZERO_BASE}, any other non-positive pair is a sign flip.
   */
  public static Outcome cagr(Double start, Double end, int years) {
    if (years < 1) {
      throw new IllegalArgumentException("years must be positive: " + years);
    }
    if (start == null || end == null || !Double.isFinite(start) || !Double.isFinite(end)) {
      return Outcome.caveat(GrowthCaveat.INSUFFICIENT_DATA);
    }
    if ((start == 0d) != (end == 0d)) {
      return Outcome.caveat(GrowthCaveat.ZERO_BASE);
    }
    if (start <= 0d || end <= 0d) {
      return Outcome.caveat(GrowthCaveat.SIGN_FLIP);
    }
    return Outcome.of(Math.pow(end / start, 1d / years) - 1d);
  }

  private static void adjacent(Metric metric,
      NavigableMap<Integer, Map.Entry<PeriodKey, Double>> slots, FrameType frame,
      GrowthKind kind, List<GrowthResult> out) {
    if (slots.isEmpty()) {
      return;
    }
    for (int index = slots.firstKey() + 1; index <= slots.lastKey(); index++) {
      var from = slots.get(index - 1);
      var to = slots.get(index);
      if (from == null && to == null) {
        continue;
      }
      Double fromValue = from == null ? null : from.getValue();
      Double toValue = to == null ? null : to.getValue();
      out.add(result(metric, kind, keyFor(metric, slots, index - 1, frame),
          keyFor(metric, slots, index, frame), simpleGrowth(fromValue, toValue), fromValue,
          toValue));
    }
  }

  private static void compound(Metric metric,
      NavigableMap<Integer, Map.Entry<PeriodKey, Double>> years, int maxCagrYears,
      List<GrowthResult> out) {
    if (years.isEmpty()) {
      return;
    }
    int span = Math.min(maxCagrYears, years.lastKey() - years.firstKey());
    if (span < MIN_CAGR_YEARS) {
      return;
    }
    for (int start = years.firstKey(); start + span <= years.lastKey(); start++) {
      var from = years.get(start);
      var to = years.get(start + span);
      if (from == null && to == null) {
        continue;
      }
      Double fromValue = from == null ? null : from.getValue();
      Double toValue = to == null ? null : to.getValue();
      out.add(result(metric, GrowthKind.CAGR, keyFor(metric, years, start, FrameType.ANNUAL),
          keyFor(metric, years, start + span, FrameType.ANNUAL),
          cagr(fromValue, toValue, span), fromValue, toValue));
    }
  }

  private static GrowthResult result(Metric metric, GrowthKind kind, PeriodKey from, PeriodKey to,
      Outcome outcome, Double fromValue, Double toValue) {
    if (outcome.caveat() == GrowthCaveat.NONE) {
      return GrowthResult.computed(metric, kind, from, to, outcome.rate(), fromValue, toValue);
    }
    return GrowthResult.notComputable(metric, kind, from, to, outcome.caveat(), fromValue,
        toValue);
  }

  // One entry per fiscal slot; when two period ends share a slot the later one is kept.
  private static NavigableMap<Integer, Map.Entry<PeriodKey, Double>> slots(OrganizedSeries series,
      FrameType frame) {
    NavigableMap<Integer, Map.Entry<PeriodKey, Double>> slots = new TreeMap<>();
    for (var entry : series.entries(frame)) {
      slots.put(FiscalPeriods.index(entry.getKey().periodEnd(), frame), entry);
    }
    return slots;
  }

  private static PeriodKey keyFor(Metric metric,
      NavigableMap<Integer, Map.Entry<PeriodKey, Double>> slots, int index, FrameType frame) {
    var present = slots.get(index);
    if (present != null) {
      return present.getKey();
    }
    return new PeriodKey(metric, frame, FiscalPeriods.nominalEnd(index, frame),
        FiscalPeriods.labelForIndex(index, frame));
  }

  private static double normalize(double value) {
    return BigDecimal.valueOf(value).setScale(RATE_SCALE, RoundingMode.HALF_UP).doubleValue();
  }
}
