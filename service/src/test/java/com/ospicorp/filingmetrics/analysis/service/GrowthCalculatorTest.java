package com.ospicorp.filingmetrics.analysis.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.filingmetrics.analysis.model.GrowthCaveat;
import com.ospicorp.filingmetrics.analysis.model.GrowthKind;
import com.ospicorp.filingmetrics.analysis.model.GrowthResult;
import com.ospicorp.filingmetrics.analysis.model.OrganizedSeries;
import com.ospicorp.filingmetrics.analysis.model.PeriodKey;
import com.ospicorp.filingmetrics.facts.model.FrameType;
import com.ospicorp.filingmetrics.facts.model.Metric;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class GrowthCalculatorTest {
  private static final double EPS = 1e-6;

  @Test
  void simpleGrowthCases() {
    assertEquals(0.5, GrowthCalculator.simpleGrowth(100d, 150d).rate(), EPS);
    assertEquals(0.6, GrowthCalculator.simpleGrowth(-50d, -20d).rate(), EPS);
    assertEquals(-1.0, GrowthCalculator.simpleGrowth(100d, 0d).rate(), EPS);

    assertCaveat(GrowthCaveat.ZERO_BASE, GrowthCalculator.simpleGrowth(0d, 50d));
    assertCaveat(GrowthCaveat.SIGN_FLIP, GrowthCalculator.simpleGrowth(-20d, 30d));
    assertCaveat(GrowthCaveat.SIGN_FLIP, GrowthCalculator.simpleGrowth(20d, -30d));
    assertCaveat(GrowthCaveat.INSUFFICIENT_DATA, GrowthCalculator.simpleGrowth(100d, null));
    assertCaveat(GrowthCaveat.INSUFFICIENT_DATA, GrowthCalculator.simpleGrowth(null, 100d));
  }

  @Test
  void cagrCases() {
    assertEquals(0.2, GrowthCalculator.cagr(100d, 144d, 2).rate(), EPS);
    assertEquals(0.0, GrowthCalculator.cagr(100d, 100d, 3).rate(), EPS);

    assertCaveat(GrowthCaveat.ZERO_BASE, GrowthCalculator.cagr(100d, 0d, 2));
    assertCaveat(GrowthCaveat.ZERO_BASE, GrowthCalculator.cagr(0d, 40d, 2));
    assertCaveat(GrowthCaveat.ZERO_BASE, GrowthCalculator.cagr(0d, -40d, 2));
    assertCaveat(GrowthCaveat.SIGN_FLIP, GrowthCalculator.cagr(0d, 0d, 2));
    assertCaveat(GrowthCaveat.SIGN_FLIP, GrowthCalculator.cagr(-10d, 50d, 2));
    assertCaveat(GrowthCaveat.SIGN_FLIP, GrowthCalculator.cagr(-10d, -5d, 2));
    assertCaveat(GrowthCaveat.INSUFFICIENT_DATA, GrowthCalculator.cagr(null, 5d, 2));
    assertThrows(IllegalArgumentException.class, () -> GrowthCalculator.cagr(1d, 2d, 0));
  }

  @Test
  void veryLargeRatesAreNotCapped() {
    double rate = GrowthCalculator.simpleGrowth(1e-10, 1e4).rate();
    assertEquals(1e14, rate, 10d);
    assertTrue(rate > Long.MAX_VALUE / 1_000_000d);
    assertEquals(0.333333, GrowthCalculator.simpleGrowth(3d, 4d).rate(), 0d);
  }

  @Test
  void threeYearsYieldTwoYoyAndOneCagr() {
    var series = annualSeries(2020, 100d, 120d, 144d);

    List<GrowthResult> results = GrowthCalculator.compute(series, Metric.REVENUE);

    assertEquals(3, results.size());
    assertEquals(GrowthKind.YOY, results.get(0).kind());
    assertEquals("FY2021", results.get(0).toPeriod().fiscalPeriodLabel());
    assertEquals(GrowthKind.CAGR, results.get(1).kind());
    assertEquals("FY2020", results.get(1).fromPeriod().fiscalPeriodLabel());
    assertEquals("FY2022", results.get(1).toPeriod().fiscalPeriodLabel());
    assertEquals(GrowthKind.YOY, results.get(2).kind());
    results.forEach(r -> assertEquals(0.2, r.rate(), EPS));
  }

  @Test
  void twoYearsGiveNoCagr() {
    var results = GrowthCalculator.compute(annualSeries(2022, 100d, 110d), Metric.REVENUE);
    assertEquals(1, results.size());
    assertEquals(GrowthKind.YOY, results.get(0).kind());
  }

  @Test
  void missingYearYieldsInsufficientDataButCagrSpansTheGap() {
    var series = OrganizedSeries.builder(Metric.REVENUE)
        .put(annualKey(2019), 100d)
        .put(annualKey(2021), 150d)
        .build();

    var results = GrowthCalculator.compute(series, Metric.REVENUE);

    var yoy = results.stream().filter(r -> r.kind() == GrowthKind.YOY).toList();
    assertEquals(2, yoy.size());
    yoy.forEach(r -> {
      assertEquals(GrowthCaveat.INSUFFICIENT_DATA, r.caveat());
      assertNull(r.rate());
    });
    assertEquals("FY2020", yoy.get(0).toPeriod().fiscalPeriodLabel());
    assertEquals(LocalDate.of(2020, 12, 31), yoy.get(0).toPeriod().periodEnd());
    assertEquals("Missing value for FY2020", yoy.get(0).note());

    var cagr = results.stream().filter(r -> r.kind() == GrowthKind.CAGR).toList();
    assertEquals(1, cagr.size());
    assertEquals(Math.sqrt(1.5) - 1, cagr.get(0).rate(), EPS);
  }

  @Test
  void cagrRollsOverTheConfiguredWindow() {
    double[] values = new double[9];
    for (int i = 0; i < values.length; i++) {
      values[i] = 100d * Math.pow(1.1, i);
    }
    var series = annualSeries(2015, values);

    var cagr = GrowthCalculator.compute(series, Metric.REVENUE, 5).stream()
        .filter(r -> r.kind() == GrowthKind.CAGR)
        .toList();

    assertEquals(4, cagr.size());
    assertEquals("FY2015", cagr.get(0).fromPeriod().fiscalPeriodLabel());
    assertEquals("FY2023", cagr.get(3).toPeriod().fiscalPeriodLabel());
    cagr.forEach(r -> assertEquals(0.1, r.rate(), EPS));
  }

  @Test
  void quarterOverQuarterCarriesSignCaveats() {
    var series = OrganizedSeries.builder(Metric.NET_INCOME)
        .put(quarterKey(Metric.NET_INCOME, LocalDate.of(2023, 3, 31), "Q1 2023"), 10d)
        .put(quarterKey(Metric.NET_INCOME, LocalDate.of(2023, 6, 30), "Q2 2023"), -5d)
        .put(quarterKey(Metric.NET_INCOME, LocalDate.of(2023, 9, 30), "Q3 2023"), 5d)
        .build();

    var results = GrowthCalculator.compute(series, Metric.NET_INCOME);

    assertEquals(2, results.size());
    assertEquals(GrowthKind.QOQ, results.get(0).kind());
    assertEquals(GrowthCaveat.SIGN_FLIP, results.get(0).caveat());
    assertEquals("Negative", results.get(0).display());
    assertEquals("Turnaround", results.get(1).display());
  }

  @Test
  void resultsAreOrderedByPeriodEnd() {
    var series = annualSeries(2016, 50d, 0d, 40d, -10d, 60d, 70d, 80d);

    var results = GrowthCalculator.compute(series, Metric.REVENUE);

    for (int i = 1; i < results.size(); i++) {
      assertFalse(results.get(i).toPeriod().periodEnd()
          .isBefore(results.get(i - 1).toPeriod().periodEnd()));
    }
    results.forEach(r -> assertEquals(r.rate() == null, r.caveat() != GrowthCaveat.NONE));
  }

  @Test
  void seriesForAnotherMetricIsRejected() {
    var series = annualSeries(2020, 1d, 2d);
    assertThrows(IllegalArgumentException.class,
        () -> GrowthCalculator.compute(series, Metric.NET_INCOME));
  }

  @Test
  void emptySeriesHasNoGrowth() {
    assertTrue(GrowthCalculator.compute(OrganizedSeries.empty(Metric.REVENUE), Metric.REVENUE)
        .isEmpty());
  }

  private static void assertCaveat(GrowthCaveat expected, GrowthCalculator.Outcome outcome) {
    assertEquals(expected, outcome.caveat());
    assertNull(outcome.rate());
  }

  private static OrganizedSeries annualSeries(int firstYear, double... values) {
    var builder = OrganizedSeries.builder(Metric.REVENUE).unit("USD");
    for (int i = 0; i < values.length; i++) {
      builder.put(annualKey(firstYear + i), values[i]);
    }
    return builder.build();
  }

  private static PeriodKey annualKey(int year) {
    return new PeriodKey(Metric.REVENUE, FrameType.ANNUAL, LocalDate.of(year, 12, 31), "FY" + year);
  }

  private static PeriodKey quarterKey(Metric metric, LocalDate end, String label) {
    return new PeriodKey(metric, FrameType.QUARTERLY, end, label);
  }
}
