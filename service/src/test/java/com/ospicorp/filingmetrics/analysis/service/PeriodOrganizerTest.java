package com.ospicorp.filingmetrics.analysis.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.filingmetrics.analysis.model.PeriodKey;
import com.ospicorp.filingmetrics.facts.model.FrameType;
import com.ospicorp.filingmetrics.facts.model.Metric;
import com.ospicorp.filingmetrics.facts.model.RawFact;
import com.ospicorp.filingmetrics.facts.service.ConceptSynonyms;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.Test;

class PeriodOrganizerTest {

  private static final ConceptSynonyms SYNONYMS = ConceptSynonyms.of(Map.of(
      Metric.REVENUE, List.of("Revenues", "SalesRevenueNet"),
      Metric.TOTAL_ASSETS, List.of("Assets")));

  private final PeriodOrganizer organizer = new PeriodOrganizer(SYNONYMS);

  @Test
  void amendmentReplacesOriginalRegardlessOfOrder() {
    var original = annual("Revenues", 100d, 2022, LocalDate.of(2023, 2, 1));
    var amendment = annual("Revenues", 110d, 2022, LocalDate.of(2023, 6, 1));

    var forward = organizer.organize(Metric.REVENUE, List.of(original, amendment));
    var backward = organizer.organize(Metric.REVENUE, List.of(amendment, original));

    assertEquals(1, forward.size());
    assertEquals(110d, forward.values().firstEntry().getValue());
    assertEquals(forward, backward);
  }

  @Test
  void laterFiledYearToDateDoesNotReplaceTheQuarter() {
    var threeMonths = new RawFact("Revenues", 30d, "USD", LocalDate.of(2023, 4, 1),
        LocalDate.of(2023, 6, 30), LocalDate.of(2023, 8, 1), FrameType.QUARTERLY);
    var sixMonths = new RawFact("Revenues", 55d, "USD", LocalDate.of(2023, 1, 1),
        LocalDate.of(2023, 6, 30), LocalDate.of(2024, 8, 1), FrameType.QUARTERLY);

    var series = organizer.organize(Metric.REVENUE, List.of(sixMonths, threeMonths));

    var key = new PeriodKey(Metric.REVENUE, FrameType.QUARTERLY, LocalDate.of(2023, 6, 30),
        "Q2 2023");
    assertEquals(1, series.size());
    assertEquals(30d, series.get(key));
  }

  @Test
  void yearToDateAloneLeavesTheQuarterMissing() {
    var q1 = new RawFact("NetCashProvidedByUsedInOperatingActivities", 100d, "USD",
        LocalDate.of(2023, 1, 1), LocalDate.of(2023, 3, 31), LocalDate.of(2023, 5, 1),
        FrameType.QUARTERLY);
    var firstHalf = new RawFact("NetCashProvidedByUsedInOperatingActivities", 210d, "USD",
        LocalDate.of(2023, 1, 1), LocalDate.of(2023, 6, 30), LocalDate.of(2023, 8, 1),
        FrameType.QUARTERLY);

    var series = organizer.organize(Metric.OPERATING_CASH_FLOW, List.of(q1, firstHalf));

    assertEquals(1, series.size());
    assertTrue(series.containsLabel("Q1 2023"));
    assertFalse(series.containsLabel("Q2 2023"));
    assertTrue(GrowthCalculator.compute(series, Metric.OPERATING_CASH_FLOW).isEmpty());
  }

  @Test
  void partialYearIsNotAnAnnualValue() {
    var nineMonths = new RawFact("Revenues", 75d, "USD", LocalDate.of(2023, 1, 1),
        LocalDate.of(2023, 9, 30), LocalDate.of(2023, 11, 1), FrameType.ANNUAL);

    assertTrue(organizer.organize(Metric.REVENUE, List.of(nineMonths)).isEmpty());
  }

  @Test
  void fiftyThreeWeekYearIsAFullYear() {
    var longYear = new RawFact("Revenues", 500d, "USD", LocalDate.of(2022, 9, 25),
        LocalDate.of(2023, 9, 30), LocalDate.of(2023, 11, 3), FrameType.ANNUAL);

    assertEquals(1, organizer.organize(Metric.REVENUE, List.of(longYear)).size());
  }

  @Test
  void preferredSynonymWinsFullTie() {
    var filed = LocalDate.of(2023, 2, 1);
    var sales = annual("SalesRevenueNet", 99d, 2022, filed);
    var revenues = annual("Revenues", 100d, 2022, filed);

    var series = organizer.organize(Metric.REVENUE, List.of(sales, revenues));

    assertEquals(100d, series.values().firstEntry().getValue());
  }

  @Test
  void malformedAndMissingValuesAreDropped() {
    var backwards = new RawFact("Revenues", 5d, "USD", LocalDate.of(2023, 12, 31),
        LocalDate.of(2023, 1, 1), LocalDate.of(2024, 2, 1), FrameType.ANNUAL);
    var noValue = new RawFact("Revenues", null, "USD", LocalDate.of(2021, 1, 1),
        LocalDate.of(2021, 12, 31), LocalDate.of(2022, 2, 1), FrameType.ANNUAL);
    var good = annual("Revenues", 10d, 2022, LocalDate.of(2023, 2, 1));

    var series = organizer.organize(Metric.REVENUE, List.of(backwards, noValue, good));

    assertEquals(1, series.size());
    assertTrue(series.containsLabel("FY2022"));
    assertFalse(series.containsLabel("FY2021"));
  }

  @Test
  void annualAndQuarterlySharingAnEndStaySeparate() {
    var filed = LocalDate.of(2023, 2, 1);
    var year = annual("Revenues", 400d, 2022, filed);
    var quarter = new RawFact("Revenues", 110d, "USD", LocalDate.of(2022, 10, 1),
        LocalDate.of(2022, 12, 31), filed, FrameType.QUARTERLY);

    var series = organizer.organize(Metric.REVENUE, List.of(year, quarter));

    assertEquals(2, series.size());
    assertEquals(1, series.entries(FrameType.ANNUAL).size());
    assertEquals("Q4 2022",
        series.entries(FrameType.QUARTERLY).get(0).getKey().fiscalPeriodLabel());
  }

  @Test
  void instantFactsAreKeyedByTheirDate() {
    var assets = new RawFact("Assets", 900d, "USD", null, LocalDate.of(2023, 12, 31),
        LocalDate.of(2024, 2, 1), FrameType.ANNUAL);

    var series = organizer.organize(Metric.TOTAL_ASSETS, List.of(assets));

    assertEquals("FY2023", series.values().firstKey().fiscalPeriodLabel());
    assertEquals("USD", series.unit());
  }

  @Test
  void organizingIsIdempotentAndOrderIndependent() {
    List<RawFact> facts = new ArrayList<>();
    for (int year = 2015; year <= 2023; year++) {
      facts.add(annual("Revenues", year * 10d, year, LocalDate.of(year + 1, 2, 1)));
      facts.add(annual("SalesRevenueNet", year * 10d + 1, year, LocalDate.of(year + 1, 2, 1)));
      facts.add(annual("Revenues", year * 10d + 2, year, LocalDate.of(year + 1, 5, 1)));
    }
    var first = organizer.organize(Map.of(Metric.REVENUE, facts));
    var second = organizer.organize(Map.of(Metric.REVENUE, facts));
    assertEquals(first, second);

    var shuffled = new ArrayList<>(facts);
    Collections.shuffle(shuffled, new Random(7));
    assertEquals(first, organizer.organize(Map.of(Metric.REVENUE, shuffled)));
    assertEquals(9, first.get(Metric.REVENUE).size());
    assertEquals(20232d, first.get(Metric.REVENUE).values().lastEntry().getValue());
  }

  @Test
  void emptyInputGivesEmptySeries() {
    var series = organizer.organize(Metric.REVENUE, List.of());
    assertTrue(series.isEmpty());
    assertNull(series.unit());
  }

  @Test
  void seriesKeepsOnlyTheLatestPeriodsUnit() {
    var dollars = annual("Revenues", 100d, 2022, LocalDate.of(2023, 2, 1));
    var euros = new RawFact("Revenues", 300d, "EUR", LocalDate.of(2023, 1, 1),
        LocalDate.of(2023, 12, 31), LocalDate.of(2024, 2, 1), FrameType.ANNUAL);

    var series = organizer.organize(Metric.REVENUE, List.of(dollars, euros));

    assertEquals("EUR", series.unit());
    assertEquals(1, series.size());
    assertFalse(series.containsLabel("FY2022"));
    assertTrue(GrowthCalculator.compute(series, Metric.REVENUE).isEmpty());
  }

  @Test
  void otherUnitInTheSamePeriodIsIgnored() {
    var filed = LocalDate.of(2024, 2, 1);
    var dollars2022 = annual("Revenues", 100d, 2022, LocalDate.of(2023, 2, 1));
    var dollars2023 = annual("Revenues", 120d, 2023, filed);
    var euros2023 = new RawFact("SalesRevenueNet", 110d, "EUR", LocalDate.of(2023, 1, 1),
        LocalDate.of(2023, 12, 31), filed, FrameType.ANNUAL);

    var series = organizer.organize(Metric.REVENUE, List.of(euros2023, dollars2022, dollars2023));

    assertEquals("USD", series.unit());
    assertEquals(2, series.size());
    assertEquals(120d, series.values().lastEntry().getValue());
  }

  private static RawFact annual(String concept, double value, int year, LocalDate filed) {
    return new RawFact(concept, value, "USD", LocalDate.of(year, 1, 1), LocalDate.of(year, 12, 31),
        filed, FrameType.ANNUAL);
  }
}
