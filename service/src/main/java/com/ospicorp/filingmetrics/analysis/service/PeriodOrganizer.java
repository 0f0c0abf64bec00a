package com.ospicorp.filingmetrics.analysis.service;

import com.ospicorp.filingmetrics.analysis.model.OrganizedSeries;
import com.ospicorp.filingmetrics.analysis.model.PeriodKey;
import com.ospicorp.filingmetrics.facts.model.FrameType;
import com.ospicorp.filingmetrics.facts.model.Metric;
import com.ospicorp.filingmetrics.facts.model.RawFact;
import com.ospicorp.filingmetrics.facts.service.ConceptSynonyms;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Buckets mapped facts into one value per metric, frame and period end. Duration facts must span
 * a full year or a full quarter for their frame, so year-to-date values never enter a quarterly
 * series. A series holds a single unit: the unit of the most recent period. Within a bucket the
 * most recently filed fact wins; ties go to the higher priority concept.
 */
public final class PeriodOrganizer {
  private static final Logger log = LoggerFactory.getLogger(PeriodOrganizer.class);

  static final int ANNUAL_MIN_DAYS = 350;
  static final int ANNUAL_MAX_DAYS = 380;
  static final int QUARTER_MIN_DAYS = 80;
  static final int QUARTER_MAX_DAYS = 100;

  private final Comparator<RawFact> preference;

  public PeriodOrganizer(ConceptSynonyms synonyms) {
    this.preference = Comparator
        .comparing(RawFact::filedAt, Comparator.reverseOrder())
        .thenComparingInt((RawFact f) -> f.isInstant() ? 1 : 0)
        .thenComparingInt(f -> synonyms.rankOf(f.conceptName()).orElse(Integer.MAX_VALUE))
        .thenComparingLong(f -> -f.spanDays())
        .thenComparing(RawFact::value, Comparator.reverseOrder())
        .thenComparing(RawFact::conceptName)
        .thenComparing(RawFact::unit, Comparator.nullsLast(Comparator.naturalOrder()));
  }

  public Map<Metric, OrganizedSeries> organize(Map<Metric, List<RawFact>> mapped) {
    Map<Metric, OrganizedSeries> out = new EnumMap<>(Metric.class);
    mapped.forEach((metric, facts) -> out.put(metric, organize(metric, facts)));
    return Collections.unmodifiableMap(out);
  }

  public OrganizedSeries organize(Metric metric, List<RawFact> facts) {
    List<RawFact> usable = new ArrayList<>(facts.size());
    for (RawFact fact : facts) {
      if (fact.value() == null || !Double.isFinite(fact.value())) {
        continue;
      }
      if (isMalformed(fact) || !spanMatchesFrame(fact)) {
        log.debug("Rejecting {} fact {} spanning {} to {} for a {} frame", metric,
            fact.conceptName(), fact.periodStart(), fact.periodEnd(), fact.frameType());
        continue;
      }
      usable.add(fact);
    }

    String unit = seriesUnit(usable);
    Map<Slot, List<RawFact>> groups = new TreeMap<>();
    int otherUnits = 0;
    for (RawFact fact : usable) {
      if (!Objects.equals(unit, fact.unit())) {
        otherUnits++;
        continue;
      }
      groups.computeIfAbsent(new Slot(fact.frameType(), fact.periodEnd()), s -> new ArrayList<>())
          .add(fact);
    }
    if (otherUnits > 0) {
      log.debug("Dropped {} {} facts not reported in {}", otherUnits, metric, unit);
    }

    OrganizedSeries.Builder builder = OrganizedSeries.builder(metric).unit(unit);
    for (var group : groups.entrySet()) {
      Slot slot = group.getKey();
      RawFact winner = Collections.min(group.getValue(), preference);
      PeriodKey key = new PeriodKey(metric, slot.frameType(), slot.periodEnd(),
          FiscalPeriods.label(slot.periodEnd(), slot.frameType()));
      builder.put(key, winner.value());
    }
    return builder.build();
  }

  // Unit of the fact that would win the latest period end across both frames.
  private String seriesUnit(List<RawFact> facts) {
    RawFact latest = null;
    for (RawFact fact : facts) {
      if (latest == null) {
        latest = fact;
        continue;
      }
      int byEnd = fact.periodEnd().compareTo(latest.periodEnd());
      if (byEnd > 0 || (byEnd == 0 && preference.compare(fact, latest) < 0)) {
        latest = fact;
      }
    }
    return latest == null ? null : latest.unit();
  }

  static boolean isMalformed(RawFact fact) {
    return fact.periodStart() != null && fact.periodStart().isAfter(fact.periodEnd());
  }

  static boolean spanMatchesFrame(RawFact fact) {
    if (fact.isInstant()) {
      return true;
    }
    long days = fact.spanDays();
    return switch (fact.frameType()) {
      case ANNUAL -> days >= ANNUAL_MIN_DAYS && days <= ANNUAL_MAX_DAYS;
      case QUARTERLY -> days >= QUARTER_MIN_DAYS && days <= QUARTER_MAX_DAYS;
    };
  }

  private record Slot(FrameType frameType, LocalDate periodEnd) implements Comparable<Slot> {
    @Override
    public int compareTo(Slot other) {
      int byFrame = frameType.compareTo(other.frameType);
      return byFrame != 0 ? byFrame : periodEnd.compareTo(other.periodEnd);
    }
  }
}
