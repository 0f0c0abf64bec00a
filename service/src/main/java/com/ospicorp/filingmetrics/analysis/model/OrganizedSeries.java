package com.ospicorp.filingmetrics.analysis.model;

import com.ospicorp.filingmetrics.facts.model.FrameType;
import com.ospicorp.filingmetrics.facts.model.Metric;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Resolved values of one metric keyed by reporting period, in chronological order within each
 * frame. Holds at most one value per {@link PeriodKey}.
 */
public final class OrganizedSeries {

  private final Metric metric;
  private final String unit;
  private final NavigableMap<PeriodKey, Double> values;

  private OrganizedSeries(Metric metric, String unit, NavigableMap<PeriodKey, Double> values) {
    this.metric = metric;
    this.unit = unit;
    this.values = Collections.unmodifiableNavigableMap(values);
  }

  public static OrganizedSeries empty(Metric metric) {
    return new OrganizedSeries(metric, null, new TreeMap<>());
  }

  public static Builder builder(Metric metric) {
    return new Builder(metric);
  }

  public Metric metric() {
    return metric;
  }

  public String unit() {
    return unit;
  }

  public NavigableMap<PeriodKey, Double> values() {
    return values;
  }

  public Double get(PeriodKey key) {
    return values.get(key);
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  public int size() {
    return values.size();
  }

  public boolean containsLabel(String label) {
    for (PeriodKey key : values.keySet()) {
      if (key.fiscalPeriodLabel().equals(label)) {
        return true;
      }
    }
    return false;
  }

  /** Entries of one frame, oldest first. */
  public List<Map.Entry<PeriodKey, Double>> entries(FrameType frameType) {
    List<Map.Entry<PeriodKey, Double>> out = new ArrayList<>();
    for (var e : values.entrySet()) {
      if (e.getKey().frameType() == frameType) {
        out.add(Map.entry(e.getKey(), e.getValue()));
      }
    }
    return out;
  }

  public List<SeriesPoint> points() {
    List<SeriesPoint> out = new ArrayList<>(values.size());
    for (var e : values.entrySet()) {
      out.add(SeriesPoint.of(e.getKey(), e.getValue()));
    }
    return out;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof OrganizedSeries other)) {
      return false;
    }
    return metric == other.metric
        && Objects.equals(unit, other.unit)
        && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return Objects.hash(metric, unit, values);
  }

  @Override
  public String toString() {
    return "OrganizedSeries[" + metric + ", " + unit + ", " + values + "]";
  }

  public static final class Builder {
    private final Metric metric;
    private final NavigableMap<PeriodKey, Double> values = new TreeMap<>();
    private String unit;

    private Builder(Metric metric) {
      this.metric = Objects.requireNonNull(metric, "metric");
    }

    public Builder unit(String unit) {
      this.unit = unit;
      return this;
    }

    public Builder put(PeriodKey key, double value) {
      if (key.metric() != metric) {
        throw new IllegalArgumentException(
            "Period key for " + key.metric() + " added to " + metric + " series");
      }
      Double previous = values.put(key, value);
      if (previous != null) {
        throw new IllegalStateException("Period " + key + " resolved to more than one value: "
            + previous + " and " + value);
      }
      return this;
    }

    public OrganizedSeries build() {
      return new OrganizedSeries(metric, unit, new TreeMap<>(values));
    }
  }
}
