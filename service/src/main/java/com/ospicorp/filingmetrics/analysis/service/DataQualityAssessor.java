package com.ospicorp.filingmetrics.analysis.service;

import com.ospicorp.filingmetrics.analysis.model.MetricAnalysis;
import com.ospicorp.filingmetrics.analysis.model.MetricStatus;
import com.ospicorp.filingmetrics.analysis.model.OrganizedSeries;
import com.ospicorp.filingmetrics.analysis.model.PeriodKey;
import com.ospicorp.filingmetrics.analysis.model.QualityReport;
import com.ospicorp.filingmetrics.facts.model.Metric;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public final class DataQualityAssessor {
  public static final Set<Metric> KEY_METRICS =
      Set.of(Metric.REVENUE, Metric.NET_INCOME, Metric.DILUTED_EPS);

  private DataQualityAssessor() {
  }

  /**
   * Measures {@code series} against the caller's expected labels. Labels never reported are listed
   * in the caller's order.
   */
  public static QualityReport assess(OrganizedSeries series, Metric metric,
      List<String> expectedPeriodLabels) {
    Set<String> present = new HashSet<>();
    for (PeriodKey key : series.values().keySet()) {
      present.add(key.fiscalPeriodLabel());
    }
    List<String> missing = new ArrayList<>();
    int found = 0;
    for (String label : expectedPeriodLabels) {
      if (present.contains(label)) {
        found++;
      } else {
        missing.add(label);
      }
    }
    int expected = expectedPeriodLabels.size();
    double ratio = expected == 0 ? 0d : (double) found / expected;
    return new QualityReport(metric, expected, found, missing, ratio);
  }

  /** Request level caveats: thin annual or quarterly coverage and key metrics with no data. */
  public static List<String> warnings(List<MetricAnalysis> analyses, double threshold) {
    List<String> warnings = new ArrayList<>();
    double annual = 0d;
    double quarterly = 0d;
    List<String> missing = new ArrayList<>();
    for (Metric metric : Metric.values()) {
      if (!KEY_METRICS.contains(metric)) {
        continue;
      }
      MetricAnalysis analysis = find(analyses, metric);
      if (analysis == null || analysis.status() == MetricStatus.NO_MAPPED_FACTS) {
        missing.add(metric.name());
        continue;
      }
      annual += analysis.annualQuality().completenessRatio();
      quarterly += analysis.quarterlyQuality().completenessRatio();
    }
    annual /= KEY_METRICS.size();
    quarterly /= KEY_METRICS.size();

    if (annual < threshold) {
      warnings.add("Limited annual data available - some calculations may be incomplete");
    }
    if (quarterly < threshold) {
      warnings.add("Limited quarterly data available - QoQ analysis may be incomplete");
    }
    if (!missing.isEmpty()) {
      warnings.add("Missing key metrics: " + String.join(", ", missing));
    }
    return warnings;
  }

  private static MetricAnalysis find(List<MetricAnalysis> analyses, Metric metric) {
    for (MetricAnalysis analysis : analyses) {
      if (analysis.metric() == metric) {
        return analysis;
      }
    }
    return null;
  }
}
