package com.ospicorp.filingmetrics.facts.service;

import com.ospicorp.filingmetrics.facts.model.Metric;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Immutable table of accepted concept names per metric, each list in priority order. A concept
 * listed under several metrics belongs to the first of them in {@link Metric} declaration order.
 */
public final class ConceptSynonyms {

  private final Map<Metric, List<String>> byMetric;
  private final Map<String, Metric> metricByConcept;
  private final Map<String, Integer> rankByConcept;

  private ConceptSynonyms(Map<Metric, List<String>> byMetric) {
    this.byMetric = Collections.unmodifiableMap(byMetric);
    Map<String, Metric> metrics = new HashMap<>();
    Map<String, Integer> ranks = new HashMap<>();
    for (Metric metric : Metric.values()) {
      List<String> concepts = byMetric.getOrDefault(metric, List.of());
      for (int i = 0; i < concepts.size(); i++) {
        String concept = concepts.get(i);
        if (metrics.putIfAbsent(concept, metric) == null) {
          ranks.put(concept, i);
        }
      }
    }
    this.metricByConcept = Map.copyOf(metrics);
    this.rankByConcept = Map.copyOf(ranks);
  }

  public static ConceptSynonyms of(Map<Metric, List<String>> table) {
    Map<Metric, List<String>> copy = new EnumMap<>(Metric.class);
    table.forEach((metric, concepts) -> copy.put(metric, List.copyOf(concepts)));
    return new ConceptSynonyms(copy);
  }

  public Optional<Metric> metricFor(String conceptName) {
    return Optional.ofNullable(metricByConcept.get(conceptName));
  }

  /** Position of the concept in its metric's synonym list; lower is preferred. */
  public OptionalInt rankOf(String conceptName) {
    Integer rank = rankByConcept.get(conceptName);
    return rank == null ? OptionalInt.empty() : OptionalInt.of(rank);
  }

  public List<String> conceptsFor(Metric metric) {
    return byMetric.getOrDefault(metric, List.of());
  }

  public Map<Metric, List<String>> asMap() {
    return byMetric;
  }
}
