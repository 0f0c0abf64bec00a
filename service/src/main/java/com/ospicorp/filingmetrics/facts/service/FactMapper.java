package com.ospicorp.filingmetrics.facts.service;

import com.ospicorp.filingmetrics.facts.model.Metric;
import com.ospicorp.filingmetrics.facts.model.RawFact;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies raw facts into the internal metric vocabulary. Facts whose concept is not a known
 * synonym are dropped; filings report far more concepts than are tracked.
 */
public final class FactMapper {
  private static final Logger log = LoggerFactory.getLogger(FactMapper.class);

  private final ConceptSynonyms synonyms;

  public FactMapper(ConceptSynonyms synonyms) {
    this.synonyms = synonyms;
  }

  public Map<Metric, List<RawFact>> map(Collection<RawFact> facts) {
    Map<Metric, List<RawFact>> mapped = new EnumMap<>(Metric.class);
    int dropped = 0;
    for (RawFact fact : facts) {
      Optional<Metric> metric = synonyms.metricFor(fact.conceptName());
      if (metric.isEmpty()) {
        dropped++;
        continue;
      }
      mapped.computeIfAbsent(metric.get(), m -> new ArrayList<>()).add(fact);
    }
    if (log.isDebugEnabled()) {
      log.debug("Mapped {} of {} facts onto {} metrics ({} unmapped)",
          facts.size() - dropped, facts.size(), mapped.size(), dropped);
    }
    mapped.replaceAll((metric, list) -> Collections.unmodifiableList(list));
    return Collections.unmodifiableMap(mapped);
  }
}
