package com.ospicorp.filingmetrics.web;

import com.ospicorp.filingmetrics.facts.model.Metric;
import com.ospicorp.filingmetrics.facts.service.ConceptSynonyms;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Service index and liveness. */
@RestController
public class RootController {

  private final ConceptSynonyms synonyms;

  public RootController(ConceptSynonyms synonyms) {
    this.synonyms = synonyms;
  }

  /** Lists the metrics with at least one configured concept, as accepted in metric paths. */
  @GetMapping("/")
  public Map<String, Object> root() {
    List<String> metrics = new ArrayList<>();
    for (Metric metric : Metric.values()) {
      if (!synonyms.conceptsFor(metric).isEmpty()) {
        metrics.add(metric.name().toLowerCase(Locale.ROOT));
      }
    }
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("service", "filing-metrics-service");
    body.put("metrics", metrics);
    body.put("analysis", "/v1/companies/{ticker}/analysis");
    body.put("docs", "/swagger-ui.html");
    return body;
  }

  @GetMapping("/v1/ping")
  public ResponseEntity<Map<String, Object>> ping() {
    return ResponseEntity.ok(Map.of("pong", true));
  }
}
