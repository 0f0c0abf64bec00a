package com.ospicorp.filingmetrics.facts.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.ospicorp.filingmetrics.facts.model.FrameType;
import com.ospicorp.filingmetrics.facts.model.RawFact;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the SEC company-facts payload
 * ({@code facts.<taxonomy>.<concept>.units.<unit>[]}) into {@link RawFact}s.
 */
public class CompanyFactsParser {
  private static final Logger log = LoggerFactory.getLogger(CompanyFactsParser.class);

  public List<RawFact> parse(JsonNode body, LocalDate since) {
    List<RawFact> facts = new ArrayList<>();
    if (body == null) {
      return facts;
    }
    JsonNode taxonomies = body.path("facts");
    if (!taxonomies.isObject()) {
      log.warn("Company facts payload for {} has no facts section",
          body.path("entityName").asText("unknown entity"));
      return facts;
    }
    int skipped = 0;
    for (JsonNode concepts : taxonomies) {
      Iterator<Map.Entry<String, JsonNode>> conceptFields = concepts.fields();
      while (conceptFields.hasNext()) {
        var concept = conceptFields.next();
        Iterator<Map.Entry<String, JsonNode>> units = concept.getValue().path("units").fields();
        while (units.hasNext()) {
          var unit = units.next();
          if (!unit.getValue().isArray()) {
            continue;
          }
          for (JsonNode entry : unit.getValue()) {
            RawFact fact = toFact(concept.getKey(), unit.getKey(), entry);
            if (fact == null) {
              skipped++;
            } else if (since == null || !fact.periodEnd().isBefore(since)) {
              facts.add(fact);
            }
          }
        }
      }
    }
    log.debug("Parsed {} facts ({} entries skipped)", facts.size(), skipped);
    return facts;
  }

  static FrameType frameOf(String fiscalPeriod) {
    if ("FY".equals(fiscalPeriod)) {
      return FrameType.ANNUAL;
    }
    if (fiscalPeriod != null && fiscalPeriod.startsWith("Q")) {
      return FrameType.QUARTERLY;
    }
    return null;
  }

  private RawFact toFact(String concept, String unit, JsonNode entry) {
    FrameType frame = frameOf(entry.path("fp").asText(null));
    String end = entry.path("end").asText(null);
    String filed = entry.path("filed").asText(null);
    if (frame == null || end == null || filed == null) {
      return null;
    }
    try {
      String start = entry.path("start").asText(null);
      JsonNode val = entry.path("val");
      return new RawFact(
          concept,
          val.isNumber() ? val.asDouble() : null,
          unit,
          start == null ? null : LocalDate.parse(start),
          LocalDate.parse(end),
          LocalDate.parse(filed),
          frame);
    } catch (DateTimeParseException ex) {
      log.debug("Skipping {} entry with unparseable date: {}", concept, ex.getMessage());
      return null;
    }
  }
}
