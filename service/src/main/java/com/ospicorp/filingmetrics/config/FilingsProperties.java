package com.ospicorp.filingmetrics.config;

import com.ospicorp.filingmetrics.facts.model.Metric;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "filings")
public record FilingsProperties(
    @DefaultValue("5") int trailingYears,
    @DefaultValue("5") int cagrYears,
    @DefaultValue("0.6") double completenessWarningThreshold,
    Map<String, String> tickerCorrections,
    Map<Metric, List<String>> conceptSynonyms,
    @DefaultValue Sec sec
) {

  public FilingsProperties {
    if (trailingYears < 1) {
      throw new IllegalArgumentException("filings.trailing-years must be at least 1");
    }
    tickerCorrections = tickerCorrections == null ? Map.of() : Map.copyOf(tickerCorrections);
    conceptSynonyms = conceptSynonyms == null ? Map.of() : Map.copyOf(conceptSynonyms);
  }

  public record Sec(
      @DefaultValue("https://www.sec.gov/files/company_tickers.json") String tickerIndexUrl,
      @DefaultValue("https://data.sec.gov") String baseUrl,
      @DefaultValue("filing-metrics-api admin@example.com") String userAgent
  ) {}
}
