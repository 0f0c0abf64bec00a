package com.ospicorp.filingmetrics.config;

import com.ospicorp.filingmetrics.analysis.service.PeriodOrganizer;
import com.ospicorp.filingmetrics.facts.client.CompanyFactsParser;
import com.ospicorp.filingmetrics.facts.service.ConceptSynonyms;
import com.ospicorp.filingmetrics.facts.service.FactMapper;
import com.ospicorp.filingmetrics.ticker.TickerNormalizer;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(FilingsProperties.class)
public class PipelineConfig {
  private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

  @Bean
  ConceptSynonyms conceptSynonyms(FilingsProperties properties) {
    if (properties.conceptSynonyms().isEmpty()) {
      log.warn("No concept synonyms configured under filings.concept-synonyms; "
          + "every metric will report NO_MAPPED_FACTS");
    }
    return ConceptSynonyms.of(properties.conceptSynonyms());
  }

  @Bean
  TickerNormalizer tickerNormalizer(FilingsProperties properties) {
    return new TickerNormalizer(properties.tickerCorrections());
  }

  @Bean
  FactMapper factMapper(ConceptSynonyms synonyms) {
    return new FactMapper(synonyms);
  }

  @Bean
  PeriodOrganizer periodOrganizer(ConceptSynonyms synonyms) {
    return new PeriodOrganizer(synonyms);
  }

  @Bean
  CompanyFactsParser companyFactsParser() {
    return new CompanyFactsParser();
  }

  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }
}
