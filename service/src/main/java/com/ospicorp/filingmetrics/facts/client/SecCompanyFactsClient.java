package com.ospicorp.filingmetrics.facts.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.ospicorp.filingmetrics.config.FilingsProperties;
import com.ospicorp.filingmetrics.facts.model.RawFact;
import com.ospicorp.filingmetrics.ticker.NormalizedTicker;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

@Component
public class SecCompanyFactsClient implements CompanyFactsSource {
  private static final Logger log = LoggerFactory.getLogger(SecCompanyFactsClient.class);

  private final RestTemplate restTemplate;
  private final CompanyFactsParser parser;
  private final FilingsProperties.Sec sec;

  public SecCompanyFactsClient(RestTemplate restTemplate, CompanyFactsParser parser,
      FilingsProperties properties) {
    this.restTemplate = restTemplate;
    this.parser = parser;
    this.sec = properties.sec();
  }

  @Override
  public List<RawFact> fetchFacts(NormalizedTicker ticker, LocalDate since) {
    String cik = findCik(get(sec.tickerIndexUrl()), ticker.symbol());
    if (cik == null) {
      throw new NoSuchElementException("Company not found for ticker: " + ticker.symbol());
    }
    String baseUrl = sec.baseUrl().endsWith("/")
        ? sec.baseUrl().substring(0, sec.baseUrl().length() - 1)
        : sec.baseUrl();
    String url = baseUrl + "/api/xbrl/companyfacts/CIK" + cik + ".json";
    log.debug("Fetching company facts for {} from {}", ticker.symbol(), url);
    return parser.parse(get(url), since);
  }

  /** Zero padded CIK of {@code symbol} in the SEC ticker index, or null when not listed. */
  static String findCik(JsonNode index, String symbol) {
    if (index == null) {
      return null;
    }
    for (JsonNode company : index) {
      String listed = company.path("ticker").asText("");
      if (listed.toUpperCase(Locale.ROOT).equals(symbol) && company.path("cik_str").canConvertToLong()) {
        return String.format(Locale.ROOT, "%010d", company.path("cik_str").asLong());
      }
    }
    return null;
  }

  private JsonNode get(String url) {
    HttpHeaders headers = new HttpHeaders();
    headers.set(HttpHeaders.USER_AGENT, sec.userAgent());
    headers.setAccept(List.of(MediaType.APPLICATION_JSON));
    try {
      ResponseEntity<JsonNode> response = restTemplate.exchange(url, HttpMethod.GET,
          new HttpEntity<>(headers), JsonNode.class);
      return response.getBody();
    } catch (HttpClientErrorException.NotFound e) {
      throw new NoSuchElementException("No filings data at " + url);
    }
  }
}
