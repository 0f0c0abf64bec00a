package com.ospicorp.filingmetrics.facts.client;

import com.ospicorp.filingmetrics.facts.model.RawFact;
import com.ospicorp.filingmetrics.ticker.NormalizedTicker;
import java.time.LocalDate;
import java.util.List;

/**
 * Supplies the reported facts of one company.
 */
public interface CompanyFactsSource {

  /**
   * @param ticker normalized ticker of the company
   * @param since earliest period end to include
   * @return facts in no particular order
   * @throws java.util.NoSuchElementException if the ticker is unknown to the source
   */
  List<RawFact> fetchFacts(NormalizedTicker ticker, LocalDate since);
}
