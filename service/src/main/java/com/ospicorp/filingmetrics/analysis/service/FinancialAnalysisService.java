package com.ospicorp.filingmetrics.analysis.service;

import com.ospicorp.filingmetrics.analysis.model.CompanyAnalysis;
import com.ospicorp.filingmetrics.analysis.model.GrowthResult;
import com.ospicorp.filingmetrics.analysis.model.GrowthRow;
import com.ospicorp.filingmetrics.analysis.model.MetricAnalysis;
import com.ospicorp.filingmetrics.analysis.model.MetricStatus;
import com.ospicorp.filingmetrics.analysis.model.OrganizedSeries;
import com.ospicorp.filingmetrics.config.FilingsProperties;
import com.ospicorp.filingmetrics.facts.client.CompanyFactsSource;
import com.ospicorp.filingmetrics.facts.model.Metric;
import com.ospicorp.filingmetrics.facts.model.RawFact;
import com.ospicorp.filingmetrics.facts.service.FactMapper;
import com.ospicorp.filingmetrics.ticker.NormalizedTicker;
import com.ospicorp.filingmetrics.ticker.TickerNormalizer;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs the analysis pipeline for one company: normalize the ticker, fetch facts, map them onto
 * metrics, organize them by period, then derive growth and quality for each metric.
 */
@Service
public class FinancialAnalysisService {
  private static final Logger log = LoggerFactory.getLogger(FinancialAnalysisService.class);

  private final TickerNormalizer tickerNormalizer;
  private final CompanyFactsSource factsSource;
  private final FactMapper factMapper;
  private final PeriodOrganizer periodOrganizer;
  private final FilingsProperties properties;
  private final Clock clock;

  public FinancialAnalysisService(TickerNormalizer tickerNormalizer,
      CompanyFactsSource factsSource,
      FactMapper factMapper,
      PeriodOrganizer periodOrganizer,
      FilingsProperties properties,
      Clock clock) {
    this.tickerNormalizer = tickerNormalizer;
    this.factsSource = factsSource;
    this.factMapper = factMapper;
    this.periodOrganizer = periodOrganizer;
    this.properties = properties;
    this.clock = clock;
  }

  public NormalizedTicker normalizeTicker(String rawTicker) {
    return tickerNormalizer.normalize(rawTicker);
  }

  public CompanyAnalysis analyze(String rawTicker) {
    NormalizedTicker ticker = tickerNormalizer.normalize(rawTicker);
    LocalDate asOf = LocalDate.now(clock);
    Map<Metric, OrganizedSeries> organized = organize(ticker, asOf);

    List<MetricAnalysis> metrics = new ArrayList<>();
    for (Metric metric : Metric.values()) {
      metrics.add(analyzeSeries(organized.getOrDefault(metric, OrganizedSeries.empty(metric)),
          asOf));
    }
    List<String> warnings =
        DataQualityAssessor.warnings(metrics, properties.completenessWarningThreshold());
    long available = metrics.stream().filter(m -> m.status() == MetricStatus.AVAILABLE).count();
    log.info("Analyzed {} as of {}: {} of {} metrics available, {} warnings",
        ticker.symbol(), asOf, available, metrics.size(), warnings.size());
    return new CompanyAnalysis(ticker.symbol(), ticker.notes(), asOf, metrics, warnings);
  }

  /**
   * @throws NoMappedFactsException when no usable fact maps onto {@code metric}
   */
  public MetricAnalysis analyzeMetric(String rawTicker, Metric metric) {
    NormalizedTicker ticker = tickerNormalizer.normalize(rawTicker);
    LocalDate asOf = LocalDate.now(clock);
    OrganizedSeries series = organize(ticker, asOf).get(metric);
    if (series == null || series.isEmpty()) {
      throw new NoMappedFactsException(ticker.symbol(), metric);
    }
    return analyzeSeries(series, asOf);
  }

  public List<GrowthRow> growthRows(String rawTicker, Metric metric) {
    String symbol = tickerNormalizer.normalize(rawTicker).symbol();
    List<GrowthRow> rows = new ArrayList<>();
    for (GrowthResult result : analyzeMetric(rawTicker, metric).growth()) {
      rows.add(GrowthRow.of(symbol, result));
    }
    return rows;
  }

  MetricAnalysis analyzeSeries(OrganizedSeries series, LocalDate asOf) {
    Metric metric = series.metric();
    int years = properties.trailingYears();
    var annual = DataQualityAssessor.assess(series, metric,
        ReportingWindow.trailingFiscalYears(asOf, years));
    var quarterly = DataQualityAssessor.assess(series, metric,
        ReportingWindow.trailingQuarters(asOf, years * 4));
    if (series.isEmpty()) {
      return new MetricAnalysis(metric, MetricStatus.NO_MAPPED_FACTS, series, List.of(), annual,
          quarterly);
    }
    List<GrowthResult> growth = GrowthCalculator.compute(series, metric, properties.cagrYears());
    return new MetricAnalysis(metric, MetricStatus.AVAILABLE, series, growth, annual, quarterly);
  }

  private Map<Metric, OrganizedSeries> organize(NormalizedTicker ticker, LocalDate asOf) {
    // one extra year so the oldest year of the window still has a YoY base
    LocalDate since = LocalDate.of(asOf.getYear() - properties.trailingYears() - 1, 1, 1);
    List<RawFact> facts = factsSource.fetchFacts(ticker, since);
    Map<Metric, List<RawFact>> mapped = factMapper.map(facts);
    log.debug("{}: {} facts since {}, {} metrics mapped", ticker.symbol(), facts.size(), since,
        mapped.size());
    return periodOrganizer.organize(mapped);
  }
}
