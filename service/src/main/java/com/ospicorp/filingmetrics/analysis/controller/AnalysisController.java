package com.ospicorp.filingmetrics.analysis.controller;

import com.ospicorp.filingmetrics.analysis.model.CompanyAnalysis;
import com.ospicorp.filingmetrics.analysis.model.GrowthRow;
import com.ospicorp.filingmetrics.analysis.model.MetricAnalysis;
import com.ospicorp.filingmetrics.analysis.service.FinancialAnalysisService;
import com.ospicorp.filingmetrics.facts.model.Metric;
import com.ospicorp.filingmetrics.ticker.NormalizedTicker;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Pattern;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@Validated
@Tag(name = "Analysis")
public class AnalysisController {
  private static final String TICKER_REGEX = "^[A-Za-z0-9._-]{1,16}$";
  private static final String ERROR_DOCS_BASE = "https://docs.filing-metrics.dev/errors/";

  private final FinancialAnalysisService analysisService;

  public AnalysisController(FinancialAnalysisService analysisService) {
    this.analysisService = analysisService;
  }

  @GetMapping("/tickers/{ticker}")
  @Operation(summary = "Normalize a ticker",
      description = "Validate a ticker and rewrite it into the form used by the SEC ticker index.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Normalized ticker",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = NormalizedTicker.class))),
      @ApiResponse(responseCode = "400", description = "Invalid ticker",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public NormalizedTicker ticker(@PathVariable @Pattern(regexp = TICKER_REGEX)
      @Parameter(description = "Ticker symbol", example = "brk.b") String ticker) {
    return analysisService.normalizeTicker(ticker);
  }

  @GetMapping("/companies/{ticker}/analysis")
  @Operation(summary = "Analyze a company",
      description = "Periodized metrics, growth rates and data-quality reports for every tracked metric.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Analysis",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = CompanyAnalysis.class))),
      @ApiResponse(responseCode = "400", description = "Invalid ticker",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "404", description = "Company not found",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public CompanyAnalysis analysis(@PathVariable @Pattern(regexp = TICKER_REGEX)
      @Parameter(description = "Ticker symbol", example = "AAPL") String ticker) {
    return analysisService.analyze(ticker);
  }

  @GetMapping("/companies/{ticker}/metrics/{metric}")
  @Operation(summary = "Analyze one metric")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Metric analysis",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = MetricAnalysis.class))),
      @ApiResponse(responseCode = "404", description = "Company not found or no data for the metric",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public MetricAnalysis metric(@PathVariable @Pattern(regexp = TICKER_REGEX) String ticker,
      @PathVariable @Parameter(description = "Metric name", example = "net_income") String metric) {
    return analysisService.analyzeMetric(ticker, parseMetric(metric));
  }

  @GetMapping("/companies/{ticker}/metrics/{metric}/growth")
  @Operation(summary = "Growth rates of one metric",
      description = "CAGR, YoY and QoQ rows, oldest first, as JSON or CSV.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Growth rows",
          content = {
              @Content(mediaType = "application/json"),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "404", description = "Company not found or no data for the metric",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<List<GrowthRow>> growth(
      @PathVariable @Pattern(regexp = TICKER_REGEX) String ticker,
      @PathVariable String metric,
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    MediaType contentType = selectMediaType(format, accept);
    List<GrowthRow> rows = analysisService.growthRows(ticker, parseMetric(metric));
    return ResponseEntity.ok().contentType(contentType).body(rows);
  }

  private static Metric parseMetric(String value) {
    try {
      return Metric.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    } catch (IllegalArgumentException ex) {
      String supported = Arrays.stream(Metric.values())
          .map(m -> m.name().toLowerCase(Locale.ROOT))
          .collect(Collectors.joining(","));
      throw invalidParameter("Invalid metric. Supported values: " + supported + ".", 2001);
    }
  }

  private static MediaType selectMediaType(String format, String accept) {
    if (StringUtils.hasText(format)) {
      if ("csv".equalsIgnoreCase(format)) {
        return CsvHttpMessageConverter.TEXT_CSV;
      }
      if ("json".equalsIgnoreCase(format)) {
        return MediaType.APPLICATION_JSON;
      }
      throw invalidParameter("Invalid format value. Supported values: json,csv.", 2002);
    }
    if (!StringUtils.hasText(accept)) {
      return MediaType.APPLICATION_JSON;
    }
    List<MediaType> mediaTypes = MediaType.parseMediaTypes(accept);
    mediaTypes.sort(Comparator.comparingDouble(MediaType::getQualityValue).reversed());
    MimeTypeUtils.sortBySpecificity(mediaTypes);
    for (MediaType mediaType : mediaTypes) {
      if (mediaType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
        return MediaType.APPLICATION_JSON;
      }
      if (mediaType.isCompatibleWith(CsvHttpMessageConverter.TEXT_CSV)) {
        return CsvHttpMessageConverter.TEXT_CSV;
      }
    }
    return MediaType.APPLICATION_JSON;
  }

  private static InvalidParameterException invalidParameter(String message, int errorCode) {
    return new InvalidParameterException(message, errorCode, ERROR_DOCS_BASE + errorCode);
  }
}
