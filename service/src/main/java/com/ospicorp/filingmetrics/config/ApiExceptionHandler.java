package com.ospicorp.filingmetrics.config;

import com.ospicorp.filingmetrics.analysis.controller.InvalidParameterException;
import com.ospicorp.filingmetrics.analysis.service.NoMappedFactsException;
import com.ospicorp.filingmetrics.ticker.InvalidTickerException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.net.URI;
import java.util.Map;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.client.RestClientException;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);
  private static final String PROBLEM_BASE = "https://docs.filing-metrics.dev/problems/";

  private static final Map<HttpStatus, String> TYPE_SLUGS = Map.of(
      HttpStatus.BAD_REQUEST, "invalid-parameter",
      HttpStatus.NOT_FOUND, "not-found",
      HttpStatus.BAD_GATEWAY, "upstream-error",
      HttpStatus.INTERNAL_SERVER_ERROR, "internal-error"
  );

  @ExceptionHandler(InvalidTickerException.class)
  public ResponseEntity<ProblemDetail> handleInvalidTicker(InvalidTickerException ex,
      HttpServletRequest request) {
    ProblemDetail detail = problem(HttpStatus.BAD_REQUEST, ex, request, "invalid-ticker");
    detail.setProperty("errorCode", ex.errorCode());
    detail.setProperty("reason", ex.reason());
    detail.setProperty("suggestions", ex.suggestions());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(detail);
  }

  @ExceptionHandler(NoMappedFactsException.class)
  public ResponseEntity<ProblemDetail> handleNoMappedFacts(NoMappedFactsException ex,
      HttpServletRequest request) {
    ProblemDetail detail = problem(HttpStatus.NOT_FOUND, ex, request, "data-unavailable");
    detail.setProperty("errorCode", ex.errorCode());
    detail.setProperty("metric", ex.metric().name());
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(detail);
  }

  @ExceptionHandler(InvalidParameterException.class)
  public ResponseEntity<ProblemDetail> handleInvalidParameter(InvalidParameterException ex,
      HttpServletRequest request) {
    ProblemDetail detail = problem(HttpStatus.BAD_REQUEST, ex, request, null);
    detail.setProperty("errorCode", ex.errorCode());
    detail.setProperty("moreInfo", ex.moreInfo());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(detail);
  }

  @ExceptionHandler({ConstraintViolationException.class, HandlerMethodValidationException.class,
      MethodArgumentTypeMismatchException.class, IllegalArgumentException.class})
  public ResponseEntity<ProblemDetail> handleBadRequest(Exception ex, HttpServletRequest request) {
    return respond(HttpStatus.BAD_REQUEST, ex, request);
  }

  @ExceptionHandler(NoSuchElementException.class)
  public ResponseEntity<ProblemDetail> handleNotFound(NoSuchElementException ex,
      HttpServletRequest request) {
    return respond(HttpStatus.NOT_FOUND, ex, request);
  }

  @ExceptionHandler(RestClientException.class)
  public ResponseEntity<ProblemDetail> handleUpstream(RestClientException ex,
      HttpServletRequest request) {
    return respond(HttpStatus.BAD_GATEWAY, ex, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleServerError(Exception ex, HttpServletRequest request) {
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex, request);
  }

  private ResponseEntity<ProblemDetail> respond(HttpStatus status, Exception ex,
      HttpServletRequest request) {
    return ResponseEntity.status(status).body(problem(status, ex, request, null));
  }

  private ProblemDetail problem(HttpStatus status, Exception ex, HttpServletRequest request,
      String slug) {
    logException(status, ex, request);
    ProblemDetail detail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
    detail.setTitle(status.getReasonPhrase());
    detail.setInstance(URI.create(request.getRequestURI()));
    detail.setType(URI.create(PROBLEM_BASE
        + (slug != null ? slug : TYPE_SLUGS.getOrDefault(status, "internal-error"))));
    detail.setProperty("path", request.getRequestURI());
    return detail;
  }

  private void logException(HttpStatus status, Exception ex, HttpServletRequest request) {
    String errorMessage = ex.getMessage();
    if (errorMessage == null || errorMessage.isBlank()) {
      errorMessage = ex.getClass().getName();
    }
    if (status.is5xxServerError()) {
      log.error("Request {} {} from {} failed with status {}: {}",
          request.getMethod(),
          RequestDescriptions.uriWithQuery(request),
          RequestDescriptions.clientIp(request),
          status.value(),
          errorMessage,
          ex);
    } else {
      log.warn("Request {} {} from {} returned status {}: {}",
          request.getMethod(),
          RequestDescriptions.uriWithQuery(request),
          RequestDescriptions.clientIp(request),
          status.value(),
          errorMessage);
    }
  }
}
