package com.ospicorp.filingmetrics.analysis.model;

public enum MetricStatus {
  AVAILABLE,
  NO_MAPPED_FACTS
}
