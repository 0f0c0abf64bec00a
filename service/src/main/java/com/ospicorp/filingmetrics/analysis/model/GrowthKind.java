package com.ospicorp.filingmetrics.analysis.model;

public enum GrowthKind {
  CAGR,
  YOY,
  QOQ
}
