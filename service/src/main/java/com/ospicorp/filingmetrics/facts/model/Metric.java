package com.ospicorp.filingmetrics.facts.model;

/**
 * Internal metric vocabulary. Declaration order is the priority order used when a concept
 * name is listed as a synonym under more than one metric.
 */
public enum Metric {
  REVENUE,
  GROSS_PROFIT,
  OPERATING_INCOME,
  NET_INCOME,
  DILUTED_EPS,
  BASIC_EPS,
  OPERATING_CASH_FLOW,
  TOTAL_ASSETS,
  TOTAL_LIABILITIES
}
