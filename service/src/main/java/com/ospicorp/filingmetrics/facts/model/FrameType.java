package com.ospicorp.filingmetrics.facts.model;

public enum FrameType {
  ANNUAL,
  QUARTERLY
}
