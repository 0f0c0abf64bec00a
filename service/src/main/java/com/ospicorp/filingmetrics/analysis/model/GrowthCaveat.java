package com.ospicorp.filingmetrics.analysis.model;

/** Reason a growth rate could not be expressed as a single number. */
public enum GrowthCaveat {
  NONE,
  SIGN_FLIP,
  ZERO_BASE,
  INSUFFICIENT_DATA
}
