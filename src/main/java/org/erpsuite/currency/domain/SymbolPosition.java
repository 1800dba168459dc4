package org.erpsuite.currency.domain;

/** Placement of the currency symbol relative to a formatted amount. */
public enum SymbolPosition {
  /** Symbol precedes the amount, e.g. {@code $1,234.56}. */
  BEFORE,

  /** Symbol follows the amount, e.g. {@code 1.234,56€}. */
  AFTER
}
