package org.erpsuite.currency.service;

/** Error codes for currency service exceptions. */
public enum CurrencyServiceError {
  /** Request input failed validation. */
  VALIDATION_ERROR,

  /** A non-retired currency with the same code already exists for the tenant. */
  DUPLICATE_CURRENCY_CODE,

  /** No active currency exists for a requested code. */
  CURRENCY_NOT_FOUND,

  /** No direct or inverse exchange rate applies to the pair at the requested date. */
  RATE_NOT_FOUND,

  /** The base currency cannot be retired or deactivated. */
  CANNOT_RETIRE_BASE_CURRENCY,

  /** Rate references an unknown or retired currency, or the same currency on both sides. */
  INVALID_CURRENCY_PAIR,

  /** Expiry precedes the effective date. */
  INVALID_VALIDITY_WINDOW,

  /** Bulk conversion request exceeds the configured item limit. */
  TOO_MANY_ITEMS,

  /** A concurrent request changed the tenant's base currency. */
  BASE_CURRENCY_CONFLICT,
}
