package org.erpsuite.currency.domain;

/** Origin of an exchange rate record. */
public enum RateSource {
  MANUAL,
  API_OPENEXCHANGE,
  API_FIXER,
  API_CURRENCYLAYER,
  API_XE,
  BANK_FEED
}
