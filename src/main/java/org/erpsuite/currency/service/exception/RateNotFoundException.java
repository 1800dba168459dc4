package org.erpsuite.currency.service.exception;

import java.time.Instant;

import org.erpsuite.currency.service.CurrencyServiceError;

/** Neither a direct nor an inverse exchange rate applies to a pair at the requested instant. */
public class RateNotFoundException extends ResourceNotFoundException {

  private final String fromCode;
  private final String toCode;
  private final Instant asOf;

  public RateNotFoundException(String fromCode, String toCode, Instant asOf) {
    super(
        "Exchange rate not found for " + fromCode + " -> " + toCode + " as of " + asOf,
        CurrencyServiceError.RATE_NOT_FOUND.name());
    this.fromCode = fromCode;
    this.toCode = toCode;
    this.asOf = asOf;
  }

  public String getFromCode() {
    return fromCode;
  }

  public String getToCode() {
    return toCode;
  }

  public Instant getAsOf() {
    return asOf;
  }
}
