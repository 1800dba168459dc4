package org.erpsuite.currency.service.exception;

import java.util.List;

import org.erpsuite.currency.service.CurrencyServiceError;

/** No active currency matches a requested code. */
public class CurrencyNotFoundException extends ResourceNotFoundException {

  private final List<String> codes;

  /**
   * Single code lookup failed.
   *
   * @param code the requested code
   */
  public CurrencyNotFoundException(String code) {
    super("Currency not found: " + code, CurrencyServiceError.CURRENCY_NOT_FOUND.name());
    this.codes = List.of(code);
  }

  /**
   * One or both sides of a currency pair could not be found.
   *
   * @param fromCode source currency code
   * @param toCode target currency code
   */
  public CurrencyNotFoundException(String fromCode, String toCode) {
    super(
        "Currency not found for pair " + fromCode + " -> " + toCode,
        CurrencyServiceError.CURRENCY_NOT_FOUND.name());
    this.codes = List.of(fromCode, toCode);
  }

  public List<String> getCodes() {
    return codes;
  }
}
