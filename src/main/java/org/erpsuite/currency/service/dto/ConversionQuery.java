package org.erpsuite.currency.service.dto;

import java.math.BigDecimal;

/**
 * A single conversion request.
 *
 * @param amount non-negative amount in the source currency
 * @param fromCurrency source currency code
 * @param toCurrency target currency code
 * @param date optional as-of date, ISO-8601 date-time with offset or plain date
 */
public record ConversionQuery(
    BigDecimal amount, String fromCurrency, String toCurrency, String date) {}
