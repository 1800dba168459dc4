package org.erpsuite.currency.service.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import org.erpsuite.currency.domain.Currency;
import org.erpsuite.currency.domain.ExchangeRate;
import org.erpsuite.currency.domain.RateSource;

/**
 * Effective rate between two currencies at a point in time.
 *
 * @param kind which resolution branch produced this result
 * @param exchangeRateId id of the backing record; null for identity resolutions
 * @param fromCurrency source currency
 * @param toCurrency target currency
 * @param rate multiplier converting source amounts into target amounts
 * @param inverseRate multiplier converting target amounts back into source amounts
 * @param effectiveDate start of validity of the backing record
 * @param expiresAt end of validity of the backing record, null if open-ended
 * @param source origin of the backing record
 */
public record RateResolution(
    ResolutionKind kind,
    UUID exchangeRateId,
    Currency fromCurrency,
    Currency toCurrency,
    BigDecimal rate,
    BigDecimal inverseRate,
    Instant effectiveDate,
    Instant expiresAt,
    RateSource source) {

  public static RateResolution identity(Currency currency, Instant now) {
    return new RateResolution(
        ResolutionKind.IDENTITY,
        null,
        currency,
        currency,
        BigDecimal.ONE,
        BigDecimal.ONE,
        now,
        null,
        RateSource.MANUAL);
  }

  public static RateResolution direct(Currency from, Currency to, ExchangeRate record) {
    return new RateResolution(
        ResolutionKind.DIRECT,
        record.getId(),
        from,
        to,
        record.getRate(),
        record.getInverseRate(),
        record.getEffectiveDate(),
        record.getExpiresAt(),
        record.getSource());
  }

  /** Resolution through a record stored for the opposite direction (to -> from). */
  public static RateResolution inverse(Currency from, Currency to, ExchangeRate record) {
    return new RateResolution(
        ResolutionKind.INVERSE,
        record.getId(),
        from,
        to,
        record.getInverseRate(),
        record.getRate(),
        record.getEffectiveDate(),
        record.getExpiresAt(),
        record.getSource());
  }
}
