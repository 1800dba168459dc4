package org.erpsuite.currency.service.dto;

import java.math.BigDecimal;
import java.time.Instant;

import org.erpsuite.currency.domain.RateSource;

/**
 * Partial update of an exchange rate. Null components leave the stored value unchanged.
 *
 * @param rate new rate; the inverse rate is recomputed from it
 * @param effectiveDate new start of validity
 * @param expiresAt new end of validity
 * @param clearExpiresAt true to make the validity window open-ended
 * @param source new source
 * @param sourceReference new source reference
 * @param active new active flag
 */
public record ExchangeRateUpdate(
    BigDecimal rate,
    Instant effectiveDate,
    Instant expiresAt,
    boolean clearExpiresAt,
    RateSource source,
    String sourceReference,
    Boolean active) {}
