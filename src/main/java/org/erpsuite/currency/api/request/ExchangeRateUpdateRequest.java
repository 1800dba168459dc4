package org.erpsuite.currency.api.request;

import java.math.BigDecimal;
import java.time.Instant;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import io.swagger.v3.oas.annotations.media.Schema;

import org.erpsuite.currency.domain.RateSource;
import org.erpsuite.currency.service.dto.ExchangeRateUpdate;

/** Partial update; omitted fields keep their current value. */
@Schema(description = "Request to update an exchange rate")
public record ExchangeRateUpdateRequest(
    @Schema(description = "New rate; the inverse rate is recomputed", example = "0.93")
        @Positive(message = "Rate must be greater than zero")
        @Digits(integer = 14, fraction = 10)
        BigDecimal rate,
    @Schema(description = "New start of validity") Instant effectiveDate,
    @Schema(description = "New end of validity") Instant expiresAt,
    @Schema(description = "Remove the end of validity", example = "false") Boolean clearExpiresAt,
    @Schema(description = "New origin") RateSource source,
    @Schema(description = "New source reference") @Size(max = 255) String sourceReference,
    @Schema(description = "Whether the rate is active", example = "true") Boolean active) {

  public ExchangeRateUpdate toUpdate() {
    return new ExchangeRateUpdate(
        rate,
        effectiveDate,
        expiresAt,
        Boolean.TRUE.equals(clearExpiresAt),
        source,
        sourceReference,
        active);
  }
}
