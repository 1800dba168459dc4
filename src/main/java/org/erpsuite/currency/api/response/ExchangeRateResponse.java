package org.erpsuite.currency.api.response;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import io.swagger.v3.oas.annotations.media.Schema;

import org.erpsuite.currency.domain.ExchangeRate;
import org.erpsuite.currency.domain.RateSource;

/** Response DTO for stored exchange rates. */
@Schema(description = "Stored exchange rate")
public record ExchangeRateResponse(
    @Schema(description = "Unique identifier", requiredMode = Schema.RequiredMode.REQUIRED)
        UUID id,
    @Schema(description = "Source currency id", requiredMode = Schema.RequiredMode.REQUIRED)
        UUID fromCurrencyId,
    @Schema(description = "Target currency id", requiredMode = Schema.RequiredMode.REQUIRED)
        UUID toCurrencyId,
    @Schema(
            description = "Amount of target currency per unit of source currency",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "0.92")
        BigDecimal rate,
    @Schema(
            description = "1 / rate, rounded to 8 decimal places",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "1.08695652")
        BigDecimal inverseRate,
    @Schema(
            description = "Start of validity",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "2024-01-01T00:00:00Z")
        Instant effectiveDate,
    @Schema(description = "End of validity, null when open-ended") Instant expiresAt,
    @Schema(description = "Origin of the rate", requiredMode = Schema.RequiredMode.REQUIRED)
        RateSource source,
    @Schema(description = "Reference in the source system") String sourceReference,
    @Schema(description = "Whether the rate is active", requiredMode = Schema.RequiredMode.REQUIRED)
        boolean active,
    @Schema(description = "Creation timestamp", requiredMode = Schema.RequiredMode.REQUIRED)
        Instant createdAt,
    @Schema(description = "Last update timestamp", requiredMode = Schema.RequiredMode.REQUIRED)
        Instant updatedAt) {

  public static ExchangeRateResponse from(ExchangeRate entity) {
    return new ExchangeRateResponse(
        entity.getId(),
        entity.getFromCurrencyId(),
        entity.getToCurrencyId(),
        entity.getRate(),
        entity.getInverseRate(),
        entity.getEffectiveDate(),
        entity.getExpiresAt(),
        entity.getSource(),
        entity.getSourceReference(),
        entity.isActive(),
        entity.getCreatedAt(),
        entity.getUpdatedAt());
  }
}
