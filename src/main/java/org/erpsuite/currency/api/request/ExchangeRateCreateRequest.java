package org.erpsuite.currency.api.request;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import io.swagger.v3.oas.annotations.media.Schema;

import org.erpsuite.currency.domain.ExchangeRate;
import org.erpsuite.currency.domain.RateSource;

@Schema(description = "Request to create an exchange rate")
public record ExchangeRateCreateRequest(
    @Schema(description = "Source currency id", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "Source currency is required")
        UUID fromCurrencyId,
    @Schema(description = "Target currency id", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "Target currency is required")
        UUID toCurrencyId,
    @Schema(
            description = "Amount of target currency per unit of source currency",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "0.92")
        @NotNull(message = "Rate is required")
        @Positive(message = "Rate must be greater than zero")
        @Digits(integer = 14, fraction = 10)
        BigDecimal rate,
    @Schema(description = "Start of validity, defaults to now", example = "2024-01-01T00:00:00Z")
        Instant effectiveDate,
    @Schema(
            description = "End of validity, open-ended when omitted",
            example = "2024-06-30T23:59:59Z")
        Instant expiresAt,
    @Schema(description = "Origin of the rate, defaults to MANUAL", example = "MANUAL")
        RateSource source,
    @Schema(description = "Reference in the source system", example = "ECB-2024-001")
        @Size(max = 255)
        String sourceReference) {

  public ExchangeRate toEntity() {
    var exchangeRate = new ExchangeRate();
    exchangeRate.setFromCurrencyId(fromCurrencyId);
    exchangeRate.setToCurrencyId(toCurrencyId);
    exchangeRate.setRate(rate);
    exchangeRate.setEffectiveDate(effectiveDate);
    exchangeRate.setExpiresAt(expiresAt);
    if (source != null) {
      exchangeRate.setSource(source);
    }
    exchangeRate.setSourceReference(sourceReference);

    return exchangeRate;
  }
}
