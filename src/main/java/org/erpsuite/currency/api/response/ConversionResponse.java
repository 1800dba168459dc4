package org.erpsuite.currency.api.response;

import java.math.BigDecimal;
import java.time.Instant;

import io.swagger.v3.oas.annotations.media.Schema;

import org.erpsuite.currency.domain.RateSource;
import org.erpsuite.currency.service.dto.ConversionResult;
import org.erpsuite.currency.service.dto.ResolutionKind;

/** Response DTO for currency conversions. */
@Schema(description = "Result of converting an amount")
public record ConversionResponse(
    @Schema(
            description = "Amount in the source currency",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "100")
        BigDecimal originalAmount,
    @Schema(
            description = "Amount in the target currency, rounded to its decimal places",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "92.00")
        BigDecimal convertedAmount,
    @Schema(
            description = "Source currency code",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "USD")
        String fromCurrency,
    @Schema(
            description = "Target currency code",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "EUR")
        String toCurrency,
    @Schema(
            description = "Rate applied",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "0.92")
        BigDecimal rate,
    @Schema(
            description = "Inverse of the applied rate",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "1.08695652")
        BigDecimal inverseRate,
    @Schema(
            description = "Start of validity of the applied rate",
            requiredMode = Schema.RequiredMode.REQUIRED)
        Instant effectiveDate,
    @Schema(description = "Origin of the applied rate", requiredMode = Schema.RequiredMode.REQUIRED)
        RateSource source,
    @Schema(
            description = "How the rate was obtained",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "DIRECT")
        ResolutionKind resolution,
    @Schema(
            description = "Converted amount formatted for the target currency",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "92,00€")
        String formattedAmount) {

  public static ConversionResponse from(ConversionResult result) {
    return new ConversionResponse(
        result.originalAmount(),
        result.convertedAmount(),
        result.fromCurrency(),
        result.toCurrency(),
        result.rate(),
        result.inverseRate(),
        result.effectiveDate(),
        result.source(),
        result.resolution(),
        result.formattedAmount());
  }
}
