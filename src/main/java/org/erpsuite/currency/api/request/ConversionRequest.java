package org.erpsuite.currency.api.request;

import java.math.BigDecimal;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;

import io.swagger.v3.oas.annotations.media.Schema;

import org.erpsuite.currency.service.dto.ConversionQuery;

@Schema(description = "Request to convert an amount between two currencies")
public record ConversionRequest(
    @Schema(
            description = "Amount in the source currency",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "100.00")
        @NotNull(message = "Amount is required")
        @PositiveOrZero(message = "Amount must not be negative")
        BigDecimal amount,
    @Schema(
            description = "Source currency code",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "USD")
        @NotBlank
        @Pattern(regexp = "^[A-Za-z]{3}$", message = "Currency code must be 3 letters")
        String fromCurrency,
    @Schema(
            description = "Target currency code",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "EUR")
        @NotBlank
        @Pattern(regexp = "^[A-Za-z]{3}$", message = "Currency code must be 3 letters")
        String toCurrency,
    @Schema(
            description =
                "As-of date, ISO-8601 date-time with offset or plain date; defaults to now",
            example = "2024-07-01")
        String date) {

  public ConversionQuery toQuery() {
    return new ConversionQuery(amount, fromCurrency, toCurrency, date);
  }
}
