package org.erpsuite.currency.api.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import io.swagger.v3.oas.annotations.media.Schema;

import org.erpsuite.currency.domain.SymbolPosition;
import org.erpsuite.currency.service.dto.CurrencyUpdate;

/** Partial update; omitted fields keep their current value. */
@Schema(description = "Request to update a currency")
public record CurrencyUpdateRequest(
    @Schema(description = "Three letter currency code", example = "EUR")
        @Pattern(regexp = "^[A-Za-z]{3}$", message = "Currency code must be 3 letters")
        String code,
    @Schema(description = "Display name", example = "Euro") @Size(min = 1, max = 100) String name,
    @Schema(description = "Symbol", example = "€") @Size(min = 1, max = 10) String symbol,
    @Schema(description = "Fractional digits", example = "2") @Min(0) @Max(4)
        Integer decimalPlaces,
    @Schema(description = "Symbol placement", example = "AFTER") SymbolPosition symbolPosition,
    @Schema(description = "Thousands separator", example = ".") @Size(max = 5)
        String thousandsSeparator,
    @Schema(description = "Decimal separator", example = ",") @Size(max = 5)
        String decimalSeparator,
    @Schema(description = "Make this the tenant's base currency", example = "true")
        Boolean baseCurrency,
    @Schema(description = "Display position", example = "3") @Min(0) Integer sortOrder,
    @Schema(description = "Whether the currency is active", example = "true") Boolean active) {

  public CurrencyUpdate toUpdate() {
    return new CurrencyUpdate(
        code,
        name,
        symbol,
        decimalPlaces,
        symbolPosition,
        thousandsSeparator,
        decimalSeparator,
        baseCurrency,
        sortOrder,
        active);
  }
}
