package org.erpsuite.currency.api.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import io.swagger.v3.oas.annotations.media.Schema;

import org.erpsuite.currency.domain.Currency;
import org.erpsuite.currency.domain.SymbolPosition;

@Schema(description = "Request to register a currency")
public record CurrencyCreateRequest(
    @Schema(
            description = "Three letter currency code, stored upper case",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "EUR")
        @NotBlank(message = "Currency code is required")
        @Pattern(regexp = "^[A-Za-z]{3}$", message = "Currency code must be 3 letters")
        String code,
    @Schema(
            description = "Display name",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "Euro")
        @NotBlank(message = "Name is required")
        @Size(max = 100)
        String name,
    @Schema(description = "Symbol", requiredMode = Schema.RequiredMode.REQUIRED, example = "€")
        @NotBlank(message = "Symbol is required")
        @Size(max = 10)
        String symbol,
    @Schema(description = "Fractional digits, defaults to 2", example = "2")
        @Min(0)
        @Max(4)
        Integer decimalPlaces,
    @Schema(description = "Symbol placement, defaults to BEFORE", example = "AFTER")
        SymbolPosition symbolPosition,
    @Schema(description = "Thousands separator, defaults to ','", example = ".")
        @Size(max = 5)
        String thousandsSeparator,
    @Schema(description = "Decimal separator, defaults to '.'", example = ",")
        @Size(max = 5)
        String decimalSeparator,
    @Schema(description = "Make this the tenant's base currency", example = "false")
        Boolean baseCurrency,
    @Schema(description = "Display position; appended at the end when omitted", example = "1")
        @Min(0)
        Integer sortOrder) {

  public Currency toEntity() {
    var currency = new Currency();
    currency.setCode(code);
    currency.setName(name);
    currency.setSymbol(symbol);
    if (decimalPlaces != null) {
      currency.setDecimalPlaces(decimalPlaces);
    }
    if (symbolPosition != null) {
      currency.setSymbolPosition(symbolPosition);
    }
    if (thousandsSeparator != null) {
      currency.setThousandsSeparator(thousandsSeparator);
    }
    if (decimalSeparator != null) {
      currency.setDecimalSeparator(decimalSeparator);
    }
    currency.setBaseCurrency(Boolean.TRUE.equals(baseCurrency));
    currency.setSortOrder(sortOrder);

    return currency;
  }
}
