package org.erpsuite.currency.api.response;

import io.swagger.v3.oas.annotations.media.Schema;

import org.erpsuite.currency.domain.PredefinedCurrency;
import org.erpsuite.currency.domain.SymbolPosition;

@Schema(description = "Catalog entry for a well-known currency")
public record PredefinedCurrencyResponse(
    @Schema(description = "ISO 4217 code", example = "JPY") String code,
    @Schema(description = "Display name", example = "Japanese Yen") String name,
    @Schema(description = "Symbol", example = "¥") String symbol,
    @Schema(description = "Customary fractional digits", example = "0") int decimalPlaces,
    @Schema(description = "Customary symbol placement", example = "BEFORE")
        SymbolPosition symbolPosition,
    @Schema(description = "Country or region", example = "Japan") String country) {

  public static PredefinedCurrencyResponse from(PredefinedCurrency entry) {
    return new PredefinedCurrencyResponse(
        entry.code(),
        entry.name(),
        entry.symbol(),
        entry.decimalPlaces(),
        entry.symbolPosition(),
        entry.country());
  }
}
