package org.erpsuite.currency.domain;

/**
 * Catalog entry describing a well-known ISO 4217 currency.
 *
 * @param code ISO 4217 code
 * @param name display name
 * @param symbol currency symbol
 * @param decimalPlaces customary number of fractional digits
 * @param symbolPosition customary symbol placement
 * @param country country or region using the currency
 */
public record PredefinedCurrency(
    String code,
    String name,
    String symbol,
    int decimalPlaces,
    SymbolPosition symbolPosition,
    String country) {}
