package org.erpsuite.currency.service.dto;

import org.erpsuite.currency.domain.SymbolPosition;

/**
 * Partial update of a currency. Null components leave the stored value unchanged.
 *
 * @param code new currency code
 * @param name new display name
 * @param symbol new symbol
 * @param decimalPlaces new number of fractional digits
 * @param symbolPosition new symbol placement
 * @param thousandsSeparator new grouping separator
 * @param decimalSeparator new decimal separator
 * @param baseCurrency true to make this the tenant's base currency
 * @param sortOrder new display position
 * @param active new active flag
 */
public record CurrencyUpdate(
    String code,
    String name,
    String symbol,
    Integer decimalPlaces,
    SymbolPosition symbolPosition,
    String thousandsSeparator,
    String decimalSeparator,
    Boolean baseCurrency,
    Integer sortOrder,
    Boolean active) {}
