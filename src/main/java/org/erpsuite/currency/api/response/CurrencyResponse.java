package org.erpsuite.currency.api.response;

import java.time.Instant;
import java.util.UUID;

import io.swagger.v3.oas.annotations.media.Schema;

import org.erpsuite.currency.domain.Currency;
import org.erpsuite.currency.domain.SymbolPosition;

/** Response DTO for currency operations. */
@Schema(description = "Currency with formatting settings")
public record CurrencyResponse(
    @Schema(description = "Unique identifier", requiredMode = Schema.RequiredMode.REQUIRED)
        UUID id,
    @Schema(
            description = "Three letter currency code",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "EUR")
        String code,
    @Schema(
            description = "Display name",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "Euro")
        String name,
    @Schema(description = "Symbol", requiredMode = Schema.RequiredMode.REQUIRED, example = "€")
        String symbol,
    @Schema(
            description = "Fractional digits amounts are rounded to",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "2")
        int decimalPlaces,
    @Schema(
            description = "Symbol placement",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "AFTER")
        SymbolPosition symbolPosition,
    @Schema(
            description = "Thousands separator",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = ".")
        String thousandsSeparator,
    @Schema(
            description = "Decimal separator",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = ",")
        String decimalSeparator,
    @Schema(
            description = "Whether this is the tenant's base currency",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "false")
        boolean baseCurrency,
    @Schema(
            description = "Display position",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "1")
        int sortOrder,
    @Schema(
            description = "Whether the currency is active",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "true")
        boolean active,
    @Schema(
            description = "Timestamp when this currency was created",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "2025-01-15T10:30:00Z")
        Instant createdAt,
    @Schema(
            description = "Timestamp when this currency was last updated",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "2025-01-15T14:45:00Z")
        Instant updatedAt) {

  /**
   * Create a response DTO from a domain entity.
   *
   * @param entity The currency entity
   * @return CurrencyResponse
   */
  public static CurrencyResponse from(Currency entity) {
    return new CurrencyResponse(
        entity.getId(),
        entity.getCode(),
        entity.getName(),
        entity.getSymbol(),
        entity.getDecimalPlaces(),
        entity.getSymbolPosition(),
        entity.getThousandsSeparator(),
        entity.getDecimalSeparator(),
        entity.isBaseCurrency(),
        entity.getSortOrder(),
        entity.isActive(),
        entity.getCreatedAt(),
        entity.getUpdatedAt());
  }
}
