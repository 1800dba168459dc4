package org.erpsuite.currency.api.response;

import java.math.BigDecimal;
import java.time.Instant;

import io.swagger.v3.oas.annotations.media.Schema;

import org.erpsuite.currency.domain.RateSource;
import org.erpsuite.currency.service.dto.RateResolution;
import org.erpsuite.currency.service.dto.ResolutionKind;

/** Response DTO for a resolved currency pair. */
@Schema(description = "Effective rate between two currencies")
public record RateResolutionResponse(
    @Schema(
            description =
                "Backing record id; 'same-currency' for identity and 'inverse-{id}' when derived"
                    + " from the opposite direction",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "inverse-3f1c9a2e-0b7d-4c55-9f1e-2a8d6c4b7e10")
        String id,
    @Schema(
            description = "How the rate was obtained",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "DIRECT")
        ResolutionKind resolution,
    @Schema(description = "Source currency", requiredMode = Schema.RequiredMode.REQUIRED)
        CurrencyResponse fromCurrency,
    @Schema(description = "Target currency", requiredMode = Schema.RequiredMode.REQUIRED)
        CurrencyResponse toCurrency,
    @Schema(description = "Rate", requiredMode = Schema.RequiredMode.REQUIRED, example = "0.92")
        BigDecimal rate,
    @Schema(
            description = "Inverse rate",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "1.08695652")
        BigDecimal inverseRate,
    @Schema(description = "Start of validity", requiredMode = Schema.RequiredMode.REQUIRED)
        Instant effectiveDate,
    @Schema(description = "End of validity, null when open-ended") Instant expiresAt,
    @Schema(description = "Origin of the rate", requiredMode = Schema.RequiredMode.REQUIRED)
        RateSource source) {

  static final String SAME_CURRENCY_ID = "same-currency";
  static final String INVERSE_ID_PREFIX = "inverse-";

  public static RateResolutionResponse from(RateResolution resolution) {
    return new RateResolutionResponse(
        virtualId(resolution),
        resolution.kind(),
        CurrencyResponse.from(resolution.fromCurrency()),
        CurrencyResponse.from(resolution.toCurrency()),
        resolution.rate(),
        resolution.inverseRate(),
        resolution.effectiveDate(),
        resolution.expiresAt(),
        resolution.source());
  }

  private static String virtualId(RateResolution resolution) {
    switch (resolution.kind()) {
      case IDENTITY:
        return SAME_CURRENCY_ID;
      case INVERSE:
        return INVERSE_ID_PREFIX + resolution.exchangeRateId();
      default:
        return String.valueOf(resolution.exchangeRateId());
    }
  }
}
