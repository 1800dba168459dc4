package org.erpsuite.currency.service.dto;

import java.math.BigDecimal;
import java.time.Instant;

import org.erpsuite.currency.domain.RateSource;

public record ConversionResult(
    BigDecimal originalAmount,
    BigDecimal convertedAmount,
    String fromCurrency,
    String toCurrency,
    BigDecimal rate,
    BigDecimal inverseRate,
    Instant effectiveDate,
    RateSource source,
    ResolutionKind resolution,
    String formattedAmount) {}
