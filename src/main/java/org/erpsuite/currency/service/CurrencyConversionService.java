package org.erpsuite.currency.service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.micrometer.core.instrument.MeterRegistry;

import org.erpsuite.currency.config.CurrencyServiceProperties;
import org.erpsuite.currency.domain.ExchangeRateMath;
import org.erpsuite.currency.service.dto.ConversionQuery;
import org.erpsuite.currency.service.dto.ConversionResult;
import org.erpsuite.currency.service.dto.ResolutionKind;
import org.erpsuite.currency.service.exception.InvalidRequestException;
import org.erpsuite.currency.service.exception.ServiceException;

/**
 * Converts amounts between tenant currencies.
 *
 * <p>A converted amount is rounded half-up to the target currency's decimal places. Converting a
 * currency to itself returns the original amount untouched.
 *
 * <p>Bulk conversion processes each item independently. Items that fail (invalid input, unknown
 * currency, no applicable rate) are left out of the response; the failure is logged at debug level
 * and counted in the {@value #SKIPPED_METRIC} metric, tagged with the error code.
 *
 * <p>Conversions run outside a transaction; each lookup opens its own read-only one.
 */
@Service
public class CurrencyConversionService {

  private static final Logger log = LoggerFactory.getLogger(CurrencyConversionService.class);

  /** Counter of bulk conversion items left out of the response. */
  public static final String SKIPPED_METRIC = "currency.bulk_conversion.skipped";

  private static final Pattern CURRENCY_CODE = Pattern.compile("^[A-Za-z]{3}$");

  private final RateResolutionService rateResolutionService;
  private final MoneyFormatter moneyFormatter;
  private final CurrencyServiceProperties properties;
  private final MeterRegistry meterRegistry;

  public CurrencyConversionService(
      RateResolutionService rateResolutionService,
      MoneyFormatter moneyFormatter,
      CurrencyServiceProperties properties,
      MeterRegistry meterRegistry) {
    this.rateResolutionService = rateResolutionService;
    this.moneyFormatter = moneyFormatter;
    this.properties = properties;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Convert a single amount.
   *
   * @param tenantId The owning tenant
   * @param query The conversion request
   * @return The conversion result
   * @throws InvalidRequestException if the amount, a code or the date is malformed
   * @throws org.erpsuite.currency.service.exception.CurrencyNotFoundException if either currency
   *     is unknown
   * @throws org.erpsuite.currency.service.exception.RateNotFoundException if no rate applies
   */
  public ConversionResult convert(String tenantId, ConversionQuery query) {
    validate(query);

    var fromCode = query.fromCurrency().toUpperCase(Locale.ROOT);
    var toCode = query.toCurrency().toUpperCase(Locale.ROOT);
    var asOf = AsOfDates.parse(query.date());

    var resolution = rateResolutionService.resolveRate(tenantId, fromCode, toCode, asOf);
    var toCurrency = resolution.toCurrency();

    var converted =
        resolution.kind() == ResolutionKind.IDENTITY
            ? query.amount()
            : ExchangeRateMath.convert(
                query.amount(), resolution.rate(), toCurrency.getDecimalPlaces());

    return new ConversionResult(
        query.amount(),
        converted,
        resolution.fromCurrency().getCode(),
        toCurrency.getCode(),
        resolution.rate(),
        resolution.inverseRate(),
        resolution.effectiveDate(),
        resolution.source(),
        resolution.kind(),
        moneyFormatter.format(converted, toCurrency));
  }

  /**
   * Convert several amounts, skipping the ones that fail.
   *
   * @param tenantId The owning tenant
   * @param queries The conversion requests, at most the configured bulk limit
   * @return Results of the successful items, in request order
   * @throws InvalidRequestException if the list is empty or exceeds the bulk limit; no item is
   *     processed in that case
   */
  public List<ConversionResult> bulkConvert(String tenantId, List<ConversionQuery> queries) {
    if (queries == null || queries.isEmpty()) {
      throw new InvalidRequestException(
          "At least one conversion is required", CurrencyServiceError.VALIDATION_ERROR.name());
    }

    var maxItems = properties.getConversion().getBulkMaxItems();
    if (queries.size() > maxItems) {
      throw new InvalidRequestException(
          "Maximum " + maxItems + " conversions per request",
          CurrencyServiceError.TOO_MANY_ITEMS.name());
    }

    var results = new ArrayList<ConversionResult>(queries.size());
    for (var i = 0; i < queries.size(); i++) {
      try {
        results.add(convert(tenantId, queries.get(i)));
      } catch (ServiceException e) {
        var reason = e.getCode() != null ? e.getCode() : e.getClass().getSimpleName();
        log.debug("Skipping bulk conversion item {} ({}): {}", i, reason, e.getMessage());
        meterRegistry.counter(SKIPPED_METRIC, "reason", reason).increment();
      }
    }

    log.info(
        "Bulk conversion for tenant {}: {} of {} items converted",
        tenantId,
        results.size(),
        queries.size());

    return results;
  }

  private static void validate(ConversionQuery query) {
    if (query == null) {
      throw invalid("Conversion request is required");
    }
    if (query.amount() == null) {
      throw invalid("Amount is required");
    }
    if (query.amount().compareTo(BigDecimal.ZERO) < 0) {
      throw invalid("Amount must not be negative");
    }
    if (!isCurrencyCode(query.fromCurrency())) {
      throw invalid("Invalid source currency code: " + query.fromCurrency());
    }
    if (!isCurrencyCode(query.toCurrency())) {
      throw invalid("Invalid target currency code: " + query.toCurrency());
    }
  }

  private static boolean isCurrencyCode(String code) {
    return code != null && CURRENCY_CODE.matcher(code).matches();
  }

  private static InvalidRequestException invalid(String message) {
    return new InvalidRequestException(message, CurrencyServiceError.VALIDATION_ERROR.name());
  }
}
