package org.erpsuite.currency.service;

import java.time.Clock;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import org.erpsuite.currency.domain.Currency;
import org.erpsuite.currency.repository.ExchangeRateRepository;
import org.erpsuite.currency.service.dto.RateResolution;
import org.erpsuite.currency.service.exception.CurrencyNotFoundException;
import org.erpsuite.currency.service.exception.RateNotFoundException;

/**
 * Resolves the effective exchange rate between two currencies of a tenant at a point in time.
 *
 * <p><b>Resolution order:</b>
 *
 * <ol>
 *   <li>Same currency on both sides: rate 1, no lookup.
 *   <li>An applicable record stored for the requested direction.
 *   <li>An applicable record stored for the opposite direction, with rate and inverse rate swapped.
 * </ol>
 *
 * <p>When several records apply to the same direction, the one with the latest effective date
 * wins, then the most recently created one. Both lookups use the same as-of instant.
 */
@Service
public class RateResolutionService {

  private static final Logger log = LoggerFactory.getLogger(RateResolutionService.class);

  private final ExchangeRateRepository exchangeRateRepository;
  private final CurrencyService currencyService;
  private final Clock clock;

  public RateResolutionService(
      ExchangeRateRepository exchangeRateRepository, CurrencyService currencyService, Clock clock) {
    this.exchangeRateRepository = exchangeRateRepository;
    this.currencyService = currencyService;
    this.clock = clock;
  }

  /**
   * Resolve the rate between two registered currencies.
   *
   * @param tenantId The owning tenant
   * @param from Source currency
   * @param to Target currency
   * @param asOf Instant the rate must be valid at; null means now
   * @return The resolution, tagged with the branch that produced it
   * @throws RateNotFoundException if neither direction has an applicable record
   */
  @Transactional(readOnly = true)
  public RateResolution resolveRate(String tenantId, Currency from, Currency to, Instant asOf) {
    if (from.getId().equals(to.getId())) {
      return RateResolution.identity(from, clock.instant());
    }

    var effectiveAsOf = asOf != null ? asOf : clock.instant();

    var direct =
        exchangeRateRepository.findApplicable(tenantId, from.getId(), to.getId(), effectiveAsOf);
    if (direct.isPresent()) {
      return RateResolution.direct(from, to, direct.get());
    }

    var inverse =
        exchangeRateRepository.findApplicable(tenantId, to.getId(), from.getId(), effectiveAsOf);
    if (inverse.isPresent()) {
      log.debug(
          "No direct rate {} -> {} for tenant {}, using inverse of {}",
          from.getCode(),
          to.getCode(),
          tenantId,
          inverse.get().getId());
      return RateResolution.inverse(from, to, inverse.get());
    }

    throw new RateNotFoundException(from.getCode(), to.getCode(), effectiveAsOf);
  }

  /**
   * Resolve the rate between two currencies given by code.
   *
   * @param tenantId The owning tenant
   * @param fromCode Source currency code, any case
   * @param toCode Target currency code, any case
   * @param asOf Instant the rate must be valid at; null means now
   * @return The resolution
   * @throws CurrencyNotFoundException if either code has no active currency, naming both codes
   * @throws RateNotFoundException if neither direction has an applicable record
   */
  public RateResolution resolveRate(
      String tenantId, String fromCode, String toCode, Instant asOf) {
    Currency from;
    Currency to;
    try {
      from = currencyService.findByCode(tenantId, fromCode);
      to = currencyService.findByCode(tenantId, toCode);
    } catch (CurrencyNotFoundException e) {
      throw new CurrencyNotFoundException(fromCode, toCode);
    }

    return resolveRate(tenantId, from, to, asOf);
  }
}
