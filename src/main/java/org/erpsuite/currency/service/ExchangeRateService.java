package org.erpsuite.currency.service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import org.erpsuite.currency.domain.ExchangeRate;
import org.erpsuite.currency.repository.CurrencyRepository;
import org.erpsuite.currency.repository.ExchangeRateRepository;
import org.erpsuite.currency.repository.spec.ExchangeRateSpecifications;
import org.erpsuite.currency.service.dto.ExchangeRateUpdate;
import org.erpsuite.currency.service.exception.BusinessException;
import org.erpsuite.currency.service.exception.InvalidRequestException;
import org.erpsuite.currency.service.exception.ResourceNotFoundException;

/**
 * Service for managing stored exchange rates.
 *
 * <p>Rates are kept per tenant and directed currency pair. The inverse rate is always derived from
 * the rate by the entity itself, so both values change together on create and update.
 */
@Service
public class ExchangeRateService {

  private static final Logger log = LoggerFactory.getLogger(ExchangeRateService.class);

  private final ExchangeRateRepository exchangeRateRepository;
  private final CurrencyRepository currencyRepository;
  private final Clock clock;

  /**
   * Constructs a new ExchangeRateService.
   *
   * @param exchangeRateRepository The exchange rate repository
   * @param currencyRepository The currency repository used to validate pairs
   * @param clock The clock supplying the default effective date
   */
  public ExchangeRateService(
      ExchangeRateRepository exchangeRateRepository,
      CurrencyRepository currencyRepository,
      Clock clock) {
    this.exchangeRateRepository = exchangeRateRepository;
    this.currencyRepository = currencyRepository;
    this.clock = clock;
  }

  /**
   * Create an exchange rate.
   *
   * @param tenantId The owning tenant
   * @param exchangeRate The rate to store; effective date defaults to now
   * @return The persisted rate
   * @throws BusinessException if a currency is unknown, retired or used on both sides, or if the
   *     validity window is inverted
   */
  @Transactional
  public ExchangeRate create(String tenantId, ExchangeRate exchangeRate) {
    if (exchangeRate.getRate() == null) {
      throw new InvalidRequestException(
          "Exchange rate is required", CurrencyServiceError.VALIDATION_ERROR.name());
    }

    validatePair(tenantId, exchangeRate.getFromCurrencyId(), exchangeRate.getToCurrencyId());

    if (exchangeRate.getEffectiveDate() == null) {
      exchangeRate.setEffectiveDate(clock.instant());
    }
    validateWindow(exchangeRate.getEffectiveDate(), exchangeRate.getExpiresAt());

    exchangeRate.setTenantId(tenantId);
    exchangeRate.setActive(true);

    var saved = exchangeRateRepository.save(exchangeRate);
    log.info(
        "Created exchange rate {} for tenant {}: {} -> {} = {}",
        saved.getId(),
        tenantId,
        saved.getFromCurrencyId(),
        saved.getToCurrencyId(),
        saved.getRate());

    return saved;
  }

  /**
   * Apply a partial update to an exchange rate.
   *
   * <p>A new rate recomputes the stored inverse rate in the same write.
   *
   * @param tenantId The owning tenant
   * @param id The exchange rate id
   * @param update The changes to apply
   * @return The updated rate
   * @throws ResourceNotFoundException if the rate does not exist for the tenant
   */
  @Transactional
  public ExchangeRate update(String tenantId, UUID id, ExchangeRateUpdate update) {
    var exchangeRate = getById(tenantId, id);

    if (update.rate() != null) {
      if (update.rate().signum() <= 0) {
        throw new InvalidRequestException(
            "Exchange rate must be greater than zero",
            CurrencyServiceError.VALIDATION_ERROR.name());
      }
      exchangeRate.setRate(update.rate());
    }
    if (update.effectiveDate() != null) {
      exchangeRate.setEffectiveDate(update.effectiveDate());
    }
    if (update.clearExpiresAt()) {
      exchangeRate.setExpiresAt(null);
    } else if (update.expiresAt() != null) {
      exchangeRate.setExpiresAt(update.expiresAt());
    }
    if (update.source() != null) {
      exchangeRate.setSource(update.source());
    }
    if (update.sourceReference() != null) {
      exchangeRate.setSourceReference(update.sourceReference());
    }
    if (update.active() != null) {
      exchangeRate.setActive(update.active());
    }

    validateWindow(exchangeRate.getEffectiveDate(), exchangeRate.getExpiresAt());

    return exchangeRateRepository.save(exchangeRate);
  }

  /**
   * Deactivate an exchange rate. Inactive rates are ignored by rate resolution.
   *
   * @param tenantId The owning tenant
   * @param id The exchange rate id
   * @throws ResourceNotFoundException if the rate does not exist for the tenant
   */
  @Transactional
  public void deactivate(String tenantId, UUID id) {
    var exchangeRate = getById(tenantId, id);
    exchangeRate.setActive(false);
    exchangeRateRepository.save(exchangeRate);

    log.info("Deactivated exchange rate {} for tenant {}", id, tenantId);
  }

  @Transactional(readOnly = true)
  public ExchangeRate getById(String tenantId, UUID id) {
    return exchangeRateRepository
        .findByIdAndTenantId(id, tenantId)
        .orElseThrow(
            () -> new ResourceNotFoundException("Exchange rate not found with id: " + id));
  }

  @Transactional(readOnly = true)
  public Page<ExchangeRate> search(String tenantId, boolean activeOnly, Pageable pageable) {
    var spec = ExchangeRateSpecifications.belongsToTenant(tenantId);

    if (activeOnly) {
      spec = spec.and(ExchangeRateSpecifications.isActive());
    }

    return exchangeRateRepository.findAll(spec, pageable);
  }

  private void validatePair(String tenantId, UUID fromCurrencyId, UUID toCurrencyId) {
    if (fromCurrencyId == null || toCurrencyId == null) {
      throw new BusinessException(
          "Both currencies of an exchange rate are required",
          CurrencyServiceError.INVALID_CURRENCY_PAIR.name());
    }

    if (fromCurrencyId.equals(toCurrencyId)) {
      throw new BusinessException(
          "Exchange rate currencies must differ",
          CurrencyServiceError.INVALID_CURRENCY_PAIR.name());
    }

    for (var currencyId : List.of(fromCurrencyId, toCurrencyId)) {
      var currency = currencyRepository.findByIdAndTenantIdAndDeletedAtIsNull(currencyId, tenantId);
      if (currency.isEmpty()) {
        throw new BusinessException(
            "Currency " + currencyId + " does not exist",
            CurrencyServiceError.INVALID_CURRENCY_PAIR.name());
      }
    }
  }

  private static void validateWindow(Instant effectiveDate, Instant expiresAt) {
    if (expiresAt != null && expiresAt.isBefore(effectiveDate)) {
      throw new BusinessException(
          "Expiry " + expiresAt + " precedes effective date " + effectiveDate,
          CurrencyServiceError.INVALID_VALIDITY_WINDOW.name());
    }
  }
}
