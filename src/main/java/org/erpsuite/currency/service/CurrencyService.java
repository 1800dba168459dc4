package org.erpsuite.currency.service;

import java.time.Clock;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import org.erpsuite.currency.config.CacheConfig;
import org.erpsuite.currency.domain.Currency;
import org.erpsuite.currency.repository.CurrencyRepository;
import org.erpsuite.currency.repository.spec.CurrencySpecifications;
import org.erpsuite.currency.service.dto.CurrencyUpdate;
import org.erpsuite.currency.service.exception.BusinessException;
import org.erpsuite.currency.service.exception.CurrencyNotFoundException;
import org.erpsuite.currency.service.exception.ResourceNotFoundException;

/**
 * Tenant currency registry.
 *
 * <p>Owns the lifecycle of currencies: registration, partial updates, retirement (soft delete) and
 * lookups. Maintains two per-tenant invariants:
 *
 * <ul>
 *   <li>currency codes are unique among non-retired currencies, compared case-insensitively
 *   <li>at most one active, non-retired currency is flagged as the base currency
 * </ul>
 *
 * <p>Every mutation first takes a per-tenant advisory lock, so two requests that both try to change
 * the base currency of the same tenant are applied one after the other, even for a tenant with no
 * currencies yet. Moving the base flag is done with a single bulk update that clears it on every
 * other currency before the new base currency is written, all in one transaction. A partial unique
 * index on the table backs both invariants; violations reported by the database on flush are
 * translated to the matching business error.
 */
@Service
public class CurrencyService {

  private static final Logger log = LoggerFactory.getLogger(CurrencyService.class);

  /** Name of the partial unique index enforcing a single base currency per tenant. */
  static final String BASE_CURRENCY_INDEX = "uq_currency_tenant_base";

  private final CurrencyRepository currencyRepository;
  private final Clock clock;

  /**
   * Constructor for CurrencyService.
   *
   * @param currencyRepository The currency repository
   * @param clock The clock used for retirement timestamps
   */
  public CurrencyService(CurrencyRepository currencyRepository, Clock clock) {
    this.currencyRepository = currencyRepository;
    this.clock = clock;
  }

  /**
   * Register a new currency for a tenant.
   *
   * <p>The code is stored upper case. When the new currency is flagged as base currency, the flag
   * is first cleared on all other currencies of the tenant. A currency registered without a sort
   * order is appended after the tenant's existing currencies.
   *
   * @param tenantId The owning tenant
   * @param currency The currency to register
   * @return The persisted currency
   * @throws BusinessException if the code is already used by a non-retired currency of the tenant
   */
  @Transactional
  @CacheEvict(cacheNames = CacheConfig.CURRENCY_BY_CODE_CACHE, allEntries = true)
  public Currency register(String tenantId, Currency currency) {
    var code = normalizeCode(currency.getCode());
    currency.setTenantId(tenantId);
    currency.setCode(code);

    currencyRepository.lockTenant(tenantId);

    if (currencyRepository.existsByTenantIdAndCodeIgnoreCaseAndDeletedAtIsNull(tenantId, code)) {
      throw duplicateCode(code);
    }

    if (currency.isBaseCurrency()) {
      var cleared = currencyRepository.clearBaseCurrency(tenantId);
      log.info("Registering {} as base currency, cleared flag on {} currencies", code, cleared);
    }

    if (currency.getSortOrder() == null) {
      currency.setSortOrder(currencyRepository.findMaxSortOrder(tenantId) + 1);
    }

    currency.setActive(true);
    currency.setDeletedAt(null);

    return saveAndFlush(currency);
  }

  /**
   * Apply a partial update to a currency.
   *
   * @param tenantId The owning tenant
   * @param id The currency id
   * @param update The changes to apply; null components are left unchanged
   * @return The updated currency
   * @throws ResourceNotFoundException if the currency does not exist or is retired
   * @throws BusinessException if the new code is taken, or the update would leave the base
   *     currency inactive
   */
  @Transactional
  @CacheEvict(cacheNames = CacheConfig.CURRENCY_BY_CODE_CACHE, allEntries = true)
  public Currency update(String tenantId, UUID id, CurrencyUpdate update) {
    currencyRepository.lockTenant(tenantId);
    var currency = getById(tenantId, id);

    if (update.code() != null) {
      var code = normalizeCode(update.code());
      if (!code.equals(currency.getCode())
          && currencyRepository.existsByTenantIdAndCodeIgnoreCaseAndDeletedAtIsNullAndIdNot(
              tenantId, code, id)) {
        throw duplicateCode(code);
      }
    }

    var endsAsBase =
        update.baseCurrency() != null ? update.baseCurrency() : currency.isBaseCurrency();
    var endsActive = update.active() != null ? update.active() : currency.isActive();
    if (endsAsBase && !endsActive) {
      log.warn(
          "Rejected deactivation of base currency {} for tenant {}", currency.getCode(), tenantId);
      throw new BusinessException(
          "Base currency '" + currency.getCode() + "' cannot be deactivated",
          CurrencyServiceError.CANNOT_RETIRE_BASE_CURRENCY.name());
    }

    if (Boolean.TRUE.equals(update.baseCurrency()) && !currency.isBaseCurrency()) {
      // Bulk update clears the persistence context, continue with a fresh copy
      currencyRepository.clearBaseCurrencyExcept(tenantId, id);
      currency = getById(tenantId, id);
    }

    applyUpdate(currency, update);

    return saveAndFlush(currency);
  }

  /**
   * Retire (soft delete) a currency.
   *
   * <p>The row is kept so that exchange rates referencing it stay valid; it is marked inactive and
   * stamped with a deletion time, which frees its code for reuse.
   *
   * @param tenantId The owning tenant
   * @param id The currency id
   * @throws ResourceNotFoundException if the currency does not exist or is already retired
   * @throws BusinessException if the currency is the tenant's base currency
   */
  @Transactional
  @CacheEvict(cacheNames = CacheConfig.CURRENCY_BY_CODE_CACHE, allEntries = true)
  public void retire(String tenantId, UUID id) {
    currencyRepository.lockTenant(tenantId);
    var currency = getById(tenantId, id);

    if (currency.isBaseCurrency()) {
      log.warn(
          "Rejected retirement of base currency {} for tenant {}", currency.getCode(), tenantId);
      throw new BusinessException(
          "Base currency '" + currency.getCode() + "' cannot be retired",
          CurrencyServiceError.CANNOT_RETIRE_BASE_CURRENCY.name());
    }

    currency.setActive(false);
    currency.setDeletedAt(clock.instant());
    currencyRepository.save(currency);
  }

  /**
   * Get a non-retired currency by id.
   *
   * @param tenantId The owning tenant
   * @param id The currency id
   * @return The currency
   * @throws ResourceNotFoundException if the currency does not exist or is retired
   */
  @Transactional(readOnly = true)
  public Currency getById(String tenantId, UUID id) {
    return currencyRepository
        .findByIdAndTenantIdAndDeletedAtIsNull(id, tenantId)
        .orElseThrow(() -> new ResourceNotFoundException("Currency not found with id: " + id));
  }

  /**
   * Find an active currency by code, ignoring case.
   *
   * <p>Results are cached per tenant and code; the cache is cleared by every registry mutation.
   *
   * @param tenantId The owning tenant
   * @param code The currency code
   * @return The currency
   * @throws CurrencyNotFoundException if no active currency has this code
   */
  @Cacheable(
      cacheNames = CacheConfig.CURRENCY_BY_CODE_CACHE,
      key = "#tenantId + ':' + #code.toUpperCase(T(java.util.Locale).ROOT)")
  @Transactional(readOnly = true)
  public Currency findByCode(String tenantId, String code) {
    return currencyRepository
        .findByTenantIdAndCodeIgnoreCaseAndActiveTrueAndDeletedAtIsNull(tenantId, code)
        .orElseThrow(() -> new CurrencyNotFoundException(normalizeCode(code)));
  }

  /**
   * Get the tenant's base currency.
   *
   * @param tenantId The owning tenant
   * @return The base currency, or empty if none is configured
   */
  @Transactional(readOnly = true)
  public Optional<Currency> getBaseCurrency(String tenantId) {
    return currencyRepository.findByTenantIdAndBaseCurrencyTrueAndActiveTrueAndDeletedAtIsNull(
        tenantId);
  }

  /**
   * Search the tenant's non-retired currencies.
   *
   * @param tenantId The owning tenant
   * @param search Optional case-insensitive term matched against name, code and symbol
   * @param activeOnly If true, return only active currencies
   * @param pageable Page and sort
   * @return Page of currencies
   */
  @Transactional(readOnly = true)
  public Page<Currency> search(
      String tenantId, String search, boolean activeOnly, Pageable pageable) {
    var spec =
        CurrencySpecifications.belongsToTenant(tenantId).and(CurrencySpecifications.notRetired());

    if (activeOnly) {
      spec = spec.and(CurrencySpecifications.isActive());
    }

    if (search != null && !search.isBlank()) {
      spec = spec.and(CurrencySpecifications.matchesSearch(search.trim()));
    }

    return currencyRepository.findAll(spec, pageable);
  }

  private void applyUpdate(Currency currency, CurrencyUpdate update) {
    if (update.code() != null) {
      currency.setCode(normalizeCode(update.code()));
    }
    if (update.name() != null) {
      currency.setName(update.name());
    }
    if (update.symbol() != null) {
      currency.setSymbol(update.symbol());
    }
    if (update.decimalPlaces() != null) {
      currency.setDecimalPlaces(update.decimalPlaces());
    }
    if (update.symbolPosition() != null) {
      currency.setSymbolPosition(update.symbolPosition());
    }
    if (update.thousandsSeparator() != null) {
      currency.setThousandsSeparator(update.thousandsSeparator());
    }
    if (update.decimalSeparator() != null) {
      currency.setDecimalSeparator(update.decimalSeparator());
    }
    if (update.baseCurrency() != null) {
      currency.setBaseCurrency(update.baseCurrency());
    }
    if (update.sortOrder() != null) {
      currency.setSortOrder(update.sortOrder());
    }
    if (update.active() != null) {
      currency.setActive(update.active());
    }
  }

  private Currency saveAndFlush(Currency currency) {
    try {
      return currencyRepository.saveAndFlush(currency);
    } catch (DataIntegrityViolationException e) {
      var detail = String.valueOf(e.getMostSpecificCause().getMessage()).toLowerCase(Locale.ROOT);
      if (detail.contains(BASE_CURRENCY_INDEX)) {
        throw new BusinessException(
            "Base currency of tenant '" + currency.getTenantId() + "' was changed concurrently",
            CurrencyServiceError.BASE_CURRENCY_CONFLICT.name(),
            e);
      }

      throw new BusinessException(
          "Currency code '" + currency.getCode() + "' already exists",
          CurrencyServiceError.DUPLICATE_CURRENCY_CODE.name(),
          e);
    }
  }

  private static BusinessException duplicateCode(String code) {
    return new BusinessException(
        "Currency code '" + code + "' already exists",
        CurrencyServiceError.DUPLICATE_CURRENCY_CODE.name());
  }

  private static String normalizeCode(String code) {
    return code == null ? null : code.trim().toUpperCase(Locale.ROOT);
  }
}
