package org.erpsuite.currency.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.util.Locale;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.cache.CacheManager;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoSpyBean;

import org.erpsuite.currency.base.AbstractIntegrationTest;
import org.erpsuite.currency.config.CacheConfig;
import org.erpsuite.currency.domain.Currency;
import org.erpsuite.currency.fixture.CurrencyTestBuilder;
import org.erpsuite.currency.fixture.TestConstants;
import org.erpsuite.currency.repository.CurrencyRepository;
import org.erpsuite.currency.service.CurrencyService;
import org.erpsuite.currency.service.dto.CurrencyUpdate;

/**
 * Redis caching of currency lookups by code.
 *
 * <ul>
 *   <li>Key format: {@code {tenantId}:{CODE}}
 *   <li>Every registry mutation evicts the whole cache
 * </ul>
 *
 * @see CacheConfig
 * @see CurrencyService#findByCode
 */
@TestPropertySource(properties = "spring.cache.type=redis")
class CachingIntegrationTest extends AbstractIntegrationTest {

  private static final String TENANT = TestConstants.TENANT_ACME;

  @Autowired private CurrencyService currencyService;

  @Autowired private CacheManager cacheManager;

  @MockitoSpyBean private CurrencyRepository currencyRepository;

  private Currency usd;

  @BeforeEach
  void setUp() {
    clearCache();
    usd = currencyService.register(TENANT, CurrencyTestBuilder.defaultUsd().buildNew());
    clearInvocations(currencyRepository);
  }

  @Test
  void shouldUseRedisCacheManager() {
    assertThat(cacheManager).isInstanceOf(RedisCacheManager.class);
  }

  @Test
  void shouldCacheLookupPerTenantAndCode() {
    currencyService.findByCode(TENANT, "USD");
    var cached = currencyService.findByCode(TENANT, "usd");

    assertThat(cached.getId()).isEqualTo(usd.getId());
    assertThat(cached.getCreatedAt()).isNotNull();
    verify(currencyRepository, times(1))
        .findByTenantIdAndCodeIgnoreCaseAndActiveTrueAndDeletedAtIsNull(TENANT, "USD");
    assertThat(cacheManager.getCache(CacheConfig.CURRENCY_BY_CODE_CACHE).get(TENANT + ":USD"))
        .isNotNull();
  }

  @Test
  void shouldBuildKeyIndependentOfDefaultLocale() {
    currencyService.register(
        TENANT,
        new CurrencyTestBuilder()
            .withCode("IDR")
            .withName("Indonesian Rupiah")
            .withSymbol("Rp")
            .withDecimalPlaces(0)
            .withSortOrder(null)
            .buildNew());
    clearInvocations(currencyRepository);

    var defaultLocale = Locale.getDefault();
    // Dotted capital I under Turkish casing rules
    Locale.setDefault(Locale.forLanguageTag("tr-TR"));
    try {
      currencyService.findByCode(TENANT, "idr");
      currencyService.findByCode(TENANT, "IDR");
    } finally {
      Locale.setDefault(defaultLocale);
    }

    verify(currencyRepository, times(1))
        .findByTenantIdAndCodeIgnoreCaseAndActiveTrueAndDeletedAtIsNull(TENANT, "idr");
    verify(currencyRepository, never())
        .findByTenantIdAndCodeIgnoreCaseAndActiveTrueAndDeletedAtIsNull(TENANT, "IDR");
    assertThat(cacheManager.getCache(CacheConfig.CURRENCY_BY_CODE_CACHE).get(TENANT + ":IDR"))
        .isNotNull();
  }

  @Test
  void shouldEvictOnUpdate() {
    currencyService.findByCode(TENANT, "USD");

    currencyService.update(
        TENANT,
        usd.getId(),
        new CurrencyUpdate(null, "Dollar", null, null, null, null, null, null, null, null));

    var reloaded = currencyService.findByCode(TENANT, "USD");

    assertThat(reloaded.getName()).isEqualTo("Dollar");
    verify(currencyRepository, times(2))
        .findByTenantIdAndCodeIgnoreCaseAndActiveTrueAndDeletedAtIsNull(TENANT, "USD");
  }

  private void clearCache() {
    var cache = cacheManager.getCache(CacheConfig.CURRENCY_BY_CODE_CACHE);
    if (cache != null) {
      cache.clear();
    }
  }
}
