package org.erpsuite.currency.fixture;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import org.erpsuite.currency.domain.ExchangeRate;
import org.erpsuite.currency.domain.RateSource;

/**
 * Fluent builder for {@link ExchangeRate} test data.
 *
 * <p>Defaults to an active, open-ended USD to EUR rate of 0.92 effective from January 1st 2024.
 */
public class ExchangeRateTestBuilder {

  private UUID id;
  private String tenantId = TestConstants.TENANT_ACME;
  private UUID fromCurrencyId = TestConstants.USD_ID;
  private UUID toCurrencyId = TestConstants.EUR_ID;
  private BigDecimal rate = TestConstants.RATE_USD_EUR;
  private Instant effectiveDate = TestConstants.JAN_1;
  private Instant expiresAt;
  private RateSource source = RateSource.MANUAL;
  private String sourceReference;
  private boolean active = true;

  public static ExchangeRateTestBuilder usdToEur() {
    return new ExchangeRateTestBuilder();
  }

  public static ExchangeRateTestBuilder usdToJpy() {
    return new ExchangeRateTestBuilder()
        .withToCurrencyId(TestConstants.JPY_ID)
        .withRate(TestConstants.RATE_USD_JPY);
  }

  public ExchangeRateTestBuilder withId(UUID id) {
    this.id = id;
    return this;
  }

  public ExchangeRateTestBuilder withTenantId(String tenantId) {
    this.tenantId = tenantId;
    return this;
  }

  public ExchangeRateTestBuilder withFromCurrencyId(UUID fromCurrencyId) {
    this.fromCurrencyId = fromCurrencyId;
    return this;
  }

  public ExchangeRateTestBuilder withToCurrencyId(UUID toCurrencyId) {
    this.toCurrencyId = toCurrencyId;
    return this;
  }

  public ExchangeRateTestBuilder withPair(UUID fromCurrencyId, UUID toCurrencyId) {
    this.fromCurrencyId = fromCurrencyId;
    this.toCurrencyId = toCurrencyId;
    return this;
  }

  public ExchangeRateTestBuilder withRate(BigDecimal rate) {
    this.rate = rate;
    return this;
  }

  public ExchangeRateTestBuilder withRate(String rate) {
    return withRate(new BigDecimal(rate));
  }

  public ExchangeRateTestBuilder effectiveFrom(Instant effectiveDate) {
    this.effectiveDate = effectiveDate;
    return this;
  }

  public ExchangeRateTestBuilder expiresAt(Instant expiresAt) {
    this.expiresAt = expiresAt;
    return this;
  }

  public ExchangeRateTestBuilder withSource(RateSource source) {
    this.source = source;
    return this;
  }

  public ExchangeRateTestBuilder withSourceReference(String sourceReference) {
    this.sourceReference = sourceReference;
    return this;
  }

  public ExchangeRateTestBuilder active(boolean active) {
    this.active = active;
    return this;
  }

  public ExchangeRate build() {
    var exchangeRate = new ExchangeRate();
    exchangeRate.setId(id);
    exchangeRate.setTenantId(tenantId);
    exchangeRate.setFromCurrencyId(fromCurrencyId);
    exchangeRate.setToCurrencyId(toCurrencyId);
    if (rate != null) {
      exchangeRate.setRate(rate);
    }
    exchangeRate.setEffectiveDate(effectiveDate);
    exchangeRate.setExpiresAt(expiresAt);
    exchangeRate.setSource(source);
    exchangeRate.setSourceReference(sourceReference);
    exchangeRate.setActive(active);
    return exchangeRate;
  }

  /** Builds a rate with an id and audit timestamps, as if loaded from the database. */
  public ExchangeRate buildPersisted() {
    var exchangeRate = build();
    if (exchangeRate.getId() == null) {
      exchangeRate.setId(UUID.randomUUID());
    }
    exchangeRate.setCreatedAt(TestConstants.JAN_1);
    exchangeRate.setUpdatedAt(TestConstants.JAN_1);
    return exchangeRate;
  }
}
