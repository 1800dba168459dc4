package org.erpsuite.currency.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;

/**
 * Exchange rate from one tenant currency to another, valid within a time window.
 *
 * <p>The record stores both directions: {@code rate} converts an amount of {@code fromCurrency}
 * into {@code toCurrency}, {@code inverseRate} converts back. The inverse is never written on its
 * own; {@link #setRate(BigDecimal)} recomputes it with {@link ExchangeRateMath#inverseOf}.
 *
 * <p>A record applies at instant D when it is active, {@code effectiveDate <= D} and {@code
 * expiresAt} is either null or {@code >= D}.
 */
@Entity
@Table(name = "exchange_rate")
public class ExchangeRate extends AuditableEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false, length = 64)
  @NotNull
  private String tenantId;

  @Column(nullable = false)
  @NotNull
  private UUID fromCurrencyId;

  @Column(nullable = false)
  @NotNull
  private UUID toCurrencyId;

  @Column(nullable = false, precision = 24, scale = 10)
  @NotNull
  private BigDecimal rate;

  @Column(nullable = false, precision = 24, scale = ExchangeRateMath.INVERSE_RATE_SCALE)
  @NotNull
  private BigDecimal inverseRate;

  @Column(nullable = false)
  @NotNull
  private Instant effectiveDate;

  /** Inclusive end of validity; null means open-ended. */
  private Instant expiresAt;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 30)
  private RateSource source = RateSource.MANUAL;

  @Column(length = 255)
  private String sourceReference;

  @Column(name = "is_active", nullable = false)
  private boolean active = true;

  public UUID getId() {
    return id;
  }

  public void setId(UUID id) {
    this.id = id;
  }

  public String getTenantId() {
    return tenantId;
  }

  public void setTenantId(String tenantId) {
    this.tenantId = tenantId;
  }

  public UUID getFromCurrencyId() {
    return fromCurrencyId;
  }

  public void setFromCurrencyId(UUID fromCurrencyId) {
    this.fromCurrencyId = fromCurrencyId;
  }

  public UUID getToCurrencyId() {
    return toCurrencyId;
  }

  public void setToCurrencyId(UUID toCurrencyId) {
    this.toCurrencyId = toCurrencyId;
  }

  public BigDecimal getRate() {
    return rate;
  }

  /**
   * Sets the rate and recomputes the inverse rate.
   *
   * @param rate strictly positive rate
   * @throws IllegalArgumentException if the rate is not positive
   */
  public void setRate(BigDecimal rate) {
    this.inverseRate = ExchangeRateMath.inverseOf(rate);
    this.rate = rate;
  }

  public BigDecimal getInverseRate() {
    return inverseRate;
  }

  public Instant getEffectiveDate() {
    return effectiveDate;
  }

  public void setEffectiveDate(Instant effectiveDate) {
    this.effectiveDate = effectiveDate;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }

  public void setExpiresAt(Instant expiresAt) {
    this.expiresAt = expiresAt;
  }

  public RateSource getSource() {
    return source;
  }

  public void setSource(RateSource source) {
    this.source = source;
  }

  public String getSourceReference() {
    return sourceReference;
  }

  public void setSourceReference(String sourceReference) {
    this.sourceReference = sourceReference;
  }

  public boolean isActive() {
    return active;
  }

  public void setActive(boolean active) {
    this.active = active;
  }
}
