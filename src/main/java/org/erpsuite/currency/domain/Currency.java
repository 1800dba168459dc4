package org.erpsuite.currency.domain;

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
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * Currency defined by a tenant.
 *
 * <p>A currency is retired by setting {@code deletedAt}; retired rows stay in the table so
 * historical exchange rates keep a valid reference, but they no longer take part in code uniqueness
 * or lookups. At most one non-retired currency per tenant carries the base currency flag.
 */
@Entity
@Table(name = "currency")
public class Currency extends AuditableEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  /** Owning tenant. */
  @Column(nullable = false, length = 64)
  @NotNull
  private String tenantId;

  /** Three letter currency code, stored upper case. */
  @Column(nullable = false, length = 3)
  @NotNull
  private String code;

  @Column(nullable = false, length = 100)
  @NotNull
  private String name;

  @Column(nullable = false, length = 10)
  @NotNull
  private String symbol;

  /** Number of fractional digits amounts in this currency are rounded to. */
  @Column(nullable = false)
  @Min(0)
  @Max(4)
  private int decimalPlaces = 2;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 10)
  private SymbolPosition symbolPosition = SymbolPosition.BEFORE;

  @Column(nullable = false, length = 5)
  private String thousandsSeparator = ",";

  @Column(nullable = false, length = 5)
  private String decimalSeparator = ".";

  @Column(name = "is_base_currency", nullable = false)
  private boolean baseCurrency;

  /** Display position within the tenant's list; assigned on registration when not given. */
  @Column(nullable = false)
  private Integer sortOrder;

  @Column(name = "is_active", nullable = false)
  private boolean active = true;

  /** Soft-delete marker; null while the currency is in use. */
  private Instant deletedAt;

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

  public String getCode() {
    return code;
  }

  public void setCode(String code) {
    this.code = code;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getSymbol() {
    return symbol;
  }

  public void setSymbol(String symbol) {
    this.symbol = symbol;
  }

  public int getDecimalPlaces() {
    return decimalPlaces;
  }

  public void setDecimalPlaces(int decimalPlaces) {
    this.decimalPlaces = decimalPlaces;
  }

  public SymbolPosition getSymbolPosition() {
    return symbolPosition;
  }

  public void setSymbolPosition(SymbolPosition symbolPosition) {
    this.symbolPosition = symbolPosition;
  }

  public String getThousandsSeparator() {
    return thousandsSeparator;
  }

  public void setThousandsSeparator(String thousandsSeparator) {
    this.thousandsSeparator = thousandsSeparator;
  }

  public String getDecimalSeparator() {
    return decimalSeparator;
  }

  public void setDecimalSeparator(String decimalSeparator) {
    this.decimalSeparator = decimalSeparator;
  }

  public boolean isBaseCurrency() {
    return baseCurrency;
  }

  public void setBaseCurrency(boolean baseCurrency) {
    this.baseCurrency = baseCurrency;
  }

  public Integer getSortOrder() {
    return sortOrder;
  }

  public void setSortOrder(Integer sortOrder) {
    this.sortOrder = sortOrder;
  }

  public boolean isActive() {
    return active;
  }

  public void setActive(boolean active) {
    this.active = active;
  }

  public Instant getDeletedAt() {
    return deletedAt;
  }

  public void setDeletedAt(Instant deletedAt) {
    this.deletedAt = deletedAt;
  }
}
