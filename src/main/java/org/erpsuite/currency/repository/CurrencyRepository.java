package org.erpsuite.currency.repository;

import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import org.erpsuite.currency.domain.Currency;

public interface CurrencyRepository
    extends JpaRepository<Currency, UUID>, JpaSpecificationExecutor<Currency> {

  Optional<Currency> findByIdAndTenantIdAndDeletedAtIsNull(UUID id, String tenantId);

  Optional<Currency> findByTenantIdAndCodeIgnoreCaseAndActiveTrueAndDeletedAtIsNull(
      String tenantId, String code);

  Optional<Currency> findByTenantIdAndBaseCurrencyTrueAndActiveTrueAndDeletedAtIsNull(
      String tenantId);

  boolean existsByTenantIdAndCodeIgnoreCaseAndDeletedAtIsNull(String tenantId, String code);

  boolean existsByTenantIdAndCodeIgnoreCaseAndDeletedAtIsNullAndIdNot(
      String tenantId, String code, UUID id);

  /**
   * Clears the base currency flag on every currency of a tenant in a single statement.
   *
   * @param tenantId the tenant
   * @return number of rows updated
   */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      "UPDATE Currency c SET c.baseCurrency = false "
          + "WHERE c.tenantId = :tenantId AND c.baseCurrency = true")
  int clearBaseCurrency(@Param("tenantId") String tenantId);

  /**
   * Clears the base currency flag on every currency of a tenant except one.
   *
   * @param tenantId the tenant
   * @param keepId id of the currency that keeps its flag
   * @return number of rows updated
   */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      "UPDATE Currency c SET c.baseCurrency = false "
          + "WHERE c.tenantId = :tenantId AND c.baseCurrency = true AND c.id <> :keepId")
  int clearBaseCurrencyExcept(@Param("tenantId") String tenantId, @Param("keepId") UUID keepId);

  /**
   * Takes a transaction-scoped PostgreSQL advisory lock keyed by the tenant id.
   *
   * <p>Registry mutations call this first so that concurrent writers for the same tenant run one
   * after the other. The lock does not depend on existing rows, so it also serializes the first
   * registrations of a new tenant. It is released when the transaction ends.
   *
   * @param tenantId the tenant
   * @return always 1
   */
  @Query(
      value =
          "SELECT COUNT(*) FROM (SELECT pg_advisory_xact_lock(hashtext(:tenantId))) AS tenant_lock",
      nativeQuery = true)
  long lockTenant(@Param("tenantId") String tenantId);

  @Query(
      "SELECT COALESCE(MAX(c.sortOrder), -1) FROM Currency c "
          + "WHERE c.tenantId = :tenantId AND c.deletedAt IS NULL")
  int findMaxSortOrder(@Param("tenantId") String tenantId);
}
