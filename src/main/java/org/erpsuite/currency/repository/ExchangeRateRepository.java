package org.erpsuite.currency.repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import org.erpsuite.currency.domain.ExchangeRate;
import org.erpsuite.currency.repository.spec.ExchangeRateSpecifications;

public interface ExchangeRateRepository
    extends JpaRepository<ExchangeRate, UUID>, JpaSpecificationExecutor<ExchangeRate> {

  /** Latest effective date first, then latest created, then highest id. */
  Sort LATEST_FIRST =
      Sort.by(
          Sort.Order.desc("effectiveDate"), Sort.Order.desc("createdAt"), Sort.Order.desc("id"));

  Optional<ExchangeRate> findByIdAndTenantId(UUID id, String tenantId);

  /**
   * Finds the record that applies to a directed currency pair at a given instant.
   *
   * <p>When several records apply, the one with the latest effective date wins; ties go to the most
   * recently created record.
   *
   * @param tenantId the tenant
   * @param fromCurrencyId source currency
   * @param toCurrencyId target currency
   * @param asOf instant the rate must be valid at
   * @return the applicable record, or empty if none applies
   */
  default Optional<ExchangeRate> findApplicable(
      String tenantId, UUID fromCurrencyId, UUID toCurrencyId, Instant asOf) {
    var spec =
        ExchangeRateSpecifications.applicableAt(tenantId, fromCurrencyId, toCurrencyId, asOf);

    return findAll(spec, PageRequest.of(0, 1, LATEST_FIRST)).stream().findFirst();
  }
}
