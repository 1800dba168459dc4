package org.erpsuite.currency.repository.spec;

import java.util.Locale;

import org.springframework.data.jpa.domain.Specification;

import org.erpsuite.currency.domain.Currency;

public class CurrencySpecifications {

  public static Specification<Currency> belongsToTenant(String tenantId) {
    return (root, query, cb) -> cb.equal(root.get("tenantId"), tenantId);
  }

  public static Specification<Currency> notRetired() {
    return (root, query, cb) -> cb.isNull(root.get("deletedAt"));
  }

  public static Specification<Currency> isActive() {
    return (root, query, cb) -> cb.isTrue(root.get("active"));
  }

  /** Case-insensitive substring match on name, code or symbol. */
  public static Specification<Currency> matchesSearch(String search) {
    var pattern = "%" + search.toLowerCase(Locale.ROOT) + "%";

    return (root, query, cb) ->
        cb.or(
            cb.like(cb.lower(root.get("name")), pattern),
            cb.like(cb.lower(root.get("code")), pattern),
            cb.like(cb.lower(root.get("symbol")), pattern));
  }
}
