package org.erpsuite.currency.repository;

import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

/**
 * Base class for repository unit tests on an in-memory H2 database.
 *
 * <p>The schema is generated from the entities; PostgreSQL-only constraints such as the partial
 * unique indexes are covered by {@code FlywayMigrationIntegrationTest}.
 */
@DataJpaTest
abstract class AbstractRepositoryUnitTest {}
