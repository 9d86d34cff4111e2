/**
 * Persistence for the control plane.
 *
 * <p>{@link com.warden.database.Store} and {@link com.warden.database.Querier} form the contract
 * the services program against; {@link com.warden.database.jdbc.JdbcStore} implements it over
 * Spring's {@code JdbcTemplate}. The schema lives in Flyway migrations under {@code
 * db/migration} and sticks to SQL that both PostgreSQL and H2 accept.
 */
package com.warden.database;
