package com.warden.database.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.database.Querier;
import com.warden.database.Store;
import com.warden.database.StoreException;
import com.warden.database.Transaction;
import com.warden.database.UniqueViolationException;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

/**
 * {@link Store} backed by a JDBC {@link DataSource}.
 *
 * <p>A transaction pins one connection with auto-commit disabled. Its querier runs every statement
 * on that connection through a {@link SingleConnectionDataSource} that never closes it; the
 * connection goes back to the pool on commit, rollback or close.
 */
public final class JdbcStore implements Store {

    private static final Logger log = LoggerFactory.getLogger(JdbcStore.class);

    /** SQLSTATE for unique_violation, shared by PostgreSQL and H2. */
    private static final String UNIQUE_VIOLATION = "23505";

    private final DataSource dataSource;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final JdbcTemplate jdbc;
    private final Querier querier;

    public JdbcStore(DataSource dataSource, ObjectMapper mapper, Clock clock) {
        this.dataSource = dataSource;
        this.mapper = mapper;
        this.clock = clock;
        this.jdbc = new JdbcTemplate(dataSource);
        this.querier = new JdbcQuerier(jdbc, mapper, clock);
    }

    @Override
    public Querier querier() {
        return querier;
    }

    @Override
    public Transaction beginTransaction() {
        try {
            Connection connection = dataSource.getConnection();
            try {
                connection.setAutoCommit(false);
            } catch (SQLException e) {
                connection.close();
                throw e;
            }
            return new JdbcTransaction(connection);
        } catch (SQLException e) {
            throw new StoreException("cannot begin transaction", e);
        }
    }

    @Override
    public Querier querierWithTransaction(Transaction tx) {
        JdbcTransaction jdbcTx = unwrap(tx);
        if (!jdbcTx.isActive()) {
            throw new IllegalStateException("transaction already finished");
        }
        JdbcTemplate template = new JdbcTemplate(new SingleConnectionDataSource(jdbcTx.connection, true));
        return new JdbcQuerier(template, mapper, clock);
    }

    @Override
    public void commit(Transaction tx) {
        unwrap(tx).commit();
    }

    @Override
    public void rollback(Transaction tx) {
        unwrap(tx).rollback();
    }

    @Override
    public boolean isUniqueViolation(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof UniqueViolationException || t instanceof DuplicateKeyException) {
                return true;
            }
            if (t instanceof SQLException sql && UNIQUE_VIOLATION.equals(sql.getSQLState())) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    @Override
    public boolean ping() {
        try {
            Integer one = jdbc.queryForObject("SELECT 1", Integer.class);
            return one != null && one == 1;
        } catch (DataAccessException e) {
            log.warn("Database ping failed", e);
            return false;
        }
    }

    private static JdbcTransaction unwrap(Transaction tx) {
        if (tx instanceof JdbcTransaction jdbcTx) {
            return jdbcTx;
        }
        throw new IllegalArgumentException("transaction was not started by this store");
    }

    /** Connection-bound transaction. Not thread-safe; a transaction belongs to one call. */
    static final class JdbcTransaction implements Transaction {

        private final Connection connection;
        private boolean active = true;

        JdbcTransaction(Connection connection) {
            this.connection = connection;
        }

        @Override
        public boolean isActive() {
            return active;
        }

        void commit() {
            finish(true);
        }

        void rollback() {
            finish(false);
        }

        @Override
        public void close() {
            if (active) {
                log.debug("Rolling back unfinished transaction");
                finish(false);
            }
        }

        private void finish(boolean commit) {
            if (!active) {
                throw new IllegalStateException("transaction already finished");
            }
            active = false;
            try {
                if (commit) {
                    connection.commit();
                } else {
                    connection.rollback();
                }
            } catch (SQLException e) {
                throw new StoreException(commit ? "commit failed" : "rollback failed", e);
            } finally {
                release();
            }
        }

        private void release() {
            try {
                connection.setAutoCommit(true);
                connection.close();
            } catch (SQLException e) {
                log.warn("Failed to release transaction connection", e);
            }
        }
    }
}
