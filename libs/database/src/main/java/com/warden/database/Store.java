package com.warden.database;

/**
 * Entry point to persistence. Single statements go through {@link #querier()}; multi-row writes
 * run inside a transaction:
 *
 * <pre>{@code
 * try (Transaction tx = store.beginTransaction()) {
 *     Querier q = store.querierWithTransaction(tx);
 *     ...
 *     store.commit(tx);
 * }
 * }</pre>
 */
public interface Store {

    /** Querier running each statement in its own auto-committed transaction. */
    Querier querier();

    Transaction beginTransaction();

    /** Querier bound to {@code tx}; valid until the transaction ends. */
    Querier querierWithTransaction(Transaction tx);

    void commit(Transaction tx);

    void rollback(Transaction tx);

    /** Whether {@code error}, or one of its causes, is a unique-constraint violation. */
    boolean isUniqueViolation(Throwable error);

    /** Runs a trivial query; false when the database cannot be reached. */
    boolean ping();
}
