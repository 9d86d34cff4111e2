package com.warden.database;

/**
 * Handle of an open store transaction. Closing a transaction that was not committed rolls it
 * back, so callers use try-with-resources and commit as the last statement of the block.
 */
public interface Transaction extends AutoCloseable {

    boolean isActive();

    @Override
    void close();
}
