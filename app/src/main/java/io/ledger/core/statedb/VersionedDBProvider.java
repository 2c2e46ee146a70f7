package io.ledger.core.statedb;

/** Hands out one {@link VersionedDB} per logical database name. */
public interface VersionedDBProvider extends AutoCloseable {

    VersionedDB getDBHandle(String dbName);

    @Override
    void close();
}
