package io.ledger.core.statedb;

import io.ledger.core.version.Height;

import java.util.List;
import java.util.Optional;

/**
 * Handle on one logical state database.
 *
 * Notes:
 * - Values come back with {@link #PLACEHOLDER_VERSION}, not the height of their last write.
 *   Callers must not use the returned version for conflict detection.
 * - At most one {@link #applyUpdates} per database may be in flight. This is not enforced here.
 * - Reads are not isolated from a concurrent applyUpdates.
 */
public interface VersionedDB extends AutoCloseable {

    Height PLACEHOLDER_VERSION = Height.of(1, 1);

    String name();

    void open();

    @Override
    void close();

    /** Empty when the key has never been written. Store failures are thrown, never mapped to empty. */
    Optional<VersionedValue> getState(String namespace, String key);

    /** Sequential point reads in the order of {@code keys}. The first failure aborts the whole call. */
    List<Optional<VersionedValue>> getStateMultipleKeys(String namespace, List<String> keys);

    /**
     * Scan {@code [startKey, endKey)} inside {@code namespace}. An empty endKey scans to the end
     * of the namespace. Results are capped and fully materialized; there is no continuation.
     */
    ResultsIterator getStateRangeScanIterator(String namespace, String startKey, String endKey);

    /** Pass a store-native query through untouched. Same cap as range scans. */
    ResultsIterator executeQuery(String query);

    /**
     * Write every entry of the batch, then record {@code height} as the savepoint.
     * A failure leaves the commit height unknown; re-derive it from {@link #getLatestSavePoint()}.
     */
    void applyUpdates(UpdateBatch batch, Height height);

    /**
     * Highest height whose writes are known to be durable, {@link Height#ZERO} for a fresh database.
     *
     * @throws SavepointCorruptedException if the stored savepoint cannot be decoded
     */
    Height getLatestSavePoint();
}
