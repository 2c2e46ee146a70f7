package io.ledger.core.statedb;

import java.util.Optional;

/**
 * Finite, single-pass cursor over an already fetched batch of results.
 */
public interface ResultsIterator extends AutoCloseable {

    /** Next record, or empty once the batch is exhausted. Exhaustion is never an error. */
    Optional<QueryResult> next();

    /** Drop the batch. No I/O. */
    @Override
    void close();
}
