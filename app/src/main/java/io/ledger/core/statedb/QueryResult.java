package io.ledger.core.statedb;

/** One record produced by a {@link ResultsIterator}. */
public interface QueryResult {
}
