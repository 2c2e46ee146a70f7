package io.ledger.core.statedb;

/** Range scan result: the key inside the scanned namespace and its value. */
public record VersionedKV(CompositeKey compositeKey, VersionedValue versionedValue) implements QueryResult {
}
