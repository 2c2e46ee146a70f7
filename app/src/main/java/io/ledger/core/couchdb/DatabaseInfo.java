package io.ledger.core.couchdb;

/**
 * Database metadata. {@code updateSeq} is opaque: it only ever moves forward.
 */
public record DatabaseInfo(String dbName, String updateSeq, long docCount) {
}
