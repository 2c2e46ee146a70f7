package io.ledger.core.couchdb;

/** Result of an explicit durability flush. */
public record FullCommitResponse(boolean ok, String instanceStartTime) {
}
