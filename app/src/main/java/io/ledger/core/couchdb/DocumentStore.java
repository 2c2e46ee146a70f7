package io.ledger.core.couchdb;

/**
 * A CouchDB-compatible document store: the remote CouchDB server or one of the embedded
 * stand-ins. Databases handed out are safe for concurrent use.
 */
public interface DocumentStore extends AutoCloseable {

    /** Open the named database, creating it physically if it does not exist yet. */
    DocumentDatabase createDatabaseIfNotExists(String dbName);

    @Override
    void close();
}
