package io.ledger.core.statedb.couch;

import io.ledger.core.config.StateDbConfig;
import io.ledger.core.couchdb.CouchInstance;
import io.ledger.core.couchdb.DocumentStore;
import io.ledger.core.couchdb.InMemoryDocumentStore;
import io.ledger.core.couchdb.RocksDocumentStore;
import io.ledger.core.statedb.VersionedDB;
import io.ledger.core.statedb.VersionedDBProvider;

import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Logger;

/**
 * Registry of {@link CouchVersionedDB} handles, one per lower-cased database name, created
 * on first use. The store's naming rules are case-sensitive and stricter than ledger ids,
 * so names are only case-folded; other characters are passed through and the store may reject them.
 */
public final class CouchVersionedDBProvider implements VersionedDBProvider {
    private static final Logger LOG = Logger.getLogger(CouchVersionedDBProvider.class.getName());

    private final DocumentStore store;
    private final boolean ownsStore;
    private final int queryLimit;
    private final ConcurrentMap<String, CouchVersionedDB> databases = new ConcurrentHashMap<>();

    /** Provider over a store the caller keeps ownership of. */
    public CouchVersionedDBProvider(DocumentStore store, int queryLimit) {
        this(store, queryLimit, false);
    }

    private CouchVersionedDBProvider(DocumentStore store, int queryLimit, boolean ownsStore) {
        this.store = Objects.requireNonNull(store, "store");
        if (queryLimit <= 0) {
            throw new IllegalArgumentException("queryLimit must be positive: " + queryLimit);
        }
        this.queryLimit = queryLimit;
        this.ownsStore = ownsStore;
    }

    /** Build the configured backing store and a provider that owns it. */
    public static CouchVersionedDBProvider create(StateDbConfig config) {
        LOG.fine(() -> "Constructing VersionedDBProvider: " + config);
        DocumentStore store;
        switch (config.backend()) {
            case COUCHDB:
                store = CouchInstance.create(config.couchDbUrl(), config.username(), config.password(), config.requestTimeout());
                break;
            case ROCKSDB:
                store = RocksDocumentStore.open(config.rocksDataDir());
                break;
            case MEMORY:
                store = new InMemoryDocumentStore();
                break;
            default:
                throw new IllegalArgumentException("Unknown backend: " + config.backend());
        }
        return new CouchVersionedDBProvider(store, config.queryLimit(), true);
    }

    /**
     * Handle for {@code dbName}, case-folded. The backing database is created on the first call
     * for a name; concurrent first calls for the same name create it once and share the handle.
     * A failed creation is not cached.
     */
    @Override
    public VersionedDB getDBHandle(String dbName) {
        Objects.requireNonNull(dbName, "dbName");
        String normalized = dbName.toLowerCase(Locale.ROOT);
        return databases.computeIfAbsent(normalized, name -> {
            LOG.info(() -> "Opening state database " + name);
            return new CouchVersionedDB(store.createDatabaseIfNotExists(name), name, queryLimit);
        });
    }

    /** Handles share the store connection and need no teardown; an owned embedded store is closed. */
    @Override
    public void close() {
        if (ownsStore) {
            store.close();
        }
    }
}
