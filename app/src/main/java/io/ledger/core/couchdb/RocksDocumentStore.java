package io.ledger.core.couchdb;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.DBOptions;
import org.rocksdb.Options;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Embedded document store on RocksDB for single-node deployments.
 *
 * Layout (column families):
 *  - "default"  : key = "seq:" + dbName, val = update sequence (8, big-endian)
 *  - one family per database : key = document id (UTF-8), val = document in wire form (JSON)
 *
 * Writes go to the WAL without fsync; {@link DocumentDatabase#ensureFullCommit()} syncs it.
 */
public final class RocksDocumentStore implements DocumentStore {
    private static final Logger LOG = Logger.getLogger(RocksDocumentStore.class.getName());
    private static final String SEQ_PREFIX = "seq:";
    private static final String COUNT_PREFIX = "count:";

    static {
        RocksDB.loadLibrary();
    }

    private final RocksDB db;
    private final DBOptions dbOptions;
    private final ColumnFamilyHandle cfDefault;
    private final List<ColumnFamilyHandle> handles;
    private final Map<String, RocksDatabase> databases = new HashMap<>();
    private final long instanceStartTime = System.currentTimeMillis();

    private RocksDocumentStore(RocksDB db, DBOptions dbOptions, List<ColumnFamilyHandle> handles) {
        this.db = db;
        this.dbOptions = dbOptions;
        this.handles = handles;
        this.cfDefault = handles.get(0);
    }

    /** Factory: open/create a store in the given directory, reopening every known database. */
    public static RocksDocumentStore open(Path dataDir) {
        try {
            Files.createDirectories(dataDir);
            List<byte[]> existing = new ArrayList<>();
            if (Files.exists(dataDir.resolve("CURRENT"))) {
                try (Options opts = new Options()) {
                    existing = RocksDB.listColumnFamilies(opts, dataDir.toString());
                }
            }
            List<ColumnFamilyDescriptor> descriptors = new ArrayList<>();
            descriptors.add(new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY));
            for (byte[] name : existing) {
                if (!Arrays.equals(name, RocksDB.DEFAULT_COLUMN_FAMILY)) {
                    descriptors.add(new ColumnFamilyDescriptor(name));
                }
            }

            DBOptions dbOpts = new DBOptions()
                    .setCreateIfMissing(true)
                    .setCreateMissingColumnFamilies(true);
            List<ColumnFamilyHandle> handles = new ArrayList<>();
            RocksDB db;
            try {
                db = RocksDB.open(dbOpts, dataDir.toString(), descriptors, handles);
            } catch (RocksDBException e) {
                for (ColumnFamilyDescriptor descriptor : descriptors) {
                    descriptor.getOptions().close();
                }
                dbOpts.close();
                throw e;
            }

            RocksDocumentStore store = new RocksDocumentStore(db, dbOpts, handles);
            for (int i = 1; i < descriptors.size(); i++) {
                String name = new String(descriptors.get(i).getName(), StandardCharsets.UTF_8);
                store.databases.put(name, store.new RocksDatabase(name, handles.get(i)));
            }
            LOG.info(() -> "Opened RocksDB document store at " + dataDir + " with " + store.databases.size() + " database(s)");
            return store;
        } catch (RocksDBException | IOException e) {
            throw new CouchDbException(0, "storage_error", "Failed to open RocksDB at " + dataDir, e);
        }
    }

    @Override
    public synchronized DocumentDatabase createDatabaseIfNotExists(String dbName) {
        RocksDatabase existing = databases.get(dbName);
        if (existing != null) {
            return existing;
        }
        try {
            ColumnFamilyHandle handle = db.createColumnFamily(
                    new ColumnFamilyDescriptor(dbName.getBytes(StandardCharsets.UTF_8)));
            handles.add(handle);
            RocksDatabase created = new RocksDatabase(dbName, handle);
            databases.put(dbName, created);
            LOG.fine(() -> "Created database " + dbName);
            return created;
        } catch (RocksDBException e) {
            throw new CouchDbException(0, "storage_error", "Failed to create database " + dbName, e);
        }
    }

    @Override
    public synchronized void close() {
        // handles first, then the DB and its options
        for (ColumnFamilyHandle handle : handles) {
            handle.close();
        }
        db.close();
        dbOptions.close();
    }

    private final class RocksDatabase implements DocumentDatabase {
        private final String name;
        private final ColumnFamilyHandle cf;
        private final byte[] seqKey;
        private final byte[] countKey;

        RocksDatabase(String name, ColumnFamilyHandle cf) {
            this.name = name;
            this.cf = cf;
            this.seqKey = (SEQ_PREFIX + name).getBytes(StandardCharsets.UTF_8);
            this.countKey = (COUNT_PREFIX + name).getBytes(StandardCharsets.UTF_8);
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public Optional<byte[]> readDoc(String id) {
            try {
                byte[] raw = db.get(cf, id.getBytes(StandardCharsets.UTF_8));
                return raw == null ? Optional.empty() : Optional.of(JsonDocuments.payload(JsonDocuments.parseObject(raw)));
            } catch (RocksDBException e) {
                throw new CouchDbException(0, "storage_error", "readDoc failed for " + name, e);
            }
        }

        @Override
        public String saveDoc(String id, String rev, byte[] jsonBody, List<Attachment> attachments) {
            byte[] key = id.getBytes(StandardCharsets.UTF_8);
            // one writer at a time per store keeps the revision check and the sequence bump consistent
            synchronized (RocksDocumentStore.this) {
                try (WriteOptions wo = new WriteOptions().setSync(false);
                     WriteBatch batch = new WriteBatch()) {
                    byte[] current = db.get(cf, key);
                    String currentRev = current == null ? null
                            : JsonDocuments.parseObject(current).path(JsonDocuments.REV).asText(null);
                    if (rev != null && !rev.equals(currentRev)) {
                        throw new CouchDbException(409, "conflict", "Document update conflict.");
                    }
                    String newRev = Revisions.next(currentRev, jsonBody, attachments);
                    ObjectNode doc = JsonDocuments.buildDocument(id, newRev, jsonBody, attachments);
                    batch.put(cf, key, JsonDocuments.toBytes(doc));
                    batch.put(cfDefault, seqKey, longToBytes(readCounter(seqKey) + 1));
                    if (current == null) {
                        batch.put(cfDefault, countKey, longToBytes(readCounter(countKey) + 1));
                    }
                    db.write(wo, batch);
                    return newRev;
                } catch (RocksDBException e) {
                    throw new CouchDbException(0, "storage_error", "saveDoc failed for " + name, e);
                }
            }
        }

        @Override
        public List<DocumentRecord> readDocRange(String startKey, String endKey, int limit, int skip) {
            byte[] end = endKey.getBytes(StandardCharsets.UTF_8);
            List<DocumentRecord> out = new ArrayList<>();
            int skipped = 0;
            try (RocksIterator it = db.newIterator(cf)) {
                for (it.seek(startKey.getBytes(StandardCharsets.UTF_8)); it.isValid(); it.next()) {
                    if (out.size() >= limit || Arrays.compareUnsigned(it.key(), end) >= 0) break;
                    if (skipped++ < skip) continue;
                    out.add(new DocumentRecord(new String(it.key(), StandardCharsets.UTF_8),
                            JsonDocuments.payload(JsonDocuments.parseObject(it.value()))));
                }
            }
            return out;
        }

        @Override
        public List<DocumentRecord> queryDocuments(String query, int limit, int skip) {
            SelectorMatcher matcher = SelectorMatcher.parse(query);
            List<DocumentRecord> out = new ArrayList<>();
            int skipped = 0;
            try (RocksIterator it = db.newIterator(cf)) {
                for (it.seekToFirst(); it.isValid(); it.next()) {
                    if (out.size() >= limit) break;
                    ObjectNode doc = JsonDocuments.parseObject(it.value());
                    if (!matcher.matches(doc)) continue;
                    if (skipped++ < skip) continue;
                    out.add(new DocumentRecord(new String(it.key(), StandardCharsets.UTF_8), JsonDocuments.payload(doc)));
                }
            }
            return out;
        }

        @Override
        public FullCommitResponse ensureFullCommit() {
            try {
                db.flushWal(true);
                return new FullCommitResponse(true, Long.toString(instanceStartTime));
            } catch (RocksDBException e) {
                throw new CouchDbException(0, "storage_error", "WAL sync failed for " + name, e);
            }
        }

        @Override
        public DatabaseInfo getDatabaseInfo() {
            try {
                return new DatabaseInfo(name, Long.toString(readCounter(seqKey)), readCounter(countKey));
            } catch (RocksDBException e) {
                throw new CouchDbException(0, "storage_error", "getDatabaseInfo failed for " + name, e);
            }
        }

        /** Per-database counters live in the default family; documents are never deleted. */
        private long readCounter(byte[] key) throws RocksDBException {
            byte[] raw = db.get(cfDefault, key);
            return raw == null ? 0L : bytesToLong(raw);
        }
    }

    // -------------- helpers ----------------

    private static byte[] longToBytes(long v) {
        ByteBuffer b = ByteBuffer.allocate(8);
        b.putLong(v);
        return b.array();
    }

    private static long bytesToLong(byte[] a) {
        return ByteBuffer.wrap(a).getLong();
    }
}
