package io.ledger.core.statedb.couch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.ledger.core.couchdb.Attachment;
import io.ledger.core.couchdb.DatabaseInfo;
import io.ledger.core.couchdb.DocumentDatabase;
import io.ledger.core.couchdb.DocumentRecord;
import io.ledger.core.couchdb.FullCommitResponse;
import io.ledger.core.couchdb.JsonDocuments;
import io.ledger.core.metrics.StateDbMetrics;
import io.ledger.core.statedb.CompositeKey;
import io.ledger.core.statedb.ResultsIterator;
import io.ledger.core.statedb.SavepointCorruptedException;
import io.ledger.core.statedb.StateDbException;
import io.ledger.core.statedb.UpdateBatch;
import io.ledger.core.statedb.VersionedDB;
import io.ledger.core.statedb.VersionedValue;
import io.ledger.core.version.Height;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link VersionedDB} over one database of a CouchDB-compatible document store.
 *
 * Physical layout:
 *  - a JSON object value is the document body at its encoded key
 *  - any other value is the single attachment "valueBytes" (application/octet-stream)
 *  - "statedb_savepoint" holds {BlockNum, TxNum, UpdateSeq}
 *
 * The handle owns nothing beyond the database reference; the store connection is shared.
 */
public final class CouchVersionedDB implements VersionedDB {
    private static final Logger LOG = Logger.getLogger(CouchVersionedDB.class.getName());

    static final String SAVEPOINT_DOC_ID = "statedb_savepoint";
    static final String BINARY_CONTENT_TYPE = "application/octet-stream";
    private static final int TRACE_BYTES = 200;

    private final DocumentDatabase db;
    private final String dbName;
    private final int queryLimit;
    private final ObjectMapper mapper = new ObjectMapper();

    CouchVersionedDB(DocumentDatabase db, String dbName, int queryLimit) {
        this.db = Objects.requireNonNull(db, "db");
        this.dbName = Objects.requireNonNull(dbName, "dbName");
        this.queryLimit = queryLimit;
    }

    @Override
    public String name() {
        return dbName;
    }

    @Override
    public void open() {
        // shared store connection, nothing to open
    }

    @Override
    public void close() {
        // shared store connection, nothing to close
    }

    @Override
    public Optional<VersionedValue> getState(String namespace, String key) {
        LOG.fine(() -> "getState() ns=" + namespace + ", key=" + key);
        String id = CompositeKeyCodec.encodeToId(namespace, key);
        Optional<byte[]> doc = db.readDoc(id);
        if (doc.isEmpty()) {
            return Optional.empty();
        }
        byte[] value = doc.get();
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("getState() read " + trace(value));
        }
        return Optional.of(new VersionedValue(value, PLACEHOLDER_VERSION));
    }

    @Override
    public List<Optional<VersionedValue>> getStateMultipleKeys(String namespace, List<String> keys) {
        List<Optional<VersionedValue>> values = new ArrayList<>(keys.size());
        for (String key : keys) {
            values.add(getState(namespace, key));
        }
        return values;
    }

    @Override
    public ResultsIterator getStateRangeScanIterator(String namespace, String startKey, String endKey) {
        String start = CompositeKeyCodec.encodeToId(namespace, startKey);
        String end = CompositeKeyCodec.rangeEnd(namespace, endKey);
        List<DocumentRecord> results = db.readDocRange(start, end, queryLimit, 0);
        if (results.size() >= queryLimit) {
            LOG.fine(() -> "Range scan on " + dbName + "/" + namespace + " hit the result cap of " + queryLimit);
        }
        StateDbMetrics.recordResultSize("range", results.size());
        return new RangeScanner(namespace, results);
    }

    @Override
    public ResultsIterator executeQuery(String query) {
        List<DocumentRecord> results = db.queryDocuments(query, queryLimit, 0);
        StateDbMetrics.recordResultSize("query", results.size());
        return new QueryScanner(results);
    }

    @Override
    public void applyUpdates(UpdateBatch batch, Height height) {
        Objects.requireNonNull(batch, "batch");
        Objects.requireNonNull(height, "height");
        StateDbMetrics.recordApply(() -> {
            for (Map.Entry<CompositeKey, VersionedValue> entry : batch.entries().entrySet()) {
                writeEntry(entry.getKey(), entry.getValue());
            }
            recordSavepoint(height);
        });
        LOG.fine(() -> "Applied " + batch.size() + " update(s) to " + dbName + " at " + height);
    }

    /** Blind overwrite of one key, as a JSON document or as an opaque attachment. */
    private void writeEntry(CompositeKey ck, VersionedValue vv) {
        String id = CompositeKeyCodec.encodeToId(ck.namespace(), ck.key());
        byte[] value = vv.value();
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Applying key=" + ck + ", value=" + trace(value));
        }
        String rev;
        try {
            if (JsonDocuments.isJsonObject(value)) {
                rev = db.saveDoc(id, null, value, List.of());
                StateDbMetrics.incrementDocsWritten("json");
            } else {
                Attachment attachment = new Attachment(JsonDocuments.VALUE_ATTACHMENT, BINARY_CONTENT_TYPE, value);
                rev = db.saveDoc(id, null, null, List.of(attachment));
                StateDbMetrics.incrementDocsWritten("binary");
            }
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, "Error writing " + ck + " to " + dbName, e);
            throw e;
        }
        LOG.finer(() -> "Saved document revision " + rev);
    }

    /**
     * Fence the savepoint between two full commits. The store may apply writes out of order
     * across documents, so the savepoint for a height may only become durable after every
     * data write before it, and the call only succeeds once the savepoint itself is durable.
     */
    private void recordSavepoint(Height height) {
        ensureFullCommit();

        DatabaseInfo info = db.getDatabaseInfo();
        byte[] savepoint;
        try {
            savepoint = mapper.writeValueAsBytes(SavepointDocument.of(height, info.updateSeq()));
        } catch (JsonProcessingException e) {
            throw new StateDbException("Failed to create savepoint data", e);
        }
        try {
            db.saveDoc(SAVEPOINT_DOC_ID, null, savepoint, List.of());
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, "Failed to save the savepoint to " + dbName, e);
            throw e;
        }

        ensureFullCommit();
        StateDbMetrics.incrementSavepoints();
    }

    private void ensureFullCommit() {
        FullCommitResponse response;
        try {
            response = db.ensureFullCommit();
        } catch (RuntimeException e) {
            StateDbMetrics.incrementFenceFailures();
            LOG.log(Level.SEVERE, "Failed to perform full commit on " + dbName, e);
            throw new StateDbException("Failed to perform full commit", e);
        }
        if (response == null || !response.ok()) {
            StateDbMetrics.incrementFenceFailures();
            LOG.severe(() -> "Full commit on " + dbName + " was not acknowledged");
            throw new StateDbException("Failed to perform full commit");
        }
    }

    @Override
    public Height getLatestSavePoint() {
        Optional<byte[]> doc = db.readDoc(SAVEPOINT_DOC_ID);
        if (doc.isEmpty()) {
            return Height.ZERO;
        }
        try {
            return mapper.readValue(doc.get(), SavepointDocument.class).height();
        } catch (IOException e) {
            LOG.log(Level.SEVERE, "Failed to decode savepoint of " + dbName, e);
            throw new SavepointCorruptedException("Failed to unmarshal savepoint data of " + dbName, e);
        }
    }

    /** First 200 bytes only, values can be huge. */
    private static String trace(byte[] value) {
        if (value.length <= TRACE_BYTES) {
            return new String(value, StandardCharsets.UTF_8);
        }
        return new String(value, 0, TRACE_BYTES, StandardCharsets.UTF_8) + "...";
    }
}
