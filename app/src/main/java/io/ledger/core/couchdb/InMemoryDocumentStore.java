package io.ledger.core.couchdb;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Simple, fast in-memory document store.
 * Good for tests and local runs before wiring CouchDB.
 *
 * Documents are kept in their wire form, sorted by the UTF-8 bytes of their id so range
 * reads see the same order as the persistent stores. Nothing survives the process.
 */
public final class InMemoryDocumentStore implements DocumentStore {

    /** Orders ids the way a bytewise key comparator would. */
    static final Comparator<String> ID_ORDER = (a, b) -> Arrays.compareUnsigned(
            a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));

    private final ConcurrentMap<String, InMemoryDatabase> databases = new ConcurrentHashMap<>();
    private final long instanceStartTime = System.currentTimeMillis();

    @Override
    public DocumentDatabase createDatabaseIfNotExists(String dbName) {
        Objects.requireNonNull(dbName, "dbName");
        return databases.computeIfAbsent(dbName, InMemoryDatabase::new);
    }

    /** Number of databases created so far. */
    public int databaseCount() {
        return databases.size();
    }

    @Override
    public void close() {
        // nothing to release
    }

    private final class InMemoryDatabase implements DocumentDatabase {
        private final String name;
        private final NavigableMap<String, ObjectNode> docs = new TreeMap<>(ID_ORDER);
        private long updateSeq;

        InMemoryDatabase(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public synchronized Optional<byte[]> readDoc(String id) {
            ObjectNode doc = docs.get(id);
            return doc == null ? Optional.empty() : Optional.of(JsonDocuments.payload(doc));
        }

        @Override
        public synchronized String saveDoc(String id, String rev, byte[] jsonBody, List<Attachment> attachments) {
            Objects.requireNonNull(id, "id");
            ObjectNode existing = docs.get(id);
            String currentRev = existing == null ? null : existing.path(JsonDocuments.REV).asText(null);
            if (rev != null && !rev.equals(currentRev)) {
                throw new CouchDbException(409, "conflict", "Document update conflict.");
            }
            String newRev = Revisions.next(currentRev, jsonBody, attachments);
            docs.put(id, JsonDocuments.buildDocument(id, newRev, jsonBody, attachments));
            updateSeq++;
            return newRev;
        }

        @Override
        public synchronized List<DocumentRecord> readDocRange(String startKey, String endKey, int limit, int skip) {
            NavigableMap<String, ObjectNode> range;
            if (ID_ORDER.compare(startKey, endKey) >= 0) {
                range = new TreeMap<>(ID_ORDER);
            } else {
                range = docs.subMap(startKey, true, endKey, false);
            }
            List<DocumentRecord> out = new ArrayList<>();
            int skipped = 0;
            for (Map.Entry<String, ObjectNode> entry : range.entrySet()) {
                if (out.size() >= limit) break;
                if (skipped++ < skip) continue;
                out.add(new DocumentRecord(entry.getKey(), JsonDocuments.payload(entry.getValue())));
            }
            return out;
        }

        @Override
        public synchronized List<DocumentRecord> queryDocuments(String query, int limit, int skip) {
            SelectorMatcher matcher = SelectorMatcher.parse(query);
            List<DocumentRecord> out = new ArrayList<>();
            int skipped = 0;
            for (Map.Entry<String, ObjectNode> entry : docs.entrySet()) {
                if (out.size() >= limit) break;
                if (!matcher.matches(entry.getValue())) continue;
                if (skipped++ < skip) continue;
                out.add(new DocumentRecord(entry.getKey(), JsonDocuments.payload(entry.getValue())));
            }
            return out;
        }

        @Override
        public FullCommitResponse ensureFullCommit() {
            return new FullCommitResponse(true, Long.toString(instanceStartTime));
        }

        @Override
        public synchronized DatabaseInfo getDatabaseInfo() {
            return new DatabaseInfo(name, Long.toString(updateSeq), docs.size());
        }
    }
}
