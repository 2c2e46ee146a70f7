package io.ledger.core.statedb.couch;

import io.ledger.core.couchdb.Attachment;
import io.ledger.core.couchdb.CouchDbException;
import io.ledger.core.couchdb.DatabaseInfo;
import io.ledger.core.couchdb.DocumentDatabase;
import io.ledger.core.couchdb.DocumentRecord;
import io.ledger.core.couchdb.FullCommitResponse;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Delegating database that records the call sequence and can be told to fail. */
final class RecordingDatabase implements DocumentDatabase {
    final List<String> calls = new ArrayList<>();
    private final DocumentDatabase delegate;

    /** 1-based index of the ensureFullCommit call to answer with ok=false, 0 for never. */
    int rejectCommitNumber;
    /** 1-based index of the ensureFullCommit call to fail with an exception, 0 for never. */
    int throwOnCommitNumber;
    /** Id whose save fails with a store error, null for none. */
    String failSaveOf;
    private int commits;

    RecordingDatabase(DocumentDatabase delegate) {
        this.delegate = delegate;
    }

    @Override
    public String name() {
        return delegate.name();
    }

    @Override
    public Optional<byte[]> readDoc(String id) {
        calls.add("read:" + printable(id));
        return delegate.readDoc(id);
    }

    @Override
    public String saveDoc(String id, String rev, byte[] jsonBody, List<Attachment> attachments) {
        calls.add("save:" + printable(id));
        if (id.equals(failSaveOf)) {
            throw new CouchDbException(500, "internal_server_error", "injected");
        }
        return delegate.saveDoc(id, rev, jsonBody, attachments);
    }

    @Override
    public List<DocumentRecord> readDocRange(String startKey, String endKey, int limit, int skip) {
        calls.add("range");
        return delegate.readDocRange(startKey, endKey, limit, skip);
    }

    @Override
    public List<DocumentRecord> queryDocuments(String query, int limit, int skip) {
        calls.add("query");
        return delegate.queryDocuments(query, limit, skip);
    }

    @Override
    public FullCommitResponse ensureFullCommit() {
        calls.add("commit");
        commits++;
        if (commits == throwOnCommitNumber) {
            throw new CouchDbException(0, "transport_error", "injected");
        }
        if (commits == rejectCommitNumber) {
            return new FullCommitResponse(false, "0");
        }
        return delegate.ensureFullCommit();
    }

    @Override
    public DatabaseInfo getDatabaseInfo() {
        calls.add("info");
        return delegate.getDatabaseInfo();
    }

    private static String printable(String id) {
        return id.replace('\u0000', '|');
    }
}
