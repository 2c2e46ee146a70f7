package io.ledger.core.statedb.couch;

import io.ledger.core.couchdb.DocumentRecord;
import io.ledger.core.statedb.CompositeKey;
import io.ledger.core.statedb.QueryResult;
import io.ledger.core.statedb.ResultsIterator;
import io.ledger.core.statedb.VersionedDB;
import io.ledger.core.statedb.VersionedQueryRecord;

import java.util.List;
import java.util.Optional;

/**
 * Cursor over the documents matched by an ad-hoc query. Documents whose id is not a composite
 * key (the savepoint record) are skipped.
 */
final class QueryScanner implements ResultsIterator {
    private List<DocumentRecord> results;
    private int cursor = -1;

    QueryScanner(List<DocumentRecord> results) {
        this.results = List.copyOf(results);
    }

    @Override
    public Optional<QueryResult> next() {
        if (results == null) {
            return Optional.empty();
        }
        while (++cursor < results.size()) {
            DocumentRecord selected = results.get(cursor);
            if (!CompositeKeyCodec.isCompositeId(selected.id())) {
                continue;
            }
            CompositeKey ck = CompositeKeyCodec.decodeId(selected.id());
            return Optional.of(new VersionedQueryRecord(
                    ck.namespace(), ck.key(), VersionedDB.PLACEHOLDER_VERSION, selected.value()));
        }
        return Optional.empty();
    }

    @Override
    public void close() {
        results = null;
    }
}
