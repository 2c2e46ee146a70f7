package io.ledger.core.statedb.couch;

import io.ledger.core.couchdb.DocumentRecord;
import io.ledger.core.statedb.CompositeKey;
import io.ledger.core.statedb.QueryResult;
import io.ledger.core.statedb.ResultsIterator;
import io.ledger.core.statedb.VersionedDB;
import io.ledger.core.statedb.VersionedKV;
import io.ledger.core.statedb.VersionedValue;

import java.util.List;
import java.util.Optional;

/** Cursor over the documents of one range read, all inside {@code namespace}. */
final class RangeScanner implements ResultsIterator {
    private final String namespace;
    private List<DocumentRecord> results;
    private int cursor = -1;

    RangeScanner(String namespace, List<DocumentRecord> results) {
        this.namespace = namespace;
        this.results = List.copyOf(results);
    }

    @Override
    public Optional<QueryResult> next() {
        if (results == null) {
            return Optional.empty();
        }
        cursor++;
        if (cursor >= results.size()) {
            return Optional.empty();
        }
        DocumentRecord selected = results.get(cursor);
        String key = CompositeKeyCodec.decodeId(selected.id()).key();
        return Optional.of(new VersionedKV(
                new CompositeKey(namespace, key),
                new VersionedValue(selected.value(), VersionedDB.PLACEHOLDER_VERSION)));
    }

    @Override
    public void close() {
        results = null;
    }
}
