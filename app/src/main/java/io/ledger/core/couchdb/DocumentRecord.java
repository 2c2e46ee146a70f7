package io.ledger.core.couchdb;

import java.util.Objects;

/** A document id together with its payload as returned by {@link DocumentDatabase#readDoc}. */
public final class DocumentRecord {
    private final String id;
    private final byte[] value;

    public DocumentRecord(String id, byte[] value) {
        this.id = Objects.requireNonNull(id, "id");
        this.value = value == null ? new byte[0] : value.clone();
    }

    public String id() { return id; }
    public byte[] value() { return value.clone(); }

    @Override
    public String toString() {
        return "DocumentRecord{" + id.replace('\u0000', '|') + ", " + value.length + " bytes}";
    }
}
