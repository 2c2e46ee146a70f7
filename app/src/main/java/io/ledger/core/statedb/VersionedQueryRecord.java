package io.ledger.core.statedb;

import io.ledger.core.version.Height;

import java.util.Arrays;
import java.util.Objects;

/** Ad-hoc query result. The namespace comes from the matched document id. */
public final class VersionedQueryRecord implements QueryResult {
    private final String namespace;
    private final String key;
    private final Height version;
    private final byte[] record;

    public VersionedQueryRecord(String namespace, String key, Height version, byte[] record) {
        this.namespace = Objects.requireNonNull(namespace, "namespace");
        this.key = Objects.requireNonNull(key, "key");
        this.version = Objects.requireNonNull(version, "version");
        this.record = record == null ? new byte[0] : record.clone();
    }

    public String namespace() { return namespace; }
    public String key() { return key; }
    public Height version() { return version; }
    public byte[] record() { return record.clone(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VersionedQueryRecord)) return false;
        VersionedQueryRecord other = (VersionedQueryRecord) o;
        return namespace.equals(other.namespace)
                && key.equals(other.key)
                && version.equals(other.version)
                && Arrays.equals(record, other.record);
    }

    @Override
    public int hashCode() {
        return Objects.hash(namespace, key, version) * 31 + Arrays.hashCode(record);
    }

    @Override
    public String toString() {
        return "VersionedQueryRecord{" + namespace + "/" + key + ", " + record.length + " bytes}";
    }
}
