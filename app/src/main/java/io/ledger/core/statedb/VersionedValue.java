package io.ledger.core.statedb;

import io.ledger.core.version.Height;

import java.util.Arrays;
import java.util.Objects;

/**
 * Raw value bytes plus the height they are attributed to.
 * The bytes are either UTF-8 JSON text or arbitrary binary; nothing here records which.
 */
public final class VersionedValue {
    private final byte[] value;
    private final Height version;

    public VersionedValue(byte[] value, Height version) {
        this.value = Objects.requireNonNull(value, "value").clone();
        this.version = Objects.requireNonNull(version, "version");
    }

    public byte[] value() { return value.clone(); }
    public Height version() { return version; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VersionedValue)) return false;
        VersionedValue other = (VersionedValue) o;
        return Arrays.equals(value, other.value) && version.equals(other.version);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(value) + version.hashCode();
    }

    @Override
    public String toString() {
        return "VersionedValue{" + value.length + " bytes, " + version + "}";
    }
}
