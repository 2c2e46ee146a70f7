package io.ledger.core.statedb;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * All writes belonging to one commit. Built by the caller, read by
 * {@link VersionedDB#applyUpdates}. Entry order carries no meaning.
 */
public final class UpdateBatch {

    private final Map<CompositeKey, VersionedValue> kvs = new HashMap<>();

    public UpdateBatch put(String namespace, String key, VersionedValue value) {
        return put(new CompositeKey(namespace, key), value);
    }

    /** Last write for a key wins. */
    public UpdateBatch put(CompositeKey key, VersionedValue value) {
        kvs.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
        return this;
    }

    public VersionedValue get(String namespace, String key) {
        return kvs.get(new CompositeKey(namespace, key));
    }

    public boolean exists(String namespace, String key) {
        return kvs.containsKey(new CompositeKey(namespace, key));
    }

    public Map<CompositeKey, VersionedValue> entries() {
        return Collections.unmodifiableMap(kvs);
    }

    public int size() {
        return kvs.size();
    }

    public boolean isEmpty() {
        return kvs.isEmpty();
    }
}
