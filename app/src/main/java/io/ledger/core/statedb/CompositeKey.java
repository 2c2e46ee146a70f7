package io.ledger.core.statedb;

import java.util.Objects;

/**
 * (namespace, key) pair. The namespace partitions the key space and may not contain
 * the NUL character, which is reserved as the encoding separator.
 */
public record CompositeKey(String namespace, String key) {

    public CompositeKey {
        requireValidNamespace(namespace);
        Objects.requireNonNull(key, "key");
    }

    /** Non-null and free of the NUL separator. */
    public static String requireValidNamespace(String namespace) {
        Objects.requireNonNull(namespace, "namespace");
        if (namespace.indexOf('\u0000') >= 0) {
            throw new IllegalArgumentException("namespace must not contain the NUL separator: " + namespace.replace('\u0000', '?'));
        }
        return namespace;
    }
}
