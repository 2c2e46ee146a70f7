package io.ledger.core.statedb.couch;

import io.ledger.core.statedb.CompositeKey;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Flat encoding of a (namespace, key) pair: {@code namespace ++ 0x00 ++ key}.
 * Byte order of encoded keys matches (namespace, key) order as long as namespaces hold no 0x00.
 */
public final class CompositeKeyCodec {

    static final byte SEPARATOR = 0x00;
    static final byte LAST_KEY_INDICATOR = 0x01;

    private CompositeKeyCodec() {}

    public static byte[] encode(String namespace, String key) {
        byte[] ns = CompositeKey.requireValidNamespace(namespace).getBytes(StandardCharsets.UTF_8);
        byte[] k = Objects.requireNonNull(key, "key").getBytes(StandardCharsets.UTF_8);
        byte[] out = new byte[ns.length + 1 + k.length];
        System.arraycopy(ns, 0, out, 0, ns.length);
        out[ns.length] = SEPARATOR;
        System.arraycopy(k, 0, out, ns.length + 1, k.length);
        return out;
    }

    /** Encoded key as a document id. */
    public static String encodeToId(String namespace, String key) {
        return new String(encode(namespace, key), StandardCharsets.UTF_8);
    }

    /**
     * Exclusive upper bound of a range scan. An empty {@code endKey} means the end of the
     * namespace: the trailing separator becomes 0x01, which sorts after every key in it.
     */
    public static String rangeEnd(String namespace, String endKey) {
        byte[] end = encode(namespace, endKey);
        if (endKey.isEmpty()) {
            end[end.length - 1] = LAST_KEY_INDICATOR;
        }
        return new String(end, StandardCharsets.UTF_8);
    }

    /** Split on the first separator. */
    static CompositeKey decode(byte[] encoded) {
        for (int i = 0; i < encoded.length; i++) {
            if (encoded[i] == SEPARATOR) {
                return new CompositeKey(
                        new String(encoded, 0, i, StandardCharsets.UTF_8),
                        new String(encoded, i + 1, encoded.length - i - 1, StandardCharsets.UTF_8));
            }
        }
        throw new IllegalArgumentException("Not a composite key: no separator in " + encoded.length + " bytes");
    }

    public static CompositeKey decodeId(String id) {
        int sep = id.indexOf('\u0000');
        if (sep < 0) {
            throw new IllegalArgumentException("Not a composite key id: " + id);
        }
        return new CompositeKey(id.substring(0, sep), id.substring(sep + 1));
    }

    public static boolean isCompositeId(String id) {
        return id.indexOf('\u0000') >= 0;
    }
}
