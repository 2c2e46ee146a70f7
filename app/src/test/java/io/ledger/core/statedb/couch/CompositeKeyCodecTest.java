package io.ledger.core.statedb.couch;

import io.ledger.core.statedb.CompositeKey;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class CompositeKeyCodecTest {

    @Test
    void encodesNamespaceSeparatorKey() {
        assertArrayEquals(new byte[] {'n', 's', 0x00, 'k', '1'}, CompositeKeyCodec.encode("ns", "k1"));
        assertEquals("ns\u0000k1", CompositeKeyCodec.encodeToId("ns", "k1"));
    }

    @Test
    void keysOrderLikePlainKeysInsideANamespace() {
        assertTrue(compare(CompositeKeyCodec.encode("ns", "a"), CompositeKeyCodec.encode("ns", "b")) < 0);
        assertTrue(compare(CompositeKeyCodec.encode("ns", "a"), CompositeKeyCodec.encode("ns", "ab")) < 0);
    }

    @Test
    void namespacesOrderEntirelyBeforeEachOther() {
        assertTrue(compare(CompositeKeyCodec.encode("nsA", "zzzz"), CompositeKeyCodec.encode("nsB", "a")) < 0);
        // a namespace that is a prefix of another still sorts first
        assertTrue(compare(CompositeKeyCodec.encode("ns", "\u00ff"), CompositeKeyCodec.encode("ns1", "")) < 0);
    }

    @Test
    void openEndedBoundCoversWholeNamespaceOnly() {
        String end = CompositeKeyCodec.rangeEnd("ns", "");
        assertEquals("ns\u0001", end);
        assertTrue(CompositeKeyCodec.encodeToId("ns", "\uffff").compareTo(end) < 0);
        assertTrue(CompositeKeyCodec.encodeToId("ns1", "").compareTo(end) > 0);
        assertEquals("ns\u0000k9", CompositeKeyCodec.rangeEnd("ns", "k9"));
    }

    @Test
    void decodeSplitsOnFirstSeparator() {
        assertEquals(new CompositeKey("ns", "a\u0000b"), CompositeKeyCodec.decodeId("ns\u0000a\u0000b"));
        assertEquals(new CompositeKey("ns", ""), CompositeKeyCodec.decode(new byte[] {'n', 's', 0x00}));
        assertEquals(new CompositeKey("chaincode1", "alice"),
                CompositeKeyCodec.decode(CompositeKeyCodec.encode("chaincode1", "alice")));
    }

    @Test
    void rejectsIdsWithoutSeparator() {
        assertFalse(CompositeKeyCodec.isCompositeId(CouchVersionedDB.SAVEPOINT_DOC_ID));
        assertThrows(IllegalArgumentException.class, () -> CompositeKeyCodec.decodeId("statedb_savepoint"));
        assertThrows(IllegalArgumentException.class, () -> CompositeKeyCodec.decode(new byte[] {'x'}));
    }

    @Test
    void rejectsNamespaceContainingSeparator() {
        assertThrows(IllegalArgumentException.class, () -> CompositeKeyCodec.encode("a\u0000b", "k"));
        assertThrows(IllegalArgumentException.class, () -> CompositeKeyCodec.rangeEnd("a\u0000b", ""));
        assertThrows(NullPointerException.class, () -> CompositeKeyCodec.encode(null, "k"));
        assertThrows(NullPointerException.class, () -> CompositeKeyCodec.encode("ns", null));
        // separator bytes are allowed inside the key
        assertArrayEquals(new byte[] {'n', 0x00, 'a', 0x00, 'b'}, CompositeKeyCodec.encode("n", "a\u0000b"));
    }

    private static int compare(byte[] a, byte[] b) {
        return Arrays.compareUnsigned(a, b);
    }
}
