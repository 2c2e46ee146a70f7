package io.ledger.core.couchdb;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryDocumentStoreTest extends DocumentStoreContractTest {

    @Override
    protected DocumentStore newStore() {
        return new InMemoryDocumentStore();
    }

    @Test
    void idsOrderByUtf8Bytes() {
        // U+FFFF sorts before U+10000 in UTF-16 but after it in UTF-8
        assertTrue(InMemoryDocumentStore.ID_ORDER.compare("\uffff", "\ud800\udc00") < 0);
        assertTrue(InMemoryDocumentStore.ID_ORDER.compare("a\u0000", "a\u0001") < 0);
        assertTrue(InMemoryDocumentStore.ID_ORDER.compare("ns\u0000é", "ns\u0001") < 0);
    }

    @Test
    void countsDatabases() {
        InMemoryDocumentStore memory = (InMemoryDocumentStore) store;
        memory.createDatabaseIfNotExists("ledger1");
        memory.createDatabaseIfNotExists("ledger2");
        assertEquals(2, memory.databaseCount());
    }
}
