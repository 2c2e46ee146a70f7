package io.ledger.core.statedb.couch;

import io.ledger.core.config.StateDbConfig;
import io.ledger.core.couchdb.CouchDbException;
import io.ledger.core.couchdb.DocumentDatabase;
import io.ledger.core.couchdb.DocumentStore;
import io.ledger.core.couchdb.InMemoryDocumentStore;
import io.ledger.core.statedb.UpdateBatch;
import io.ledger.core.statedb.VersionedDB;
import io.ledger.core.statedb.VersionedDBProvider;
import io.ledger.core.statedb.VersionedValue;
import io.ledger.core.version.Height;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CouchVersionedDBProviderTest {

    @TempDir
    Path tempDir;

    @Test
    void namesAreCaseFoldedToOneHandle() {
        InMemoryDocumentStore store = new InMemoryDocumentStore();
        VersionedDBProvider provider = new CouchVersionedDBProvider(store, 1000);

        VersionedDB upper = provider.getDBHandle("MyLedger");
        VersionedDB lower = provider.getDBHandle("myledger");

        assertSame(upper, lower);
        assertEquals("myledger", upper.name());
        assertEquals(1, store.databaseCount());
    }

    @Test
    void distinctNamesGetDistinctDatabases() {
        VersionedDBProvider provider = new CouchVersionedDBProvider(new InMemoryDocumentStore(), 1000);
        VersionedDB a = provider.getDBHandle("a");
        VersionedDB b = provider.getDBHandle("b");

        a.applyUpdates(new UpdateBatch().put("ns", "k", new VersionedValue(bytes("x"), Height.of(1, 0))), Height.of(1, 0));

        assertNotSame(a, b);
        assertTrue(b.getState("ns", "k").isEmpty());
        assertEquals(Height.ZERO, b.getLatestSavePoint());
    }

    @Test
    void concurrentFirstCallsCreateOnce() throws Exception {
        CountingStore store = new CountingStore();
        VersionedDBProvider provider = new CouchVersionedDBProvider(store, 1000);
        int threads = 8;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<VersionedDB>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                String name = i % 2 == 0 ? "Shared" : "SHARED";
                Callable<VersionedDB> task = () -> {
                    start.await();
                    return provider.getDBHandle(name);
                };
                futures.add(pool.submit(task));
            }
            start.countDown();
            VersionedDB first = futures.get(0).get(5, TimeUnit.SECONDS);
            for (Future<VersionedDB> f : futures) {
                assertSame(first, f.get(5, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, store.creations.get());
    }

    @Test
    void failedCreationIsNotCached() {
        CountingStore store = new CountingStore();
        store.failNext = true;
        VersionedDBProvider provider = new CouchVersionedDBProvider(store, 1000);

        assertThrows(CouchDbException.class, () -> provider.getDBHandle("flaky"));
        assertNotNull(provider.getDBHandle("flaky"));
        assertEquals(2, store.creations.get());
    }

    @Test
    void closeLeavesCallerOwnedStoreOpen() {
        CountingStore store = new CountingStore();
        VersionedDBProvider provider = new CouchVersionedDBProvider(store, 1000);
        provider.getDBHandle("x").close();
        provider.close();
        assertFalse(store.closed);
    }

    @Test
    void createsConfiguredEmbeddedBackends() {
        StateDbConfig memory = new StateDbConfig(StateDbConfig.Backend.MEMORY, "http://unused", "", "",
                Duration.ofSeconds(1), 10, tempDir);
        try (CouchVersionedDBProvider provider = CouchVersionedDBProvider.create(memory)) {
            assertEquals(Height.ZERO, provider.getDBHandle("mem").getLatestSavePoint());
        }

        StateDbConfig rocks = new StateDbConfig(StateDbConfig.Backend.ROCKSDB, "http://unused", "", "",
                Duration.ofSeconds(1), 10, tempDir.resolve("rocks"));
        try (CouchVersionedDBProvider provider = CouchVersionedDBProvider.create(rocks)) {
            VersionedDB db = provider.getDBHandle("Ledger1");
            db.applyUpdates(new UpdateBatch().put("ns", "k", new VersionedValue(bytes("v"), Height.of(2, 0))), Height.of(2, 0));
        }
        try (CouchVersionedDBProvider provider = CouchVersionedDBProvider.create(rocks)) {
            VersionedDB db = provider.getDBHandle("ledger1");
            assertEquals(Height.of(2, 0), db.getLatestSavePoint());
            assertArrayEquals(bytes("v"), db.getState("ns", "k").orElseThrow().value());
        }
    }

    @Test
    void rejectsNonPositiveQueryLimit() {
        assertThrows(IllegalArgumentException.class, () -> new CouchVersionedDBProvider(new InMemoryDocumentStore(), 0));
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static final class CountingStore implements DocumentStore {
        final AtomicInteger creations = new AtomicInteger();
        final InMemoryDocumentStore delegate = new InMemoryDocumentStore();
        volatile boolean failNext;
        volatile boolean closed;

        @Override
        public DocumentDatabase createDatabaseIfNotExists(String dbName) {
            creations.incrementAndGet();
            if (failNext) {
                failNext = false;
                throw new CouchDbException(0, "transport_error", "connection refused");
            }
            try {
                Thread.sleep(20); // widen the race window
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return delegate.createDatabaseIfNotExists(dbName);
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
