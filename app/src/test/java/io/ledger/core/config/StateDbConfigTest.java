package io.ledger.core.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StateDbConfigTest {

    @Test
    void defaultsWhenNothingIsSet() {
        StateDbConfig config = StateDbConfig.fromEnvironment(Map.of());
        assertEquals(StateDbConfig.defaultLocal(), config);
        assertEquals(StateDbConfig.Backend.COUCHDB, config.backend());
        assertEquals("http://127.0.0.1:5984", config.couchDbUrl());
        assertEquals(Duration.ofSeconds(35), config.requestTimeout());
        assertEquals(1000, config.queryLimit());
    }

    @Test
    void environmentOverridesDefaults() {
        StateDbConfig config = StateDbConfig.fromEnvironment(Map.of(
                "STATEDB_BACKEND", "RocksDB",
                "STATEDB_COUCHDB_URL", "http://couch:5984",
                "STATEDB_COUCHDB_USERNAME", "admin",
                "STATEDB_COUCHDB_PASSWORD", "secret",
                "STATEDB_COUCHDB_REQUEST_TIMEOUT_MS", "1500",
                "STATEDB_QUERY_LIMIT", "250",
                "STATEDB_ROCKSDB_DIR", "/var/lib/statedb"));

        assertEquals(StateDbConfig.Backend.ROCKSDB, config.backend());
        assertEquals("http://couch:5984", config.couchDbUrl());
        assertEquals("admin", config.username());
        assertEquals("secret", config.password());
        assertEquals(Duration.ofMillis(1500), config.requestTimeout());
        assertEquals(250, config.queryLimit());
        assertEquals(Path.of("/var/lib/statedb"), config.rocksDataDir());
    }

    @Test
    void blankValuesFallBackToDefaults() {
        StateDbConfig config = StateDbConfig.fromEnvironment(Map.of("STATEDB_QUERY_LIMIT", "  ", "STATEDB_BACKEND", ""));
        assertEquals(1000, config.queryLimit());
        assertEquals(StateDbConfig.Backend.COUCHDB, config.backend());
    }

    @Test
    void invalidValuesNameTheVariable() {
        assertInvalid("STATEDB_BACKEND", "mongo");
        assertInvalid("STATEDB_QUERY_LIMIT", "0");
        assertInvalid("STATEDB_QUERY_LIMIT", "lots");
        assertInvalid("STATEDB_QUERY_LIMIT", "99999999999");
        assertInvalid("STATEDB_COUCHDB_REQUEST_TIMEOUT_MS", "-5");
    }

    @Test
    void toStringMasksPassword() {
        StateDbConfig config = StateDbConfig.fromEnvironment(Map.of("STATEDB_COUCHDB_PASSWORD", "hunter2"));
        assertFalse(config.toString().contains("hunter2"));
        assertTrue(config.toString().contains("password=****"));
    }

    @Test
    void queryLimitMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new StateDbConfig(StateDbConfig.Backend.MEMORY,
                "http://x", "", "", Duration.ofSeconds(1), 0, Path.of(".")));
    }

    private static void assertInvalid(String key, String value) {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> StateDbConfig.fromEnvironment(Map.of(key, value)));
        assertEquals("Invalid value for " + key + ": " + value, e.getMessage());
    }
}
