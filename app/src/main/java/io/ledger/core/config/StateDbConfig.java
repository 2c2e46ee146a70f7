package io.ledger.core.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Settings for the state database layer.
 *
 * Environment overrides:
 *   STATEDB_BACKEND                     couchdb (default), rocksdb or memory
 *   STATEDB_COUCHDB_URL                 CouchDB base URL (default http://127.0.0.1:5984)
 *   STATEDB_COUCHDB_USERNAME            Basic auth user, empty for none
 *   STATEDB_COUCHDB_PASSWORD            Basic auth password
 *   STATEDB_COUCHDB_REQUEST_TIMEOUT_MS  Per-request timeout (default 35000)
 *   STATEDB_QUERY_LIMIT                 Cap on range scan and query results (default 1000)
 *   STATEDB_ROCKSDB_DIR                 Data directory of the embedded store (default ./data/statedb)
 */
public record StateDbConfig(
        Backend backend,
        String couchDbUrl,
        String username,
        String password,
        Duration requestTimeout,
        int queryLimit,
        Path rocksDataDir
) {
    public enum Backend { COUCHDB, ROCKSDB, MEMORY }

    public static final int DEFAULT_QUERY_LIMIT = 1000;

    public StateDbConfig {
        Objects.requireNonNull(backend, "backend");
        Objects.requireNonNull(couchDbUrl, "couchDbUrl");
        Objects.requireNonNull(requestTimeout, "requestTimeout");
        Objects.requireNonNull(rocksDataDir, "rocksDataDir");
        if (queryLimit <= 0) {
            throw new IllegalArgumentException("queryLimit must be positive: " + queryLimit);
        }
    }

    public static StateDbConfig defaultLocal() {
        return new StateDbConfig(
                Backend.COUCHDB,
                "http://127.0.0.1:5984",
                "",
                "",
                Duration.ofSeconds(35),
                DEFAULT_QUERY_LIMIT,
                Path.of("./data/statedb")
        );
    }

    public static StateDbConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /** Defaults from {@link #defaultLocal()}, overridden by any STATEDB_* variable present. */
    public static StateDbConfig fromEnvironment(Map<String, String> env) {
        StateDbConfig defaults = defaultLocal();
        Backend backend = defaults.backend;
        String backendValue = value(env, "STATEDB_BACKEND");
        if (backendValue != null) {
            try {
                backend = Backend.valueOf(backendValue.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid value for STATEDB_BACKEND: " + backendValue);
            }
        }
        String url = orDefault(value(env, "STATEDB_COUCHDB_URL"), defaults.couchDbUrl);
        String username = orDefault(value(env, "STATEDB_COUCHDB_USERNAME"), defaults.username);
        String password = orDefault(value(env, "STATEDB_COUCHDB_PASSWORD"), defaults.password);
        Duration timeout = defaults.requestTimeout;
        String timeoutValue = value(env, "STATEDB_COUCHDB_REQUEST_TIMEOUT_MS");
        if (timeoutValue != null) {
            timeout = Duration.ofMillis(parsePositiveLong(timeoutValue, "STATEDB_COUCHDB_REQUEST_TIMEOUT_MS"));
        }
        int queryLimit = defaults.queryLimit;
        String limitValue = value(env, "STATEDB_QUERY_LIMIT");
        if (limitValue != null) {
            long parsed = parsePositiveLong(limitValue, "STATEDB_QUERY_LIMIT");
            if (parsed > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("Invalid value for STATEDB_QUERY_LIMIT: " + limitValue);
            }
            queryLimit = (int) parsed;
        }
        String dir = value(env, "STATEDB_ROCKSDB_DIR");
        Path rocksDir = dir == null ? defaults.rocksDataDir : Path.of(dir);

        return new StateDbConfig(backend, url, username, password, timeout, queryLimit, rocksDir);
    }

    @Override
    public String toString() {
        return "StateDbConfig{backend=" + backend
                + ", couchDbUrl=" + couchDbUrl
                + ", username=" + username
                + ", password=" + (password == null || password.isEmpty() ? "" : "****")
                + ", requestTimeout=" + requestTimeout
                + ", queryLimit=" + queryLimit
                + ", rocksDataDir=" + rocksDataDir + "}";
    }

    private static String value(Map<String, String> env, String key) {
        String value = env.get(key);
        return (value == null || value.isBlank()) ? null : value;
    }

    private static String orDefault(String value, String fallback) {
        return value == null ? fallback : value;
    }

    private static long parsePositiveLong(String value, String key) {
        try {
            long parsed = Long.parseLong(value.trim());
            if (parsed <= 0) {
                throw new NumberFormatException();
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value);
        }
    }
}
