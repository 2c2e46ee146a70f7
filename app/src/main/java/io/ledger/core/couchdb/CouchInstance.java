package io.ledger.core.couchdb;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Connection to a CouchDB server. One instance is shared by every database handle; the
 * protocol is stateless per request so no extra locking is needed.
 */
public final class CouchInstance implements DocumentStore {
    private static final Logger LOG = Logger.getLogger(CouchInstance.class.getName());

    private final URI baseUri;
    private final String authorization;
    private final Duration requestTimeout;
    private final HttpClient http;

    private CouchInstance(URI baseUri, String username, String password, Duration requestTimeout) {
        String url = baseUri.toString();
        this.baseUri = URI.create(url.endsWith("/") ? url : url + "/");
        this.authorization = (username == null || username.isBlank())
                ? null
                : "Basic " + Base64.getEncoder().encodeToString(
                        (username + ":" + (password == null ? "" : password)).getBytes(StandardCharsets.UTF_8));
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        this.http = HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .build();
    }

    /**
     * Connect and verify the server answers as CouchDB.
     *
     * @throws CouchDbException if the server is unreachable or rejects the credentials
     */
    public static CouchInstance create(String url, String username, String password, Duration requestTimeout) {
        CouchInstance instance = new CouchInstance(URI.create(url), username, password, requestTimeout);
        instance.verifyConnection();
        return instance;
    }

    private void verifyConnection() {
        HttpResponse<byte[]> resp = send(request("").GET());
        if (resp.statusCode() != 200) {
            throw errorFrom(resp);
        }
        JsonNode info = readJson(resp);
        LOG.info(() -> "Connected to CouchDB " + info.path("version").asText("?") + " at " + baseUri);
    }

    @Override
    public DocumentDatabase createDatabaseIfNotExists(String dbName) {
        CouchDatabase db = new CouchDatabase(this, dbName);
        db.createIfNotExists();
        return db;
    }

    @Override
    public void close() {
        // the HTTP client has nothing to release per instance
    }

    /** Request builder for {@code path} relative to the server root. */
    HttpRequest.Builder request(String path) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(baseUri.resolve(path))
                .timeout(requestTimeout)
                .header("Accept", "application/json");
        if (authorization != null) {
            builder.header("Authorization", authorization);
        }
        return builder;
    }

    HttpResponse<byte[]> send(HttpRequest.Builder builder) {
        HttpRequest request = builder.build();
        try {
            return http.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            throw new CouchDbException(0, "transport_error", request.method() + " " + request.uri() + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CouchDbException(0, "interrupted", request.method() + " " + request.uri() + " interrupted", e);
        }
    }

    static JsonNode readJson(HttpResponse<byte[]> resp) {
        try {
            return JsonDocuments.mapper().readTree(resp.body());
        } catch (IOException e) {
            throw new CouchDbException(resp.statusCode(), "bad_response", "Response is not valid JSON", e);
        }
    }

    /** CouchDB reports failures as {@code {"error": ..., "reason": ...}}. */
    static CouchDbException errorFrom(HttpResponse<byte[]> resp) {
        String error = "http_error";
        String reason = null;
        try {
            JsonNode body = JsonDocuments.mapper().readTree(resp.body());
            if (body != null) {
                error = body.path("error").asText(error);
                reason = body.path("reason").asText(null);
            }
        } catch (IOException e) {
            reason = new String(resp.body(), StandardCharsets.UTF_8);
        }
        return new CouchDbException(resp.statusCode(), error, reason);
    }

    static String encodePathSegment(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    static String encodeQueryValue(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
