package io.ledger.core.couchdb;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * One CouchDB database reached over its REST API.
 */
public final class CouchDatabase implements DocumentDatabase {
    private static final Logger LOG = Logger.getLogger(CouchDatabase.class.getName());

    private final CouchInstance couch;
    private final String name;
    private final String dbPath;

    CouchDatabase(CouchInstance couch, String name) {
        this.couch = couch;
        this.name = name;
        this.dbPath = CouchInstance.encodePathSegment(name);
    }

    @Override
    public String name() {
        return name;
    }

    void createIfNotExists() {
        HttpResponse<byte[]> info = couch.send(couch.request(dbPath).GET());
        if (info.statusCode() == 200) {
            return;
        }
        if (info.statusCode() != 404) {
            throw CouchInstance.errorFrom(info);
        }
        HttpResponse<byte[]> resp = couch.send(couch.request(dbPath).PUT(HttpRequest.BodyPublishers.noBody()));
        int status = resp.statusCode();
        // 412: created concurrently by someone else
        if (status != 201 && status != 202 && status != 412) {
            throw CouchInstance.errorFrom(resp);
        }
        LOG.info(() -> "Created CouchDB database " + name);
    }

    @Override
    public Optional<byte[]> readDoc(String id) {
        return readRawDoc(id).map(JsonDocuments::payload);
    }

    private Optional<JsonNode> readRawDoc(String id) {
        HttpResponse<byte[]> resp = couch.send(couch.request(docPath(id) + "?attachments=true").GET());
        if (resp.statusCode() == 404) {
            return Optional.empty();
        }
        if (resp.statusCode() != 200) {
            throw CouchInstance.errorFrom(resp);
        }
        return Optional.of(CouchInstance.readJson(resp));
    }

    @Override
    public String saveDoc(String id, String rev, byte[] jsonBody, List<Attachment> attachments) {
        String targetRev = rev == null ? currentRevision(id) : rev;
        ObjectNode doc = JsonDocuments.buildDocument(id, targetRev, jsonBody, attachments);
        HttpResponse<byte[]> resp = couch.send(couch.request(docPath(id))
                .header("Content-Type", "application/json")
                .PUT(HttpRequest.BodyPublishers.ofByteArray(JsonDocuments.toBytes(doc))));
        if (resp.statusCode() != 201 && resp.statusCode() != 202) {
            throw CouchInstance.errorFrom(resp);
        }
        return CouchInstance.readJson(resp).path("rev").asText("");
    }

    /** Revision currently stored for {@code id}, from the ETag of a HEAD request; null when absent. */
    private String currentRevision(String id) {
        HttpResponse<byte[]> resp = couch.send(couch.request(docPath(id))
                .method("HEAD", HttpRequest.BodyPublishers.noBody()));
        if (resp.statusCode() == 404) {
            return null;
        }
        if (resp.statusCode() != 200) {
            throw new CouchDbException(resp.statusCode(), "http_error", "HEAD " + name + " document failed");
        }
        return resp.headers().firstValue("ETag")
                .map(etag -> etag.replace("\"", ""))
                .orElse(null);
    }

    @Override
    public List<DocumentRecord> readDocRange(String startKey, String endKey, int limit, int skip) {
        String query = "_all_docs?include_docs=true&attachments=true&inclusive_end=false"
                + "&startkey=" + CouchInstance.encodeQueryValue(jsonString(startKey))
                + "&endkey=" + CouchInstance.encodeQueryValue(jsonString(endKey))
                + "&limit=" + limit
                + "&skip=" + skip;
        HttpResponse<byte[]> resp = couch.send(couch.request(dbPath + "/" + query).GET());
        if (resp.statusCode() != 200) {
            throw CouchInstance.errorFrom(resp);
        }
        List<DocumentRecord> out = new ArrayList<>();
        for (JsonNode row : CouchInstance.readJson(resp).path("rows")) {
            JsonNode doc = row.get("doc");
            if (doc == null || !doc.isObject()) {
                continue;
            }
            out.add(new DocumentRecord(row.path("id").asText(), JsonDocuments.payload(doc)));
        }
        return out;
    }

    @Override
    public List<DocumentRecord> queryDocuments(String query, int limit, int skip) {
        ObjectNode find;
        try {
            JsonNode parsed = JsonDocuments.mapper().readTree(query);
            if (parsed == null || !parsed.isObject()) {
                throw new CouchDbException(400, "bad_request", "Query must be a JSON object");
            }
            find = (ObjectNode) parsed;
        } catch (IOException e) {
            throw new CouchDbException(400, "bad_request", "Query is not valid JSON", e);
        }
        find.put("limit", limit);
        find.put("skip", skip);
        HttpResponse<byte[]> resp = couch.send(couch.request(dbPath + "/_find")
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(JsonDocuments.toBytes(find))));
        if (resp.statusCode() != 200) {
            throw CouchInstance.errorFrom(resp);
        }
        JsonNode body = CouchInstance.readJson(resp);
        if (body.hasNonNull("warning")) {
            LOG.fine(() -> "_find warning on " + name + ": " + body.get("warning").asText());
        }
        List<DocumentRecord> out = new ArrayList<>();
        for (JsonNode doc : body.path("docs")) {
            String id = doc.path(JsonDocuments.ID).asText();
            // _find only returns attachment stubs
            if (JsonDocuments.hasAttachmentStub(doc)) {
                Optional<byte[]> value = readDoc(id);
                if (value.isPresent()) {
                    out.add(new DocumentRecord(id, value.get()));
                }
            } else {
                out.add(new DocumentRecord(id, JsonDocuments.payload(doc)));
            }
        }
        return out;
    }

    @Override
    public FullCommitResponse ensureFullCommit() {
        HttpResponse<byte[]> resp = couch.send(couch.request(dbPath + "/_ensure_full_commit")
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.noBody()));
        if (resp.statusCode() != 201 && resp.statusCode() != 200) {
            throw CouchInstance.errorFrom(resp);
        }
        JsonNode body = CouchInstance.readJson(resp);
        return new FullCommitResponse(body.path("ok").asBoolean(false), body.path("instance_start_time").asText(""));
    }

    @Override
    public DatabaseInfo getDatabaseInfo() {
        HttpResponse<byte[]> resp = couch.send(couch.request(dbPath).GET());
        if (resp.statusCode() != 200) {
            throw CouchInstance.errorFrom(resp);
        }
        JsonNode body = CouchInstance.readJson(resp);
        // CouchDB 1.x reports a number, 2.x an opaque string
        JsonNode seq = body.path("update_seq");
        String updateSeq = seq.isTextual() ? seq.asText() : seq.toString();
        return new DatabaseInfo(body.path("db_name").asText(name), updateSeq, body.path("doc_count").asLong());
    }

    private String docPath(String id) {
        return dbPath + "/" + CouchInstance.encodePathSegment(id);
    }

    private static String jsonString(String value) {
        return JsonDocuments.mapper().getNodeFactory().textNode(value).toString();
    }
}
