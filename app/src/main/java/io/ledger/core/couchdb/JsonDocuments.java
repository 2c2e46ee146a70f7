package io.ledger.core.couchdb;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.util.Arrays;
import java.util.Base64;
import java.util.Iterator;
import java.util.List;

/**
 * Helpers for the CouchDB document shape shared by every {@link DocumentStore}:
 * a JSON object with reserved {@code _id}, {@code _rev} and {@code _attachments} members,
 * attachments inlined as base64.
 */
public final class JsonDocuments {

    public static final String ID = "_id";
    public static final String REV = "_rev";
    public static final String ATTACHMENTS = "_attachments";

    /** Attachment that carries an opaque value. */
    public static final String VALUE_ATTACHMENT = "valueBytes";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private JsonDocuments() {}

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Decides whether a value is stored as a document body. True when {@code value} is UTF-8
     * text holding exactly one JSON object that
     * <ul>
     *   <li>has no top-level member starting with an underscore (CouchDB reserves those), and</li>
     *   <li>is already in the compact form the store hands back, so a read returns the same bytes.</li>
     * </ul>
     * Everything else, JSON scalars and arrays included, is stored as an opaque attachment.
     */
    public static boolean isJsonObject(byte[] value) {
        if (value == null || value.length == 0) {
            return false;
        }
        JsonNode node;
        try {
            node = MAPPER.readTree(value);
        } catch (IOException e) {
            return false;
        }
        if (node == null || !node.isObject()) {
            return false;
        }
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            if (names.next().startsWith("_")) {
                return false;
            }
        }
        return Arrays.equals(toBytes(node), value);
    }

    /** Parse bytes into a document object; the store rejects anything else. */
    public static ObjectNode parseObject(byte[] json) {
        try {
            JsonNode node = MAPPER.readTree(json);
            if (node == null || !node.isObject()) {
                throw new CouchDbException(400, "bad_request", "Document must be a JSON object");
            }
            return (ObjectNode) node;
        } catch (IOException e) {
            throw new CouchDbException(400, "bad_request", "Invalid UTF-8 JSON", e);
        }
    }

    /** Build the wire form of a document. Attachments are inlined as base64. */
    public static ObjectNode buildDocument(String id, String rev, byte[] jsonBody, List<Attachment> attachments) {
        ObjectNode doc = MAPPER.createObjectNode();
        doc.put(ID, id);
        if (rev != null && !rev.isEmpty()) {
            doc.put(REV, rev);
        }
        if (jsonBody != null) {
            ObjectNode body = parseObject(jsonBody);
            body.remove(ID);
            body.remove(REV);
            doc.setAll(body);
        }
        if (attachments != null && !attachments.isEmpty()) {
            ObjectNode atts = doc.putObject(ATTACHMENTS);
            for (Attachment attachment : attachments) {
                atts.putObject(attachment.name())
                        .put("content_type", attachment.contentType())
                        .put("data", Base64.getEncoder().encodeToString(attachment.data()));
            }
        }
        return doc;
    }

    /**
     * Payload of a stored document: the decoded {@code valueBytes} attachment when present,
     * otherwise the body with the reserved members removed.
     */
    public static byte[] payload(JsonNode doc) {
        JsonNode data = doc.path(ATTACHMENTS).path(VALUE_ATTACHMENT).path("data");
        if (data.isTextual()) {
            return Base64.getDecoder().decode(data.asText());
        }
        ObjectNode body = ((ObjectNode) doc).deepCopy();
        body.remove(ID);
        body.remove(REV);
        body.remove(ATTACHMENTS);
        return toBytes(body);
    }

    /** True when the document carries an attachment stub without inline data. */
    public static boolean hasAttachmentStub(JsonNode doc) {
        JsonNode value = doc.path(ATTACHMENTS).path(VALUE_ATTACHMENT);
        return !value.isMissingNode() && !value.path("data").isTextual();
    }

    public static byte[] toBytes(JsonNode node) {
        try {
            return MAPPER.writeValueAsBytes(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize JSON document", e);
        }
    }
}
