package io.ledger.core.couchdb;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.Iterator;
import java.util.Map;

/**
 * Evaluates the part of the Mango selector language the embedded stores support:
 * implicit equality, {@code $eq $ne $gt $gte $lt $lte $in $nin $exists}, {@code $and $or $not}
 * and dotted field paths. Anything else is rejected with a 400, as CouchDB would.
 */
public final class SelectorMatcher {

    private final JsonNode selector;

    private SelectorMatcher(JsonNode selector) {
        this.selector = selector;
    }

    /** Parse a Mango query document, e.g. {@code {"selector":{"owner":"tom"}}}. */
    public static SelectorMatcher parse(String query) {
        JsonNode root;
        try {
            root = JsonDocuments.mapper().readTree(query == null ? "" : query);
        } catch (IOException e) {
            throw new CouchDbException(400, "bad_request", "Query is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new CouchDbException(400, "bad_request", "Query must be a JSON object");
        }
        JsonNode selector = root.get("selector");
        if (selector == null || !selector.isObject()) {
            throw new CouchDbException(400, "missing_required_key", "Missing required key: selector");
        }
        validate(selector);
        return new SelectorMatcher(selector);
    }

    public boolean matches(JsonNode doc) {
        return matchesSelector(doc, selector);
    }

    private static boolean matchesSelector(JsonNode doc, JsonNode selector) {
        Iterator<Map.Entry<String, JsonNode>> fields = selector.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            JsonNode cond = field.getValue();
            boolean ok;
            switch (name) {
                case "$and":
                    ok = true;
                    for (JsonNode sub : cond) {
                        ok &= matchesSelector(doc, sub);
                    }
                    break;
                case "$or":
                    ok = false;
                    for (JsonNode sub : cond) {
                        ok |= matchesSelector(doc, sub);
                    }
                    break;
                case "$not":
                    ok = !matchesSelector(doc, cond);
                    break;
                default:
                    ok = matchesField(resolve(doc, name), cond);
            }
            if (!ok) {
                return false;
            }
        }
        return true;
    }

    private static boolean matchesField(JsonNode value, JsonNode cond) {
        if (!isOperatorObject(cond)) {
            return value != null && value.equals(cond);
        }
        Iterator<Map.Entry<String, JsonNode>> ops = cond.fields();
        while (ops.hasNext()) {
            Map.Entry<String, JsonNode> op = ops.next();
            JsonNode arg = op.getValue();
            boolean ok;
            switch (op.getKey()) {
                case "$eq": ok = value != null && value.equals(arg); break;
                case "$ne": ok = value == null || !value.equals(arg); break;
                case "$gt": ok = comparable(value, arg) && compare(value, arg) > 0; break;
                case "$gte": ok = comparable(value, arg) && compare(value, arg) >= 0; break;
                case "$lt": ok = comparable(value, arg) && compare(value, arg) < 0; break;
                case "$lte": ok = comparable(value, arg) && compare(value, arg) <= 0; break;
                case "$in": ok = value != null && contains(arg, value); break;
                case "$nin": ok = value == null || !contains(arg, value); break;
                case "$exists": ok = (value != null) == arg.asBoolean(); break;
                default:
                    throw new CouchDbException(400, "invalid_operator", "Invalid operator: " + op.getKey());
            }
            if (!ok) {
                return false;
            }
        }
        return true;
    }

    private static JsonNode resolve(JsonNode doc, String path) {
        JsonNode current = doc;
        for (String part : path.split("\\.")) {
            if (current == null || !current.isObject()) {
                return null;
            }
            current = current.get(part);
        }
        return current;
    }

    /** Range operators only relate two numbers or two strings. */
    private static boolean comparable(JsonNode value, JsonNode arg) {
        return value != null
                && ((value.isNumber() && arg.isNumber()) || (value.isTextual() && arg.isTextual()));
    }

    private static int compare(JsonNode value, JsonNode arg) {
        if (value.isNumber()) {
            return value.decimalValue().compareTo(arg.decimalValue());
        }
        return value.asText().compareTo(arg.asText());
    }

    private static boolean contains(JsonNode array, JsonNode value) {
        for (JsonNode candidate : array) {
            if (candidate.equals(value)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isOperatorObject(JsonNode cond) {
        if (!cond.isObject() || cond.size() == 0) {
            return false;
        }
        return cond.fieldNames().next().startsWith("$");
    }

    private static void validate(JsonNode selector) {
        Iterator<Map.Entry<String, JsonNode>> fields = selector.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            JsonNode cond = field.getValue();
            if (name.equals("$and") || name.equals("$or")) {
                if (!cond.isArray()) {
                    throw new CouchDbException(400, "bad_request", name + " requires an array");
                }
                for (JsonNode sub : cond) {
                    validate(sub);
                }
            } else if (name.equals("$not")) {
                validate(cond);
            } else if (name.startsWith("$")) {
                throw new CouchDbException(400, "invalid_operator", "Invalid operator: " + name);
            } else if (isOperatorObject(cond)) {
                Iterator<Map.Entry<String, JsonNode>> ops = cond.fields();
                while (ops.hasNext()) {
                    Map.Entry<String, JsonNode> op = ops.next();
                    String key = op.getKey();
                    if ((key.equals("$in") || key.equals("$nin")) && !op.getValue().isArray()) {
                        throw new CouchDbException(400, "bad_request", key + " requires an array");
                    }
                }
            }
        }
    }
}
