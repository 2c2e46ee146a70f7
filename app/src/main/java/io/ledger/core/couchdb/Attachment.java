package io.ledger.core.couchdb;

import java.util.Objects;

/** Named binary attachment of a document. */
public final class Attachment {
    private final String name;
    private final String contentType;
    private final byte[] data;

    public Attachment(String name, String contentType, byte[] data) {
        this.name = Objects.requireNonNull(name, "name");
        this.contentType = Objects.requireNonNull(contentType, "contentType");
        this.data = Objects.requireNonNull(data, "data").clone();
    }

    public String name() { return name; }
    public String contentType() { return contentType; }
    public byte[] data() { return data.clone(); }
}
