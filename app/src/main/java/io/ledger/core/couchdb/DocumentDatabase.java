package io.ledger.core.couchdb;

import java.util.List;
import java.util.Optional;

/**
 * One database inside a {@link DocumentStore}. Documents are addressed by string id and hold
 * either a JSON body or attachments.
 *
 * Every method throws {@link CouchDbException} for transport failures and store-side rejections.
 */
public interface DocumentDatabase {

    String name();

    /**
     * Document payload: the bytes of the {@code valueBytes} attachment when the document has one,
     * otherwise the JSON body without the {@code _id}/{@code _rev} fields. Empty when not found.
     */
    Optional<byte[]> readDoc(String id);

    /**
     * Create or replace a document and return its new revision.
     *
     * @param rev expected current revision, or {@code null} to overwrite whatever is stored
     * @param jsonBody JSON object body, or {@code null} for an attachment-only document
     * @param attachments attachments to store with the document, may be empty
     */
    String saveDoc(String id, String rev, byte[] jsonBody, List<Attachment> attachments);

    /** Documents with {@code startKey <= id < endKey} in id order, after skipping {@code skip}, at most {@code limit}. */
    List<DocumentRecord> readDocRange(String startKey, String endKey, int limit, int skip);

    /** Run a Mango query (JSON text with a {@code selector}). {@code limit} and {@code skip} override the query's own. */
    List<DocumentRecord> queryDocuments(String query, int limit, int skip);

    /** Make every write accepted so far durable. */
    FullCommitResponse ensureFullCommit();

    DatabaseInfo getDatabaseInfo();
}
