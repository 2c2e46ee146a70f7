package io.ledger.core.couchdb;

/**
 * Transport failure or store-side rejection. {@code status} is the HTTP status, or 0 when the
 * request never got a response.
 */
public class CouchDbException extends RuntimeException {
    private final int status;
    private final String error;
    private final String reason;

    public CouchDbException(int status, String error, String reason) {
        super(format(status, error, reason));
        this.status = status;
        this.error = error;
        this.reason = reason;
    }

    public CouchDbException(int status, String error, String reason, Throwable cause) {
        super(format(status, error, reason), cause);
        this.status = status;
        this.error = error;
        this.reason = reason;
    }

    public int status() { return status; }
    public String error() { return error; }
    public String reason() { return reason; }

    private static String format(int status, String error, String reason) {
        StringBuilder sb = new StringBuilder();
        if (status > 0) {
            sb.append("HTTP ").append(status).append(' ');
        }
        sb.append(error == null ? "unknown_error" : error);
        if (reason != null && !reason.isBlank()) {
            sb.append(": ").append(reason);
        }
        return sb.toString();
    }
}
