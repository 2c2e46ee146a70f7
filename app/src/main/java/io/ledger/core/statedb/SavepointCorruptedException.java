package io.ledger.core.statedb;

import io.ledger.core.version.Height;

/**
 * The savepoint document exists but cannot be decoded. Recovery code may fall back to
 * {@link #fallbackHeight()} or halt.
 */
public class SavepointCorruptedException extends StateDbException {
    private final Height fallbackHeight;

    public SavepointCorruptedException(String message, Throwable cause) {
        super(message, cause);
        this.fallbackHeight = Height.ZERO;
    }

    public Height fallbackHeight() {
        return fallbackHeight;
    }
}
