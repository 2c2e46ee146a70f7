package io.ledger.core.statedb;

/** Failure raised by the state database layer itself (as opposed to the backing store). */
public class StateDbException extends RuntimeException {

    public StateDbException(String message) {
        super(message);
    }

    public StateDbException(String message, Throwable cause) {
        super(message, cause);
    }
}
