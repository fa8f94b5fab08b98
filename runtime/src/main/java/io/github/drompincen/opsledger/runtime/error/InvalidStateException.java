package io.github.drompincen.opsledger.runtime.error;

/** A transition was attempted from a state that does not allow it. */
public class InvalidStateException extends LedgerException {

    public static final String CODE = "INVALID_STATE";

    public InvalidStateException(String message) {
        super(CODE, message);
    }

    public InvalidStateException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
