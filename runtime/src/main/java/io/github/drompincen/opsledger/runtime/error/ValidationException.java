package io.github.drompincen.opsledger.runtime.error;

/** Malformed or out-of-range input. */
public class ValidationException extends LedgerException {

    public static final String CODE = "VALIDATION_ERROR";

    public ValidationException(String message) {
        super(CODE, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
