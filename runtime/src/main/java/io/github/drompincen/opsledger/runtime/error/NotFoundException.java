package io.github.drompincen.opsledger.runtime.error;

public class NotFoundException extends LedgerException {

    public static final String CODE = "NOT_FOUND";

    public NotFoundException(String message) {
        super(CODE, message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(CODE, message, cause);
    }

    public static NotFoundException of(String what, String id) {
        return new NotFoundException(what + " not found: " + id);
    }
}
