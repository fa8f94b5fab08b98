package io.github.drompincen.opsledger.runtime.error;

/**
 * Base of the ledger's error taxonomy. The {@link #getCode() code} is stable and is
 * what API clients and job rows see.
 */
public abstract class LedgerException extends RuntimeException {

    private final String code;

    protected LedgerException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected LedgerException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
