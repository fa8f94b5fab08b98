package io.github.drompincen.opsledger.runtime.error;

public class ExecutionTimeoutException extends LedgerException {

    public static final String CODE = "EXECUTION_TIMEOUT";

    public ExecutionTimeoutException(String message) {
        super(CODE, message);
    }

    public ExecutionTimeoutException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
