package io.github.drompincen.opsledger.runtime.error;

/** A channel refused or could not take a notification. Retried by the dispatcher. */
public class DeliveryFailureException extends LedgerException {

    public static final String CODE = "DELIVERY_FAILURE";

    public DeliveryFailureException(String message) {
        super(CODE, message);
    }

    public DeliveryFailureException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
