package io.github.drompincen.opsledger.runtime.error;

/** Hard-cap denial from the budget ledger. */
public class BudgetExceededException extends LedgerException {

    public static final String CODE = "BUDGET_EXCEEDED";

    public BudgetExceededException(String message) {
        super(CODE, message);
    }

    public BudgetExceededException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
