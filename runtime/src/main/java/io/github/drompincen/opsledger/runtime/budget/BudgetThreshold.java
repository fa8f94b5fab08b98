package io.github.drompincen.opsledger.runtime.budget;

public enum BudgetThreshold {
    /** Spend reached the warning percentage of the daily cap. */
    WARNING,
    /** Spend went above the daily cap (soft enforcement only). */
    EXCEEDED
}
