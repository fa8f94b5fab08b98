package io.github.drompincen.opsledger.runtime.budget;

import java.math.BigDecimal;

public record CommitResult(boolean committed, BigDecimal cost, BigDecimal usedAfter, BigDecimal cap,
                           BudgetThreshold threshold) {

    public static CommitResult rejected(BigDecimal cost, BigDecimal used, BigDecimal cap) {
        return new CommitResult(false, cost, used, cap, BudgetThreshold.EXCEEDED);
    }
}
