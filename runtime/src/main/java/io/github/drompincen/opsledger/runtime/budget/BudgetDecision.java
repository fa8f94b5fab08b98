package io.github.drompincen.opsledger.runtime.budget;

import java.math.BigDecimal;

/**
 * Result of {@link BudgetLedger#reserve}. On {@code DENY} nothing was reserved.
 */
public record BudgetDecision(Outcome outcome, BudgetThreshold threshold, String periodKey,
                             BigDecimal reserved, String reason) {

    public enum Outcome { ALLOW, ALLOW_WITH_WARNING, DENY }

    public static BudgetDecision allow(String periodKey, BigDecimal reserved) {
        return new BudgetDecision(Outcome.ALLOW, null, periodKey, reserved, null);
    }

    public static BudgetDecision warn(String periodKey, BigDecimal reserved, BudgetThreshold threshold) {
        return new BudgetDecision(Outcome.ALLOW_WITH_WARNING, threshold, periodKey, reserved, null);
    }

    public static BudgetDecision deny(String periodKey, String reason) {
        return new BudgetDecision(Outcome.DENY, null, periodKey, BigDecimal.ZERO, reason);
    }

    public boolean allowed() {
        return outcome != Outcome.DENY;
    }
}
