package io.github.drompincen.opsledger.gateway.controller;

import io.github.drompincen.opsledger.protocol.api.BudgetDto;
import io.github.drompincen.opsledger.protocol.api.BudgetUpdateRequest;
import io.github.drompincen.opsledger.protocol.api.EnforcementMode;
import io.github.drompincen.opsledger.runtime.budget.BudgetLedger;
import io.github.drompincen.opsledger.runtime.error.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BudgetControllerTest {

    @Mock private BudgetLedger budgetLedger;

    private BudgetController controller;

    @BeforeEach
    void setUp() {
        controller = new BudgetController(budgetLedger);
    }

    private BudgetDto snapshot(String cap, String used) {
        BigDecimal c = new BigDecimal(cap);
        BigDecimal u = new BigDecimal(used);
        return new BudgetDto("agent-1", "2026-03-02", c, u, BigDecimal.ZERO, c.subtract(u).max(BigDecimal.ZERO),
                0, EnforcementMode.HARD, false);
    }

    @Test
    void updateAppliesCapAndReturnsFreshSnapshot() {
        when(budgetLedger.snapshot("agent-1")).thenReturn(snapshot("5.00", "1.00"));

        BudgetDto dto = controller.update("agent-1", new BudgetUpdateRequest(new BigDecimal("5.00"), null));

        verify(budgetLedger).updateCap("agent-1", new BigDecimal("5.00"), null);
        assertThat(dto.remainingUsd()).isEqualByComparingTo("4.00");
    }

    @Test
    void negativeCapIsRejected() {
        when(budgetLedger.updateCap(any(), any(), any())).thenThrow(new ValidationException("daily cap must not be negative"));

        assertThatThrownBy(() -> controller.update("agent-1", new BudgetUpdateRequest(new BigDecimal("-1"), null)))
                .isInstanceOf(ValidationException.class);
        verify(budgetLedger, never()).snapshot(any());
    }

    @Test
    void resetZeroesUsed() {
        when(budgetLedger.snapshot("agent-1")).thenReturn(snapshot("10.00", "0"));

        BudgetDto dto = controller.reset("agent-1");

        verify(budgetLedger).reset("agent-1");
        assertThat(dto.usedUsd()).isEqualByComparingTo("0");
    }
}
