package io.github.drompincen.opsledger.gateway.controller;

import io.github.drompincen.opsledger.protocol.api.BudgetDto;
import io.github.drompincen.opsledger.protocol.api.BudgetUpdateRequest;
import io.github.drompincen.opsledger.runtime.budget.BudgetLedger;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/agentic/profiles/{agentId}/budget")
public class BudgetController {

    private final BudgetLedger budgetLedger;

    public BudgetController(BudgetLedger budgetLedger) {
        this.budgetLedger = budgetLedger;
    }

    @GetMapping
    public BudgetDto get(@PathVariable String agentId) {
        return budgetLedger.snapshot(agentId);
    }

    @PutMapping
    public BudgetDto update(@PathVariable String agentId, @RequestBody BudgetUpdateRequest req) {
        budgetLedger.updateCap(agentId, req.dailyCapUsd(), req.enforcement());
        return budgetLedger.snapshot(agentId);
    }

    @PostMapping("/reset")
    public BudgetDto reset(@PathVariable String agentId) {
        budgetLedger.reset(agentId);
        return budgetLedger.snapshot(agentId);
    }
}
