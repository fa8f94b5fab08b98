package io.github.drompincen.opsledger.protocol.api;

import java.math.BigDecimal;

public record BudgetUpdateRequest(BigDecimal dailyCapUsd, EnforcementMode enforcement) {}
