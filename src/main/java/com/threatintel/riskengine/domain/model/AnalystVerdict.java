package com.threatintel.riskengine.domain.model;

public enum AnalystVerdict {
    RULES_CORRECT,
    SECONDARY_CORRECT,
    INCONCLUSIVE
}
