package com.example.triage.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RiskCategory {
    CARDIOVASCULAR("cardiovascular"),
    MENTAL_HEALTH("mental_health"),
    SUBSTANCE_ABUSE("substance_abuse"),
    CHRONIC_DISEASE("chronic_disease"),
    ALLERGY_RISK("allergy_risk"),
    SAFETY_RISK("safety_risk");

    private final String code;

    RiskCategory(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
