package com.example.triage.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FraudRecommendation {
    ACCEPT("accept"),
    REVIEW("review"),
    FLAG("flag");

    private final String code;

    FraudRecommendation(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static FraudRecommendation fromScore(int inconsistencyScore) {
        if (inconsistencyScore >= 50) return FLAG;
        if (inconsistencyScore >= 25) return REVIEW;
        return ACCEPT;
    }
}
