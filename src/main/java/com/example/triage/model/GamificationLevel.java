package com.example.triage.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum GamificationLevel {
    BRONZE("bronze", 0),
    SILVER("silver", 75),
    GOLD("gold", 85),
    PLATINUM("platinum", 95);

    private final String code;
    private final int minScore;

    GamificationLevel(String code, int minScore) {
        this.code = code;
        this.minScore = minScore;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static GamificationLevel fromScore(double healthScore) {
        GamificationLevel level = BRONZE;
        for (GamificationLevel candidate : values()) {
            if (healthScore >= candidate.minScore) {
                level = candidate;
            }
        }
        return level;
    }
}
