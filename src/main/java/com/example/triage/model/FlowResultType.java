package com.example.triage.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FlowResultType {
    QUESTION("question"),
    DOMAIN_TRANSITION("domain_transition"),
    COMPLETE("complete");

    private final String code;

    FlowResultType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
