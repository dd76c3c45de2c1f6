package com.example.triage.model;

public enum FlowStage {
    NOT_STARTED,
    TRIAGE,
    AWAITING_CONTINUE,
    DOMAIN_ACTIVE,
    COMPLETE,
    ABANDONED;

    public boolean isFinished() {
        return this == COMPLETE || this == ABANDONED;
    }
}
