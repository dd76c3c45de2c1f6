package com.example.triage.scoring;

import com.example.triage.model.ClinicalScore;
import com.example.triage.model.ResponseSet;
import com.example.triage.model.RiskAssessment;
import lombok.Value;

@Value
public class RiskRule {
    String name;
    Action action;

    @FunctionalInterface
    public interface Action {
        void apply(ResponseSet responses, ClinicalScore score, RiskAssessment assessment);
    }

    public void apply(ResponseSet responses, ClinicalScore score, RiskAssessment assessment) {
        action.apply(responses, score, assessment);
    }
}
