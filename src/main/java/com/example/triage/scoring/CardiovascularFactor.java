package com.example.triage.scoring;

import com.example.triage.model.ClinicalScore;
import com.example.triage.model.ResponseSet;

import java.util.function.BiPredicate;

public enum CardiovascularFactor {
    HYPERTENSION((r, s) -> r.listContains("chronic_conditions", "hypertension")),
    DIABETES((r, s) -> r.listContains("chronic_conditions", "diabetes")),
    HEART_DISEASE((r, s) -> r.listContains("chronic_conditions", "heart_disease")),
    CURRENT_SMOKER((r, s) -> r.is("smoking_status", "current")),
    OBESITY((r, s) -> s.getBmi() != null && s.getBmi() > 30),
    // só conta quando a frequência foi respondida
    SEDENTARY((r, s) -> r.number("exercise_frequency").isPresent() && r.doubleValue("exercise_frequency") < 3),
    FAMILY_HEART_DISEASE((r, s) -> r.isTrue("family_heart_disease")),
    FREQUENT_DRINKING((r, s) -> r.intValue("audit_c_1") >= 3),
    AGE_OVER_65((r, s) -> r.doubleValue("age") > 65);

    public static final int POINTS_PER_FACTOR = 12;

    private final BiPredicate<ResponseSet, ClinicalScore> present;

    CardiovascularFactor(BiPredicate<ResponseSet, ClinicalScore> present) {
        this.present = present;
    }

    public boolean isPresent(ResponseSet responses, ClinicalScore score) {
        return present.test(responses, score);
    }
}
