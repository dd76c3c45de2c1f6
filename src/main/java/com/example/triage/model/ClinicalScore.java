package com.example.triage.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ClinicalScore {
    private int phq9;
    private int gad7;
    private int auditC;
    private int who5;
    private int who5Percent;
    private double painInterference;
    private Double bmi;
    private String phq9Severity;
    private String gad7Severity;
    private String auditCSeverity;

    public Map<String, Number> toMap() {
        Map<String, Number> scores = new LinkedHashMap<>();
        scores.put("phq9", phq9);
        scores.put("gad7", gad7);
        scores.put("audit_c", auditC);
        scores.put("who5", who5);
        scores.put("pain_interference", painInterference);
        if (bmi != null) {
            scores.put("bmi", bmi);
        }
        return scores;
    }
}
