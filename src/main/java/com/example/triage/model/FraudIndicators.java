package com.example.triage.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class FraudIndicators {
    private int inconsistencyScore;
    private List<String> suspiciousPatterns = new ArrayList<>();
    private List<String> validationFailures = new ArrayList<>();
    private FraudRecommendation recommendation = FraudRecommendation.ACCEPT;
}
