package com.example.triage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Resultado consolidado de uma avaliação. {@code partial} indica que a
 * sessão foi abandonada antes do fim e o cálculo é apenas uma estimativa.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssessmentResults {
    private Map<String, Object> responses;
    private List<String> completedDomains;
    private ClinicalScore clinicalScore;
    private RiskAssessment riskAssessment;
    private FraudIndicators fraudIndicators;
    private GamificationResult gamification;
    // risco acumulado por domínio, a partir dos pesos do catálogo
    private Map<String, Integer> riskScores;
    private int totalRiskScore;
    private List<String> recommendations;
    private List<String> nextSteps;
    private Instant completedAt;
    private boolean partial;
}
