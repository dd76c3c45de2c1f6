package com.example.triage.scoring;

import com.example.triage.model.AssessmentResults;
import com.example.triage.model.ClinicalScore;
import com.example.triage.model.FraudIndicators;
import com.example.triage.model.GamificationResult;
import com.example.triage.model.ResponseSet;
import com.example.triage.model.RiskAssessment;

import java.time.Instant;
import java.util.List;

/**
 * Executa os cálculos sobre as respostas, sem alterá-las, e consolida o
 * resultado da avaliação.
 */
public class ResultAssembler {

    private final ClinicalScorer clinicalScorer;
    private final RiskClassifier riskClassifier;
    private final FraudDetector fraudDetector;
    private final GamificationScorer gamificationScorer;
    private final DomainRiskScorer domainRiskScorer;

    public ResultAssembler(ClinicalScorer clinicalScorer, RiskClassifier riskClassifier,
                           FraudDetector fraudDetector, GamificationScorer gamificationScorer,
                           DomainRiskScorer domainRiskScorer) {
        this.clinicalScorer = clinicalScorer;
        this.riskClassifier = riskClassifier;
        this.fraudDetector = fraudDetector;
        this.gamificationScorer = gamificationScorer;
        this.domainRiskScorer = domainRiskScorer;
    }

    public AssessmentResults assemble(ResponseSet responses, List<String> completedDomains,
                                      boolean partial, Instant completedAt) {
        ClinicalScore clinical = clinicalScorer.score(responses);
        RiskAssessment risk = riskClassifier.classify(responses, clinical);
        FraudIndicators fraud = fraudDetector.detect(responses);
        GamificationResult gamification = gamificationScorer.score(responses, clinical, risk, fraud);
        DomainRiskProfile domainRisk = domainRiskScorer.score(responses);

        return AssessmentResults.builder()
                .responses(responses.asMap())
                .completedDomains(List.copyOf(completedDomains))
                .clinicalScore(clinical)
                .riskAssessment(risk)
                .fraudIndicators(fraud)
                .gamification(gamification)
                .riskScores(domainRisk.getScores())
                .totalRiskScore(domainRisk.getTotal())
                .recommendations(domainRisk.getRecommendations())
                .nextSteps(risk.getRiskBand().getNextSteps())
                .completedAt(completedAt)
                .partial(partial)
                .build();
    }
}
