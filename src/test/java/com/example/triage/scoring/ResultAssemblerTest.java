package com.example.triage.scoring;

import com.example.triage.model.AssessmentResults;
import com.example.triage.model.FraudRecommendation;
import com.example.triage.model.ResponseSet;
import com.example.triage.model.RiskBand;
import com.example.triage.registry.DomainRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ResultAssembler")
class ResultAssemblerTest {

    private static final Instant COMPLETED_AT = Instant.parse("2025-03-10T12:00:00Z");

    private static final DomainRegistry REGISTRY = DomainRegistry.loadDefault();

    private final ResultAssembler assembler = new ResultAssembler(new ClinicalScorer(), new RiskClassifier(),
            new FraudDetector(), new GamificationScorer(REGISTRY), new DomainRiskScorer(REGISTRY));

    @Test
    @DisplayName("Should combine every score into the final result")
    void shouldAssembleResults() {
        // Given
        ResponseSet responses = ResponseSet.of(Map.of("age", 30, "phq9_1", 3, "phq9_2", 3, "phq9_3", 3, "phq9_4", 2));
        List<String> domains = new ArrayList<>(List.of("mental_health", "validation"));

        // When
        AssessmentResults results = assembler.assemble(responses, domains, false, COMPLETED_AT);
        domains.add("lifestyle");

        // Then
        assertThat(results.getClinicalScore().getPhq9()).isEqualTo(11);
        assertThat(results.getRiskAssessment().getOverall()).isEqualTo(20);
        assertThat(results.getRiskAssessment().getRiskBand()).isEqualTo(RiskBand.LOW);
        assertThat(results.getNextSteps()).isEqualTo(RiskBand.LOW.getNextSteps());
        assertThat(results.getFraudIndicators().getRecommendation()).isEqualTo(FraudRecommendation.ACCEPT);
        assertThat(results.getGamification()).isNotNull();
        assertThat(results.getRiskScores()).containsOnly(Map.entry("demographics", 1), Map.entry("mental_health", 11));
        assertThat(results.getTotalRiskScore()).isEqualTo(12);
        assertThat(results.getRecommendations())
                .containsExactly("Recomendamos conversar com um profissional de saúde mental");
        assertThat(results.getCompletedDomains()).containsExactly("mental_health", "validation");
        assertThat(results.getResponses()).isEqualTo(responses.asMap());
        assertThat(results.getCompletedAt()).isEqualTo(COMPLETED_AT);
        assertThat(results.isPartial()).isFalse();
    }

    @Test
    @DisplayName("Should produce the same result for the same answers")
    void shouldBeDeterministic() {
        ResponseSet responses = ResponseSet.of(Map.of("age", 70, "smoking_status", "current",
                "emergency_check", List.of("chest_pain")));

        AssessmentResults first = assembler.assemble(responses, List.of(), true, COMPLETED_AT);
        AssessmentResults second = assembler.assemble(responses, List.of(), true, COMPLETED_AT);

        assertThat(first).isEqualTo(second);
        assertThat(first.isPartial()).isTrue();
        assertThat(first.getNextSteps()).isEqualTo(RiskBand.CRITICAL.getNextSteps());
    }
}
