package com.example.triage.scoring;

import com.example.triage.model.ClinicalScore;
import com.example.triage.model.ResponseSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ClinicalScorer")
class ClinicalScorerTest {

    private final ClinicalScorer scorer = new ClinicalScorer();

    private static Map<String, Object> answerAll(List<String> items, int value) {
        Map<String, Object> answers = new HashMap<>();
        items.forEach(item -> answers.put(item, value));
        return answers;
    }

    @Test
    @DisplayName("Should sum instrument items and classify severity")
    void shouldSumInstruments() {
        // Given
        Map<String, Object> answers = answerAll(ClinicalScorer.PHQ9_ITEMS, 2);
        answers.putAll(answerAll(ClinicalScorer.GAD7_ITEMS, 1));
        answers.putAll(answerAll(ClinicalScorer.WHO5_ITEMS, 3));
        answers.put("audit_c_1", 4);
        answers.put("audit_c_2", 4);

        // When
        ClinicalScore score = scorer.score(ResponseSet.of(answers));

        // Then
        assertThat(score.getPhq9()).isEqualTo(18);
        assertThat(score.getPhq9Severity()).isEqualTo("moderately_severe");
        assertThat(score.getGad7()).isEqualTo(7);
        assertThat(score.getGad7Severity()).isEqualTo("mild");
        assertThat(score.getAuditC()).isEqualTo(8);
        assertThat(score.getAuditCSeverity()).isEqualTo("very_high_risk");
        assertThat(score.getWho5()).isEqualTo(15);
        assertThat(score.getWho5Percent()).isEqualTo(60);
    }

    @Test
    @DisplayName("Should count missing items as zero")
    void shouldTreatMissingAsZero() {
        ClinicalScore score = scorer.score(ResponseSet.of(Map.of("phq9_1", 3, "phq9_2", 2)));

        assertThat(score.getPhq9()).isEqualTo(5);
        assertThat(score.getPhq9Severity()).isEqualTo("mild");
        assertThat(score.getGad7()).isZero();
        assertThat(score.getGad7Severity()).isEqualTo("minimal");
        assertThat(score.getPainInterference()).isZero();
        assertThat(score.getBmi()).isNull();
    }

    @ParameterizedTest(name = "PHQ-9 {0} -> {1}")
    @CsvSource({
            "4, minimal",
            "5, mild",
            "9, mild",
            "10, moderate",
            "14, moderate",
            "15, moderately_severe",
            "19, moderately_severe",
            "20, severe",
            "27, severe"
    })
    @DisplayName("Should apply PHQ-9 severity cut-offs")
    void shouldApplyPhq9CutOffs(int total, String expected) {
        assertThat(SeverityBand.classify(ClinicalScorer.PHQ9_SEVERITY, total)).isEqualTo(expected);
    }

    @ParameterizedTest(name = "GAD-7 {0} -> {1}")
    @CsvSource({
            "0, minimal",
            "4, minimal",
            "5, mild",
            "9, mild",
            "10, moderate",
            "14, moderate",
            "15, severe",
            "21, severe"
    })
    @DisplayName("Should apply GAD-7 severity cut-offs")
    void shouldApplyGad7CutOffs(int total, String expected) {
        Map<String, Object> answers = new HashMap<>();
        int remaining = total;
        for (String item : ClinicalScorer.GAD7_ITEMS) {
            int value = Math.min(3, remaining);
            answers.put(item, value);
            remaining -= value;
        }

        ClinicalScore score = scorer.score(ResponseSet.of(answers));

        assertThat(score.getGad7()).isEqualTo(total);
        assertThat(score.getGad7Severity()).isEqualTo(expected);
    }

    @ParameterizedTest(name = "AUDIT-C {0} -> {1}")
    @CsvSource({
            "2, low_risk",
            "3, moderate_risk",
            "4, moderate_risk",
            "5, high_risk",
            "7, high_risk",
            "8, very_high_risk"
    })
    @DisplayName("Should apply AUDIT-C severity cut-offs")
    void shouldApplyAuditCutOffs(int total, String expected) {
        assertThat(SeverityBand.classify(ClinicalScorer.AUDIT_C_SEVERITY, total)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should average the pain interference items")
    void shouldAveragePainInterference() {
        ClinicalScore score = scorer.score(ResponseSet.of(Map.of(
                "pain_average", 6, "pain_work_interference", 4, "pain_sleep_interference", 5)));

        assertThat(score.getPainInterference()).isEqualTo(5.0);
    }

    @Test
    @DisplayName("Should derive BMI from confirmed height and weight")
    void shouldDeriveBmi() {
        ResponseSet responses = ResponseSet.of(Map.of("height_confirmation", 180, "weight_confirmation", 81));

        assertThat(scorer.bmi(responses)).isEqualTo(25.0);
        assertThat(scorer.bmi(ResponseSet.of(Map.of("height_confirmation", 170, "weight_confirmation", 95))))
                .isEqualTo(32.9);
    }

    @Test
    @DisplayName("Should prefer an informed BMI and skip it when data is missing")
    void shouldPreferInformedBmi() {
        assertThat(scorer.bmi(ResponseSet.of(Map.of("bmi", 27.4, "height_confirmation", 180,
                "weight_confirmation", 81)))).isEqualTo(27.4);
        assertThat(scorer.bmi(ResponseSet.of(Map.of("height_confirmation", 180)))).isNull();
    }

    @Test
    @DisplayName("Should report instrument completeness")
    void shouldReportCompleteness() {
        ResponseSet full = ResponseSet.of(answerAll(ClinicalScorer.GAD7_ITEMS, 0));

        assertThat(ClinicalScorer.isComplete(full, ClinicalScorer.GAD7_ITEMS)).isTrue();
        assertThat(ClinicalScorer.isComplete(full, ClinicalScorer.PHQ9_ITEMS)).isFalse();
    }

    @Test
    @DisplayName("Should expose scores as a flat map")
    void shouldExposeScoreMap() {
        ClinicalScore score = scorer.score(ResponseSet.of(Map.of("height_confirmation", 180, "weight_confirmation", 81)));

        assertThat(score.toMap()).containsKeys("phq9", "gad7", "audit_c", "who5", "pain_interference", "bmi");
        assertThat(scorer.score(ResponseSet.empty()).toMap()).doesNotContainKey("bmi");
    }
}
