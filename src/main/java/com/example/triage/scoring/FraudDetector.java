package com.example.triage.scoring;

import com.example.triage.model.FraudIndicators;
import com.example.triage.model.FraudRecommendation;
import com.example.triage.model.ResponseSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Detecta respostas inconsistentes ou padrões de preenchimento automático.
 * Todas as regras rodam sempre; os pontos são somados linearmente.
 */
public class FraudDetector {

    static final double HEIGHT_TOLERANCE_CM = 5.0;
    static final int MIN_BOOLEAN_ANSWERS = 10;
    static final int MIN_SCALE_ANSWERS = 5;
    static final List<String> SCALE_MARKERS = List.of("scale", "phq", "gad");

    static final List<FraudRule> RULES = List.of(
            new FraudRule("height_mismatch", 20, FraudRule.Kind.VALIDATION_FAILURE,
                    r -> differsBeyond(r, "height_confirmation", "height_recheck", HEIGHT_TOLERANCE_CM)),
            new FraudRule("smoking_contradiction", 30, FraudRule.Kind.VALIDATION_FAILURE,
                    r -> r.is("smoking_status", "never") && r.isTrue("smoking_advice")),
            new FraudRule("extreme_response_pattern", 25, FraudRule.Kind.SUSPICIOUS_PATTERN,
                    FraudDetector::uniformBooleans),
            new FraudRule("straight_line_responding", 20, FraudRule.Kind.SUSPICIOUS_PATTERN,
                    FraudDetector::straightLine),
            new FraudRule("unlikely_condition_count_for_age", 15, FraudRule.Kind.SUSPICIOUS_PATTERN,
                    r -> r.number("age").isPresent() && r.doubleValue("age") < 30
                            && RiskClassifier.countConditions(r) > 5),
            new FraudRule("surgery_without_hospitalization", 25, FraudRule.Kind.VALIDATION_FAILURE,
                    r -> isReported(r.get("surgeries")) && !isReported(r.get("hospitalization_history"))));

    public FraudIndicators detect(ResponseSet responses) {
        FraudIndicators indicators = new FraudIndicators();
        int score = 0;
        for (FraudRule rule : RULES) {
            if (!rule.matches(responses)) {
                continue;
            }
            score += rule.getPoints();
            if (rule.getKind() == FraudRule.Kind.VALIDATION_FAILURE) {
                indicators.getValidationFailures().add(rule.getName());
            } else {
                indicators.getSuspiciousPatterns().add(rule.getName());
            }
        }
        indicators.setInconsistencyScore(score);
        indicators.setRecommendation(FraudRecommendation.fromScore(score));
        return indicators;
    }

    private static boolean differsBeyond(ResponseSet r, String first, String second, double tolerance) {
        OptionalDouble a = r.number(first);
        OptionalDouble b = r.number(second);
        if (a.isEmpty() || b.isEmpty() || a.getAsDouble() == 0 || b.getAsDouble() == 0) {
            return false;
        }
        return Math.abs(a.getAsDouble() - b.getAsDouble()) > tolerance;
    }

    private static boolean uniformBooleans(ResponseSet r) {
        int total = 0;
        int trueCount = 0;
        for (Object value : r.asMap().values()) {
            if (value instanceof Boolean) {
                total++;
                if ((Boolean) value) trueCount++;
            }
        }
        return total >= MIN_BOOLEAN_ANSWERS && (trueCount == 0 || trueCount == total);
    }

    private static boolean straightLine(ResponseSet r) {
        List<Object> values = new ArrayList<>();
        for (Map.Entry<String, Object> entry : r.asMap().entrySet()) {
            if (SCALE_MARKERS.stream().anyMatch(entry.getKey()::contains)) {
                values.add(entry.getValue());
            }
        }
        return values.size() >= MIN_SCALE_ANSWERS && values.stream().distinct().count() == 1;
    }

    // resposta "informada": presente e diferente de false, zero, texto vazio
    private static boolean isReported(Object value) {
        if (value == null || Boolean.FALSE.equals(value)) return false;
        if (value instanceof Number) return ((Number) value).doubleValue() != 0;
        if (value instanceof String) return !((String) value).isEmpty();
        return true;
    }
}
