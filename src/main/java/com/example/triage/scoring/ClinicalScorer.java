package com.example.triage.scoring;

import com.example.triage.model.ClinicalScore;
import com.example.triage.model.ResponseSet;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Pontuação dos instrumentos clínicos validados (PHQ-9, GAD-7, AUDIT-C, WHO-5)
 * e da interferência da dor. Respostas ausentes contam como 0.
 */
public class ClinicalScorer {

    public static final List<String> PHQ9_ITEMS = items("phq9_", 9);
    public static final List<String> GAD7_ITEMS = items("gad7_", 7);
    public static final List<String> AUDIT_C_ITEMS = items("audit_c_", 3);
    public static final List<String> WHO5_ITEMS = items("who5_", 5);
    public static final List<String> PAIN_INTERFERENCE_ITEMS =
            List.of("pain_average", "pain_work_interference", "pain_sleep_interference");

    static final List<SeverityBand> PHQ9_SEVERITY = List.of(
            new SeverityBand(0, "minimal"),
            new SeverityBand(5, "mild"),
            new SeverityBand(10, "moderate"),
            new SeverityBand(15, "moderately_severe"),
            new SeverityBand(20, "severe"));

    static final List<SeverityBand> GAD7_SEVERITY = List.of(
            new SeverityBand(0, "minimal"),
            new SeverityBand(5, "mild"),
            new SeverityBand(10, "moderate"),
            new SeverityBand(15, "severe"));

    static final List<SeverityBand> AUDIT_C_SEVERITY = List.of(
            new SeverityBand(0, "low_risk"),
            new SeverityBand(3, "moderate_risk"),
            new SeverityBand(5, "high_risk"),
            new SeverityBand(8, "very_high_risk"));

    public ClinicalScore score(ResponseSet responses) {
        int phq9 = sum(responses, PHQ9_ITEMS);
        int gad7 = sum(responses, GAD7_ITEMS);
        int auditC = sum(responses, AUDIT_C_ITEMS);
        int who5 = sum(responses, WHO5_ITEMS);

        double painTotal = 0;
        for (String item : PAIN_INTERFERENCE_ITEMS) {
            painTotal += responses.doubleValue(item);
        }

        return ClinicalScore.builder()
                .phq9(phq9)
                .gad7(gad7)
                .auditC(auditC)
                .who5(who5)
                .who5Percent(who5 * 4)
                .painInterference(painTotal / PAIN_INTERFERENCE_ITEMS.size())
                .bmi(bmi(responses))
                .phq9Severity(SeverityBand.classify(PHQ9_SEVERITY, phq9))
                .gad7Severity(SeverityBand.classify(GAD7_SEVERITY, gad7))
                .auditCSeverity(SeverityBand.classify(AUDIT_C_SEVERITY, auditC))
                .build();
    }

    /**
     * IMC informado diretamente ou calculado a partir de peso (kg) e altura
     * (cm) confirmados. Sem os dois, não há IMC.
     */
    public Double bmi(ResponseSet responses) {
        OptionalDouble informed = responses.number("bmi");
        if (informed.isPresent()) {
            return informed.getAsDouble();
        }
        OptionalDouble height = responses.number("height_confirmation");
        OptionalDouble weight = responses.number("weight_confirmation");
        if (height.isEmpty() || weight.isEmpty() || height.getAsDouble() <= 0) {
            return null;
        }
        double meters = height.getAsDouble() / 100.0;
        return Math.round(weight.getAsDouble() / (meters * meters) * 10.0) / 10.0;
    }

    public static boolean isComplete(ResponseSet responses, List<String> items) {
        return items.stream().allMatch(responses::has);
    }

    private static int sum(ResponseSet responses, List<String> items) {
        int total = 0;
        for (String item : items) {
            total += responses.intValue(item);
        }
        return total;
    }

    private static List<String> items(String prefix, int count) {
        List<String> ids = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            ids.add(prefix + i);
        }
        return List.copyOf(ids);
    }
}
