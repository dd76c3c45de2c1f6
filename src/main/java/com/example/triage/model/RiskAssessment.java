package com.example.triage.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pontuação de risco por categoria, com flags e recomendações acumuladas
 * pelas regras do {@code RiskClassifier}.
 */
@Data
public class RiskAssessment {
    private int overall;
    private Map<String, Integer> categories = new LinkedHashMap<>();
    private List<String> flags = new ArrayList<>();
    private List<String> recommendations = new ArrayList<>();
    private RiskBand riskBand = RiskBand.LOW;

    public RiskAssessment() {
        for (RiskCategory category : RiskCategory.values()) {
            categories.put(category.getCode(), 0);
        }
    }

    public void add(RiskCategory category, int points) {
        categories.merge(category.getCode(), points, Integer::sum);
    }

    public void flag(String flag) {
        if (!flags.contains(flag)) {
            flags.add(flag);
        }
    }

    public void recommend(String recommendation) {
        if (!recommendations.contains(recommendation)) {
            recommendations.add(recommendation);
        }
    }

    @JsonIgnore
    public int getCategory(RiskCategory category) {
        return categories.getOrDefault(category.getCode(), 0);
    }

    public boolean hasFlag(String flag) {
        return flags.contains(flag);
    }
}
