package com.example.triage.scoring;

import com.example.triage.model.Question;
import com.example.triage.model.QuestionOption;
import com.example.triage.model.ResponseSet;
import com.example.triage.registry.DomainRegistry;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Risco acumulado por domínio a partir dos pesos declarados no catálogo:
 * cada pergunta respondida soma seu {@code riskWeight} e o {@code riskScore}
 * das opções escolhidas. Respostas sim/não só contam o peso da pergunta.
 */
public class DomainRiskScorer {

    @Value
    static class DomainAdvice {
        String domainId;
        int threshold;
        String recommendation;
    }

    static final List<DomainAdvice> ADVICE = List.of(
            new DomainAdvice("pain_management", 5, "Considere consultar um especialista em manejo da dor"),
            new DomainAdvice("mental_health", 5, "Recomendamos conversar com um profissional de saúde mental"),
            new DomainAdvice("lifestyle", 8,
                    "Mudanças no estilo de vida podem melhorar significativamente sua saúde"));

    private final DomainRegistry registry;

    public DomainRiskScorer(DomainRegistry registry) {
        this.registry = registry;
    }

    public DomainRiskProfile score(ResponseSet responses) {
        Map<String, Integer> scores = new LinkedHashMap<>();
        for (Map.Entry<String, Object> answer : responses.asMap().entrySet()) {
            Optional<Question> question = registry.findQuestion(answer.getKey());
            if (question.isEmpty() || !carriesRisk(question.get())) {
                continue;
            }
            String domainId = question.get().getRiskDomain() != null
                    ? question.get().getRiskDomain()
                    : registry.findOwnerOf(answer.getKey()).orElse(answer.getKey());
            scores.merge(domainId, points(question.get(), answer.getValue()), Integer::sum);
        }

        int total = 0;
        for (int points : scores.values()) {
            total += points;
        }
        List<String> recommendations = new ArrayList<>();
        for (DomainAdvice advice : ADVICE) {
            if (scores.getOrDefault(advice.getDomainId(), 0) >= advice.getThreshold()) {
                recommendations.add(advice.getRecommendation());
            }
        }
        return new DomainRiskProfile(Collections.unmodifiableMap(scores), total, List.copyOf(recommendations));
    }

    static boolean carriesRisk(Question question) {
        if (question.getRiskWeight() != null) return true;
        if (!question.hasOptions()) return false;
        for (QuestionOption option : question.getOptions()) {
            if (option.getRiskScore() != null) return true;
        }
        return false;
    }

    static int points(Question question, Object value) {
        int points = question.getRiskWeight() == null ? 0 : question.getRiskWeight();
        if (value instanceof Boolean) {
            return points;
        }
        if (value instanceof List) {
            for (Object item : (List<?>) value) {
                points += optionScore(question, item);
            }
            return points;
        }
        return points + optionScore(question, value);
    }

    private static int optionScore(Question question, Object value) {
        QuestionOption option = question.findOption(value);
        return option == null || option.getRiskScore() == null ? 0 : option.getRiskScore();
    }
}
