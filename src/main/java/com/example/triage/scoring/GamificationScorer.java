package com.example.triage.scoring;

import com.example.triage.model.ClinicalScore;
import com.example.triage.model.FraudIndicators;
import com.example.triage.model.FraudRecommendation;
import com.example.triage.model.GamificationLevel;
import com.example.triage.model.GamificationResult;
import com.example.triage.model.GamificationStreaks;
import com.example.triage.model.Question;
import com.example.triage.model.ResponseSet;
import com.example.triage.model.RiskAssessment;
import com.example.triage.registry.DomainRegistry;
import com.example.triage.registry.RuleEvaluator;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Pontuação de engajamento: parte de 100, desconta o risco geral e soma os
 * bônus conquistados. Seções com perguntas condicionais não exibidas contam
 * como completas.
 */
public class GamificationScorer {

    static final int BASE_SCORE = 100;
    static final double MAX_RISK_DEDUCTION = 50;
    static final double THOROUGH_COMPLETION_RATE = 0.9;

    static final List<String> SUBSTANCE_ITEMS = List.of("audit_c_1", "audit_c_2", "audit_c_3", "nida_1", "nida_2");
    static final List<String> ALLERGY_ITEMS =
            List.of("has_allergies", "medication_allergies", "food_allergies", "allergy_severity", "carries_epinephrine");

    static final List<String> NEXT_REWARDS = List.of(
            "Complete all clinical assessments for \"Clinical Excellence\" badge",
            "Maintain safety protocols for \"Safety Champion\" badge",
            "Complete substance screening for \"Substance Awareness\" badge");

    @Value
    static class Context {
        ResponseSet responses;
        ClinicalScore clinical;
        FraudIndicators fraud;
        double completionRate;
        boolean mentalComplete;
        boolean substanceComplete;
        boolean allergyComplete;
        boolean safetyAnswered;

        int majorSections() {
            int sections = 0;
            if (mentalComplete) sections++;
            if (substanceComplete) sections++;
            if (allergyComplete) sections++;
            if (safetyAnswered) sections++;
            return sections;
        }
    }

    @Value
    static class Bonus {
        String badge;
        int points;
        Predicate<Context> earned;
    }

    static final List<Bonus> BONUSES = List.of(
            new Bonus("honest_reporter", 10,
                    c -> c.getFraud().getRecommendation() == FraudRecommendation.ACCEPT),
            new Bonus("thorough_responder", 5,
                    c -> c.getCompletionRate() > THOROUGH_COMPLETION_RATE),
            new Bonus("mental_wellness_champion", 15, Context::isMentalComplete),
            new Bonus("mental_health_resilient", 10,
                    c -> c.isMentalComplete() && c.getClinical().getPhq9() < 5 && c.getClinical().getGad7() < 5),
            new Bonus("substance_awareness_advocate", 10, Context::isSubstanceComplete),
            new Bonus("substance_free_lifestyle", 15,
                    c -> c.isSubstanceComplete()
                            && c.getResponses().number("audit_c_1").isPresent()
                            && c.getResponses().intValue("audit_c_1") == 0
                            && c.getResponses().is("nida_1", "no")),
            new Bonus("allergy_safety_expert", 8, Context::isAllergyComplete),
            new Bonus("emergency_prepared", 12,
                    c -> c.isAllergyComplete() && c.getResponses().isTrue("carries_epinephrine")),
            new Bonus("safety_first_champion", 20,
                    c -> c.getResponses().isTrue("safety_check")
                            && c.getResponses().is("suicidal_ideation_screen", "never")),
            new Bonus("proactive_safety_planner", 10,
                    c -> c.getResponses().isTrue("safety_plan_willingness")),
            new Bonus("fitness_enthusiast", 0,
                    c -> c.getResponses().number("exercise_frequency").isPresent()
                            && c.getResponses().doubleValue("exercise_frequency") >= 5),
            new Bonus("sleep_champion", 0,
                    c -> c.getResponses().number("sleep_hours").isPresent()
                            && c.getResponses().doubleValue("sleep_hours") >= 7
                            && c.getResponses().doubleValue("sleep_hours") <= 9),
            new Bonus("smoke_free", 0,
                    c -> !c.getResponses().has("smoking_status") || c.getResponses().is("smoking_status", "never")),
            new Bonus("clinical_excellence", 25, c -> c.majorSections() >= 3),
            new Bonus("comprehensive_health_advocate", 30, c -> c.majorSections() == 4));

    private final DomainRegistry registry;

    public GamificationScorer(DomainRegistry registry) {
        this.registry = registry;
    }

    public GamificationResult score(ResponseSet responses, ClinicalScore clinical, RiskAssessment risk,
                                    FraudIndicators fraud) {
        double completionRate = Math.min(1.0, (double) responses.size() / registry.totalQuestionCount());
        Context context = new Context(responses, clinical, fraud, completionRate,
                sectionComplete(responses, ClinicalScorer.PHQ9_ITEMS)
                        && sectionComplete(responses, ClinicalScorer.GAD7_ITEMS),
                sectionComplete(responses, SUBSTANCE_ITEMS),
                sectionComplete(responses, ALLERGY_ITEMS),
                responses.has("safety_check"));

        double score = BASE_SCORE - Math.min(risk.getOverall() / 10.0, MAX_RISK_DEDUCTION);
        List<String> badges = new ArrayList<>();
        for (Bonus bonus : BONUSES) {
            if (bonus.getEarned().test(context)) {
                badges.add(bonus.getBadge());
                score += bonus.getPoints();
            }
        }
        double healthScore = Math.max(0, Math.min(100, score));

        return GamificationResult.builder()
                .healthScore(healthScore)
                .badges(badges)
                .streaks(new GamificationStreaks(
                        fraud.getRecommendation() == FraudRecommendation.ACCEPT ? 1 : 0,
                        (int) Math.floor(completionRate * 10)))
                .level(GamificationLevel.fromScore(healthScore))
                .nextRewards(NEXT_REWARDS)
                .build();
    }

    private boolean sectionComplete(ResponseSet responses, List<String> items) {
        for (String item : items) {
            if (responses.has(item)) {
                continue;
            }
            Optional<Question> question = registry.findQuestion(item);
            boolean skipped = question.isPresent()
                    && question.get().getConditionalOn() != null
                    && !RuleEvaluator.isSurfaced(question.get(), responses);
            if (!skipped) {
                return false;
            }
        }
        return true;
    }
}
