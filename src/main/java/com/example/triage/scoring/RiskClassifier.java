package com.example.triage.scoring;

import com.example.triage.model.ClinicalScore;
import com.example.triage.model.ResponseSet;
import com.example.triage.model.RiskAssessment;
import com.example.triage.model.RiskBand;
import com.example.triage.model.RiskCategory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Classificação de risco por categoria. Cada regra é uma entrada nomeada da
 * lista {@link #RULES}, aplicada em ordem; as pontuações são acumuladas sem
 * teto e a faixa final vem da soma.
 */
public class RiskClassifier {

    static final String SUICIDE_RISK = "suicide_risk";
    static final String EMERGENCY_PREFIX = "emergency_";

    static final List<ThresholdBand> PHQ9_BANDS = List.of(
            new ThresholdBand(20, 30, "severe_depression",
                    "Encaminhamento urgente para psiquiatra - depressão severa"),
            new ThresholdBand(15, 25, "moderately_severe_depression",
                    "Encaminhamento para profissional de saúde mental - depressão moderadamente severa"),
            new ThresholdBand(10, 20, "moderate_depression",
                    "Avaliação de saúde mental recomendada - depressão moderada"),
            new ThresholdBand(5, 10, "mild_depression",
                    "Monitoramento de sintomas depressivos leves"));

    static final List<ThresholdBand> GAD7_BANDS = List.of(
            new ThresholdBand(15, 25, "severe_anxiety",
                    "Encaminhamento urgente para avaliação de transtorno de ansiedade severo"),
            new ThresholdBand(10, 20, "moderate_anxiety",
                    "Avaliação para transtorno de ansiedade moderado"),
            new ThresholdBand(5, 10, "mild_anxiety",
                    "Monitoramento de sintomas de ansiedade leves"));

    static final List<ThresholdBand> AUDIT_C_BANDS = List.of(
            new ThresholdBand(8, 30, "high_risk_alcohol_use",
                    "Encaminhamento para avaliação de transtorno por uso de álcool"),
            new ThresholdBand(4, 20, "moderate_risk_alcohol_use",
                    "Intervenção breve para uso de álcool recomendada"),
            new ThresholdBand(3, 10, "mild_risk_alcohol_use",
                    "Educação sobre uso seguro de álcool"));

    // blocos independentes: podem somar com phq9_9 (sobrecontagem intencional)
    static final Map<String, ThresholdBand> SUICIDAL_IDEATION = Map.of(
            "recent_attempt", new ThresholdBand(0, 60, "recent_suicide_attempt",
                    "EMERGÊNCIA: Avaliação psiquiátrica imediata obrigatória"),
            "active_with_plan", new ThresholdBand(0, 50, "active_suicidal_ideation_with_plan",
                    "EMERGÊNCIA: Intervenção de crise imediata"),
            "active_no_plan", new ThresholdBand(0, 35, "active_suicidal_ideation",
                    "Avaliação de risco suicida urgente"),
            "passive", new ThresholdBand(0, 20, "passive_suicidal_ideation",
                    "Acompanhamento de saúde mental prioritário"));

    static final List<String> CRITICAL_FLAGS =
            List.of(SUICIDE_RISK, "recent_suicide_attempt", "active_suicidal_ideation_with_plan");

    static final List<RiskRule> RULES = List.of(
            new RiskRule("phq9_severity", (r, s, a) ->
                    applyBands(PHQ9_BANDS, s.getPhq9(), RiskCategory.MENTAL_HEALTH, a)),
            new RiskRule("gad7_severity", (r, s, a) ->
                    applyBands(GAD7_BANDS, s.getGad7(), RiskCategory.MENTAL_HEALTH, a)),
            new RiskRule("audit_c_risk", (r, s, a) ->
                    applyBands(AUDIT_C_BANDS, s.getAuditC(), RiskCategory.SUBSTANCE_ABUSE, a)),
            new RiskRule("nida_screen", RiskClassifier::nidaScreen),
            new RiskRule("allergy_severity", RiskClassifier::allergySeverity),
            new RiskRule("phq9_suicidal_item", (r, s, a) -> {
                if (r.intValue("phq9_9") > 0) {
                    a.add(RiskCategory.SAFETY_RISK, 50);
                    a.flag(SUICIDE_RISK);
                    a.recommend("EMERGÊNCIA: Encaminhamento imediato para profissional de saúde mental");
                }
            }),
            new RiskRule("suicidal_ideation_screen", (r, s, a) ->
                    r.text("suicidal_ideation_screen")
                            .map(SUICIDAL_IDEATION::get)
                            .ifPresent(band -> apply(band, RiskCategory.SAFETY_RISK, a))),
            new RiskRule("violence_exposure", (r, s, a) -> {
                if (r.is("violence_safety", "current")) {
                    a.add(RiskCategory.SAFETY_RISK, 30);
                    a.flag("current_violence_exposure");
                    a.recommend("Protocolo de segurança para violência doméstica");
                }
            }),
            new RiskRule("cardiovascular_factors", (r, s, a) -> {
                int factors = 0;
                for (CardiovascularFactor factor : CardiovascularFactor.values()) {
                    if (factor.isPresent(r, s)) factors++;
                }
                a.add(RiskCategory.CARDIOVASCULAR, factors * CardiovascularFactor.POINTS_PER_FACTOR);
            }),
            new RiskRule("chronic_burden", (r, s, a) -> {
                long conditions = countConditions(r);
                if (conditions > 3) {
                    a.add(RiskCategory.CHRONIC_DISEASE, 25);
                    a.flag("multiple_chronic_conditions");
                } else if (conditions > 1) {
                    a.add(RiskCategory.CHRONIC_DISEASE, 15);
                    a.flag("comorbid_conditions");
                }
            }),
            new RiskRule("emergency_check", RiskClassifier::emergencyCheck));

    public RiskAssessment classify(ResponseSet responses, ClinicalScore score) {
        RiskAssessment assessment = new RiskAssessment();
        for (RiskRule rule : RULES) {
            rule.apply(responses, score, assessment);
        }

        int overall = assessment.getCategories().values().stream().mapToInt(Integer::intValue).sum();
        assessment.setOverall(overall);
        assessment.setRiskBand(band(assessment));
        return assessment;
    }

    private static RiskBand band(RiskAssessment assessment) {
        boolean emergency = assessment.getFlags().stream().anyMatch(f -> f.startsWith(EMERGENCY_PREFIX));
        boolean critical = CRITICAL_FLAGS.stream().anyMatch(assessment::hasFlag);
        if (emergency || critical) {
            return RiskBand.CRITICAL;
        }
        return RiskBand.fromScore(assessment.getOverall());
    }

    public static long countConditions(ResponseSet responses) {
        return responses.list("chronic_conditions").stream()
                .filter(condition -> !"none".equals(condition))
                .count();
    }

    private static void applyBands(List<ThresholdBand> bands, int score, RiskCategory category,
                                   RiskAssessment assessment) {
        bands.stream()
                .filter(band -> score >= band.getMin())
                .findFirst()
                .ifPresent(band -> apply(band, category, assessment));
    }

    private static void apply(ThresholdBand band, RiskCategory category, RiskAssessment assessment) {
        assessment.add(category, band.getPoints());
        assessment.flag(band.getFlag());
        assessment.recommend(band.getRecommendation());
    }

    private static void nidaScreen(ResponseSet r, ClinicalScore s, RiskAssessment a) {
        Optional<String> screen = r.text("nida_1");
        if (screen.isPresent() && !"no".equals(screen.get())) {
            a.add(RiskCategory.SUBSTANCE_ABUSE, 25);
            a.flag("substance_use_concern");
            a.recommend("Avaliação completa de uso de substâncias recomendada");
            if ("yes_illegal".equals(screen.get())) {
                a.add(RiskCategory.SUBSTANCE_ABUSE, 15);
                a.flag("illegal_drug_use");
            }
        }
        if (r.listContains("nida_2", "cocaine")) {
            a.add(RiskCategory.SUBSTANCE_ABUSE, 20);
            a.flag("high_risk_drug_use");
        }
    }

    private static void allergySeverity(ResponseSet r, ClinicalScore s, RiskAssessment a) {
        if (r.is("allergy_severity", "life_threatening")) {
            a.add(RiskCategory.ALLERGY_RISK, 40);
            a.flag("life_threatening_allergies");
            a.recommend("Protocolo de emergência para anafilaxia deve estar disponível");
            if (!r.isTrue("carries_epinephrine")) {
                a.add(RiskCategory.ALLERGY_RISK, 20);
                a.flag("missing_epinephrine");
                a.recommend("Prescrição de auto-injetor de epinefrina urgente");
            }
        } else if (r.is("allergy_severity", "severe")) {
            a.add(RiskCategory.ALLERGY_RISK, 25);
            a.flag("severe_allergies");
            a.recommend("Avaliação alergológica especializada recomendada");
        }
    }

    // só sinaliza; a condição de emergência não soma pontos nem muda o fluxo
    private static void emergencyCheck(ResponseSet r, ClinicalScore s, RiskAssessment a) {
        boolean any = false;
        for (String item : r.list("emergency_check")) {
            if (!"none".equals(item)) {
                a.flag(EMERGENCY_PREFIX + item);
                any = true;
            }
        }
        if (any) {
            a.recommend("URGENTE: Procure atendimento médico de emergência imediatamente");
        }
    }
}
