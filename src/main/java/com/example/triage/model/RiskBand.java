package com.example.triage.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

public enum RiskBand {
    LOW("low", 0,
            List.of("Manutenção dos bons hábitos de saúde", "Próxima avaliação em 6 meses")),
    MODERATE("moderate", 31,
            List.of("Recomendações personalizadas de saúde", "Acompanhamento em 1 semana")),
    HIGH("high", 71,
            List.of("Agendamento prioritário com profissional de saúde", "Acompanhamento em 48 horas")),
    CRITICAL("critical", 121,
            List.of("Contato imediato com equipe médica", "Recursos de emergência disponibilizados"));

    private final String code;
    private final int minScore;
    private final List<String> nextSteps;

    RiskBand(String code, int minScore, List<String> nextSteps) {
        this.code = code;
        this.minScore = minScore;
        this.nextSteps = nextSteps;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public List<String> getNextSteps() {
        return nextSteps;
    }

    public static RiskBand fromScore(int overall) {
        RiskBand band = LOW;
        for (RiskBand candidate : values()) {
            if (overall >= candidate.minScore) {
                band = candidate;
            }
        }
        return band;
    }
}
