package com.example.triage.scoring;

import lombok.Value;

/**
 * Faixa de pontuação que soma pontos de risco, com a flag e a recomendação
 * correspondentes.
 */
@Value
public class ThresholdBand {
    int min;
    int points;
    String flag;
    String recommendation;
}
