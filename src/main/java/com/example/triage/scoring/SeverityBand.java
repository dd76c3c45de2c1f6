package com.example.triage.scoring;

import lombok.Value;

import java.util.List;

/**
 * Faixa de severidade de um instrumento validado: a partir de {@code min}
 * pontos vale {@code label}.
 */
@Value
public class SeverityBand {
    int min;
    String label;

    // bandas em ordem crescente de min
    public static String classify(List<SeverityBand> bands, int score) {
        String label = bands.get(0).getLabel();
        for (SeverityBand band : bands) {
            if (score >= band.getMin()) {
                label = band.getLabel();
            }
        }
        return label;
    }
}
