package com.example.triage.scoring;

import com.example.triage.model.ResponseSet;
import lombok.Value;

import java.util.function.Predicate;

/**
 * Verificação de consistência. Quando {@code check} é verdadeiro, soma
 * {@code points} ao índice de inconsistência e registra {@code name}.
 */
@Value
public class FraudRule {

    public enum Kind {
        SUSPICIOUS_PATTERN,
        VALIDATION_FAILURE
    }

    String name;
    int points;
    Kind kind;
    Predicate<ResponseSet> check;

    public boolean matches(ResponseSet responses) {
        return check.test(responses);
    }
}
