package com.example.triage.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Objects;

/**
 * Pergunta do catálogo. Imutável: a mesma instância é exibida em todas as
 * sessões.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Question {
    String id;
    String text;
    QuestionType type;
    boolean required;
    List<QuestionOption> options;
    ValidationRange validation;
    ConditionalRule conditionalOn;
    Integer riskWeight;
    // domínio que recebe o risco; por padrão, o domínio dono da pergunta
    String riskDomain;
    String instrument;
    String clinicalCode;

    @Builder
    @Jacksonized
    private Question(String id, String text, QuestionType type, Boolean required, List<QuestionOption> options,
                     ValidationRange validation, ConditionalRule conditionalOn, Integer riskWeight,
                     String riskDomain, String instrument, String clinicalCode) {
        this.id = id;
        this.text = text;
        this.type = type;
        this.required = required == null || required;
        this.options = options == null ? null : List.copyOf(options);
        this.validation = validation;
        this.conditionalOn = conditionalOn;
        this.riskWeight = riskWeight;
        this.riskDomain = riskDomain;
        this.instrument = instrument;
        this.clinicalCode = clinicalCode;
    }

    @JsonIgnore
    public boolean hasOptions() {
        return options != null && !options.isEmpty();
    }

    /**
     * Verifica se o valor informado corresponde a alguma opção declarada.
     * Números são comparados pelo valor, independente do tipo (Integer/Double).
     */
    public boolean hasOption(Object value) {
        return findOption(value) != null;
    }

    public QuestionOption findOption(Object value) {
        if (!hasOptions()) return null;
        for (QuestionOption option : options) {
            if (sameValue(option.getValue(), value)) {
                return option;
            }
        }
        return null;
    }

    public static boolean sameValue(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue()) == 0;
        }
        return Objects.equals(a, b);
    }
}
