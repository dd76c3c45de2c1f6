package com.example.triage.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

/**
 * Condição de exibição de uma pergunta: ela só aparece quando a resposta de
 * {@code questionId} é um dos {@code values}.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConditionalRule {
    String questionId;
    List<Object> values;

    @JsonCreator
    public ConditionalRule(@JsonProperty("questionId") String questionId,
                           @JsonProperty("values") List<?> values) {
        this.questionId = questionId;
        this.values = values == null ? List.of() : List.<Object>copyOf(values);
    }
}
