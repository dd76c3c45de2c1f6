package com.example.triage.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class TriggerRule {
    String questionId;
    ComparisonOperator operator;
    Object value;

    @JsonCreator
    public TriggerRule(@JsonProperty("questionId") String questionId,
                       @JsonProperty("operator") ComparisonOperator operator,
                       @JsonProperty("value") Object value) {
        this.questionId = questionId;
        this.operator = operator;
        this.value = value;
    }
}
