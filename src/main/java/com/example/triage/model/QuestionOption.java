package com.example.triage.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class QuestionOption {
    Object value;
    String label;
    Integer riskScore;

    @JsonCreator
    public QuestionOption(@JsonProperty("value") Object value,
                          @JsonProperty("label") String label,
                          @JsonProperty("riskScore") Integer riskScore) {
        this.value = value;
        this.label = label;
        this.riskScore = riskScore;
    }
}
