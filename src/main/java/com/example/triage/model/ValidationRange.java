package com.example.triage.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class ValidationRange {
    Double min;
    Double max;

    @JsonCreator
    public ValidationRange(@JsonProperty("min") Double min, @JsonProperty("max") Double max) {
        this.min = min;
        this.max = max;
    }

    public boolean contains(double value) {
        if (min != null && value < min) return false;
        if (max != null && value > max) return false;
        return true;
    }
}
