package com.example.triage.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class NextStepRequest {
    @NotBlank
    private String sessionId;

    @NotBlank
    private String questionId;

    private Object value;
}
