package com.example.triage.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Estado serializável de uma sessão. É o que fica salvo no Redis entre
 * requisições; restaurar o mesmo snapshot reproduz o mesmo comportamento.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FlowSnapshot {
    private FlowStage stage;
    private String currentDomainId;
    private String currentQuestionId;
    @Builder.Default
    private List<String> visitedDomains = new ArrayList<>();
    @Builder.Default
    private List<Response> responses = new ArrayList<>();
}
