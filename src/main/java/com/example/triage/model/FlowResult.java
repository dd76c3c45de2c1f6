package com.example.triage.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Resultado de cada passo do fluxo: a próxima pergunta, o anúncio de um novo
 * domínio ou o resultado final da avaliação.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FlowResult {
    private FlowResultType type;
    private Question question;
    private DomainDescriptor domain;
    private String message;
    private AssessmentResults results;
    private int progress;
    private String currentDomain;
    private int estimatedTimeRemaining;
}
