package com.example.triage.registry;

import com.example.triage.model.Domain;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Conteúdo do questionnaire.json: a etapa de triagem e os domínios, na ordem
 * em que foram declarados.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class QuestionnaireDefinition {
    private String questionnaireId;
    private String version;
    private Domain triage;
    private List<Domain> domains = new ArrayList<>();
}
