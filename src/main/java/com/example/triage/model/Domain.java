package com.example.triage.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Optional;

/**
 * Domínio clínico do questionário: regra de ativação, prioridade e a lista
 * ordenada de perguntas. A triagem inicial usa a mesma estrutura, sem regra.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class Domain {
    String id;
    String name;
    String description;
    int priority;
    TriggerRule trigger;
    String continuationOf;
    boolean terminal;
    int estimatedMinutes;
    List<Question> questions;

    @Builder
    @Jacksonized
    private Domain(String id, String name, String description, int priority, TriggerRule trigger,
                   String continuationOf, boolean terminal, int estimatedMinutes, List<Question> questions) {
        this.id = id;
        this.name = name;
        this.description = description;
        this.priority = priority;
        this.trigger = trigger;
        this.continuationOf = continuationOf;
        this.terminal = terminal;
        this.estimatedMinutes = estimatedMinutes;
        this.questions = questions == null ? List.of() : List.copyOf(questions);
    }

    @JsonIgnore
    public boolean isContinuation() {
        return continuationOf != null;
    }

    public Optional<Question> findQuestion(String questionId) {
        return questions.stream()
                .filter(q -> q.getId().equals(questionId))
                .findFirst();
    }

    public int indexOf(String questionId) {
        for (int i = 0; i < questions.size(); i++) {
            if (questions.get(i).getId().equals(questionId)) {
                return i;
            }
        }
        return -1;
    }

    public DomainDescriptor toDescriptor() {
        return DomainDescriptor.builder()
                .id(id)
                .name(name)
                .description(description)
                .priority(priority)
                .estimatedMinutes(estimatedMinutes)
                .questionCount(questions.size())
                .build();
    }
}
