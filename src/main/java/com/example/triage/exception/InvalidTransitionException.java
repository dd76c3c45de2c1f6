package com.example.triage.exception;

import com.example.triage.model.FlowStage;

/**
 * Entrada recebida fora de ordem: id de pergunta diferente do esperado,
 * pseudo-entrada no estágio errado ou chamada após o fim da sessão.
 */
public class InvalidTransitionException extends TriageException {

    private final FlowStage stage;
    private final String expected;
    private final String received;

    public InvalidTransitionException(FlowStage stage, String expected, String received) {
        super(String.format("Transição inválida no estágio %s: esperado '%s', recebido '%s'",
                stage, expected, received));
        this.stage = stage;
        this.expected = expected;
        this.received = received;
    }

    public FlowStage getStage() {
        return stage;
    }

    public String getExpected() {
        return expected;
    }

    public String getReceived() {
        return received;
    }
}
