package com.example.triage.exception;

public class SessionNotFoundException extends TriageException {

    public SessionNotFoundException(String sessionId) {
        super("Sessão não encontrada: " + sessionId);
    }
}
