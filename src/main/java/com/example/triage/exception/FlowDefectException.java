package com.example.triage.exception;

/**
 * Defeito estrutural do questionário ou do fluxo. Não é erro do usuário.
 */
public class FlowDefectException extends TriageException {

    public FlowDefectException(String message) {
        super(message);
    }

    public FlowDefectException(String message, Throwable cause) {
        super(message, cause);
    }
}
