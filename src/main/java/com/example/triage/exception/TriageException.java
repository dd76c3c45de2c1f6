package com.example.triage.exception;

/**
 * Base de todas as exceções do motor de triagem.
 */
public class TriageException extends RuntimeException {

    public TriageException(String message) {
        super(message);
    }

    public TriageException(String message, Throwable cause) {
        super(message, cause);
    }
}
