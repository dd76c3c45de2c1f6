package com.example.triage.exception;

public class InvalidResponseException extends TriageException {

    private final String questionId;

    public InvalidResponseException(String questionId, String message) {
        super(message);
        this.questionId = questionId;
    }

    public String getQuestionId() {
        return questionId;
    }
}
