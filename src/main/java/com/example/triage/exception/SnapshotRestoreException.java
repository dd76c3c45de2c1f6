package com.example.triage.exception;

public class SnapshotRestoreException extends TriageException {

    public SnapshotRestoreException(String message) {
        super(message);
    }
}
