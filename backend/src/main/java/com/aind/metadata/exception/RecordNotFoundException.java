package com.aind.metadata.exception;

/**
 * Raised when an operation addresses a record (or session) that does not exist.
 * Always recoverable; controllers map it to 404.
 */
public class RecordNotFoundException extends RuntimeException {

    private final String recordId;

    public RecordNotFoundException(String recordId) {
        super("Record not found: " + recordId);
        this.recordId = recordId;
    }

    public RecordNotFoundException(String recordId, String message) {
        super(message);
        this.recordId = recordId;
    }

    public String getRecordId() {
        return recordId;
    }
}
