package com.controlsdashboard.service;

public class DocumentSourceException extends RuntimeException {

    public enum Reason { INVALID_IDENTIFIER, NOT_FOUND, READ_FAILED }

    private final Reason reason;

    public DocumentSourceException(Reason reason, String m) {
        super(m);
        this.reason = reason;
    }

    public DocumentSourceException(Reason reason, String m, Throwable c) {
        super(m, c);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
