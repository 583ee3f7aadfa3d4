package com.chanakya.vault.exception;

public class ReportConflictException extends RuntimeException {
    public ReportConflictException(String message) {
        super(message);
    }
}
