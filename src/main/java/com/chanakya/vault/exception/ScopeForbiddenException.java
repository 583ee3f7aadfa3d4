package com.chanakya.vault.exception;

public class ScopeForbiddenException extends RuntimeException {
    public ScopeForbiddenException(String message) {
        super(message);
    }
}
