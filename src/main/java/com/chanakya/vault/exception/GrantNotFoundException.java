package com.chanakya.vault.exception;

public class GrantNotFoundException extends RuntimeException {
    public GrantNotFoundException(String message) {
        super(message);
    }
}
