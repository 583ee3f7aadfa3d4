package com.chanakya.vault.exception;

public class GrantExpiredException extends GrantUnavailableException {
    public GrantExpiredException(String message) {
        super(message);
    }
}
