package com.chanakya.vault.exception;

public class GrantRevokedException extends GrantUnavailableException {
    public GrantRevokedException(String message) {
        super(message);
    }
}
