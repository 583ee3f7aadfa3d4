package com.chanakya.vault.exception;

/**
 * A grant that exists but can no longer be used to read reports.
 * Viewers see the same response as for an unknown token.
 */
public abstract class GrantUnavailableException extends RuntimeException {

    protected GrantUnavailableException(String message) {
        super(message);
    }
}
