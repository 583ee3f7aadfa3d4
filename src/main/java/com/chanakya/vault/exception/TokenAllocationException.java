package com.chanakya.vault.exception;

import lombok.Getter;

@Getter
public class TokenAllocationException extends RuntimeException {

    private final int attempts;

    public TokenAllocationException(int attempts) {
        super("Could not allocate a unique access token after " + attempts + " attempts");
        this.attempts = attempts;
    }
}
