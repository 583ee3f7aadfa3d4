package com.chanakya.vault.model.enums;

public enum GrantStatus {
    ACTIVE,
    EXPIRED, // still active but past expiresAt
    REVOKED
}
