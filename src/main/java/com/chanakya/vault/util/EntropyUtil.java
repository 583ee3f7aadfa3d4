package com.chanakya.vault.util;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.UUID;

public final class EntropyUtil {

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    private static final int TOKEN_BYTES = 32;

    private EntropyUtil() {}

    /**
     * Generates a 256-bit random access token as base64url (43 chars).
     */
    public static String generateAccessToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        SECURE_RANDOM.nextBytes(bytes);
        return ENCODER.encodeToString(bytes);
    }

    /**
     * Generates a grant or report identifier as a UUID string.
     */
    public static String generateId() {
        return UUID.randomUUID().toString();
    }
}
