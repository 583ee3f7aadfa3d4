package com.chanakya.vault.util;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class EntropyUtilTest {

    @Test
    void accessTokenIsUrlSafe256Bits() {
        String token = EntropyUtil.generateAccessToken();

        assertEquals(43, token.length());
        assertTrue(token.matches("[A-Za-z0-9_-]+"));
    }

    @Test
    void accessTokensDoNotRepeat() {
        Set<String> tokens = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            tokens.add(EntropyUtil.generateAccessToken());
        }
        assertEquals(1000, tokens.size());
    }
}
