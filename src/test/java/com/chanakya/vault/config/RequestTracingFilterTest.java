package com.chanakya.vault.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RequestTracingFilterTest {

    @Test
    void timelineTokenIsMasked() {
        assertEquals("/api/timeline/***", RequestTracingFilter.maskPath("/api/timeline/abcDEF123-_xyz"));
    }

    @Test
    void ownerPathsAreLoggedAsIs() {
        assertEquals("/api/patients/alice/grants", RequestTracingFilter.maskPath("/api/patients/alice/grants"));
    }
}
