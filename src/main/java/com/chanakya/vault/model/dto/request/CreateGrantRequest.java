package com.chanakya.vault.model.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;

import java.util.List;

/**
 * Scope checks (empty list, blank ids) happen in the grant service so every caller gets the
 * same {@code invalid_scope} error. {@code ttlMinutes} is capped at 30 days.
 */
public record CreateGrantRequest(
        List<String> reportIds,
        @Positive @Max(CreateGrantRequest.MAX_TTL_MINUTES) Long ttlMinutes
) {
    public static final long MAX_TTL_MINUTES = 30L * 24 * 60;
}
