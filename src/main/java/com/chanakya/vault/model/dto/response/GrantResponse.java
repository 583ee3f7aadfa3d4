package com.chanakya.vault.model.dto.response;

import com.chanakya.vault.model.enums.GrantStatus;

import java.time.Instant;
import java.util.List;

public record GrantResponse(
        String id,
        String token,
        String shareUrl,
        List<String> reportIds,
        Instant issuedAt,
        Instant expiresAt,
        boolean active,
        GrantStatus status
) {}
