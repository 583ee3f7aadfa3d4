package com.chanakya.vault.model.dto.response;

import com.chanakya.vault.model.enums.AccessType;

import java.time.Instant;

public record AccessLogEntry(
        String id,
        String grantId,
        String reportId,
        AccessType accessType,
        String detail,
        Instant accessedAt
) {}
