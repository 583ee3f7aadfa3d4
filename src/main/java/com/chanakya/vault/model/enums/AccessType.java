package com.chanakya.vault.model.enums;

public enum AccessType {
    REPORT_INGESTED,
    GRANT_ISSUED,
    GRANT_REVOKED,
    TIMELINE_VIEWED,
    TIMELINE_DENIED
}
