package com.chanakya.vault.model.dto.response;

public record ErrorResponse(
        String error,
        String message
) {}
