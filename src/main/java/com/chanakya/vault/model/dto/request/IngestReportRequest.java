package com.chanakya.vault.model.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record IngestReportRequest(
        @NotBlank @Size(max = 2048) String documentUri,
        @NotBlank @Size(max = 100) String mimeType,
        @Size(max = 255) String fileName
) {}
