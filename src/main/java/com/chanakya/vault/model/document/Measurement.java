package com.chanakya.vault.model.document;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Measurement(
        MeasurementValue value,
        String unit,
        String referenceRange,
        @JsonProperty("isAbnormal") boolean abnormal
) {}
