package com.chanakya.vault.model.document;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A measured value as reported: either a number or free text such as "N/A" or "Positive".
 */
public sealed interface MeasurementValue permits MeasurementValue.Numeric, MeasurementValue.Text {

    record Numeric(@JsonValue double value) implements MeasurementValue {}

    record Text(@JsonValue String value) implements MeasurementValue {}

    static MeasurementValue numeric(double value) {
        return new Numeric(value);
    }

    static MeasurementValue text(String value) {
        return new Text(value);
    }
}
