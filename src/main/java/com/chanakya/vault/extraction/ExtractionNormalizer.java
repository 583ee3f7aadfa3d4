package com.chanakya.vault.extraction;

import com.chanakya.vault.model.document.Measurement;
import com.chanakya.vault.model.document.MeasurementValue;
import com.chanakya.vault.model.document.ReportDocument;
import com.chanakya.vault.util.EntropyUtil;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns the loosely typed output of the extraction model into a {@link ReportDocument}.
 * Total over its input: malformed fields fall back to defaults instead of failing the report.
 */
@Component
public class ExtractionNormalizer {

    private static final Logger log = LoggerFactory.getLogger(ExtractionNormalizer.class);

    private static final Pattern STRICT_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");

    private final Clock clock;

    public ExtractionNormalizer(Clock clock) {
        this.clock = clock;
    }

    /**
     * The uploaded document a payload was extracted from.
     */
    public record SourceDocument(String documentUri, String fileName) {

        public static final SourceDocument NONE = new SourceDocument(null, null);
    }

    public ReportDocument normalize(String ownerId, JsonNode payload, SourceDocument source) {
        JsonNode root = payload != null && payload.isObject() ? payload : MissingNode.getInstance();
        SourceDocument origin = source != null ? source : SourceDocument.NONE;
        String reportId = EntropyUtil.generateId();

        return ReportDocument.builder()
                .id(reportId)
                .ownerId(ownerId)
                .reportType(optionalText(root.path("reportType")))
                .sourceFacility(optionalText(root.path("hospital")))
                .capturedAt(normalizeDate(root.path("timestamp"), reportId))
                .ingestedAt(clock.instant())
                .values(normalizeValues(root.path("extractedValues")))
                .findings(textList(root.path("abnormalities")))
                .medications(textList(root.path("medications")))
                .diagnoses(textList(root.path("diagnosis")))
                .summaryForPatient(text(root.path("patientSummary")))
                .summaryForClinician(text(root.path("doctorSummary")))
                .sourceDocumentUri(origin.documentUri())
                .fileName(origin.fileName())
                .build();
    }

    Map<String, Measurement> normalizeValues(JsonNode node) {
        if (!node.isObject()) {
            return Collections.emptyMap();
        }
        Map<String, Measurement> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            values.put(field.getKey(), normalizeMeasurement(field.getValue()));
        }
        return values;
    }

    Measurement normalizeMeasurement(JsonNode node) {
        if (!node.isObject()) {
            // bare "Hemoglobin": "13.5" entries carry only the value
            return new Measurement(coerceValue(node), null, null, false);
        }
        return new Measurement(
                coerceValue(node.path("value")),
                optionalText(node.path("unit")),
                optionalText(node.path("ref")),
                isAbnormal(node.path("isAbnormal"))
        );
    }

    static MeasurementValue coerceValue(JsonNode node) {
        if (node.isNumber()) {
            return MeasurementValue.numeric(node.doubleValue());
        }
        if (node.isMissingNode() || node.isNull()) {
            return MeasurementValue.text("");
        }
        if (!node.isTextual()) {
            return MeasurementValue.text(node.toString());
        }
        String raw = node.textValue();
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return MeasurementValue.text(raw);
        }
        try {
            return MeasurementValue.numeric(new BigDecimal(trimmed).doubleValue());
        } catch (NumberFormatException e) {
            return MeasurementValue.text(raw);
        }
    }

    static boolean isAbnormal(JsonNode node) {
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return node.isTextual() && "true".equals(node.textValue());
    }

    private String normalizeDate(JsonNode node, String reportId) {
        String raw = node.isTextual() ? node.textValue().trim() : null;
        if (raw != null && STRICT_DATE.matcher(raw).matches()) {
            return raw;
        }
        return ReportDates.parseLenient(raw)
                .map(ReportDates::format)
                .orElseGet(() -> {
                    log.warn("event=report_date_unparseable reportId={} raw=\"{}\"", reportId, raw);
                    return ReportDocument.UNKNOWN_DATE;
                });
    }

    private static List<String> textList(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return new ArrayList<>();
        }
        List<String> items = new ArrayList<>();
        if (!node.isArray()) {
            items.add(node.isTextual() ? node.textValue() : node.toString());
            return items;
        }
        for (JsonNode item : node) {
            if (item.isNull()) {
                continue;
            }
            items.add(item.isTextual() ? item.textValue() : item.toString());
        }
        return items;
    }

    private static String text(JsonNode node) {
        return node.isTextual() ? node.textValue() : "";
    }

    private static String optionalText(JsonNode node) {
        if (node.isTextual()) {
            String value = node.textValue().trim();
            return value.isEmpty() ? null : value;
        }
        return node.isValueNode() && !node.isNull() ? node.asText() : null;
    }
}
