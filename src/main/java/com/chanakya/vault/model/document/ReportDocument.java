package com.chanakya.vault.model.document;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Canonical record extracted from one uploaded document. Never updated after ingestion.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "reports")
public class ReportDocument {

    public static final String UNKNOWN_DATE = "Unknown";

    @Id
    private String id;

    @Indexed
    private String ownerId;

    private String reportType;
    private String sourceFacility;

    /** Clinical date as {@code yyyy-MM-dd}, or {@link #UNKNOWN_DATE}. */
    private String capturedAt;
    private Instant ingestedAt;

    private Map<String, Measurement> values;
    private List<String> findings;
    private List<String> medications;
    private List<String> diagnoses;

    private String summaryForPatient;
    private String summaryForClinician;

    private String sourceDocumentUri;
    private String fileName;

    public boolean hasKnownCaptureDate() {
        return capturedAt != null && !UNKNOWN_DATE.equals(capturedAt);
    }
}
