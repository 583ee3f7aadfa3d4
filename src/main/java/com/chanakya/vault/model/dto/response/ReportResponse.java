package com.chanakya.vault.model.dto.response;

import com.chanakya.vault.model.document.Measurement;
import com.chanakya.vault.model.document.ReportDocument;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record ReportResponse(
        String id,
        String reportType,
        String sourceFacility,
        String capturedAt,
        Instant ingestedAt,
        Map<String, Measurement> values,
        List<String> findings,
        List<String> medications,
        List<String> diagnoses,
        String summaryForPatient,
        String summaryForClinician,
        String fileName
) {
    public static ReportResponse from(ReportDocument report) {
        return new ReportResponse(
                report.getId(),
                report.getReportType(),
                report.getSourceFacility(),
                report.getCapturedAt(),
                report.getIngestedAt(),
                report.getValues(),
                report.getFindings(),
                report.getMedications(),
                report.getDiagnoses(),
                report.getSummaryForPatient(),
                report.getSummaryForClinician(),
                report.getFileName()
        );
    }
}
