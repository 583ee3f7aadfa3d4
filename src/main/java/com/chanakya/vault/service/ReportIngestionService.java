package com.chanakya.vault.service;

import com.chanakya.vault.extraction.DocumentExtractionClient;
import com.chanakya.vault.extraction.ExtractionNormalizer;
import com.chanakya.vault.extraction.ExtractionNormalizer.SourceDocument;
import com.chanakya.vault.model.document.ReportDocument;
import com.chanakya.vault.model.dto.request.IngestReportRequest;
import com.chanakya.vault.model.enums.AccessType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

@Service
public class ReportIngestionService {

    private static final Logger log = LoggerFactory.getLogger(ReportIngestionService.class);

    private final DocumentExtractionClient extractionClient;
    private final ExtractionNormalizer normalizer;
    private final ReportService reportService;
    private final AccessLogService accessLogService;

    public ReportIngestionService(DocumentExtractionClient extractionClient,
                                  ExtractionNormalizer normalizer,
                                  ReportService reportService,
                                  AccessLogService accessLogService) {
        this.extractionClient = extractionClient;
        this.normalizer = normalizer;
        this.reportService = reportService;
        this.accessLogService = accessLogService;
    }

    /**
     * Extracts, normalizes and stores one uploaded document. An unsupported MIME type fails with
     * {@link IllegalArgumentException} from the extraction client before any upstream call.
     * Extraction failures propagate as {@link com.chanakya.vault.exception.ExtractionException};
     * retrying is the caller's call.
     */
    public Mono<ReportDocument> ingest(String ownerId, IngestReportRequest request) {
        SourceDocument source = new SourceDocument(request.documentUri(), request.fileName());

        return extractionClient.extract(request.documentUri(), request.mimeType())
                .map(payload -> normalizer.normalize(ownerId, payload, source))
                .flatMap(reportService::put)
                .flatMap(report -> accessLogService
                        .logReportEvent(ownerId, report.getId(), AccessType.REPORT_INGESTED)
                        .thenReturn(report))
                .doOnNext(report -> log.info("event=report_ingested reportId={} ownerId={} reportType={} values={}",
                        report.getId(), ownerId, report.getReportType(), report.getValues().size()));
    }
}
