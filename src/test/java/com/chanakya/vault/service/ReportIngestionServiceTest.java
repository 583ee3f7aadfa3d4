package com.chanakya.vault.service;

import com.chanakya.vault.exception.ExtractionException;
import com.chanakya.vault.extraction.DocumentExtractionClient;
import com.chanakya.vault.extraction.ExtractionNormalizer;
import com.chanakya.vault.model.document.AccessLogDocument;
import com.chanakya.vault.model.document.MeasurementValue;
import com.chanakya.vault.model.document.ReportDocument;
import com.chanakya.vault.model.dto.request.IngestReportRequest;
import com.chanakya.vault.model.enums.AccessType;
import com.chanakya.vault.repository.AccessLogRepository;
import com.chanakya.vault.repository.InMemoryAccessGrantRepository;
import com.chanakya.vault.repository.InMemoryReportRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;

import static com.chanakya.vault.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ReportIngestionServiceTest {

    private static final String DOCUMENT_URI = "https://files.example.org/uploads/cbc.pdf";

    private final ObjectMapper objectMapper = new ObjectMapper();

    private DocumentExtractionClient extractionClient;
    private InMemoryReportRepository reportRepository;
    private AccessLogRepository accessLogRepository;
    private ReportService reportService;
    private ReportIngestionService ingestionService;

    @BeforeEach
    void setUp() {
        Clock clock = clockAt(NOW);
        extractionClient = mock(DocumentExtractionClient.class);
        reportRepository = new InMemoryReportRepository();
        accessLogRepository = acceptingAccessLog();
        reportService = new ReportService(reportRepository);
        ingestionService = new ReportIngestionService(
                extractionClient,
                new ExtractionNormalizer(clock),
                reportService,
                new AccessLogService(accessLogRepository, new InMemoryAccessGrantRepository(), clock));
    }

    @Test
    void extractedReportIsNormalizedAndStored() throws Exception {
        when(extractionClient.extract(DOCUMENT_URI, "application/pdf")).thenReturn(Mono.just(objectMapper.readTree("""
                {"reportType": "CBC", "hospital": "City Lab", "timestamp": "2024-02-20",
                 "extractedValues": {"Hemoglobin": {"value": "11.2", "unit": "g/dL", "ref": "12-16", "isAbnormal": true}},
                 "diagnosis": [], "medications": [], "abnormalities": ["Low hemoglobin"],
                 "patientSummary": "Slightly low iron.", "doctorSummary": "Mild anemia."}
                """)));

        ReportDocument stored = ingestionService
                .ingest("alice", new IngestReportRequest(DOCUMENT_URI, "application/pdf", "cbc.pdf"))
                .block();

        assertNotNull(stored);
        assertEquals("alice", stored.getOwnerId());
        assertEquals("2024-02-20", stored.getCapturedAt());
        assertEquals(NOW, stored.getIngestedAt());
        assertEquals(new MeasurementValue.Numeric(11.2), stored.getValues().get("Hemoglobin").value());
        assertEquals("cbc.pdf", stored.getFileName());
        assertEquals(DOCUMENT_URI, stored.getSourceDocumentUri());

        StepVerifier.create(reportService.listByOwner("alice").map(ReportDocument::getId))
                .expectNext(stored.getId())
                .verifyComplete();

        ArgumentCaptor<AccessLogDocument> captor = ArgumentCaptor.forClass(AccessLogDocument.class);
        verify(accessLogRepository).save(captor.capture());
        assertEquals(AccessType.REPORT_INGESTED, captor.getValue().getAccessType());
        assertEquals(stored.getId(), captor.getValue().getReportId());
    }

    @Test
    void extractionFailureStoresNothing() {
        when(extractionClient.extract(anyString(), anyString()))
                .thenReturn(Mono.error(new ExtractionException("upstream returned 500")));

        StepVerifier.create(ingestionService.ingest("alice",
                        new IngestReportRequest(DOCUMENT_URI, "image/png", null)))
                .expectError(ExtractionException.class)
                .verify();

        assertEquals(0, reportRepository.size());
        verifyNoInteractions(accessLogRepository);
    }

    @Test
    void unsupportedMimeTypeIsRejectedBeforeAnyUpstreamCall() {
        DocumentExtractionClient realClient = new DocumentExtractionClient(properties(), objectMapper);
        realClient.init();
        Clock clock = clockAt(NOW);
        ReportIngestionService service = new ReportIngestionService(
                realClient,
                new ExtractionNormalizer(clock),
                reportService,
                new AccessLogService(accessLogRepository, new InMemoryAccessGrantRepository(), clock));

        StepVerifier.create(service.ingest("alice",
                        new IngestReportRequest(DOCUMENT_URI, "text/plain", "notes.txt")))
                .expectError(IllegalArgumentException.class)
                .verify();

        assertEquals(0, reportRepository.size());
        verifyNoInteractions(accessLogRepository);
    }

    @Test
    void garbageExtractionStillProducesReport() throws Exception {
        when(extractionClient.extract(anyString(), anyString()))
                .thenReturn(Mono.just(objectMapper.readTree("{\"timestamp\": \"sometime last week\"}")));

        ReportDocument stored = ingestionService
                .ingest("alice", new IngestReportRequest(DOCUMENT_URI, "image/jpeg", "scan.jpg"))
                .block();

        assertEquals(ReportDocument.UNKNOWN_DATE, stored.getCapturedAt());
        assertTrue(stored.getValues().isEmpty());
        assertEquals(1, reportRepository.size());
    }
}
