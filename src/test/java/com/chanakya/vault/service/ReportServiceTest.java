package com.chanakya.vault.service;

import com.chanakya.vault.exception.ReportConflictException;
import com.chanakya.vault.model.document.ReportDocument;
import com.chanakya.vault.repository.InMemoryReportRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Set;

import static com.chanakya.vault.TestFixtures.NOW;
import static com.chanakya.vault.TestFixtures.report;
import static org.junit.jupiter.api.Assertions.*;

class ReportServiceTest {

    private InMemoryReportRepository repository;
    private ReportService reportService;

    @BeforeEach
    void setUp() {
        repository = new InMemoryReportRepository();
        reportService = new ReportService(repository);
    }

    @Test
    void putRejectsDuplicateId() {
        ReportDocument first = report("r-1", "alice", "2024-01-10", NOW);
        ReportDocument again = report("r-1", "alice", "2024-02-10", NOW.plusSeconds(5));

        StepVerifier.create(reportService.put(first)).expectNext(first).verifyComplete();
        StepVerifier.create(reportService.put(again))
                .expectError(ReportConflictException.class)
                .verify();
        assertEquals(1, repository.size());
    }

    @Test
    void listByOwnerOrdersByCaptureDateThenIngestion() {
        reportService.put(report("old", "alice", "2023-06-01", NOW)).block();
        reportService.put(report("undated", "alice", ReportDocument.UNKNOWN_DATE, NOW.plusSeconds(100))).block();
        reportService.put(report("new-first-ingest", "alice", "2024-03-01", NOW)).block();
        reportService.put(report("new-second-ingest", "alice", "2024-03-01", NOW.plusSeconds(60))).block();
        reportService.put(report("bob-report", "bob", "2025-01-01", NOW)).block();

        List<String> ids = reportService.listByOwner("alice")
                .map(ReportDocument::getId)
                .collectList()
                .block();

        assertEquals(List.of("new-second-ingest", "new-first-ingest", "old", "undated"), ids);
    }

    @Test
    void getByIdsReturnsOnlyOwnedExistingReports() {
        reportService.put(report("a-1", "alice", "2024-01-10", NOW)).block();
        reportService.put(report("a-2", "alice", "2024-03-01", NOW)).block();
        reportService.put(report("b-1", "bob", "2024-02-01", NOW)).block();

        StepVerifier.create(reportService.getByIds("alice", Set.of("a-1", "b-1", "missing"))
                        .map(ReportDocument::getId))
                .expectNext("a-1")
                .verifyComplete();
    }

    @Test
    void getByIdsWithNoIdsIsEmpty() {
        reportService.put(report("a-1", "alice", "2024-01-10", NOW)).block();

        StepVerifier.create(reportService.getByIds("alice", Set.of())).verifyComplete();
    }
}
