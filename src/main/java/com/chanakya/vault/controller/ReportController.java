package com.chanakya.vault.controller;

import com.chanakya.vault.model.dto.request.IngestReportRequest;
import com.chanakya.vault.model.dto.response.ReportResponse;
import com.chanakya.vault.service.ReportIngestionService;
import com.chanakya.vault.service.ReportService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

// TODO: take ownerId from the authenticated principal once OAuth2 login is wired in
@RestController
@RequestMapping("/api/patients/{ownerId}/reports")
public class ReportController {

    private final ReportIngestionService ingestionService;
    private final ReportService reportService;

    public ReportController(ReportIngestionService ingestionService, ReportService reportService) {
        this.ingestionService = ingestionService;
        this.reportService = reportService;
    }

    /**
     * Extract and store a report from an uploaded document.
     */
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<ReportResponse> ingest(@PathVariable String ownerId,
                                       @Valid @RequestBody IngestReportRequest request) {
        return ingestionService.ingest(ownerId, request).map(ReportResponse::from);
    }

    /**
     * The patient's own timeline, newest first.
     */
    @GetMapping
    public Flux<ReportResponse> listReports(@PathVariable String ownerId) {
        return reportService.listByOwner(ownerId).map(ReportResponse::from);
    }
}
