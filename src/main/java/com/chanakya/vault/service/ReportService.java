package com.chanakya.vault.service;

import com.chanakya.vault.exception.ReportConflictException;
import com.chanakya.vault.model.document.ReportDocument;
import com.chanakya.vault.repository.ReportRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;

/**
 * Owns canonical reports. The only write path is {@link #put}; reports are never updated.
 */
@Service
public class ReportService {

    private static final Logger log = LoggerFactory.getLogger(ReportService.class);

    /**
     * Newest clinical date first, undated reports last, then most recently ingested first.
     */
    public static final Comparator<ReportDocument> TIMELINE_ORDER = Comparator
            .comparing(ReportDocument::hasKnownCaptureDate).reversed()
            .thenComparing(ReportDocument::getCapturedAt, Comparator.nullsLast(Comparator.<String>reverseOrder()))
            .thenComparing(ReportDocument::getIngestedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

    private final ReportRepository reportRepository;

    public ReportService(ReportRepository reportRepository) {
        this.reportRepository = reportRepository;
    }

    public Mono<ReportDocument> put(ReportDocument report) {
        return reportRepository.insert(report)
                .onErrorMap(DuplicateKeyException.class,
                        e -> new ReportConflictException("Report " + report.getId() + " already exists"))
                .doOnNext(saved -> log.info("event=report_stored reportId={} ownerId={} capturedAt={}",
                        saved.getId(), saved.getOwnerId(), saved.getCapturedAt()));
    }

    public Flux<ReportDocument> listByOwner(String ownerId) {
        return reportRepository.findByOwnerId(ownerId).sort(TIMELINE_ORDER);
    }

    /**
     * Returns the requested reports that exist and belong to {@code ownerId}. Callers compare the
     * result with the request to detect ids that are missing or owned by someone else.
     */
    public Flux<ReportDocument> getByIds(String ownerId, Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return Flux.empty();
        }
        return reportRepository.findByOwnerIdAndIdIn(ownerId, ids);
    }
}
