package com.chanakya.vault.service;

import com.chanakya.vault.exception.GrantNotFoundException;
import com.chanakya.vault.model.document.AccessGrantDocument;
import com.chanakya.vault.model.document.AccessLogDocument;
import com.chanakya.vault.model.dto.response.AccessLogEntry;
import com.chanakya.vault.model.enums.AccessType;
import com.chanakya.vault.repository.AccessGrantRepository;
import com.chanakya.vault.repository.AccessLogRepository;
import com.chanakya.vault.util.EntropyUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.util.Set;

@Service
public class AccessLogService {

    private static final Logger log = LoggerFactory.getLogger(AccessLogService.class);

    private static final Set<AccessType> DATA_ACCESS_EVENTS = Set.of(AccessType.TIMELINE_VIEWED);

    private final AccessLogRepository accessLogRepository;
    private final AccessGrantRepository grantRepository;
    private final Clock clock;

    public AccessLogService(AccessLogRepository accessLogRepository,
                            AccessGrantRepository grantRepository,
                            Clock clock) {
        this.accessLogRepository = accessLogRepository;
        this.grantRepository = grantRepository;
        this.clock = clock;
    }

    public Mono<Void> logGrantEvent(AccessGrantDocument grant, AccessType accessType, String detail) {
        return save(AccessLogDocument.builder()
                .id(EntropyUtil.generateId())
                .ownerId(grant.getOwnerId())
                .grantId(grant.getId())
                .accessType(accessType)
                .detail(detail)
                .accessedAt(clock.instant())
                .build());
    }

    public Mono<Void> logReportEvent(String ownerId, String reportId, AccessType accessType) {
        return save(AccessLogDocument.builder()
                .id(EntropyUtil.generateId())
                .ownerId(ownerId)
                .reportId(reportId)
                .accessType(accessType)
                .accessedAt(clock.instant())
                .build());
    }

    /**
     * Data access events must be recorded: they are retried and a persistent failure fails the read.
     * Everything else is best-effort.
     */
    private Mono<Void> save(AccessLogDocument entry) {
        Mono<Void> save = accessLogRepository.save(entry)
                .doOnError(e -> log.error("event=access_log_write_failed ownerId={} accessType={} error={}",
                        entry.getOwnerId(), entry.getAccessType(), e.getMessage()))
                .then();

        if (DATA_ACCESS_EVENTS.contains(entry.getAccessType())) {
            return save.retryWhen(Retry.backoff(2, Duration.ofMillis(100)));
        }
        return save.onErrorResume(e -> Mono.empty());
    }

    public Flux<AccessLogEntry> listForOwner(String ownerId) {
        return accessLogRepository.findByOwnerIdOrderByAccessedAtDesc(ownerId)
                .map(this::toEntry);
    }

    public Flux<AccessLogEntry> listForGrant(String ownerId, String grantId) {
        return grantRepository.findByOwnerIdAndId(ownerId, grantId)
                .switchIfEmpty(Mono.error(new GrantNotFoundException("Grant not found")))
                .flatMapMany(grant -> accessLogRepository.findByGrantIdOrderByAccessedAtDesc(grant.getId()))
                .map(this::toEntry);
    }

    private AccessLogEntry toEntry(AccessLogDocument doc) {
        return new AccessLogEntry(
                doc.getId(),
                doc.getGrantId(),
                doc.getReportId(),
                doc.getAccessType(),
                doc.getDetail(),
                doc.getAccessedAt()
        );
    }
}
