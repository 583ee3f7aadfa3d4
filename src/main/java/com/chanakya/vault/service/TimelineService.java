package com.chanakya.vault.service;

import com.chanakya.vault.exception.GrantExpiredException;
import com.chanakya.vault.exception.GrantRevokedException;
import com.chanakya.vault.model.document.AccessGrantDocument;
import com.chanakya.vault.model.document.ReportDocument;
import com.chanakya.vault.model.enums.AccessType;
import com.chanakya.vault.model.enums.GrantStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * Read path for viewers holding an access token. Returns only the reports the grant names.
 */
@Service
public class TimelineService {

    private static final Logger log = LoggerFactory.getLogger(TimelineService.class);

    private final AccessGrantService grantService;
    private final ReportService reportService;
    private final AccessLogService accessLogService;
    private final Clock clock;

    public TimelineService(AccessGrantService grantService,
                           ReportService reportService,
                           AccessLogService accessLogService,
                           Clock clock) {
        this.grantService = grantService;
        this.reportService = reportService;
        this.accessLogService = accessLogService;
        this.clock = clock;
    }

    public Flux<ReportDocument> readTimeline(String token) {
        return grantService.resolve(token)
                .flatMap(this::requireUsable)
                .flatMapMany(grant -> reportService.getByIds(grant.getOwnerId(), grant.getReportIds())
                        .sort(ReportService.TIMELINE_ORDER)
                        .collectList()
                        .flatMap(reports -> accessLogService
                                .logGrantEvent(grant, AccessType.TIMELINE_VIEWED, reports.size() + " reports")
                                .thenReturn(reports))
                        .doOnNext(reports -> log.info("event=timeline_viewed grantId={} reportCount={}",
                                grant.getId(), reports.size()))
                        .flatMapIterable(reports -> reports));
    }

    private Mono<AccessGrantDocument> requireUsable(AccessGrantDocument grant) {
        GrantStatus status = grant.statusAt(clock.instant());
        if (status == GrantStatus.ACTIVE) {
            return Mono.just(grant);
        }
        log.info("event=timeline_denied grantId={} status={}", grant.getId(), status);
        RuntimeException denial = status == GrantStatus.REVOKED
                ? new GrantRevokedException("Grant has been revoked")
                : new GrantExpiredException("Grant has expired");
        return accessLogService.logGrantEvent(grant, AccessType.TIMELINE_DENIED, status.name())
                .then(Mono.<AccessGrantDocument>error(denial));
    }
}
