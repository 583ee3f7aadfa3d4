package com.chanakya.vault.controller;

import com.chanakya.vault.exception.GlobalExceptionHandler;
import com.chanakya.vault.model.document.AccessGrantDocument;
import com.chanakya.vault.repository.InMemoryAccessGrantRepository;
import com.chanakya.vault.repository.InMemoryReportRepository;
import com.chanakya.vault.service.AccessGrantService;
import com.chanakya.vault.service.AccessLogService;
import com.chanakya.vault.service.ReportService;
import com.chanakya.vault.service.TimelineService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static com.chanakya.vault.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;

class TimelineControllerTest {

    private InMemoryAccessGrantRepository grantRepository;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        Clock clock = clockAt(NOW);
        InMemoryReportRepository reportRepository = new InMemoryReportRepository();
        grantRepository = new InMemoryAccessGrantRepository();
        ReportService reportService = new ReportService(reportRepository);
        AccessLogService accessLogService = new AccessLogService(acceptingAccessLog(), grantRepository, clock);
        AccessGrantService grantService = new AccessGrantService(
                grantRepository, reportService, accessLogService, properties(), clock);

        reportService.put(report("r-1", "alice", "2024-01-10", NOW)).block();
        reportService.put(report("r-2", "alice", "2024-03-01", NOW)).block();

        client = WebTestClient.bindToController(
                        new TimelineController(new TimelineService(grantService, reportService, accessLogService, clock)))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private void storeGrant(String token, boolean active, Duration remaining) {
        grantRepository.store(AccessGrantDocument.builder()
                .id("grant-" + token)
                .token(token)
                .ownerId("alice")
                .reportIds(List.of("r-1"))
                .issuedAt(NOW.minus(Duration.ofHours(2)))
                .expiresAt(NOW.plus(remaining))
                .active(active)
                .build());
    }

    private byte[] failureBody(String token) {
        return client.get().uri("/api/timeline/{token}", token)
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("access_unavailable")
                .returnResult()
                .getResponseBody();
    }

    @Test
    void returnsScopedReports() {
        storeGrant("tok-live", true, Duration.ofHours(1));

        client.get().uri("/api/timeline/{token}", "tok-live")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(1)
                .jsonPath("$[0].id").isEqualTo("r-1")
                .jsonPath("$[0].ownerId").doesNotExist();
    }

    @Test
    void unknownRevokedAndExpiredTokensLookTheSame() {
        storeGrant("tok-revoked", false, Duration.ofHours(1));
        storeGrant("tok-expired", true, Duration.ofHours(-1));

        byte[] unknown = failureBody("tok-missing");
        assertArrayEquals(unknown, failureBody("tok-revoked"));
        assertArrayEquals(unknown, failureBody("tok-expired"));
    }
}
