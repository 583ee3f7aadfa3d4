package com.chanakya.vault;

import com.chanakya.vault.config.VaultProperties;
import com.chanakya.vault.model.document.AccessLogDocument;
import com.chanakya.vault.model.document.ReportDocument;
import com.chanakya.vault.repository.AccessLogRepository;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public final class TestFixtures {

    public static final Instant NOW = Instant.parse("2024-03-15T10:00:00Z");

    private TestFixtures() {}

    public static Clock clockAt(Instant instant) {
        return Clock.fixed(instant, ZoneOffset.UTC);
    }

    public static VaultProperties properties() {
        return new VaultProperties(
                "https://vault.example.org/#doctor-view",
                new VaultProperties.Grants(Duration.ofHours(24), 3),
                new VaultProperties.Extraction("http://localhost:9999", "test-key", "test-model", Duration.ofSeconds(5)),
                new VaultProperties.Cors(List.of("*"))
        );
    }

    public static ReportDocument report(String id, String ownerId, String capturedAt, Instant ingestedAt) {
        return ReportDocument.builder()
                .id(id)
                .ownerId(ownerId)
                .reportType("CBC")
                .capturedAt(capturedAt)
                .ingestedAt(ingestedAt)
                .values(Map.of())
                .findings(List.of())
                .medications(List.of())
                .diagnoses(List.of())
                .summaryForPatient("")
                .summaryForClinician("")
                .build();
    }

    /**
     * An access log repository that accepts every write.
     */
    public static AccessLogRepository acceptingAccessLog() {
        AccessLogRepository repository = mock(AccessLogRepository.class);
        when(repository.save(any(AccessLogDocument.class)))
                .thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));
        return repository;
    }
}
