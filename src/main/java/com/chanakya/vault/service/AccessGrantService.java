package com.chanakya.vault.service;

import com.chanakya.vault.config.VaultProperties;
import com.chanakya.vault.exception.GrantNotFoundException;
import com.chanakya.vault.exception.InvalidScopeException;
import com.chanakya.vault.exception.InvalidTokenException;
import com.chanakya.vault.exception.ScopeForbiddenException;
import com.chanakya.vault.exception.TokenAllocationException;
import com.chanakya.vault.model.document.AccessGrantDocument;
import com.chanakya.vault.model.dto.response.GrantResponse;
import com.chanakya.vault.model.enums.AccessType;
import com.chanakya.vault.repository.AccessGrantRepository;
import com.chanakya.vault.util.EntropyUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Issues, resolves and revokes access grants. Issuance is the only place report ownership is
 * checked against a grant's scope.
 */
@Service
public class AccessGrantService {

    private static final Logger log = LoggerFactory.getLogger(AccessGrantService.class);

    public static final Duration MAX_TTL = Duration.ofDays(30);

    private final AccessGrantRepository grantRepository;
    private final ReportService reportService;
    private final AccessLogService accessLogService;
    private final VaultProperties properties;
    private final Clock clock;

    public AccessGrantService(AccessGrantRepository grantRepository,
                              ReportService reportService,
                              AccessLogService accessLogService,
                              VaultProperties properties,
                              Clock clock) {
        this.grantRepository = grantRepository;
        this.reportService = reportService;
        this.accessLogService = accessLogService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Issues a grant over exactly {@code reportIds}. All ids must belong to {@code ownerId};
     * otherwise nothing is written. A null {@code ttl} means the configured default; lifetimes
     * above {@link #MAX_TTL} are rejected.
     */
    public Mono<AccessGrantDocument> issue(String ownerId, Collection<String> reportIds, Duration ttl) {
        if (reportIds == null || reportIds.isEmpty()) {
            return Mono.error(new InvalidScopeException("At least one report must be selected"));
        }
        if (reportIds.stream().anyMatch(id -> id == null || id.isBlank())) {
            return Mono.error(new InvalidScopeException("Report ids must not be blank"));
        }
        Duration lifetime = ttl != null ? ttl : properties.grants().defaultTtl();
        if (lifetime.isZero() || lifetime.isNegative()) {
            return Mono.error(new InvalidScopeException("Grant lifetime must be positive"));
        }
        if (lifetime.compareTo(MAX_TTL) > 0) {
            return Mono.error(new InvalidScopeException("Grant lifetime must not exceed " + MAX_TTL.toDays() + " days"));
        }
        Set<String> scope = new LinkedHashSet<>(reportIds);

        return reportService.getByIds(ownerId, scope)
                .count()
                .flatMap(owned -> {
                    if (owned != scope.size()) {
                        log.warn("event=grant_scope_rejected ownerId={} requested={} owned={}",
                                ownerId, scope.size(), owned);
                        return Mono.error(new ScopeForbiddenException(
                                "One or more selected reports do not belong to this patient"));
                    }
                    return insertWithFreshToken(ownerId, new ArrayList<>(scope), lifetime, 1);
                })
                .flatMap(grant -> accessLogService.logGrantEvent(grant, AccessType.GRANT_ISSUED, null)
                        .thenReturn(grant))
                .doOnNext(grant -> log.info("event=grant_issued grantId={} ownerId={} scopeSize={} expiresAt={}",
                        grant.getId(), ownerId, grant.getReportIds().size(), grant.getExpiresAt()));
    }

    private Mono<AccessGrantDocument> insertWithFreshToken(String ownerId, List<String> scope,
                                                           Duration lifetime, int attempt) {
        Instant now = clock.instant();
        AccessGrantDocument grant = AccessGrantDocument.builder()
                .id(EntropyUtil.generateId())
                .token(EntropyUtil.generateAccessToken())
                .ownerId(ownerId)
                .reportIds(List.copyOf(scope))
                .issuedAt(now)
                .expiresAt(now.plus(lifetime))
                .active(true)
                .build();

        return grantRepository.insert(grant)
                .onErrorResume(DuplicateKeyException.class, e -> {
                    int maxAttempts = properties.grants().tokenAttempts();
                    if (attempt >= maxAttempts) {
                        return Mono.error(new TokenAllocationException(attempt));
                    }
                    log.warn("event=grant_token_collision ownerId={} attempt={}", ownerId, attempt);
                    return insertWithFreshToken(ownerId, scope, lifetime, attempt + 1);
                });
    }

    /**
     * Deactivates a grant. Revoking an already revoked grant succeeds; only the first revocation
     * is audited.
     */
    public Mono<AccessGrantDocument> revoke(String ownerId, String grantId) {
        return grantRepository.deactivate(ownerId, grantId)
                .switchIfEmpty(Mono.error(new GrantNotFoundException("Grant not found")))
                .flatMap(previous -> {
                    AccessGrantDocument revoked = previous.toBuilder().active(false).build();
                    if (!previous.isActive()) {
                        log.debug("event=grant_already_revoked grantId={} ownerId={}", grantId, ownerId);
                        return Mono.just(revoked);
                    }
                    return accessLogService.logGrantEvent(revoked, AccessType.GRANT_REVOKED, null)
                            .doOnSuccess(v -> log.info("event=grant_revoked grantId={} ownerId={}", grantId, ownerId))
                            .thenReturn(revoked);
                });
    }

    /**
     * Looks a grant up by its bearer token. Validity is left to the caller.
     */
    public Mono<AccessGrantDocument> resolve(String token) {
        if (token == null || token.isBlank()) {
            return Mono.error(new InvalidTokenException("Unknown access token"));
        }
        return grantRepository.findByToken(token)
                .switchIfEmpty(Mono.error(new InvalidTokenException("Unknown access token")));
    }

    public Flux<AccessGrantDocument> listActive(String ownerId) {
        return grantRepository.findActiveByOwnerId(ownerId);
    }

    public Mono<AccessGrantDocument> findOwned(String ownerId, String grantId) {
        return grantRepository.findByOwnerIdAndId(ownerId, grantId)
                .switchIfEmpty(Mono.error(new GrantNotFoundException("Grant not found")));
    }

    public String shareUrl(AccessGrantDocument grant) {
        String base = properties.viewerBaseUrl();
        String separator = base.endsWith("/") ? "" : "/";
        return base + separator + grant.getToken();
    }

    public GrantResponse toResponse(AccessGrantDocument grant) {
        return new GrantResponse(
                grant.getId(),
                grant.getToken(),
                shareUrl(grant),
                grant.getReportIds(),
                grant.getIssuedAt(),
                grant.getExpiresAt(),
                grant.isActive(),
                grant.statusAt(clock.instant())
        );
    }
}
