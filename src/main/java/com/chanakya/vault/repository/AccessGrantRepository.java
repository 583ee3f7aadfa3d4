package com.chanakya.vault.repository;

import com.chanakya.vault.model.document.AccessGrantDocument;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Storage for access grants. Implementations must reject a grant whose id or token already
 * exists with {@link org.springframework.dao.DuplicateKeyException}, atomically with the insert.
 */
public interface AccessGrantRepository {

    Mono<AccessGrantDocument> insert(AccessGrantDocument grant);

    Mono<AccessGrantDocument> findByToken(String token);

    Mono<AccessGrantDocument> findByOwnerIdAndId(String ownerId, String id);

    /**
     * Sets {@code active = false} and returns the grant as it was before the update, or empty if the
     * owner has no such grant.
     */
    Mono<AccessGrantDocument> deactivate(String ownerId, String id);

    /**
     * Grants still flagged active, newest first. Expired grants are included.
     */
    Flux<AccessGrantDocument> findActiveByOwnerId(String ownerId);
}
