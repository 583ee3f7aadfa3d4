package com.chanakya.vault.repository;

import com.chanakya.vault.model.document.ReportDocument;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;

/**
 * Storage for canonical reports. Inserting an existing id fails with
 * {@link org.springframework.dao.DuplicateKeyException}.
 */
public interface ReportRepository {

    Mono<ReportDocument> insert(ReportDocument report);

    Flux<ReportDocument> findByOwnerId(String ownerId);

    Flux<ReportDocument> findByOwnerIdAndIdIn(String ownerId, Collection<String> ids);
}
