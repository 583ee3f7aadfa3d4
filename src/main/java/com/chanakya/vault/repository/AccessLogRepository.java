package com.chanakya.vault.repository;

import com.chanakya.vault.model.document.AccessLogDocument;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import reactor.core.publisher.Flux;

public interface AccessLogRepository extends ReactiveMongoRepository<AccessLogDocument, String> {

    Flux<AccessLogDocument> findByOwnerIdOrderByAccessedAtDesc(String ownerId);

    Flux<AccessLogDocument> findByGrantIdOrderByAccessedAtDesc(String grantId);
}
