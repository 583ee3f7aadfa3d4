package com.chanakya.vault.repository;

import com.chanakya.vault.model.document.ReportDocument;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;

@Repository
public class MongoReportRepository implements ReportRepository {

    private final ReactiveMongoTemplate mongoTemplate;

    public MongoReportRepository(ReactiveMongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public Mono<ReportDocument> insert(ReportDocument report) {
        return mongoTemplate.insert(report);
    }

    @Override
    public Flux<ReportDocument> findByOwnerId(String ownerId) {
        return mongoTemplate.find(Query.query(Criteria.where("ownerId").is(ownerId)), ReportDocument.class);
    }

    @Override
    public Flux<ReportDocument> findByOwnerIdAndIdIn(String ownerId, Collection<String> ids) {
        Query query = Query.query(
                Criteria.where("ownerId").is(ownerId)
                        .and("id").in(ids)
        );
        return mongoTemplate.find(query, ReportDocument.class);
    }
}
