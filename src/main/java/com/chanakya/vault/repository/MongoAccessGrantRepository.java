package com.chanakya.vault.repository;

import com.chanakya.vault.model.document.AccessGrantDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public class MongoAccessGrantRepository implements AccessGrantRepository {

    private final ReactiveMongoTemplate mongoTemplate;

    public MongoAccessGrantRepository(ReactiveMongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public Mono<AccessGrantDocument> insert(AccessGrantDocument grant) {
        // unique index on token turns a collision into DuplicateKeyException
        return mongoTemplate.insert(grant);
    }

    @Override
    public Mono<AccessGrantDocument> findByToken(String token) {
        return mongoTemplate.findOne(Query.query(Criteria.where("token").is(token)), AccessGrantDocument.class);
    }

    @Override
    public Mono<AccessGrantDocument> findByOwnerIdAndId(String ownerId, String id) {
        return mongoTemplate.findOne(ownedGrant(ownerId, id), AccessGrantDocument.class);
    }

    @Override
    public Mono<AccessGrantDocument> deactivate(String ownerId, String id) {
        return mongoTemplate.findAndModify(
                ownedGrant(ownerId, id),
                new Update().set("active", false),
                FindAndModifyOptions.options().returnNew(false),
                AccessGrantDocument.class
        );
    }

    @Override
    public Flux<AccessGrantDocument> findActiveByOwnerId(String ownerId) {
        Query query = Query.query(
                Criteria.where("ownerId").is(ownerId)
                        .and("active").is(true)
        ).with(Sort.by(Sort.Direction.DESC, "issuedAt"));
        return mongoTemplate.find(query, AccessGrantDocument.class);
    }

    private Query ownedGrant(String ownerId, String id) {
        return Query.query(
                Criteria.where("id").is(id)
                        .and("ownerId").is(ownerId)
        );
    }
}
