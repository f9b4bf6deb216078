package com.trustmail.rule;

import org.springframework.data.cassandra.repository.ReactiveCassandraRepository;
import org.springframework.stereotype.Repository;

import reactor.core.publisher.Flux;

@Repository
public interface RuleRepository extends ReactiveCassandraRepository<RuleEntity, RuleKey> {

    Flux<RuleEntity> findAllByKeyMailbox(String mailbox);
}
