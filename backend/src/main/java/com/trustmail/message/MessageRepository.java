package com.trustmail.message;

import org.springframework.data.cassandra.repository.ReactiveCassandraRepository;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.stereotype.Repository;

import reactor.core.publisher.Mono;

@Repository
public interface MessageRepository extends ReactiveCassandraRepository<MessageEntity, MessageKey> {

    // PAGINATION: one Cassandra page per call, continued with the paging state of the previous slice
    Mono<Slice<MessageEntity>> findAllByKeyMailbox(String mailbox, Pageable pageable);
}
