package com.trustmail.directory;

import org.springframework.data.cassandra.repository.ReactiveCassandraRepository;
import org.springframework.stereotype.Repository;

import reactor.core.publisher.Flux;

@Repository
public interface ContactGroupRepository extends ReactiveCassandraRepository<ContactGroupEntity, String> {

    // backed by the contact_groups_by_name secondary index
    Flux<ContactGroupEntity> findByName(String name);
}
