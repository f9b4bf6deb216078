package com.trustmail.directory;

import java.util.List;

import com.trustmail.trust.GroupRef;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Directory of named contact groups whose members can be trusted as a whole.
 */
public interface GroupDirectory {

    /**
     * Member addresses of the referenced group.
     * Signals {@link com.trustmail.error.NotFoundException} when the group does not exist.
     */
    Mono<List<String>> expand(GroupRef ref);

    /** Id of the group with this exact name, creating it when absent. */
    Mono<String> ensureGroup(String name);

    Mono<Void> addMembers(String groupId, List<String> emails);

    Mono<Void> removeMembers(String groupId, List<String> emails);

    /** Member ids inside the group whose address matches {@code email}, ignoring case. */
    Flux<String> findMembersByEmail(String groupId, String email);
}
