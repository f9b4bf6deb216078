package com.trustmail.trust;

import java.util.List;

import reactor.core.publisher.Mono;

/**
 * Durable home of the process-wide trust list.
 *
 * <p>{@link #save} is a compare-and-set: it succeeds only when the stored version still
 * equals {@code expectedVersion}, otherwise it signals
 * {@link ConcurrentTrustListUpdateException}.
 */
public interface TrustListStore {

    Mono<TrustList> load();

    Mono<TrustList> save(List<String> tokens, long expectedVersion);
}
