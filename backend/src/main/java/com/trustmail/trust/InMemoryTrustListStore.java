package com.trustmail.trust;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.trustmail.config.TrustMailProperties;

import reactor.core.publisher.Mono;

/**
 * Process-local trust list, lost on restart. Selected with
 * {@code trustmail.trust-list.store=memory}.
 */
@Component
@ConditionalOnProperty(name = "trustmail.trust-list.store", havingValue = "memory")
public class InMemoryTrustListStore implements TrustListStore {

    private final AtomicReference<TrustList> current;

    public InMemoryTrustListStore(TrustMailProperties properties) {
        this.current = new AtomicReference<>(new TrustList(CassandraTrustListStore.seedTokens(properties), 0L));
    }

    @Override
    public Mono<TrustList> load() {
        return Mono.fromSupplier(current::get);
    }

    @Override
    public Mono<TrustList> save(List<String> tokens, long expectedVersion) {
        return Mono.defer(() -> {
            TrustList existing = current.get();
            TrustList updated = new TrustList(tokens, expectedVersion + 1);
            if (existing.version() != expectedVersion || !current.compareAndSet(existing, updated)) {
                return Mono.error(new ConcurrentTrustListUpdateException(expectedVersion));
            }
            return Mono.just(updated);
        });
    }
}
