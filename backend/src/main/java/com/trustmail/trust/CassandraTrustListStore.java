package com.trustmail.trust;

import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.cassandra.core.EntityWriteResult;
import org.springframework.data.cassandra.core.InsertOptions;
import org.springframework.data.cassandra.core.ReactiveCassandraOperations;
import org.springframework.data.cassandra.core.UpdateOptions;
import org.springframework.data.cassandra.core.query.Criteria;
import org.springframework.stereotype.Component;

import com.trustmail.config.TrustMailProperties;

import reactor.core.publisher.Mono;

/**
 * Trust list kept in a single Cassandra row. Writes are lightweight transactions
 * conditioned on the version column.
 */
@Component
@ConditionalOnProperty(name = "trustmail.trust-list.store", havingValue = "cassandra", matchIfMissing = true)
public class CassandraTrustListStore implements TrustListStore {

    private static final Logger log = LoggerFactory.getLogger(CassandraTrustListStore.class);

    static final String LIST_ID = "default";

    private final ReactiveCassandraOperations operations;
    private final TrustMailProperties properties;

    public CassandraTrustListStore(ReactiveCassandraOperations operations, TrustMailProperties properties) {
        this.operations = operations;
        this.properties = properties;
    }

    @Override
    public Mono<TrustList> load() {
        return operations.selectOneById(LIST_ID, TrustListEntity.class)
                .map(entity -> new TrustList(
                        entity.getTokens() != null ? entity.getTokens() : List.of(),
                        entity.getVersion()))
                .switchIfEmpty(Mono.fromSupplier(() -> new TrustList(seedTokens(properties), 0L)));
    }

    @Override
    public Mono<TrustList> save(List<String> tokens, long expectedVersion) {
        TrustListEntity entity = new TrustListEntity(LIST_ID, List.copyOf(tokens), expectedVersion + 1);
        Mono<EntityWriteResult<TrustListEntity>> write;
        if (expectedVersion == 0L) {
            write = operations.insert(entity, InsertOptions.builder().withIfNotExists().build());
        } else {
            write = operations.update(entity, UpdateOptions.builder()
                    .ifCondition(Criteria.where("version").is(expectedVersion))
                    .build());
        }
        return write.flatMap(result -> {
            if (!result.wasApplied()) {
                log.info("[trust_list] Version {} is stale, write rejected", expectedVersion);
                return Mono.error(new ConcurrentTrustListUpdateException(expectedVersion));
            }
            return Mono.just(new TrustList(entity.getTokens(), entity.getVersion()));
        });
    }

    static List<String> seedTokens(TrustMailProperties properties) {
        String seed = properties.getTrustList().getSeed();
        if (seed == null || seed.isBlank()) {
            return List.of();
        }
        return Arrays.stream(seed.split(","))
                .map(String::trim)
                .filter(token -> !token.isEmpty())
                .toList();
    }
}
