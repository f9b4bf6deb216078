package com.trustmail.rule;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.trustmail.error.AuthException;
import com.trustmail.message.MessageStore;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Applies a rule's label changes to messages that already exist.
 *
 * <p>A run pages through every message matching the selector, then mutates the collected
 * ids in chunks of {@code batchSize}. A chunk is sent as one bulk call; when that fails each
 * id is retried individually and failures are recorded in the run state instead of
 * stopping the run. Pages and chunks are processed strictly one after another, separated by
 * {@code rateLimitDelay}.
 *
 * <p>Authorization failures abort the run. Any other failure while listing ends the run
 * early with a "General error" entry in the returned report.
 */
@Service
public class RetroactiveRuleApplier {

    private static final Logger log = LoggerFactory.getLogger(RetroactiveRuleApplier.class);

    private final MessageStore messageStore;

    public RetroactiveRuleApplier(MessageStore messageStore) {
        this.messageStore = messageStore;
    }

    public Mono<RetroactiveRunState> apply(String mailbox, RuleSelector selector, RuleAction action,
                                           RetroactiveConfig config) {
        return apply(mailbox, selector, action, config, RetroactiveProgressListener.NONE);
    }

    public Mono<RetroactiveRunState> apply(String mailbox, RuleSelector selector, RuleAction action,
                                           RetroactiveConfig config, RetroactiveProgressListener listener) {
        RetroactiveRunState state = new RetroactiveRunState();
        if (!action.hasLabelChanges()) {
            log.warn("[retroactive] No label actions specified, nothing to apply");
            return Mono.just(state);
        }
        String query = selector.toQuery();
        log.info("[retroactive] Starting in {} with query '{}'", mailbox, query);

        return Mono.defer(() -> collectIds(mailbox, query, null, 1, new ArrayList<>(), state, config, listener))
                .flatMap(ids -> {
                    state.setTotalFound(ids.size());
                    log.info("[retroactive] Total messages found: {}", ids.size());
                    List<BatchChunk> chunks = BatchChunk.partition(ids, config.batchSize());
                    return Flux.fromIterable(chunks)
                            .concatMap(chunk -> processChunk(mailbox, chunk, action, config, state)
                                    .then(Mono.fromRunnable(() ->
                                            listener.onBatchCompleted(chunk.index() + 1, chunks.size(), state)))
                                    .then(chunk.index() < chunks.size() - 1
                                            ? pause(config.rateLimitDelay())
                                            : Mono.empty()))
                            .then(Mono.just(state));
                })
                .onErrorResume(error -> !(error instanceof AuthException), error -> {
                    log.error("[retroactive] Unexpected error: {}", error.getMessage());
                    state.addError("General error during retroactive application: " + error.getMessage());
                    return Mono.just(state);
                })
                .doOnNext(done -> log.info("[retroactive] Completed - {}", done));
    }

    /**
     * Follows continuation tokens until the store has no more pages or the id limit is hit.
     * Hitting the limit trims the candidates and marks the run truncated.
     */
    private Mono<List<String>> collectIds(String mailbox, String query, String pageToken, int pageNumber,
                                          List<String> ids, RetroactiveRunState state, RetroactiveConfig config,
                                          RetroactiveProgressListener listener) {
        return messageStore.list(mailbox, query, pageToken)
                .flatMap(page -> {
                    ids.addAll(page.ids());
                    log.debug("[retroactive] Page {}: {} id(s), {} so far", pageNumber, page.ids().size(), ids.size());
                    listener.onPageFetched(pageNumber, page.ids().size(), ids.size());

                    if (config.isLimited() && ids.size() >= config.maxItems()) {
                        state.markTruncated();
                        log.info("[retroactive] Reached max items limit: {}", config.maxItems());
                        return Mono.just(List.copyOf(ids.subList(0, config.maxItems())));
                    }
                    if (!page.hasNext()) {
                        return Mono.just(List.copyOf(ids));
                    }
                    return pause(config.rateLimitDelay())
                            .then(Mono.defer(() -> collectIds(mailbox, query, page.nextPageToken(), pageNumber + 1,
                                    ids, state, config, listener)));
                });
    }

    private Mono<Void> processChunk(String mailbox, BatchChunk chunk, RuleAction action,
                                    RetroactiveConfig config, RetroactiveRunState state) {
        log.info("[retroactive] Processing batch {}: {} message(s)", chunk.index() + 1, chunk.size());
        if (chunk.size() == 1) {
            String id = chunk.ids().get(0);
            return mutateOne(mailbox, id, action)
                    .doOnNext(result -> fold(List.of(result), state))
                    .then();
        }
        return messageStore.batchMutate(mailbox, chunk.ids(), action)
                .then(Mono.fromRunnable(() -> state.addProcessed(chunk.size())))
                .onErrorResume(error -> !(error instanceof AuthException), error -> {
                    log.warn("[retroactive] Batch processing failed, falling back to individual calls: {}",
                            error.getMessage());
                    return mutateIndividually(mailbox, chunk, action, config)
                            .doOnNext(results -> fold(results, state))
                            .then();
                })
                .then();
    }

    private Mono<List<MutationResult>> mutateIndividually(String mailbox, BatchChunk chunk, RuleAction action,
                                                          RetroactiveConfig config) {
        List<String> ids = chunk.ids();
        return Flux.range(0, ids.size())
                .concatMap(i -> mutateOne(mailbox, ids.get(i), action)
                        .flatMap(result -> i < ids.size() - 1
                                ? pause(config.rateLimitDelay()).thenReturn(result)
                                : Mono.just(result)))
                .collectList();
    }

    private Mono<MutationResult> mutateOne(String mailbox, String id, RuleAction action) {
        return messageStore.mutate(mailbox, id, action)
                .then(Mono.just(MutationResult.ok(id)))
                .onErrorResume(error -> !(error instanceof AuthException),
                        error -> Mono.just(MutationResult.failed(id, error)));
    }

    static void fold(List<MutationResult> results, RetroactiveRunState state) {
        for (MutationResult result : results) {
            if (result.succeeded()) {
                state.addProcessed(1);
            } else {
                log.warn("[retroactive] Failed to process message {}: {}", result.id(), result.error().getMessage());
                state.addError("Message " + result.id() + ": " + result.error().getMessage());
            }
        }
    }

    private static Mono<Void> pause(Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return Mono.empty();
        }
        return Mono.delay(delay).then();
    }
}
