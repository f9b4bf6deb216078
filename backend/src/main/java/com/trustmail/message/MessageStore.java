package com.trustmail.message;

import java.util.List;

import com.trustmail.rule.RuleAction;

import reactor.core.publisher.Mono;

/**
 * Mailbox operations the trust gateway and the rule engine depend on.
 *
 * <p>Implementations signal {@link com.trustmail.error.AuthException} for credential or
 * permission failures, {@link com.trustmail.error.NotFoundException} for unknown ids and
 * {@link com.trustmail.error.TransientApiException} for retryable failures.
 */
public interface MessageStore {

    /**
     * One page of ids matching a search expression such as
     * {@code from:alice@example.com subject:(invoice) has:attachment}.
     *
     * @param pageToken null for the first page
     */
    Mono<MessagePage> list(String mailbox, String query, String pageToken);

    /** Applies the label changes to every id in one call; fails as a whole. */
    Mono<Void> batchMutate(String mailbox, List<String> ids, RuleAction action);

    Mono<Void> mutate(String mailbox, String id, RuleAction action);

    /** @return the draft id */
    Mono<String> createDraft(OutgoingMessage content);

    /** @return the id of the sent message */
    Mono<String> send(OutgoingMessage content);

    Mono<MessageEntity> find(String mailbox, String id);
}
