package com.trustmail.message;

import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.datastax.oss.driver.api.core.uuid.Uuids;

import reactor.core.publisher.Mono;

/**
 * Read side of a mailbox: search listing and direct lookup.
 */
@Service
public class MessageService {

    private final CassandraMessageStore store;

    public MessageService(CassandraMessageStore store) {
        this.store = store;
    }

    public Mono<MessageListing> search(String mailbox, String query, String pageToken) {
        return Mono.defer(() -> {
            MessageQuery filter = MessageQuery.parse(query);
            return store.listEntities(mailbox, pageToken)
                    .map(slice -> {
                        List<MessageSummary> summaries = slice.getContent().stream()
                                .filter(filter)
                                .map(this::mapToSummary)
                                .toList();
                        return new MessageListing(summaries, CassandraMessageStore.nextPageToken(slice));
                    });
        });
    }

    public Mono<MessageDetail> getMessage(String mailbox, String id) {
        return store.find(mailbox, id)
                .map(entity -> new MessageDetail(
                        entity.getKey().id().toString(),
                        entity.getThreadId() != null ? entity.getThreadId().toString() : null,
                        entity.getSender(),
                        orEmpty(entity.getToRecipients()),
                        orEmpty(entity.getCcRecipients()),
                        entity.getSubject(),
                        entity.getBody(),
                        entity.getHtmlBody(),
                        entity.isHasAttachment(),
                        entity.getSizeBytes(),
                        entity.getLabelIds() != null ? entity.getLabelIds() : Set.of()
                ));
    }

    private MessageSummary mapToSummary(MessageEntity entity) {
        return new MessageSummary(
                entity.getKey().id().toString(),
                entity.getThreadId() != null ? entity.getThreadId().toString() : null,
                entity.getSender(),
                entity.getSubject(),
                Uuids.unixTimestamp(entity.getKey().id()),
                entity.getLabelIds() != null ? entity.getLabelIds() : Set.of()
        );
    }

    private static List<String> orEmpty(List<String> values) {
        return values != null ? values : List.of();
    }
}
