package com.trustmail.message;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.cassandra.core.query.CassandraPageRequest;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.stereotype.Service;

import com.datastax.oss.driver.api.core.uuid.Uuids;
import com.trustmail.config.TrustMailProperties;
import com.trustmail.error.NotFoundException;
import com.trustmail.error.ValidationException;
import com.trustmail.rule.RuleAction;

import reactor.core.publisher.Mono;

/**
 * {@link MessageStore} backed by the {@code mailbox_messages} table.
 *
 * <p>Listing walks the mailbox partition newest first, one Cassandra page per call, and
 * filters each page with {@link MessageQuery}. The driver's paging state is handed back to
 * the caller as an opaque page token, so a page can contain fewer ids than the page size
 * (or none) while more pages remain.
 */
@Service
public class CassandraMessageStore implements MessageStore {

    private static final Logger log = LoggerFactory.getLogger(CassandraMessageStore.class);

    public static final String LABEL_SENT = "SENT";
    public static final String LABEL_DRAFT = "DRAFT";

    private final MessageRepository repository;
    private final TrustMailProperties properties;

    public CassandraMessageStore(MessageRepository repository, TrustMailProperties properties) {
        this.repository = repository;
        this.properties = properties;
    }

    @Override
    public Mono<MessagePage> list(String mailbox, String query, String pageToken) {
        return Mono.defer(() -> {
            MessageQuery filter = MessageQuery.parse(query);
            Pageable pageable = pageRequest(pageToken);
            return repository.findAllByKeyMailbox(mailbox, pageable)
                    .map(slice -> toPage(slice, filter))
                    .onErrorMap(StoreErrors::translate);
        });
    }

    /**
     * Entities of one listing page, in the same order as {@link #list}. Used by the read API,
     * which needs more than ids.
     */
    public Mono<Slice<MessageEntity>> listEntities(String mailbox, String pageToken) {
        return Mono.defer(() -> repository.findAllByKeyMailbox(mailbox, pageRequest(pageToken)))
                .onErrorMap(StoreErrors::translate);
    }

    @Override
    public Mono<Void> batchMutate(String mailbox, List<String> ids, RuleAction action) {
        if (ids == null || ids.isEmpty()) {
            return Mono.empty();
        }
        return Mono.defer(() -> {
            List<MessageKey> keys = ids.stream().map(id -> key(mailbox, id)).toList();
            return repository.findAllById(keys)
                    .collectMap(MessageEntity::getKey, Function.identity())
                    .flatMap(found -> {
                        List<String> missing = keys.stream()
                                .filter(k -> !found.containsKey(k))
                                .map(k -> k.id().toString())
                                .toList();
                        if (!missing.isEmpty()) {
                            return Mono.error(new NotFoundException("message", String.join(",", missing)));
                        }
                        return repository.saveAll(applyAll(found, action)).then();
                    })
                    .doOnSuccess(v -> log.debug("[store.batch_mutate] Updated labels on {} message(s) in {}",
                            ids.size(), mailbox))
                    .onErrorMap(StoreErrors::translate);
        });
    }

    @Override
    public Mono<Void> mutate(String mailbox, String id, RuleAction action) {
        return Mono.defer(() -> repository.findById(key(mailbox, id)))
                .switchIfEmpty(Mono.error(() -> new NotFoundException("message", id)))
                .flatMap(entity -> {
                    applyLabels(entity, action);
                    return repository.save(entity);
                })
                .onErrorMap(StoreErrors::translate)
                .then();
    }

    @Override
    public Mono<String> createDraft(OutgoingMessage content) {
        return store(content, LABEL_DRAFT)
                .doOnNext(id -> log.info("[store.create_draft] Saved draft {} in {}", id, content.mailbox()));
    }

    @Override
    public Mono<String> send(OutgoingMessage content) {
        return store(content, LABEL_SENT)
                .doOnNext(id -> log.info("[store.send] Sent message {} from {} to {} recipient(s)", id,
                        content.mailbox(), content.to().size() + content.cc().size() + content.bcc().size()));
    }

    @Override
    public Mono<MessageEntity> find(String mailbox, String id) {
        return Mono.defer(() -> repository.findById(key(mailbox, id)))
                .switchIfEmpty(Mono.error(() -> new NotFoundException("message", id)))
                .onErrorMap(StoreErrors::translate);
    }

    private Mono<String> store(OutgoingMessage content, String label) {
        return Mono.defer(() -> repository.save(toEntity(content, label)))
                .map(saved -> saved.getKey().id().toString())
                .onErrorMap(StoreErrors::translate);
    }

    private static MessageEntity toEntity(OutgoingMessage content, String label) {
        MessageEntity entity = new MessageEntity();
        entity.setKey(new MessageKey(content.mailbox(), Uuids.timeBased()));
        entity.setThreadId(content.threadId() != null ? parseUuid(content.threadId()) : UUID.randomUUID());
        entity.setSender(content.mailbox());
        entity.setToRecipients(content.to());
        entity.setCcRecipients(content.cc());
        entity.setBccRecipients(content.bcc());
        entity.setSubject(content.subject());
        entity.setBody(content.body());
        entity.setHtmlBody(content.htmlBody());
        entity.setInReplyTo(content.inReplyTo());
        entity.setSizeBytes(sizeOf(content));
        entity.setLabelIds(new HashSet<>(Set.of(label)));
        return entity;
    }

    private MessagePage toPage(Slice<MessageEntity> slice, MessageQuery filter) {
        List<String> ids = slice.getContent().stream()
                .filter(filter)
                .map(entity -> entity.getKey().id().toString())
                .toList();
        return new MessagePage(ids, nextPageToken(slice));
    }

    /** Opaque token for the page after {@code slice}, null on the last page. */
    static String nextPageToken(Slice<?> slice) {
        if (slice.hasNext() && slice.nextPageable() instanceof CassandraPageRequest request
                && request.getPagingState() != null) {
            return encodeToken(request.getPagingState());
        }
        return null;
    }

    private Pageable pageRequest(String pageToken) {
        int pageSize = Math.max(1, properties.getStore().getPageSize());
        if (pageToken == null || pageToken.isBlank()) {
            return CassandraPageRequest.first(pageSize);
        }
        return CassandraPageRequest.of(PageRequest.of(0, pageSize), decodeToken(pageToken));
    }

    static String encodeToken(ByteBuffer pagingState) {
        ByteBuffer copy = pagingState.duplicate();
        byte[] bytes = new byte[copy.remaining()];
        copy.get(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    static ByteBuffer decodeToken(String pageToken) {
        try {
            return ByteBuffer.wrap(Base64.getUrlDecoder().decode(pageToken));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid page token");
        }
    }

    private static List<MessageEntity> applyAll(Map<MessageKey, MessageEntity> found, RuleAction action) {
        List<MessageEntity> updated = new ArrayList<>(found.values());
        updated.forEach(entity -> applyLabels(entity, action));
        return updated;
    }

    static void applyLabels(MessageEntity entity, RuleAction action) {
        Set<String> labels = entity.getLabelIds() == null
                ? new LinkedHashSet<>()
                : new LinkedHashSet<>(entity.getLabelIds());
        labels.addAll(action.addLabelIds());
        action.removeLabelIds().forEach(labels::remove);
        entity.setLabelIds(labels);
    }

    private static MessageKey key(String mailbox, String id) {
        UUID uuid;
        try {
            uuid = UUID.fromString(id);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new NotFoundException("message", String.valueOf(id));
        }
        return new MessageKey(mailbox, uuid);
    }

    private static UUID parseUuid(String value) {
        try {
            return UUID.fromString(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid thread id: " + value);
        }
    }

    private static long sizeOf(OutgoingMessage content) {
        long size = 0;
        for (String part : new String[]{content.subject(), content.body(), content.htmlBody()}) {
            if (part != null) {
                size += part.getBytes(StandardCharsets.UTF_8).length;
            }
        }
        return size;
    }
}
