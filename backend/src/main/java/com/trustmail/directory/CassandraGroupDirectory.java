package com.trustmail.directory;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.datastax.oss.driver.api.core.uuid.Uuids;
import com.trustmail.error.NotFoundException;
import com.trustmail.error.ValidationException;
import com.trustmail.message.StoreErrors;
import com.trustmail.trust.GroupKind;
import com.trustmail.trust.GroupRef;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Service
public class CassandraGroupDirectory implements GroupDirectory {

    private static final Logger log = LoggerFactory.getLogger(CassandraGroupDirectory.class);

    static final String GROUP_ID_PREFIX = "contactGroups/";
    static final String MEMBER_ID_PREFIX = "people/";

    private final ContactGroupRepository repository;

    public CassandraGroupDirectory(ContactGroupRepository repository) {
        this.repository = repository;
    }

    @Override
    public Mono<List<String>> expand(GroupRef ref) {
        return findGroup(ref)
                .map(group -> {
                    Set<String> addresses = new LinkedHashSet<>();
                    if (group.getMembers() != null) {
                        group.getMembers().values().forEach(email -> addresses.add(normalize(email)));
                    }
                    addresses.remove("");
                    return List.copyOf(addresses);
                })
                .onErrorMap(StoreErrors::translate);
    }

    private Mono<ContactGroupEntity> findGroup(GroupRef ref) {
        Mono<ContactGroupEntity> lookup = ref.kind() == GroupKind.ID
                ? repository.findById(ref.value())
                : repository.findByName(ref.value()).next();
        return lookup.switchIfEmpty(Mono.error(() -> new NotFoundException("contact group", ref.value())));
    }

    @Override
    public Mono<String> ensureGroup(String name) {
        if (name == null || name.isBlank()) {
            return Mono.error(new ValidationException("Group name is required"));
        }
        String label = name.trim();
        return repository.findByName(label)
                .next()
                .map(ContactGroupEntity::getGroupId)
                .switchIfEmpty(Mono.defer(() -> {
                    ContactGroupEntity group = new ContactGroupEntity();
                    group.setGroupId(GROUP_ID_PREFIX + Uuids.timeBased());
                    group.setName(label);
                    group.setMembers(new HashMap<>());
                    log.info("[directory] Creating contact group '{}' as {}", label, group.getGroupId());
                    return repository.save(group).map(ContactGroupEntity::getGroupId);
                }))
                .onErrorMap(StoreErrors::translate);
    }

    @Override
    public Mono<Void> addMembers(String groupId, List<String> emails) {
        return requireGroup(groupId)
                .flatMap(group -> {
                    Map<String, String> members = group.getMembers() != null
                            ? new HashMap<>(group.getMembers())
                            : new HashMap<>();
                    Set<String> present = new LinkedHashSet<>();
                    members.values().forEach(email -> present.add(normalize(email)));
                    for (String email : emails) {
                        String address = normalize(email);
                        if (!address.isEmpty() && present.add(address)) {
                            members.put(MEMBER_ID_PREFIX + Uuids.timeBased(), address);
                        }
                    }
                    group.setMembers(members);
                    return repository.save(group);
                })
                .then()
                .onErrorMap(StoreErrors::translate);
    }

    @Override
    public Mono<Void> removeMembers(String groupId, List<String> emails) {
        return requireGroup(groupId)
                .flatMap(group -> {
                    if (group.getMembers() == null || group.getMembers().isEmpty()) {
                        return Mono.just(group);
                    }
                    Set<String> toRemove = new LinkedHashSet<>();
                    emails.forEach(email -> toRemove.add(normalize(email)));
                    Map<String, String> members = new HashMap<>(group.getMembers());
                    members.values().removeIf(email -> toRemove.contains(normalize(email)));
                    group.setMembers(members);
                    return repository.save(group);
                })
                .then()
                .onErrorMap(StoreErrors::translate);
    }

    @Override
    public Flux<String> findMembersByEmail(String groupId, String email) {
        String address = normalize(email);
        return requireGroup(groupId)
                .flatMapMany(group -> group.getMembers() == null
                        ? Flux.<String>empty()
                        : Flux.fromIterable(group.getMembers().entrySet())
                                .filter(member -> normalize(member.getValue()).equals(address))
                                .map(Map.Entry::getKey))
                .onErrorMap(StoreErrors::translate);
    }

    private Mono<ContactGroupEntity> requireGroup(String groupId) {
        return repository.findById(groupId)
                .switchIfEmpty(Mono.error(() -> new NotFoundException("contact group", groupId)));
    }

    private static String normalize(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }
}
