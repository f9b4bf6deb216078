package com.trustmail.trust;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.trustmail.config.TrustMailProperties;
import com.trustmail.directory.GroupDirectory;
import com.trustmail.error.ValidationException;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Management verbs for the trust list: {@code add}, {@code remove}, {@code view},
 * {@code label_add} and {@code label_remove}.
 *
 * <p>Every call reloads the persisted list; nothing is cached between calls. Writes are
 * read-modify-write cycles guarded by the store's version token and retried when another
 * writer got there first.
 */
@Service
public class TrustListService {

    private static final Logger log = LoggerFactory.getLogger(TrustListService.class);

    public static final Pattern EMAIL_PATTERN = Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");

    private final TrustListStore store;
    private final TrustListResolver resolver;
    private final GroupDirectory groupDirectory;
    private final TrustMailProperties properties;

    public TrustListService(TrustListStore store,
                            TrustListResolver resolver,
                            GroupDirectory groupDirectory,
                            TrustMailProperties properties) {
        this.store = store;
        this.resolver = resolver;
        this.groupDirectory = groupDirectory;
        this.properties = properties;
    }

    /** The trust set as of now, with every group reference expanded. */
    public Mono<ResolvedTrustSet> currentTrustSet() {
        return store.load().flatMap(list -> resolver.resolveTrustSet(list.tokens()));
    }

    public Mono<TrustListUpdateResult> add(List<String> input) {
        List<String> tokens = normalizeInput(input);
        log.info("[trust_list.add] Adding {} token(s)", tokens.size());
        if (tokens.isEmpty()) {
            return Mono.error(new ValidationException("No valid email addresses provided"));
        }
        List<String> valid = new ArrayList<>();
        List<String> invalid = new ArrayList<>();
        for (String token : tokens) {
            if (isValidToken(token)) {
                valid.add(token);
            } else {
                invalid.add(token);
            }
        }
        if (valid.isEmpty()) {
            return Mono.error(new ValidationException(
                    "No valid email addresses found. Invalid: " + String.join(", ", invalid)));
        }

        return writeWithRetry(Mono.defer(() -> store.load().flatMap(current -> {
            List<String> added = new ArrayList<>();
            List<String> alreadyPresent = new ArrayList<>();
            Set<String> existing = keysOf(current.tokens());
            for (String token : valid) {
                if (existing.add(key(token))) {
                    added.add(token);
                } else {
                    alreadyPresent.add(token);
                }
            }
            if (added.isEmpty()) {
                return Mono.just(addResult(added, alreadyPresent, invalid, current.tokens().size()));
            }
            List<String> updated = new ArrayList<>(current.tokens());
            updated.addAll(added);
            return store.save(updated, current.version())
                    .map(saved -> addResult(added, alreadyPresent, invalid, saved.tokens().size()));
        })));
    }

    public Mono<TrustListUpdateResult> remove(List<String> input) {
        List<String> tokens = normalizeInput(input);
        log.info("[trust_list.remove] Removing {} token(s)", tokens.size());
        if (tokens.isEmpty()) {
            return Mono.error(new ValidationException("No valid email addresses provided"));
        }

        return writeWithRetry(Mono.defer(() -> store.load().flatMap(current -> {
            Set<String> existing = keysOf(current.tokens());
            List<String> removed = new ArrayList<>();
            List<String> notPresent = new ArrayList<>();
            Set<String> removeKeys = new LinkedHashSet<>();
            for (String token : tokens) {
                if (existing.contains(key(token)) && removeKeys.add(key(token))) {
                    removed.add(token);
                } else if (!removeKeys.contains(key(token))) {
                    notPresent.add(token);
                }
            }
            if (removed.isEmpty()) {
                return Mono.just(removeResult(removed, notPresent, current.tokens().size()));
            }
            List<String> updated = current.tokens().stream()
                    .filter(token -> !removeKeys.contains(key(token)))
                    .toList();
            return store.save(updated, current.version())
                    .map(saved -> removeResult(removed, notPresent, saved.tokens().size()));
        })));
    }

    public Mono<TrustListView> view() {
        log.info("[trust_list.view] Viewing trust list");
        return store.load().map(current -> {
            SplitTokens split = TrustListResolver.split(current.tokens());
            List<String> masked = split.literalTokens().stream().map(TrustListService::mask).toList();
            int count = split.literalTokens().size() + split.groupTokens().size();
            String message = count == 0
                    ? "Trust list is empty; outbound mail is not gated"
                    : count + " entr" + (count == 1 ? "y" : "ies") + " configured; listed recipients skip confirmation";
            return new TrustListView(true, count, masked, split.groupTokens(), message);
        });
    }

    /**
     * Ensures a directory group called {@code label} and adds the addresses to it. Unlike
     * trust-set resolution, directory failures here are returned to the caller.
     */
    public Mono<LabelUpdateResult> labelAdd(String label, List<String> input) {
        return Mono.defer(() -> {
            List<String> emails = requireLabelInput(label, input);
            String name = label.trim();
            log.info("[trust_list.label_add] Adding {} address(es) to group '{}'", emails.size(), name);
            return groupDirectory.ensureGroup(name)
                    .flatMap(groupId -> groupDirectory.addMembers(groupId, emails)
                            .thenReturn(new LabelUpdateResult(true, "label_add", name, groupId, emails.size(), List.of(),
                                    "Added " + emails.size() + " address(es) to group '" + name + "'")));
        });
    }

    public Mono<LabelUpdateResult> labelRemove(String label, List<String> input) {
        return Mono.defer(() -> removeFromLabel(label, input));
    }

    private Mono<LabelUpdateResult> removeFromLabel(String label, List<String> input) {
        List<String> emails = requireLabelInput(label, input);
        String name = label.trim();
        log.info("[trust_list.label_remove] Removing {} address(es) from group '{}'", emails.size(), name);
        return groupDirectory.ensureGroup(name)
                .flatMap(groupId -> Flux.fromIterable(emails)
                        .concatMap(email -> groupDirectory.findMembersByEmail(groupId, email)
                                .hasElements()
                                .map(found -> new EmailLookup(email, found)))
                        .collectList()
                        .flatMap(lookups -> {
                            List<String> found = lookups.stream().filter(EmailLookup::found).map(EmailLookup::email).toList();
                            List<String> notFound = lookups.stream().filter(l -> !l.found()).map(EmailLookup::email).toList();
                            String message = "Removed " + found.size() + " address(es) from group '" + name + "'"
                                    + (notFound.isEmpty() ? "" : "; no matching member for " + notFound.size());
                            LabelUpdateResult result = new LabelUpdateResult(
                                    true, "label_remove", name, groupId, emails.size(), notFound, message);
                            if (found.isEmpty()) {
                                return Mono.just(result);
                            }
                            return groupDirectory.removeMembers(groupId, found).thenReturn(result);
                        }));
    }

    private record EmailLookup(String email, boolean found) {}

    private <T> Mono<T> writeWithRetry(Mono<T> attempt) {
        int attempts = Math.max(1, properties.getTrustList().getMaxWriteAttempts());
        return attempt.retryWhen(Retry.max(attempts - 1)
                .filter(ConcurrentTrustListUpdateException.class::isInstance)
                .doBeforeRetry(signal -> log.info("[trust_list] Concurrent update detected, retrying (attempt {})",
                        signal.totalRetries() + 2))
                .onRetryExhaustedThrow((retry, signal) -> signal.failure()));
    }

    private static List<String> requireLabelInput(String label, List<String> input) {
        if (label == null || label.isBlank()) {
            throw new ValidationException("'label' is required for label actions");
        }
        List<String> emails = new ArrayList<>(new LinkedHashSet<>(normalizeInput(input)));
        if (emails.isEmpty()) {
            throw new ValidationException("No valid email addresses provided for label operation");
        }
        return emails;
    }

    /** Splits comma-joined entries and lowercases literal addresses. Group tokens keep their case. */
    static List<String> normalizeInput(List<String> input) {
        List<String> tokens = new ArrayList<>();
        if (input == null) {
            return tokens;
        }
        for (String entry : input) {
            if (entry == null) {
                continue;
            }
            for (String part : entry.split(",")) {
                String token = part.trim();
                if (token.isEmpty()) {
                    continue;
                }
                tokens.add(TrustListResolver.isGroupToken(token) ? token : token.toLowerCase(Locale.ROOT));
            }
        }
        return tokens;
    }

    static boolean isValidToken(String token) {
        if (TrustListResolver.isGroupToken(token)) {
            return TrustListResolver.parseGroupRef(token).isPresent();
        }
        return EMAIL_PATTERN.matcher(token).matches();
    }

    /** Comparison key; group prefixes and literal addresses compare case-insensitively. */
    private static String key(String token) {
        return TrustListResolver.parseGroupRef(token)
                .map(ref -> ref.kind() + ":" + ref.value())
                .orElseGet(() -> token.trim().toLowerCase(Locale.ROOT));
    }

    private static Set<String> keysOf(List<String> tokens) {
        Set<String> keys = new LinkedHashSet<>();
        tokens.forEach(token -> keys.add(key(token)));
        return keys;
    }

    /** {@code alice@example.com -> al***@example.com}; short local parts are fully hidden. */
    static String mask(String email) {
        int at = email.indexOf('@');
        if (at >= 0) {
            String local = email.substring(0, at);
            String domain = email.substring(at + 1);
            return local.length() > 3 ? local.substring(0, 2) + "***@" + domain : "***@" + domain;
        }
        return email.length() > 3 ? email.substring(0, 3) + "***" : "***";
    }

    private static List<String> masked(List<String> tokens) {
        return tokens.stream()
                .map(token -> TrustListResolver.isGroupToken(token) ? token : mask(token))
                .toList();
    }

    private static TrustListUpdateResult addResult(List<String> added, List<String> alreadyPresent,
                                                   List<String> invalid, int size) {
        List<String> lines = new ArrayList<>();
        if (!added.isEmpty()) {
            lines.add("Added " + added.size() + " entr" + (added.size() == 1 ? "y" : "ies") + ": "
                    + String.join(", ", masked(added)));
        }
        if (!alreadyPresent.isEmpty()) {
            lines.add(alreadyPresent.size() + " already present: " + String.join(", ", masked(alreadyPresent)));
        }
        if (!invalid.isEmpty()) {
            lines.add(invalid.size() + " invalid skipped: " + String.join(", ", invalid));
        }
        lines.add("Trust list now contains " + size + " entr" + (size == 1 ? "y" : "ies"));
        return new TrustListUpdateResult(true, "add", added, alreadyPresent, invalid, size, String.join(". ", lines));
    }

    private static TrustListUpdateResult removeResult(List<String> removed, List<String> notPresent, int size) {
        List<String> lines = new ArrayList<>();
        if (!removed.isEmpty()) {
            lines.add("Removed " + removed.size() + " entr" + (removed.size() == 1 ? "y" : "ies") + ": "
                    + String.join(", ", masked(removed)));
        }
        if (!notPresent.isEmpty()) {
            lines.add(notPresent.size() + " not present: " + String.join(", ", masked(notPresent)));
        }
        lines.add("Trust list now contains " + size + " entr" + (size == 1 ? "y" : "ies"));
        return new TrustListUpdateResult(true, "remove", removed, notPresent, List.of(), size, String.join(". ", lines));
    }
}
