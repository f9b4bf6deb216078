package com.trustmail.trust;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.trustmail.directory.GroupDirectory;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Turns raw trust-list tokens into a {@link ResolvedTrustSet}.
 *
 * <p>Token grammar (comma-separated in the persisted form):
 * <pre>
 *   token := literal-email | "group:" name | "groupId:" resource-id
 * </pre>
 * Prefixes match case-insensitively after trimming. Resolution is best-effort:
 * malformed tokens are dropped and a group the directory cannot expand contributes
 * no members. Stricter validation happens where tokens are added, not here.
 */
public class TrustListResolver {

    private static final Logger log = LoggerFactory.getLogger(TrustListResolver.class);

    public static final String GROUP_NAME_PREFIX = "group:";
    public static final String GROUP_ID_PREFIX = "groupid:";

    private final GroupDirectory groupDirectory;

    public TrustListResolver(GroupDirectory groupDirectory) {
        this.groupDirectory = groupDirectory;
    }

    public static boolean isGroupToken(String token) {
        if (token == null) {
            return false;
        }
        String lower = token.trim().toLowerCase(Locale.ROOT);
        return lower.startsWith(GROUP_NAME_PREFIX) || lower.startsWith(GROUP_ID_PREFIX);
    }

    /**
     * Separates group references from literal address candidates. Blank tokens are dropped;
     * literals are not checked for address syntax.
     */
    public static SplitTokens split(List<String> rawTokens) {
        List<String> literals = new ArrayList<>();
        List<String> groups = new ArrayList<>();
        if (rawTokens == null) {
            return new SplitTokens(literals, groups);
        }
        for (String raw : rawTokens) {
            if (raw == null || raw.isBlank()) {
                continue;
            }
            String token = raw.trim();
            if (isGroupToken(token)) {
                groups.add(token);
            } else {
                literals.add(token);
            }
        }
        return new SplitTokens(literals, groups);
    }

    /**
     * Parses a group token. Returns empty when the token is not a group reference or names
     * no group ({@code "group:"} alone).
     */
    public static Optional<GroupRef> parseGroupRef(String token) {
        if (!isGroupToken(token)) {
            return Optional.empty();
        }
        String trimmed = token.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        GroupKind kind = lower.startsWith(GROUP_ID_PREFIX) ? GroupKind.ID : GroupKind.NAME;
        int prefixLength = kind == GroupKind.ID ? GROUP_ID_PREFIX.length() : GROUP_NAME_PREFIX.length();
        String value = trimmed.substring(prefixLength).trim();
        if (value.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new GroupRef(trimmed, kind, value));
    }

    public static List<TrustEntry> parse(List<String> rawTokens) {
        SplitTokens split = split(rawTokens);
        List<TrustEntry> entries = new ArrayList<>();
        for (String literal : split.literalTokens()) {
            entries.add(new LiteralAddress(literal, ResolvedTrustSet.normalize(literal)));
        }
        for (String group : split.groupTokens()) {
            parseGroupRef(group).ifPresent(entries::add);
        }
        return entries;
    }

    /**
     * Expands every group token through the directory, one lookup at a time.
     * Lookup failures are logged and leave that group empty.
     */
    public Mono<ResolvedGroupMembers> resolve(List<String> groupTokens) {
        if (groupTokens == null || groupTokens.isEmpty()) {
            return Mono.just(ResolvedGroupMembers.empty());
        }
        List<String> distinct = new ArrayList<>(new LinkedHashSet<>(groupTokens));
        return Flux.fromIterable(distinct)
                .concatMap(token -> expandToken(token)
                        .map(members -> Map.entry(token, members)))
                .collectList()
                .map(entries -> {
                    Map<String, List<String>> byToken = new LinkedHashMap<>();
                    entries.forEach(e -> byToken.put(e.getKey(), e.getValue()));
                    return new ResolvedGroupMembers(byToken);
                });
    }

    private Mono<List<String>> expandToken(String token) {
        Optional<GroupRef> ref = parseGroupRef(token);
        if (ref.isEmpty()) {
            log.debug("[trust_list] Ignoring malformed group token '{}'", token);
            return Mono.just(List.of());
        }
        return groupDirectory.expand(ref.get())
                .defaultIfEmpty(List.of())
                .onErrorResume(e -> {
                    log.warn("[trust_list] Could not expand '{}': {}", token, e.getMessage());
                    return Mono.just(List.of());
                });
    }

    public static ResolvedTrustSet buildTrustSet(List<String> literalTokens, ResolvedGroupMembers groupMembers) {
        boolean configured = (literalTokens != null && !literalTokens.isEmpty())
                || (groupMembers != null && !groupMembers.membersByToken().isEmpty());
        return ResolvedTrustSet.of(
                literalTokens == null ? List.of() : literalTokens,
                groupMembers == null ? List.of() : groupMembers.allMembers(),
                configured);
    }

    /** split, resolve and build in one step. */
    public Mono<ResolvedTrustSet> resolveTrustSet(List<String> rawTokens) {
        SplitTokens split = split(rawTokens);
        return resolve(split.groupTokens())
                .map(members -> {
                    ResolvedTrustSet trustSet = buildTrustSet(split.literalTokens(), members);
                    log.debug("[trust_list] Resolved {} literal and {} group token(s) into {} address(es)",
                            split.literalTokens().size(), split.groupTokens().size(), trustSet.size());
                    return trustSet;
                });
    }
}
