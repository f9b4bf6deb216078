package com.trustmail.trust;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.trustmail.directory.GroupDirectory;
import com.trustmail.error.NotFoundException;

import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for TrustListResolver.
 *
 * GroupDirectory is a Mockito stub; no Spring context or Cassandra involved.
 */
@ExtendWith(MockitoExtension.class)
class TrustListResolverTest {

    @Mock
    private GroupDirectory groupDirectory;

    private TrustListResolver resolver;

    @BeforeEach
    void setup() {
        resolver = new TrustListResolver(groupDirectory);
    }

    // ── split ─────────────────────────────────────────────────────────────────

    @Test
    void split_shouldSeparateGroupTokensByCaseInsensitivePrefix() {
        SplitTokens split = TrustListResolver.split(Arrays.asList(
                "alice@example.com", "  group:VIP ", "GroupId:contactGroups/123", "GROUP:team",
                "   ", "", null, "bob@example.com", "groupie@example.com"));

        assertEquals(List.of("alice@example.com", "bob@example.com", "groupie@example.com"), split.literalTokens());
        assertEquals(List.of("group:VIP", "GroupId:contactGroups/123", "GROUP:team"), split.groupTokens());
    }

    @Test
    void split_shouldNotValidateLiterals() {
        SplitTokens split = TrustListResolver.split(List.of("not-an-email", "group:"));

        assertEquals(List.of("not-an-email"), split.literalTokens());
        assertEquals(List.of("group:"), split.groupTokens());
    }

    @Test
    void parseGroupRef_shouldRecogniseKindAndValue() {
        GroupRef byName = TrustListResolver.parseGroupRef(" Group: Board Members ").orElseThrow();
        assertEquals(GroupKind.NAME, byName.kind());
        assertEquals("Board Members", byName.value());

        GroupRef byId = TrustListResolver.parseGroupRef("groupId:contactGroups/9").orElseThrow();
        assertEquals(GroupKind.ID, byId.kind());
        assertEquals("contactGroups/9", byId.value());

        assertTrue(TrustListResolver.parseGroupRef("group:").isEmpty());
        assertTrue(TrustListResolver.parseGroupRef("alice@example.com").isEmpty());
    }

    // ── resolve ───────────────────────────────────────────────────────────────

    @Test
    void resolveTrustSet_shouldUnionLiteralsAndGroupMembers() {
        when(groupDirectory.expand(any(GroupRef.class)))
                .thenReturn(Mono.just(List.of("Carol@Example.com", "alice@example.com")));

        StepVerifier.create(resolver.resolveTrustSet(List.of(" Alice@Example.com ", "group:VIP")))
                .assertNext(set -> {
                    assertEquals(2, set.size());
                    assertTrue(set.contains("carol@example.com"));
                    assertEquals(ResolvedTrustSet.Source.EXPLICIT, set.sourceOf("alice@example.com"));
                    assertEquals(ResolvedTrustSet.Source.GROUP, set.sourceOf("carol@example.com"));
                })
                .verifyComplete();
    }

    @Test
    void resolve_shouldIgnoreFailingGroups() {
        when(groupDirectory.expand(eq(new GroupRef("group:missing", GroupKind.NAME, "missing"))))
                .thenReturn(Mono.error(new NotFoundException("contact group", "missing")));
        when(groupDirectory.expand(eq(new GroupRef("group:VIP", GroupKind.NAME, "VIP"))))
                .thenReturn(Mono.just(List.of("vip@example.com")));

        StepVerifier.create(resolver.resolve(List.of("group:missing", "group:VIP")))
                .assertNext(members -> {
                    assertEquals(List.of(), members.membersOf("group:missing"));
                    assertEquals(List.of("vip@example.com"), members.membersOf("group:VIP"));
                })
                .verifyComplete();
    }

    @Test
    void resolve_shouldSkipMalformedGroupTokensWithoutLookup() {
        StepVerifier.create(resolver.resolve(List.of("group:  ")))
                .assertNext(members -> assertTrue(members.allMembers().isEmpty()))
                .verifyComplete();

        verify(groupDirectory, never()).expand(any());
    }

    @Test
    void resolveTrustSet_shouldNotDependOnTokenOrder() {
        when(groupDirectory.expand(any(GroupRef.class))).thenAnswer(invocation -> {
            GroupRef ref = invocation.getArgument(0);
            return Mono.just(ref.value().equals("A") ? List.of("a1@example.com", "shared@example.com")
                    : List.of("b1@example.com", "SHARED@example.com"));
        });

        ResolvedTrustSet first = resolver.resolveTrustSet(List.of("group:A", "group:B", "x@example.com")).block();
        ResolvedTrustSet second = resolver.resolveTrustSet(List.of("x@example.com", "group:B", "group:A")).block();

        assertEquals(first, second);
        assertEquals(4, first.size());
    }

    @Test
    void resolveTrustSet_shouldStayConfiguredWhenEveryGroupFailsToExpand() {
        when(groupDirectory.expand(any(GroupRef.class)))
                .thenReturn(Mono.error(new IllegalStateException("directory unavailable")));

        StepVerifier.create(resolver.resolveTrustSet(List.of("group:VIP")))
                .assertNext(trustSet -> {
                    assertTrue(trustSet.isEmpty());
                    assertTrue(trustSet.isConfigured());
                })
                .verifyComplete();
    }

    @Test
    void resolveTrustSet_shouldBeUnconfiguredWithoutTokens() {
        StepVerifier.create(resolver.resolveTrustSet(List.of(" ", "")))
                .assertNext(trustSet -> assertFalse(trustSet.isConfigured()))
                .verifyComplete();

        verify(groupDirectory, never()).expand(any());
    }

    @Test
    void parse_shouldProduceTypedEntries() {
        List<TrustEntry> entries = TrustListResolver.parse(List.of(" Alice@Example.com ", "GroupId:contactGroups/7", "group:"));

        assertEquals(2, entries.size());
        LiteralAddress literal = assertInstanceOf(LiteralAddress.class, entries.get(0));
        assertEquals("alice@example.com", literal.email());
        GroupRef ref = assertInstanceOf(GroupRef.class, entries.get(1));
        assertEquals(GroupKind.ID, ref.kind());
        assertEquals("contactGroups/7", ref.value());
    }
}
