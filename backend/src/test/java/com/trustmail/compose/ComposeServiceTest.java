package com.trustmail.compose;

import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.datastax.oss.driver.api.core.uuid.Uuids;
import com.trustmail.directory.GroupDirectory;
import com.trustmail.elicitation.DispatchOutcome;
import com.trustmail.elicitation.DispatchStatus;
import com.trustmail.elicitation.ElicitationController;
import com.trustmail.error.NotFoundException;
import com.trustmail.error.ValidationException;
import com.trustmail.message.MessageEntity;
import com.trustmail.message.MessageKey;
import com.trustmail.message.MessageStore;
import com.trustmail.message.OutgoingMessage;
import com.trustmail.trust.GroupRef;
import com.trustmail.trust.ResolvedTrustSet;
import com.trustmail.trust.TrustDecision;
import com.trustmail.trust.TrustGate;
import com.trustmail.trust.TrustListResolver;
import com.trustmail.trust.TrustListService;

import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Send path tests: group expansion, trust classification and reply/forward composition.
 * The resolver and gate are real; the directory, trust list and elicitation are mocked.
 */
@ExtendWith(MockitoExtension.class)
class ComposeServiceTest {

    private static final String MAILBOX = "me@example.com";

    @Mock
    private MessageStore messageStore;

    @Mock
    private GroupDirectory groupDirectory;

    @Mock
    private TrustListService trustListService;

    @Mock
    private ElicitationController elicitationController;

    private ComposeService service;

    @BeforeEach
    void setup() {
        service = new ComposeService(messageStore, new TrustListResolver(groupDirectory), trustListService,
                new TrustGate(), elicitationController);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private void trustSetIs(List<String> addresses) {
        when(trustListService.currentTrustSet()).thenReturn(Mono.just(ResolvedTrustSet.of(addresses, List.of())));
    }

    private ArgumentCaptor<OutgoingMessage> messageCaptor() {
        return ArgumentCaptor.forClass(OutgoingMessage.class);
    }

    private ArgumentCaptor<TrustDecision> decisionCaptor() {
        return ArgumentCaptor.forClass(TrustDecision.class);
    }

    private void elicitationSends() {
        when(elicitationController.dispatch(any(OutgoingMessage.class), any(TrustDecision.class)))
                .thenAnswer(inv -> {
                    TrustDecision decision = inv.getArgument(1);
                    return Mono.just(new DispatchOutcome(
                            decision.untrustedRecipients().isEmpty() ? DispatchStatus.NO_SESSION_NEEDED : DispatchStatus.PROCEED,
                            null, "msg-1", null, decision.untrustedRecipients(), "Email sent"));
                });
    }

    private static MessageEntity original() {
        MessageEntity entity = new MessageEntity();
        entity.setKey(new MessageKey(MAILBOX, Uuids.timeBased()));
        entity.setThreadId(UUID.randomUUID());
        entity.setSender("alice@example.com");
        entity.setToRecipients(List.of(MAILBOX));
        entity.setSubject("Quarterly numbers");
        entity.setBody("Line one\nLine two");
        return entity;
    }

    // ── send ──────────────────────────────────────────────────────────────────

    @Test
    void send_shouldRequireConfirmationWhenGroupOnlyListCannotBeExpanded() {
        GroupRef vip = TrustListResolver.parseGroupRef("group:VIP").orElseThrow();
        when(groupDirectory.expand(vip)).thenReturn(Mono.error(new IllegalStateException("directory unavailable")));
        when(trustListService.currentTrustSet())
                .thenReturn(new TrustListResolver(groupDirectory).resolveTrustSet(List.of("group:VIP")));
        elicitationSends();

        SendRequest request = new SendRequest(List.of("stranger@example.org"), null, null, "Hi", "Body", null, null);

        StepVerifier.create(service.send(MAILBOX, request))
                .assertNext(result -> assertEquals(List.of("stranger@example.org"), result.untrustedRecipients()))
                .verifyComplete();

        ArgumentCaptor<TrustDecision> decision = decisionCaptor();
        verify(elicitationController).dispatch(any(OutgoingMessage.class), decision.capture());
        assertTrue(decision.getValue().requiresConfirmation());
        assertTrue(decision.getValue().trustedRecipients().isEmpty());
    }

    @Test
    void send_shouldExpandGroupRecipientsBeforeClassification() {
        GroupRef team = TrustListResolver.parseGroupRef("group:Team").orElseThrow();
        when(groupDirectory.expand(team)).thenReturn(Mono.just(List.of("Bob@Example.com", "carol@example.com")));
        trustSetIs(List.of("bob@example.com", "carol@example.com"));
        elicitationSends();

        SendRequest request = new SendRequest(List.of("group:Team, dave@example.com"), null, null, "Hi", "Body", null, null);

        StepVerifier.create(service.send(MAILBOX, request))
                .assertNext(result -> {
                    assertTrue(result.success());
                    assertEquals(SendIntent.SEND, result.intent());
                    assertEquals(List.of("dave@example.com"), result.untrustedRecipients());
                })
                .verifyComplete();

        ArgumentCaptor<OutgoingMessage> message = messageCaptor();
        ArgumentCaptor<TrustDecision> decision = decisionCaptor();
        verify(elicitationController).dispatch(message.capture(), decision.capture());
        assertEquals(List.of("bob@example.com", "carol@example.com", "dave@example.com"), message.getValue().to());
        assertTrue(decision.getValue().trustedRecipients().containsAll(List.of("bob@example.com", "carol@example.com")));
        assertFalse(decision.getValue().untrustedRecipients().stream().anyMatch(TrustListResolver::isGroupToken));
    }

    @Test
    void send_shouldRejectGroupWithoutMembers() {
        when(groupDirectory.expand(any(GroupRef.class))).thenReturn(Mono.error(new NotFoundException("contact group", "Ghosts")));

        SendRequest request = new SendRequest(List.of("group:Ghosts"), null, null, "Hi", "Body", null, null);

        StepVerifier.create(service.send(MAILBOX, request))
                .expectErrorMatches(ex -> ex instanceof ValidationException
                        && ex.getMessage().contains("group:Ghosts"))
                .verify();
        verify(elicitationController, never()).dispatch(any(), any());
    }

    @Test
    void send_shouldRejectInvalidLiteralAddress() {
        SendRequest request = new SendRequest(List.of("not-an-address"), null, null, "Hi", "Body", null, null);

        StepVerifier.create(service.send(MAILBOX, request))
                .expectErrorMatches(ex -> ex instanceof ValidationException
                        && ex.getMessage().startsWith("Invalid recipient address"))
                .verify();
    }

    @Test
    void send_shouldRequireARecipient() {
        SendRequest request = new SendRequest(List.of(" , "), List.of(), null, "Hi", "Body", null, null);

        StepVerifier.create(service.send(MAILBOX, request))
                .expectErrorMatches(ex -> ex instanceof ValidationException
                        && ex.getMessage().equals("At least one recipient is required"))
                .verify();
    }

    @Test
    void send_shouldClassifyCcAndBccToo() {
        trustSetIs(List.of("a@example.com"));
        elicitationSends();

        SendRequest request = new SendRequest(List.of("A@example.com"), List.of("b@example.com"),
                List.of("c@example.com"), "Hi", "Body", null, null);

        StepVerifier.create(service.send(MAILBOX, request))
                .assertNext(result -> assertEquals(List.of("b@example.com", "c@example.com"), result.untrustedRecipients()))
                .verifyComplete();
    }

    // ── reply / forward ───────────────────────────────────────────────────────

    @Test
    void reply_shouldDefaultToOriginalSenderAndQuoteBody() {
        MessageEntity original = original();
        when(messageStore.find(MAILBOX, original.getKey().id().toString())).thenReturn(Mono.just(original));
        trustSetIs(List.of());
        elicitationSends();

        SendRequest request = new SendRequest(null, null, null, null, "Thanks!", null, original.getKey().id().toString());

        StepVerifier.create(service.reply(MAILBOX, request))
                .assertNext(result -> assertEquals(SendIntent.REPLY, result.intent()))
                .verifyComplete();

        ArgumentCaptor<OutgoingMessage> message = messageCaptor();
        verify(elicitationController).dispatch(message.capture(), any(TrustDecision.class));
        OutgoingMessage sent = message.getValue();
        assertEquals(List.of("alice@example.com"), sent.to());
        assertEquals("Re: Quarterly numbers", sent.subject());
        assertEquals("Thanks!\n\nOn alice@example.com wrote:\n> Line one\n> Line two", sent.body());
        assertEquals(original.getThreadId().toString(), sent.threadId());
        assertEquals(original.getKey().id().toString(), sent.inReplyTo());
    }

    @Test
    void reply_shouldRequireOriginalMessageId() {
        SendRequest request = new SendRequest(List.of("a@example.com"), null, null, null, "Hi", null, " ");

        StepVerifier.create(service.reply(MAILBOX, request))
                .expectErrorMatches(ex -> ex instanceof ValidationException
                        && ex.getMessage().equals("'originalMessageId' is required"))
                .verify();
    }

    @Test
    void forward_shouldPrefixSubjectAndIncludeOriginal() {
        MessageEntity original = original();
        when(messageStore.find(MAILBOX, original.getKey().id().toString())).thenReturn(Mono.just(original));
        trustSetIs(List.of());
        elicitationSends();

        SendRequest request = new SendRequest(List.of("dave@example.com"), null, null, null, "FYI", null,
                original.getKey().id().toString());

        StepVerifier.create(service.forward(MAILBOX, request))
                .assertNext(result -> assertEquals(SendIntent.FORWARD, result.intent()))
                .verifyComplete();

        ArgumentCaptor<OutgoingMessage> message = messageCaptor();
        verify(elicitationController).dispatch(message.capture(), any(TrustDecision.class));
        OutgoingMessage sent = message.getValue();
        assertEquals("Fwd: Quarterly numbers", sent.subject());
        assertTrue(sent.body().startsWith("FYI\n\n" + ComposeService.FORWARD_SEPARATOR));
        assertTrue(sent.body().contains("From: alice@example.com"));
        assertTrue(sent.body().endsWith("Line one\nLine two"));
    }

    @Test
    void forward_shouldRequireRecipients() {
        MessageEntity original = original();
        when(messageStore.find(MAILBOX, original.getKey().id().toString())).thenReturn(Mono.just(original));

        SendRequest request = new SendRequest(null, null, null, null, null, null, original.getKey().id().toString());

        StepVerifier.create(service.forward(MAILBOX, request))
                .expectError(ValidationException.class)
                .verify();
    }

    @Test
    void subjects_shouldNotBePrefixedTwice() {
        assertEquals("RE: hello", ComposeService.replySubject("RE: hello"));
        assertEquals("Re: (no subject)", ComposeService.replySubject(null));
        assertEquals("Fw: hello", ComposeService.forwardSubject("Fw: hello"));
    }
}
