package com.trustmail.elicitation;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.trustmail.config.TrustMailProperties;
import com.trustmail.error.UnsupportedCapabilityException;
import com.trustmail.message.MessageStore;
import com.trustmail.message.OutgoingMessage;
import com.trustmail.trust.TrustDecision;

import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for the confirmation state machine.
 *
 * The transport and message store are Mockito stubs; the five-minute deadline is
 * exercised on virtual time.
 */
@ExtendWith(MockitoExtension.class)
class ElicitationControllerTest {

    @Mock
    private ElicitationTransport transport;

    @Mock
    private MessageStore messageStore;

    private TrustMailProperties properties;
    private ElicitationController controller;

    private final OutgoingMessage message = new OutgoingMessage("me@example.com",
            List.of("friend@example.com", "stranger@example.org"), List.of(), List.of(),
            "Lunch", "See you at noon", null, null, null);

    private final TrustDecision mixed = new TrustDecision(
            List.of("friend@example.com"), List.of("stranger@example.org"));

    @BeforeEach
    void setup() {
        properties = new TrustMailProperties();
        controller = new ElicitationController(transport, messageStore, properties);
    }

    // ── No confirmation needed ────────────────────────────────────────────────

    @Test
    void dispatch_shouldSendDirectlyWhenAllRecipientsTrusted() {
        when(messageStore.send(message)).thenReturn(Mono.just("m-1"));

        StepVerifier.create(controller.dispatch(message,
                        new TrustDecision(List.of("friend@example.com"), List.of())))
                .assertNext(outcome -> {
                    assertEquals(DispatchStatus.NO_SESSION_NEEDED, outcome.status());
                    assertEquals("m-1", outcome.messageId());
                    assertTrue(outcome.success());
                })
                .verifyComplete();

        verifyNoInteractions(transport);
    }

    // ── Caller answers ────────────────────────────────────────────────────────

    @Test
    void dispatch_shouldSendWhenCallerAcceptsSend() {
        when(transport.prompt(any(), any())).thenReturn(Mono.just(ElicitationResponse.accept(ElicitationAction.SEND)));
        when(messageStore.send(message)).thenReturn(Mono.just("m-2"));

        StepVerifier.create(controller.dispatch(message, mixed))
                .assertNext(outcome -> {
                    assertEquals(DispatchStatus.PROCEED, outcome.status());
                    assertEquals("m-2", outcome.messageId());
                    assertEquals(List.of("stranger@example.org"), outcome.untrustedRecipients());
                })
                .verifyComplete();

        verify(messageStore, never()).createDraft(any());
    }

    @Test
    void dispatch_shouldSaveDraftWhenCallerChoosesDraft() {
        when(transport.prompt(any(), any()))
                .thenReturn(Mono.just(ElicitationResponse.accept(ElicitationAction.SAVE_DRAFT)));
        when(messageStore.createDraft(message)).thenReturn(Mono.just("d-1"));

        StepVerifier.create(controller.dispatch(message, mixed))
                .assertNext(outcome -> {
                    assertEquals(DispatchStatus.DRAFT_SAVED, outcome.status());
                    assertEquals("d-1", outcome.draftId());
                    assertNull(outcome.fallbackPolicy());
                })
                .verifyComplete();

        verify(messageStore, never()).send(any());
    }

    @Test
    void dispatch_shouldCancelOnAcceptedCancel() {
        when(transport.prompt(any(), any())).thenReturn(Mono.just(ElicitationResponse.accept(ElicitationAction.CANCEL)));

        StepVerifier.create(controller.dispatch(message, mixed))
                .assertNext(outcome -> assertEquals(DispatchStatus.CANCELLED, outcome.status()))
                .verifyComplete();

        verifyNoInteractions(messageStore);
    }

    @Test
    void dispatch_shouldPromptWithUntrustedRecipientsAndChoices() {
        when(transport.prompt(any(), any())).thenReturn(Mono.just(ElicitationResponse.decline()));

        controller.dispatch(message, mixed).block();

        ArgumentCaptor<ElicitationPrompt> prompt = ArgumentCaptor.forClass(ElicitationPrompt.class);
        verify(transport).prompt(prompt.capture(), any(Duration.class));
        assertEquals(List.of("stranger@example.org"), prompt.getValue().untrustedRecipients());
        assertEquals(List.of(ElicitationAction.SEND, ElicitationAction.SAVE_DRAFT, ElicitationAction.CANCEL),
                prompt.getValue().choices());
        assertEquals(300, prompt.getValue().timeoutSeconds());
        assertTrue(prompt.getValue().message().contains("Subject: Lunch"));
    }

    // ── Timeout vs decline ────────────────────────────────────────────────────

    @Test
    void dispatch_shouldTimeOutAfterDeadline() {
        when(transport.prompt(any(), any())).thenReturn(Mono.never());

        StepVerifier.withVirtualTime(() -> controller.dispatch(message, mixed))
                .expectSubscription()
                .expectNoEvent(Duration.ofSeconds(299))
                .thenAwait(Duration.ofSeconds(1))
                .assertNext(outcome -> {
                    assertEquals(DispatchStatus.TIMED_OUT, outcome.status());
                    assertFalse(outcome.success());
                    assertEquals(List.of("stranger@example.org"), outcome.untrustedRecipients());
                })
                .verifyComplete();

        verifyNoInteractions(messageStore);
    }

    @Test
    void dispatch_shouldReportDeclineAsCancelledNotTimedOut() {
        when(transport.prompt(any(), any())).thenReturn(Mono.just(ElicitationResponse.decline()));

        StepVerifier.create(controller.dispatch(message, mixed))
                .assertNext(outcome -> {
                    assertEquals(DispatchStatus.CANCELLED, outcome.status());
                    assertTrue(outcome.message().contains("declined"));
                })
                .verifyComplete();
    }

    // ── Fallback ──────────────────────────────────────────────────────────────

    @Test
    void dispatch_shouldSaveExactlyOneDraftWhenUnsupportedWithDraftPolicy() {
        properties.getElicitation().setFallback(FallbackPolicy.DRAFT);
        when(transport.prompt(any(), any()))
                .thenReturn(Mono.error(new UnsupportedCapabilityException("no client connected")));
        when(messageStore.createDraft(message)).thenReturn(Mono.just("d-9"));

        StepVerifier.create(controller.dispatch(message, mixed))
                .assertNext(outcome -> {
                    assertEquals(DispatchStatus.DRAFT_SAVED, outcome.status());
                    assertEquals(FallbackPolicy.DRAFT, outcome.fallbackPolicy());
                    assertEquals("d-9", outcome.draftId());
                })
                .verifyComplete();

        verify(messageStore, times(1)).createDraft(message);
        verify(messageStore, never()).send(any());
    }

    @Test
    void dispatch_shouldClassifyMethodNotFoundAsUnsupported() {
        when(transport.prompt(any(), any()))
                .thenReturn(Mono.error(new IllegalStateException("Method not found: elicitation/create")));

        StepVerifier.create(controller.dispatch(message, mixed))
                .assertNext(outcome -> {
                    assertEquals(DispatchStatus.FALLBACK_APPLIED, outcome.status());
                    assertEquals(FallbackPolicy.BLOCK, outcome.fallbackPolicy());
                    assertTrue(outcome.message().contains("stranger@example.org"));
                })
                .verifyComplete();

        verifyNoInteractions(messageStore);
    }

    @Test
    void dispatch_shouldApplyAllowPolicyWhenDisabled() {
        properties.getElicitation().setEnabled(false);
        properties.getElicitation().setFallback(FallbackPolicy.ALLOW);
        when(messageStore.send(message)).thenReturn(Mono.just("m-3"));

        StepVerifier.create(controller.dispatch(message, mixed))
                .assertNext(outcome -> {
                    assertEquals(DispatchStatus.FALLBACK_APPLIED, outcome.status());
                    assertEquals("m-3", outcome.messageId());
                    assertTrue(outcome.success());
                })
                .verifyComplete();

        verifyNoInteractions(transport);
    }

    @Test
    void dispatch_shouldReadFallbackPolicyAtDecisionTime() {
        properties.getElicitation().setEnabled(false);
        properties.getElicitation().setFallback(FallbackPolicy.ALLOW);
        when(messageStore.send(message)).thenReturn(Mono.just("m-4"));
        controller.dispatch(message, mixed).block();

        properties.getElicitation().setFallback(FallbackPolicy.BLOCK);

        StepVerifier.create(controller.dispatch(message, mixed))
                .assertNext(outcome -> assertEquals(FallbackPolicy.BLOCK, outcome.fallbackPolicy()))
                .verifyComplete();

        verify(messageStore, times(1)).send(message);
    }

    // ── Hard failure ──────────────────────────────────────────────────────────

    @Test
    void dispatch_shouldSurfaceOtherTransportErrorsWithoutSending() {
        when(transport.prompt(any(), any())).thenReturn(Mono.error(new IllegalStateException("connection reset")));

        StepVerifier.create(controller.dispatch(message, mixed))
                .assertNext(outcome -> {
                    assertEquals(DispatchStatus.HARD_FAILURE, outcome.status());
                    assertTrue(outcome.message().contains("connection reset"));
                })
                .verifyComplete();

        verifyNoInteractions(messageStore);
    }

    @Test
    void dispatch_shouldNotApplyAllowPolicyToUnrelatedUnsupportedErrors() {
        properties.getElicitation().setFallback(FallbackPolicy.ALLOW);
        when(transport.prompt(any(), any()))
                .thenReturn(Mono.error(new RuntimeException("415 Unsupported Media Type")));

        StepVerifier.create(controller.dispatch(message, mixed))
                .assertNext(outcome -> {
                    assertEquals(DispatchStatus.HARD_FAILURE, outcome.status());
                    assertFalse(outcome.success());
                    assertTrue(outcome.message().contains("415 Unsupported Media Type"));
                })
                .verifyComplete();

        verify(messageStore, never()).send(any());
    }

    @Test
    void dispatch_shouldTreatEmptyTransportReplyAsHardFailure() {
        when(transport.prompt(any(), any())).thenReturn(Mono.empty());

        StepVerifier.create(controller.dispatch(message, mixed))
                .assertNext(outcome -> assertEquals(DispatchStatus.HARD_FAILURE, outcome.status()))
                .verifyComplete();
    }

    @Test
    void transportErrors_shouldOnlyFlagCapabilityMessages() {
        assertEquals(TransportErrors.Kind.UNSUPPORTED,
                TransportErrors.classify(new RuntimeException("Method not found: elicitation/create")));
        assertEquals(TransportErrors.Kind.OTHER,
                TransportErrors.classify(new RuntimeException("Elicitation not supported by client")));
        assertEquals(TransportErrors.Kind.OTHER,
                TransportErrors.classify(new RuntimeException("415 Unsupported Media Type")));
        assertEquals(TransportErrors.Kind.UNSUPPORTED,
                TransportErrors.classify(new UnsupportedCapabilityException("x")));
        assertEquals(TransportErrors.Kind.OTHER, TransportErrors.classify(new RuntimeException("timeout")));
        assertEquals(TransportErrors.Kind.OTHER, TransportErrors.classify(new RuntimeException()));
    }
}
