package com.trustmail.elicitation;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.trustmail.config.TrustMailProperties;
import com.trustmail.message.MessageStore;
import com.trustmail.message.OutgoingMessage;
import com.trustmail.trust.TrustDecision;

import reactor.core.publisher.Mono;

/**
 * Routes an outbound message once the trust gate has classified its recipients.
 *
 * <p>Messages whose recipients are all trusted are sent directly. Otherwise the caller is
 * asked once, through the {@link ElicitationTransport}, whether to send, save a draft or
 * cancel. The wait is bounded by {@code trustmail.elicitation.timeout}; when it elapses the
 * outcome is {@link DispatchStatus#TIMED_OUT}, which callers can tell apart from an explicit
 * decline. When confirmation is disabled or the transport lacks the capability, the
 * configured {@link FallbackPolicy} decides.
 *
 * <p>The session outcome is settled before any side effect runs, and exactly one of
 * {@link MessageStore#send} or {@link MessageStore#createDraft} is called at most once.
 * Nothing is retried.
 */
@Service
public class ElicitationController {

    private static final Logger log = LoggerFactory.getLogger(ElicitationController.class);

    static final int BODY_PREVIEW_LENGTH = 300;
    static final List<ElicitationAction> CHOICES =
            List.of(ElicitationAction.SEND, ElicitationAction.SAVE_DRAFT, ElicitationAction.CANCEL);

    private final ElicitationTransport transport;
    private final MessageStore messageStore;
    private final TrustMailProperties properties;

    public ElicitationController(ElicitationTransport transport,
                                 MessageStore messageStore,
                                 TrustMailProperties properties) {
        this.transport = transport;
        this.messageStore = messageStore;
        this.properties = properties;
    }

    public Mono<DispatchOutcome> dispatch(OutgoingMessage message, TrustDecision decision) {
        if (!decision.requiresConfirmation()) {
            log.info("[dispatch] All {} recipient(s) trusted, sending without confirmation",
                    decision.trustedRecipients().size());
            return messageStore.send(message)
                    .map(id -> new DispatchOutcome(DispatchStatus.NO_SESSION_NEEDED, null, id, null, List.of(),
                            "Message sent"));
        }

        TrustMailProperties.Elicitation settings = properties.getElicitation();
        List<String> untrusted = decision.untrustedRecipients();
        if (!settings.isEnabled()) {
            log.info("[dispatch] Confirmation disabled, applying fallback {} for {} untrusted recipient(s)",
                    settings.getFallback(), untrusted.size());
            return applyFallback(settings.getFallback(), message, untrusted);
        }

        Duration timeout = settings.getTimeout();
        ElicitationSession session = new ElicitationSession(
                UUID.randomUUID().toString(), decision, Instant.now().plus(timeout));
        ElicitationPrompt prompt = buildPrompt(session.getPromptId(), message, untrusted, timeout);
        log.info("[dispatch] Confirmation required for {} untrusted recipient(s), prompt {}",
                untrusted.size(), session.getPromptId());

        return Mono.defer(() -> transport.prompt(prompt, timeout))
                .timeout(timeout)
                .map(session::respond)
                .switchIfEmpty(Mono.fromSupplier(() ->
                        session.fail(new IllegalStateException("Transport completed without a response"))))
                .onErrorResume(error -> Mono.just(settle(session, error)))
                .flatMap(settled -> act(settled, message));
    }

    private static ElicitationSession settle(ElicitationSession session, Throwable error) {
        if (error instanceof TimeoutException) {
            return session.timeOut();
        }
        if (TransportErrors.classify(error) == TransportErrors.Kind.UNSUPPORTED) {
            return session.unsupported(error);
        }
        return session.fail(error);
    }

    private Mono<DispatchOutcome> act(ElicitationSession session, OutgoingMessage message) {
        List<String> untrusted = session.getDecision().untrustedRecipients();
        switch (session.getStatus()) {
            case ACCEPTED:
                return actOnChoice(session.acceptedAction(), message, untrusted);
            case DECLINED:
                String verb = session.getResponse().kind() == ResponseKind.CANCEL ? "cancelled" : "declined";
                log.info("[dispatch] Prompt {} {} by caller", session.getPromptId(), verb);
                return Mono.just(new DispatchOutcome(DispatchStatus.CANCELLED, null, null, null, untrusted,
                        "Email operation " + verb + " by user"));
            case TIMED_OUT:
                log.info("[dispatch] Prompt {} timed out", session.getPromptId());
                return Mono.just(new DispatchOutcome(DispatchStatus.TIMED_OUT, null, null, null, untrusted,
                        "Email operation timed out - no response received within "
                                + properties.getElicitation().getTimeout().toSeconds() + " seconds"));
            case UNSUPPORTED:
                FallbackPolicy policy = properties.getElicitation().getFallback();
                log.info("[dispatch] Confirmation unsupported by transport ({}), applying fallback {}",
                        session.getFailure().getMessage(), policy);
                return applyFallback(policy, message, untrusted);
            case FAILED:
            default:
                log.error("[dispatch] Confirmation transport failed for prompt {}", session.getPromptId(),
                        session.getFailure());
                return Mono.just(new DispatchOutcome(DispatchStatus.HARD_FAILURE, null, null, null, untrusted,
                        "Confirmation failed, nothing was sent: " + session.getFailure().getMessage()));
        }
    }

    private Mono<DispatchOutcome> actOnChoice(ElicitationAction choice, OutgoingMessage message, List<String> untrusted) {
        switch (choice) {
            case SEND:
                log.info("[dispatch] Caller confirmed send");
                return messageStore.send(message)
                        .map(id -> new DispatchOutcome(DispatchStatus.PROCEED, null, id, null, untrusted,
                                "Message sent after confirmation"));
            case SAVE_DRAFT:
                log.info("[dispatch] Caller chose to save a draft");
                return messageStore.createDraft(message)
                        .map(id -> new DispatchOutcome(DispatchStatus.DRAFT_SAVED, null, null, id, untrusted,
                                "Email saved as draft instead of sending"));
            case CANCEL:
            default:
                log.info("[dispatch] Caller chose to cancel");
                return Mono.just(new DispatchOutcome(DispatchStatus.CANCELLED, null, null, null, untrusted,
                        "Email operation cancelled by user"));
        }
    }

    private Mono<DispatchOutcome> applyFallback(FallbackPolicy policy, OutgoingMessage message, List<String> untrusted) {
        switch (policy) {
            case ALLOW:
                return messageStore.send(message)
                        .map(id -> new DispatchOutcome(DispatchStatus.FALLBACK_APPLIED, FallbackPolicy.ALLOW, id, null,
                                untrusted, "Message sent; fallback policy allows untrusted recipients"));
            case DRAFT:
                return messageStore.createDraft(message)
                        .map(id -> new DispatchOutcome(DispatchStatus.DRAFT_SAVED, FallbackPolicy.DRAFT, null, id,
                                untrusted, "Confirmation unavailable; email saved as draft"));
            case BLOCK:
            default:
                return Mono.just(new DispatchOutcome(DispatchStatus.FALLBACK_APPLIED, FallbackPolicy.BLOCK, null, null,
                        untrusted, "Blocked: recipients not on the trust list: " + String.join(", ", untrusted)));
        }
    }

    static ElicitationPrompt buildPrompt(String promptId, OutgoingMessage message, List<String> untrusted,
                                         Duration timeout) {
        String body = message.body() != null ? message.body() : "";
        String preview = body.length() > BODY_PREVIEW_LENGTH
                ? body.substring(0, BODY_PREVIEW_LENGTH) + "... [truncated]"
                : body;
        StringBuilder text = new StringBuilder()
                .append("Email confirmation required\n\n")
                .append("To: ").append(String.join(", ", message.to())).append('\n');
        if (!message.cc().isEmpty()) {
            text.append("CC: ").append(String.join(", ", message.cc())).append('\n');
        }
        if (!message.bcc().isEmpty()) {
            text.append("BCC: ").append(String.join(", ", message.bcc())).append('\n');
        }
        text.append("Subject: ").append(message.subject() != null ? message.subject() : "").append("\n\n")
                .append(preview).append("\n\n")
                .append("Not on your trust list: ").append(String.join(", ", untrusted)).append('\n')
                .append("Choose send, save_draft or cancel. Cancels automatically in ")
                .append(timeout.toSeconds()).append(" seconds.");
        return new ElicitationPrompt(promptId, message.mailbox(), text.toString(), untrusted, CHOICES,
                timeout.toSeconds());
    }
}
