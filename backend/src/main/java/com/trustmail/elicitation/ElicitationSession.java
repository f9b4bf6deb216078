package com.trustmail.elicitation;

import java.time.Instant;

import com.trustmail.trust.TrustDecision;

/**
 * One confirmation round for one send request. Starts in
 * {@link SessionStatus#AWAITING_RESPONSE} and moves to exactly one terminal status.
 */
public class ElicitationSession {

    private final String promptId;
    private final TrustDecision decision;
    private final Instant deadline;
    private SessionStatus status = SessionStatus.AWAITING_RESPONSE;
    private ElicitationResponse response;
    private Throwable failure;

    public ElicitationSession(String promptId, TrustDecision decision, Instant deadline) {
        this.promptId = promptId;
        this.decision = decision;
        this.deadline = deadline;
    }

    public ElicitationSession respond(ElicitationResponse response) {
        this.response = response;
        return transition(response.kind() == ResponseKind.ACCEPT ? SessionStatus.ACCEPTED : SessionStatus.DECLINED);
    }

    public ElicitationSession timeOut() {
        return transition(SessionStatus.TIMED_OUT);
    }

    public ElicitationSession unsupported(Throwable cause) {
        this.failure = cause;
        return transition(SessionStatus.UNSUPPORTED);
    }

    public ElicitationSession fail(Throwable cause) {
        this.failure = cause;
        return transition(SessionStatus.FAILED);
    }

    private ElicitationSession transition(SessionStatus next) {
        if (status != SessionStatus.AWAITING_RESPONSE) {
            throw new IllegalStateException("Session " + promptId + " already " + status);
        }
        status = next;
        return this;
    }

    /** The accepted choice, or null when the session did not end in {@link SessionStatus#ACCEPTED}. */
    public ElicitationAction acceptedAction() {
        return status == SessionStatus.ACCEPTED ? response.choice() : null;
    }

    public String getPromptId() { return promptId; }
    public TrustDecision getDecision() { return decision; }
    public Instant getDeadline() { return deadline; }
    public SessionStatus getStatus() { return status; }
    public ElicitationResponse getResponse() { return response; }
    public Throwable getFailure() { return failure; }
}
