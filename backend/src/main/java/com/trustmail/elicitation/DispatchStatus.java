package com.trustmail.elicitation;

/**
 * Terminal result of routing one outbound message through confirmation.
 */
public enum DispatchStatus {
    /** Every recipient trusted; sent. */
    NO_SESSION_NEEDED,
    /** Confirmation unavailable; the fallback policy decided (block or allow). */
    FALLBACK_APPLIED,
    CANCELLED,
    DRAFT_SAVED,
    /** Caller confirmed; sent. */
    PROCEED,
    TIMED_OUT,
    HARD_FAILURE;

    public boolean isSuccess() {
        return this == NO_SESSION_NEEDED || this == PROCEED || this == DRAFT_SAVED;
    }
}
