package com.trustmail.elicitation;

/**
 * What happens to a message with untrusted recipients when nobody can be asked.
 */
public enum FallbackPolicy {
    /** Nothing is sent or saved. */
    BLOCK,
    /** Send as if every recipient were trusted. */
    ALLOW,
    /** Save a draft instead of sending. */
    DRAFT
}
