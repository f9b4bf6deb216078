package com.trustmail.elicitation;

public enum SessionStatus {
    AWAITING_RESPONSE,
    ACCEPTED,
    DECLINED,
    TIMED_OUT,
    UNSUPPORTED,
    FAILED
}
