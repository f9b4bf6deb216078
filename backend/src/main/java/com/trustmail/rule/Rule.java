package com.trustmail.rule;

import java.time.Instant;

public record Rule(String id, String mailbox, RuleSelector criteria, FilterActions action, Instant createdAt) {}
