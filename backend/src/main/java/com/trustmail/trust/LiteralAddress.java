package com.trustmail.trust;

public record LiteralAddress(String raw, String email) implements TrustEntry {}
