package com.trustmail.trust;

import java.util.List;

/**
 * Outcome of an {@code add} or {@code remove}. {@code changed} holds the tokens actually
 * added or removed, {@code unchanged} those already present (add) or absent (remove).
 */
public record TrustListUpdateResult(
        boolean success,
        String action,
        List<String> changed,
        List<String> unchanged,
        List<String> invalid,
        int size,
        String message
) {}
