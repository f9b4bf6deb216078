package com.trustmail.rule;

/**
 * Outcome of one per-message mutation; {@code error} is null on success.
 */
public record MutationResult(String id, Throwable error) {

    public static MutationResult ok(String id) {
        return new MutationResult(id, null);
    }

    public static MutationResult failed(String id, Throwable error) {
        return new MutationResult(id, error);
    }

    public boolean succeeded() {
        return error == null;
    }
}
