package com.trustmail.elicitation;

import java.time.Duration;

import reactor.core.publisher.Mono;

/**
 * Round-trip to whoever can confirm a send.
 *
 * <p>Implementations emit the caller's answer, or signal
 * {@link com.trustmail.error.UnsupportedCapabilityException} when interactive confirmation
 * is not available for this caller. Any other error is a transport failure. The returned
 * {@code Mono} may never complete; the controller bounds the wait itself.
 */
public interface ElicitationTransport {

    Mono<ElicitationResponse> prompt(ElicitationPrompt prompt, Duration timeout);
}
