package com.trustmail.elicitation;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.trustmail.error.NotFoundException;
import com.trustmail.error.UnsupportedCapabilityException;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * {@link ElicitationTransport} for HTTP clients.
 *
 * <p>A client that can confirm sends keeps a server-sent event stream open for its mailbox;
 * prompts are pushed on that stream and answered through {@link #answer}. A mailbox with
 * no open stream has no confirmation capability. Pending prompts live only as long as the
 * controller waits for them, and a mailbox's stream is dropped when its last client leaves.
 */
@Component
public class PendingConfirmationTransport implements ElicitationTransport {

    private static final Logger log = LoggerFactory.getLogger(PendingConfirmationTransport.class);

    private final Map<String, MailboxStream> streams = new ConcurrentHashMap<>();
    private final Map<String, PendingPrompt> pending = new ConcurrentHashMap<>();

    private record PendingPrompt(ElicitationPrompt prompt, Sinks.One<ElicitationResponse> answer) {}

    // clients is only changed inside streams.compute* for the owning mailbox
    private record MailboxStream(Sinks.Many<ElicitationPrompt> sink, AtomicInteger clients) {
        static MailboxStream open() {
            return new MailboxStream(Sinks.many().multicast().directBestEffort(), new AtomicInteger());
        }
    }

    @Override
    public Mono<ElicitationResponse> prompt(ElicitationPrompt prompt, Duration timeout) {
        return Mono.defer(() -> {
            MailboxStream mailboxStream = streams.get(prompt.mailbox());
            Sinks.Many<ElicitationPrompt> stream = mailboxStream == null ? null : mailboxStream.sink();
            if (stream == null || stream.currentSubscriberCount() == 0) {
                return Mono.error(new UnsupportedCapabilityException(
                        "No confirmation client connected for " + prompt.mailbox()));
            }
            Sinks.One<ElicitationResponse> answer = Sinks.one();
            pending.put(prompt.promptId(), new PendingPrompt(prompt, answer));
            Sinks.EmitResult emitted = stream.tryEmitNext(prompt);
            if (emitted.isFailure()) {
                pending.remove(prompt.promptId());
                return Mono.error(new UnsupportedCapabilityException(
                        "Confirmation client for " + prompt.mailbox() + " is not accepting prompts: " + emitted));
            }
            log.debug("[confirmations] Prompt {} pushed to {}", prompt.promptId(), prompt.mailbox());
            return answer.asMono()
                    .doFinally(signal -> pending.remove(prompt.promptId()));
        });
    }

    /** Prompts still waiting first, then every new prompt for the mailbox. */
    public Flux<ElicitationPrompt> subscribe(String mailbox) {
        return Flux.defer(() -> {
            MailboxStream stream = streams.compute(mailbox, (m, current) -> {
                MailboxStream joined = current == null ? MailboxStream.open() : current;
                joined.clients().incrementAndGet();
                return joined;
            });
            log.info("[confirmations] Client connected for {}", mailbox);
            return Flux.fromIterable(pendingFor(mailbox))
                    .concatWith(stream.sink().asFlux())
                    .doFinally(signal -> {
                        release(mailbox, stream);
                        log.info("[confirmations] Client for {} disconnected ({})", mailbox, signal);
                    });
        });
    }

    private void release(String mailbox, MailboxStream stream) {
        streams.computeIfPresent(mailbox, (m, current) ->
                current == stream && current.clients().decrementAndGet() <= 0 ? null : current);
    }

    boolean hasStream(String mailbox) {
        return streams.containsKey(mailbox);
    }

    public List<ElicitationPrompt> pendingFor(String mailbox) {
        return pending.values().stream()
                .map(PendingPrompt::prompt)
                .filter(prompt -> prompt.mailbox().equals(mailbox))
                .toList();
    }

    public Mono<Void> answer(String mailbox, String promptId, ElicitationResponse response) {
        return Mono.defer(() -> {
            PendingPrompt waiting = pending.get(promptId);
            if (waiting == null || !waiting.prompt().mailbox().equals(mailbox)) {
                return Mono.error(new NotFoundException("confirmation prompt", promptId));
            }
            if (waiting.answer().tryEmitValue(response).isFailure()) {
                return Mono.error(new NotFoundException("confirmation prompt", promptId));
            }
            log.info("[confirmations] Prompt {} answered with {}", promptId, response.kind());
            return Mono.<Void>empty();
        });
    }
}
