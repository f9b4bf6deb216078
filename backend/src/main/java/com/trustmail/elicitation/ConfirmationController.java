package com.trustmail.elicitation;

import java.util.List;
import java.util.Map;

import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/confirmations/{mailbox}")
public class ConfirmationController {

    private final PendingConfirmationTransport transport;

    public ConfirmationController(PendingConfirmationTransport transport) {
        this.transport = transport;
    }

    /**
     * Holding this stream open enables interactive confirmation for the mailbox.
     */
    @GetMapping(produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<ElicitationPrompt>> stream(@PathVariable String mailbox) {
        return transport.subscribe(mailbox)
                .map(prompt -> ServerSentEvent.builder(prompt)
                        .id(prompt.promptId())
                        .event("confirmation")
                        .build());
    }

    @GetMapping("/pending")
    public List<ElicitationPrompt> pending(@PathVariable String mailbox) {
        return transport.pendingFor(mailbox);
    }

    @PostMapping("/{promptId}")
    public Mono<Map<String, Object>> answer(@PathVariable String mailbox,
                                            @PathVariable String promptId,
                                            @RequestBody ElicitationResponse response) {
        return transport.answer(mailbox, promptId, response)
                .thenReturn(Map.of("success", true, "promptId", promptId));
    }
}
