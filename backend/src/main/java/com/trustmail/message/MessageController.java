package com.trustmail.message;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/mail/{mailbox}/messages")
public class MessageController {

    private final MessageService messageService;

    public MessageController(MessageService messageService) {
        this.messageService = messageService;
    }

    /**
     * SEARCH: one page of messages matching {@code q}, newest first.
     */
    @GetMapping
    public Mono<MessageListing> search(
            @PathVariable String mailbox,
            @RequestParam(name = "q", required = false) String query,
            @RequestParam(required = false) String pageToken) {
        return messageService.search(mailbox, query, pageToken);
    }

    @GetMapping("/{id}")
    public Mono<MessageDetail> getMessage(@PathVariable String mailbox, @PathVariable String id) {
        return messageService.getMessage(mailbox, id);
    }
}
