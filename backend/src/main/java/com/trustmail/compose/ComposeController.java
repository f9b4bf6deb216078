package com.trustmail.compose;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.trustmail.elicitation.DispatchStatus;

import reactor.core.publisher.Mono;

/**
 * Outbound mail. Each call may block on interactive confirmation for up to the configured
 * timeout when recipients are not on the trust list.
 */
@RestController
@RequestMapping("/api/mail/{mailbox}")
public class ComposeController {

    private final ComposeService composeService;

    public ComposeController(ComposeService composeService) {
        this.composeService = composeService;
    }

    @PostMapping("/send")
    public Mono<ResponseEntity<SendResult>> send(@PathVariable String mailbox, @RequestBody SendRequest request) {
        return composeService.send(mailbox, request).map(ComposeController::toResponse);
    }

    @PostMapping("/reply")
    public Mono<ResponseEntity<SendResult>> reply(@PathVariable String mailbox, @RequestBody SendRequest request) {
        return composeService.reply(mailbox, request).map(ComposeController::toResponse);
    }

    @PostMapping("/forward")
    public Mono<ResponseEntity<SendResult>> forward(@PathVariable String mailbox, @RequestBody SendRequest request) {
        return composeService.forward(mailbox, request).map(ComposeController::toResponse);
    }

    // HARD_FAILURE is the only outcome where confirmation itself broke
    private static ResponseEntity<SendResult> toResponse(SendResult result) {
        HttpStatus status = result.status() == DispatchStatus.HARD_FAILURE ? HttpStatus.BAD_GATEWAY : HttpStatus.OK;
        return ResponseEntity.status(status).body(result);
    }
}
