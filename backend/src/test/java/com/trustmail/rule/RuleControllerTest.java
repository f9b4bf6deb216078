package com.trustmail.rule;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.reactive.server.WebTestClient;

import com.trustmail.error.NotFoundException;

import reactor.core.publisher.Mono;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * HTTP-layer tests for RuleController, including the label id input forms.
 */
@WebFluxTest(controllers = RuleController.class)
class RuleControllerTest {

    private static final String MAILBOX = "me@example.com";

    @Autowired
    private WebTestClient webTestClient;

    @MockitoBean
    private RuleService ruleService;

    @Test
    void create_shouldAcceptJsonEncodedLabelArray() {
        ArgumentCaptor<CreateRuleRequest> request = ArgumentCaptor.forClass(CreateRuleRequest.class);
        when(ruleService.create(eq(MAILBOX), request.capture()))
                .thenReturn(Mono.just(new CreateRuleResult(true, "rule-1", "From: a@b.com",
                        "Add labels: Label_1, Label_2", null, null, "Rule rule-1 created")));

        webTestClient.post()
                .uri("/api/rules/{mailbox}", MAILBOX)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {"criteria": {"from": "a@b.com", "size": 1024, "sizeComparison": "larger"},
                         "action": {"addLabelIds": "[\\"Label_1\\", \\"Label_2\\"]", "removeLabelIds": "INBOX"},
                         "retroactive": false}
                        """)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.ruleId").isEqualTo("rule-1")
                .jsonPath("$.retroactiveResults").doesNotExist();

        CreateRuleRequest sent = request.getValue();
        assertEquals(List.of("Label_1", "Label_2"), sent.action().addLabelIds());
        assertEquals(List.of("INBOX"), sent.action().removeLabelIds());
        assertEquals(SizeComparison.LARGER, sent.criteria().sizeComparison());
        assertFalse(sent.retroactiveOrDefault());
    }

    @Test
    void get_shouldReturn404WithRuleId() {
        when(ruleService.get(MAILBOX, "missing")).thenReturn(Mono.error(new NotFoundException("rule", "missing")));

        webTestClient.get()
                .uri("/api/rules/{mailbox}/{id}", MAILBOX, "missing")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error_code").isEqualTo("NOT_FOUND")
                .jsonPath("$.resource_id").isEqualTo("missing");
    }

    @Test
    void delete_shouldReturnResult() {
        when(ruleService.delete(MAILBOX, "rule-1"))
                .thenReturn(Mono.just(new DeleteRuleResult(true, "rule-1", "Rule rule-1 deleted")));

        webTestClient.delete()
                .uri("/api/rules/{mailbox}/{id}", MAILBOX, "rule-1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true);

        verify(ruleService).delete(MAILBOX, "rule-1");
    }

    @Test
    void apply_shouldReturnRunState() {
        RetroactiveRunState state = new RetroactiveRunState();
        state.setTotalFound(3);
        state.addProcessed(2);
        state.addError("Message m3: gone");
        when(ruleService.applyExisting(MAILBOX, "rule-1")).thenReturn(Mono.just(state));

        webTestClient.post()
                .uri("/api/rules/{mailbox}/{id}/apply", MAILBOX, "rule-1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.totalFound").isEqualTo(3)
                .jsonPath("$.processedCount").isEqualTo(2)
                .jsonPath("$.errorCount").isEqualTo(1)
                .jsonPath("$.errors[0]").isEqualTo("Message m3: gone");
    }
}
