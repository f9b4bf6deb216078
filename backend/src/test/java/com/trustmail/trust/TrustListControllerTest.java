package com.trustmail.trust;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.reactive.server.WebTestClient;

import com.trustmail.error.ValidationException;

import reactor.core.publisher.Mono;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * HTTP-layer tests for TrustListController. The service is mocked with @MockitoBean.
 */
@WebFluxTest(controllers = TrustListController.class)
class TrustListControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockitoBean
    private TrustListService trustListService;

    // ── POST /api/trust-list/add ──────────────────────────────────────────────

    @Test
    void add_shouldAcceptCommaSeparatedString() {
        when(trustListService.add(List.of("a@example.com", "b@example.com")))
                .thenReturn(Mono.just(new TrustListUpdateResult(true, "add",
                        List.of("a@example.com", "b@example.com"), List.of(), List.of(), 2, "Added 2 entries")));

        webTestClient.post()
                .uri("/api/trust-list/add")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"email\":\"a@example.com, b@example.com\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.size").isEqualTo(2);
    }

    @Test
    void add_shouldAcceptList() {
        when(trustListService.add(List.of("a@example.com", "group:Team")))
                .thenReturn(Mono.just(new TrustListUpdateResult(true, "add",
                        List.of("a@example.com", "group:Team"), List.of(), List.of(), 2, "Added 2 entries")));

        webTestClient.post()
                .uri("/api/trust-list/add")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"email\":[\"a@example.com\",\"group:Team\"]}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.changed[1]").isEqualTo("group:Team");
    }

    @Test
    void add_shouldMapValidationErrorTo400() {
        when(trustListService.add(any()))
                .thenReturn(Mono.error(new ValidationException("No valid email addresses found. Invalid: nope")));

        webTestClient.post()
                .uri("/api/trust-list/add")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"email\":\"nope\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error_code").isEqualTo("VALIDATION_ERROR")
                .jsonPath("$.message").isEqualTo("No valid email addresses found. Invalid: nope");
    }

    // ── GET /api/trust-list ───────────────────────────────────────────────────

    @Test
    void view_shouldReturnMaskedListing() {
        when(trustListService.view()).thenReturn(Mono.just(new TrustListView(true, 2,
                List.of("al***@example.com"), List.of("group:Team"), "2 entries configured")));

        webTestClient.get()
                .uri("/api/trust-list")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.count").isEqualTo(2)
                .jsonPath("$.maskedAddresses[0]").isEqualTo("al***@example.com")
                .jsonPath("$.groupTokens[0]").isEqualTo("group:Team");
    }

    // ── label verbs ───────────────────────────────────────────────────────────

    @Test
    void labelAdd_shouldPassLabelFromPath() {
        when(trustListService.labelAdd("Vendors", List.of("x@vendor.com")))
                .thenReturn(Mono.just(new LabelUpdateResult(true, "label_add", "Vendors", "contactGroups/1", 1,
                        List.of(), "Added 1 address(es) to group 'Vendors'")));

        webTestClient.post()
                .uri("/api/trust-list/labels/Vendors/add")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"email\":\"x@vendor.com\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.groupId").isEqualTo("contactGroups/1");

        verify(trustListService).labelAdd("Vendors", List.of("x@vendor.com"));
    }
}
