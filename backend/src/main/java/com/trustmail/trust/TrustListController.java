package com.trustmail.trust;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/trust-list")
public class TrustListController {

    private final TrustListService trustListService;

    public TrustListController(TrustListService trustListService) {
        this.trustListService = trustListService;
    }

    @GetMapping
    public Mono<TrustListView> view() {
        return trustListService.view();
    }

    @PostMapping("/add")
    public Mono<TrustListUpdateResult> add(@RequestBody TrustListCommand command) {
        return trustListService.add(command.email());
    }

    @PostMapping("/remove")
    public Mono<TrustListUpdateResult> remove(@RequestBody TrustListCommand command) {
        return trustListService.remove(command.email());
    }

    /**
     * label_add: attach addresses to a directory group, creating the group when needed.
     * Reference the group from the trust list as {@code group:<label>}.
     */
    @PostMapping("/labels/{label}/add")
    public Mono<LabelUpdateResult> labelAdd(@PathVariable String label, @RequestBody TrustListCommand command) {
        return trustListService.labelAdd(label, command.email());
    }

    @PostMapping("/labels/{label}/remove")
    public Mono<LabelUpdateResult> labelRemove(@PathVariable String label, @RequestBody TrustListCommand command) {
        return trustListService.labelRemove(label, command.email());
    }
}
