package com.trustmail.rule;

import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/rules/{mailbox}")
public class RuleController {

    private final RuleService ruleService;

    public RuleController(RuleService ruleService) {
        this.ruleService = ruleService;
    }

    @PostMapping
    public Mono<CreateRuleResult> create(@PathVariable String mailbox, @RequestBody CreateRuleRequest request) {
        return ruleService.create(mailbox, request);
    }

    @GetMapping
    public Mono<RuleList> list(@PathVariable String mailbox) {
        return ruleService.list(mailbox);
    }

    @GetMapping("/{ruleId}")
    public Mono<Rule> get(@PathVariable String mailbox, @PathVariable String ruleId) {
        return ruleService.get(mailbox, ruleId);
    }

    @DeleteMapping("/{ruleId}")
    public Mono<DeleteRuleResult> delete(@PathVariable String mailbox, @PathVariable String ruleId) {
        return ruleService.delete(mailbox, ruleId);
    }

    /**
     * Re-runs the rule's label changes over messages already in the mailbox.
     */
    @PostMapping("/{ruleId}/apply")
    public Mono<RetroactiveRunState> apply(@PathVariable String mailbox, @PathVariable String ruleId) {
        return ruleService.applyExisting(mailbox, ruleId);
    }
}
