package com.trustmail.rule;

import java.time.Instant;
import java.util.Comparator;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.trustmail.config.TrustMailProperties;
import com.trustmail.error.NotFoundException;
import com.trustmail.error.ValidationException;
import com.trustmail.message.StoreErrors;

import reactor.core.publisher.Mono;

/**
 * Rule (filter) management: create, get, delete, list, plus retroactive application of a
 * rule's label changes to messages that already exist.
 */
@Service
public class RuleService {

    private static final Logger log = LoggerFactory.getLogger(RuleService.class);

    private final RuleRepository repository;
    private final RetroactiveRuleApplier applier;
    private final TrustMailProperties properties;

    public RuleService(RuleRepository repository, RetroactiveRuleApplier applier, TrustMailProperties properties) {
        this.repository = repository;
        this.applier = applier;
        this.properties = properties;
    }

    /**
     * Saves the rule, then applies its label changes to existing matching messages when
     * {@code retroactive} is set (the default). A failed retroactive run does not undo the
     * rule; the failure is reported in {@link CreateRuleResult#retroactiveError()}.
     */
    public Mono<CreateRuleResult> create(String mailbox, CreateRuleRequest request) {
        return Mono.defer(() -> {
            RuleSelector criteria = request.criteria();
            FilterActions action = request.action();
            if (criteria == null || criteria.isEmpty()) {
                return Mono.error(new ValidationException("At least one filter criteria must be specified."));
            }
            if (action == null || action.isEmpty()) {
                return Mono.error(new ValidationException("At least one filter action must be specified."));
            }
            Rule rule = new Rule(UUID.randomUUID().toString(), mailbox, criteria, action, Instant.now());
            log.info("[rules.create] Creating rule {} in {}: {} -> {}", rule.id(), mailbox,
                    criteria.summary(), action.summary());

            return repository.save(toEntity(rule))
                    .onErrorMap(StoreErrors::translate)
                    .flatMap(saved -> {
                        if (!request.retroactiveOrDefault() || !action.ruleAction().hasLabelChanges()
                                || criteria.toQuery().isEmpty()) {
                            return Mono.just(created(rule, null, null));
                        }
                        log.info("[rules.create] Applying rule {} retroactively to existing messages", rule.id());
                        return runRetroactive(rule)
                                .map(state -> created(rule, state, null))
                                .onErrorResume(error -> {
                                    log.error("[rules.create] Error during retroactive application: {}",
                                            error.getMessage());
                                    return Mono.just(created(rule, null, error.getMessage()));
                                });
                    });
        });
    }

    public Mono<Rule> get(String mailbox, String ruleId) {
        return repository.findById(new RuleKey(mailbox, ruleId))
                .onErrorMap(StoreErrors::translate)
                .switchIfEmpty(Mono.error(() -> new NotFoundException("rule", ruleId)))
                .map(RuleService::toRule);
    }

    public Mono<DeleteRuleResult> delete(String mailbox, String ruleId) {
        log.info("[rules.delete] Deleting rule {} in {}", ruleId, mailbox);
        return get(mailbox, ruleId)
                .flatMap(rule -> repository.deleteById(new RuleKey(mailbox, ruleId))
                        .onErrorMap(StoreErrors::translate))
                .thenReturn(new DeleteRuleResult(true, ruleId, "Rule " + ruleId + " deleted"));
    }

    public Mono<RuleList> list(String mailbox) {
        return repository.findAllByKeyMailbox(mailbox)
                .onErrorMap(StoreErrors::translate)
                .map(RuleService::toRule)
                .sort(Comparator.comparing(Rule::createdAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .collectList()
                .map(rules -> new RuleList(true, rules.size(), rules));
    }

    /** Runs an existing rule over the current mailbox contents. */
    public Mono<RetroactiveRunState> applyExisting(String mailbox, String ruleId) {
        return get(mailbox, ruleId)
                .flatMap(rule -> {
                    if (!rule.action().ruleAction().hasLabelChanges()) {
                        return Mono.error(new ValidationException("Rule " + ruleId + " has no label actions to apply"));
                    }
                    log.info("[rules.apply] Applying rule {} retroactively", ruleId);
                    return runRetroactive(rule);
                });
    }

    private Mono<RetroactiveRunState> runRetroactive(Rule rule) {
        RetroactiveConfig config = RetroactiveConfig.from(properties.getRetroactive());
        return applier.apply(rule.mailbox(), rule.criteria(), rule.action().ruleAction(), config,
                new RetroactiveProgressListener() {
                    @Override
                    public void onPageFetched(int pageNumber, int idsOnPage, int idsSoFar) {
                        log.debug("[rules.apply] Rule {}: found {} messages so far", rule.id(), idsSoFar);
                    }

                    @Override
                    public void onBatchCompleted(int batchNumber, int totalBatches, RetroactiveRunState state) {
                        log.debug("[rules.apply] Rule {}: batch {} of {} done ({})", rule.id(), batchNumber,
                                totalBatches, state);
                    }
                });
    }

    private static CreateRuleResult created(Rule rule, RetroactiveRunState state, String retroactiveError) {
        String message = "Rule " + rule.id() + " created";
        if (state != null) {
            message += "; applied to " + state.getProcessedCount() + " of " + state.getTotalFound()
                    + " existing message(s)" + (state.getErrorCount() > 0 ? " with " + state.getErrorCount() + " error(s)" : "");
        } else if (retroactiveError != null) {
            message += "; retroactive application failed";
        }
        return new CreateRuleResult(true, rule.id(), rule.criteria().summary(), rule.action().summary(),
                state, retroactiveError, message);
    }

    static RuleEntity toEntity(Rule rule) {
        RuleEntity entity = new RuleEntity();
        entity.setKey(new RuleKey(rule.mailbox(), rule.id()));
        RuleSelector c = rule.criteria();
        entity.setFromAddress(c.from());
        entity.setToAddress(c.to());
        entity.setSubjectContains(c.subjectContains());
        entity.setQuery(c.query());
        entity.setHasAttachment(c.hasAttachment());
        entity.setExcludeChats(c.excludeChats());
        entity.setSizeBytes(c.size());
        entity.setSizeComparison(c.sizeComparison() != null ? c.sizeComparison().name() : null);
        FilterActions a = rule.action();
        entity.setAddLabelIds(a.addLabelIds());
        entity.setRemoveLabelIds(a.removeLabelIds());
        entity.setForwardTo(a.forward());
        entity.setMarkAsSpam(a.markAsSpam());
        entity.setMarkAsImportant(a.markAsImportant());
        entity.setNeverMarkAsSpam(a.neverMarkAsSpam());
        entity.setNeverMarkAsImportant(a.neverMarkAsImportant());
        entity.setCreatedAt(rule.createdAt());
        return entity;
    }

    static Rule toRule(RuleEntity entity) {
        RuleSelector criteria = new RuleSelector(
                entity.getFromAddress(),
                entity.getToAddress(),
                entity.getSubjectContains(),
                entity.getQuery(),
                entity.getHasAttachment(),
                entity.getExcludeChats(),
                entity.getSizeBytes(),
                SizeComparison.fromWire(entity.getSizeComparison()));
        FilterActions action = new FilterActions(
                entity.getAddLabelIds(),
                entity.getRemoveLabelIds(),
                entity.getForwardTo(),
                entity.getMarkAsSpam(),
                entity.getMarkAsImportant(),
                entity.getNeverMarkAsSpam(),
                entity.getNeverMarkAsImportant());
        return new Rule(entity.getKey().ruleId(), entity.getKey().mailbox(), criteria, action, entity.getCreatedAt());
    }
}
