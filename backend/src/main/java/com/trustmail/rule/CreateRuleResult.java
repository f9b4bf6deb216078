package com.trustmail.rule;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * @param retroactiveResults null when no retroactive run happened
 * @param retroactiveError   set when the rule was saved but the retroactive run failed outright
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreateRuleResult(
        boolean success,
        String ruleId,
        String criteriaSummary,
        String actionsSummary,
        RetroactiveRunState retroactiveResults,
        String retroactiveError,
        String message
) {}
