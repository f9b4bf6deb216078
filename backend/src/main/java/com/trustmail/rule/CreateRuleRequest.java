package com.trustmail.rule;

/**
 * @param retroactive apply the label changes to existing matching messages; defaults to true
 */
public record CreateRuleRequest(RuleSelector criteria, FilterActions action, Boolean retroactive) {

    public boolean retroactiveOrDefault() {
        return retroactive == null || retroactive;
    }
}
