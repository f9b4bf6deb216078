package com.trustmail.rule;

import java.util.List;

/**
 * Label changes applied to each matching message.
 */
public record RuleAction(List<String> addLabelIds, List<String> removeLabelIds) {

    public RuleAction {
        addLabelIds = addLabelIds != null ? List.copyOf(addLabelIds) : List.of();
        removeLabelIds = removeLabelIds != null ? List.copyOf(removeLabelIds) : List.of();
    }

    public static RuleAction addLabels(String... labelIds) {
        return new RuleAction(List.of(labelIds), List.of());
    }

    public boolean hasLabelChanges() {
        return !addLabelIds.isEmpty() || !removeLabelIds.isEmpty();
    }
}
