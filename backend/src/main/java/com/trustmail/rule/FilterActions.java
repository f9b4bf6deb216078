package com.trustmail.rule;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.trustmail.config.StringOrListDeserializer;

/**
 * Everything a rule does to a matching message. Only the label changes are applied
 * retroactively; the flags and forwarding address are stored with the rule.
 *
 * <p>Label id fields accept a list, a JSON array encoded as a string, or a single id.
 */
public record FilterActions(
        @JsonDeserialize(using = StringOrListDeserializer.Verbatim.class) List<String> addLabelIds,
        @JsonDeserialize(using = StringOrListDeserializer.Verbatim.class) List<String> removeLabelIds,
        String forward,
        Boolean markAsSpam,
        Boolean markAsImportant,
        Boolean neverMarkAsSpam,
        Boolean neverMarkAsImportant
) {

    public FilterActions {
        addLabelIds = addLabelIds != null ? List.copyOf(addLabelIds) : List.of();
        removeLabelIds = removeLabelIds != null ? List.copyOf(removeLabelIds) : List.of();
    }

    public static FilterActions labels(RuleAction action) {
        return new FilterActions(action.addLabelIds(), action.removeLabelIds(), null, null, null, null, null);
    }

    public RuleAction ruleAction() {
        return new RuleAction(addLabelIds, removeLabelIds);
    }

    public boolean isEmpty() {
        return addLabelIds.isEmpty() && removeLabelIds.isEmpty() && (forward == null || forward.isBlank())
                && markAsSpam == null && markAsImportant == null
                && neverMarkAsSpam == null && neverMarkAsImportant == null;
    }

    public String summary() {
        List<String> parts = new ArrayList<>();
        if (!addLabelIds.isEmpty()) {
            parts.add("Add labels: " + String.join(", ", addLabelIds));
        }
        if (!removeLabelIds.isEmpty()) {
            parts.add("Remove labels: " + String.join(", ", removeLabelIds));
        }
        if (forward != null && !forward.isBlank()) {
            parts.add("Forward to: " + forward);
        }
        if (Boolean.TRUE.equals(markAsSpam)) {
            parts.add("Mark as spam");
        }
        if (Boolean.TRUE.equals(markAsImportant)) {
            parts.add("Mark as important");
        }
        if (Boolean.TRUE.equals(neverMarkAsSpam)) {
            parts.add("Never mark as spam");
        }
        if (Boolean.TRUE.equals(neverMarkAsImportant)) {
            parts.add("Never mark as important");
        }
        return String.join(" | ", parts);
    }
}
