package com.trustmail.rule;

import java.util.ArrayList;
import java.util.List;

/**
 * Filter criteria of a rule. All present criteria must match.
 *
 * @param query          free-form search expression, appended verbatim
 * @param excludeChats   stored with the rule; chats are not part of the mailbox store, so it
 *                       has no effect on {@link #toQuery()}
 * @param size           threshold in bytes, only used together with {@code sizeComparison}
 */
public record RuleSelector(
        String from,
        String to,
        String subjectContains,
        String query,
        Boolean hasAttachment,
        Boolean excludeChats,
        Long size,
        SizeComparison sizeComparison
) {

    public static RuleSelector ofQuery(String query) {
        return new RuleSelector(null, null, null, query, null, null, null, null);
    }

    /** True when no criterion is set at all. */
    public boolean isEmpty() {
        return isBlank(from) && isBlank(to) && isBlank(subjectContains) && isBlank(query)
                && hasAttachment == null && excludeChats == null && size == null && sizeComparison == null;
    }

    /**
     * Search expression understood by {@link com.trustmail.message.MessageQuery}, e.g.
     * {@code from:alice@example.com subject:(invoice) has:attachment larger:1048576}.
     * Empty when no criterion translates into a search term.
     */
    public String toQuery() {
        List<String> terms = new ArrayList<>();
        if (!isBlank(from)) {
            terms.add("from:" + from.trim());
        }
        if (!isBlank(to)) {
            terms.add("to:" + to.trim());
        }
        if (!isBlank(subjectContains)) {
            terms.add("subject:(" + subjectContains.trim() + ")");
        }
        if (!isBlank(query)) {
            terms.add(query.trim());
        }
        if (Boolean.TRUE.equals(hasAttachment)) {
            terms.add("has:attachment");
        } else if (Boolean.FALSE.equals(hasAttachment)) {
            terms.add("-has:attachment");
        }
        if (size != null && sizeComparison != null) {
            terms.add((sizeComparison == SizeComparison.LARGER ? "larger:" : "smaller:") + size);
        }
        return String.join(" ", terms);
    }

    /** "From: a | Subject contains: b" style summary of the text criteria. */
    public String summary() {
        List<String> parts = new ArrayList<>();
        if (!isBlank(from)) {
            parts.add("From: " + from);
        }
        if (!isBlank(to)) {
            parts.add("To: " + to);
        }
        if (!isBlank(subjectContains)) {
            parts.add("Subject contains: " + subjectContains);
        }
        if (!isBlank(query)) {
            parts.add("Query: " + query);
        }
        return String.join(" | ", parts);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
