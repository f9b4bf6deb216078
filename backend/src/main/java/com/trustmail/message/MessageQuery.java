package com.trustmail.message;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

import com.trustmail.error.ValidationException;

/**
 * Search expression evaluated against stored messages.
 *
 * <p>Supported terms, space separated and all required to match:
 * <pre>
 *   from:alice@example.com     sender contains the value
 *   to:bob@example.com         any of to/cc/bcc contains the value
 *   subject:(quarterly report) subject contains the phrase
 *   label:IMPORTANT            message carries the label id
 *   has:attachment             message has an attachment
 *   larger:10M / smaller:500K  size in bytes, optional K or M suffix
 *   "exact phrase" or word     subject or body contains the text
 * </pre>
 * Any term may be negated with a leading {@code -}. Matching is case-insensitive.
 */
public final class MessageQuery implements Predicate<MessageEntity> {

    private static final MessageQuery MATCH_ALL = new MessageQuery("", List.of());

    private final String expression;
    private final List<Predicate<MessageEntity>> terms;

    private MessageQuery(String expression, List<Predicate<MessageEntity>> terms) {
        this.expression = expression;
        this.terms = terms;
    }

    public static MessageQuery matchAll() {
        return MATCH_ALL;
    }

    public static MessageQuery parse(String expression) {
        if (expression == null || expression.isBlank()) {
            return MATCH_ALL;
        }
        List<Predicate<MessageEntity>> terms = new ArrayList<>();
        for (String token : tokenize(expression)) {
            boolean negated = token.length() > 1 && token.startsWith("-");
            Predicate<MessageEntity> term = parseTerm(negated ? token.substring(1) : token);
            terms.add(negated ? term.negate() : term);
        }
        return new MessageQuery(expression.trim(), List.copyOf(terms));
    }

    @Override
    public boolean test(MessageEntity message) {
        for (Predicate<MessageEntity> term : terms) {
            if (!term.test(message)) {
                return false;
            }
        }
        return true;
    }

    public boolean isMatchAll() {
        return terms.isEmpty();
    }

    @Override
    public String toString() {
        return expression;
    }

    private static Predicate<MessageEntity> parseTerm(String token) {
        int colon = token.indexOf(':');
        if (colon > 0) {
            String operator = token.substring(0, colon).toLowerCase(Locale.ROOT);
            String value = unwrap(token.substring(colon + 1));
            switch (operator) {
                case "from":
                    return m -> containsIgnoreCase(m.getSender(), value);
                case "to":
                    return m -> anyContains(m.getToRecipients(), value)
                            || anyContains(m.getCcRecipients(), value)
                            || anyContains(m.getBccRecipients(), value);
                case "subject":
                    return m -> containsIgnoreCase(m.getSubject(), value);
                case "label":
                    return m -> m.getLabelIds() != null
                            && m.getLabelIds().stream().anyMatch(label -> label.equalsIgnoreCase(value));
                case "has":
                    if (!"attachment".equalsIgnoreCase(value)) {
                        throw new ValidationException("Unsupported search term: " + token);
                    }
                    return MessageEntity::isHasAttachment;
                case "larger": {
                    long threshold = parseSize(value, token);
                    return m -> m.getSizeBytes() > threshold;
                }
                case "smaller": {
                    long threshold = parseSize(value, token);
                    return m -> m.getSizeBytes() < threshold;
                }
                default:
                    // not an operator we know; treat it as free text such as a URL
                    break;
            }
        }
        String text = unwrap(token);
        return m -> containsIgnoreCase(m.getSubject(), text) || containsIgnoreCase(m.getBody(), text);
    }

    static long parseSize(String value, String token) {
        String upper = value.trim().toUpperCase(Locale.ROOT);
        long multiplier = 1;
        if (upper.endsWith("K")) {
            multiplier = 1024;
            upper = upper.substring(0, upper.length() - 1);
        } else if (upper.endsWith("M")) {
            multiplier = 1024 * 1024;
            upper = upper.substring(0, upper.length() - 1);
        }
        try {
            return Long.parseLong(upper) * multiplier;
        } catch (NumberFormatException e) {
            throw new ValidationException("Invalid size in search term: " + token);
        }
    }

    /**
     * Splits on whitespace, keeping {@code (...)} groups and double-quoted phrases intact.
     */
    static List<String> tokenize(String expression) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        boolean quoted = false;
        for (char c : expression.toCharArray()) {
            if (c == '"') {
                quoted = !quoted;
            } else if (c == '(' && !quoted) {
                depth++;
            } else if (c == ')' && !quoted && depth > 0) {
                depth--;
            }
            if (Character.isWhitespace(c) && depth == 0 && !quoted) {
                if (current.length() > 0) {
                    tokens.add(current.toString());
                    current.setLength(0);
                }
            } else {
                current.append(c);
            }
        }
        if (current.length() > 0) {
            tokens.add(current.toString());
        }
        return tokens;
    }

    private static String unwrap(String value) {
        String v = value.trim();
        if (v.length() >= 2 && ((v.startsWith("(") && v.endsWith(")")) || (v.startsWith("\"") && v.endsWith("\"")))) {
            v = v.substring(1, v.length() - 1).trim();
        }
        return v;
    }

    private static boolean anyContains(Collection<String> values, String needle) {
        return values != null && values.stream().anyMatch(v -> containsIgnoreCase(v, needle));
    }

    private static boolean containsIgnoreCase(String haystack, String needle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle.toLowerCase(Locale.ROOT));
    }
}
