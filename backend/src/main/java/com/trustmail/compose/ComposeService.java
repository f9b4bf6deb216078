package com.trustmail.compose;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.trustmail.elicitation.ElicitationController;
import com.trustmail.error.ValidationException;
import com.trustmail.message.MessageEntity;
import com.trustmail.message.MessageStore;
import com.trustmail.message.OutgoingMessage;
import com.trustmail.trust.ResolvedGroupMembers;
import com.trustmail.trust.TrustDecision;
import com.trustmail.trust.TrustGate;
import com.trustmail.trust.TrustListResolver;
import com.trustmail.trust.TrustListService;

import reactor.core.publisher.Mono;

/**
 * Send, reply and forward paths. Each one expands group recipients, classifies every
 * recipient against the current trust set and hands the message to the
 * {@link ElicitationController}, which decides whether and how it goes out.
 */
@Service
public class ComposeService {

    private static final Logger log = LoggerFactory.getLogger(ComposeService.class);

    static final String FORWARD_SEPARATOR = "---------- Forwarded message ---------";

    private final MessageStore messageStore;
    private final TrustListResolver resolver;
    private final TrustListService trustListService;
    private final TrustGate trustGate;
    private final ElicitationController elicitationController;

    public ComposeService(MessageStore messageStore,
                          TrustListResolver resolver,
                          TrustListService trustListService,
                          TrustGate trustGate,
                          ElicitationController elicitationController) {
        this.messageStore = messageStore;
        this.resolver = resolver;
        this.trustListService = trustListService;
        this.trustGate = trustGate;
        this.elicitationController = elicitationController;
    }

    public Mono<SendResult> send(String mailbox, SendRequest request) {
        log.info("[compose.send] Sending from {} to {} to / {} cc / {} bcc entr(ies)",
                mailbox, request.to().size(), request.cc().size(), request.bcc().size());
        return Mono.defer(() -> {
            requireRecipients(request.to(), request.cc(), request.bcc());
            return dispatch(SendIntent.SEND, mailbox, request.to(), request.cc(), request.bcc(),
                    request.subject(), request.body(), request.htmlBody(), null, null);
        });
    }

    /** Replies to the original sender unless {@code to} is given; quotes the original body. */
    public Mono<SendResult> reply(String mailbox, SendRequest request) {
        log.info("[compose.reply] Replying from {} to message {}", mailbox, request.originalMessageId());
        return Mono.defer(() -> messageStore.find(mailbox, requireOriginal(request))
                .flatMap(original -> {
                    List<String> to = request.to().isEmpty() && original.getSender() != null
                            ? List.of(original.getSender())
                            : request.to();
                    requireRecipients(to, request.cc(), request.bcc());
                    String from = original.getSender() != null ? original.getSender() : "(unknown sender)";
                    String body = nullToEmpty(request.body()) + "\n\nOn " + from + " wrote:\n"
                            + quote(original.getBody());
                    return dispatch(SendIntent.REPLY, mailbox, to, request.cc(), request.bcc(),
                            replySubject(original.getSubject()), body, request.htmlBody(),
                            threadOf(original), original.getKey().id().toString());
                }));
    }

    public Mono<SendResult> forward(String mailbox, SendRequest request) {
        log.info("[compose.forward] Forwarding message {} from {}", request.originalMessageId(), mailbox);
        return Mono.defer(() -> messageStore.find(mailbox, requireOriginal(request))
                .flatMap(original -> {
                    requireRecipients(request.to(), request.cc(), request.bcc());
                    String subject = request.subject() != null && !request.subject().isBlank()
                            ? request.subject()
                            : forwardSubject(original.getSubject());
                    String body = nullToEmpty(request.body()) + "\n\n" + FORWARD_SEPARATOR + "\n"
                            + "From: " + nullToEmpty(original.getSender()) + "\n"
                            + "Subject: " + nullToEmpty(original.getSubject()) + "\n"
                            + "To: " + String.join(", ", orEmpty(original.getToRecipients())) + "\n\n"
                            + nullToEmpty(original.getBody());
                    return dispatch(SendIntent.FORWARD, mailbox, request.to(), request.cc(), request.bcc(),
                            subject, body, request.htmlBody(), null, null);
                }));
    }

    private Mono<SendResult> dispatch(SendIntent intent, String mailbox,
                                      List<String> to, List<String> cc, List<String> bcc,
                                      String subject, String body, String htmlBody,
                                      String threadId, String inReplyTo) {
        List<String> toTokens = splitRecipients(to);
        List<String> ccTokens = splitRecipients(cc);
        List<String> bccTokens = splitRecipients(bcc);
        List<String> groupTokens = new ArrayList<>();
        for (List<String> field : List.of(toTokens, ccTokens, bccTokens)) {
            field.stream().filter(TrustListResolver::isGroupToken).forEach(groupTokens::add);
        }

        return resolver.resolve(groupTokens)
                .flatMap(members -> {
                    OutgoingMessage message = new OutgoingMessage(mailbox,
                            expand(toTokens, members), expand(ccTokens, members), expand(bccTokens, members),
                            subject, body, htmlBody, threadId, inReplyTo);
                    List<String> all = new ArrayList<>(message.to());
                    all.addAll(message.cc());
                    all.addAll(message.bcc());
                    return trustListService.currentTrustSet()
                            .flatMap(trustSet -> {
                                TrustDecision decision = trustGate.evaluate(all, trustSet);
                                log.info("[compose.{}] {} trusted, {} untrusted recipient(s)",
                                        intent.name().toLowerCase(Locale.ROOT),
                                        decision.trustedRecipients().size(), decision.untrustedRecipients().size());
                                return elicitationController.dispatch(message, decision);
                            });
                })
                .map(outcome -> SendResult.of(intent, outcome));
    }

    /**
     * Replaces group tokens with their members and validates literal addresses.
     * A group without members is rejected so that no recipient silently disappears.
     */
    static List<String> expand(List<String> tokens, ResolvedGroupMembers members) {
        Set<String> addresses = new LinkedHashSet<>();
        for (String token : tokens) {
            if (TrustListResolver.isGroupToken(token)) {
                List<String> groupMembers = members.membersOf(token);
                if (groupMembers.isEmpty()) {
                    throw new ValidationException("Recipient group '" + token + "' could not be resolved to any member");
                }
                groupMembers.forEach(member -> addresses.add(member.trim().toLowerCase(Locale.ROOT)));
            } else {
                if (!TrustListService.EMAIL_PATTERN.matcher(token).matches()) {
                    throw new ValidationException("Invalid recipient address: " + token);
                }
                addresses.add(token.toLowerCase(Locale.ROOT));
            }
        }
        return new ArrayList<>(addresses);
    }

    /** Splits comma-joined entries and trims; case is kept so group names resolve as written. */
    static List<String> splitRecipients(List<String> raw) {
        List<String> tokens = new ArrayList<>();
        for (String entry : raw) {
            if (entry == null) {
                continue;
            }
            for (String part : entry.split(",")) {
                String token = part.trim();
                if (!token.isEmpty() && !tokens.contains(token)) {
                    tokens.add(token);
                }
            }
        }
        return tokens;
    }

    private static void requireRecipients(List<String> to, List<String> cc, List<String> bcc) {
        if (splitRecipients(to).isEmpty() && splitRecipients(cc).isEmpty() && splitRecipients(bcc).isEmpty()) {
            throw new ValidationException("At least one recipient is required");
        }
    }

    private static String requireOriginal(SendRequest request) {
        if (request.originalMessageId() == null || request.originalMessageId().isBlank()) {
            throw new ValidationException("'originalMessageId' is required");
        }
        return request.originalMessageId().trim();
    }

    static String replySubject(String subject) {
        String s = subject != null && !subject.isBlank() ? subject.trim() : "(no subject)";
        return s.toLowerCase(Locale.ROOT).startsWith("re:") ? s : "Re: " + s;
    }

    static String forwardSubject(String subject) {
        String s = subject != null && !subject.isBlank() ? subject.trim() : "(no subject)";
        String lower = s.toLowerCase(Locale.ROOT);
        return lower.startsWith("fwd:") || lower.startsWith("fw:") ? s : "Fwd: " + s;
    }

    static String quote(String body) {
        if (body == null || body.isEmpty()) {
            return "> ";
        }
        StringBuilder quoted = new StringBuilder();
        for (String line : body.split("\n", -1)) {
            if (quoted.length() > 0) {
                quoted.append('\n');
            }
            quoted.append("> ").append(line);
        }
        return quoted.toString();
    }

    private static String threadOf(MessageEntity original) {
        return original.getThreadId() != null ? original.getThreadId().toString() : null;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    private static List<String> orEmpty(List<String> values) {
        return values != null ? values : List.of();
    }
}
