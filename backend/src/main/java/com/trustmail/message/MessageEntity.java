package com.trustmail.message;

import java.util.List;
import java.util.Set;
import java.util.UUID;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

@Table("mailbox_messages")
public class MessageEntity {

    @PrimaryKey
    private MessageKey key;

    @Column("thread_id")
    private UUID threadId;

    @Column("sender")
    private String sender;

    @Column("to_recipients")
    private List<String> toRecipients;

    @Column("cc_recipients")
    private List<String> ccRecipients;

    @Column("bcc_recipients")
    private List<String> bccRecipients;

    @Column("subject")
    private String subject;

    @Column("body")
    private String body;

    @Column("html_body")
    private String htmlBody;

    /** Id of the message this one replies to, null for new threads. */
    @Column("in_reply_to")
    private String inReplyTo;

    @Column("has_attachment")
    private boolean hasAttachment;

    @Column("size_bytes")
    private long sizeBytes;

    /**
     * System labels (SENT, DRAFT, INBOX, ...) and user label ids. Rule actions only ever
     * touch this column.
     */
    @Column("label_ids")
    private Set<String> labelIds;

    public MessageEntity() {}

    // Getters & Setters
    public MessageKey getKey() { return key; }
    public void setKey(MessageKey key) { this.key = key; }
    public UUID getThreadId() { return threadId; }
    public void setThreadId(UUID threadId) { this.threadId = threadId; }
    public String getSender() { return sender; }
    public void setSender(String sender) { this.sender = sender; }
    public List<String> getToRecipients() { return toRecipients; }
    public void setToRecipients(List<String> toRecipients) { this.toRecipients = toRecipients; }
    public List<String> getCcRecipients() { return ccRecipients; }
    public void setCcRecipients(List<String> ccRecipients) { this.ccRecipients = ccRecipients; }
    public List<String> getBccRecipients() { return bccRecipients; }
    public void setBccRecipients(List<String> bccRecipients) { this.bccRecipients = bccRecipients; }
    public String getSubject() { return subject; }
    public void setSubject(String subject) { this.subject = subject; }
    public String getBody() { return body; }
    public void setBody(String body) { this.body = body; }
    public String getHtmlBody() { return htmlBody; }
    public void setHtmlBody(String htmlBody) { this.htmlBody = htmlBody; }
    public String getInReplyTo() { return inReplyTo; }
    public void setInReplyTo(String inReplyTo) { this.inReplyTo = inReplyTo; }
    public boolean isHasAttachment() { return hasAttachment; }
    public void setHasAttachment(boolean hasAttachment) { this.hasAttachment = hasAttachment; }
    public long getSizeBytes() { return sizeBytes; }
    public void setSizeBytes(long sizeBytes) { this.sizeBytes = sizeBytes; }
    public Set<String> getLabelIds() { return labelIds; }
    public void setLabelIds(Set<String> labelIds) { this.labelIds = labelIds; }
}
