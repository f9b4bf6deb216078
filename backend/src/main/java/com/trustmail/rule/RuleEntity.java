package com.trustmail.rule;

import java.time.Instant;
import java.util.List;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

@Table("rules")
public class RuleEntity {

    @PrimaryKey
    private RuleKey key;

    // Criteria
    @Column("from_address")
    private String fromAddress;

    @Column("to_address")
    private String toAddress;

    @Column("subject_contains")
    private String subjectContains;

    @Column("query")
    private String query;

    @Column("has_attachment")
    private Boolean hasAttachment;

    @Column("exclude_chats")
    private Boolean excludeChats;

    @Column("size_bytes")
    private Long sizeBytes;

    @Column("size_comparison")
    private String sizeComparison;

    // Actions
    @Column("add_label_ids")
    private List<String> addLabelIds;

    @Column("remove_label_ids")
    private List<String> removeLabelIds;

    @Column("forward_to")
    private String forwardTo;

    @Column("mark_as_spam")
    private Boolean markAsSpam;

    @Column("mark_as_important")
    private Boolean markAsImportant;

    @Column("never_mark_as_spam")
    private Boolean neverMarkAsSpam;

    @Column("never_mark_as_important")
    private Boolean neverMarkAsImportant;

    @Column("created_at")
    private Instant createdAt;

    public RuleEntity() {}

    // Getters & Setters
    public RuleKey getKey() { return key; }
    public void setKey(RuleKey key) { this.key = key; }
    public String getFromAddress() { return fromAddress; }
    public void setFromAddress(String fromAddress) { this.fromAddress = fromAddress; }
    public String getToAddress() { return toAddress; }
    public void setToAddress(String toAddress) { this.toAddress = toAddress; }
    public String getSubjectContains() { return subjectContains; }
    public void setSubjectContains(String subjectContains) { this.subjectContains = subjectContains; }
    public String getQuery() { return query; }
    public void setQuery(String query) { this.query = query; }
    public Boolean getHasAttachment() { return hasAttachment; }
    public void setHasAttachment(Boolean hasAttachment) { this.hasAttachment = hasAttachment; }
    public Boolean getExcludeChats() { return excludeChats; }
    public void setExcludeChats(Boolean excludeChats) { this.excludeChats = excludeChats; }
    public Long getSizeBytes() { return sizeBytes; }
    public void setSizeBytes(Long sizeBytes) { this.sizeBytes = sizeBytes; }
    public String getSizeComparison() { return sizeComparison; }
    public void setSizeComparison(String sizeComparison) { this.sizeComparison = sizeComparison; }
    public List<String> getAddLabelIds() { return addLabelIds; }
    public void setAddLabelIds(List<String> addLabelIds) { this.addLabelIds = addLabelIds; }
    public List<String> getRemoveLabelIds() { return removeLabelIds; }
    public void setRemoveLabelIds(List<String> removeLabelIds) { this.removeLabelIds = removeLabelIds; }
    public String getForwardTo() { return forwardTo; }
    public void setForwardTo(String forwardTo) { this.forwardTo = forwardTo; }
    public Boolean getMarkAsSpam() { return markAsSpam; }
    public void setMarkAsSpam(Boolean markAsSpam) { this.markAsSpam = markAsSpam; }
    public Boolean getMarkAsImportant() { return markAsImportant; }
    public void setMarkAsImportant(Boolean markAsImportant) { this.markAsImportant = markAsImportant; }
    public Boolean getNeverMarkAsSpam() { return neverMarkAsSpam; }
    public void setNeverMarkAsSpam(Boolean neverMarkAsSpam) { this.neverMarkAsSpam = neverMarkAsSpam; }
    public Boolean getNeverMarkAsImportant() { return neverMarkAsImportant; }
    public void setNeverMarkAsImportant(Boolean neverMarkAsImportant) { this.neverMarkAsImportant = neverMarkAsImportant; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
