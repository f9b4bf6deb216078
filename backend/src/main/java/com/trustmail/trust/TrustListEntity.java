package com.trustmail.trust;

import java.util.List;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

@Table("trust_lists")
public class TrustListEntity {

    @PrimaryKey("list_id")
    private String listId;

    @Column("tokens")
    private List<String> tokens;

    @Column("version")
    private long version;

    public TrustListEntity() {}

    public TrustListEntity(String listId, List<String> tokens, long version) {
        this.listId = listId;
        this.tokens = tokens;
        this.version = version;
    }

    public String getListId() { return listId; }
    public void setListId(String listId) { this.listId = listId; }
    public List<String> getTokens() { return tokens; }
    public void setTokens(List<String> tokens) { this.tokens = tokens; }
    public long getVersion() { return version; }
    public void setVersion(long version) { this.version = version; }
}
