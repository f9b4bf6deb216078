package com.trustmail.directory;

import java.util.Map;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

@Table("contact_groups")
public class ContactGroupEntity {

    /** Resource name, e.g. {@code contactGroups/0b1c...}. */
    @PrimaryKey("group_id")
    private String groupId;

    @Column("name")
    private String name;

    /** member id -> address */
    @Column("members")
    private Map<String, String> members;

    public ContactGroupEntity() {}

    public String getGroupId() { return groupId; }
    public void setGroupId(String groupId) { this.groupId = groupId; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public Map<String, String> getMembers() { return members; }
    public void setMembers(Map<String, String> members) { this.members = members; }
}
