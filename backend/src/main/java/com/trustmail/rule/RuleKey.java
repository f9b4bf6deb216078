package com.trustmail.rule;

import java.io.Serializable;

import org.springframework.data.cassandra.core.cql.PrimaryKeyType;
import org.springframework.data.cassandra.core.mapping.PrimaryKeyClass;
import org.springframework.data.cassandra.core.mapping.PrimaryKeyColumn;

@PrimaryKeyClass
public record RuleKey(
    @PrimaryKeyColumn(name = "mailbox", ordinal = 0, type = PrimaryKeyType.PARTITIONED)
    String mailbox,

    @PrimaryKeyColumn(name = "rule_id", ordinal = 1, type = PrimaryKeyType.CLUSTERED)
    String ruleId
) implements Serializable {}
