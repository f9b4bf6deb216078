package com.trustmail.rule;

import java.util.List;

public record RuleList(boolean success, int count, List<Rule> rules) {}
