package com.trustmail.rule;

public record DeleteRuleResult(boolean success, String ruleId, String message) {}
