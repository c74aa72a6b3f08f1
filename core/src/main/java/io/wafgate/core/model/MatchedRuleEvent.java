package io.wafgate.core.model;

/**
 * Emitted by the engine's error log each time a rule matches during
 * evaluation. Read-only; the core only logs it.
 *
 * @param severity the rule's severity
 * @param errorLog the engine's human-readable log line for the match
 * @param ruleId   the matched rule id
 */
public record MatchedRuleEvent(RuleSeverity severity, String errorLog, int ruleId) {}
