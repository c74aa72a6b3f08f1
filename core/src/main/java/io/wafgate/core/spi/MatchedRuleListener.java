package io.wafgate.core.spi;

import io.wafgate.core.model.MatchedRuleEvent;

/** Receives one callback per matched rule from the engine's error log. */
@FunctionalInterface
public interface MatchedRuleListener {

    void onMatchedRule(MatchedRuleEvent event);
}
