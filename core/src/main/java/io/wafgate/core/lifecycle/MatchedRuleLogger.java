package io.wafgate.core.lifecycle;

import io.wafgate.core.model.MatchedRuleEvent;
import io.wafgate.core.spi.MatchedRuleListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes every matched rule to the log at WARN. */
public final class MatchedRuleLogger implements MatchedRuleListener {

    private static final Logger LOG = LoggerFactory.getLogger(MatchedRuleLogger.class);

    @Override
    public void onMatchedRule(MatchedRuleEvent event) {
        LOG.warn(
                "WAF rule matched: severity={}, error_log={}, rule_id={}",
                event.severity() != null ? event.severity().label() : "unknown",
                event.errorLog(),
                event.ruleId());
    }
}
