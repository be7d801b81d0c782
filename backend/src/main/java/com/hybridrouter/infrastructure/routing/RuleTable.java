package com.hybridrouter.infrastructure.routing;

import com.hybridrouter.domain.routing.model.RequestContext;
import com.hybridrouter.domain.routing.model.RoutingRule;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * One loaded version of the ordered forced-provider rules. First match wins.
 */
public record RuleTable(
        long version,
        List<RoutingRule> rules,
        String location,
        Instant loadedAt
) {
    public RuleTable {
        rules = List.copyOf(rules);
    }

    public Optional<RoutingRule> match(RequestContext context) {
        for (RoutingRule rule : rules) {
            if (rule.matches(context)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }
}
