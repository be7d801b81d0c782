package com.hybridrouter.domain.routing.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable outcome of one {@code route()} call, persisted to the decision log for audit and
 * later reward attribution.
 */
public record RoutingDecision(
        UUID decisionId,
        RequestContext context,
        Provider provider,
        String promptVariant,
        ContextBucket bucket,
        ThrottleState throttleState,
        DecisionReason reason,
        BigDecimal estimatedCost,
        Instant decidedAt
) {
    public static RoutingDecision of(RequestContext context, Provider provider, String promptVariant,
                                     ContextBucket bucket, ThrottleState throttleState,
                                     DecisionReason reason, Instant decidedAt) {
        return new RoutingDecision(UUID.randomUUID(), context, provider, promptVariant, bucket,
                throttleState, reason, provider.estimatedCost(), decidedAt);
    }

    public RoutingDecision downgradeTo(Provider cheaper, DecisionReason newReason) {
        return new RoutingDecision(decisionId, context, cheaper, promptVariant, bucket,
                throttleState, newReason, cheaper.estimatedCost(), decidedAt);
    }
}
