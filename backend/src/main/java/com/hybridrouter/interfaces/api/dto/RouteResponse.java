package com.hybridrouter.interfaces.api.dto;

import com.hybridrouter.domain.routing.model.DecisionReason;
import com.hybridrouter.domain.routing.model.RoutingDecision;
import com.hybridrouter.domain.routing.model.ThrottleState;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record RouteResponse(
        UUID decisionId,
        String provider,
        String promptVariant,
        Instant decidedAt,
        ThrottleState throttleState,
        DecisionReason reason,
        BigDecimal estimatedCost
) {
    public static RouteResponse from(RoutingDecision decision) {
        return new RouteResponse(decision.decisionId(), decision.provider().id(), decision.promptVariant(),
                decision.decidedAt(), decision.throttleState(), decision.reason(), decision.estimatedCost());
    }
}
