package com.hybridrouter.domain.routing.model;

/**
 * Budget directive in effect for a routing decision. Declaration order is severity order.
 */
public enum ThrottleState {
    NORMAL,     // daily spend within pacing target
    SOFT,       // bias away from premium, do not forbid it
    HARD,       // premium only for allowlisted traffic
    EMERGENCY;  // cheapest provider only, exploration frozen

    public boolean isAtLeast(ThrottleState other) {
        return compareTo(other) >= 0;
    }
}
