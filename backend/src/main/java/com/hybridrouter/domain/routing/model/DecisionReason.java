package com.hybridrouter.domain.routing.model;

public enum DecisionReason {
    HARD_RULE,          // forced by the rule table
    EMERGENCY,          // budget emergency, cheapest provider
    HARD_THROTTLE,      // hard throttle, context not allowlisted
    COLD_START,         // bucket below minimum sample count, safe provider
    THOMPSON,           // sampled from the posteriors
    EXPLOIT,            // exploration frozen, best posterior mean
    BUDGET_EXHAUSTED,   // reservation refused, downgraded to cheapest
    FAIL_OPEN           // timeout or internal failure, cheapest provider
}
