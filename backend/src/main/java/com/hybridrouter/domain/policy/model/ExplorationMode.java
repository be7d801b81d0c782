package com.hybridrouter.domain.policy.model;

public enum ExplorationMode {
    ACTIVE,
    FROZEN
}
