package com.hybridrouter.domain.routing.model;

public enum ComplexityTier {
    LOW,
    MEDIUM,
    HIGH
}
