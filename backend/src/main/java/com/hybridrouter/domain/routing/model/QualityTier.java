package com.hybridrouter.domain.routing.model;

public enum QualityTier {
    PREMIUM,    // highest quality, highest cost
    STANDARD,
    ECONOMY     // volume work
}
