package com.hybridrouter.infrastructure.bandit;

public record ProviderStatistics(
        String provider,
        String tier,
        long samples,
        double meanReward,
        int buckets
) {}
