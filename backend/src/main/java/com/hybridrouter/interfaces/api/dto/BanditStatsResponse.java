package com.hybridrouter.interfaces.api.dto;

import com.hybridrouter.domain.policy.model.ExplorationMode;
import com.hybridrouter.domain.routing.model.DecisionReason;
import com.hybridrouter.infrastructure.bandit.ProviderStatistics;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record BanditStatsResponse(
        long snapshotVersion,
        List<ProviderStatistics> providers,
        ExplorationMode explorationMode,
        String explorationReason,
        Instant explorationSince,
        Map<DecisionReason, Long> decisions
) {}
