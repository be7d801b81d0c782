package com.hybridrouter.application.learning;

import com.hybridrouter.domain.policy.model.ExplorationMode;
import com.hybridrouter.domain.quality.model.RegressionReport;
import com.hybridrouter.domain.routing.model.ThrottleState;

import java.time.Instant;

/**
 * @param eventsDrained    feedback events read from the learning horizon
 * @param contentsPending  contents whose feedback has not settled yet
 * @param rewardsWritten   new reward records appended
 * @param contentsSkipped  contents skipped for a malformed payload or a missing decision
 * @param samplesInHorizon reward samples the snapshots were rebuilt from
 */
public record LearningCycleReport(
        Instant startedAt,
        Instant finishedAt,
        int eventsDrained,
        int contentsPending,
        int rewardsWritten,
        int contentsSkipped,
        int samplesInHorizon,
        RegressionReport regression,
        ExplorationMode explorationMode,
        boolean policyChanged,
        ThrottleState throttleState
) {}
