package com.hybridrouter.infrastructure.evaluation;

import com.hybridrouter.domain.quality.model.RewardSample;
import com.hybridrouter.domain.quality.model.ValidationResult;

import java.math.BigDecimal;

/**
 * @param sample     the reward attributed to the decision
 * @param validation validator output the reward was derived from
 * @param actualCost cost reported with the generation outcome (nullable)
 */
public record ScoredReward(
        RewardSample sample,
        ValidationResult validation,
        BigDecimal actualCost
) {}
