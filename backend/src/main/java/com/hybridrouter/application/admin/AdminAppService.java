package com.hybridrouter.application.admin;

import com.hybridrouter.domain.budget.model.BudgetPolicy;
import com.hybridrouter.domain.policy.model.ExplorationPolicy;
import com.hybridrouter.domain.routing.model.DecisionReason;
import com.hybridrouter.infrastructure.bandit.ProviderStatistics;
import com.hybridrouter.infrastructure.bandit.ThompsonBandit;
import com.hybridrouter.infrastructure.budget.BudgetCalibrator;
import com.hybridrouter.infrastructure.policy.ExplorationPolicyHolder;
import com.hybridrouter.infrastructure.routing.RoutingMetricsTracker;
import com.hybridrouter.infrastructure.routing.RuleTable;
import com.hybridrouter.infrastructure.routing.RuleTableLoader;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class AdminAppService {

    private final ThompsonBandit bandit;
    private final ExplorationPolicyHolder policyHolder;
    private final RoutingMetricsTracker metricsTracker;
    private final RuleTableLoader ruleTableLoader;
    private final BudgetCalibrator calibrator;

    public List<ProviderStatistics> providerStatistics() {
        return bandit.statistics();
    }

    public long banditVersion() {
        return bandit.snapshot().version();
    }

    public ExplorationPolicy explorationPolicy() {
        return policyHolder.current();
    }

    public Map<DecisionReason, Long> decisionCounts() {
        return metricsTracker.getCountsByReason();
    }

    /**
     * @throws com.hybridrouter.infrastructure.config.RoutingConfigurationException if the new table is invalid
     */
    public RuleTable reloadRules() {
        return ruleTableLoader.reload();
    }

    public BudgetPolicy updateBudget(BigDecimal monthlyCap, double softRatio, double hardRatio) {
        return calibrator.updatePolicy(monthlyCap, softRatio, hardRatio);
    }
}
