package com.hybridrouter.application.learning;

import com.hybridrouter.domain.routing.repository.DecisionRecordRepository;
import com.hybridrouter.infrastructure.budget.BudgetCalibrator;
import com.hybridrouter.infrastructure.policy.ExplorationPolicyHolder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Rebuilds in-memory routing state from the persisted logs at startup: spend from the decision log,
 * the exploration policy from its latest transition, posteriors from the reward log.
 * <p>
 * Runs once all singletons exist and before lifecycle start, so the web server only accepts
 * routing requests after spend has been restored.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RouterStateInitializer implements SmartInitializingSingleton {

    private final DecisionRecordRepository decisionRecordRepository;
    private final BudgetCalibrator calibrator;
    private final ExplorationPolicyHolder policyHolder;
    private final LearningCycleService learningCycleService;
    private final Clock clock;

    @Override
    public void afterSingletonsInstantiated() {
        ZoneId zone = clock.getZone();
        LocalDate today = LocalDate.now(clock);
        BigDecimal monthSpend = decisionRecordRepository.sumEstimatedCostSince(
                today.withDayOfMonth(1).atStartOfDay(zone).toInstant());
        BigDecimal daySpend = decisionRecordRepository.sumEstimatedCostSince(today.atStartOfDay(zone).toInstant());
        calibrator.restore(monthSpend, daySpend);

        policyHolder.restore();
        int samples = learningCycleService.rebuildSnapshots().size();
        log.info("[Startup] Router state restored: month spend {}, {} reward samples", monthSpend, samples);
    }
}
