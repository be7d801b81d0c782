package com.hybridrouter.application.learning;

import com.hybridrouter.application.learning.exception.LearningCycleInProgressException;
import com.hybridrouter.domain.budget.model.BudgetDirective;
import com.hybridrouter.domain.feedback.model.FeedbackEvent;
import com.hybridrouter.domain.feedback.model.FeedbackSource;
import com.hybridrouter.domain.policy.model.PolicyTransition;
import com.hybridrouter.domain.quality.model.RegressionReport;
import com.hybridrouter.domain.quality.model.RewardRecord;
import com.hybridrouter.domain.quality.model.RewardSample;
import com.hybridrouter.domain.quality.repository.RewardRecordRepository;
import com.hybridrouter.domain.routing.model.DecisionRecord;
import com.hybridrouter.domain.routing.repository.DecisionRecordRepository;
import com.hybridrouter.infrastructure.bandit.ThompsonBandit;
import com.hybridrouter.infrastructure.budget.BudgetCalibrator;
import com.hybridrouter.infrastructure.collector.FeedbackCollector;
import com.hybridrouter.infrastructure.config.RouterProperties;
import com.hybridrouter.infrastructure.evaluation.FeedbackPayloadException;
import com.hybridrouter.infrastructure.evaluation.RegressionDetector;
import com.hybridrouter.infrastructure.evaluation.RewardScorer;
import com.hybridrouter.infrastructure.evaluation.ScoredReward;
import com.hybridrouter.infrastructure.policy.ExplorationPolicyHolder;
import com.hybridrouter.infrastructure.prompt.PromptVariantSelector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Daily learning path: feedback -> rewards -> bandit/prompter snapshots -> regression check -> policy.
 * Runs one at a time; re-running over the same feedback writes no new rewards.
 */
@Slf4j
@Service
public class LearningCycleService {

    private final FeedbackCollector collector;
    private final DecisionRecordRepository decisionRecordRepository;
    private final RewardRecordRepository rewardRecordRepository;
    private final RewardScorer rewardScorer;
    private final ThompsonBandit bandit;
    private final PromptVariantSelector promptSelector;
    private final RegressionDetector regressionDetector;
    private final ExplorationPolicyHolder policyHolder;
    private final BudgetCalibrator calibrator;
    private final Clock clock;
    private final Duration horizon;
    private final Duration settleAfter;
    private final AtomicBoolean running = new AtomicBoolean();

    public LearningCycleService(FeedbackCollector collector,
                                DecisionRecordRepository decisionRecordRepository,
                                RewardRecordRepository rewardRecordRepository,
                                RewardScorer rewardScorer,
                                ThompsonBandit bandit,
                                PromptVariantSelector promptSelector,
                                RegressionDetector regressionDetector,
                                ExplorationPolicyHolder policyHolder,
                                BudgetCalibrator calibrator,
                                RouterProperties properties,
                                Clock clock) {
        this.collector = collector;
        this.decisionRecordRepository = decisionRecordRepository;
        this.rewardRecordRepository = rewardRecordRepository;
        this.rewardScorer = rewardScorer;
        this.bandit = bandit;
        this.promptSelector = promptSelector;
        this.regressionDetector = regressionDetector;
        this.policyHolder = policyHolder;
        this.calibrator = calibrator;
        this.clock = clock;
        this.horizon = Duration.ofDays(properties.getLearning().getHorizonDays());
        this.settleAfter = properties.getLearning().getSettleAfter();
    }

    /**
     * @throws LearningCycleInProgressException if another run has not finished
     */
    public LearningCycleReport runCycle() {
        if (!running.compareAndSet(false, true)) {
            throw new LearningCycleInProgressException();
        }
        try {
            return doRun();
        } finally {
            running.set(false);
        }
    }

    private LearningCycleReport doRun() {
        Instant startedAt = clock.instant();
        Instant horizonStart = startedAt.minus(horizon);

        // 1. Drain and group by content
        List<FeedbackEvent> events = collector.drainSince(horizonStart);
        Map<String, List<FeedbackEvent>> byContent = events.stream()
                .collect(Collectors.groupingBy(FeedbackEvent::getContentId, LinkedHashMap::new, Collectors.toList()));
        Set<String> rewarded = byContent.isEmpty()
                ? Set.of()
                : rewardRecordRepository.findRewardedContentIds(byContent.keySet());

        // 2-3. Score settled, unrewarded contents
        List<RewardRecord> fresh = new ArrayList<>();
        int pending = 0;
        int skipped = 0;
        for (Map.Entry<String, List<FeedbackEvent>> entry : byContent.entrySet()) {
            String contentId = entry.getKey();
            if (rewarded.contains(contentId)) continue;
            if (!isSettled(entry.getValue(), startedAt)) {
                pending++;
                continue;
            }
            Optional<DecisionRecord> decision = decisionRecordRepository.findTopByContentIdOrderByDecidedAtDesc(contentId);
            if (decision.isEmpty()) {
                log.warn("[LearningCycle] No decision recorded for content {}, skipping", contentId);
                skipped++;
                continue;
            }
            try {
                ScoredReward scored = rewardScorer.score(decision.get(), entry.getValue(), startedAt);
                fresh.add(RewardRecord.from(scored.sample(), scored.actualCost()));
            } catch (FeedbackPayloadException | IllegalArgumentException e) {
                log.warn("[LearningCycle] Skipping content {}: {}", contentId, e.getMessage());
                skipped++;
            }
        }

        // 4. Append rewards
        rewardRecordRepository.saveAll(fresh);

        // 5. Rebuild and swap snapshots
        List<RewardSample> samples = rebuildSnapshots(horizonStart);

        // 6-7. Regression check and exploration policy
        RegressionReport regression = regressionDetector.checkRegression(samples, startedAt);
        Optional<PolicyTransition> transition = policyHolder.apply(regression);

        // 8. Budget directive
        BudgetDirective directive = calibrator.directive();

        LearningCycleReport report = new LearningCycleReport(startedAt, clock.instant(), events.size(), pending,
                fresh.size(), skipped, samples.size(), regression, policyHolder.current().mode(),
                transition.isPresent(), directive.state());
        log.info("[LearningCycle] events={} rewards+={} pending={} skipped={} samples={} exploration={} directive={} "
                        + "(month spend {} / cap {}, projected {})",
                report.eventsDrained(), report.rewardsWritten(), report.contentsPending(), report.contentsSkipped(),
                report.samplesInHorizon(), report.explorationMode(), directive.state(),
                directive.monthSpend(), directive.monthlyCap(), directive.projectedMonthEnd());
        return report;
    }

    /**
     * Rebuilds the bandit and prompter from every reward decided within the learning horizon.
     */
    public List<RewardSample> rebuildSnapshots() {
        return rebuildSnapshots(clock.instant().minus(horizon));
    }

    private List<RewardSample> rebuildSnapshots(Instant since) {
        List<RewardSample> samples = rewardRecordRepository.findByDecidedAtAfterOrderByDecidedAtAsc(since).stream()
                .map(RewardRecord::toSample)
                .toList();
        bandit.rebuild(samples);
        promptSelector.rebuild(samples);
        return samples;
    }

    /**
     * Settled once the generation outcome is in and either an editor has decided or the outcome is
     * older than the settle period.
     */
    boolean isSettled(List<FeedbackEvent> events, Instant now) {
        Optional<FeedbackEvent> outcome = events.stream()
                .filter(e -> e.getSource() == FeedbackSource.GENERATION_OUTCOME)
                .findFirst();
        if (outcome.isEmpty()) {
            return false;
        }
        boolean edited = events.stream().anyMatch(e -> e.getSource() == FeedbackSource.EDITORIAL);
        return edited || !outcome.get().getOccurredAt().plus(settleAfter).isAfter(now);
    }

    public boolean isRunning() {
        return running.get();
    }
}
