package com.hybridrouter.infrastructure.policy;

import com.hybridrouter.domain.policy.model.ExplorationMode;
import com.hybridrouter.domain.policy.model.ExplorationPolicy;
import com.hybridrouter.domain.policy.model.PolicyTransition;
import com.hybridrouter.domain.policy.repository.PolicyTransitionRepository;
import com.hybridrouter.domain.quality.model.RegressionReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Current exploration policy. Freezes exploration on a detected regression and lifts the freeze
 * on the next clean report; every change is persisted for operator review.
 */
@Slf4j
@Component
public class ExplorationPolicyHolder {

    private final PolicyTransitionRepository transitionRepository;
    private final Clock clock;
    private final AtomicReference<ExplorationPolicy> current;

    public ExplorationPolicyHolder(PolicyTransitionRepository transitionRepository, Clock clock) {
        this.transitionRepository = transitionRepository;
        this.clock = clock;
        this.current = new AtomicReference<>(ExplorationPolicy.active(clock.instant()));
    }

    public ExplorationPolicy current() {
        return current.get();
    }

    /**
     * Reinstates the mode of the latest persisted transition.
     */
    public ExplorationPolicy restore() {
        transitionRepository.findTopByOrderByCreatedAtDescIdDesc().ifPresent(t ->
                current.set(new ExplorationPolicy(t.getToMode(), t.getCause(), t.getCreatedAt())));
        log.info("[Policy] Exploration {} since {}", current.get().mode(), current.get().since());
        return current.get();
    }

    public Optional<PolicyTransition> apply(RegressionReport report) {
        ExplorationPolicy before = current.get();
        if (report.regressionDetected() && !before.frozen()) {
            return Optional.of(transition(before, ExplorationMode.FROZEN, report.summary()));
        }
        if (!report.regressionDetected() && before.frozen()) {
            return Optional.of(transition(before, ExplorationMode.ACTIVE, "clean report: " + report.summary()));
        }
        return Optional.empty();
    }

    private PolicyTransition transition(ExplorationPolicy before, ExplorationMode to, String cause) {
        PolicyTransition saved = transitionRepository.save(
                new PolicyTransition(before.mode(), to, cause, clock.instant()));
        current.set(new ExplorationPolicy(to, saved.getCause(), saved.getCreatedAt()));
        log.info("[Policy] Exploration {} -> {}: {}", before.mode(), to, saved.getCause());
        return saved;
    }
}
