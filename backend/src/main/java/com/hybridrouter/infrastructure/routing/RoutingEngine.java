package com.hybridrouter.infrastructure.routing;

import com.hybridrouter.domain.budget.model.BudgetDirective;
import com.hybridrouter.domain.policy.model.ExplorationPolicy;
import com.hybridrouter.domain.routing.model.ContextBucket;
import com.hybridrouter.domain.routing.model.DecisionReason;
import com.hybridrouter.domain.routing.model.Provider;
import com.hybridrouter.domain.routing.model.RequestContext;
import com.hybridrouter.domain.routing.model.RoutingDecision;
import com.hybridrouter.domain.routing.model.RoutingRule;
import com.hybridrouter.domain.routing.model.ThrottleState;
import com.hybridrouter.infrastructure.bandit.ThompsonBandit;
import com.hybridrouter.infrastructure.budget.BudgetCalibrator;
import com.hybridrouter.infrastructure.config.RouterProperties;
import com.hybridrouter.infrastructure.policy.ExplorationPolicyHolder;
import com.hybridrouter.infrastructure.prompt.PromptVariantRegistry;
import com.hybridrouter.infrastructure.prompt.PromptVariantSelector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Decides which provider serves a request.
 * <ol>
 *   <li>EMERGENCY: cheapest provider.</li>
 *   <li>HARD: cheapest provider unless the context is allowlisted.</li>
 *   <li>Forced rule: the rule's provider.</li>
 *   <li>Bandit: Thompson draw (premium scaled down under SOFT), or best mean while exploration is frozen.</li>
 * </ol>
 * The estimated cost is then reserved with the calibrator; a refused reservation downgrades to the
 * cheapest provider, whose cost is recorded even past the reservation ceiling so tracked spend always
 * matches the decision log. The decision runs under a strict timeout and fails open to the cheapest
 * provider; a timed-out decision task is interrupted.
 */
@Slf4j
@Component
public class RoutingEngine {

    private final ProviderCatalog catalog;
    private final BucketResolver bucketResolver;
    private final RuleTableLoader ruleTableLoader;
    private final ThompsonBandit bandit;
    private final PromptVariantSelector promptSelector;
    private final PromptVariantRegistry promptRegistry;
    private final BudgetCalibrator calibrator;
    private final ExplorationPolicyHolder policyHolder;
    private final DecisionLogWriter decisionLogWriter;
    private final RoutingMetricsTracker metricsTracker;
    private final Executor routingExecutor;
    private final Clock clock;
    private final Duration timeout;
    private final double softPremiumMultiplier;
    private final Set<String> hardThrottleAllowlist;

    public RoutingEngine(ProviderCatalog catalog,
                         BucketResolver bucketResolver,
                         RuleTableLoader ruleTableLoader,
                         ThompsonBandit bandit,
                         PromptVariantSelector promptSelector,
                         PromptVariantRegistry promptRegistry,
                         BudgetCalibrator calibrator,
                         ExplorationPolicyHolder policyHolder,
                         DecisionLogWriter decisionLogWriter,
                         RoutingMetricsTracker metricsTracker,
                         @Qualifier("routingExecutor") Executor routingExecutor,
                         RouterProperties properties,
                         Clock clock) {
        this.catalog = catalog;
        this.bucketResolver = bucketResolver;
        this.ruleTableLoader = ruleTableLoader;
        this.bandit = bandit;
        this.promptSelector = promptSelector;
        this.promptRegistry = promptRegistry;
        this.calibrator = calibrator;
        this.policyHolder = policyHolder;
        this.decisionLogWriter = decisionLogWriter;
        this.metricsTracker = metricsTracker;
        this.routingExecutor = routingExecutor;
        this.clock = clock;
        this.timeout = properties.getDecisionTimeout();
        this.softPremiumMultiplier = properties.getBandit().getSoftPremiumMultiplier();
        this.hardThrottleAllowlist = properties.getHardThrottleAllowlist().stream()
                .map(c -> c.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Never throws; any failure or timeout yields a {@link DecisionReason#FAIL_OPEN} decision.
     */
    public RoutingDecision route(RequestContext context) {
        RoutingDecision decision;
        FutureTask<RoutingDecision> task = new FutureTask<>(() -> decide(context));
        try {
            routingExecutor.execute(task);
            decision = task.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            log.warn("[Router] Decision for {} exceeded {} ms, failing open", context.contentId(), timeout.toMillis());
            decision = failOpen(context);
        } catch (ExecutionException e) {
            log.warn("[Router] Decision for {} failed, failing open", context.contentId(), e.getCause());
            decision = failOpen(context);
        } catch (RejectedExecutionException e) {
            log.warn("[Router] Routing executor saturated, failing open for {}", context.contentId());
            decision = failOpen(context);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            task.cancel(true);
            decision = failOpen(context);
        }

        decision = reserveOrRecord(decision);
        try {
            decisionLogWriter.append(decision);
        } catch (RuntimeException e) {
            log.error("[Router] Decision log append failed for {}, decision {} not persisted",
                    context.contentId(), decision.decisionId(), e);
        }
        try {
            metricsTracker.record(decision);
        } catch (RuntimeException e) {
            log.warn("[Router] Metrics update failed for {}", context.contentId(), e);
        }
        log.debug("[Router] content={} bucket={} provider={} variant={} reason={} throttle={}",
                context.contentId(), decision.bucket(), decision.provider().id(), decision.promptVariant(),
                decision.reason(), decision.throttleState());
        return decision;
    }

    RoutingDecision decide(RequestContext context) {
        BudgetDirective directive = calibrator.directive();
        ExplorationPolicy policy = policyHolder.current();
        ThrottleState throttle = directive.state();
        ContextBucket bucket = bucketResolver.resolve(context);
        Optional<RoutingRule> rule = ruleTableLoader.current().match(context);
        boolean explore = directive.allowsExploration() && !policy.frozen();

        Provider provider;
        DecisionReason reason;
        if (throttle == ThrottleState.EMERGENCY) {
            provider = catalog.cheapest();
            reason = DecisionReason.EMERGENCY;
        } else if (throttle == ThrottleState.HARD && !allowlisted(context, rule)) {
            provider = catalog.cheapest();
            reason = DecisionReason.HARD_THROTTLE;
        } else if (rule.isPresent()) {
            provider = catalog.require(rule.get().provider());
            reason = DecisionReason.HARD_RULE;
        } else if (bandit.isColdStart(bucket)) {
            provider = catalog.safe();
            reason = DecisionReason.COLD_START;
        } else if (!explore) {
            provider = bandit.exploit(bucket);
            reason = DecisionReason.EXPLOIT;
        } else {
            double premiumScale = throttle == ThrottleState.SOFT ? softPremiumMultiplier : 1.0;
            provider = bandit.recommend(bucket, premiumScale);
            reason = DecisionReason.THOMPSON;
        }

        String variant = promptSelector.selectVariant(context.category(), explore);
        return RoutingDecision.of(context, provider, variant, bucket, throttle, reason, clock.instant());
    }

    private boolean allowlisted(RequestContext context, Optional<RoutingRule> rule) {
        return rule.map(RoutingRule::allowlisted).orElse(false)
                || hardThrottleAllowlist.contains(context.category());
    }

    private RoutingDecision failOpen(RequestContext context) {
        Provider cheapest = catalog.cheapest();
        ThrottleState throttle;
        try {
            throttle = calibrator.directive().state();
        } catch (RuntimeException e) {
            throttle = ThrottleState.EMERGENCY;
        }
        return RoutingDecision.of(context, cheapest, promptRegistry.fallback(context.category()),
                bucketResolver.resolve(context), throttle, DecisionReason.FAIL_OPEN, clock.instant());
    }

    private RoutingDecision reserveOrRecord(RoutingDecision decision) {
        try {
            return reserve(decision);
        } catch (RuntimeException e) {
            log.error("[Router] Budget accounting failed for {}, returning unaccounted decision",
                    decision.context().contentId(), e);
            return decision;
        }
    }

    private RoutingDecision reserve(RoutingDecision decision) {
        if (calibrator.tryReserve(decision.estimatedCost())) {
            return decision;
        }
        Provider cheapest = catalog.cheapest();
        RoutingDecision admitted = decision.provider().equals(cheapest)
                ? decision
                : decision.downgradeTo(cheapest, DecisionReason.BUDGET_EXHAUSTED);
        if (admitted != decision && calibrator.tryReserve(admitted.estimatedCost())) {
            return admitted;
        }
        // Past the ceiling the cheapest provider still serves; its spend is recorded, not reserved
        log.warn("[Router] Budget ceiling reached, {} routed to {} past the ceiling",
                decision.context().contentId(), cheapest.id());
        calibrator.recordCost(admitted.estimatedCost());
        return admitted;
    }
}
