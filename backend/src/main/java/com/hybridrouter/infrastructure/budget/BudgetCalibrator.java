package com.hybridrouter.infrastructure.budget;

import com.hybridrouter.domain.budget.model.BudgetDirective;
import com.hybridrouter.domain.budget.model.BudgetPolicy;
import com.hybridrouter.domain.budget.model.BudgetState;
import com.hybridrouter.domain.routing.model.ThrottleState;
import com.hybridrouter.infrastructure.config.RouterProperties;
import com.hybridrouter.infrastructure.routing.ProviderCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tracks spend against the monthly cap and derives the throttle directive from daily pacing.
 * <p>
 * Every state change is one compare-and-set of an immutable {@link BudgetState}; day and month
 * rollover are applied inside the same swap, so no increment is lost across a rollover.
 */
@Slf4j
@Component
public class BudgetCalibrator {

    private static final int SCALE = 6;

    private final Clock clock;
    private final int absurdFactor;
    private final AtomicReference<BudgetState> state;
    private final AtomicReference<BudgetPolicy> policy;

    public BudgetCalibrator(RouterProperties properties, ProviderCatalog catalog, Clock clock) {
        this.clock = clock;
        RouterProperties.Budget config = properties.getBudget();
        BigDecimal maxSingleCost = config.getMaxSingleCost() != null
                ? config.getMaxSingleCost()
                : catalog.maxWorstCaseCost();
        this.absurdFactor = config.getAbsurdFactor();
        this.policy = new AtomicReference<>(new BudgetPolicy(
                config.getMonthlyCap(), config.getSoftRatio(), config.getHardRatio(), maxSingleCost, 1));
        this.state = new AtomicReference<>(BudgetState.start(today()));
    }

    /**
     * Adds an incurred cost unconditionally. Invalid amounts are logged and dropped.
     */
    public void recordCost(BigDecimal amount) {
        if (!acceptable(amount)) {
            return;
        }
        LocalDate today = today();
        state.updateAndGet(s -> s.rollTo(today).plus(amount));
    }

    /**
     * Routing gate: admits {@code amount} only if month spend stays within cap + one worst-case
     * request, so concurrent admissions cannot overshoot further than that.
     *
     * @return true if the amount was added
     */
    public boolean tryReserve(BigDecimal amount) {
        if (!acceptable(amount)) {
            return false;
        }
        LocalDate today = today();
        BigDecimal ceiling = policy.get().reservationCeiling();
        while (true) {
            BudgetState current = state.get();
            BudgetState rolled = current.rollTo(today);
            if (rolled.monthSpend().add(amount).compareTo(ceiling) > 0) {
                log.debug("[Calibrator] Reservation of {} refused, month spend {} ceiling {}",
                        amount, rolled.monthSpend(), ceiling);
                return false;
            }
            if (state.compareAndSet(current, rolled.plus(amount))) {
                return true;
            }
        }
    }

    private boolean acceptable(BigDecimal amount) {
        if (amount == null) {
            log.warn("[Calibrator] Dropping null cost");
            return false;
        }
        if (amount.signum() < 0) {
            log.warn("[Calibrator] Dropping negative cost {}", amount);
            return false;
        }
        BigDecimal absurd = policy.get().maxSingleCost().multiply(BigDecimal.valueOf(absurdFactor));
        if (amount.compareTo(absurd) > 0) {
            log.warn("[Calibrator] Dropping absurd cost {} (limit {})", amount, absurd);
            return false;
        }
        return true;
    }

    /**
     * Overload for costs reported as floating point by callers; non-finite values are dropped.
     */
    public void recordCost(double amount) {
        if (Double.isNaN(amount) || Double.isInfinite(amount)) {
            log.warn("[Calibrator] Dropping non-finite cost {}", amount);
            return;
        }
        recordCost(BigDecimal.valueOf(amount));
    }

    public BudgetDirective directive() {
        LocalDate today = today();
        BudgetState s = state.get().rollTo(today);
        BudgetPolicy p = policy.get();

        int dayOfMonth = today.getDayOfMonth();
        int daysInMonth = today.lengthOfMonth();
        BigDecimal remaining = p.monthlyCap().subtract(s.spendBeforeToday());
        BigDecimal pacing = remaining.signum() <= 0
                ? BigDecimal.ZERO
                : remaining.divide(BigDecimal.valueOf(daysInMonth - dayOfMonth + 1L), SCALE, RoundingMode.HALF_UP);
        BigDecimal projected = project(s, dayOfMonth, daysInMonth);

        ThrottleState throttle = classify(s.daySpend(), pacing, projected, remaining, p);
        return new BudgetDirective(throttle, today, p.monthlyCap(), s.monthSpend(), s.daySpend(), pacing, projected);
    }

    private static ThrottleState classify(BigDecimal daySpend, BigDecimal pacing, BigDecimal projected,
                                          BigDecimal remaining, BudgetPolicy p) {
        if (projected.compareTo(p.monthlyCap()) > 0 || remaining.signum() <= 0) {
            return ThrottleState.EMERGENCY;
        }
        if (daySpend.compareTo(pacing) <= 0) {
            return ThrottleState.NORMAL;
        }
        if (daySpend.compareTo(pacing.multiply(BigDecimal.valueOf(p.softRatio()))) <= 0) {
            return ThrottleState.SOFT;
        }
        if (daySpend.compareTo(pacing.multiply(BigDecimal.valueOf(p.hardRatio()))) <= 0) {
            return ThrottleState.HARD;
        }
        return ThrottleState.EMERGENCY;
    }

    public BigDecimal projectMonthEnd() {
        LocalDate today = today();
        return project(state.get().rollTo(today), today.getDayOfMonth(), today.lengthOfMonth());
    }

    // Month-to-date daily run-rate extrapolated over the days after today
    private static BigDecimal project(BudgetState s, int dayOfMonth, int daysInMonth) {
        BigDecimal rate = s.monthSpend().divide(BigDecimal.valueOf(dayOfMonth), SCALE, RoundingMode.HALF_UP);
        return s.monthSpend().add(rate.multiply(BigDecimal.valueOf(daysInMonth - dayOfMonth)))
                .setScale(SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Replaces the spend totals of the current period, e.g. from the decision log at startup.
     */
    public void restore(BigDecimal monthSpend, BigDecimal daySpend) {
        if (monthSpend == null || daySpend == null || monthSpend.signum() < 0 || daySpend.signum() < 0
                || daySpend.compareTo(monthSpend) > 0) {
            throw new IllegalArgumentException("Restored spend must satisfy 0 <= day <= month, got month="
                    + monthSpend + " day=" + daySpend);
        }
        LocalDate today = today();
        BudgetState restored = new BudgetState(YearMonth.from(today), today, monthSpend, daySpend);
        state.set(restored);
        log.info("[Calibrator] Restored spend month={} day={}", monthSpend, daySpend);
    }

    public BudgetPolicy updatePolicy(BigDecimal monthlyCap, double softRatio, double hardRatio) {
        BudgetPolicy updated = policy.updateAndGet(p -> p.nextVersion(monthlyCap, softRatio, hardRatio));
        log.info("[Calibrator] Budget policy v{}: cap={} soft={} hard={}",
                updated.version(), updated.monthlyCap(), updated.softRatio(), updated.hardRatio());
        return updated;
    }

    public BudgetPolicy policy() {
        return policy.get();
    }

    public BudgetState state() {
        return state.get().rollTo(today());
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }
}
