package com.hybridrouter.infrastructure.routing;

import com.hybridrouter.domain.routing.model.DecisionReason;
import com.hybridrouter.domain.routing.model.RoutingDecision;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

@Slf4j
@Component
public class RoutingMetricsTracker {

    private final AtomicLong totalDecisions = new AtomicLong();
    private final AtomicLong premiumDecisions = new AtomicLong();
    private final Map<DecisionReason, AtomicLong> byReason = new EnumMap<>(DecisionReason.class);

    public RoutingMetricsTracker() {
        for (DecisionReason reason : DecisionReason.values()) {
            byReason.put(reason, new AtomicLong());
        }
    }

    public void record(RoutingDecision decision) {
        long total = totalDecisions.incrementAndGet();
        if (decision.provider().isPremium()) {
            premiumDecisions.incrementAndGet();
        }
        byReason.get(decision.reason()).incrementAndGet();

        log.debug("Routing metrics - decision #{}: provider={}, reason={}, throttle={}, " +
                        "cumulative: premiumShare={}%, failOpen={}",
                total, decision.provider().id(), decision.reason(), decision.throttleState(),
                String.format("%.1f", getPremiumShare()), byReason.get(DecisionReason.FAIL_OPEN).get());
    }

    public double getPremiumShare() {
        long total = totalDecisions.get();
        return total > 0 ? (double) premiumDecisions.get() / total * 100 : 0;
    }

    public long getTotalDecisions() {
        return totalDecisions.get();
    }

    public Map<DecisionReason, Long> getCountsByReason() {
        Map<DecisionReason, Long> counts = new EnumMap<>(DecisionReason.class);
        byReason.forEach((reason, count) -> counts.put(reason, count.get()));
        return counts;
    }
}
