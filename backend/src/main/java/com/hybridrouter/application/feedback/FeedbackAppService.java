package com.hybridrouter.application.feedback;

import com.hybridrouter.domain.feedback.model.FeedbackEvent;
import com.hybridrouter.domain.feedback.model.FeedbackSource;
import com.hybridrouter.domain.routing.model.DecisionRecord;
import com.hybridrouter.domain.routing.repository.DecisionRecordRepository;
import com.hybridrouter.infrastructure.budget.BudgetCalibrator;
import com.hybridrouter.infrastructure.collector.FeedbackCollector;
import com.hybridrouter.infrastructure.evaluation.FeedbackPayloadParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class FeedbackAppService {

    private final FeedbackCollector collector;
    private final FeedbackPayloadParser payloadParser;
    private final DecisionRecordRepository decisionRecordRepository;
    private final BudgetCalibrator calibrator;
    private final Clock clock;

    /**
     * Validates the payload shape and stores the event once per (contentId, source).
     *
     * @throws com.hybridrouter.infrastructure.evaluation.FeedbackPayloadException if the payload is malformed
     */
    public IngestResult ingest(String contentId, FeedbackSource source, String payload, Instant occurredAt) {
        payloadParser.check(source, payload);

        FeedbackEvent event = FeedbackEvent.builder()
                .contentId(contentId)
                .source(source)
                .payload(payload)
                .occurredAt(occurredAt)
                .receivedAt(clock.instant())
                .build();

        boolean stored = collector.ingest(event);
        return new IngestResult(true, !stored);
    }

    /**
     * Records the part of an actual cost that exceeds the estimate reserved at decision time.
     * The decision log is append-only and is not rewritten.
     */
    public CostReconciliation reportCost(String contentId, BigDecimal actualCost) {
        Optional<DecisionRecord> decision = decisionRecordRepository.findTopByContentIdOrderByDecidedAtDesc(contentId);
        if (decision.isEmpty()) {
            log.warn("[Calibrator] Cost {} reported for unknown content {}, dropped", actualCost, contentId);
            return new CostReconciliation(contentId, false, null, actualCost, BigDecimal.ZERO);
        }

        BigDecimal estimated = decision.get().getEstimatedCost();
        BigDecimal delta = actualCost.subtract(estimated);
        if (delta.signum() <= 0) {
            return new CostReconciliation(contentId, true, estimated, actualCost, BigDecimal.ZERO);
        }
        calibrator.recordCost(delta);
        log.debug("[Calibrator] Content {} cost {} over estimate {}, recorded {}", contentId, actualCost, estimated, delta);
        return new CostReconciliation(contentId, true, estimated, actualCost, delta);
    }
}
