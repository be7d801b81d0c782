package com.hybridrouter.infrastructure.routing;

import com.hybridrouter.domain.routing.model.DecisionRecord;
import com.hybridrouter.domain.routing.model.RoutingDecision;
import com.hybridrouter.domain.routing.repository.DecisionRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Appends routing decisions to the decision log off the request thread.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DecisionLogWriter {

    private final DecisionRecordRepository decisionRecordRepository;

    @Async("decisionLogExecutor")
    public void append(RoutingDecision decision) {
        try {
            decisionRecordRepository.save(DecisionRecord.from(decision));
        } catch (DataAccessException e) {
            log.error("[DecisionLog] Failed to persist decision {} for content {}",
                    decision.decisionId(), decision.context().contentId(), e);
        }
    }
}
