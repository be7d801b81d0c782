package com.hybridrouter.infrastructure.collector;

import com.hybridrouter.domain.feedback.model.FeedbackEvent;
import com.hybridrouter.domain.feedback.repository.FeedbackEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Append-only feedback store, idempotent on (contentId, source).
 * Not transactional: a duplicate rejected by the unique constraint must not poison a caller's transaction.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FeedbackCollector {

    private final FeedbackEventRepository feedbackEventRepository;

    /**
     * @return true if stored, false if an event for the same (contentId, source) already exists
     */
    public boolean ingest(FeedbackEvent event) {
        if (feedbackEventRepository.existsByContentIdAndSource(event.getContentId(), event.getSource())) {
            log.debug("[Collector] Duplicate {} for content {} ignored", event.getSource(), event.getContentId());
            return false;
        }
        try {
            feedbackEventRepository.saveAndFlush(event);
            return true;
        } catch (DataIntegrityViolationException e) {
            // concurrent duplicate lost the race on the unique constraint
            log.debug("[Collector] Concurrent duplicate {} for content {} ignored", event.getSource(), event.getContentId());
            return false;
        }
    }

    /**
     * Events received strictly after {@code since}, oldest first.
     */
    public List<FeedbackEvent> drainSince(Instant since) {
        return feedbackEventRepository.findByReceivedAtAfterOrderByReceivedAtAscIdAsc(since);
    }
}
