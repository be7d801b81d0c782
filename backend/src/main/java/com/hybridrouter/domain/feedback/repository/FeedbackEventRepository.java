package com.hybridrouter.domain.feedback.repository;

import com.hybridrouter.domain.feedback.model.FeedbackEvent;
import com.hybridrouter.domain.feedback.model.FeedbackSource;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;

public interface FeedbackEventRepository extends JpaRepository<FeedbackEvent, Long> {

    boolean existsByContentIdAndSource(String contentId, FeedbackSource source);

    List<FeedbackEvent> findByReceivedAtAfterOrderByReceivedAtAscIdAsc(Instant since);

    List<FeedbackEvent> findByContentIdOrderByReceivedAtAsc(String contentId);
}
