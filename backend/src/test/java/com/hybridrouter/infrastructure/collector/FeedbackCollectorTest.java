package com.hybridrouter.infrastructure.collector;

import com.hybridrouter.domain.feedback.model.FeedbackEvent;
import com.hybridrouter.domain.feedback.model.FeedbackSource;
import com.hybridrouter.domain.feedback.repository.FeedbackEventRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FeedbackCollectorTest {

    private static final Instant RECEIVED = Instant.parse("2026-06-01T10:00:00Z");

    @Mock
    private FeedbackEventRepository repository;

    @InjectMocks
    private FeedbackCollector collector;

    private static FeedbackEvent event() {
        return FeedbackEvent.builder()
                .contentId("content-1")
                .source(FeedbackSource.EDITORIAL)
                .payload("{\"accepted\":true}")
                .receivedAt(RECEIVED)
                .build();
    }

    @Test
    void stores_first_event_per_content_and_source() {
        FeedbackEvent event = event();
        when(repository.existsByContentIdAndSource("content-1", FeedbackSource.EDITORIAL)).thenReturn(false);

        assertThat(collector.ingest(event)).isTrue();
        verify(repository).saveAndFlush(event);
        assertThat(event.getOccurredAt()).isEqualTo(RECEIVED);
    }

    @Test
    void duplicate_is_ignored_without_write() {
        when(repository.existsByContentIdAndSource("content-1", FeedbackSource.EDITORIAL)).thenReturn(true);

        assertThat(collector.ingest(event())).isFalse();
        verify(repository, never()).saveAndFlush(any());
    }

    @Test
    void concurrent_duplicate_rejected_by_constraint_is_ignored() {
        when(repository.existsByContentIdAndSource("content-1", FeedbackSource.EDITORIAL)).thenReturn(false);
        when(repository.saveAndFlush(any())).thenThrow(new DataIntegrityViolationException("uk_feedback_content_source"));

        assertThat(collector.ingest(event())).isFalse();
    }

    @Test
    void drains_events_received_after_cursor() {
        List<FeedbackEvent> events = List.of(event());
        when(repository.findByReceivedAtAfterOrderByReceivedAtAscIdAsc(RECEIVED.minusSeconds(1))).thenReturn(events);

        assertThat(collector.drainSince(RECEIVED.minusSeconds(1))).isSameAs(events);
    }
}
