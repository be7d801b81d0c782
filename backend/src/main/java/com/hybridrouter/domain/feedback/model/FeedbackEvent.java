package com.hybridrouter.domain.feedback.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Append-only feedback observation tied to a prior decision by content id.
 * At most one event per (contentId, source) is stored.
 */
@Entity
@Table(name = "feedback_events",
        uniqueConstraints = @UniqueConstraint(name = "uk_feedback_content_source", columnNames = {"contentId", "source"}),
        indexes = @Index(name = "idx_feedback_received_at", columnList = "receivedAt"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class FeedbackEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String contentId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private FeedbackSource source;

    @Lob
    @Column(nullable = false)
    private String payload;

    @Column(nullable = false, updatable = false)
    private Instant occurredAt;

    @Column(nullable = false, updatable = false)
    private Instant receivedAt;

    @Builder
    public FeedbackEvent(String contentId, FeedbackSource source, String payload,
                         Instant occurredAt, Instant receivedAt) {
        this.contentId = contentId;
        this.source = source;
        this.payload = payload;
        this.occurredAt = occurredAt != null ? occurredAt : receivedAt;
        this.receivedAt = receivedAt;
    }
}
