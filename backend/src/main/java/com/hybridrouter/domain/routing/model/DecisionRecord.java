package com.hybridrouter.domain.routing.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One row of the append-only decision log.
 */
@Entity
@Table(name = "decision_log", indexes = {
        @Index(name = "idx_decision_content", columnList = "contentId"),
        @Index(name = "idx_decision_decided_at", columnList = "decidedAt")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class DecisionRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 36)
    private String decisionId;

    @Column(nullable = false)
    private String contentId;

    @Column(nullable = false, length = 50)
    private String provider;

    @Column(nullable = false, length = 100)
    private String promptVariant;

    @Column(nullable = false, length = 20)
    private String language;

    @Column(nullable = false, length = 100)
    private String category;

    @Column(nullable = false, length = 100)
    private String bucketKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ThrottleState throttleState;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private DecisionReason reason;

    @Column(nullable = false, precision = 19, scale = 6)
    private BigDecimal estimatedCost;

    @Column(nullable = false, updatable = false)
    private Instant decidedAt;

    @Builder
    public DecisionRecord(String decisionId, String contentId, String provider, String promptVariant,
                          String language, String category, String bucketKey, ThrottleState throttleState,
                          DecisionReason reason, BigDecimal estimatedCost, Instant decidedAt) {
        this.decisionId = decisionId;
        this.contentId = contentId;
        this.provider = provider;
        this.promptVariant = promptVariant;
        this.language = language;
        this.category = category;
        this.bucketKey = bucketKey;
        this.throttleState = throttleState;
        this.reason = reason;
        this.estimatedCost = estimatedCost;
        this.decidedAt = decidedAt;
    }

    public static DecisionRecord from(RoutingDecision decision) {
        return DecisionRecord.builder()
                .decisionId(decision.decisionId().toString())
                .contentId(decision.context().contentId())
                .provider(decision.provider().id())
                .promptVariant(decision.promptVariant())
                .language(decision.context().language())
                .category(decision.context().category())
                .bucketKey(decision.bucket().key())
                .throttleState(decision.throttleState())
                .reason(decision.reason())
                .estimatedCost(decision.estimatedCost())
                .decidedAt(decision.decidedAt())
                .build();
    }
}
