package com.hybridrouter.domain.quality.model;

import com.hybridrouter.domain.feedback.model.FeedbackSource;
import com.hybridrouter.domain.routing.model.ContextBucket;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One row of the append-only reward log. A content id is rewarded at most once.
 */
@Entity
@Table(name = "reward_log", indexes = @Index(name = "idx_reward_decided_at", columnList = "decidedAt"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class RewardRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String contentId;

    @Column(nullable = false, length = 100)
    private String bucketKey;

    @Column(nullable = false, length = 50)
    private String provider;

    @Column(nullable = false, length = 100)
    private String category;

    @Column(nullable = false, length = 100)
    private String promptVariant;

    @Column(nullable = false)
    private double reward;

    @Column(nullable = false)
    private boolean validationPassed;

    @Column(nullable = false, length = 100)
    private String sources;

    @Column(precision = 19, scale = 6)
    private BigDecimal cost;

    @Column(nullable = false, updatable = false)
    private Instant decidedAt;

    @Column(nullable = false, updatable = false)
    private Instant scoredAt;

    private RewardRecord(RewardSample sample, BigDecimal cost) {
        this.contentId = sample.contentId();
        this.bucketKey = sample.bucket().key();
        this.provider = sample.provider();
        this.category = sample.category();
        this.promptVariant = sample.promptVariant();
        this.reward = sample.reward();
        this.validationPassed = sample.validationPassed();
        this.sources = sample.sources().stream().map(Enum::name).sorted().collect(Collectors.joining(","));
        this.cost = cost;
        this.decidedAt = sample.decidedAt();
        this.scoredAt = sample.scoredAt();
    }

    public static RewardRecord from(RewardSample sample, BigDecimal cost) {
        return new RewardRecord(sample, cost);
    }

    public RewardSample toSample() {
        Set<FeedbackSource> parsed = EnumSet.noneOf(FeedbackSource.class);
        if (sources != null && !sources.isBlank()) {
            Arrays.stream(sources.split(",")).map(FeedbackSource::valueOf).forEach(parsed::add);
        }
        return new RewardSample(contentId, ContextBucket.parse(bucketKey), provider, category,
                promptVariant, reward, validationPassed, parsed, decidedAt, scoredAt);
    }
}
