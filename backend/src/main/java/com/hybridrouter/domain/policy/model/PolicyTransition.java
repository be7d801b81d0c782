package com.hybridrouter.domain.policy.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Auditable change of the exploration policy, with the cause retained for operator review.
 */
@Entity
@Table(name = "policy_transitions")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PolicyTransition {

    private static final int MAX_CAUSE_LENGTH = 4000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private ExplorationMode fromMode;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private ExplorationMode toMode;

    @Column(nullable = false, length = MAX_CAUSE_LENGTH)
    private String cause;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    public PolicyTransition(ExplorationMode fromMode, ExplorationMode toMode, String cause, Instant createdAt) {
        this.fromMode = fromMode;
        this.toMode = toMode;
        this.cause = cause.length() > MAX_CAUSE_LENGTH ? cause.substring(0, MAX_CAUSE_LENGTH) : cause;
        this.createdAt = createdAt;
    }
}
