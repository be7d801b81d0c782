package com.hybridrouter.infrastructure.evaluation;

import com.hybridrouter.domain.feedback.model.EditorialSignal;
import com.hybridrouter.domain.feedback.model.EngagementSignal;
import com.hybridrouter.domain.feedback.model.FeedbackEvent;
import com.hybridrouter.domain.feedback.model.FeedbackSource;
import com.hybridrouter.domain.feedback.model.GenerationOutcome;
import com.hybridrouter.domain.quality.model.RewardSample;
import com.hybridrouter.domain.quality.model.ValidationResult;
import com.hybridrouter.domain.routing.model.ContextBucket;
import com.hybridrouter.domain.routing.model.DecisionRecord;
import com.hybridrouter.infrastructure.config.RouterProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Combines validation, text heuristics, editorial acceptance and engagement into one reward in [0,1].
 * Weights are renormalised over the signals present; hedging and reference misses are subtracted.
 */
@Slf4j
@Component
public class RewardScorer {

    private final OutputValidator validator;
    private final FeedbackPayloadParser parser;
    private final RouterProperties.Evaluator weights;

    public RewardScorer(OutputValidator validator, FeedbackPayloadParser parser, RouterProperties properties) {
        this.validator = validator;
        this.parser = parser;
        this.weights = properties.getEvaluator();
    }

    /**
     * Scores the feedback gathered for one content against the decision that produced it.
     * Only the first event per source is used.
     *
     * @throws FeedbackPayloadException if there is no generation outcome or a payload is malformed
     */
    public ScoredReward score(DecisionRecord decision, List<FeedbackEvent> events, Instant scoredAt) {
        GenerationOutcome outcome = null;
        EditorialSignal editorial = null;
        EngagementSignal engagement = null;
        for (FeedbackEvent event : events) {
            switch (event.getSource()) {
                case GENERATION_OUTCOME -> {
                    if (outcome == null) outcome = parser.parseOutcome(event.getPayload());
                }
                case EDITORIAL -> {
                    if (editorial == null) editorial = parser.parseEditorial(event.getPayload());
                }
                case ENGAGEMENT -> {
                    if (engagement == null) engagement = parser.parseEngagement(event.getPayload());
                }
            }
        }
        if (outcome == null) {
            throw new FeedbackPayloadException("No generation outcome for content " + decision.getContentId());
        }
        return score(decision, outcome, editorial, engagement, scoredAt);
    }

    public ScoredReward score(DecisionRecord decision, GenerationOutcome outcome,
                              EditorialSignal editorial, EngagementSignal engagement, Instant scoredAt) {
        ValidationResult validation = validator.validate(outcome);
        Set<FeedbackSource> sources = EnumSet.of(FeedbackSource.GENERATION_OUTCOME);

        double weighted = weights.getValidationWeight() * (validation.passed() ? 1.0 : 0.0)
                + weights.getHeuristicWeight() * heuristic(outcome);
        double total = weights.getValidationWeight() + weights.getHeuristicWeight();

        if (editorial != null) {
            weighted += weights.getEditorialWeight() * editorial.score();
            total += weights.getEditorialWeight();
            sources.add(FeedbackSource.EDITORIAL);
        }
        if (engagement != null) {
            weighted += weights.getEngagementWeight() * engagement.score();
            total += weights.getEngagementWeight();
            sources.add(FeedbackSource.ENGAGEMENT);
        }

        double base = total > 0 ? weighted / total : 0.0;
        String claims = outcome.field("lede") + " " + outcome.field(QualityHeuristics.WHY_IT_MATTERS);
        double penalty = weights.getHallucinationPenalty() * QualityHeuristics.hedgeDensity(claims, validator.hedgeTerms())
                + weights.getReferenceMissPenalty() * QualityHeuristics.referenceMissRate(outcome.sources());
        double reward = clip(base - penalty);

        log.debug("[Evaluator] content={} base={} penalty={} reward={} sources={}",
                decision.getContentId(), String.format("%.3f", base), String.format("%.3f", penalty),
                String.format("%.3f", reward), sources);

        RewardSample sample = new RewardSample(
                decision.getContentId(),
                ContextBucket.parse(decision.getBucketKey()),
                decision.getProvider(),
                decision.getCategory(),
                decision.getPromptVariant(),
                reward,
                validation.passed(),
                sources,
                decision.getDecidedAt(),
                scoredAt);
        return new ScoredReward(sample, validation, outcome.costEur());
    }

    private static double heuristic(GenerationOutcome outcome) {
        return (QualityHeuristics.distinctSentenceRatio(outcome.fullText()) + QualityHeuristics.analysisScore(outcome)) / 2.0;
    }

    private static double clip(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
