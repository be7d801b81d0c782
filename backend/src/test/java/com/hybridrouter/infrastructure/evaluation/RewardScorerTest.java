package com.hybridrouter.infrastructure.evaluation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hybridrouter.domain.feedback.model.EditorialSignal;
import com.hybridrouter.domain.feedback.model.EngagementSignal;
import com.hybridrouter.domain.feedback.model.FeedbackEvent;
import com.hybridrouter.domain.feedback.model.FeedbackSource;
import com.hybridrouter.domain.feedback.model.GenerationOutcome;
import com.hybridrouter.domain.quality.model.RewardSample;
import com.hybridrouter.domain.routing.model.DecisionReason;
import com.hybridrouter.domain.routing.model.DecisionRecord;
import com.hybridrouter.domain.routing.model.ThrottleState;
import com.hybridrouter.infrastructure.config.RouterProperties;
import com.hybridrouter.support.RouterFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static com.hybridrouter.infrastructure.evaluation.OutputValidatorTest.HEADLINE;
import static com.hybridrouter.infrastructure.evaluation.OutputValidatorTest.LEDE;
import static com.hybridrouter.infrastructure.evaluation.OutputValidatorTest.SOURCES;
import static com.hybridrouter.infrastructure.evaluation.OutputValidatorTest.WHY;
import static com.hybridrouter.infrastructure.evaluation.OutputValidatorTest.outcome;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RewardScorerTest {

    private static final Instant DECIDED = Instant.parse("2026-06-01T08:00:00Z");
    private static final Instant SCORED = Instant.parse("2026-06-05T03:30:00Z");

    private RewardScorer scorer;
    private DecisionRecord decision;

    @BeforeEach
    void setUp() {
        RouterProperties properties = RouterFixtures.properties();
        scorer = new RewardScorer(new OutputValidator(properties), new FeedbackPayloadParser(new ObjectMapper()),
                properties);
        decision = DecisionRecord.builder()
                .decisionId("d-1")
                .contentId("content-1")
                .provider(RouterFixtures.STANDARD)
                .promptVariant("politics_v1")
                .language("fi")
                .category("politics")
                .bucketKey("fi|critical|high")
                .throttleState(ThrottleState.NORMAL)
                .reason(DecisionReason.THOMPSON)
                .estimatedCost(new BigDecimal("0.010000"))
                .decidedAt(DECIDED)
                .build();
    }

    private double reward(GenerationOutcome outcome, EditorialSignal editorial, EngagementSignal engagement) {
        return scorer.score(decision, outcome, editorial, engagement, SCORED).sample().reward();
    }

    @Nested
    @DisplayName("Weighting")
    class WeightTests {

        @Test
        void clean_item_without_human_signals_scores_full() {
            assertThat(reward(outcome(HEADLINE, LEDE, WHY, SOURCES), null, null)).isCloseTo(1.0, within(1e-9));
        }

        @Test
        void weights_renormalise_over_present_signals() {
            GenerationOutcome clean = outcome(HEADLINE, LEDE, WHY, SOURCES);

            // (0.3 + 0.2 + 0.3 * 0) / 0.8
            assertThat(reward(clean, new EditorialSignal(false, 0.0), null)).isCloseTo(0.625, within(1e-9));
            // (0.3 + 0.2 + 0.3 * 0 + 0.2 * 1) / 1.0
            assertThat(reward(clean, new EditorialSignal(false, 0.0), new EngagementSignal(1, 60, 0)))
                    .isCloseTo(0.7, within(1e-9));
            // (0.3 + 0.2 + 0.3 * 0.9) / 0.8
            assertThat(reward(clean, new EditorialSignal(true, 0.2), null)).isCloseTo(0.9625, within(1e-9));
        }

        @Test
        void failed_validation_and_missing_references_are_penalised() {
            // base 0.2 / 0.5 = 0.4, minus 0.2 for a 100 % reference miss rate
            assertThat(reward(outcome(HEADLINE, LEDE, WHY, List.of()), null, null)).isCloseTo(0.2, within(1e-9));
        }

        @Test
        void hedged_claims_are_penalised() {
            double hedged = reward(outcome(HEADLINE, "Reportedly the council approved the plan.", WHY, SOURCES),
                    null, null);

            assertThat(hedged).isCloseTo(0.5, within(1e-9));
        }

        @Test
        void reward_is_clipped_at_zero() {
            GenerationOutcome bad = outcome(HEADLINE, "Allegedly, reportedly, sources say.", "Unconfirmed.", List.of());

            assertThat(reward(bad, new EditorialSignal(false, 0.0), null)).isZero();
        }
    }

    @Nested
    @DisplayName("Attribution")
    class AttributionTests {

        @Test
        void sample_is_attributed_to_decision() {
            ScoredReward scored = scorer.score(decision, List.of(
                    event(FeedbackSource.GENERATION_OUTCOME,
                            "{\"fields\":{\"headline\":\"" + HEADLINE + "\",\"lede\":\"" + LEDE
                                    + "\",\"why_it_matters\":\"" + WHY + "\"},\"sources\":[\"https://yle.fi/a/1\"],"
                                    + "\"costEur\":0.012}"),
                    event(FeedbackSource.EDITORIAL, "{\"accepted\":true}"),
                    event(FeedbackSource.EDITORIAL, "{\"accepted\":false}")), SCORED);

            RewardSample sample = scored.sample();
            assertThat(sample.contentId()).isEqualTo("content-1");
            assertThat(sample.bucket()).isEqualTo(RouterFixtures.FI_CRITICAL_HIGH);
            assertThat(sample.provider()).isEqualTo(RouterFixtures.STANDARD);
            assertThat(sample.promptVariant()).isEqualTo("politics_v1");
            assertThat(sample.decidedAt()).isEqualTo(DECIDED);
            assertThat(sample.scoredAt()).isEqualTo(SCORED);
            assertThat(sample.sources()).containsExactlyInAnyOrder(
                    FeedbackSource.GENERATION_OUTCOME, FeedbackSource.EDITORIAL);
            assertThat(sample.reward()).isCloseTo(1.0, within(1e-9));
            assertThat(scored.actualCost()).isEqualByComparingTo("0.012");
        }

        @Test
        void engagement_alone_cannot_be_scored() {
            assertThatThrownBy(() -> scorer.score(decision,
                    List.of(event(FeedbackSource.ENGAGEMENT, "{\"clicks\":3}")), SCORED))
                    .isInstanceOf(FeedbackPayloadException.class)
                    .hasMessageContaining("content-1");
        }
    }

    private static FeedbackEvent event(FeedbackSource source, String payload) {
        return FeedbackEvent.builder()
                .contentId("content-1")
                .source(source)
                .payload(payload)
                .receivedAt(DECIDED.plusSeconds(60))
                .build();
    }
}
