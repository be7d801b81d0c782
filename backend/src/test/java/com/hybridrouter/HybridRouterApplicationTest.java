package com.hybridrouter;

import com.hybridrouter.domain.routing.model.DecisionRecord;
import com.hybridrouter.domain.routing.repository.DecisionRecordRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class HybridRouterApplicationTest {

    private static final String CLEAN_OUTCOME = """
            {"fields": {"headline": "Rent cap approved", "lede": "The council voted 45-40.",
                        "why_it_matters": "Rents fall 3 % in 2027."},
             "sources": ["https://yle.fi/a/1"], "costEur": 0.04}
            """;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private DecisionRecordRepository decisionRecordRepository;

    private ResultActions route(String contentId, String language, String category, double complexity, double risk)
            throws Exception {
        return mockMvc.perform(post("/api/v1/route")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {"contentId": "%s", "language": "%s", "category": "%s", "complexity": %s, "risk": %s}
                        """.formatted(contentId, language, category, complexity, risk)));
    }

    private ResultActions feedback(String contentId, String source, String payload) throws Exception {
        return mockMvc.perform(post("/api/v1/feedback")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {"contentId": "%s", "source": "%s", "payload": %s}
                        """.formatted(contentId, source, payload)));
    }

    /**
     * The decision log is written asynchronously.
     */
    private DecisionRecord awaitDecision(String contentId) throws InterruptedException {
        for (int i = 0; i < 100; i++) {
            Optional<DecisionRecord> record = decisionRecordRepository.findTopByContentIdOrderByDecidedAtDesc(contentId);
            if (record.isPresent()) {
                return record.get();
            }
            Thread.sleep(50);
        }
        throw new AssertionError("Decision for " + contentId + " was never logged");
    }

    @Nested
    @DisplayName("POST /api/v1/route")
    class RouteTests {

        @Test
        void forced_rule_routes_finnish_politics_to_premium() throws Exception {
            route("it-route-1", "fi", "politics", 0.8, 0.2)
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.provider").value("premium-a"))
                    .andExpect(jsonPath("$.reason").value("HARD_RULE"))
                    .andExpect(jsonPath("$.promptVariant").exists())
                    .andExpect(jsonPath("$.decisionId").exists());

            DecisionRecord record = awaitDecision("it-route-1");
            assertThat(record.getBucketKey()).isEqualTo("fi|critical|high");
            assertThat(record.getEstimatedCost()).isEqualByComparingTo("0.036");
        }

        @Test
        void cold_bucket_routes_to_safe_provider() throws Exception {
            route("it-route-2", "sv", "sports", 0.1, 0.1)
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.provider").value("premium-a"))
                    .andExpect(jsonPath("$.reason").value("COLD_START"));
        }

        @Test
        void missing_scores_are_rejected() throws Exception {
            mockMvc.perform(post("/api/v1/route")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"contentId\": \"x\", \"complexity\": 0.5}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
        }
    }

    @Nested
    @DisplayName("POST /api/v1/feedback and /costs")
    class FeedbackTests {

        @Test
        void duplicate_feedback_is_accepted_but_not_stored_twice() throws Exception {
            feedback("it-fb-1", "ENGAGEMENT", "{\"clicks\": 1}")
                    .andExpect(status().isAccepted())
                    .andExpect(jsonPath("$.accepted").value(true))
                    .andExpect(jsonPath("$.duplicate").value(false));
            feedback("it-fb-1", "ENGAGEMENT", "{\"clicks\": 7}")
                    .andExpect(status().isAccepted())
                    .andExpect(jsonPath("$.duplicate").value(true));
        }

        @Test
        void malformed_payload_is_rejected() throws Exception {
            feedback("it-fb-2", "EDITORIAL", "{\"accepted\": \"maybe\"}")
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("INVALID_PAYLOAD"));
        }

        @Test
        void unknown_source_is_a_malformed_request() throws Exception {
            feedback("it-fb-3", "TWEETS", "{}")
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("MALFORMED_REQUEST"));
        }

        @Test
        void cost_over_estimate_is_recorded() throws Exception {
            route("it-cost-1", "fi", "politics", 0.8, 0.2).andExpect(status().isOk());
            awaitDecision("it-cost-1");

            mockMvc.perform(post("/api/v1/costs")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"contentId\": \"it-cost-1\", \"amount\": 0.05}"))
                    .andExpect(status().isAccepted())
                    .andExpect(jsonPath("$.known").value(true))
                    .andExpect(jsonPath("$.estimatedCost").value(0.036))
                    .andExpect(jsonPath("$.recordedDelta").value(0.014));
        }

        @Test
        void cost_for_unknown_content_is_dropped() throws Exception {
            mockMvc.perform(post("/api/v1/costs")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"contentId\": \"never-routed\", \"amount\": 0.05}"))
                    .andExpect(status().isAccepted())
                    .andExpect(jsonPath("$.known").value(false))
                    .andExpect(jsonPath("$.recordedDelta").value(0));
        }
    }

    @Nested
    @DisplayName("Budget and admin")
    class AdminTests {

        @Test
        void directive_reports_cap_and_state() throws Exception {
            mockMvc.perform(get("/api/v1/budget/directive"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.monthlyCap").value(30))
                    .andExpect(jsonPath("$.throttleState").exists())
                    .andExpect(jsonPath("$.pacingTarget").exists());
        }

        @Test
        void bandit_statistics_list_every_provider() throws Exception {
            mockMvc.perform(get("/api/v1/admin/bandit"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.providers.length()").value(3))
                    .andExpect(jsonPath("$.explorationMode").exists());
        }

        @Test
        void rules_reload_bumps_version() throws Exception {
            mockMvc.perform(post("/api/v1/admin/rules/reload"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.rules").value(3))
                    .andExpect(jsonPath("$.version").value(greaterThanOrEqualTo(2)));
        }

        @Test
        void inconsistent_budget_ratios_are_rejected() throws Exception {
            mockMvc.perform(put("/api/v1/admin/budget")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"monthlyCap\": 30, \"softRatio\": 1.5, \"hardRatio\": 1.2}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
        }

        @Test
        void budget_policy_update_is_versioned() throws Exception {
            mockMvc.perform(put("/api/v1/admin/budget")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"monthlyCap\": 30, \"softRatio\": 1.10, \"hardRatio\": 1.25}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.version").value(greaterThanOrEqualTo(2)))
                    .andExpect(jsonPath("$.monthlyCap").value(30));
        }
    }

    @Nested
    @DisplayName("Learning cycle")
    class LearningCycleTests {

        @Test
        void edited_content_is_rewarded_once() throws Exception {
            route("it-learn-1", "en", "economy", 0.5, 0.3).andExpect(status().isOk());
            awaitDecision("it-learn-1");
            feedback("it-learn-1", "GENERATION_OUTCOME", CLEAN_OUTCOME).andExpect(status().isAccepted());
            feedback("it-learn-1", "EDITORIAL", "{\"accepted\": true, \"editRatio\": 0.1}")
                    .andExpect(status().isAccepted());

            mockMvc.perform(post("/api/v1/admin/learning-cycle"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.rewardsWritten").value(greaterThanOrEqualTo(1)))
                    .andExpect(jsonPath("$.samplesInHorizon").value(greaterThanOrEqualTo(1)));

            mockMvc.perform(post("/api/v1/admin/learning-cycle"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.rewardsWritten").value(0));

            mockMvc.perform(get("/api/v1/admin/bandit"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.snapshotVersion").value(greaterThanOrEqualTo(2)));
        }
    }
}
