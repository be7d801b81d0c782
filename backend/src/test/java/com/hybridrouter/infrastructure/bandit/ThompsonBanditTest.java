package com.hybridrouter.infrastructure.bandit;

import com.hybridrouter.domain.quality.model.RewardSample;
import com.hybridrouter.domain.routing.model.Provider;
import com.hybridrouter.infrastructure.config.RouterProperties;
import com.hybridrouter.infrastructure.routing.ProviderCatalog;
import com.hybridrouter.support.RouterFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.hybridrouter.support.RouterFixtures.ECONOMY;
import static com.hybridrouter.support.RouterFixtures.EN_ROUTINE_LOW;
import static com.hybridrouter.support.RouterFixtures.FI_CRITICAL_HIGH;
import static com.hybridrouter.support.RouterFixtures.PREMIUM;
import static com.hybridrouter.support.RouterFixtures.STANDARD;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ThompsonBanditTest {

    private final Clock clock = RouterFixtures.clockAt(LocalDate.of(2026, 6, 1));
    private ProviderCatalog catalog;
    private ThompsonBandit bandit;

    @BeforeEach
    void setUp() {
        RouterProperties properties = RouterFixtures.properties();
        catalog = new ProviderCatalog(properties);
        bandit = new ThompsonBandit(catalog, properties, new Random(42), clock);
    }

    private List<RewardSample> trained(double premium, double standard, double economy, int n) {
        List<RewardSample> samples = new ArrayList<>();
        samples.addAll(RouterFixtures.samples(EN_ROUTINE_LOW, PREMIUM, premium, n, clock.instant()));
        samples.addAll(RouterFixtures.samples(EN_ROUTINE_LOW, STANDARD, standard, n, clock.instant()));
        samples.addAll(RouterFixtures.samples(EN_ROUTINE_LOW, ECONOMY, economy, n, clock.instant()));
        return samples;
    }

    @Nested
    @DisplayName("Cold start")
    class ColdStartTests {

        @Test
        void empty_bucket_recommends_safe_provider() {
            assertThat(bandit.isColdStart(EN_ROUTINE_LOW)).isTrue();
            assertThat(bandit.recommend(EN_ROUTINE_LOW, 1.0).id()).isEqualTo(PREMIUM);
            assertThat(bandit.exploit(EN_ROUTINE_LOW).id()).isEqualTo(PREMIUM);
        }

        @Test
        void bucket_warms_up_at_min_samples() {
            for (int i = 0; i < 19; i++) {
                bandit.update(RouterFixtures.sample("c" + i, EN_ROUTINE_LOW, ECONOMY, 1.0, true, clock.instant()));
            }
            assertThat(bandit.isColdStart(EN_ROUTINE_LOW)).isTrue();

            bandit.update(RouterFixtures.sample("c19", EN_ROUTINE_LOW, ECONOMY, 1.0, true, clock.instant()));
            assertThat(bandit.isColdStart(EN_ROUTINE_LOW)).isFalse();
            assertThat(bandit.isColdStart(FI_CRITICAL_HIGH)).isTrue();
        }
    }

    @Nested
    @DisplayName("Sampling")
    class SamplingTests {

        @Test
        void converges_on_clearly_better_arm() {
            bandit.rebuild(trained(0.2, 0.3, 0.9, 100));

            Map<String, Integer> picks = new HashMap<>();
            for (int i = 0; i < 1000; i++) {
                picks.merge(bandit.recommend(EN_ROUTINE_LOW, 1.0).id(), 1, Integer::sum);
            }
            assertThat(picks.getOrDefault(ECONOMY, 0)).isGreaterThan(950);
        }

        @Test
        void still_explores_close_arms() {
            bandit.rebuild(trained(0.55, 0.5, 0.5, 10));

            Map<String, Integer> picks = new HashMap<>();
            for (int i = 0; i < 1000; i++) {
                picks.merge(bandit.recommend(EN_ROUTINE_LOW, 1.0).id(), 1, Integer::sum);
            }
            assertThat(picks).containsKeys(PREMIUM, STANDARD, ECONOMY);
        }

        @Test
        void zero_premium_scale_excludes_premium() {
            bandit.rebuild(trained(1.0, 0.1, 0.1, 50));

            for (int i = 0; i < 200; i++) {
                assertThat(bandit.recommend(EN_ROUTINE_LOW, 0.0).isPremium()).isFalse();
            }
        }

        @Test
        void exploit_picks_best_mean_and_breaks_ties_towards_cheaper() {
            bandit.rebuild(trained(0.4, 0.8, 0.4, 30));
            assertThat(bandit.exploit(EN_ROUTINE_LOW).id()).isEqualTo(STANDARD);

            bandit.rebuild(trained(0.6, 0.6, 0.6, 30));
            assertThat(bandit.exploit(EN_ROUTINE_LOW).id()).isEqualTo(ECONOMY);
        }

        @Test
        void beta_sampler_matches_posterior_mean() {
            Random random = new Random(7);
            double sum = 0.0;
            int n = 20000;
            for (int i = 0; i < n; i++) {
                double draw = BetaSampler.sample(2.0, 5.0, random);
                assertThat(draw).isBetween(0.0, 1.0);
                sum += draw;
            }
            assertThat(sum / n).isCloseTo(2.0 / 7.0, within(0.01));
        }

        @Test
        void beta_sampler_handles_small_shapes() {
            Random random = new Random(3);
            double sum = 0.0;
            int n = 20000;
            for (int i = 0; i < n; i++) {
                sum += BetaSampler.sample(0.5, 0.5, random);
            }
            assertThat(sum / n).isCloseTo(0.5, within(0.02));
        }
    }

    @Nested
    @DisplayName("Snapshots")
    class SnapshotTests {

        @Test
        void rebuild_replaces_rather_than_accumulates() {
            List<RewardSample> samples = trained(0.5, 0.5, 0.5, 10);
            bandit.rebuild(samples);
            BanditSnapshot second = bandit.rebuild(samples);

            assertThat(second.bucketSamples(EN_ROUTINE_LOW.key())).isEqualTo(30);
            assertThat(second.posterior(EN_ROUTINE_LOW.key(), ECONOMY))
                    .isEqualTo(new BetaPosterior(6.0, 6.0, 10));
            assertThat(second.version()).isEqualTo(2);
        }

        @Test
        void fractional_rewards_update_both_shape_parameters() {
            bandit.update(RouterFixtures.sample("c", EN_ROUTINE_LOW, STANDARD, 0.25, false, clock.instant()));

            BetaPosterior posterior = bandit.snapshot().posterior(EN_ROUTINE_LOW.key(), STANDARD);
            assertThat(posterior.alpha()).isEqualTo(1.25);
            assertThat(posterior.beta()).isEqualTo(1.75);
            assertThat(posterior.samples()).isEqualTo(1);
        }

        @Test
        void statistics_report_mean_reward_per_provider() {
            bandit.rebuild(trained(0.2, 0.5, 0.8, 10));

            assertThat(bandit.statistics())
                    .filteredOn(s -> s.provider().equals(ECONOMY))
                    .singleElement()
                    .satisfies(s -> {
                        assertThat(s.samples()).isEqualTo(10);
                        assertThat(s.meanReward()).isCloseTo(0.8, within(1e-9));
                        assertThat(s.buckets()).isEqualTo(1);
                    });
        }

        @Test
        void concurrent_updates_are_not_lost() throws Exception {
            int threads = 8;
            int perThread = 250;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int thread = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        bandit.update(RouterFixtures.sample(thread + "-" + i, EN_ROUTINE_LOW, STANDARD, 1.0,
                                true, clock.instant()));
                        Provider p = bandit.recommend(EN_ROUTINE_LOW, 1.0);
                        assertThat(p).isNotNull();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
            pool.shutdown();

            assertThat(bandit.snapshot().bucketSamples(EN_ROUTINE_LOW.key())).isEqualTo(threads * perThread);
        }
    }
}
