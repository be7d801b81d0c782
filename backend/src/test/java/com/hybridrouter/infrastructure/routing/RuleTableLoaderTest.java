package com.hybridrouter.infrastructure.routing;

import com.hybridrouter.domain.routing.model.RequestContext;
import com.hybridrouter.domain.routing.model.RoutingRule;
import com.hybridrouter.infrastructure.config.RouterProperties;
import com.hybridrouter.infrastructure.config.RoutingConfigurationException;
import com.hybridrouter.support.RouterFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleTableLoaderTest {

    private final Clock clock = RouterFixtures.clockAt(LocalDate.of(2026, 6, 1));
    private RouterProperties properties;
    private ProviderCatalog catalog;

    @BeforeEach
    void setUp() {
        properties = RouterFixtures.properties();
        catalog = new ProviderCatalog(properties);
    }

    private RuleTableLoader loader(String location) {
        properties.setRulesLocation(location);
        return new RuleTableLoader(new DefaultResourceLoader(), catalog, properties, clock);
    }

    @Nested
    @DisplayName("Loading")
    class LoadTests {

        @Test
        void loads_classpath_table_and_lower_cases_criteria() {
            RuleTable table = loader("classpath:rules/test-rules.yml").current();

            assertThat(table.version()).isEqualTo(1);
            assertThat(table.rules()).extracting(RoutingRule::name)
                    .containsExactly("fi-politics-premium", "weather-standard");
            RoutingRule first = table.rules().get(0);
            assertThat(first.languages()).containsExactly("fi");
            assertThat(first.categories()).containsExactly("politics");
            assertThat(first.allowlisted()).isTrue();
            assertThat(table.rules().get(1).allowlisted()).isFalse();
        }

        @Test
        void first_matching_rule_wins() {
            RuleTable table = loader("classpath:rules/test-rules.yml").current();

            assertThat(table.match(new RequestContext("c1", "FI", "Politics", 0.1, 0.1)))
                    .map(RoutingRule::provider).contains(RouterFixtures.PREMIUM);
            assertThat(table.match(new RequestContext("c2", "en", "politics", 0.1, 0.1))).isEmpty();
            assertThat(table.match(new RequestContext("c3", "sv", "weather", 0.9, 0.9)))
                    .map(RoutingRule::name).contains("weather-standard");
        }

        @Test
        void unknown_provider_is_rejected() {
            assertThatThrownBy(() -> loader("classpath:rules/unknown-provider.yml"))
                    .isInstanceOf(RoutingConfigurationException.class)
                    .hasMessageContaining("does-not-exist");
        }

        @Test
        void rule_without_criteria_is_rejected() {
            assertThatThrownBy(() -> loader("classpath:rules/no-criteria.yml"))
                    .isInstanceOf(RoutingConfigurationException.class)
                    .hasMessageContaining("catch-all");
        }

        @Test
        void missing_file_is_rejected() {
            assertThatThrownBy(() -> loader("classpath:rules/nope.yml"))
                    .isInstanceOf(RoutingConfigurationException.class)
                    .hasMessageContaining("not found");
        }
    }

    @Nested
    @DisplayName("Reload")
    class ReloadTests {

        @TempDir
        Path dir;

        @Test
        void failed_reload_keeps_active_table() throws IOException {
            Path file = dir.resolve("rules.yml");
            Files.writeString(file, """
                    rules:
                      - name: sports-economy
                        categories: [sports]
                        provider: economy-c
                    """);
            RuleTableLoader loader = loader(file.toUri().toString());
            assertThat(loader.current().rules()).hasSize(1);

            Files.writeString(file, """
                    rules:
                      - name: bad-threshold
                        minRisk: 1.5
                        provider: economy-c
                    """);
            assertThatThrownBy(loader::reload)
                    .isInstanceOf(RoutingConfigurationException.class)
                    .hasMessageContaining("minRisk");
            assertThat(loader.current().version()).isEqualTo(1);
            assertThat(loader.current().rules()).extracting(RoutingRule::name).containsExactly("sports-economy");

            Files.writeString(file, """
                    rules:
                      - name: sports-economy
                        categories: [sports]
                        provider: economy-c
                      - name: risky-premium
                        minRisk: 0.9
                        provider: premium-a
                    """);
            RuleTable reloaded = loader.reload();
            assertThat(reloaded.version()).isEqualTo(2);
            assertThat(loader.current()).isSameAs(reloaded);
        }

        @Test
        void unknown_keys_are_rejected() throws IOException {
            Path file = dir.resolve("typo.yml");
            Files.writeString(file, """
                    rules:
                      - name: typo
                        categorys: [sports]
                        provider: economy-c
                    """);

            assertThatThrownBy(() -> loader(file.toUri().toString()))
                    .isInstanceOf(RoutingConfigurationException.class);
        }

        @Test
        void duplicate_names_are_rejected() throws IOException {
            Path file = dir.resolve("dup.yml");
            Files.writeString(file, """
                    rules:
                      - name: same
                        categories: [sports]
                        provider: economy-c
                      - name: same
                        categories: [weather]
                        provider: standard-b
                    """);

            assertThatThrownBy(() -> loader(file.toUri().toString()))
                    .isInstanceOf(RoutingConfigurationException.class)
                    .hasMessageContaining("Duplicate");
        }
    }
}
