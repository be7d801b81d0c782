package com.hybridrouter.infrastructure.config;

import com.hybridrouter.domain.routing.model.QualityTier;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "router")
public class RouterProperties {

    /** Strict local timeout for one routing decision. */
    private Duration decisionTimeout = Duration.ofMillis(5);

    /** Provider used for cold-start buckets; defaults to the first PREMIUM provider. */
    private String safeProvider;

    private List<ProviderProperties> providers = new ArrayList<>();

    /** Location of the ordered rule table (classpath: or file:). */
    private String rulesLocation = "classpath:routing-rules.yml";

    /** Categories that keep premium routing under a hard throttle. */
    private List<String> hardThrottleAllowlist = new ArrayList<>();

    private Bucket bucket = new Bucket();
    private Bandit bandit = new Bandit();
    private Prompter prompter = new Prompter();
    private Evaluator evaluator = new Evaluator();
    private Budget budget = new Budget();
    private Learning learning = new Learning();

    @Data
    public static class ProviderProperties {
        private String id;
        private QualityTier tier;
        private BigDecimal costPerThousandUnits;
        private int expectedUnits;
        private int maxUnits;
    }

    @Data
    public static class Bucket {
        /** Languages with their own bucket; everything else shares "other". */
        private List<String> languages = new ArrayList<>(List.of("fi", "en"));
        private List<String> criticalCategories = new ArrayList<>();
        private double riskThreshold = 0.7;
        private double complexityMedium = 0.3;
        private double complexityHigh = 0.6;
    }

    @Data
    public static class Bandit {
        private int minSamples = 20;
        private int maxBuckets = 50;
        /** Seed for the exploration random source; unset means nondeterministic. */
        private Long seed;
        /** Scale applied to premium Thompson draws under a soft throttle. */
        private double softPremiumMultiplier = 0.6;
    }

    @Data
    public static class Prompter {
        private double epsilon = 0.1;
        private int minTrials = 5;
        /** Curated variants per category; "default" covers every other category. */
        private Map<String, List<String>> variants = new LinkedHashMap<>();
    }

    @Data
    public static class Evaluator {
        private double validationWeight = 0.3;
        private double heuristicWeight = 0.2;
        private double editorialWeight = 0.3;
        private double engagementWeight = 0.2;
        private double hallucinationPenalty = 0.5;
        private double referenceMissPenalty = 0.2;
        private List<String> requiredFields = new ArrayList<>(List.of("headline", "lede", "why_it_matters"));
        private List<String> bannedPhrases = new ArrayList<>();
        private List<String> hedgeTerms = new ArrayList<>();
        private Regression regression = new Regression();
    }

    @Data
    public static class Regression {
        private double alpha = 0.05;
        private double minEffect = 0.05;
        private int minSamples = 30;
        private int windowDays = 14;
    }

    @Data
    public static class Budget {
        private BigDecimal monthlyCap = new BigDecimal("30");
        private double softRatio = 1.10;
        private double hardRatio = 1.25;
        /** Worst-case single request cost; unset means the largest provider worst case. */
        private BigDecimal maxSingleCost;
        /** Costs above maxSingleCost times this factor are rejected as absurd. */
        private int absurdFactor = 100;
    }

    @Data
    public static class Learning {
        private String cron = "0 30 3 * * *";
        private int horizonDays = 30;
        private Duration settleAfter = Duration.ofHours(72);
    }
}
