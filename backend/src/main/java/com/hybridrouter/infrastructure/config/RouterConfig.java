package com.hybridrouter.infrastructure.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Random;

@Slf4j
@Configuration
public class RouterConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Shared exploration random source for the bandit and the prompter.
     */
    @Bean
    public Random explorationRandom(RouterProperties properties) {
        Long seed = properties.getBandit().getSeed();
        if (seed != null) {
            log.info("[RouterConfig] Exploration random source seeded with {}", seed);
            return new Random(seed);
        }
        return new Random();
    }
}
