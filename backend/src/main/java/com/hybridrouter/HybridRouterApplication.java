package com.hybridrouter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Hybrid router - budget-aware adaptive provider routing for content generation.
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class HybridRouterApplication {

	public static void main(String[] args) {
		SpringApplication.run(HybridRouterApplication.class, args);
	}

}
