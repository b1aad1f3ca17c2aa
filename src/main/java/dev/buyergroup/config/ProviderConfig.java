package dev.buyergroup.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration for the professional-network provider and its cost model.
 * Loaded from application.yml under 'provider' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "provider")
public class ProviderConfig {

    private String baseUrl = "https://api.coresignal.com";
    private String apiKey = "";

    // Cost model
    private int searchCreditCost = 1;
    private int collectCreditCost = 2;
    private double usdPerCredit = 0.196;

    // Pacing and resilience
    private double requestsPerSecond = 5.0;
    private int parallelism = 4;
    private Duration callTimeout = Duration.ofSeconds(20);
    private Duration retryDelay = Duration.ofSeconds(1);

    private int resultLimit = 25;

    // Response cache
    private Duration cacheTtl = Duration.ofHours(24);
    private long cacheMaxEntries = 10_000;
}
