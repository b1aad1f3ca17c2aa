package dev.buyergroup.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for composite role scoring weights.
 * Loaded from application.yml under 'scoring' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "scoring")
public class ScoringConfig {

    private double seniorityWeight = 0.35;
    private double departmentWeight = 0.25;
    private double titleWeight = 0.30;
    private double tenureWeight = 0.10;

    // Multiplier for Decision scores below the deal-size authority level
    private double authorityPenalty = 0.8;

    private int tenureCapMonths = 60;

    // Title strength used when no pattern matched
    private double overrideStrength = 0.7;
    private double gatekeeperStrength = 0.5;
    private double fallbackStrength = 0.3;
}
