package dev.buyergroup.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Defaults for pipeline runs that the caller does not override.
 * Loaded from application.yml under 'pipeline' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "pipeline")
public class PipelineConfig {

    private int maxQueries = 12;
    private int batchSize = 10;
    private int defaultSearchBudget = 20;
    private int defaultCollectBudget = 200;
}
