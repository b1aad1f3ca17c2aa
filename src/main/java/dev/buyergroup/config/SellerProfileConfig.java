package dev.buyergroup.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.buyergroup.config.SellerProfilesConfig.Definition;
import dev.buyergroup.service.SellerProfileRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.File;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the seller profile registry from seller-profiles.yml plus an optional JSON file.
 * Profiles from the JSON file replace YAML profiles with the same name.
 */
@Slf4j
@Configuration
public class SellerProfileConfig {

    @Bean
    public SellerProfileRegistry sellerProfileRegistry(SellerProfilesConfig config, ObjectMapper objectMapper) {
        Map<String, Definition> definitions = new LinkedHashMap<>(config.getProfiles());

        String externalFile = config.getExternalFile();
        if (externalFile != null && !externalFile.isBlank()) {
            definitions.putAll(readExternal(new File(externalFile), objectMapper));
        }

        log.info("Seller profiles available: {}", definitions.keySet());
        return new SellerProfileRegistry(definitions);
    }

    Map<String, Definition> readExternal(File file, ObjectMapper objectMapper) {
        if (!file.exists()) {
            log.warn("Seller profile file {} not found. Using YAML profiles only.", file.getPath());
            return Map.of();
        }

        try {
            Map<String, Definition> loaded = objectMapper.readValue(file, new TypeReference<>() {
            });
            log.info("Loaded {} seller profiles from {}", loaded.size(), file.getPath());
            return loaded;
        } catch (IOException e) {
            log.error("Failed to load {}. Ensure it maps profile names to profile definitions.", file.getPath(), e);
            throw new IllegalStateException("Could not load seller profiles from " + file.getPath(), e);
        }
    }
}
