package com.tony.propsAnalytics.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "stats.cache")
@Data
public class CacheProperties {

    public enum StoreType {
        MEMORY,
        FILE
    }

    private Duration ttl = Duration.ofHours(1);

    // Rétention max d'une entrée, indépendante du TTL (purge périodique)
    private Duration maxRetention = Duration.ofDays(7);

    private StoreType store = StoreType.MEMORY;

    // Répertoire des fichiers JSON si store = FILE
    private String directory = "cache";
}
