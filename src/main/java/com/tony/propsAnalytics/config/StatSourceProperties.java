package com.tony.propsAnalytics.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "stats.source")
@Data
public class StatSourceProperties {
    private String baseUrl = "http://localhost:8090/api";

    // Pseudo rate limiting : délai minimum entre deux appels amont
    private Duration minDelay = Duration.ofSeconds(1);

    private Duration timeout = Duration.ofSeconds(10);
}
