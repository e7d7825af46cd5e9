package com.tony.propsAnalytics.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tony.propsAnalytics.cache.CacheStore;
import com.tony.propsAnalytics.cache.InMemoryCacheStore;
import com.tony.propsAnalytics.cache.JsonFileCacheStore;
import com.tony.propsAnalytics.cache.StatCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Racine de composition : horloge, cache de stats et client HTTP amont.
 */
@Configuration
@Slf4j
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CacheStore cacheStore(CacheProperties properties, ObjectMapper objectMapper) {
        if (properties.getStore() == CacheProperties.StoreType.FILE) {
            log.info("🗄️ Cache de stats sur disque : {}", properties.getDirectory());
            return new JsonFileCacheStore(Path.of(properties.getDirectory()), objectMapper);
        }
        log.info("🗄️ Cache de stats en mémoire");
        return new InMemoryCacheStore();
    }

    @Bean
    public StatCache statCache(CacheStore cacheStore, Clock clock) {
        return new StatCache(cacheStore, clock);
    }

    @Bean
    public RestTemplate statSourceRestTemplate(RestTemplateBuilder builder, StatSourceProperties properties) {
        return builder
                .setConnectTimeout(properties.getTimeout())
                .setReadTimeout(properties.getTimeout())
                .build();
    }
}
