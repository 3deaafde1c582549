package br.com.draftroom.backend.config;

import br.com.draftroom.backend.service.PlayerCatalogService;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

@Configuration
@EnableCaching
public class CacheConfig {

    @Bean
    public CacheManager cacheManager() {
        CaffeineCacheManager cacheManager = new CaffeineCacheManager();

        // Catálogo é estático durante um draft; expiração longa
        cacheManager.setCaffeine(Caffeine.newBuilder()
                .maximumSize(10_000)
                .expireAfterWrite(Duration.ofHours(6))
                .recordStats());

        cacheManager.setCacheNames(List.of(
                PlayerCatalogService.CATALOG_CACHE,
                PlayerCatalogService.PLAYER_CACHE));

        return cacheManager;
    }
}
