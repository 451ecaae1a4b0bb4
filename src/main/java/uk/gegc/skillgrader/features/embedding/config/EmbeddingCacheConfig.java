package uk.gegc.skillgrader.features.embedding.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uk.gegc.skillgrader.shared.config.CacheProperties;

@Configuration
public class EmbeddingCacheConfig {

    /**
     * Exemplar and exercise-content embeddings, keyed by exercise id and text prefix.
     */
    @Bean
    public Cache<String, float[]> embeddingCache(CacheProperties cacheProperties) {
        return Caffeine.newBuilder()
                .recordStats()
                .maximumSize(cacheProperties.getEmbeddingMaxSize())
                .expireAfterWrite(cacheProperties.getEmbeddingTtl())
                .build();
    }
}
