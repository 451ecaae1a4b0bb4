package uk.gegc.skillgrader.features.clustering.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uk.gegc.skillgrader.features.clustering.domain.model.ExerciseSimilarity;
import uk.gegc.skillgrader.shared.config.CacheProperties;

@Configuration
public class ClusteringCacheConfig {

    /**
     * Pairwise exercise similarities keyed by the ordered pair of exercise ids.
     */
    @Bean
    public Cache<String, ExerciseSimilarity> exerciseSimilarityCache(CacheProperties cacheProperties) {
        return Caffeine.newBuilder()
                .recordStats()
                .maximumSize(cacheProperties.getSimilarityMaxSize())
                .expireAfterWrite(cacheProperties.getSimilarityTtl())
                .build();
    }
}
