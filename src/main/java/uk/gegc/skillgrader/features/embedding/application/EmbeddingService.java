package uk.gegc.skillgrader.features.embedding.application;

import com.github.benmanes.caffeine.cache.Cache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import uk.gegc.skillgrader.features.exercise.domain.event.ExerciseCatalogChangedEvent;

import java.util.Optional;

/**
 * Embedding access for scoring. Exercise-bound texts (exemplars, exercise content) go through the
 * bounded cache; learner submissions are always embedded fresh.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmbeddingService {

    static final int CACHE_KEY_PREFIX_LENGTH = 50;

    private final EmbeddingProvider embeddingProvider;
    private final Cache<String, float[]> embeddingCache;

    public Optional<float[]> embed(String text) {
        return embeddingProvider.embed(text);
    }

    public Optional<float[]> embedForExercise(String exerciseId, String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String key = cacheKey(exerciseId, text);
        // the cache keeps its own copy; callers always receive a fresh array
        float[] cached = embeddingCache.getIfPresent(key);
        if (cached != null) {
            return Optional.of(cached.clone());
        }
        Optional<float[]> computed = embeddingProvider.embed(text);
        computed.ifPresent(vector -> embeddingCache.put(key, vector.clone()));
        return computed;
    }

    @EventListener
    public void onCatalogChanged(ExerciseCatalogChangedEvent event) {
        // keys are prefixed by exercise id
        embeddingCache.asMap().keySet().removeIf(key -> event.getExerciseIds().stream()
                .anyMatch(id -> key.startsWith(id + ":")));
        log.debug("Embedding cache invalidated: exerciseIds={}", event.getExerciseIds());
    }

    static String cacheKey(String exerciseId, String text) {
        String prefix = text.length() > CACHE_KEY_PREFIX_LENGTH ? text.substring(0, CACHE_KEY_PREFIX_LENGTH) : text;
        return exerciseId + ":" + prefix;
    }
}
