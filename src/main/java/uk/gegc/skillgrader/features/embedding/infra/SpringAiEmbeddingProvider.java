package uk.gegc.skillgrader.features.embedding.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import uk.gegc.skillgrader.features.embedding.application.EmbeddingProvider;

import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class SpringAiEmbeddingProvider implements EmbeddingProvider {

    private final EmbeddingModel embeddingModel;

    @Override
    public Optional<float[]> embed(String text) {
        if (!StringUtils.hasText(text)) {
            return Optional.empty();
        }
        try {
            float[] vector = embeddingModel.embed(text);
            if (vector == null || vector.length == 0) {
                log.warn("Embedding model returned an empty vector: textLength={}", text.length());
                return Optional.empty();
            }
            return Optional.of(vector);
        } catch (RuntimeException e) {
            log.warn("Embedding request failed, continuing without embedding signal: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
