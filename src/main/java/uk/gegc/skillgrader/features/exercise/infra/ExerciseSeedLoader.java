package uk.gegc.skillgrader.features.exercise.infra;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import uk.gegc.skillgrader.features.exercise.config.SeedProperties;
import uk.gegc.skillgrader.features.exercise.domain.event.ExerciseCatalogChangedEvent;
import uk.gegc.skillgrader.features.exercise.domain.model.Difficulty;
import uk.gegc.skillgrader.features.exercise.domain.model.Exercise;
import uk.gegc.skillgrader.features.exercise.domain.repository.ExerciseRepository;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Seeds the exercise catalog at startup from a JSON file. Existing exercises are left untouched.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExerciseSeedLoader implements CommandLineRunner {

    private static final TypeReference<List<ExerciseSeed>> SEED_LIST = new TypeReference<>() {
    };

    private final ExerciseRepository exerciseRepository;
    private final SeedProperties seedProperties;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final ApplicationEventPublisher eventPublisher;

    @Override
    public void run(String... args) {
        if (!seedProperties.isEnabled()) {
            log.info("ExerciseSeedLoader: seeding disabled");
            return;
        }
        try {
            List<String> inserted = seed(readSeeds());
            log.info("ExerciseSeedLoader: inserted={} total={}", inserted.size(), exerciseRepository.count());
        } catch (Exception e) {
            log.warn("ExerciseSeedLoader encountered an error while seeding exercises: {}", e.getMessage());
        }
    }

    List<String> seed(List<ExerciseSeed> seeds) {
        List<String> inserted = new ArrayList<>();
        for (ExerciseSeed seed : seeds) {
            if (!StringUtils.hasText(seed.id()) || exerciseRepository.existsById(seed.id())) {
                continue;
            }
            exerciseRepository.save(toExercise(seed));
            inserted.add(seed.id());
        }
        if (!inserted.isEmpty()) {
            eventPublisher.publishEvent(new ExerciseCatalogChangedEvent(this, inserted));
        }
        return inserted;
    }

    private List<ExerciseSeed> readSeeds() throws IOException {
        Resource resource = resourceLoader.getResource(seedProperties.getExercisesLocation());
        if (!resource.exists()) {
            log.warn("ExerciseSeedLoader: seed file not found at {}", seedProperties.getExercisesLocation());
            return List.of();
        }
        try (InputStream in = resource.getInputStream()) {
            List<ExerciseSeed> seeds = objectMapper.readValue(in, SEED_LIST);
            return seeds != null ? seeds : List.of();
        }
    }

    private static Exercise toExercise(ExerciseSeed seed) {
        Exercise exercise = new Exercise();
        exercise.setId(seed.id());
        exercise.setTitle(seed.title());
        exercise.setDescription(seed.description() != null ? seed.description() : "");
        exercise.setSkillCategory(seed.skillCategory());
        exercise.setDifficulty(seed.difficulty() != null ? seed.difficulty() : Difficulty.MEDIUM);
        exercise.setExemplar(seed.exemplar());
        exercise.setRubric(seed.rubric() != null ? new ArrayList<>(seed.rubric()) : new ArrayList<>());
        exercise.setMinExpectedTimeMs(seed.minExpectedTimeMs());
        return exercise;
    }
}
