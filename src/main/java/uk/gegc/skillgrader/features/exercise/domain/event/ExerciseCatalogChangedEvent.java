package uk.gegc.skillgrader.features.exercise.domain.event;

import org.springframework.context.ApplicationEvent;

import java.util.List;

/**
 * Published after exercises are created or their content changes, so derived similarity data can be dropped.
 */
public class ExerciseCatalogChangedEvent extends ApplicationEvent {

    private final List<String> exerciseIds;

    public ExerciseCatalogChangedEvent(Object source, List<String> exerciseIds) {
        super(source);
        this.exerciseIds = List.copyOf(exerciseIds);
    }

    public List<String> getExerciseIds() {
        return exerciseIds;
    }
}
