package uk.gegc.skillgrader.features.exercise.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import uk.gegc.skillgrader.features.rubric.domain.model.RubricCriterion;
import uk.gegc.skillgrader.shared.persistence.EmbeddingVectorConverter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Getter
@Setter
@Table(name = "exercises")
public class Exercise {

    @Id
    @Column(name = "id", length = 100, updatable = false, nullable = false)
    private String id;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "description", columnDefinition = "TEXT", nullable = false)
    private String description;

    @Column(name = "skill_category", nullable = false, length = 100)
    private String skillCategory;

    @Enumerated(EnumType.STRING)
    @Column(name = "difficulty", nullable = false, length = 10)
    private Difficulty difficulty = Difficulty.MEDIUM;

    @Column(name = "exemplar", columnDefinition = "TEXT")
    private String exemplar;

    @Convert(converter = RubricCriteriaConverter.class)
    @Column(name = "rubric", columnDefinition = "TEXT", nullable = false)
    private List<RubricCriterion> rubric = new ArrayList<>();

    @Convert(converter = EmbeddingVectorConverter.class)
    @Column(name = "content_embedding", columnDefinition = "TEXT")
    private float[] contentEmbedding;

    @Column(name = "min_expected_time_ms")
    private Long minExpectedTimeMs;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public boolean hasExemplar() {
        return exemplar != null && !exemplar.isBlank();
    }

    /**
     * Text used to embed the exercise for cross-exercise comparison.
     */
    public String contentText() {
        return title + "\n" + description;
    }
}
