package uk.gegc.skillgrader.features.reference.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import uk.gegc.skillgrader.features.exercise.domain.model.Difficulty;
import uk.gegc.skillgrader.shared.persistence.EmbeddingVectorConverter;

import java.time.Instant;
import java.util.UUID;

/**
 * A previously scored, high-quality answer kept for similarity comparison.
 * Rows are never hard-deleted by the engine; {@code active=false} is a soft delete.
 */
@Entity
@Getter
@Setter
@Table(
        name = "reference_answers",
        indexes = {
                @Index(name = "idx_reference_exercise_active", columnList = "exercise_id, active"),
                @Index(name = "idx_reference_skill_active", columnList = "skill_category, active")
        }
)
public class ReferenceAnswer {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "exercise_id", nullable = false, length = 100)
    private String exerciseId;

    @Column(name = "submission_text", columnDefinition = "TEXT", nullable = false)
    private String submissionText;

    @Column(name = "score", nullable = false)
    private Integer score;

    @Convert(converter = EmbeddingVectorConverter.class)
    @Column(name = "embedding", columnDefinition = "TEXT", nullable = false)
    private float[] embedding;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_kind", nullable = false, length = 20)
    private ReferenceSourceKind sourceKind = ReferenceSourceKind.LEARNER;

    @Column(name = "verified", nullable = false)
    private Boolean verified = Boolean.FALSE;

    @Column(name = "active", nullable = false)
    private Boolean active = Boolean.TRUE;

    @Column(name = "skill_category", length = 100)
    private String skillCategory;

    @Enumerated(EnumType.STRING)
    @Column(name = "difficulty", length = 10)
    private Difficulty difficulty;

    @Column(name = "judgment_score")
    private Integer judgmentScore;

    @Column(name = "validator_score")
    private Integer validatorScore;

    @Column(name = "embedding_similarity")
    private Double embeddingSimilarity;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public boolean isVerified() {
        return Boolean.TRUE.equals(verified);
    }

    public boolean isActive() {
        return Boolean.TRUE.equals(active);
    }
}
