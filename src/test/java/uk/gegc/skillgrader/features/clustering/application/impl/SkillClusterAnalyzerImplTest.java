package uk.gegc.skillgrader.features.clustering.application.impl;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import uk.gegc.skillgrader.BaseUnitTest;
import uk.gegc.skillgrader.features.clustering.config.ClusteringProperties;
import uk.gegc.skillgrader.features.clustering.domain.model.ClusterInsight;
import uk.gegc.skillgrader.features.clustering.domain.model.ClusterProgress;
import uk.gegc.skillgrader.features.clustering.domain.model.ExerciseSimilarity;
import uk.gegc.skillgrader.features.clustering.domain.model.InsightType;
import uk.gegc.skillgrader.features.clustering.domain.model.RelatedExercise;
import uk.gegc.skillgrader.features.clustering.domain.model.RelationshipType;
import uk.gegc.skillgrader.features.clustering.domain.model.ScoreTrend;
import uk.gegc.skillgrader.features.clustering.domain.model.SkillCluster;
import uk.gegc.skillgrader.features.embedding.application.EmbeddingService;
import uk.gegc.skillgrader.features.exercise.application.ExerciseCatalog;
import uk.gegc.skillgrader.features.exercise.domain.event.ExerciseCatalogChangedEvent;
import uk.gegc.skillgrader.features.exercise.domain.model.Difficulty;
import uk.gegc.skillgrader.features.exercise.domain.model.Exercise;
import uk.gegc.skillgrader.features.exercise.domain.model.ExerciseEmbeddingRecord;
import uk.gegc.skillgrader.features.similarity.application.SimilarityKernel;
import uk.gegc.skillgrader.shared.exception.ResourceNotFoundException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("SkillClusterAnalyzerImpl")
class SkillClusterAnalyzerImplTest extends BaseUnitTest {

    @Mock
    private ExerciseCatalog exerciseCatalog;

    @Mock
    private EmbeddingService embeddingService;

    private ClusteringProperties properties;
    private SkillClusterAnalyzerImpl analyzer;

    @BeforeEach
    void setUp() {
        properties = new ClusteringProperties();
        analyzer = new SkillClusterAnalyzerImpl(exerciseCatalog, embeddingService, new SimilarityKernel(), properties,
                Caffeine.newBuilder().maximumSize(100).build());
    }

    private static ExerciseEmbeddingRecord record(String id, String skill, Difficulty difficulty, float... embedding) {
        return new ExerciseEmbeddingRecord(id, skill, difficulty, embedding, List.of());
    }

    private static Exercise exercise(String id, String skill, Difficulty difficulty, float... embedding) {
        Exercise exercise = new Exercise();
        exercise.setId(id);
        exercise.setTitle("Exercise " + id);
        exercise.setDescription("Practice task");
        exercise.setSkillCategory(skill);
        exercise.setDifficulty(difficulty);
        exercise.setContentEmbedding(embedding.length == 0 ? null : embedding);
        return exercise;
    }

    private static RelatedExercise related(String id, String skill, RelationshipType type) {
        return new RelatedExercise(id, "Exercise " + id, skill, Difficulty.MEDIUM, 0.8, type);
    }

    @Nested
    @DisplayName("computeExerciseSimilarity")
    class Similarity {

        @Test
        @DisplayName("identical exercises in the same skill and tier are fully similar")
        void identical() {
            ExerciseSimilarity similarity = analyzer.computeExerciseSimilarity(
                    record("a", "boolean", Difficulty.EASY, 1f, 0f),
                    record("b", "Boolean", Difficulty.EASY, 1f, 0f));

            assertEquals(1.0, similarity.overall(), 1e-9);
            assertEquals(1.0, similarity.skill());
            assertEquals(1.0, similarity.difficulty());
        }

        @Test
        @DisplayName("different skill two tiers apart with unrelated content")
        void distant() {
            ExerciseSimilarity similarity = analyzer.computeExerciseSimilarity(
                    record("a", "boolean", Difficulty.EASY, 1f, 0f),
                    record("b", "outreach", Difficulty.HARD, 0f, 1f));

            // 0 * 0.50 + 0.3 * 0.35 + 0.4 * 0.15
            assertEquals(0.165, similarity.overall(), 1e-9);
            assertEquals(0.3, similarity.skill());
            assertEquals(0.4, similarity.difficulty());
        }

        @Test
        @DisplayName("adjacent tiers score 0.7 on difficulty")
        void adjacentTiers() {
            ExerciseSimilarity similarity = analyzer.computeExerciseSimilarity(
                    record("a", "boolean", Difficulty.EASY, 1f, 0f),
                    record("b", "boolean", Difficulty.MEDIUM, 1f, 0f));

            assertEquals(0.7, similarity.difficulty());
        }

        @Test
        @DisplayName("results are cached per unordered pair until invalidated")
        void cachedPerPair() {
            ExerciseEmbeddingRecord a = record("a", "boolean", Difficulty.EASY, 1f, 0f);
            ExerciseEmbeddingRecord b = record("b", "boolean", Difficulty.HARD, 0.6f, 0.8f);

            ExerciseSimilarity first = analyzer.computeExerciseSimilarity(a, b);

            assertSame(first, analyzer.computeExerciseSimilarity(b, a));
            analyzer.onCatalogChanged(new ExerciseCatalogChangedEvent(this, List.of("a")));
            assertNotSame(first, analyzer.computeExerciseSimilarity(a, b));
        }

        @Test
        @DisplayName("pair key does not depend on argument order")
        void pairKey() {
            assertEquals(SkillClusterAnalyzerImpl.pairKey("x", "a"), SkillClusterAnalyzerImpl.pairKey("a", "x"));
            assertEquals("a:x", SkillClusterAnalyzerImpl.pairKey("x", "a"));
        }
    }

    @Nested
    @DisplayName("determineRelationship")
    class Relationship {

        private final ExerciseEmbeddingRecord medium = record("m", "boolean", Difficulty.MEDIUM);

        @Test
        @DisplayName("same skill is ordered by difficulty")
        void sameSkill() {
            assertEquals(RelationshipType.PREREQUISITE,
                    analyzer.determineRelationship(medium, record("e", "boolean", Difficulty.EASY), 0.1));
            assertEquals(RelationshipType.ADVANCED,
                    analyzer.determineRelationship(medium, record("h", "boolean", Difficulty.HARD), 0.1));
            assertEquals(RelationshipType.PARALLEL,
                    analyzer.determineRelationship(medium, record("p", "BOOLEAN", Difficulty.MEDIUM), 0.1));
        }

        @Test
        @DisplayName("different skill depends on content similarity")
        void differentSkill() {
            ExerciseEmbeddingRecord other = record("o", "outreach", Difficulty.HARD);

            assertEquals(RelationshipType.VARIATION, analyzer.determineRelationship(medium, other, 0.8));
            assertEquals(RelationshipType.RELATED, analyzer.determineRelationship(medium, other, 0.7));
        }
    }

    @Nested
    @DisplayName("findRelatedExercises")
    class Related {

        @Test
        @DisplayName("returns exercises above the minimum, best first, excluding the source")
        void ranksAndFilters() {
            Exercise source = exercise("a", "boolean", Difficulty.EASY, 1f, 0f);
            Exercise harder = exercise("b", "boolean", Difficulty.HARD, 1f, 0f);
            Exercise otherSkill = exercise("c", "outreach", Difficulty.EASY, 0f, 1f);
            Exercise medium = exercise("d", "boolean", Difficulty.MEDIUM, 0.6f, 0.8f);
            when(exerciseCatalog.findById("a")).thenReturn(Optional.of(source));
            when(exerciseCatalog.findAll()).thenReturn(List.of(source, harder, otherSkill, medium));

            List<RelatedExercise> related = analyzer.findRelatedExercises("a", 5);

            assertThat(related).extracting(RelatedExercise::exerciseId).containsExactly("b", "d");
            // 1.0 * 0.50 + 1.0 * 0.35 + 0.4 * 0.15
            assertEquals(0.91, related.get(0).similarity());
            assertThat(related).extracting(RelatedExercise::relationshipType)
                    .containsOnly(RelationshipType.ADVANCED);
            verifyNoInteractions(embeddingService);
        }

        @Test
        @DisplayName("limit and explicit minimum are honoured")
        void limitAndMinimum() {
            Exercise source = exercise("a", "boolean", Difficulty.EASY, 1f, 0f);
            when(exerciseCatalog.findById("a")).thenReturn(Optional.of(source));
            when(exerciseCatalog.findAll()).thenReturn(List.of(
                    source,
                    exercise("b", "boolean", Difficulty.HARD, 1f, 0f),
                    exercise("c", "outreach", Difficulty.EASY, 0f, 1f),
                    exercise("d", "boolean", Difficulty.MEDIUM, 0.6f, 0.8f)
            ));

            assertThat(analyzer.findRelatedExercises("a", 1, 0.0)).extracting(RelatedExercise::exerciseId)
                    .containsExactly("b");
            assertThat(analyzer.findRelatedExercises("a", 10, 0.0)).hasSize(3);
        }

        @Test
        @DisplayName("similarity computed during an embedding outage is not kept after recovery")
        void outageNotCached() {
            Exercise source = exercise("a", "boolean", Difficulty.EASY);
            Exercise candidate = exercise("b", "outreach", Difficulty.EASY);
            when(exerciseCatalog.findById("a")).thenReturn(Optional.of(source));
            when(exerciseCatalog.findAll()).thenReturn(List.of(source, candidate));
            when(embeddingService.embedForExercise(eq("a"), anyString()))
                    .thenReturn(Optional.empty(), Optional.of(new float[]{1f, 0f}));
            when(embeddingService.embedForExercise(eq("b"), anyString()))
                    .thenReturn(Optional.empty(), Optional.of(new float[]{1f, 0f}));

            List<RelatedExercise> duringOutage = analyzer.findRelatedExercises("a", 5, 0.0);
            List<RelatedExercise> afterRecovery = analyzer.findRelatedExercises("a", 5, 0.0);

            // 0.3 * 0.35 + 1.0 * 0.15, then with full content similarity on top
            assertEquals(0.255, duringOutage.get(0).similarity());
            assertEquals(RelationshipType.RELATED, duringOutage.get(0).relationshipType());
            assertEquals(0.755, afterRecovery.get(0).similarity());
            assertEquals(RelationshipType.VARIATION, afterRecovery.get(0).relationshipType());
        }

        @Test
        @DisplayName("unknown exercise is reported as not found")
        void unknownExercise() {
            when(exerciseCatalog.findById("missing")).thenReturn(Optional.empty());

            assertThrows(ResourceNotFoundException.class, () -> analyzer.findRelatedExercises("missing", 5));
        }
    }

    @Nested
    @DisplayName("generateInsights")
    class Insights {

        @Test
        @DisplayName("strong, improving learner gets mastery, growth, progress and challenge insights")
        void strongLearner() {
            List<RelatedExercise> related = List.of(
                    related("b", "boolean", RelationshipType.ADVANCED),
                    related("c", "outreach", RelationshipType.VARIATION),
                    related("d", "boolean", RelationshipType.ADVANCED),
                    related("e", "boolean", RelationshipType.ADVANCED)
            );
            ClusterProgress progress = new ClusterProgress("skill:boolean", "boolean", 2, 4, 78.5, 90,
                    ScoreTrend.IMPROVING, 12.0);

            List<ClusterInsight> insights = analyzer.generateInsights(90, related, progress);

            assertThat(insights).extracting(ClusterInsight::title).containsExactly(
                    "Skill Mastery", "Skill Growth", "Cluster Progress", "Ready for More Challenge");
            assertEquals("Excellent! Your score of 90 shows strong mastery in this skill area.", insights.get(0).message());
            assertEquals(List.of("b", "c", "d"), insights.get(0).relatedExerciseIds());
            assertEquals("You're improving in boolean exercises! Your average has increased by 12%.",
                    insights.get(1).message());
            assertEquals(12.0, insights.get(1).metrics().improvementPercent());
            assertEquals("You've completed 2/4 exercises in this skill cluster. 2 more to go!", insights.get(2).message());
            assertEquals(List.of("b", "d", "e"), insights.get(2).relatedExerciseIds());
            assertEquals(List.of("b", "d"), insights.get(3).relatedExerciseIds());
        }

        @Test
        @DisplayName("struggling learner is pointed at prerequisites")
        void strugglingLearner() {
            List<RelatedExercise> related = List.of(related("a", "boolean", RelationshipType.PREREQUISITE));
            ClusterProgress progress = new ClusterProgress("skill:boolean", "boolean", 4, 4, 58.0, 80,
                    ScoreTrend.DECLINING, -10.0);

            List<ClusterInsight> insights = analyzer.generateInsights(55, related, progress);

            assertThat(insights).extracting(ClusterInsight::type)
                    .containsExactly(InsightType.STRUGGLE, InsightType.RECOMMENDATION);
            assertEquals("Area for Focus", insights.get(0).title());
            assertEquals(80, insights.get(0).metrics().previousScore());
            assertEquals("Build Foundation First", insights.get(1).title());
        }

        @Test
        @DisplayName("a declining trend needs enough attempts before it is reported")
        void decliningNeedsAttempts() {
            ClusterProgress progress = new ClusterProgress("skill:boolean", "boolean", 2, 2, 60.0, 70,
                    ScoreTrend.DECLINING, -5.0);

            assertThat(analyzer.generateInsights(60, List.of(), progress)).isEmpty();
        }

        @Test
        @DisplayName("without progress only score-based insights are produced")
        void withoutProgress() {
            assertThat(analyzer.generateInsights(72, null, null)).isEmpty();
            assertThat(analyzer.generateInsights(86, null, null)).extracting(ClusterInsight::type)
                    .containsExactly(InsightType.MASTERY);
        }
    }

    @Nested
    @DisplayName("clusters and tags")
    class ClustersAndTags {

        @Test
        @DisplayName("groups exercises by skill regardless of case")
        void buildsClusters() {
            List<SkillCluster> clusters = analyzer.buildSkillClusters(List.of(
                    exercise("b2", "Boolean", Difficulty.HARD),
                    exercise("o1", "outreach", Difficulty.MEDIUM),
                    exercise("b1", "boolean", Difficulty.EASY)
            ));

            assertEquals(2, clusters.size());
            SkillCluster booleanCluster = clusters.get(0);
            assertEquals("skill:boolean", booleanCluster.clusterId());
            assertEquals("Boolean Skills", booleanCluster.clusterName());
            assertEquals(List.of("b1", "b2"), booleanCluster.exerciseIds());
            assertEquals(2.0, booleanCluster.averageDifficulty());
            assertEquals(2, booleanCluster.exerciseCount());
            assertEquals("Outreach Skills", clusters.get(1).clusterName());
        }

        @Test
        @DisplayName("derives tags from skill category and exercise text")
        void extractsTags() {
            Exercise exercise = exercise("x", "boolean", Difficulty.MEDIUM);
            exercise.setTitle("LinkedIn X-Ray Search");
            exercise.setDescription("Find candidate profiles with boolean operators");

            assertThat(analyzer.extractSkillTags(exercise))
                    .containsExactly("boolean", "boolean-operators", "linkedin", "x-ray", "persona");
        }

        @Test
        @DisplayName("an invalid tag pattern is skipped")
        void invalidPattern() {
            Map<String, String> patterns = new LinkedHashMap<>();
            patterns.put("broken", "(unclosed");
            patterns.put("github", "\\bgithub\\b");
            properties.setSkillTagPatterns(patterns);
            Exercise exercise = exercise("x", "sourcing", Difficulty.MEDIUM);
            exercise.setTitle("GitHub sourcing");

            assertThat(analyzer.extractSkillTags(exercise)).containsExactly("sourcing", "github");
        }

        @Test
        @DisplayName("exercises without a stored embedding are embedded from their content")
        void describeEmbedsContent() {
            Exercise exercise = exercise("x", "boolean", Difficulty.EASY);
            float[] vector = {0.5f, 0.5f};
            when(embeddingService.embedForExercise("x", exercise.contentText())).thenReturn(Optional.of(vector));

            ExerciseEmbeddingRecord record = analyzer.describe(exercise);

            assertSame(vector, record.contentEmbedding());
            assertEquals("boolean", record.skillCategory());
        }
    }
}
