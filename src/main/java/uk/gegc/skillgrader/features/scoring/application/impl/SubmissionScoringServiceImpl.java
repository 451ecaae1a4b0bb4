package uk.gegc.skillgrader.features.scoring.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import uk.gegc.skillgrader.features.embedding.application.EmbeddingService;
import uk.gegc.skillgrader.features.ensemble.application.EnsembleScorer;
import uk.gegc.skillgrader.features.ensemble.domain.model.EnsembleResult;
import uk.gegc.skillgrader.features.ensemble.domain.model.EnsembleSignals;
import uk.gegc.skillgrader.features.exercise.application.ExerciseCatalog;
import uk.gegc.skillgrader.features.exercise.domain.model.Exercise;
import uk.gegc.skillgrader.features.integrity.application.IntegrityDetector;
import uk.gegc.skillgrader.features.integrity.domain.model.IntegrityVerdict;
import uk.gegc.skillgrader.features.integrity.domain.model.SubmissionTiming;
import uk.gegc.skillgrader.features.reference.application.ReferenceMatcher;
import uk.gegc.skillgrader.features.reference.domain.model.ReferencePoolResult;
import uk.gegc.skillgrader.features.rubric.application.RubricValidator;
import uk.gegc.skillgrader.features.rubric.domain.model.BreakdownSummary;
import uk.gegc.skillgrader.features.rubric.domain.model.CorrectedScore;
import uk.gegc.skillgrader.features.rubric.domain.model.RubricValidationResult;
import uk.gegc.skillgrader.features.scoring.api.dto.EvaluateSubmissionRequest;
import uk.gegc.skillgrader.features.scoring.application.JudgmentParser;
import uk.gegc.skillgrader.features.scoring.application.ScoringMetricsService;
import uk.gegc.skillgrader.features.scoring.application.SubmissionScoringService;
import uk.gegc.skillgrader.features.scoring.domain.event.SubmissionScoredEvent;
import uk.gegc.skillgrader.features.scoring.domain.model.ParsedJudgment;
import uk.gegc.skillgrader.features.scoring.domain.model.SubmissionEvaluation;
import uk.gegc.skillgrader.features.similarity.application.SimilarityKernel;
import uk.gegc.skillgrader.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class SubmissionScoringServiceImpl implements SubmissionScoringService {

    private final ExerciseCatalog exerciseCatalog;
    private final JudgmentParser judgmentParser;
    private final EmbeddingService embeddingService;
    private final SimilarityKernel similarityKernel;
    private final IntegrityDetector integrityDetector;
    private final RubricValidator rubricValidator;
    private final ReferenceMatcher referenceMatcher;
    private final EnsembleScorer ensembleScorer;
    private final ScoringMetricsService metricsService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Override
    public SubmissionEvaluation evaluate(EvaluateSubmissionRequest request) {
        Exercise exercise = exerciseCatalog.findById(request.exerciseId())
                .orElseThrow(() -> new ResourceNotFoundException("Exercise " + request.exerciseId() + " not found"));

        ParsedJudgment judgment = judgmentParser.parse(request.rawJudgment());

        float[] submissionEmbedding = embeddingService.embed(request.submission()).orElse(null);
        Double embeddingSimilarity = null;
        if (exercise.hasExemplar() && submissionEmbedding != null) {
            Optional<float[]> exemplarEmbedding = embeddingService.embedForExercise(exercise.getId(), exercise.getExemplar());
            if (exemplarEmbedding.isPresent()) {
                embeddingSimilarity = similarityKernel.cosineSimilarity(submissionEmbedding, exemplarEmbedding.get());
            }
        }

        IntegrityVerdict integrity = integrityDetector.detectIntegrity(
                request.submission(),
                exercise.hasExemplar() ? exercise.getExemplar() : null,
                embeddingSimilarity != null ? embeddingSimilarity : 0.0,
                new SubmissionTiming(request.submissionTimeMs(), exercise.getMinExpectedTimeMs())
        );

        RubricValidationResult rubric = null;
        CorrectedScore rubricCorrection = null;
        BreakdownSummary breakdownSummary = null;
        Integer judgmentScore = judgment.score();
        if (judgment.hasScore() && !exercise.getRubric().isEmpty()) {
            rubric = rubricValidator.reconcileRubric(judgment.breakdown(), exercise.getRubric(), judgment.score());
            rubricCorrection = rubricValidator.calculateCorrectedScore(judgment.score(), rubric);
            breakdownSummary = rubricValidator.summarizeBreakdown(rubric.reconciledBreakdown());
            judgmentScore = rubric.correctedScore() != null ? rubric.correctedScore() : rubricCorrection.score();
            log.info("Rubric reconciled: exerciseId={}, valid={}, errors={}, percentage={}, claimed={}, used={}",
                    exercise.getId(), rubric.valid(), rubric.errorCount(), rubric.aggregation().percentage(),
                    judgment.score(), judgmentScore);
        }

        ReferencePoolResult referencePool = submissionEmbedding != null
                ? referenceMatcher.matchReferences(exercise.getId(), submissionEmbedding,
                exercise.getSkillCategory(), exercise.getDifficulty())
                : ReferencePoolResult.empty();
        int referenceAdjustment = referenceMatcher.referenceAdjustment(referencePool);

        EnsembleResult ensemble = ensembleScorer.combineEnsemble(new EnsembleSignals(
                judgmentScore,
                request.validatorScore(),
                embeddingSimilarity,
                exercise.hasExemplar(),
                referenceAdjustment,
                integrity,
                request.consistency()
        ));

        SubmissionEvaluation evaluation = new SubmissionEvaluation(
                exercise.getId(),
                ensemble.finalScore(),
                judgment,
                judgmentScore,
                request.validatorScore(),
                rubric,
                rubricCorrection,
                breakdownSummary,
                integrity,
                embeddingSimilarity,
                referencePool,
                referenceAdjustment,
                ensemble,
                Instant.now(clock)
        );

        metricsService.recordEvaluation(integrity.riskLevel(), judgment.malformed());
        log.info("Submission scored: exerciseId={}, final={}, confidence={}, risk={}, malformedJudgment={}",
                exercise.getId(), ensemble.finalScore(), ensemble.confidence(), integrity.riskLevel(), judgment.malformed());

        eventPublisher.publishEvent(new SubmissionScoredEvent(
                this,
                request.learnerId(),
                request.submission(),
                submissionEmbedding,
                exercise.getSkillCategory(),
                exercise.getDifficulty(),
                evaluation
        ));
        return evaluation;
    }
}
