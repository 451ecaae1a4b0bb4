package uk.gegc.skillgrader.features.scoring.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.skillgrader.features.ensemble.application.EnsembleScorer;
import uk.gegc.skillgrader.features.ensemble.domain.model.EnsembleResult;
import uk.gegc.skillgrader.features.integrity.application.IntegrityDetector;
import uk.gegc.skillgrader.features.integrity.domain.model.IntegrityVerdict;
import uk.gegc.skillgrader.features.rubric.application.RubricValidator;
import uk.gegc.skillgrader.features.rubric.domain.model.CorrectedScore;
import uk.gegc.skillgrader.features.rubric.domain.model.RubricValidationResult;
import uk.gegc.skillgrader.features.scoring.api.dto.EnsembleRequest;
import uk.gegc.skillgrader.features.scoring.api.dto.EvaluateSubmissionRequest;
import uk.gegc.skillgrader.features.scoring.api.dto.IntegrityCheckRequest;
import uk.gegc.skillgrader.features.scoring.api.dto.ReconcileRubricRequest;
import uk.gegc.skillgrader.features.scoring.api.dto.ReconcileRubricResponse;
import uk.gegc.skillgrader.features.scoring.application.SubmissionScoringService;
import uk.gegc.skillgrader.features.scoring.domain.model.SubmissionEvaluation;

@Tag(name = "Scoring", description = "Submission scoring pipeline and its individual stages")
@RestController
@RequestMapping("/api/v1/scoring")
@RequiredArgsConstructor
@Validated
public class ScoringController {

    private final SubmissionScoringService submissionScoringService;
    private final RubricValidator rubricValidator;
    private final IntegrityDetector integrityDetector;
    private final EnsembleScorer ensembleScorer;

    @PostMapping("/evaluate")
    @Operation(
            summary = "Score a submission",
            description = "Parses the judge output, reconciles its rubric breakdown, checks integrity, resolves the "
                    + "reference pool and combines all signals into a final score with confidence."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Submission scored",
                    content = @Content(schema = @Schema(implementation = SubmissionEvaluation.class))),
            @ApiResponse(responseCode = "400", description = "Invalid request",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Exercise not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<SubmissionEvaluation> evaluate(@Valid @RequestBody EvaluateSubmissionRequest request) {
        return ResponseEntity.ok(submissionScoringService.evaluate(request));
    }

    @PostMapping("/rubric/reconcile")
    @Operation(summary = "Reconcile a judge breakdown against a rubric")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Breakdown reconciled"),
            @ApiResponse(responseCode = "400", description = "Invalid request",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<ReconcileRubricResponse> reconcileRubric(@Valid @RequestBody ReconcileRubricRequest request) {
        RubricValidationResult result = request.config() != null
                ? rubricValidator.reconcileRubric(request.breakdown(), request.rubric(), request.claimedScore(), request.config())
                : rubricValidator.reconcileRubric(request.breakdown(), request.rubric(), request.claimedScore());
        CorrectedScore corrected = rubricValidator.calculateCorrectedScore(request.claimedScore(), result);
        return ResponseEntity.ok(new ReconcileRubricResponse(
                result,
                corrected,
                rubricValidator.summarizeBreakdown(result.reconciledBreakdown())
        ));
    }

    @PostMapping("/integrity")
    @Operation(summary = "Check a submission for copying and low-effort signals")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Integrity verdict"),
            @ApiResponse(responseCode = "400", description = "Invalid request",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<IntegrityVerdict> checkIntegrity(@Valid @RequestBody IntegrityCheckRequest request) {
        return ResponseEntity.ok(integrityDetector.detectIntegrity(
                request.submission(),
                request.exemplar(),
                request.embeddingSimilarity(),
                request.timing()
        ));
    }

    @PostMapping("/ensemble")
    @Operation(summary = "Combine scoring signals into a final score")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Combined score"),
            @ApiResponse(responseCode = "400", description = "Invalid request",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<EnsembleResult> combine(@Valid @RequestBody EnsembleRequest request) {
        EnsembleResult result = request.weights() != null
                ? ensembleScorer.combineEnsemble(request.toSignals(), request.weights())
                : ensembleScorer.combineEnsemble(request.toSignals());
        return ResponseEntity.ok(result);
    }
}
