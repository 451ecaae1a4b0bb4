package uk.gegc.skillgrader.features.clustering.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.skillgrader.features.clustering.api.dto.ClusterInsightsRequest;
import uk.gegc.skillgrader.features.clustering.api.dto.ExerciseComparisonRequest;
import uk.gegc.skillgrader.features.clustering.api.dto.ExerciseComparisonResponse;
import uk.gegc.skillgrader.features.clustering.application.ClusterQueryService;
import uk.gegc.skillgrader.features.clustering.domain.model.ClusterInsight;
import uk.gegc.skillgrader.features.clustering.domain.model.RelatedExercise;
import uk.gegc.skillgrader.features.clustering.domain.model.SkillCluster;

import java.util.List;

@Tag(name = "Clusters", description = "Exercise similarity, skill clusters and progression insights")
@RestController
@RequestMapping("/api/v1/clusters")
@RequiredArgsConstructor
@Validated
public class ClusterController {

    private final ClusterQueryService clusterQueryService;

    @GetMapping
    @Operation(summary = "List skill clusters", description = "Exercises grouped by skill category with average difficulty.")
    public ResponseEntity<List<SkillCluster>> clusters() {
        return ResponseEntity.ok(clusterQueryService.clusters());
    }

    @PostMapping("/similarity")
    @Operation(summary = "Compare two exercises")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Similarity and relationship"),
            @ApiResponse(responseCode = "404", description = "Exercise not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<ExerciseComparisonResponse> compare(@Valid @RequestBody ExerciseComparisonRequest request) {
        return ResponseEntity.ok(clusterQueryService.compare(request.exerciseIdA(), request.exerciseIdB()));
    }

    @GetMapping("/exercises/{exerciseId}/related")
    @Operation(summary = "Exercises related to an exercise", description = "Sorted by overall similarity, highest first.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Related exercises"),
            @ApiResponse(responseCode = "400", description = "Invalid query parameters",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Exercise not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<List<RelatedExercise>> related(
            @PathVariable String exerciseId,
            @Parameter(description = "Maximum number of results", example = "5")
            @RequestParam(required = false) @Min(1) @Max(50) Integer limit,
            @Parameter(description = "Minimum overall similarity", example = "0.5")
            @RequestParam(required = false) @DecimalMin("0.0") @DecimalMax("1.0") Double minSimilarity) {
        return ResponseEntity.ok(clusterQueryService.related(exerciseId, limit, minSimilarity));
    }

    @PostMapping("/insights")
    @Operation(summary = "Progression insights for a score just achieved")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Insights, possibly empty"),
            @ApiResponse(responseCode = "404", description = "Exercise not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<List<ClusterInsight>> insights(@Valid @RequestBody ClusterInsightsRequest request) {
        return ResponseEntity.ok(clusterQueryService.insights(request));
    }
}
