package uk.gegc.skillgrader.features.reference.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.skillgrader.features.reference.api.dto.MatchReferencesRequest;
import uk.gegc.skillgrader.features.reference.api.dto.ReferenceAnswerRequest;
import uk.gegc.skillgrader.features.reference.api.dto.SeedingStatusRequest;
import uk.gegc.skillgrader.features.reference.application.ReferenceBankService;
import uk.gegc.skillgrader.features.reference.domain.model.ReferenceInsertOutcome;
import uk.gegc.skillgrader.features.reference.domain.model.ReferencePoolResult;
import uk.gegc.skillgrader.features.reference.domain.model.ReferenceStats;
import uk.gegc.skillgrader.features.reference.domain.model.SeedingStatus;

import java.util.UUID;

@Tag(name = "References", description = "Reference answer bank used as comparison pool for new submissions")
@RestController
@RequestMapping("/api/v1/references")
@RequiredArgsConstructor
@Validated
public class ReferenceController {

    private final ReferenceBankService referenceBankService;

    @PostMapping
    @Operation(
            summary = "Add a reference answer",
            description = "Rejected answers (below the quality threshold, near-duplicates, storage failures) return "
                    + "200 with added=false and a reason."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Reference added"),
            @ApiResponse(responseCode = "200", description = "Reference rejected"),
            @ApiResponse(responseCode = "404", description = "Exercise not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<ReferenceInsertOutcome> addReference(@Valid @RequestBody ReferenceAnswerRequest request) {
        return toResponse(referenceBankService.addReference(request));
    }

    @PostMapping("/seed")
    @Operation(summary = "Seed a curated reference answer")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Reference seeded"),
            @ApiResponse(responseCode = "200", description = "Reference rejected"),
            @ApiResponse(responseCode = "404", description = "Exercise not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<ReferenceInsertOutcome> seedReference(
            @Valid @RequestBody ReferenceAnswerRequest request,
            @Parameter(description = "Mark the seeded answer verified straight away")
            @RequestParam(name = "verify", defaultValue = "true") boolean verify) {
        return toResponse(referenceBankService.seedReference(request, verify));
    }

    private static ResponseEntity<ReferenceInsertOutcome> toResponse(ReferenceInsertOutcome outcome) {
        return ResponseEntity.status(outcome.added() ? HttpStatus.CREATED : HttpStatus.OK).body(outcome);
    }

    @PostMapping("/match")
    @Operation(summary = "Resolve the comparison pool for a text or embedding")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Pool resolved"),
            @ApiResponse(responseCode = "400", description = "Neither text nor embedding supplied",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Exercise not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<ReferencePoolResult> match(@Valid @RequestBody MatchReferencesRequest request) {
        return ResponseEntity.ok(referenceBankService.match(request));
    }

    @GetMapping("/exercises/{exerciseId}/stats")
    @Operation(summary = "Reference statistics of an exercise")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Statistics"),
            @ApiResponse(responseCode = "404", description = "Exercise not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<ReferenceStats> getStats(@PathVariable String exerciseId) {
        return ResponseEntity.ok(referenceBankService.getStats(exerciseId));
    }

    @PostMapping("/{referenceId}/verify")
    @Operation(summary = "Mark a reference verified", description = "Learner answers are upgraded to curated.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Reference verified"),
            @ApiResponse(responseCode = "404", description = "Reference not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<Void> verify(@PathVariable UUID referenceId) {
        referenceBankService.verify(referenceId);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{referenceId}")
    @Operation(summary = "Deactivate a reference", description = "Soft delete; the answer is kept but no longer matched.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Reference deactivated"),
            @ApiResponse(responseCode = "404", description = "Reference not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<Void> deactivate(@PathVariable UUID referenceId) {
        referenceBankService.deactivate(referenceId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/seeding-status")
    @Operation(summary = "Group exercises by reference coverage")
    public ResponseEntity<SeedingStatus> seedingStatus(@Valid @RequestBody SeedingStatusRequest request) {
        return ResponseEntity.ok(referenceBankService.getSeedingStatus(request.exerciseIds()));
    }
}
