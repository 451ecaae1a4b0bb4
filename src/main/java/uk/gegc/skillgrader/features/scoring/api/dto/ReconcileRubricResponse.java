package uk.gegc.skillgrader.features.scoring.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.skillgrader.features.rubric.domain.model.BreakdownSummary;
import uk.gegc.skillgrader.features.rubric.domain.model.CorrectedScore;
import uk.gegc.skillgrader.features.rubric.domain.model.RubricValidationResult;

@Schema(name = "ReconcileRubricResponse", description = "Reconciled breakdown with the blended score")
public record ReconcileRubricResponse(
        RubricValidationResult validation,
        CorrectedScore correctedScore,
        BreakdownSummary summary
) {
}
