package uk.gegc.skillgrader.features.reference.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

@Schema(name = "SeedingStatusRequest", description = "Exercises to report reference coverage for; all exercises when empty")
public record SeedingStatusRequest(
        @NotNull(message = "Exercise ids must not be null")
        List<@NotBlank String> exerciseIds
) {
}
