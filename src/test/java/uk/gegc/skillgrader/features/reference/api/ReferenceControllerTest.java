package uk.gegc.skillgrader.features.reference.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.skillgrader.features.reference.api.dto.MatchReferencesRequest;
import uk.gegc.skillgrader.features.reference.api.dto.ReferenceAnswerRequest;
import uk.gegc.skillgrader.features.reference.api.dto.SeedingStatusRequest;
import uk.gegc.skillgrader.features.reference.application.ReferenceBankService;
import uk.gegc.skillgrader.features.reference.domain.model.ReferenceInsertOutcome;
import uk.gegc.skillgrader.features.reference.domain.model.ReferencePoolResult;
import uk.gegc.skillgrader.features.reference.domain.model.ReferenceSourceKind;
import uk.gegc.skillgrader.features.reference.domain.model.ReferenceStats;
import uk.gegc.skillgrader.features.reference.domain.model.SeedingStatus;
import uk.gegc.skillgrader.shared.exception.ResourceNotFoundException;
import uk.gegc.skillgrader.shared.exception.ValidationException;

import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ReferenceController.class)
class ReferenceControllerTest {

    @Autowired
    MockMvc mockMvc;

    @Autowired
    ObjectMapper objectMapper;

    @MockitoBean
    ReferenceBankService referenceBankService;

    private static ReferenceAnswerRequest answer(int score) {
        return new ReferenceAnswerRequest("boolean-search-basics", "(java OR kotlin) AND developer", score,
                null, ReferenceSourceKind.CURATED, null, null, null);
    }

    @Test
    @DisplayName("POST /api/v1/references returns 201 when the answer is added")
    void addReference() throws Exception {
        UUID id = UUID.randomUUID();
        when(referenceBankService.addReference(any(ReferenceAnswerRequest.class)))
                .thenReturn(ReferenceInsertOutcome.added(id));

        mockMvc.perform(post("/api/v1/references")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(answer(91))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.added").value(true))
                .andExpect(jsonPath("$.id").value(id.toString()));
    }

    @Test
    @DisplayName("POST /api/v1/references returns 200 with a reason when rejected")
    void addReferenceRejected() throws Exception {
        when(referenceBankService.addReference(any(ReferenceAnswerRequest.class)))
                .thenReturn(ReferenceInsertOutcome.rejected("Score 60 below threshold 80"));

        mockMvc.perform(post("/api/v1/references")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(answer(60))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.added").value(false))
                .andExpect(jsonPath("$.reason").value("Score 60 below threshold 80"));
    }

    @Test
    @DisplayName("POST /api/v1/references validates the score range")
    void addReferenceValidation() throws Exception {
        mockMvc.perform(post("/api/v1/references")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(answer(101))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors[0].field").value("score"));

        verifyNoInteractions(referenceBankService);
    }

    @Test
    @DisplayName("POST /api/v1/references/seed verifies by default")
    void seedReference() throws Exception {
        when(referenceBankService.seedReference(any(ReferenceAnswerRequest.class), eq(true)))
                .thenReturn(ReferenceInsertOutcome.added(UUID.randomUUID()));

        mockMvc.perform(post("/api/v1/references/seed")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(answer(95))))
                .andExpect(status().isCreated());
    }

    @Test
    @DisplayName("POST /api/v1/references/seed?verify=false leaves the answer unverified")
    void seedReferenceUnverified() throws Exception {
        when(referenceBankService.seedReference(any(ReferenceAnswerRequest.class), eq(false)))
                .thenReturn(ReferenceInsertOutcome.added(UUID.randomUUID()));

        mockMvc.perform(post("/api/v1/references/seed")
                        .param("verify", "false")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(answer(95))))
                .andExpect(status().isCreated());

        verify(referenceBankService).seedReference(any(ReferenceAnswerRequest.class), eq(false));
    }

    @Test
    @DisplayName("POST /api/v1/references/match returns the resolved pool")
    void match() throws Exception {
        when(referenceBankService.match(any(MatchReferencesRequest.class))).thenReturn(ReferencePoolResult.empty());

        mockMvc.perform(post("/api/v1/references/match")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new MatchReferencesRequest("boolean-search-basics", "java developer", null, null))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.references.length()").value(0))
                .andExpect(jsonPath("$.failed").value(false));
    }

    @Test
    @DisplayName("POST /api/v1/references/match needs text or an embedding")
    void matchWithoutInput() throws Exception {
        when(referenceBankService.match(any(MatchReferencesRequest.class)))
                .thenThrow(new ValidationException("Either text or embedding must be provided"));

        mockMvc.perform(post("/api/v1/references/match")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new MatchReferencesRequest("boolean-search-basics", null, null, null))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Either text or embedding must be provided"));
    }

    @Test
    @DisplayName("GET /api/v1/references/exercises/{id}/stats returns statistics")
    void stats() throws Exception {
        when(referenceBankService.getStats("boolean-search-basics"))
                .thenReturn(new ReferenceStats(6, 2, 88.5, 81, 97, 4, 1, 1));

        mockMvc.perform(get("/api/v1/references/exercises/{exerciseId}/stats", "boolean-search-basics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalReferences").value(6))
                .andExpect(jsonPath("$.averageScore").value(88.5));
    }

    @Test
    @DisplayName("POST /api/v1/references/{id}/verify returns 204")
    void verifyReference() throws Exception {
        UUID id = UUID.randomUUID();

        mockMvc.perform(post("/api/v1/references/{referenceId}/verify", id))
                .andExpect(status().isNoContent());

        verify(referenceBankService).verify(id);
    }

    @Test
    @DisplayName("DELETE /api/v1/references/{id} maps a missing reference to 404")
    void deactivateMissing() throws Exception {
        UUID id = UUID.randomUUID();
        doThrow(new ResourceNotFoundException("Reference " + id + " not found"))
                .when(referenceBankService).deactivate(id);

        mockMvc.perform(delete("/api/v1/references/{referenceId}", id))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.title").value("Resource Not Found"));
    }

    @Test
    @DisplayName("DELETE /api/v1/references/{id} rejects a malformed id")
    void deactivateMalformedId() throws Exception {
        mockMvc.perform(delete("/api/v1/references/{referenceId}", "not-a-uuid"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.parameter").value("referenceId"));

        verifyNoInteractions(referenceBankService);
    }

    @Test
    @DisplayName("POST /api/v1/references/seeding-status groups exercises by coverage")
    void seedingStatus() throws Exception {
        List<String> ids = List.of("a", "b", "c");
        when(referenceBankService.getSeedingStatus(ids))
                .thenReturn(new SeedingStatus(2, 1, List.of("a"), List.of("b"), List.of("c")));

        mockMvc.perform(post("/api/v1/references/seeding-status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new SeedingStatusRequest(ids))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.seeded").value(2))
                .andExpect(jsonPath("$.notSeeded[0]").value("c"));
    }
}
