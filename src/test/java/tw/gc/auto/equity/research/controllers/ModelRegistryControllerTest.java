package tw.gc.auto.equity.research.controllers;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import tw.gc.auto.equity.research.exceptions.RegistryIntegrityException;
import tw.gc.auto.equity.research.exceptions.RegistryNotFoundException;
import tw.gc.auto.equity.research.registry.Artifact;
import tw.gc.auto.equity.research.registry.ArtifactMetadata;
import tw.gc.auto.equity.research.registry.ArtifactRegistry;
import tw.gc.auto.equity.research.registry.TrainingWindowBounds;
import tw.gc.auto.equity.research.registry.VersionSelector;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ModelRegistryController.class)
class ModelRegistryControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ArtifactRegistry artifactRegistry;

    private static ArtifactMetadata metadata(int version) {
        LocalDate start = LocalDate.of(2024, 1, 2);
        return ArtifactMetadata.builder()
                .family("tree-ensemble")
                .version(version)
                .schemaVersion("v1")
                .trainingWindow(new TrainingWindowBounds(version - 1, 0, 200, 201, 221,
                        start, start.plusDays(199), start.plusDays(201), start.plusDays(220)))
                .metricsSnapshot(Map.of("mse", 0.0004))
                .contentHash("sha256:abc" + version)
                .createdAt(Instant.parse("2025-06-30T08:00:00Z"))
                .sizeBytes(3)
                .modelFamily("tree-ensemble")
                .featureColumns(List.of("feat_momentum"))
                .targetColumn("target_ret_5d")
                .seed(42L)
                .build();
    }

    @Test
    void families_shouldListFamilies() throws Exception {
        when(artifactRegistry.families()).thenReturn(List.of("baseline", "tree-ensemble"));

        mockMvc.perform(get("/api/models"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[1]").value("tree-ensemble"));
    }

    @Test
    void versions_shouldListMetadataInOrder() throws Exception {
        when(artifactRegistry.list("tree-ensemble")).thenReturn(List.of(metadata(1), metadata(2)));

        mockMvc.perform(get("/api/models/tree-ensemble"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].version").value(1))
                .andExpect(jsonPath("$[1].contentHash").value("sha256:abc2"))
                .andExpect(jsonPath("$[1].metricsSnapshot.mse").value(0.0004));
    }

    @Test
    void metadata_shouldResolveLatest() throws Exception {
        when(artifactRegistry.get("tree-ensemble", VersionSelector.latest()))
                .thenReturn(new Artifact(metadata(2), new byte[] {1, 2, 3}));

        mockMvc.perform(get("/api/models/tree-ensemble/latest"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.version").value(2))
                .andExpect(jsonPath("$.schemaVersion").value("v1"))
                .andExpect(jsonPath("$.trainingWindow.trainLastDate").value("2024-07-19"))
                .andExpect(jsonPath("$.createdAt").value("2025-06-30T08:00:00Z"));
    }

    @Test
    void payload_shouldReturnExactBytes() throws Exception {
        when(artifactRegistry.get("tree-ensemble", VersionSelector.of(1)))
                .thenReturn(new Artifact(metadata(1), new byte[] {1, 2, 3}));

        mockMvc.perform(get("/api/models/tree-ensemble/1/payload"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_OCTET_STREAM))
                .andExpect(header().string("X-Content-Hash", "sha256:abc1"))
                .andExpect(content().bytes(new byte[] {1, 2, 3}));
    }

    @Test
    void metadata_shouldReturnNotFoundForUnknownVersion() throws Exception {
        when(artifactRegistry.get(eq("tree-ensemble"), any()))
                .thenThrow(RegistryNotFoundException.unknownVersion("tree-ensemble", 9));

        mockMvc.perform(get("/api/models/tree-ensemble/9"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("artifact_not_found"))
                .andExpect(jsonPath("$.family").value("tree-ensemble"));
    }

    @Test
    void payload_shouldReportIntegrityFailure() throws Exception {
        when(artifactRegistry.get("tree-ensemble", VersionSelector.of(3)))
                .thenThrow(new RegistryIntegrityException("tree-ensemble", 3, "sha256:abc3", "sha256:fff"));

        mockMvc.perform(get("/api/models/tree-ensemble/3/payload"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("integrity_error"))
                .andExpect(jsonPath("$.family").value("tree-ensemble"))
                .andExpect(jsonPath("$.version").value(3));
    }

    @Test
    void metadata_shouldRejectMalformedVersion() throws Exception {
        mockMvc.perform(get("/api/models/tree-ensemble/v2"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("bad_request"));

        verify(artifactRegistry, never()).get(anyString(), any());
    }
}
