package tw.gc.auto.equity.research.controllers;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tw.gc.auto.equity.research.registry.Artifact;
import tw.gc.auto.equity.research.registry.ArtifactMetadata;
import tw.gc.auto.equity.research.registry.ArtifactRegistry;
import tw.gc.auto.equity.research.registry.VersionSelector;

import java.util.List;

/**
 * Read-only inspection of the model artifact registry. Artifacts are written by walk-forward
 * runs, never over HTTP.
 */
@RestController
@RequestMapping("/api/models")
@RequiredArgsConstructor
@Slf4j
public class ModelRegistryController {

    private final ArtifactRegistry artifactRegistry;

    @GetMapping
    public List<String> families() {
        return artifactRegistry.families();
    }

    @GetMapping("/{family}")
    public List<ArtifactMetadata> versions(@PathVariable String family) {
        return artifactRegistry.list(family);
    }

    /**
     * @param version a version number or {@code latest}
     */
    @GetMapping("/{family}/{version}")
    public ArtifactMetadata metadata(@PathVariable String family, @PathVariable String version) {
        return artifactRegistry.get(family, VersionSelector.parse(version)).metadata();
    }

    @GetMapping("/{family}/{version}/payload")
    public ResponseEntity<byte[]> payload(@PathVariable String family, @PathVariable String version) {
        Artifact artifact = artifactRegistry.get(family, VersionSelector.parse(version));
        log.info("📤 Serving {} v{} payload ({} bytes)", artifact.family(), artifact.version(),
            artifact.metadata().sizeBytes());
        return ResponseEntity.ok()
            .contentType(MediaType.APPLICATION_OCTET_STREAM)
            .header(HttpHeaders.CONTENT_DISPOSITION,
                "attachment; filename=\"%s-v%d.bin\"".formatted(artifact.family(), artifact.version()))
            .header("X-Content-Hash", artifact.metadata().contentHash())
            .body(artifact.payload());
    }
}
