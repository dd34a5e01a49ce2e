package tw.gc.auto.equity.research.registry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class ContentHashesTest {

    @Test
    @DisplayName("should produce the prefixed SHA-256 hex digest")
    void shouldHash() {
        assertThat(ContentHashes.sha256("abc".getBytes(StandardCharsets.UTF_8)))
            .isEqualTo("sha256:ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }
}
