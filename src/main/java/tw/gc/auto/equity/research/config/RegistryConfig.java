package tw.gc.auto.equity.research.config;

import java.nio.file.Path;
import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import tw.gc.auto.equity.research.registry.ArtifactRegistry;
import tw.gc.auto.equity.research.registry.FileSystemArtifactRegistry;

@Configuration
public class RegistryConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ArtifactRegistry artifactRegistry(RegistryProperties properties, Clock clock) {
        return new FileSystemArtifactRegistry(Path.of(properties.getRootDirectory()), clock);
    }
}
