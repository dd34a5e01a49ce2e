package tw.gc.auto.equity.research.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "registry")
public class RegistryProperties {

    /**
     * Directory holding one sub-directory per model family.
     */
    private String rootDirectory = "data/04_models";
}
