package tw.gc.auto.equity.research.config;

import java.time.Duration;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import tw.gc.auto.equity.research.services.walkforward.SchedulingMode;
import tw.gc.auto.equity.research.services.walkforward.WindowSchedulerConfig;

@Data
@Component
@ConfigurationProperties(prefix = "walkforward")
public class WalkForwardProperties {

    /** Three years of trading days. */
    private int trainSize = 756;
    private int valSize = 5;
    private int stepSize = 5;
    private int embargo = 1;
    private SchedulingMode mode = SchedulingMode.ROLLING;

    /**
     * Upper bound on fit + predict for one window. Exceeding it fails that window only.
     */
    private Duration windowTimeout = Duration.ofMinutes(10);

    /**
     * Windows evaluated concurrently. 1 = sequential.
     */
    private int parallelism = 1;

    private String featurePrefix = "feat_";
    private long seed = 42L;

    /**
     * Consecutive worsening windows needed before a metric is flagged as degrading.
     */
    private int degradationMinWindows = 3;

    public WindowSchedulerConfig toSchedulerConfig() {
        return new WindowSchedulerConfig(trainSize, valSize, stepSize, embargo, mode);
    }
}
