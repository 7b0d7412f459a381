package postlogin.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration prefix: {@code postlogin.metrics}
 */
@ConfigMapping(prefix = "postlogin.metrics")
public interface MetricsConfig {

    /**
     * @return true if session metrics are recorded (default: true)
     */
    @WithDefault("true")
    boolean enabled();
}
