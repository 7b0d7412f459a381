package postlogin.adapter.out.telemetry;

import java.util.concurrent.TimeUnit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import postlogin.core.config.MetricsConfig;
import postlogin.core.port.out.SessionMetrics;

/**
 * Micrometer metrics for the session lifecycle.
 *
 * <p>Records metrics for:
 * <ul>
 *   <li>{@code postlogin.session.initiations} - Initiations by business unit and outcome</li>
 *   <li>{@code postlogin.session.renewals} - Renewals by outcome</li>
 *   <li>{@code postlogin.session.verification.duration} - External verification latency by verdict</li>
 *   <li>{@code postlogin.session.store.timeouts} - Session store timeouts by repository and operation</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerSessionMetrics implements SessionMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public MicrometerSessionMetrics(MeterRegistry registry, MetricsConfig config) {
        this.registry = registry;
        this.enabled = config != null && config.enabled();
    }

    /**
     * Check if metrics recording is enabled.
     *
     * @return true if metrics are enabled
     */
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordInitiation(String businessUnit, String outcome) {
        if (!enabled) {
            return;
        }

        Counter.builder("postlogin.session.initiations")
                .description("Post-login session initiations")
                .tag("business_unit", nullSafe(businessUnit))
                .tag("outcome", nullSafe(outcome))
                .register(registry)
                .increment();
    }

    @Override
    public void recordRenewal(String outcome) {
        if (!enabled) {
            return;
        }

        Counter.builder("postlogin.session.renewals")
                .description("Post-login session token renewals")
                .tag("outcome", nullSafe(outcome))
                .register(registry)
                .increment();
    }

    @Override
    public void recordVerification(String verdict, long durationMs) {
        if (!enabled) {
            return;
        }

        Timer.builder("postlogin.session.verification.duration")
                .description("External session verification latency")
                .tag("verdict", nullSafe(verdict))
                .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void recordStoreTimeout(String repository, String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("postlogin.session.store.timeouts")
                .description("Session store operations that timed out")
                .tag("repository", nullSafe(repository))
                .tag("operation", nullSafe(operation))
                .register(registry)
                .increment();
    }

    private static String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
