package postlogin.adapter.out.time;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import io.quarkus.arc.DefaultBean;

/**
 * CDI producer for the clock used by session and token timestamps.
 *
 * <p>Declared as a default bean so tests can substitute a fixed or adjustable clock.
 */
@ApplicationScoped
public class ClockProducer {

    /**
     * Produce the system UTC clock.
     *
     * @return the clock
     */
    @Produces
    @Singleton
    @DefaultBean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
