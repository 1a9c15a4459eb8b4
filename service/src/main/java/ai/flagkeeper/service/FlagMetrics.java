package ai.flagkeeper.service;

import ai.flagkeeper.online.EvaluationResponse;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.micrometer.backends.BackendRegistries;

import java.util.concurrent.TimeUnit;

/**
 * Service level meters for flag evaluation, registered on the same registry as the Vert.x HTTP metrics.
 *
 * flagkeeper.evaluation counts every decision by outcome (enabled, disabled or failure, the latter
 * meaning the store couldn't be read). flagkeeper.evaluation.latency times the requests per route mode.
 */
public class FlagMetrics {

    static final String EVALUATION = "flagkeeper.evaluation";
    static final String EVALUATION_LATENCY = "flagkeeper.evaluation.latency";

    static final String OUTCOME_ENABLED = "enabled";
    static final String OUTCOME_DISABLED = "disabled";
    static final String OUTCOME_FAILURE = "failure";

    private final MeterRegistry registry;

    public FlagMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Uses the registry the launcher installed for Vert.x. Without metrics enabled (e.g. a plain
     * `vertx run`) the meters go to a local registry and are only visible in process.
     */
    public static FlagMetrics fromVertxBackend() {
        MeterRegistry registry = BackendRegistries.getDefaultNow();
        return new FlagMetrics(registry != null ? registry : new SimpleMeterRegistry());
    }

    public void recordDecision(boolean enabled) {
        outcome(enabled ? OUTCOME_ENABLED : OUTCOME_DISABLED).increment();
    }

    public void recordFailure() {
        outcome(OUTCOME_FAILURE).increment();
    }

    public void recordResponse(EvaluationResponse response) {
        if (response.enabled.isSuccess()) {
            recordDecision(response.enabled.getValue());
        } else {
            recordFailure();
        }
    }

    public void recordLatency(String mode, long startNanos) {
        Timer.builder(EVALUATION_LATENCY)
                .tag("mode", mode)
                .register(registry)
                .record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
    }

    private Counter outcome(String outcome) {
        return Counter.builder(EVALUATION)
                .tag("outcome", outcome)
                .register(registry);
    }
}
