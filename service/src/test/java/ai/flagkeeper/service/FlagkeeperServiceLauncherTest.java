package ai.flagkeeper.service;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.statsd.StatsdConfig;
import io.micrometer.statsd.StatsdProtocol;
import io.vertx.micrometer.Label;
import io.vertx.micrometer.MicrometerMetricsOptions;
import org.junit.Test;

import static org.junit.Assert.*;

public class FlagkeeperServiceLauncherTest {

    @Test
    public void testStatsdConfigOverUdp() {
        StatsdConfig config = FlagkeeperServiceLauncher.statsdConfig("statsd.internal", "9125");
        assertEquals("statsd.internal", config.host());
        assertEquals(9125, config.port());
        assertEquals(StatsdProtocol.UDP, config.protocol());
    }

    @Test
    public void testPortZeroUsesUnixSocket() {
        StatsdConfig config = FlagkeeperServiceLauncher.statsdConfig("/var/run/statsd.sock", "0");
        assertEquals(StatsdProtocol.UDS_DATAGRAM, config.protocol());
    }

    @Test
    public void testEvaluationMetersShareTheServiceTag() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MicrometerMetricsOptions options = FlagkeeperServiceLauncher.metricsOptions(registry);

        assertTrue(options.isEnabled());
        assertNotNull(options.getFactory());
        assertTrue(options.getLabels().contains(Label.HTTP_ROUTE));

        new FlagMetrics(registry).recordDecision(true);
        assertEquals(FlagkeeperServiceLauncher.SERVICE_TAG,
                registry.get(FlagMetrics.EVALUATION).counter().getId().getTag("service"));
    }
}
