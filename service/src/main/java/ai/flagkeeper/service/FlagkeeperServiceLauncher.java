package ai.flagkeeper.service;

import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.statsd.StatsdConfig;
import io.micrometer.statsd.StatsdMeterRegistry;
import io.vertx.core.Launcher;
import io.vertx.core.VertxOptions;
import io.vertx.micrometer.Label;
import io.vertx.micrometer.MicrometerMetricsFactory;
import io.vertx.micrometer.MicrometerMetricsOptions;

import java.util.HashMap;
import java.util.Map;

/**
 * Launcher for the flag service that ships both the Vert.x HTTP server metrics and the {@link FlagMetrics}
 * evaluation meters to a statsd agent. The agent is located with the statsd.host / statsd.port system
 * properties; port 0 switches to a unix domain socket.
 *
 * Usage: FlagkeeperServiceLauncher run ai.flagkeeper.service.WebServiceVerticle
 */
public class FlagkeeperServiceLauncher extends Launcher {

    static final String DEFAULT_STATSD_HOST = "localhost";
    static final String DEFAULT_STATSD_PORT = "8125";
    static final String SERVICE_TAG = "flagkeeper";

    @Override
    public void beforeStartingVertx(VertxOptions options) {
        StatsdConfig config = statsdConfig(
                System.getProperty("statsd.host", DEFAULT_STATSD_HOST),
                System.getProperty("statsd.port", DEFAULT_STATSD_PORT));
        options.setMetricsOptions(metricsOptions(new StatsdMeterRegistry(config, Clock.SYSTEM)));
    }

    static StatsdConfig statsdConfig(String host, String port) {
        Map<String, String> statsProps = new HashMap<>();
        statsProps.put("statsd.host", host);
        statsProps.put("statsd.port", port);
        statsProps.put("statsd.protocol", Integer.parseInt(port) == 0 ? "UDS_DATAGRAM" : "UDP");
        return statsProps::get;
    }

    /**
     * Vert.x metrics backed by the given registry. The registry becomes the Vert.x default backend, which
     * is where {@link FlagMetrics#fromVertxBackend()} registers the evaluation meters.
     */
    static MicrometerMetricsOptions metricsOptions(MeterRegistry registry) {
        registry.config().commonTags("service", SERVICE_TAG);
        return new MicrometerMetricsOptions()
                .setEnabled(true)
                .setJvmMetricsEnabled(true)
                .setFactory(new MicrometerMetricsFactory(registry))
                .addLabels(Label.HTTP_METHOD, Label.HTTP_CODE, Label.HTTP_ROUTE);
    }

    public static void main(String[] args) {
        new FlagkeeperServiceLauncher().dispatch(args);
    }
}
