package com.helios.surveillance;

import com.helios.surveillance.core.management.MatchCoordinator;
import com.helios.surveillance.infra.config.EngineConfig;
import com.helios.surveillance.infrastructure.telemetry.TracingService;
import com.helios.surveillance.metrics.MetricsRegistry;
import com.helios.surveillance.metrics.impl.prometheus.PrometheusMetricsRegistry;
import com.helios.surveillance.server.HttpServer;
import com.helios.surveillance.store.InMemoryMatchStore;
import com.helios.surveillance.store.JsonFileProfileStore;
import com.helios.surveillance.store.LoggingMatchListener;
import com.helios.surveillance.store.ProfileStoreException;
import io.prometheus.client.CollectorRegistry;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Standalone surveillance engine: JSON profile file in, HTTP admin surface out.
 *
 * <p>System properties:
 * <ul>
 *   <li>{@code profiles.file} - profile JSON array (default {@code profiles.json})</li>
 *   <li>{@code server.port} - HTTP port (default 8080)</li>
 * </ul>
 */
public class SurveillanceEngineApplication {
    private static final Logger logger = Logger.getLogger(SurveillanceEngineApplication.class.getName());

    private MatchCoordinator coordinator;
    private HttpServer httpServer;
    private TracingService tracingService;

    public static void main(String[] args) {
        configureLogging();
        try {
            SurveillanceEngineApplication app = new SurveillanceEngineApplication();
            app.start();
            Runtime.getRuntime().addShutdownHook(new Thread(app::shutdown, "surveillance-shutdown-hook"));
            Thread.currentThread().join();
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Application failed to start: " + e.getMessage(), e);
            System.exit(1);
        }
    }

    private void start() throws IOException, ProfileStoreException {
        logger.info("Starting killmail surveillance engine");
        tracingService = TracingService.fromEnvironment();
        EngineConfig config = EngineConfig.loadDefault();
        MetricsRegistry metrics = MetricsRegistry.getInstance();

        Path profilesPath = Paths.get(System.getProperty("profiles.file", "profiles.json"));
        int port = Integer.parseInt(System.getProperty("server.port", "8080"));

        coordinator = MatchCoordinator.builder(new JsonFileProfileStore(profilesPath))
                .config(config)
                .matchStore(new InMemoryMatchStore())
                .listener(new LoggingMatchListener())
                .tracer(tracingService.getTracer())
                .metrics(metrics)
                .build();
        coordinator.start();

        CollectorRegistry collectorRegistry = metrics instanceof PrometheusMetricsRegistry prometheus
                ? prometheus.getCollectorRegistry()
                : CollectorRegistry.defaultRegistry;
        httpServer = new HttpServer(port, coordinator, tracingService.getTracer(), collectorRegistry);
        httpServer.start();
        logger.info("Surveillance engine is ready on port " + httpServer.port()
                + " with profiles from " + profilesPath.toAbsolutePath());
    }

    private void shutdown() {
        if (httpServer != null) {
            httpServer.stop(2);
        }
        if (coordinator != null) {
            coordinator.shutdown();
        }
        if (tracingService != null) {
            tracingService.shutdown();
        }
        logger.info("Surveillance engine shutdown complete");
    }

    private static void configureLogging() {
        try (InputStream is = SurveillanceEngineApplication.class.getClassLoader()
                .getResourceAsStream("logging.properties")) {
            if (is != null) {
                LogManager.getLogManager().readConfiguration(is);
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not read logging.properties, using JVM defaults", e);
        }
    }
}
