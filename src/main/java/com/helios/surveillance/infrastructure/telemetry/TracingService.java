package com.helios.surveillance.infrastructure.telemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.logging.LoggingSpanExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import io.opentelemetry.sdk.trace.samplers.Sampler;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * OpenTelemetry tracing for the surveillance engine.
 * <p>
 * Settings are read from environment variables, falling back to system properties of the same name:
 * <ul>
 *   <li>{@code OTEL_DISABLED}: {@code true} installs a no-op tracer</li>
 *   <li>{@code OTEL_EXPORTER_TYPE}: {@code logging} (default) or {@code otlp}</li>
 *   <li>{@code OTEL_EXPORTER_OTLP_ENDPOINT}: gRPC endpoint for {@code otlp}</li>
 *   <li>{@code OTEL_TRACE_SAMPLING_RATIO}: 0.0 to 1.0, default 1.0</li>
 *   <li>{@code SERVICE_NAME}, {@code SERVICE_VERSION}, {@code DEPLOYMENT_ENVIRONMENT}</li>
 * </ul>
 * Any setup failure degrades to the no-op tracer.
 */
public final class TracingService {
    private static final Logger logger = Logger.getLogger(TracingService.class.getName());

    static final String INSTRUMENTATION_NAME = "com.helios.surveillance";

    private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");
    private static final AttributeKey<String> DEPLOYMENT_ENVIRONMENT = AttributeKey.stringKey("deployment.environment");

    private final Tracer tracer;
    private final SdkTracerProvider tracerProvider;

    private TracingService(Tracer tracer, SdkTracerProvider tracerProvider) {
        this.tracer = tracer;
        this.tracerProvider = tracerProvider;
    }

    public static TracingService fromEnvironment() {
        return create(key -> {
            String value = System.getenv(key);
            return value == null || value.isEmpty() ? System.getProperty(key) : value;
        });
    }

    /**
     * @param settings returns the value of a setting, or null when unset
     */
    static TracingService create(UnaryOperator<String> settings) {
        if (Boolean.parseBoolean(settings.apply("OTEL_DISABLED"))) {
            logger.info("Tracing disabled by OTEL_DISABLED");
            return disabled();
        }
        try {
            String serviceName = valueOr(settings, "SERVICE_NAME", "surveillance-engine");
            String environment = valueOr(settings, "DEPLOYMENT_ENVIRONMENT", "dev");
            double ratio = samplingRatio(settings.apply("OTEL_TRACE_SAMPLING_RATIO"));

            Resource resource = Resource.getDefault().merge(Resource.create(Attributes.of(
                    SERVICE_NAME, serviceName,
                    SERVICE_VERSION, valueOr(settings, "SERVICE_VERSION", "unknown"),
                    DEPLOYMENT_ENVIRONMENT, environment)));

            SdkTracerProvider provider = SdkTracerProvider.builder()
                    .setResource(resource)
                    .setSampler(Sampler.parentBased(Sampler.traceIdRatioBased(ratio)))
                    .addSpanProcessor(BatchSpanProcessor.builder(exporter(settings))
                            .setScheduleDelay(Duration.ofSeconds(5))
                            .build())
                    .build();

            OpenTelemetry sdk = OpenTelemetrySdk.builder()
                    .setTracerProvider(provider)
                    .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                    .build();

            logger.info("Tracing enabled for " + serviceName + " (" + environment + "), sampling ratio " + ratio);
            return new TracingService(sdk.getTracer(INSTRUMENTATION_NAME), provider);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Tracing setup failed, using no-op tracer", e);
            return disabled();
        }
    }

    static TracingService disabled() {
        return new TracingService(noopTracer(), null);
    }

    /**
     * Tracer that records nothing. Used by tests and components constructed without tracing.
     */
    public static Tracer noopTracer() {
        return OpenTelemetry.noop().getTracer(INSTRUMENTATION_NAME);
    }

    static double samplingRatio(String raw) {
        if (raw == null || raw.isBlank()) {
            return 1.0;
        }
        try {
            return Math.max(0.0, Math.min(1.0, Double.parseDouble(raw.trim())));
        } catch (NumberFormatException e) {
            logger.warning("Ignoring invalid OTEL_TRACE_SAMPLING_RATIO '" + raw + "'");
            return 1.0;
        }
    }

    private static SpanExporter exporter(UnaryOperator<String> settings) {
        String type = valueOr(settings, "OTEL_EXPORTER_TYPE", "logging").toLowerCase(Locale.ROOT);
        if (type.equals("otlp")) {
            String endpoint = valueOr(settings, "OTEL_EXPORTER_OTLP_ENDPOINT", "http://localhost:4317");
            logger.info("Exporting spans over OTLP to " + endpoint);
            return OtlpGrpcSpanExporter.builder()
                    .setEndpoint(endpoint)
                    .setTimeout(10, TimeUnit.SECONDS)
                    .build();
        }
        if (!type.equals("logging")) {
            logger.warning("Unknown OTEL_EXPORTER_TYPE '" + type + "', exporting spans to the log");
        }
        return LoggingSpanExporter.create();
    }

    private static String valueOr(UnaryOperator<String> settings, String key, String fallback) {
        String value = settings.apply(key);
        return value == null || value.isBlank() ? fallback : value;
    }

    public Tracer getTracer() {
        return tracer;
    }

    public boolean isEnabled() {
        return tracerProvider != null;
    }

    /**
     * Flushes buffered spans. Called from the shutdown hook.
     */
    public void shutdown() {
        if (tracerProvider == null) {
            return;
        }
        tracerProvider.shutdown().join(10, TimeUnit.SECONDS);
        logger.info("Tracing shut down");
    }
}
