package com.helios.surveillance.infra.config;

import java.io.InputStream;
import java.time.Duration;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Configuration for the matching engine, its cache and its match recorder.
 *
 * <p>Values are resolved in this order, later sources winning:
 * <ol>
 *   <li>builder defaults</li>
 *   <li>{@code surveillance-engine.properties} on the classpath (or file system)</li>
 *   <li>environment variables named {@code SURVEILLANCE_<PROPERTY>}, e.g.
 *       {@code SURVEILLANCE_ENGINE_MAX_CANDIDATES} for {@code engine.max.candidates}</li>
 *   <li>system properties named {@code surveillance.<property>}</li>
 * </ol>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * EngineConfig config = EngineConfig.builder()
 *     .maxCandidates(50)
 *     .cacheEnabled(false)
 *     .build();
 * }</pre>
 */
public final class EngineConfig {

    private static final Logger logger = Logger.getLogger(EngineConfig.class.getName());

    public static final String DEFAULT_PROPERTIES_FILE = "surveillance-engine.properties";
    private static final String ENV_PREFIX = "SURVEILLANCE_";
    private static final String SYSTEM_PROPERTY_PREFIX = "surveillance.";

    // Property keys
    static final String MAX_CANDIDATES = "engine.max.candidates";
    static final String SEQUENTIAL_THRESHOLD = "engine.sequential.threshold";
    static final String EVALUATOR_PARALLELISM = "engine.evaluator.parallelism";
    static final String PROFILE_TIMEOUT_MS = "engine.profile.timeout.ms";
    static final String MATCH_TIMEOUT_MS = "engine.match.timeout.ms";
    static final String MATCH_THREADS = "engine.match.threads";
    static final String EVALUATE_UNINDEXED_ALWAYS = "engine.evaluate.unindexed.always";
    static final String FLUSH_INTERVAL_MS = "recorder.flush.interval.ms";
    static final String PENDING_CAPACITY = "recorder.pending.capacity";
    static final String OFFER_TIMEOUT_MS = "recorder.offer.timeout.ms";
    static final String FREQUENCY_DECAY = "recorder.frequency.decay";
    static final String CACHE_ENABLED = "cache.enabled";
    static final String CACHE_TTL_MS = "cache.ttl.ms";
    static final String CACHE_MAX_SIZE = "cache.max.size";

    private final int maxCandidates;
    private final int sequentialThreshold;
    private final int evaluatorParallelism;
    private final Duration profileTimeout;
    private final Duration matchTimeout;
    private final int matchThreads;
    private final boolean evaluateUnindexedAlways;
    private final Duration flushInterval;
    private final int pendingCapacity;
    private final Duration offerTimeout;
    private final double frequencyDecay;
    private final boolean cacheEnabled;
    private final Duration cacheTtl;
    private final long cacheMaxSize;

    private EngineConfig(Builder builder) {
        this.maxCandidates = builder.maxCandidates;
        this.sequentialThreshold = builder.sequentialThreshold;
        this.evaluatorParallelism = builder.evaluatorParallelism;
        this.profileTimeout = builder.profileTimeout;
        this.matchTimeout = builder.matchTimeout;
        this.matchThreads = builder.matchThreads;
        this.evaluateUnindexedAlways = builder.evaluateUnindexedAlways;
        this.flushInterval = builder.flushInterval;
        this.pendingCapacity = builder.pendingCapacity;
        this.offerTimeout = builder.offerTimeout;
        this.frequencyDecay = builder.frequencyDecay;
        this.cacheEnabled = builder.cacheEnabled;
        this.cacheTtl = builder.cacheTtl;
        this.cacheMaxSize = builder.cacheMaxSize;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    /**
     * Loads {@value #DEFAULT_PROPERTIES_FILE}, then applies environment and system property overrides.
     */
    public static EngineConfig loadDefault() {
        return loadFromProperties(DEFAULT_PROPERTIES_FILE);
    }

    public static EngineConfig loadFromProperties(String propertiesPath) {
        Properties props = new Properties();

        try (InputStream is = EngineConfig.class.getClassLoader().getResourceAsStream(propertiesPath)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded " + props.size() + " properties from classpath: " + propertiesPath);
            }
        } catch (Exception e) {
            logger.fine("Could not load from classpath: " + propertiesPath);
        }

        if (props.isEmpty()) {
            try (InputStream fis = new java.io.FileInputStream(propertiesPath)) {
                props.load(fis);
                logger.info("Loaded " + props.size() + " properties from file: " + propertiesPath);
            } catch (Exception e) {
                logger.warning("Could not load properties file: " + propertiesPath + ". Using defaults.");
            }
        }

        Builder builder = builder();
        builder.apply(props::getProperty, "property ");
        builder.apply(key -> System.getenv(envKey(key)), "env ");
        builder.apply(key -> System.getProperty(SYSTEM_PROPERTY_PREFIX + key), "system property ");
        return builder.build();
    }

    /**
     * Builds a configuration from the given properties only, without environment or system property overrides.
     */
    public static EngineConfig fromProperties(Properties props) {
        Builder builder = builder();
        builder.apply(props::getProperty, "property ");
        return builder.build();
    }

    static String envKey(String propertyKey) {
        return ENV_PREFIX + propertyKey.toUpperCase().replace('.', '_');
    }

    public int maxCandidates() { return maxCandidates; }
    public int sequentialThreshold() { return sequentialThreshold; }
    public int evaluatorParallelism() { return evaluatorParallelism; }
    public Duration profileTimeout() { return profileTimeout; }
    public Duration matchTimeout() { return matchTimeout; }
    public int matchThreads() { return matchThreads; }
    public boolean evaluateUnindexedAlways() { return evaluateUnindexedAlways; }
    public Duration flushInterval() { return flushInterval; }
    public int pendingCapacity() { return pendingCapacity; }
    public Duration offerTimeout() { return offerTimeout; }
    public double frequencyDecay() { return frequencyDecay; }
    public boolean cacheEnabled() { return cacheEnabled; }
    public Duration cacheTtl() { return cacheTtl; }
    public long cacheMaxSize() { return cacheMaxSize; }

    @Override
    public String toString() {
        return String.format(
                "EngineConfig{maxCandidates=%d, sequentialThreshold=%d, parallelism=%d, profileTimeout=%s, "
                        + "matchTimeout=%s, matchThreads=%d, flushInterval=%s, pendingCapacity=%d, "
                        + "cacheEnabled=%s, cacheTtl=%s, cacheMaxSize=%d}",
                maxCandidates, sequentialThreshold, evaluatorParallelism, profileTimeout, matchTimeout,
                matchThreads, flushInterval, pendingCapacity, cacheEnabled, cacheTtl, cacheMaxSize);
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static final class Builder {
        private int maxCandidates = 100;
        private int sequentialThreshold = 10;
        private int evaluatorParallelism = 4;
        private Duration profileTimeout = Duration.ofMillis(1_000);
        private Duration matchTimeout = Duration.ofMillis(10_000);
        private int matchThreads = Runtime.getRuntime().availableProcessors();
        private boolean evaluateUnindexedAlways = false;
        private Duration flushInterval = Duration.ofMillis(5_000);
        private int pendingCapacity = 10_000;
        private Duration offerTimeout = Duration.ofMillis(50);
        private double frequencyDecay = 0.9;
        private boolean cacheEnabled = true;
        private Duration cacheTtl = Duration.ofMillis(60_000);
        private long cacheMaxSize = 10_000;

        private Builder() {
        }

        public Builder maxCandidates(int maxCandidates) {
            this.maxCandidates = requirePositive(maxCandidates, "maxCandidates");
            return this;
        }

        public Builder sequentialThreshold(int sequentialThreshold) {
            if (sequentialThreshold < 0) {
                throw new IllegalArgumentException("sequentialThreshold must be >= 0");
            }
            this.sequentialThreshold = sequentialThreshold;
            return this;
        }

        public Builder evaluatorParallelism(int evaluatorParallelism) {
            this.evaluatorParallelism = requirePositive(evaluatorParallelism, "evaluatorParallelism");
            return this;
        }

        public Builder profileTimeout(Duration profileTimeout) {
            this.profileTimeout = requirePositive(profileTimeout, "profileTimeout");
            return this;
        }

        public Builder matchTimeout(Duration matchTimeout) {
            this.matchTimeout = requirePositive(matchTimeout, "matchTimeout");
            return this;
        }

        public Builder matchThreads(int matchThreads) {
            this.matchThreads = requirePositive(matchThreads, "matchThreads");
            return this;
        }

        public Builder evaluateUnindexedAlways(boolean evaluateUnindexedAlways) {
            this.evaluateUnindexedAlways = evaluateUnindexedAlways;
            return this;
        }

        public Builder flushInterval(Duration flushInterval) {
            this.flushInterval = requirePositive(flushInterval, "flushInterval");
            return this;
        }

        public Builder pendingCapacity(int pendingCapacity) {
            this.pendingCapacity = requirePositive(pendingCapacity, "pendingCapacity");
            return this;
        }

        public Builder offerTimeout(Duration offerTimeout) {
            if (offerTimeout == null || offerTimeout.isNegative()) {
                throw new IllegalArgumentException("offerTimeout must be >= 0");
            }
            this.offerTimeout = offerTimeout;
            return this;
        }

        public Builder frequencyDecay(double frequencyDecay) {
            if (frequencyDecay < 0.0 || frequencyDecay > 1.0) {
                throw new IllegalArgumentException("frequencyDecay must be within [0, 1]");
            }
            this.frequencyDecay = frequencyDecay;
            return this;
        }

        public Builder cacheEnabled(boolean cacheEnabled) {
            this.cacheEnabled = cacheEnabled;
            return this;
        }

        public Builder cacheTtl(Duration cacheTtl) {
            this.cacheTtl = requirePositive(cacheTtl, "cacheTtl");
            return this;
        }

        public Builder cacheMaxSize(long cacheMaxSize) {
            if (cacheMaxSize <= 0) {
                throw new IllegalArgumentException("cacheMaxSize must be > 0");
            }
            this.cacheMaxSize = cacheMaxSize;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }

        /**
         * Applies every known key found through {@code lookup}. Invalid values are logged and ignored.
         */
        void apply(Function<String, String> lookup, String source) {
            applyInt(lookup, source, MAX_CANDIDATES, this::maxCandidates);
            applyInt(lookup, source, SEQUENTIAL_THRESHOLD, this::sequentialThreshold);
            applyInt(lookup, source, EVALUATOR_PARALLELISM, this::evaluatorParallelism);
            applyMillis(lookup, source, PROFILE_TIMEOUT_MS, this::profileTimeout);
            applyMillis(lookup, source, MATCH_TIMEOUT_MS, this::matchTimeout);
            applyInt(lookup, source, MATCH_THREADS, this::matchThreads);
            applyBoolean(lookup, EVALUATE_UNINDEXED_ALWAYS, this::evaluateUnindexedAlways);
            applyMillis(lookup, source, FLUSH_INTERVAL_MS, this::flushInterval);
            applyInt(lookup, source, PENDING_CAPACITY, this::pendingCapacity);
            applyMillis(lookup, source, OFFER_TIMEOUT_MS, this::offerTimeout);
            applyValue(lookup, source, FREQUENCY_DECAY, Double::parseDouble, this::frequencyDecay);
            applyBoolean(lookup, CACHE_ENABLED, this::cacheEnabled);
            applyMillis(lookup, source, CACHE_TTL_MS, this::cacheTtl);
            applyValue(lookup, source, CACHE_MAX_SIZE, Long::parseLong, this::cacheMaxSize);
        }

        private static void applyInt(Function<String, String> lookup, String source, String key,
                                     Consumer<Integer> setter) {
            applyValue(lookup, source, key, Integer::parseInt, setter);
        }

        private static void applyMillis(Function<String, String> lookup, String source, String key,
                                        Consumer<Duration> setter) {
            applyValue(lookup, source, key, val -> Duration.ofMillis(Long.parseLong(val)), setter);
        }

        private static void applyBoolean(Function<String, String> lookup, String key, Consumer<Boolean> setter) {
            read(lookup, key).ifPresent(val -> {
                String normalized = val.toLowerCase();
                setter.accept("true".equals(normalized) || "1".equals(normalized) || "yes".equals(normalized));
            });
        }

        private static <T> void applyValue(Function<String, String> lookup, String source, String key,
                                           Function<String, T> parser, Consumer<T> setter) {
            read(lookup, key).ifPresent(val -> {
                try {
                    setter.accept(parser.apply(val));
                } catch (IllegalArgumentException e) {
                    // NumberFormatException is an IllegalArgumentException too
                    logger.warning("Invalid " + source + "value for " + key + ": " + val + ", keeping default");
                }
            });
        }

        private static Optional<String> read(Function<String, String> lookup, String key) {
            String value = lookup.apply(key);
            if (value != null && !value.trim().isEmpty()) {
                return Optional.of(value.trim());
            }
            return Optional.empty();
        }

        private static int requirePositive(int value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be > 0");
            }
            return value;
        }

        private static Duration requirePositive(Duration value, String name) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be a positive duration");
            }
            return value;
        }
    }
}
