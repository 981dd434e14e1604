package com.lazyframe.runtime;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Immutable engine settings.
 *
 * <p>Values come from {@link #getDefaults()} overlaid with user overrides,
 * either a string map or JVM system properties using the same keys:
 * <pre>
 *   -Dlazyframe.broadcastThresholdBytes=1048576
 *   -Dlazyframe.defaultPartitionCount=4
 * </pre>
 */
public final class EngineConfig {

    public static final String BROADCAST_THRESHOLD_BYTES = "lazyframe.broadcastThresholdBytes";
    public static final String MAX_OPTIMIZER_PASSES = "lazyframe.maxOptimizerPasses";
    public static final String DEFAULT_PARTITION_COUNT = "lazyframe.defaultPartitionCount";
    public static final String BATCH_SIZE = "lazyframe.batchSize";

    public static final long DEFAULT_BROADCAST_THRESHOLD_BYTES = 10L * 1024 * 1024;
    public static final int DEFAULT_MAX_OPTIMIZER_PASSES = 20;
    public static final int DEFAULT_BATCH_SIZE = 4096;
    public static final int MIN_BATCH_SIZE = 64;
    public static final int MAX_BATCH_SIZE = 65536;

    private static final int MAX_DEFAULT_PARTITIONS = 8;

    private final long broadcastThresholdBytes;
    private final int maxOptimizerPasses;
    private final int defaultPartitionCount;
    private final int batchSize;

    private EngineConfig(Builder builder) {
        this.broadcastThresholdBytes = builder.broadcastThresholdBytes;
        this.maxOptimizerPasses = builder.maxOptimizerPasses;
        this.defaultPartitionCount = builder.defaultPartitionCount;
        this.batchSize = normalizeBatchSize(builder.batchSize);
    }

    /**
     * Returns the default configuration.
     *
     * @return the defaults
     */
    public static EngineConfig defaults() {
        return builder().build();
    }

    /**
     * Get the default configuration values.
     *
     * @return Map of default configuration key-value pairs
     */
    public static Map<String, String> getDefaults() {
        Map<String, String> defaults = new HashMap<>();
        defaults.put(BROADCAST_THRESHOLD_BYTES, String.valueOf(DEFAULT_BROADCAST_THRESHOLD_BYTES));
        defaults.put(MAX_OPTIMIZER_PASSES, String.valueOf(DEFAULT_MAX_OPTIMIZER_PASSES));
        defaults.put(DEFAULT_PARTITION_COUNT, String.valueOf(detectPartitionCount()));
        defaults.put(BATCH_SIZE, String.valueOf(DEFAULT_BATCH_SIZE));
        return defaults;
    }

    /**
     * Builds a configuration from the defaults overlaid with {@code overrides}.
     * Keys other than the {@code lazyframe.*} settings are ignored.
     *
     * @param overrides the user settings
     * @return the configuration
     * @throws IllegalArgumentException if a value is not a valid number
     */
    public static EngineConfig fromMap(Map<String, String> overrides) {
        Map<String, String> values = getDefaults();
        values.putAll(Objects.requireNonNull(overrides, "overrides must not be null"));
        return builder()
            .broadcastThresholdBytes(parseLong(values, BROADCAST_THRESHOLD_BYTES))
            .maxOptimizerPasses(parseInt(values, MAX_OPTIMIZER_PASSES))
            .defaultPartitionCount(parseInt(values, DEFAULT_PARTITION_COUNT))
            .batchSize(parseInt(values, BATCH_SIZE))
            .build();
    }

    /**
     * Builds a configuration from the defaults overlaid with JVM system properties.
     *
     * @return the configuration
     */
    public static EngineConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    static EngineConfig fromProperties(Properties properties) {
        Map<String, String> overrides = new HashMap<>();
        for (String key : properties.stringPropertyNames()) {
            if (key.startsWith("lazyframe.")) {
                overrides.put(key, properties.getProperty(key));
            }
        }
        return fromMap(overrides);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .broadcastThresholdBytes(broadcastThresholdBytes)
            .maxOptimizerPasses(maxOptimizerPasses)
            .defaultPartitionCount(defaultPartitionCount)
            .batchSize(batchSize);
    }

    public long broadcastThresholdBytes() {
        return broadcastThresholdBytes;
    }

    public int maxOptimizerPasses() {
        return maxOptimizerPasses;
    }

    public int defaultPartitionCount() {
        return defaultPartitionCount;
    }

    public int batchSize() {
        return batchSize;
    }

    /**
     * Returns the settings as a key-value map, using the property keys.
     *
     * @return the settings
     */
    public Map<String, String> asMap() {
        Map<String, String> map = new HashMap<>();
        map.put(BROADCAST_THRESHOLD_BYTES, String.valueOf(broadcastThresholdBytes));
        map.put(MAX_OPTIMIZER_PASSES, String.valueOf(maxOptimizerPasses));
        map.put(DEFAULT_PARTITION_COUNT, String.valueOf(defaultPartitionCount));
        map.put(BATCH_SIZE, String.valueOf(batchSize));
        return Collections.unmodifiableMap(map);
    }

    static int detectPartitionCount() {
        return Math.max(1, Math.min(Runtime.getRuntime().availableProcessors(), MAX_DEFAULT_PARTITIONS));
    }

    static int normalizeBatchSize(int requested) {
        return Math.max(MIN_BATCH_SIZE, Math.min(requested, MAX_BATCH_SIZE));
    }

    private static long parseLong(Map<String, String> values, String key) {
        String value = values.get(key);
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": '" + value + "'", e);
        }
    }

    private static int parseInt(Map<String, String> values, String key) {
        String value = values.get(key);
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": '" + value + "'", e);
        }
    }

    @Override
    public String toString() {
        return String.format(
            "EngineConfig(broadcastThresholdBytes=%d, maxOptimizerPasses=%d, defaultPartitionCount=%d, batchSize=%d)",
            broadcastThresholdBytes, maxOptimizerPasses, defaultPartitionCount, batchSize);
    }

    /**
     * Builder for {@link EngineConfig}.
     */
    public static final class Builder {
        private long broadcastThresholdBytes = DEFAULT_BROADCAST_THRESHOLD_BYTES;
        private int maxOptimizerPasses = DEFAULT_MAX_OPTIMIZER_PASSES;
        private int defaultPartitionCount = detectPartitionCount();
        private int batchSize = DEFAULT_BATCH_SIZE;

        private Builder() {}

        public Builder broadcastThresholdBytes(long bytes) {
            if (bytes < 0) {
                throw new IllegalArgumentException(BROADCAST_THRESHOLD_BYTES + " must be non-negative: " + bytes);
            }
            this.broadcastThresholdBytes = bytes;
            return this;
        }

        public Builder maxOptimizerPasses(int passes) {
            if (passes < 1) {
                throw new IllegalArgumentException(MAX_OPTIMIZER_PASSES + " must be at least 1: " + passes);
            }
            this.maxOptimizerPasses = passes;
            return this;
        }

        public Builder defaultPartitionCount(int count) {
            if (count < 1) {
                throw new IllegalArgumentException(DEFAULT_PARTITION_COUNT + " must be at least 1: " + count);
            }
            this.defaultPartitionCount = count;
            return this;
        }

        public Builder batchSize(int size) {
            this.batchSize = size;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
