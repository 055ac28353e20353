package io.catena.core;

import java.time.Duration;

/// Configuration of the Catena execution engine.
///
/// Use the {@link Builder} for fluent construction or the setters for mutable
/// configuration.
///
/// ### Default Values
/// - `workerPoolSize`: `4` concurrent executions
/// - `defaultStepTimeout`: 5 minutes per attempt
/// - `defaultRetryCount`: `3` retries after the first attempt
/// - `defaultRetryDelay`: 5 seconds before the first retry, doubled per retry
/// - `maxRetryDelay`: 30 seconds cap on any single back-off
/// - `retryCeiling`: `10` retries per execution across all steps
/// - `maxRecursionDepth`: `10` levels of nested chains
/// - `defaultChainTimeout`: 30 minutes per execution
/// - `breakerFailureThreshold`: `5` consecutive failures
/// - `breakerCoolDown`: 60 seconds
/// - `breakerHalfOpenProbes`: `1` successful probe to close
/// - `eventBusCapacity`: `1024` undelivered lifecycle events
///
/// @implNote **Not thread-safe**. Configure before passing to {@link CatenaFactory};
/// do not modify after environment creation.
///
/// @see CatenaFactory
public class CatenaConfig {
    private int workerPoolSize = 4;
    private Duration defaultStepTimeout = Duration.ofMinutes(5);
    private int defaultRetryCount = 3;
    private Duration defaultRetryDelay = Duration.ofSeconds(5);
    private Duration maxRetryDelay = Duration.ofSeconds(30);
    private int retryCeiling = 10;
    private int maxRecursionDepth = 10;
    private Duration defaultChainTimeout = Duration.ofMinutes(30);
    private int breakerFailureThreshold = 5;
    private Duration breakerCoolDown = Duration.ofSeconds(60);
    private int breakerHalfOpenProbes = 1;
    private int eventBusCapacity = 1024;

    public CatenaConfig() {}

    public int getWorkerPoolSize() {
        return workerPoolSize;
    }

    /// Sets how many executions run concurrently. Further requests queue.
    ///
    /// @param workerPoolSize number of workers, must be positive
    public void setWorkerPoolSize(int workerPoolSize) {
        this.workerPoolSize = workerPoolSize;
    }

    public Duration getDefaultStepTimeout() {
        return defaultStepTimeout;
    }

    public void setDefaultStepTimeout(Duration defaultStepTimeout) {
        this.defaultStepTimeout = defaultStepTimeout;
    }

    public int getDefaultRetryCount() {
        return defaultRetryCount;
    }

    public void setDefaultRetryCount(int defaultRetryCount) {
        this.defaultRetryCount = defaultRetryCount;
    }

    public Duration getDefaultRetryDelay() {
        return defaultRetryDelay;
    }

    public void setDefaultRetryDelay(Duration defaultRetryDelay) {
        this.defaultRetryDelay = defaultRetryDelay;
    }

    public Duration getMaxRetryDelay() {
        return maxRetryDelay;
    }

    public void setMaxRetryDelay(Duration maxRetryDelay) {
        this.maxRetryDelay = maxRetryDelay;
    }

    /// Returns the maximum number of retries one execution may spend across all its
    /// steps.
    public int getRetryCeiling() {
        return retryCeiling;
    }

    public void setRetryCeiling(int retryCeiling) {
        this.retryCeiling = retryCeiling;
    }

    public int getMaxRecursionDepth() {
        return maxRecursionDepth;
    }

    public void setMaxRecursionDepth(int maxRecursionDepth) {
        this.maxRecursionDepth = maxRecursionDepth;
    }

    public Duration getDefaultChainTimeout() {
        return defaultChainTimeout;
    }

    public void setDefaultChainTimeout(Duration defaultChainTimeout) {
        this.defaultChainTimeout = defaultChainTimeout;
    }

    public int getBreakerFailureThreshold() {
        return breakerFailureThreshold;
    }

    public void setBreakerFailureThreshold(int breakerFailureThreshold) {
        this.breakerFailureThreshold = breakerFailureThreshold;
    }

    public Duration getBreakerCoolDown() {
        return breakerCoolDown;
    }

    public void setBreakerCoolDown(Duration breakerCoolDown) {
        this.breakerCoolDown = breakerCoolDown;
    }

    public int getBreakerHalfOpenProbes() {
        return breakerHalfOpenProbes;
    }

    public void setBreakerHalfOpenProbes(int breakerHalfOpenProbes) {
        this.breakerHalfOpenProbes = breakerHalfOpenProbes;
    }

    public int getEventBusCapacity() {
        return eventBusCapacity;
    }

    public void setEventBusCapacity(int eventBusCapacity) {
        this.eventBusCapacity = eventBusCapacity;
    }

    /// Checks that every setting is usable.
    ///
    /// @throws IllegalArgumentException naming the first invalid setting
    public void validate() {
        requirePositive("workerPoolSize", workerPoolSize);
        requirePositive("defaultStepTimeout", defaultStepTimeout);
        requireNotNegative("defaultRetryCount", defaultRetryCount);
        requirePositive("defaultRetryDelay", defaultRetryDelay);
        requirePositive("maxRetryDelay", maxRetryDelay);
        requireNotNegative("retryCeiling", retryCeiling);
        requireNotNegative("maxRecursionDepth", maxRecursionDepth);
        requirePositive("defaultChainTimeout", defaultChainTimeout);
        requirePositive("breakerFailureThreshold", breakerFailureThreshold);
        requirePositive("breakerCoolDown", breakerCoolDown);
        requirePositive("breakerHalfOpenProbes", breakerHalfOpenProbes);
        requirePositive("eventBusCapacity", eventBusCapacity);
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }

    private static void requireNotNegative(String name, int value) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must not be negative: " + value);
        }
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration: " + value);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link CatenaConfig}.
    ///
    /// @implNote The builder mutates a single config instance and returns it on
    /// {@link #build()}.
    public static class Builder {
        private final CatenaConfig config = new CatenaConfig();

        public Builder workerPoolSize(int workerPoolSize) {
            config.workerPoolSize = workerPoolSize;
            return this;
        }

        public Builder defaultStepTimeout(Duration defaultStepTimeout) {
            config.defaultStepTimeout = defaultStepTimeout;
            return this;
        }

        public Builder defaultRetryCount(int defaultRetryCount) {
            config.defaultRetryCount = defaultRetryCount;
            return this;
        }

        public Builder defaultRetryDelay(Duration defaultRetryDelay) {
            config.defaultRetryDelay = defaultRetryDelay;
            return this;
        }

        public Builder maxRetryDelay(Duration maxRetryDelay) {
            config.maxRetryDelay = maxRetryDelay;
            return this;
        }

        public Builder retryCeiling(int retryCeiling) {
            config.retryCeiling = retryCeiling;
            return this;
        }

        public Builder maxRecursionDepth(int maxRecursionDepth) {
            config.maxRecursionDepth = maxRecursionDepth;
            return this;
        }

        public Builder defaultChainTimeout(Duration defaultChainTimeout) {
            config.defaultChainTimeout = defaultChainTimeout;
            return this;
        }

        public Builder breakerFailureThreshold(int breakerFailureThreshold) {
            config.breakerFailureThreshold = breakerFailureThreshold;
            return this;
        }

        public Builder breakerCoolDown(Duration breakerCoolDown) {
            config.breakerCoolDown = breakerCoolDown;
            return this;
        }

        public Builder breakerHalfOpenProbes(int breakerHalfOpenProbes) {
            config.breakerHalfOpenProbes = breakerHalfOpenProbes;
            return this;
        }

        public Builder eventBusCapacity(int eventBusCapacity) {
            config.eventBusCapacity = eventBusCapacity;
            return this;
        }

        /// Returns the configured instance.
        ///
        /// @return the configured instance, never null
        public CatenaConfig build() {
            return config;
        }
    }
}
