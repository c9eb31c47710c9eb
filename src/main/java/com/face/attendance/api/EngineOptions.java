package com.face.attendance.api;

import com.face.attendance.detection.ImageDecoder;
import com.face.attendance.matching.RetryPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Tunables of the attendance engine. Every value has a default and none is
 * compiled into the pipeline itself.
 */
public class EngineOptions {

    public static final double DEFAULT_THRESHOLD = 0.6;
    public static final int DEFAULT_TOP_K = 5;
    public static final Duration DEFAULT_REGISTRY_TIMEOUT = Duration.ofSeconds(2);
    public static final Duration DEFAULT_EMBEDDING_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_REGISTRY_THREADS = 4;
    public static final long DEFAULT_ASYNC_TIMEOUT_MS = 30_000;
    public static final String DEFAULT_ACTOR = "system";

    private final double threshold;
    private final int topK;
    private final Duration registryTimeout;
    private final RetryPolicy retryPolicy;
    private final boolean restrictToRoster;
    private final int embeddingThreads;
    private final Duration embeddingTimeout;
    private final int registryThreads;
    private final int maxImageBytes;
    private final long asyncTimeoutMs;
    private final int asyncThreads;
    private final String defaultActorId;

    private EngineOptions(Builder builder) {
        this.threshold = builder.threshold;
        this.topK = builder.topK;
        this.registryTimeout = builder.registryTimeout;
        this.retryPolicy = builder.retryPolicy;
        this.restrictToRoster = builder.restrictToRoster;
        this.embeddingThreads = builder.embeddingThreads;
        this.embeddingTimeout = builder.embeddingTimeout;
        this.registryThreads = builder.registryThreads;
        this.maxImageBytes = builder.maxImageBytes;
        this.asyncTimeoutMs = builder.asyncTimeoutMs;
        this.asyncThreads = builder.asyncThreads;
        this.defaultActorId = builder.defaultActorId;
    }

    /**
     * Minimum similarity for a face match when a submission does not supply its own.
     */
    public double getThreshold() {
        return threshold;
    }

    public int getTopK() {
        return topK;
    }

    /**
     * Shared deadline for all registry queries of one attempt.
     */
    public Duration getRegistryTimeout() {
        return registryTimeout;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    /**
     * When true, matches for identities outside the class roster are dropped.
     */
    public boolean isRestrictToRoster() {
        return restrictToRoster;
    }

    public int getEmbeddingThreads() {
        return embeddingThreads;
    }

    /**
     * Deadline for embedding all faces of one photo. Faces not embedded by then
     * are reported as embedding failures.
     */
    public Duration getEmbeddingTimeout() {
        return embeddingTimeout;
    }

    /**
     * Size of the pool that runs registry queries, kept apart from embedding work.
     */
    public int getRegistryThreads() {
        return registryThreads;
    }

    public int getMaxImageBytes() {
        return maxImageBytes;
    }

    public long getAsyncTimeoutMs() {
        return asyncTimeoutMs;
    }

    public int getAsyncThreads() {
        return asyncThreads;
    }

    public String getDefaultActorId() {
        return defaultActorId;
    }

    public static EngineOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .threshold(threshold)
                .topK(topK)
                .registryTimeout(registryTimeout)
                .retryPolicy(retryPolicy)
                .restrictToRoster(restrictToRoster)
                .embeddingThreads(embeddingThreads)
                .embeddingTimeout(embeddingTimeout)
                .registryThreads(registryThreads)
                .maxImageBytes(maxImageBytes)
                .asyncTimeoutMs(asyncTimeoutMs)
                .asyncThreads(asyncThreads)
                .defaultActorId(defaultActorId);
    }

    public static class Builder {
        private double threshold = DEFAULT_THRESHOLD;
        private int topK = DEFAULT_TOP_K;
        private Duration registryTimeout = DEFAULT_REGISTRY_TIMEOUT;
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private boolean restrictToRoster = true;
        private int embeddingThreads = Runtime.getRuntime().availableProcessors();
        private Duration embeddingTimeout = DEFAULT_EMBEDDING_TIMEOUT;
        private int registryThreads = DEFAULT_REGISTRY_THREADS;
        private int maxImageBytes = ImageDecoder.DEFAULT_MAX_BYTES;
        private long asyncTimeoutMs = DEFAULT_ASYNC_TIMEOUT_MS;
        private int asyncThreads = 4;
        private String defaultActorId = DEFAULT_ACTOR;

        public Builder threshold(double threshold) {
            validateThreshold(threshold);
            this.threshold = threshold;
            return this;
        }

        public Builder topK(int topK) {
            if (topK <= 0) {
                throw new IllegalArgumentException("topK must be > 0");
            }
            this.topK = topK;
            return this;
        }

        public Builder registryTimeout(Duration registryTimeout) {
            Objects.requireNonNull(registryTimeout, "registryTimeout is required");
            if (registryTimeout.isNegative() || registryTimeout.isZero()) {
                throw new IllegalArgumentException("registryTimeout must be positive");
            }
            this.registryTimeout = registryTimeout;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy is required");
            return this;
        }

        public Builder restrictToRoster(boolean restrictToRoster) {
            this.restrictToRoster = restrictToRoster;
            return this;
        }

        public Builder embeddingThreads(int embeddingThreads) {
            if (embeddingThreads <= 0) {
                throw new IllegalArgumentException("embeddingThreads must be > 0");
            }
            this.embeddingThreads = embeddingThreads;
            return this;
        }

        public Builder embeddingTimeout(Duration embeddingTimeout) {
            Objects.requireNonNull(embeddingTimeout, "embeddingTimeout is required");
            if (embeddingTimeout.isNegative() || embeddingTimeout.isZero()) {
                throw new IllegalArgumentException("embeddingTimeout must be positive");
            }
            this.embeddingTimeout = embeddingTimeout;
            return this;
        }

        public Builder registryThreads(int registryThreads) {
            if (registryThreads <= 0) {
                throw new IllegalArgumentException("registryThreads must be > 0");
            }
            this.registryThreads = registryThreads;
            return this;
        }

        public Builder maxImageBytes(int maxImageBytes) {
            if (maxImageBytes <= 0) {
                throw new IllegalArgumentException("maxImageBytes must be > 0");
            }
            this.maxImageBytes = maxImageBytes;
            return this;
        }

        public Builder asyncTimeoutMs(long asyncTimeoutMs) {
            if (asyncTimeoutMs <= 0) {
                throw new IllegalArgumentException("asyncTimeoutMs must be > 0");
            }
            this.asyncTimeoutMs = asyncTimeoutMs;
            return this;
        }

        public Builder asyncThreads(int asyncThreads) {
            if (asyncThreads <= 0) {
                throw new IllegalArgumentException("asyncThreads must be > 0");
            }
            this.asyncThreads = asyncThreads;
            return this;
        }

        public Builder defaultActorId(String defaultActorId) {
            if (defaultActorId == null || defaultActorId.isBlank()) {
                throw new IllegalArgumentException("defaultActorId must not be blank");
            }
            this.defaultActorId = defaultActorId;
            return this;
        }

        public EngineOptions build() {
            return new EngineOptions(this);
        }

        static void validateThreshold(double threshold) {
            if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
                throw new IllegalArgumentException("threshold must be between 0.0 and 1.0");
            }
        }
    }

    @Override
    public String toString() {
        return "EngineOptions{threshold=" + threshold + ", topK=" + topK
                + ", registryTimeout=" + registryTimeout + ", retryPolicy=" + retryPolicy
                + ", restrictToRoster=" + restrictToRoster + ", embeddingThreads=" + embeddingThreads
                + ", embeddingTimeout=" + embeddingTimeout + ", registryThreads=" + registryThreads + '}';
    }
}
