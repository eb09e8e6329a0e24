/*
 *  Copyright (C) 2020-2025 Lucas Nishimura <lucas.nishimura at gmail.com>
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU General Public License as published by
 *  the Free Software Foundation, either version 3 of the License, or
 *  (at your option) any later version.
 *
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU General Public License for more details.
 *
 *  You should have received a copy of the GNU General Public License
 *  along with this program.  If not, see <https://www.gnu.org/licenses/>
 */

package dev.nishisan.crdtsync.optimizer;

import dev.nishisan.crdtsync.common.PeriodicWorker;
import dev.nishisan.crdtsync.compression.CompressionAlgorithm;
import dev.nishisan.crdtsync.compression.DeltaCompressor;
import dev.nishisan.crdtsync.conflict.ConflictBatcher;
import dev.nishisan.crdtsync.perf.PerformanceMonitor;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable settings of a {@link PerformanceOptimizer}.
 */
public final class OptimizerConfig {

    private final String nodeId;
    private final boolean enabled;
    private final int compressionThresholdBytes;
    private final int highRatioThresholdBytes;
    private final Set<CompressionAlgorithm> disabledAlgorithms;
    private final int batchSize;
    private final Duration batchTimeout;
    private final Duration pollInterval;
    private final Duration baseInterval;
    private final Duration minInterval;
    private final Duration maxInterval;
    private final int historyCapacity;
    private final Duration monitorInterval;
    private final Duration stopTimeout;

    private OptimizerConfig(Builder builder) {
        this.nodeId = builder.nodeId;
        this.enabled = builder.enabled;
        this.compressionThresholdBytes = builder.compressionThresholdBytes;
        this.highRatioThresholdBytes = builder.highRatioThresholdBytes;
        this.disabledAlgorithms = Collections.unmodifiableSet(EnumSet.copyOf(builder.disabledAlgorithms));
        this.batchSize = builder.batchSize;
        this.batchTimeout = builder.batchTimeout;
        this.pollInterval = builder.pollInterval;
        this.baseInterval = builder.baseInterval;
        this.minInterval = builder.minInterval;
        this.maxInterval = builder.maxInterval;
        this.historyCapacity = builder.historyCapacity;
        this.monitorInterval = builder.monitorInterval;
        this.stopTimeout = builder.stopTimeout;
    }

    public static OptimizerConfig defaults() {
        return builder().build();
    }

    public String nodeId() {
        return nodeId;
    }

    public boolean enabled() {
        return enabled;
    }

    /**
     * @return payloads smaller than this many bytes are sent uncompressed
     */
    public int compressionThresholdBytes() {
        return compressionThresholdBytes;
    }

    public int highRatioThresholdBytes() {
        return highRatioThresholdBytes;
    }

    /**
     * @return algorithms whose codecs are not installed
     */
    public Set<CompressionAlgorithm> disabledAlgorithms() {
        return disabledAlgorithms;
    }

    public int batchSize() {
        return batchSize;
    }

    public Duration batchTimeout() {
        return batchTimeout;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public Duration baseInterval() {
        return baseInterval;
    }

    public Duration minInterval() {
        return minInterval;
    }

    public Duration maxInterval() {
        return maxInterval;
    }

    public int historyCapacity() {
        return historyCapacity;
    }

    public Duration monitorInterval() {
        return monitorInterval;
    }

    public Duration stopTimeout() {
        return stopTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link OptimizerConfig}.
     */
    public static final class Builder {
        private String nodeId = "local";
        private boolean enabled = true;
        private int compressionThresholdBytes = DeltaCompressor.DEFAULT_FAST_THRESHOLD_BYTES;
        private int highRatioThresholdBytes = DeltaCompressor.DEFAULT_HIGH_RATIO_THRESHOLD_BYTES;
        private final EnumSet<CompressionAlgorithm> disabledAlgorithms = EnumSet.noneOf(CompressionAlgorithm.class);
        private int batchSize = ConflictBatcher.DEFAULT_BATCH_SIZE;
        private Duration batchTimeout = ConflictBatcher.DEFAULT_TIMEOUT;
        private Duration pollInterval = Duration.ofSeconds(1);
        private Duration baseInterval = Duration.ofSeconds(60);
        private Duration minInterval = Duration.ofSeconds(1);
        private Duration maxInterval = Duration.ofSeconds(3600);
        private int historyCapacity = PerformanceMonitor.DEFAULT_HISTORY_CAPACITY;
        private Duration monitorInterval = Duration.ofSeconds(10);
        private Duration stopTimeout = PeriodicWorker.DEFAULT_STOP_TIMEOUT;

        private Builder() {
        }

        public Builder nodeId(String nodeId) {
            this.nodeId = Objects.requireNonNull(nodeId, "nodeId");
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder compressionThresholdBytes(int bytes) {
            if (bytes < 0) {
                throw new IllegalArgumentException("compressionThresholdBytes must be >= 0");
            }
            this.compressionThresholdBytes = bytes;
            return this;
        }

        public Builder highRatioThresholdBytes(int bytes) {
            if (bytes < 0) {
                throw new IllegalArgumentException("highRatioThresholdBytes must be >= 0");
            }
            this.highRatioThresholdBytes = bytes;
            return this;
        }

        public Builder disableAlgorithm(CompressionAlgorithm algorithm) {
            Objects.requireNonNull(algorithm, "algorithm");
            if (algorithm == CompressionAlgorithm.NONE) {
                throw new IllegalArgumentException("The uncompressed encoding cannot be disabled");
            }
            disabledAlgorithms.add(algorithm);
            return this;
        }

        public Builder batchSize(int batchSize) {
            if (batchSize < 1) {
                throw new IllegalArgumentException("batchSize must be >= 1");
            }
            this.batchSize = batchSize;
            return this;
        }

        public Builder batchTimeout(Duration batchTimeout) {
            this.batchTimeout = positive(batchTimeout, "batchTimeout");
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = positive(pollInterval, "pollInterval");
            return this;
        }

        public Builder baseInterval(Duration baseInterval) {
            this.baseInterval = positive(baseInterval, "baseInterval");
            return this;
        }

        public Builder minInterval(Duration minInterval) {
            this.minInterval = positive(minInterval, "minInterval");
            return this;
        }

        public Builder maxInterval(Duration maxInterval) {
            this.maxInterval = positive(maxInterval, "maxInterval");
            return this;
        }

        public Builder historyCapacity(int historyCapacity) {
            if (historyCapacity <= 0) {
                throw new IllegalArgumentException("historyCapacity must be > 0");
            }
            this.historyCapacity = historyCapacity;
            return this;
        }

        public Builder monitorInterval(Duration monitorInterval) {
            this.monitorInterval = positive(monitorInterval, "monitorInterval");
            return this;
        }

        public Builder stopTimeout(Duration stopTimeout) {
            this.stopTimeout = positive(stopTimeout, "stopTimeout");
            return this;
        }

        public OptimizerConfig build() {
            if (minInterval.compareTo(maxInterval) > 0) {
                throw new IllegalArgumentException("minInterval must not exceed maxInterval");
            }
            if (highRatioThresholdBytes < compressionThresholdBytes) {
                throw new IllegalArgumentException("highRatioThresholdBytes must be >= compressionThresholdBytes");
            }
            return new OptimizerConfig(this);
        }

        private static Duration positive(Duration value, String name) {
            Objects.requireNonNull(value, name);
            if (value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }
    }
}
