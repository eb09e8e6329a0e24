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

import dev.nishisan.crdtsync.compression.CompressionAlgorithm;
import dev.nishisan.crdtsync.compression.CompressionResult;
import dev.nishisan.crdtsync.compression.DeltaCompressor;
import dev.nishisan.crdtsync.conflict.ConflictBatcher;
import dev.nishisan.crdtsync.conflict.ConflictRecord;
import dev.nishisan.crdtsync.conflict.ConflictResolver;
import dev.nishisan.crdtsync.metrics.MetricsRecorder;
import dev.nishisan.crdtsync.metrics.SyncAttempt;
import dev.nishisan.crdtsync.perf.PerformanceMonitor;
import dev.nishisan.crdtsync.perf.ResourceProbe;
import dev.nishisan.crdtsync.sync.LazySynchronizer;
import dev.nishisan.crdtsync.sync.ScheduledSync;
import dev.nishisan.crdtsync.sync.SyncPriority;

import java.io.Closeable;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.logging.Logger;

/**
 * Entry point used by the replication layer. Composes the delta compressor,
 * the lazy synchronizer, the conflict batcher and the performance monitor
 * into one unit with a single lifecycle.
 *
 * <p>
 * Scheduled syncs pull the peer's pending delta from the {@link DeltaSource},
 * encode it, hand it to the {@link DeltaTransport} and report the outcome to
 * the {@link MetricsRecorder}.
 * </p>
 */
public final class PerformanceOptimizer implements Closeable {

    private static final Logger LOGGER = Logger.getLogger(PerformanceOptimizer.class.getName());

    /** Operation label of delta encoding measurements. */
    public static final String DELTA_COMPRESSION = "delta_compression";
    /** Operation label of scheduled sync measurements. */
    public static final String PEER_SYNC = "peer_sync";

    private final OptimizerConfig config;
    private final Clock clock;
    private final DeltaTransport transport;
    private final DeltaSource deltaSource;
    private final MetricsRecorder metricsRecorder;
    private final DeltaCompressor compressor;
    private final PerformanceMonitor monitor;
    private final LazySynchronizer synchronizer;
    private final ConflictBatcher batcher;

    private PerformanceOptimizer(Builder builder) {
        this.config = builder.config;
        this.clock = builder.clock;
        this.transport = builder.transport;
        this.deltaSource = builder.deltaSource;
        this.metricsRecorder = builder.metricsRecorder;
        this.compressor = buildCompressor(config);
        this.monitor = PerformanceMonitor.builder()
                .historyCapacity(config.historyCapacity())
                .probe(builder.probe)
                .clock(clock)
                .sampling(builder.scheduler, config.monitorInterval())
                .stopTimeout(config.stopTimeout())
                .build();
        this.synchronizer = LazySynchronizer.builder(config.nodeId(), builder.scheduler, this::syncPeer)
                .clock(clock)
                .pollInterval(config.pollInterval())
                .baseInterval(config.baseInterval())
                .minInterval(config.minInterval())
                .maxInterval(config.maxInterval())
                .stopTimeout(config.stopTimeout())
                .build();
        ConflictBatcher.Builder batcherBuilder = ConflictBatcher.builder(builder.scheduler)
                .batchSize(config.batchSize())
                .timeout(config.batchTimeout());
        builder.resolvers.forEach(batcherBuilder::resolver);
        if (builder.defaultResolver != null) {
            batcherBuilder.defaultResolver(builder.defaultResolver);
        }
        this.batcher = batcherBuilder.build();
    }

    static DeltaCompressor buildCompressor(OptimizerConfig config) {
        DeltaCompressor.Builder builder = DeltaCompressor.builder()
                .fastThresholdBytes(config.compressionThresholdBytes())
                .highRatioThresholdBytes(config.highRatioThresholdBytes());
        config.disabledAlgorithms().forEach(builder::withoutCodec);
        return builder.build();
    }

    /**
     * Starts the sync loop and the resource sampler. Does nothing when
     * optimization is disabled.
     */
    public void start() {
        if (!config.enabled()) {
            LOGGER.info(() -> "Performance optimization disabled for node " + config.nodeId());
            return;
        }
        synchronizer.start();
        monitor.start();
        LOGGER.info(() -> "Performance optimizer started for node " + config.nodeId());
    }

    /**
     * Stops the background loops and resolves whatever conflicts are still
     * pending.
     *
     * @return {@code false} if a loop had to be abandoned
     */
    public boolean stop() {
        boolean clean = synchronizer.stop();
        clean &= monitor.stop();
        batcher.close();
        return clean;
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Serializes and encodes a delta with the algorithm suited to its size.
     * With optimization disabled the delta is only serialized.
     *
     * @param delta JSON-serializable delta
     * @return the encoded delta
     */
    public OptimizedDelta optimizeDeltaForTransmission(Object delta) {
        Objects.requireNonNull(delta, "delta");
        CompressionResult result = monitor.measureSupplier(DELTA_COMPRESSION, () -> config.enabled()
                ? compressor.compress(delta)
                : compressor.compress(delta, CompressionAlgorithm.NONE));
        return OptimizedDelta.of(result);
    }

    /**
     * Decodes a delta produced by {@link #optimizeDeltaForTransmission(Object)}.
     *
     * @param payload   encoded bytes
     * @param algorithm their encoding
     * @return the delta as maps, lists and scalars
     * @see DeltaCompressor#decompress(byte[], CompressionAlgorithm)
     */
    public Object restoreDelta(byte[] payload, CompressionAlgorithm algorithm) {
        return compressor.decompress(payload, algorithm);
    }

    /**
     * Decodes a delta into its original type.
     *
     * @param payload   encoded bytes
     * @param algorithm their encoding
     * @param type      the delta type
     * @param <T>       the delta type
     * @return the delta
     */
    public <T> T restoreDelta(byte[] payload, CompressionAlgorithm algorithm, Class<T> type) {
        return compressor.decompress(payload, algorithm, type);
    }

    /**
     * Schedules a sync with a peer, mapping the activity level
     * ({@code high}, {@code normal}, {@code low}) to a priority.
     *
     * @param peerId        the peer
     * @param activityLevel activity level; unknown values mean normal
     * @return the queued entry
     */
    public ScheduledSync scheduleOptimizedSync(String peerId, String activityLevel) {
        return scheduleOptimizedSync(peerId, SyncPriority.fromActivityLevel(activityLevel));
    }

    public ScheduledSync scheduleOptimizedSync(String peerId, SyncPriority priority) {
        return synchronizer.scheduleSync(peerId, priority);
    }

    /**
     * @param peerId        the peer
     * @param activityCount operations observed for the peer
     */
    public void recordPeerActivity(String peerId, long activityCount) {
        synchronizer.recordActivity(peerId, activityCount);
    }

    /**
     * Queues a detected conflict for batched resolution and reports it to the
     * metrics recorder.
     *
     * @param conflict the conflict
     */
    public void batchConflictResolution(ConflictRecord conflict) {
        Objects.requireNonNull(conflict, "conflict");
        metricsRecorder.recordConflict(conflict);
        batcher.addConflict(conflict);
    }

    public OptimizationStatus getOptimizationStatus() {
        return new OptimizationStatus(
                config.enabled(),
                synchronizer.isRunning(),
                monitor.isMonitoring(),
                monitor.summary(),
                synchronizer.queueDepth(),
                batcher.pendingCount(),
                synchronizer.completedSyncs(),
                synchronizer.failedSyncs(),
                compressor.degradedCount());
    }

    /**
     * Runs one sync: fetch the pending delta, encode, transmit and record the
     * attempt. A peer without pending changes counts as a successful sync of
     * zero bytes.
     */
    void syncPeer(String peerId, SyncPriority priority) throws Exception {
        monitor.measure(PEER_SYNC, () -> {
            long startNanos = System.nanoTime();
            Optional<DeltaSource.PendingDelta> pending = deltaSource.pendingDelta(peerId);
            if (pending.isEmpty()) {
                metricsRecorder.recordSyncAttempt(
                        SyncAttempt.succeeded(peerId, elapsedMs(startNanos), 0L, 0L, 1.0, clock.instant()));
                LOGGER.finer(() -> "Nothing to send to " + peerId);
                return null;
            }
            DeltaSource.PendingDelta delta = pending.get();
            OptimizedDelta optimized = optimizeDeltaForTransmission(delta.payload());
            boolean accepted;
            try {
                accepted = transport.transmit(peerId, optimized.payload(), optimized.algorithm());
            } catch (Exception e) {
                metricsRecorder.recordSyncAttempt(
                        SyncAttempt.failed(peerId, elapsedMs(startNanos), e.toString(), clock.instant()));
                throw new SyncExecutionException(peerId, "Transmission to " + peerId + " failed", e);
            }
            if (!accepted) {
                metricsRecorder.recordSyncAttempt(SyncAttempt.failed(peerId, elapsedMs(startNanos),
                        "transport rejected delta", clock.instant()));
                throw new SyncExecutionException(peerId, "Transport rejected delta for " + peerId);
            }
            metricsRecorder.recordSyncAttempt(new SyncAttempt(peerId, elapsedMs(startNanos),
                    delta.operationCount(), 0L, optimized.payload().length, optimized.compressionRatio(), true,
                    clock.instant(), null));
            LOGGER.fine(() -> "Sent " + optimized.payload().length + " bytes (" + optimized.algorithm() + ") to "
                    + peerId + " at " + priority + " priority");
            return optimized;
        });
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    public OptimizerConfig config() {
        return config;
    }

    public DeltaCompressor compressor() {
        return compressor;
    }

    public LazySynchronizer synchronizer() {
        return synchronizer;
    }

    public ConflictBatcher batcher() {
        return batcher;
    }

    public PerformanceMonitor monitor() {
        return monitor;
    }

    public static Builder builder(ScheduledExecutorService scheduler, DeltaTransport transport) {
        return new Builder(scheduler, transport);
    }

    /**
     * Builder for {@link PerformanceOptimizer}.
     */
    public static final class Builder {
        private final ScheduledExecutorService scheduler;
        private final DeltaTransport transport;
        private OptimizerConfig config = OptimizerConfig.defaults();
        private Clock clock = Clock.systemUTC();
        private DeltaSource deltaSource = DeltaSource.none();
        private MetricsRecorder metricsRecorder = MetricsRecorder.noop();
        private ResourceProbe probe = ResourceProbe.jvm();
        private final Map<String, ConflictResolver> resolvers = new LinkedHashMap<>();
        private ConflictResolver defaultResolver;

        private Builder(ScheduledExecutorService scheduler, DeltaTransport transport) {
            this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
            this.transport = Objects.requireNonNull(transport, "transport");
        }

        public Builder config(OptimizerConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder deltaSource(DeltaSource deltaSource) {
            this.deltaSource = Objects.requireNonNull(deltaSource, "deltaSource");
            return this;
        }

        public Builder metricsRecorder(MetricsRecorder metricsRecorder) {
            this.metricsRecorder = Objects.requireNonNull(metricsRecorder, "metricsRecorder");
            return this;
        }

        public Builder probe(ResourceProbe probe) {
            this.probe = Objects.requireNonNull(probe, "probe");
            return this;
        }

        public Builder conflictResolver(String conflictType, ConflictResolver resolver) {
            resolvers.put(Objects.requireNonNull(conflictType, "conflictType"),
                    Objects.requireNonNull(resolver, "resolver"));
            return this;
        }

        public Builder defaultConflictResolver(ConflictResolver resolver) {
            this.defaultResolver = Objects.requireNonNull(resolver, "resolver");
            return this;
        }

        public PerformanceOptimizer build() {
            return new PerformanceOptimizer(this);
        }
    }
}
