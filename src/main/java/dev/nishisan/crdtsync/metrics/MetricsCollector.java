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

package dev.nishisan.crdtsync.metrics;

import dev.nishisan.crdtsync.common.PeriodicWorker;
import dev.nishisan.crdtsync.conflict.ConflictRecord;
import dev.nishisan.crdtsync.stats.list.BoundedHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;

/**
 * Keeps bounded histories of health samples, sync attempts and conflicts and
 * derives the composite health score and windowed aggregates from them.
 *
 * <p>
 * When built with a {@link HealthSampleSource} the collector also runs a
 * periodic sampler that records one sample per tick and hands it to the
 * registered sample listeners.
 * </p>
 */
public class MetricsCollector implements MetricsRecorder, Closeable {

    private static final Logger logger = LoggerFactory.getLogger(MetricsCollector.class);

    public static final int DEFAULT_HISTORY_CAPACITY = 1000;
    public static final Duration DEFAULT_SAMPLE_INTERVAL = Duration.ofSeconds(30);
    /** Number of most recent health samples the score is computed over. */
    public static final int SCORE_SAMPLE_COUNT = 10;
    /** Trailing window for the conflict component of the score. */
    public static final Duration CONFLICT_SCORE_WINDOW = Duration.ofHours(1);

    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final Clock clock;
    private final BoundedHistory<HealthSample> healthHistory;
    private final BoundedHistory<SyncAttempt> syncHistory;
    private final BoundedHistory<ConflictRecord> conflictHistory;
    private final List<Consumer<HealthSample>> sampleListeners = new CopyOnWriteArrayList<>();
    private final Sampler sampler;

    private MetricsCollector(Builder builder) {
        this.clock = builder.clock;
        this.healthHistory = new BoundedHistory<>("health-samples", builder.historyCapacity);
        this.syncHistory = new BoundedHistory<>("sync-attempts", builder.historyCapacity);
        this.conflictHistory = new BoundedHistory<>("conflicts", builder.historyCapacity);
        this.sampler = builder.source == null ? null
                : new Sampler(builder.scheduler, builder.source, builder.sampleInterval, builder.stopTimeout);
    }

    @Override
    public void recordHealthSample(HealthSample sample) {
        healthHistory.add(Objects.requireNonNull(sample, "sample"));
    }

    @Override
    public void recordSyncAttempt(SyncAttempt attempt) {
        syncHistory.add(Objects.requireNonNull(attempt, "attempt"));
    }

    @Override
    public void recordConflict(ConflictRecord conflict) {
        conflictHistory.add(Objects.requireNonNull(conflict, "conflict"));
    }

    /**
     * Registers a listener invoked with every sample taken by the periodic
     * sampler.
     *
     * @param listener the listener
     */
    public void addSampleListener(Consumer<HealthSample> listener) {
        sampleListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeSampleListener(Consumer<HealthSample> listener) {
        sampleListeners.remove(listener);
    }

    /**
     * @return the current composite health score in [0,100]
     */
    public double currentHealthScore() {
        return healthScore().overall();
    }

    /**
     * Computes the composite score over the last {@value #SCORE_SAMPLE_COUNT}
     * health samples and the conflicts of the trailing hour. An empty sample
     * history scores 100.
     *
     * @return the score and its components
     */
    public HealthScore healthScore() {
        List<HealthSample> recent = healthHistory.tail(SCORE_SAMPLE_COUNT);
        if (recent.isEmpty()) {
            return HealthScore.healthy();
        }
        return HealthScore.weighted(
                syncScore(recent),
                conflictScore(),
                performanceScore(recent),
                consistencyScore(recent),
                recent.size());
    }

    static double syncScore(List<HealthSample> samples) {
        long successful = 0;
        long total = 0;
        for (HealthSample sample : samples) {
            successful += sample.successfulSyncs();
            total += sample.successfulSyncs() + sample.failedSyncs();
        }
        if (total == 0) {
            return 100.0;
        }
        return (double) successful / total * 100.0;
    }

    double conflictScore() {
        Instant since = clock.instant().minus(CONFLICT_SCORE_WINDOW);
        List<ConflictRecord> recent = conflictHistory.filter(c -> c.detectedAt().isAfter(since));
        if (recent.isEmpty()) {
            return 100.0;
        }
        long resolved = recent.stream().filter(ConflictRecord::success).count();
        long manual = recent.stream().filter(ConflictRecord::manualIntervention).count();
        double resolutionRate = (double) resolved / recent.size();
        double manualPenalty = (double) manual / recent.size() * 20.0;
        return Math.max(0.0, resolutionRate * 100.0 - manualPenalty);
    }

    static double performanceScore(List<HealthSample> samples) {
        double impact = samples.stream().mapToDouble(HealthSample::performanceImpactPercent).average().orElse(0.0);
        if (impact <= 5.0) {
            return 100.0;
        }
        if (impact <= 15.0) {
            return 90.0;
        }
        if (impact <= 30.0) {
            return 75.0;
        }
        return Math.max(50.0, 100.0 - impact);
    }

    static double consistencyScore(List<HealthSample> samples) {
        return samples.stream().mapToDouble(HealthSample::dataConsistencyScore).average().orElse(1.0) * 100.0;
    }

    /**
     * Aggregates the sync attempts of the trailing window.
     *
     * @param windowHours window length in hours
     * @return the trend, or {@link SyncPerformanceTrend#noData(int)}
     */
    public SyncPerformanceTrend syncPerformanceTrend(int windowHours) {
        List<SyncAttempt> attempts = syncAttemptsSince(windowStart(windowHours));
        if (attempts.isEmpty()) {
            return SyncPerformanceTrend.noData(windowHours);
        }
        int successful = 0;
        double successfulDuration = 0;
        long bandwidth = 0;
        double ratioSum = 0;
        for (SyncAttempt attempt : attempts) {
            if (attempt.success()) {
                successful++;
                successfulDuration += attempt.durationMs();
            }
            bandwidth += attempt.bandwidthBytes();
            ratioSum += attempt.compressionRatio();
        }
        int total = attempts.size();
        return new SyncPerformanceTrend(
                true,
                windowHours,
                total,
                successful,
                total - successful,
                (double) successful / total,
                successful == 0 ? 0.0 : successfulDuration / successful,
                bandwidth / BYTES_PER_MB,
                ratioSum / total);
    }

    /**
     * Aggregates the conflicts detected in the trailing window.
     *
     * @param windowHours window length in hours
     * @return the analysis, or {@link ConflictAnalysis#noData(int)}
     */
    public ConflictAnalysis conflictAnalysis(int windowHours) {
        List<ConflictRecord> conflicts = conflictsSince(windowStart(windowHours));
        if (conflicts.isEmpty()) {
            return ConflictAnalysis.noData(windowHours);
        }
        int resolved = 0;
        double resolutionTime = 0;
        int manual = 0;
        Map<String, Integer> types = new LinkedHashMap<>();
        Map<String, Integer> strategies = new LinkedHashMap<>();
        for (ConflictRecord conflict : conflicts) {
            Double duration = conflict.resolutionDurationMs();
            if (conflict.resolvedAt() != null && duration != null) {
                resolved++;
                resolutionTime += duration;
            }
            if (conflict.manualIntervention()) {
                manual++;
            }
            types.merge(conflict.conflictType(), 1, Integer::sum);
            strategies.merge(conflict.resolutionStrategy(), 1, Integer::sum);
        }
        int total = conflicts.size();
        return new ConflictAnalysis(
                true,
                windowHours,
                total,
                resolved,
                (double) resolved / total,
                resolved == 0 ? 0.0 : resolutionTime / resolved,
                types,
                strategies,
                manual);
    }

    /**
     * @param windowHours window length in hours
     * @return the exclusive lower bound of the window
     */
    public Instant windowStart(int windowHours) {
        if (windowHours < 0) {
            throw new IllegalArgumentException("windowHours must be >= 0");
        }
        return clock.instant().minus(Duration.ofHours(windowHours));
    }

    public List<HealthSample> healthSamplesSince(Instant since) {
        return healthHistory.filter(s -> s.timestamp().isAfter(since));
    }

    public List<SyncAttempt> syncAttemptsSince(Instant since) {
        return syncHistory.filter(a -> a.timestamp().isAfter(since));
    }

    public List<ConflictRecord> conflictsSince(Instant since) {
        return conflictHistory.filter(c -> c.detectedAt().isAfter(since));
    }

    public List<HealthSample> healthSamples() {
        return healthHistory.snapshot();
    }

    public List<SyncAttempt> syncAttempts() {
        return syncHistory.snapshot();
    }

    public List<ConflictRecord> conflicts() {
        return conflictHistory.snapshot();
    }

    public Clock clock() {
        return clock;
    }

    /**
     * Starts the periodic sampler. Without a sample source this does nothing.
     */
    public void start() {
        if (sampler != null) {
            sampler.start();
        }
    }

    /**
     * @return {@code false} if an in-flight sample was abandoned
     */
    public boolean stop() {
        return sampler == null || sampler.stop();
    }

    public boolean isSampling() {
        return sampler != null && sampler.isRunning();
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Takes one sample from the source, records it and notifies listeners.
     * A failing source skips the sample.
     *
     * @param source the source
     * @return {@code true} if a sample was recorded
     */
    boolean sampleOnce(HealthSampleSource source) {
        HealthSample sample;
        try {
            sample = source.collect();
        } catch (Exception e) {
            logger.warn("Health sample collection failed, skipping this tick", e);
            return false;
        }
        if (sample == null) {
            logger.debug("Health sample source returned nothing");
            return false;
        }
        recordHealthSample(sample);
        for (Consumer<HealthSample> listener : sampleListeners) {
            try {
                listener.accept(sample);
            } catch (RuntimeException e) {
                logger.warn("Sample listener failed", e);
            }
        }
        return true;
    }

    private final class Sampler extends PeriodicWorker {
        private final HealthSampleSource source;

        private Sampler(ScheduledExecutorService scheduler, HealthSampleSource source, Duration interval,
                Duration stopTimeout) {
            super("metrics-collector", scheduler, interval, stopTimeout);
            this.source = source;
        }

        @Override
        protected void tick() {
            sampleOnce(source);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link MetricsCollector}.
     */
    public static final class Builder {
        private Clock clock = Clock.systemUTC();
        private int historyCapacity = DEFAULT_HISTORY_CAPACITY;
        private ScheduledExecutorService scheduler;
        private HealthSampleSource source;
        private Duration sampleInterval = DEFAULT_SAMPLE_INTERVAL;
        private Duration stopTimeout = PeriodicWorker.DEFAULT_STOP_TIMEOUT;

        private Builder() {
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder historyCapacity(int historyCapacity) {
            this.historyCapacity = historyCapacity;
            return this;
        }

        /**
         * Enables periodic sampling.
         *
         * @param scheduler shared scheduler
         * @param source    sample source
         * @return this builder
         */
        public Builder sampling(ScheduledExecutorService scheduler, HealthSampleSource source) {
            this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
            this.source = Objects.requireNonNull(source, "source");
            return this;
        }

        public Builder sampleInterval(Duration sampleInterval) {
            this.sampleInterval = Objects.requireNonNull(sampleInterval, "sampleInterval");
            return this;
        }

        public Builder stopTimeout(Duration stopTimeout) {
            this.stopTimeout = Objects.requireNonNull(stopTimeout, "stopTimeout");
            return this;
        }

        public MetricsCollector build() {
            return new MetricsCollector(this);
        }
    }
}
