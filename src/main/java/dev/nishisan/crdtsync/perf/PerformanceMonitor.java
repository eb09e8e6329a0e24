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

package dev.nishisan.crdtsync.perf;

import dev.nishisan.crdtsync.common.PeriodicWorker;
import dev.nishisan.crdtsync.compression.CompressionResult;
import dev.nishisan.crdtsync.stats.list.BoundedHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Supplier;

/**
 * Times operations, samples their resource usage and keeps a bounded history
 * of {@link PerformanceSample}s with summary statistics.
 *
 * <p>
 * An optional background sampler logs process CPU and heap usage at a fixed
 * interval; it is started and stopped with {@link #start()} and
 * {@link #stop()}.
 * </p>
 */
public class PerformanceMonitor implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(PerformanceMonitor.class);

    /** Default number of samples retained. */
    public static final int DEFAULT_HISTORY_CAPACITY = 1000;

    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final BoundedHistory<PerformanceSample> history;
    private final ResourceProbe probe;
    private final Clock clock;
    private final ResourceSampler sampler;

    private PerformanceMonitor(Builder builder) {
        this.history = new BoundedHistory<>("performance-samples", builder.historyCapacity);
        this.probe = builder.probe;
        this.clock = builder.clock;
        this.sampler = builder.scheduler == null ? null
                : new ResourceSampler(builder.scheduler, builder.samplingInterval, builder.stopTimeout);
    }

    /**
     * Runs and measures an operation. A failing operation is recorded with
     * {@code success=false} and its exception is rethrown unchanged.
     *
     * @param operationType label of the operation
     * @param operation     the operation
     * @param <T>           result type
     * @return the operation result
     * @throws Exception whatever the operation throws
     */
    public <T> T measure(String operationType, Callable<T> operation) throws Exception {
        Objects.requireNonNull(operationType, "operationType");
        Objects.requireNonNull(operation, "operation");
        long startNanos = System.nanoTime();
        long startHeap = probe.usedHeapBytes();
        long startCpu = probe.currentThreadCpuNanos();
        boolean success = false;
        T result = null;
        try {
            result = operation.call();
            success = true;
            return result;
        } catch (Exception e) {
            logger.debug("Operation {} failed: {}", operationType, e.toString());
            throw e;
        } finally {
            long elapsedNanos = System.nanoTime() - startNanos;
            long endHeap = probe.usedHeapBytes();
            long endCpu = probe.currentThreadCpuNanos();
            double cpuPercent = 0.0;
            if (startCpu >= 0 && endCpu >= 0 && elapsedNanos > 0) {
                cpuPercent = Math.min(100.0, Math.max(0.0, (endCpu - startCpu) * 100.0 / elapsedNanos));
            }
            record(new PerformanceSample(
                    operationType,
                    elapsedNanos / 1_000_000.0,
                    Math.max(0.0, (endHeap - startHeap) / BYTES_PER_MB),
                    cpuPercent,
                    clock.instant(),
                    success,
                    success ? payloadSize(result) : 0L));
        }
    }

    /**
     * Unchecked variant of {@link #measure(String, Callable)}.
     */
    public <T> T measureSupplier(String operationType, Supplier<T> operation) {
        Objects.requireNonNull(operation, "operation");
        try {
            return measure(operationType, operation::get);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Operation " + operationType + " failed", e);
        }
    }

    /**
     * Measures an operation without result.
     */
    public void measureRunnable(String operationType, Runnable operation) {
        Objects.requireNonNull(operation, "operation");
        measureSupplier(operationType, () -> {
            operation.run();
            return null;
        });
    }

    /**
     * Appends an externally produced sample.
     *
     * @param sample the sample
     */
    public void record(PerformanceSample sample) {
        history.add(sample);
        logger.trace("Recorded {} sample: {} ms", sample.operationType(), sample.latencyMs());
    }

    /**
     * @return summary over every retained sample
     */
    public PerformanceSummary summary() {
        return summary(null);
    }

    /**
     * @param operationType operation to summarize, or {@code null} for all
     * @return the summary, or {@link PerformanceSummary#noData(String)} when
     *         nothing matched
     */
    public PerformanceSummary summary(String operationType) {
        List<PerformanceSample> samples = operationType == null
                ? history.snapshot()
                : history.filter(s -> s.operationType().equals(operationType));
        if (samples.isEmpty()) {
            return PerformanceSummary.noData(operationType);
        }
        int n = samples.size();
        double[] latencies = new double[n];
        double latencySum = 0;
        double memorySum = 0;
        double memoryPeak = 0;
        double cpuSum = 0;
        double cpuPeak = 0;
        int successes = 0;
        for (int i = 0; i < n; i++) {
            PerformanceSample sample = samples.get(i);
            latencies[i] = sample.latencyMs();
            latencySum += sample.latencyMs();
            memorySum += sample.memoryUsageMb();
            memoryPeak = Math.max(memoryPeak, sample.memoryUsageMb());
            cpuSum += sample.cpuUsagePercent();
            cpuPeak = Math.max(cpuPeak, sample.cpuUsagePercent());
            if (sample.success()) {
                successes++;
            }
        }
        Arrays.sort(latencies);
        int p95Index = Math.min(n - 1, (int) (n * 0.95));
        return new PerformanceSummary(
                operationType,
                true,
                n,
                (double) successes / n,
                new PerformanceSummary.Latency(latencySum / n, latencies[0], latencies[n - 1], latencies[p95Index]),
                new PerformanceSummary.Usage(memorySum / n, memoryPeak),
                new PerformanceSummary.Usage(cpuSum / n, cpuPeak));
    }

    /**
     * @return retained samples, oldest first
     */
    public List<PerformanceSample> samples() {
        return history.snapshot();
    }

    /**
     * @return distinct operation types in the history
     */
    public Set<String> operationTypes() {
        Set<String> types = new TreeSet<>();
        history.snapshot().forEach(s -> types.add(s.operationType()));
        return types;
    }

    public int historySize() {
        return history.size();
    }

    /**
     * Starts the background resource sampler, if a scheduler was configured.
     */
    public void start() {
        if (sampler != null) {
            sampler.start();
        }
    }

    /**
     * Stops the background resource sampler.
     *
     * @return {@code false} if the sampler had to be abandoned
     */
    public boolean stop() {
        return sampler == null || sampler.stop();
    }

    public boolean isMonitoring() {
        return sampler != null && sampler.isRunning();
    }

    @Override
    public void close() {
        stop();
    }

    private static long payloadSize(Object result) {
        if (result instanceof byte[]) {
            return ((byte[]) result).length;
        }
        if (result instanceof CompressionResult) {
            return ((CompressionResult) result).originalSize();
        }
        if (result instanceof CharSequence) {
            return ((CharSequence) result).length();
        }
        return 0L;
    }

    private final class ResourceSampler extends PeriodicWorker {
        private long ticks;

        private ResourceSampler(ScheduledExecutorService scheduler, Duration interval, Duration stopTimeout) {
            super("performance-monitor", scheduler, interval, stopTimeout);
        }

        @Override
        protected void tick() {
            double heapMb = probe.usedHeapBytes() / BYTES_PER_MB;
            double cpu = probe.processCpuPercent();
            if (ticks++ % 10 == 0) {
                logger.debug("System: CPU {}%, heap {} MB, {} samples retained",
                        String.format(java.util.Locale.ROOT, "%.1f", cpu),
                        String.format(java.util.Locale.ROOT, "%.1f", heapMb),
                        history.size());
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link PerformanceMonitor}.
     */
    public static final class Builder {
        private int historyCapacity = DEFAULT_HISTORY_CAPACITY;
        private ResourceProbe probe = ResourceProbe.jvm();
        private Clock clock = Clock.systemUTC();
        private ScheduledExecutorService scheduler;
        private Duration samplingInterval = Duration.ofSeconds(10);
        private Duration stopTimeout = PeriodicWorker.DEFAULT_STOP_TIMEOUT;

        private Builder() {
        }

        public Builder historyCapacity(int historyCapacity) {
            this.historyCapacity = historyCapacity;
            return this;
        }

        public Builder probe(ResourceProbe probe) {
            this.probe = Objects.requireNonNull(probe, "probe");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /**
         * Enables the background resource sampler.
         *
         * @param scheduler        shared scheduler
         * @param samplingInterval sampling interval
         * @return this builder
         */
        public Builder sampling(ScheduledExecutorService scheduler, Duration samplingInterval) {
            this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
            this.samplingInterval = Objects.requireNonNull(samplingInterval, "samplingInterval");
            return this;
        }

        public Builder stopTimeout(Duration stopTimeout) {
            this.stopTimeout = Objects.requireNonNull(stopTimeout, "stopTimeout");
            return this;
        }

        public PerformanceMonitor build() {
            return new PerformanceMonitor(this);
        }
    }
}
