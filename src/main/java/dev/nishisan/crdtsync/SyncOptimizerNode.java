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

package dev.nishisan.crdtsync;

import dev.nishisan.crdtsync.config.SyncOptimizerConfigLoader;
import dev.nishisan.crdtsync.config.SyncOptimizerYamlConfig;
import dev.nishisan.crdtsync.conflict.ConflictResolver;
import dev.nishisan.crdtsync.metrics.HealthSampleSource;
import dev.nishisan.crdtsync.monitoring.HealthReport;
import dev.nishisan.crdtsync.monitoring.MonitoringConfig;
import dev.nishisan.crdtsync.monitoring.MonitoringCoordinator;
import dev.nishisan.crdtsync.optimizer.DeltaSource;
import dev.nishisan.crdtsync.optimizer.DeltaTransport;
import dev.nishisan.crdtsync.optimizer.OptimizerConfig;
import dev.nishisan.crdtsync.optimizer.PerformanceOptimizer;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Per-node context owning the shared scheduler, the
 * {@link PerformanceOptimizer} and the {@link MonitoringCoordinator}. Sync
 * outcomes and conflicts reported by the optimizer flow into the
 * coordinator's metrics collector.
 *
 * <p>
 * The node is created stopped; callers own {@link #start()} and
 * {@link #close()}.
 * </p>
 */
public final class SyncOptimizerNode implements Closeable {

    private static final Logger LOGGER = Logger.getLogger(SyncOptimizerNode.class.getName());

    static final int SCHEDULER_THREADS = 4;

    private final ScheduledThreadPoolExecutor scheduler;
    private final PerformanceOptimizer optimizer;
    private final MonitoringCoordinator coordinator;
    private volatile boolean started;

    private SyncOptimizerNode(Builder builder) {
        AtomicInteger threadCounter = new AtomicInteger();
        this.scheduler = new ScheduledThreadPoolExecutor(SCHEDULER_THREADS, r -> {
            Thread t = new Thread(r, "crdt-sync-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.scheduler.setRemoveOnCancelPolicy(true);

        MonitoringCoordinator.Builder coordinatorBuilder = MonitoringCoordinator.builder(scheduler)
                .config(builder.monitoringConfig)
                .clock(builder.clock);
        if (builder.sampleSource != null) {
            coordinatorBuilder.sampleSource(builder.sampleSource);
        }
        this.coordinator = coordinatorBuilder.build();

        PerformanceOptimizer.Builder optimizerBuilder = PerformanceOptimizer.builder(scheduler, builder.transport)
                .config(builder.optimizerConfig)
                .clock(builder.clock)
                .deltaSource(builder.deltaSource)
                .metricsRecorder(coordinator.collector());
        builder.resolvers.forEach(optimizerBuilder::conflictResolver);
        if (builder.defaultResolver != null) {
            optimizerBuilder.defaultConflictResolver(builder.defaultResolver);
        }
        this.optimizer = optimizerBuilder.build();
    }

    /**
     * Builds a node from a YAML configuration file.
     *
     * @param yamlFile  configuration file
     * @param transport transport used for scheduled syncs
     * @return a builder preloaded with the file's settings
     * @throws IOException if the file cannot be read
     */
    public static Builder fromYaml(Path yamlFile, DeltaTransport transport) throws IOException {
        SyncOptimizerYamlConfig yaml = SyncOptimizerConfigLoader.load(yamlFile);
        return builder(transport)
                .optimizerConfig(SyncOptimizerConfigLoader.convertToOptimizerConfig(yaml))
                .monitoringConfig(SyncOptimizerConfigLoader.convertToMonitoringConfig(yaml));
    }

    public synchronized void start() {
        if (started) {
            return;
        }
        if (scheduler.isShutdown()) {
            throw new IllegalStateException("Node already closed");
        }
        started = true;
        coordinator.start();
        optimizer.start();
        LOGGER.info(() -> "Sync optimizer node " + optimizer.config().nodeId() + " started");
    }

    public boolean isStarted() {
        return started;
    }

    public HealthReport getComprehensiveHealthReport() {
        return coordinator.getComprehensiveHealthReport();
    }

    public String exportMetrics(int windowHours) {
        return coordinator.exportMetrics(windowHours);
    }

    public PerformanceOptimizer optimizer() {
        return optimizer;
    }

    public MonitoringCoordinator coordinator() {
        return coordinator;
    }

    ScheduledExecutorService scheduler() {
        return scheduler;
    }

    /**
     * Stops both units, resolving pending conflicts, and shuts the scheduler
     * down.
     */
    @Override
    public synchronized void close() {
        if (scheduler.isShutdown()) {
            return;
        }
        started = false;
        optimizer.close();
        coordinator.close();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(optimizer.config().stopTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.warning("Scheduler did not terminate in time, forcing shutdown");
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
        }
        LOGGER.info(() -> "Sync optimizer node " + optimizer.config().nodeId() + " closed");
    }

    public static Builder builder(DeltaTransport transport) {
        return new Builder(transport);
    }

    /**
     * Builder for {@link SyncOptimizerNode}.
     */
    public static final class Builder {
        private final DeltaTransport transport;
        private OptimizerConfig optimizerConfig = OptimizerConfig.defaults();
        private MonitoringConfig monitoringConfig = MonitoringConfig.defaults();
        private Clock clock = Clock.systemUTC();
        private DeltaSource deltaSource = DeltaSource.none();
        private HealthSampleSource sampleSource;
        private final Map<String, ConflictResolver> resolvers = new LinkedHashMap<>();
        private ConflictResolver defaultResolver;

        private Builder(DeltaTransport transport) {
            this.transport = Objects.requireNonNull(transport, "transport");
        }

        public Builder optimizerConfig(OptimizerConfig optimizerConfig) {
            this.optimizerConfig = Objects.requireNonNull(optimizerConfig, "optimizerConfig");
            return this;
        }

        public Builder monitoringConfig(MonitoringConfig monitoringConfig) {
            this.monitoringConfig = Objects.requireNonNull(monitoringConfig, "monitoringConfig");
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

        public Builder sampleSource(HealthSampleSource sampleSource) {
            this.sampleSource = Objects.requireNonNull(sampleSource, "sampleSource");
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

        public SyncOptimizerNode build() {
            return new SyncOptimizerNode(this);
        }
    }
}
