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

package dev.nishisan.crdtsync.monitoring;

import dev.nishisan.crdtsync.alerting.Alert;
import dev.nishisan.crdtsync.alerting.AlertListener;
import dev.nishisan.crdtsync.alerting.AlertRule;
import dev.nishisan.crdtsync.alerting.AlertingEngine;
import dev.nishisan.crdtsync.alerting.DefaultAlertRules;
import dev.nishisan.crdtsync.alerting.LoggingAlertListener;
import dev.nishisan.crdtsync.config.InvalidConfigurationException;
import dev.nishisan.crdtsync.metrics.ConflictAnalysis;
import dev.nishisan.crdtsync.metrics.HealthSample;
import dev.nishisan.crdtsync.metrics.HealthSampleSource;
import dev.nishisan.crdtsync.metrics.HealthScore;
import dev.nishisan.crdtsync.metrics.MetricsCollector;
import dev.nishisan.crdtsync.metrics.MetricsExporter;
import dev.nishisan.crdtsync.metrics.SyncPerformanceTrend;

import java.io.Closeable;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ScheduledExecutorService;
import java.util.logging.Logger;

/**
 * Lifecycle owner of the metrics collector and the alerting engine. Every
 * sample taken by the periodic sampler, or pushed through
 * {@link #recordHealthSample(HealthSample)}, is also evaluated against the
 * alert rules.
 */
public final class MonitoringCoordinator implements Closeable {

    private static final Logger LOGGER = Logger.getLogger(MonitoringCoordinator.class.getName());

    private final MonitoringConfig config;
    private final Clock clock;
    private final MetricsCollector collector;
    private final AlertingEngine alertingEngine;
    private final MetricsExporter exporter;
    private final HealthReportWriter reportWriter;

    private MonitoringCoordinator(Builder builder) {
        this.config = builder.config;
        this.clock = builder.clock;

        MetricsCollector.Builder collectorBuilder = MetricsCollector.builder()
                .clock(clock)
                .historyCapacity(config.historyCapacity())
                .sampleInterval(config.sampleInterval())
                .stopTimeout(config.stopTimeout());
        if (builder.sampleSource != null) {
            collectorBuilder.sampling(builder.scheduler, builder.sampleSource);
        }
        this.collector = collectorBuilder.build();

        AlertingEngine.Builder engineBuilder = AlertingEngine.builder()
                .clock(clock)
                .historyCapacity(config.historyCapacity());
        for (AlertRule rule : initialRules(config, builder.rules)) {
            engineBuilder.rule(rule);
        }
        if (config.loggingListener()) {
            engineBuilder.listener(new LoggingAlertListener());
        }
        builder.listeners.forEach(engineBuilder::listener);
        this.alertingEngine = engineBuilder.build();

        this.collector.addSampleListener(alertingEngine::checkAlerts);
        this.exporter = new MetricsExporter(collector);
        this.reportWriter = config.reportPath() == null ? null
                : new HealthReportWriter(this::getComprehensiveHealthReport, builder.scheduler,
                        config.reportPath(), config.reportInterval(), config.stopTimeout());
    }

    /**
     * Resolves the starting rule set: the presets (when enabled) followed by
     * the custom rules, with the configured overrides applied.
     */
    static List<AlertRule> initialRules(MonitoringConfig config, List<AlertRule> customRules) {
        List<AlertRule> rules = new ArrayList<>();
        if (config.defaultRules()) {
            rules.addAll(DefaultAlertRules.all());
        }
        rules.addAll(customRules);

        Set<String> names = new HashSet<>();
        rules.forEach(r -> names.add(r.name()));
        checkKnown(config.disabledRules(), names);
        checkKnown(config.cooldownOverrides().keySet(), names);
        checkKnown(config.severityOverrides().keySet(), names);

        List<AlertRule> resolved = new ArrayList<>(rules.size());
        for (AlertRule rule : rules) {
            AlertRule effective = rule;
            if (config.disabledRules().contains(rule.name())) {
                effective = effective.withEnabled(false);
            }
            if (config.cooldownOverrides().containsKey(rule.name())) {
                effective = effective.withCooldown(config.cooldownOverrides().get(rule.name()));
            }
            if (config.severityOverrides().containsKey(rule.name())) {
                effective = effective.withSeverity(config.severityOverrides().get(rule.name()));
            }
            resolved.add(effective);
        }
        return resolved;
    }

    private static void checkKnown(Set<String> referenced, Set<String> known) {
        for (String name : referenced) {
            if (!known.contains(name)) {
                throw new InvalidConfigurationException("Unknown alert rule: " + name);
            }
        }
    }

    /**
     * Starts the periodic sampler and the report writer, where configured.
     */
    public void start() {
        collector.start();
        if (reportWriter != null) {
            reportWriter.start();
        }
        LOGGER.info(() -> "Monitoring started (sampling "
                + (collector.isSampling() ? "every " + config.sampleInterval() : "off") + ")");
    }

    /**
     * Stops the background workers, waiting for each at most the configured
     * stop timeout.
     *
     * @return {@code false} if any worker was abandoned
     */
    public boolean stop() {
        boolean clean = collector.stop();
        if (reportWriter != null) {
            clean &= reportWriter.stop();
        }
        return clean;
    }

    public boolean isRunning() {
        return collector.isSampling() || (reportWriter != null && reportWriter.isRunning());
    }

    /**
     * Records a sample and evaluates the alert rules against it.
     *
     * @param sample the sample
     * @return the alerts raised
     */
    public List<Alert> recordHealthSample(HealthSample sample) {
        collector.recordHealthSample(sample);
        return alertingEngine.checkAlerts(sample);
    }

    /**
     * Builds a report over the configured report window.
     *
     * @return the report
     */
    public HealthReport getComprehensiveHealthReport() {
        HealthScore score = collector.healthScore();
        SyncPerformanceTrend trend = collector.syncPerformanceTrend(config.reportWindowHours());
        ConflictAnalysis conflicts = collector.conflictAnalysis(config.reportWindowHours());
        return new HealthReport(
                clock.instant(),
                score.overall(),
                HealthStatus.fromScore(score.overall()),
                score,
                trend,
                conflicts,
                RecommendationEngine.recommend(score.overall(), trend, conflicts),
                alertingEngine.summary());
    }

    /**
     * @param windowHours window length in hours
     * @return the metrics export document as JSON
     */
    public String exportMetrics(int windowHours) {
        return exporter.export(windowHours);
    }

    public MetricsCollector collector() {
        return collector;
    }

    public AlertingEngine alertingEngine() {
        return alertingEngine;
    }

    public MonitoringConfig config() {
        return config;
    }

    @Override
    public void close() {
        stop();
    }

    public static Builder builder(ScheduledExecutorService scheduler) {
        return new Builder(scheduler);
    }

    /**
     * Builder for {@link MonitoringCoordinator}.
     */
    public static final class Builder {
        private final ScheduledExecutorService scheduler;
        private MonitoringConfig config = MonitoringConfig.defaults();
        private Clock clock = Clock.systemUTC();
        private HealthSampleSource sampleSource;
        private final List<AlertRule> rules = new ArrayList<>();
        private final List<AlertListener> listeners = new ArrayList<>();

        private Builder(ScheduledExecutorService scheduler) {
            this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        }

        public Builder config(MonitoringConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder sampleSource(HealthSampleSource sampleSource) {
            this.sampleSource = Objects.requireNonNull(sampleSource, "sampleSource");
            return this;
        }

        public Builder rule(AlertRule rule) {
            rules.add(Objects.requireNonNull(rule, "rule"));
            return this;
        }

        public Builder listener(AlertListener listener) {
            listeners.add(Objects.requireNonNull(listener, "listener"));
            return this;
        }

        public MonitoringCoordinator build() {
            return new MonitoringCoordinator(this);
        }
    }
}
