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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import dev.nishisan.crdtsync.alerting.AlertingSummary;
import dev.nishisan.crdtsync.common.PeriodicWorker;
import dev.nishisan.crdtsync.metrics.ConflictAnalysis;
import dev.nishisan.crdtsync.metrics.HealthScore;
import dev.nishisan.crdtsync.metrics.SyncPerformanceTrend;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodically generates a {@link HealthReport} and writes it as YAML to a
 * file on disk, for monitoring scripts or log aggregators.
 */
public final class HealthReportWriter extends PeriodicWorker {

    private static final Logger LOGGER = Logger.getLogger(HealthReportWriter.class.getName());

    private static final ObjectMapper YAML_MAPPER;

    static {
        YAMLFactory factory = YAMLFactory.builder()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .build();
        YAML_MAPPER = new ObjectMapper(factory);
        YAML_MAPPER.findAndRegisterModules();
    }

    private final Supplier<HealthReport> reportSupplier;
    private final Path outputPath;

    /**
     * @param reportSupplier supplies the report on each tick
     * @param scheduler      shared scheduler for periodic execution
     * @param outputPath     path to write the YAML report to
     * @param reportInterval interval between reports
     * @param stopTimeout    bound for {@link #stop()}
     */
    public HealthReportWriter(Supplier<HealthReport> reportSupplier,
            ScheduledExecutorService scheduler,
            Path outputPath,
            Duration reportInterval,
            Duration stopTimeout) {
        super("health-report-writer", scheduler, reportInterval, stopTimeout);
        this.reportSupplier = Objects.requireNonNull(reportSupplier, "reportSupplier");
        this.outputPath = Objects.requireNonNull(outputPath, "outputPath");
    }

    @Override
    protected void tick() {
        report();
    }

    /**
     * Generates a report and writes it. Can be called manually.
     *
     * @return {@code true} if the file was written
     */
    public boolean report() {
        try {
            HealthReport report = reportSupplier.get();
            if (report == null) {
                return false;
            }
            String yaml = YAML_MAPPER.writeValueAsString(buildDashboard(report));
            Path parent = outputPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(outputPath, yaml);
            LOGGER.fine(() -> "Health report written to " + outputPath);
            return true;
        } catch (IOException | RuntimeException e) {
            LOGGER.log(Level.WARNING, "Health report generation failed", e);
            return false;
        }
    }

    /**
     * Builds the YAML document structure from the report.
     * Package-private for testing.
     */
    Map<String, Object> buildDashboard(HealthReport report) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("generatedAt", report.timestamp().toString());

        Map<String, Object> health = new LinkedHashMap<>();
        health.put("overallScore", round(report.overallHealthScore()));
        health.put("status", report.healthStatus().name());
        HealthScore score = report.scoreBreakdown();
        Map<String, Object> components = new LinkedHashMap<>();
        components.put("sync", round(score.sync()));
        components.put("conflict", round(score.conflict()));
        components.put("performance", round(score.performance()));
        components.put("consistency", round(score.consistency()));
        health.put("components", components);
        health.put("samplesConsidered", score.samplesConsidered());
        root.put("health", health);

        SyncPerformanceTrend trend = report.syncPerformanceTrend();
        Map<String, Object> sync = new LinkedHashMap<>();
        sync.put("windowHours", trend.windowHours());
        if (trend.hasData()) {
            sync.put("totalSyncs", trend.totalSyncs());
            sync.put("successRate", round(trend.successRate()));
            sync.put("averageDurationMs", round(trend.averageDurationMs()));
            sync.put("totalBandwidthMb", round(trend.totalBandwidthMb()));
            sync.put("averageCompressionRatio", round(trend.averageCompressionRatio()));
        } else {
            sync.put("status", "no_data");
        }
        root.put("sync", sync);

        ConflictAnalysis analysis = report.conflictAnalysis();
        Map<String, Object> conflicts = new LinkedHashMap<>();
        conflicts.put("windowHours", analysis.windowHours());
        if (analysis.hasData()) {
            conflicts.put("totalConflicts", analysis.totalConflicts());
            conflicts.put("resolutionRate", round(analysis.resolutionRate()));
            conflicts.put("averageResolutionTimeMs", round(analysis.averageResolutionTimeMs()));
            conflicts.put("conflictTypes", analysis.conflictTypes());
            conflicts.put("manualInterventions", analysis.manualInterventions());
        } else {
            conflicts.put("status", "no_data");
        }
        root.put("conflicts", conflicts);

        AlertingSummary alerting = report.alertingSummary();
        Map<String, Object> alerts = new LinkedHashMap<>();
        alerts.put("activeRules", alerting.activeRules());
        alerts.put("recentAlerts", alerting.recentAlerts());
        alerts.put("bySeverity", alerting.alertsBySeverity());
        root.put("alerting", alerts);

        root.put("recommendations", report.recommendations());
        return root;
    }

    /**
     * Returns the YAML string representation of the current report.
     * Useful for programmatic access without touching the filesystem.
     *
     * @return YAML string, or null if no report is available
     */
    public String toYaml() {
        HealthReport report = reportSupplier.get();
        if (report == null) {
            return null;
        }
        try {
            return YAML_MAPPER.writeValueAsString(buildDashboard(report));
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Failed to serialize health report to YAML", e);
            return null;
        }
    }

    public Path outputPath() {
        return outputPath;
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
