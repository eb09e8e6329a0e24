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

import dev.nishisan.crdtsync.alerting.AlertSeverity;
import dev.nishisan.crdtsync.alerting.AlertingSummary;
import dev.nishisan.crdtsync.metrics.ConflictAnalysis;
import dev.nishisan.crdtsync.metrics.HealthScore;
import dev.nishisan.crdtsync.metrics.SyncPerformanceTrend;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link HealthReportWriter}.
 */
class HealthReportWriterTest {

    @TempDir
    Path tempDir;

    private HealthReport createReport(boolean withSyncData) {
        HealthScore score = new HealthScore(88.456, 80.0, 100.0, 90.0, 85.0, 4);
        SyncPerformanceTrend trend = withSyncData
                ? new SyncPerformanceTrend(true, 24, 10, 9, 1, 0.9, 123.456, 1.5, 2.42)
                : SyncPerformanceTrend.noData(24);
        return new HealthReport(
                Instant.parse("2025-01-01T00:00:00Z"),
                88.456,
                HealthStatus.fromScore(88.456),
                score,
                trend,
                ConflictAnalysis.noData(24),
                List.of(RecommendationEngine.OPTIMAL),
                new AlertingSummary(4, 2, Map.of(AlertSeverity.HIGH, 2)));
    }

    @Test
    void reportWritesYamlFile() throws Exception {
        Path outputFile = tempDir.resolve("reports/health.yaml");
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();

        try {
            HealthReportWriter writer = new HealthReportWriter(() -> createReport(true), scheduler, outputFile,
                    Duration.ofMinutes(5), Duration.ofSeconds(1));

            assertTrue(writer.report());

            assertTrue(Files.exists(outputFile));
            String content = Files.readString(outputFile);
            assertTrue(content.contains("health:"));
            assertTrue(content.contains("sync:"));
            assertTrue(content.contains("conflicts:"));
            assertTrue(content.contains("alerting:"));
            assertTrue(content.contains("overallScore: 88.46"));
            assertTrue(content.contains("averageDurationMs: 123.46"));
            assertTrue(content.contains("recentAlerts: 2"));

            writer.close();
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    void buildDashboardStructure() {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();

        try {
            HealthReportWriter writer = new HealthReportWriter(() -> createReport(false), scheduler,
                    tempDir.resolve("unused.yaml"), Duration.ofMinutes(5), Duration.ofSeconds(1));

            Map<String, Object> dashboard = writer.buildDashboard(createReport(false));

            assertEquals(List.of("generatedAt", "health", "sync", "conflicts", "alerting", "recommendations"),
                    List.copyOf(dashboard.keySet()));
            assertEquals("2025-01-01T00:00:00Z", dashboard.get("generatedAt"));

            @SuppressWarnings("unchecked")
            Map<String, Object> health = (Map<String, Object>) dashboard.get("health");
            assertEquals(88.46, health.get("overallScore"));
            assertEquals("GOOD", health.get("status"));
            assertEquals(4, health.get("samplesConsidered"));

            @SuppressWarnings("unchecked")
            Map<String, Object> sync = (Map<String, Object>) dashboard.get("sync");
            assertEquals("no_data", sync.get("status"));
            assertFalse(sync.containsKey("totalSyncs"));

            @SuppressWarnings("unchecked")
            Map<String, Object> alerting = (Map<String, Object>) dashboard.get("alerting");
            assertEquals(4, alerting.get("activeRules"));
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    void nullReportDoesNotWriteFile() {
        Path outputFile = tempDir.resolve("health-null.yaml");
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();

        try {
            HealthReportWriter writer = new HealthReportWriter(() -> null, scheduler, outputFile,
                    Duration.ofMinutes(5), Duration.ofSeconds(1));

            assertFalse(writer.report());
            assertFalse(Files.exists(outputFile));
            assertNull(writer.toYaml());
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    void failingSupplierIsReportedAsNotWritten() {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();

        try {
            HealthReportWriter writer = new HealthReportWriter(() -> {
                throw new IllegalStateException("collector closed");
            }, scheduler, tempDir.resolve("health.yaml"), Duration.ofMinutes(5), Duration.ofSeconds(1));

            assertFalse(writer.report());
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    void periodicWriterRefreshesFile() {
        Path outputFile = tempDir.resolve("periodic.yaml");
        AtomicReference<HealthReport> current = new AtomicReference<>(createReport(false));
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();

        try {
            HealthReportWriter writer = new HealthReportWriter(current::get, scheduler, outputFile,
                    Duration.ofMillis(50), Duration.ofSeconds(1));
            writer.start();

            await("first report").atMost(5, TimeUnit.SECONDS).until(() -> Files.exists(outputFile));
            current.set(createReport(true));
            await("refreshed report").atMost(5, TimeUnit.SECONDS)
                    .until(() -> Files.readString(outputFile).contains("totalSyncs: 10"));

            assertTrue(writer.stop());
        } finally {
            scheduler.shutdownNow();
        }
    }
}
