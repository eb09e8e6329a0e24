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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.nishisan.crdtsync.MutableClock;
import dev.nishisan.crdtsync.alerting.Alert;
import dev.nishisan.crdtsync.alerting.AlertRule;
import dev.nishisan.crdtsync.alerting.AlertSeverity;
import dev.nishisan.crdtsync.alerting.DefaultAlertRules;
import dev.nishisan.crdtsync.config.InvalidConfigurationException;
import dev.nishisan.crdtsync.conflict.ConflictRecord;
import dev.nishisan.crdtsync.metrics.HealthSample;
import dev.nishisan.crdtsync.metrics.SyncAttempt;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class MonitoringCoordinatorTest {

    @TempDir
    Path tempDir;

    private ScheduledExecutorService scheduler;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newScheduledThreadPool(2);
        clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void freshCoordinatorReportsExcellentHealth() {
        MonitoringCoordinator coordinator = MonitoringCoordinator.builder(scheduler).clock(clock).build();

        HealthReport report = coordinator.getComprehensiveHealthReport();

        assertEquals(100.0, report.overallHealthScore());
        assertEquals(HealthStatus.EXCELLENT, report.healthStatus());
        assertFalse(report.syncPerformanceTrend().hasData());
        assertFalse(report.conflictAnalysis().hasData());
        assertEquals(List.of(RecommendationEngine.OPTIMAL), report.recommendations());
        assertEquals(4, report.alertingSummary().activeRules());
        assertEquals(clock.instant(), report.timestamp());
    }

    @Test
    void recordedSampleIsEvaluatedAgainstRules() {
        List<Alert> received = new CopyOnWriteArrayList<>();
        MonitoringCoordinator coordinator = MonitoringCoordinator.builder(scheduler)
                .clock(clock)
                .listener(received::add)
                .build();

        List<Alert> alerts = coordinator.recordHealthSample(HealthSample.builder(clock.instant())
                .syncs(2, 8)
                .build());

        assertEquals(1, alerts.size());
        assertEquals(DefaultAlertRules.HIGH_SYNC_FAILURE_RATE, alerts.get(0).ruleName());
        assertEquals(alerts, received);
        assertEquals(1, coordinator.collector().healthSamples().size());
    }

    @Test
    void degradedSystemProducesRecommendations() {
        MonitoringCoordinator coordinator = MonitoringCoordinator.builder(scheduler).clock(clock).build();
        for (int i = 0; i < 5; i++) {
            coordinator.recordHealthSample(HealthSample.builder(clock.instant())
                    .syncs(1, 9)
                    .dataConsistencyScore(0.6)
                    .build());
            coordinator.collector().recordSyncAttempt(
                    SyncAttempt.failed("peer-" + i, 40, "timeout", clock.instant()));
        }
        coordinator.collector().recordConflict(new ConflictRecord("c1", "counter", clock.instant(), "merge",
                List.of("a", "b"), false));

        HealthReport report = coordinator.getComprehensiveHealthReport();

        assertEquals(HealthStatus.CRITICAL, report.healthStatus());
        assertTrue(report.recommendations().contains(RecommendationEngine.LOW_HEALTH));
        assertTrue(report.recommendations().contains(RecommendationEngine.LOW_SYNC_SUCCESS));
        assertTrue(report.recommendations().contains(RecommendationEngine.LOW_RESOLUTION));
        assertFalse(report.recommendations().contains(RecommendationEngine.OPTIMAL));
        assertEquals(2, report.alertingSummary().recentAlerts());
    }

    @Test
    void overridesAreAppliedToRules() {
        MonitoringConfig config = MonitoringConfig.builder()
                .disableRule(DefaultAlertRules.HIGH_CONFLICT_RATE)
                .ruleCooldown(DefaultAlertRules.HIGH_SYNC_FAILURE_RATE, Duration.ZERO)
                .ruleSeverity(DefaultAlertRules.HIGH_SYNC_FAILURE_RATE, AlertSeverity.CRITICAL)
                .build();
        MonitoringCoordinator coordinator = MonitoringCoordinator.builder(scheduler)
                .config(config)
                .clock(clock)
                .build();

        HealthSample failing = HealthSample.builder(clock.instant()).syncs(0, 5).conflicts(50, 0).build();
        List<Alert> first = coordinator.recordHealthSample(failing);
        List<Alert> second = coordinator.recordHealthSample(failing);

        assertEquals(List.of(DefaultAlertRules.HIGH_SYNC_FAILURE_RATE),
                first.stream().map(Alert::ruleName).toList());
        assertEquals(AlertSeverity.CRITICAL, first.get(0).severity());
        assertEquals(1, second.size());
        assertEquals(3, coordinator.alertingEngine().summary().activeRules());
    }

    @Test
    void overrideOfUnknownRuleIsRejected() {
        MonitoringConfig config = MonitoringConfig.builder().disableRule("no_such_rule").build();

        assertThrows(InvalidConfigurationException.class,
                () -> MonitoringCoordinator.builder(scheduler).config(config).build());
    }

    @Test
    void customRulesFollowPresets() {
        MonitoringConfig config = MonitoringConfig.builder().defaultRules(false).build();
        List<AlertRule> rules = MonitoringCoordinator.initialRules(config,
                List.of(AlertRule.of("no_peers", s -> s.activePeers() == 0, AlertSeverity.LOW, Duration.ZERO)));

        assertEquals(1, rules.size());
        assertEquals("no_peers", rules.get(0).name());
        assertEquals(5, MonitoringCoordinator.initialRules(MonitoringConfig.defaults(),
                List.of(AlertRule.of("no_peers", s -> true, AlertSeverity.LOW, Duration.ZERO))).size());
    }

    @Test
    void periodicSamplerFeedsAlerting() {
        List<Alert> received = new CopyOnWriteArrayList<>();
        MonitoringConfig config = MonitoringConfig.builder().sampleInterval(Duration.ofMillis(20)).build();
        MonitoringCoordinator coordinator = MonitoringCoordinator.builder(scheduler)
                .config(config)
                .clock(clock)
                .sampleSource(() -> HealthSample.builder(clock.instant()).dataConsistencyScore(0.5).build())
                .listener(received::add)
                .build();

        coordinator.start();
        assertTrue(coordinator.isRunning());
        await("alert raised from sampled data").atMost(5, TimeUnit.SECONDS).until(() -> !received.isEmpty());
        assertTrue(coordinator.stop());
        assertFalse(coordinator.isRunning());

        assertEquals(DefaultAlertRules.DATA_CONSISTENCY_LOW, received.get(0).ruleName());
        assertEquals(1, received.size());
    }

    @Test
    void configuredReportPathIsWritten() {
        Path report = tempDir.resolve("health.yaml");
        MonitoringConfig config = MonitoringConfig.builder()
                .reportPath(report)
                .reportInterval(Duration.ofMillis(50))
                .build();
        MonitoringCoordinator coordinator = MonitoringCoordinator.builder(scheduler).config(config).build();

        coordinator.start();
        try {
            await("report written").atMost(5, TimeUnit.SECONDS).until(() -> Files.exists(report));
        } finally {
            coordinator.close();
        }
        assertFalse(coordinator.isRunning());
    }

    @Test
    void exportMetricsCoversWindow() throws Exception {
        MonitoringCoordinator coordinator = MonitoringCoordinator.builder(scheduler).clock(clock).build();
        coordinator.recordHealthSample(HealthSample.builder(clock.instant().minusSeconds(1)).build());

        JsonNode root = new ObjectMapper().readTree(coordinator.exportMetrics(2));

        assertEquals(2, root.get("time_range_hours").asInt());
        assertEquals(1, root.get("summary").get("total_health_records").asInt());
    }
}
