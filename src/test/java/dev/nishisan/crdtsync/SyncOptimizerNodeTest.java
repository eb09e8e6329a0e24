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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.nishisan.crdtsync.conflict.ConflictRecord;
import dev.nishisan.crdtsync.monitoring.HealthReport;
import dev.nishisan.crdtsync.optimizer.DeltaSource;
import dev.nishisan.crdtsync.optimizer.DeltaTransport;
import dev.nishisan.crdtsync.optimizer.OptimizerConfig;
import dev.nishisan.crdtsync.sync.SyncPriority;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class SyncOptimizerNodeTest {

    @TempDir
    Path tempDir;

    private final List<String> sent = new CopyOnWriteArrayList<>();

    private DeltaTransport transport() {
        return (peerId, payload, algorithm) -> {
            sent.add(peerId);
            return true;
        };
    }

    private static OptimizerConfig fastConfig() {
        return OptimizerConfig.builder()
                .nodeId("node-a")
                .pollInterval(Duration.ofMillis(10))
                .minInterval(Duration.ofMillis(10))
                .baseInterval(Duration.ofMillis(20))
                .maxInterval(Duration.ofSeconds(1))
                .stopTimeout(Duration.ofSeconds(2))
                .build();
    }

    @Test
    void syncOutcomesFlowIntoHealthReport() throws Exception {
        try (SyncOptimizerNode node = SyncOptimizerNode.builder(transport())
                .optimizerConfig(fastConfig())
                .deltaSource(peer -> Optional.of(new DeltaSource.PendingDelta(Map.of("counter", 3), 1)))
                .build()) {
            node.start();
            assertTrue(node.isStarted());

            node.optimizer().scheduleOptimizedSync("peer-1", SyncPriority.HIGH);
            node.optimizer().scheduleOptimizedSync("peer-2", "high");

            await("both peers synced").atMost(5, TimeUnit.SECONDS)
                    .until(() -> node.coordinator().collector().syncAttempts().size() == 2);

            HealthReport report = node.getComprehensiveHealthReport();
            assertTrue(report.syncPerformanceTrend().hasData());
            assertEquals(2, report.syncPerformanceTrend().successfulSyncs());
            assertEquals(2, sent.size());

            JsonNode export = new ObjectMapper().readTree(node.exportMetrics(1));
            assertEquals(2, export.get("summary").get("total_sync_records").asInt());
        }
    }

    @Test
    void conflictsReachTheCollector() {
        try (SyncOptimizerNode node = SyncOptimizerNode.builder(transport())
                .defaultConflictResolver((type, conflicts) -> conflicts.forEach(
                        c -> c.markResolved(c.detectedAt().plusMillis(5), true)))
                .build()) {
            node.optimizer().batchConflictResolution(new ConflictRecord("c1", "counter", Instant.now(), "merge",
                    List.of("node-a", "node-b"), false));
            node.optimizer().batcher().flush();

            assertEquals(1, node.coordinator().collector().conflictAnalysis(1).resolvedConflicts());
            assertEquals(1.0, node.getComprehensiveHealthReport().conflictAnalysis().resolutionRate());
        }
    }

    @Test
    void conflictAfterCloseIsResolvedWithoutScheduler() {
        SyncOptimizerNode node = SyncOptimizerNode.builder(transport())
                .defaultConflictResolver((type, conflicts) -> conflicts.forEach(
                        c -> c.markResolved(c.detectedAt().plusMillis(5), true)))
                .build();
        node.start();
        node.close();

        node.optimizer().batchConflictResolution(new ConflictRecord("late", "counter", Instant.now(), "merge",
                List.of("node-a", "node-b"), false));

        assertEquals(0, node.optimizer().batcher().pendingCount());
        assertEquals(1, node.coordinator().collector().conflictAnalysis(1).totalConflicts());
        assertEquals(1, node.coordinator().collector().conflictAnalysis(1).resolvedConflicts());
    }

    @Test
    void closeShutsDownSchedulerAndPreventsRestart() {
        SyncOptimizerNode node = SyncOptimizerNode.builder(transport()).optimizerConfig(fastConfig()).build();
        node.start();
        node.start();

        node.close();

        assertFalse(node.isStarted());
        assertTrue(node.scheduler().isShutdown());
        assertThrows(IllegalStateException.class, node::start);
        node.close();
    }

    @Test
    void builtFromYaml() throws Exception {
        Path yamlFile = tempDir.resolve("node.yaml");
        Files.writeString(yamlFile,
                "node:\n" +
                "  id: yaml-node\n" +
                "conflicts:\n" +
                "  batchSize: 3\n" +
                "metrics:\n" +
                "  reportWindowHours: 2\n" +
                "alerting:\n" +
                "  loggingListener: false\n");

        try (SyncOptimizerNode node = SyncOptimizerNode.fromYaml(yamlFile, transport()).build()) {
            assertEquals("yaml-node", node.optimizer().config().nodeId());
            assertEquals(3, node.optimizer().batcher().batchSize());
            assertEquals(2, node.coordinator().config().reportWindowHours());
            assertFalse(node.coordinator().config().loggingListener());
        }
    }
}
