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

package dev.nishisan.crdtsync.config;

import dev.nishisan.crdtsync.alerting.AlertSeverity;
import dev.nishisan.crdtsync.alerting.DefaultAlertRules;
import dev.nishisan.crdtsync.compression.CompressionAlgorithm;
import dev.nishisan.crdtsync.monitoring.MonitoringConfig;
import dev.nishisan.crdtsync.optimizer.OptimizerConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SyncOptimizerConfigLoaderTest {

    @TempDir
    Path tempDir;

    private static Path sampleConfig() throws URISyntaxException {
        return Path.of(SyncOptimizerConfigLoaderTest.class.getResource("/sync-optimizer.yaml").toURI());
    }

    @Test
    void shouldLoadAndConvertToOptimizerConfig() throws Exception {
        SyncOptimizerYamlConfig yaml = SyncOptimizerConfigLoader.load(sampleConfig(), Map.<String, String>of()::get);

        OptimizerConfig config = SyncOptimizerConfigLoader.convertToOptimizerConfig(yaml);

        assertEquals("edge-node-1", config.nodeId());
        assertTrue(config.enabled());
        assertEquals(Duration.ofSeconds(2), config.stopTimeout());
        assertEquals(2048, config.compressionThresholdBytes());
        assertEquals(65536, config.highRatioThresholdBytes());
        assertEquals(Set.of(CompressionAlgorithm.HIGH_RATIO), config.disabledAlgorithms());
        assertEquals(Duration.ofMillis(500), config.pollInterval());
        assertEquals(Duration.ofSeconds(30), config.baseInterval());
        assertEquals(Duration.ofSeconds(2), config.minInterval());
        assertEquals(Duration.ofHours(1), config.maxInterval());
        assertEquals(25, config.batchSize());
        assertEquals(Duration.ofSeconds(2), config.batchTimeout());
        assertEquals(500, config.historyCapacity());
        assertEquals(Duration.ofSeconds(15), config.monitorInterval());
    }

    @Test
    void shouldConvertToMonitoringConfig() throws Exception {
        SyncOptimizerYamlConfig yaml = SyncOptimizerConfigLoader.load(sampleConfig(),
                Map.of("REPORT_DIR", "/opt/reports")::get);

        MonitoringConfig config = SyncOptimizerConfigLoader.convertToMonitoringConfig(yaml);

        assertEquals(2000, config.historyCapacity());
        assertEquals(Duration.ofSeconds(10), config.sampleInterval());
        assertEquals(6, config.reportWindowHours());
        assertEquals(Path.of("/opt/reports/crdt-health.yaml"), config.reportPath());
        assertEquals(Duration.ofMinutes(5), config.reportInterval());
        assertEquals(Duration.ofSeconds(2), config.stopTimeout());
        assertTrue(config.defaultRules());
        assertFalse(config.loggingListener());
        assertEquals(Set.of(DefaultAlertRules.HIGH_CONFLICT_RATE), config.disabledRules());
        assertEquals(Map.of(DefaultAlertRules.HIGH_SYNC_FAILURE_RATE, Duration.ofMinutes(1)),
                config.cooldownOverrides());
        assertEquals(Map.of(DefaultAlertRules.HIGH_SYNC_FAILURE_RATE, AlertSeverity.CRITICAL),
                config.severityOverrides());
    }

    @Test
    void emptyDocumentYieldsDefaults() throws IOException {
        Path yamlFile = tempDir.resolve("empty.yaml");
        Files.writeString(yamlFile, "node:\n  id: lonely\n");

        SyncOptimizerYamlConfig yaml = SyncOptimizerConfigLoader.load(yamlFile, name -> null);
        OptimizerConfig optimizer = SyncOptimizerConfigLoader.convertToOptimizerConfig(yaml);
        MonitoringConfig monitoring = SyncOptimizerConfigLoader.convertToMonitoringConfig(yaml);

        OptimizerConfig defaults = OptimizerConfig.defaults();
        assertEquals("lonely", optimizer.nodeId());
        assertEquals(defaults.compressionThresholdBytes(), optimizer.compressionThresholdBytes());
        assertEquals(defaults.baseInterval(), optimizer.baseInterval());
        assertTrue(optimizer.disabledAlgorithms().isEmpty());
        assertNull(monitoring.reportPath());
        assertTrue(monitoring.defaultRules());
    }

    @Test
    void saveAndReloadRoundTrip() throws IOException {
        SyncOptimizerYamlConfig yaml = new SyncOptimizerYamlConfig();
        NodeIdentityConfig node = new NodeIdentityConfig();
        node.setId("saved-node");
        node.setEnabled(false);
        yaml.setNode(node);
        ConflictPolicyConfig conflicts = new ConflictPolicyConfig();
        conflicts.setBatchSize(7);
        conflicts.setTimeout("750ms");
        yaml.setConflicts(conflicts);
        CompressionPolicyConfig compression = new CompressionPolicyConfig();
        compression.setDisabledAlgorithms(List.of("fast"));
        yaml.setCompression(compression);

        Path yamlFile = tempDir.resolve("saved.yaml");
        SyncOptimizerConfigLoader.save(yamlFile, yaml);
        OptimizerConfig config = SyncOptimizerConfigLoader.convertToOptimizerConfig(
                SyncOptimizerConfigLoader.load(yamlFile, name -> null));

        assertEquals("saved-node", config.nodeId());
        assertFalse(config.enabled());
        assertEquals(7, config.batchSize());
        assertEquals(Duration.ofMillis(750), config.batchTimeout());
        assertEquals(Set.of(CompressionAlgorithm.FAST), config.disabledAlgorithms());
    }

    @Test
    void unknownAlgorithmIsRejected() {
        SyncOptimizerYamlConfig yaml = new SyncOptimizerYamlConfig();
        CompressionPolicyConfig compression = new CompressionPolicyConfig();
        compression.setDisabledAlgorithms(List.of("brotli"));
        yaml.setCompression(compression);

        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class,
                () -> SyncOptimizerConfigLoader.convertToOptimizerConfig(yaml));
        assertTrue(e.getMessage().contains("brotli"));
    }

    @Test
    void unknownSeverityIsRejected() {
        SyncOptimizerYamlConfig yaml = new SyncOptimizerYamlConfig();
        AlertingPolicyConfig alerting = new AlertingPolicyConfig();
        AlertingPolicyConfig.RuleConfig rule = new AlertingPolicyConfig.RuleConfig();
        rule.setSeverity("apocalyptic");
        alerting.setRules(Map.of(DefaultAlertRules.HIGH_SYNC_FAILURE_RATE, rule));
        yaml.setAlerting(alerting);

        assertThrows(InvalidConfigurationException.class,
                () -> SyncOptimizerConfigLoader.convertToMonitoringConfig(yaml));
    }

    @Test
    void parsesDurationForms() {
        assertEquals(Duration.ofMillis(250), SyncOptimizerConfigLoader.parseDuration("250ms"));
        assertEquals(Duration.ofSeconds(30), SyncOptimizerConfigLoader.parseDuration("30s"));
        assertEquals(Duration.ofMinutes(10), SyncOptimizerConfigLoader.parseDuration("10m"));
        assertEquals(Duration.ofHours(2), SyncOptimizerConfigLoader.parseDuration("2h"));
        assertEquals(Duration.ofSeconds(5), SyncOptimizerConfigLoader.parseDuration("PT5S"));
        assertNull(SyncOptimizerConfigLoader.parseDuration("  "));
        assertThrows(InvalidConfigurationException.class, () -> SyncOptimizerConfigLoader.parseDuration("soon"));
        assertThrows(InvalidConfigurationException.class, () -> SyncOptimizerConfigLoader.parseDuration("xms"));
    }
}
