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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import dev.nishisan.crdtsync.alerting.AlertSeverity;
import dev.nishisan.crdtsync.compression.CompressionAlgorithm;
import dev.nishisan.crdtsync.monitoring.MonitoringConfig;
import dev.nishisan.crdtsync.optimizer.OptimizerConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and writes the YAML configuration and converts it into the
 * programmatic {@link OptimizerConfig} and {@link MonitoringConfig}.
 *
 * <p>
 * {@code ${VAR}} and {@code ${VAR:default}} placeholders are resolved before
 * parsing. Durations accept ISO-8601 ({@code PT5S}) or the short forms
 * {@code 500ms}, {@code 30s}, {@code 10m} and {@code 2h}.
 * </p>
 */
public class SyncOptimizerConfigLoader {

    private static final Pattern VARIABLE = Pattern.compile("\\$\\{([^}]+)\\}");

    private static final ObjectMapper mapper;

    static {
        YAMLFactory yamlFactory = new YAMLFactory()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES);
        mapper = new ObjectMapper(yamlFactory);
    }

    private SyncOptimizerConfigLoader() {
    }

    public static SyncOptimizerYamlConfig load(Path yamlFile) throws IOException {
        return load(yamlFile, System::getenv);
    }

    public static SyncOptimizerYamlConfig load(Path yamlFile, Function<String, String> envProvider)
            throws IOException {
        String content = Files.readString(yamlFile);
        String processedContent = resolveVariables(content, envProvider);
        return mapper.readValue(processedContent, SyncOptimizerYamlConfig.class);
    }

    static String resolveVariables(String content, Function<String, String> envProvider) {
        Matcher matcher = VARIABLE.matcher(content);
        StringBuilder builder = new StringBuilder();
        int i = 0;
        while (matcher.find()) {
            builder.append(content, i, matcher.start());
            builder.append(getReplacement(matcher.group(1), envProvider));
            i = matcher.end();
        }
        builder.append(content.substring(i));
        return builder.toString();
    }

    private static String getReplacement(String group, Function<String, String> envProvider) {
        String[] parts = group.split(":", 2);
        String varName = parts[0];
        String defaultValue = parts.length > 1 ? parts[1] : null;

        String value = envProvider.apply(varName);
        if (value != null) {
            return value;
        }
        if (defaultValue != null) {
            return defaultValue;
        }
        throw new InvalidConfigurationException(
                "Environment variable or property '" + varName + "' not found and no default value provided.");
    }

    public static void save(Path yamlFile, SyncOptimizerYamlConfig config) throws IOException {
        mapper.writeValue(yamlFile.toFile(), config);
    }

    public static OptimizerConfig convertToOptimizerConfig(SyncOptimizerYamlConfig yamlConfig) {
        OptimizerConfig.Builder builder = OptimizerConfig.builder();

        NodeIdentityConfig node = yamlConfig.getNode();
        if (node != null) {
            if (node.getId() != null && !node.getId().isBlank()) {
                builder.nodeId(node.getId());
            }
            builder.enabled(node.isEnabled());
            Duration stopTimeout = parseDuration(node.getStopTimeout());
            if (stopTimeout != null) {
                builder.stopTimeout(stopTimeout);
            }
        }

        CompressionPolicyConfig compression = yamlConfig.getCompression();
        if (compression != null) {
            if (compression.getThresholdBytes() != null) {
                builder.compressionThresholdBytes(compression.getThresholdBytes());
            }
            if (compression.getHighRatioThresholdBytes() != null) {
                builder.highRatioThresholdBytes(compression.getHighRatioThresholdBytes());
            }
            if (compression.getDisabledAlgorithms() != null) {
                for (String name : compression.getDisabledAlgorithms()) {
                    try {
                        builder.disableAlgorithm(CompressionAlgorithm.fromWireName(name));
                    } catch (IllegalArgumentException e) {
                        throw new InvalidConfigurationException("Invalid compression algorithm: " + name, e);
                    }
                }
            }
        }

        SyncPolicyConfig sync = yamlConfig.getSync();
        if (sync != null) {
            Duration pollInterval = parseDuration(sync.getPollInterval());
            if (pollInterval != null) {
                builder.pollInterval(pollInterval);
            }
            Duration baseInterval = parseDuration(sync.getBaseInterval());
            if (baseInterval != null) {
                builder.baseInterval(baseInterval);
            }
            Duration minInterval = parseDuration(sync.getMinInterval());
            if (minInterval != null) {
                builder.minInterval(minInterval);
            }
            Duration maxInterval = parseDuration(sync.getMaxInterval());
            if (maxInterval != null) {
                builder.maxInterval(maxInterval);
            }
        }

        ConflictPolicyConfig conflicts = yamlConfig.getConflicts();
        if (conflicts != null) {
            if (conflicts.getBatchSize() != null) {
                builder.batchSize(conflicts.getBatchSize());
            }
            Duration timeout = parseDuration(conflicts.getTimeout());
            if (timeout != null) {
                builder.batchTimeout(timeout);
            }
        }

        MonitorPolicyConfig monitor = yamlConfig.getMonitor();
        if (monitor != null) {
            if (monitor.getHistoryCapacity() != null) {
                builder.historyCapacity(monitor.getHistoryCapacity());
            }
            Duration samplingInterval = parseDuration(monitor.getSamplingInterval());
            if (samplingInterval != null) {
                builder.monitorInterval(samplingInterval);
            }
        }

        return builder.build();
    }

    public static MonitoringConfig convertToMonitoringConfig(SyncOptimizerYamlConfig yamlConfig) {
        MonitoringConfig.Builder builder = MonitoringConfig.builder();

        NodeIdentityConfig node = yamlConfig.getNode();
        if (node != null) {
            Duration stopTimeout = parseDuration(node.getStopTimeout());
            if (stopTimeout != null) {
                builder.stopTimeout(stopTimeout);
            }
        }

        MetricsPolicyConfig metrics = yamlConfig.getMetrics();
        if (metrics != null) {
            if (metrics.getHistoryCapacity() != null) {
                builder.historyCapacity(metrics.getHistoryCapacity());
            }
            Duration sampleInterval = parseDuration(metrics.getSampleInterval());
            if (sampleInterval != null) {
                builder.sampleInterval(sampleInterval);
            }
            if (metrics.getReportWindowHours() != null) {
                builder.reportWindowHours(metrics.getReportWindowHours());
            }
            MetricsPolicyConfig.ReportConfig report = metrics.getReport();
            if (report != null && report.getPath() != null && !report.getPath().isBlank()) {
                builder.reportPath(Path.of(report.getPath()));
                Duration reportInterval = parseDuration(report.getInterval());
                if (reportInterval != null) {
                    builder.reportInterval(reportInterval);
                }
            }
        }

        AlertingPolicyConfig alerting = yamlConfig.getAlerting();
        if (alerting != null) {
            builder.defaultRules(alerting.isDefaultRules());
            builder.loggingListener(alerting.isLoggingListener());
            if (alerting.getRules() != null) {
                for (Map.Entry<String, AlertingPolicyConfig.RuleConfig> entry : alerting.getRules().entrySet()) {
                    String name = entry.getKey();
                    AlertingPolicyConfig.RuleConfig rule = entry.getValue();
                    if (rule == null) {
                        continue;
                    }
                    if (!rule.isEnabled()) {
                        builder.disableRule(name);
                    }
                    Duration cooldown = parseDuration(rule.getCooldown());
                    if (cooldown != null) {
                        builder.ruleCooldown(name, cooldown);
                    }
                    if (rule.getSeverity() != null && !rule.getSeverity().isBlank()) {
                        builder.ruleSeverity(name, AlertSeverity.parse(rule.getSeverity()));
                    }
                }
            }
        }

        return builder.build();
    }

    /**
     * @param s ISO-8601 or short-form duration
     * @return the duration, or {@code null} for a blank value
     * @throws InvalidConfigurationException if the value cannot be parsed
     */
    public static Duration parseDuration(String s) {
        if (s == null || s.isBlank()) {
            return null;
        }
        String value = s.trim().toUpperCase(Locale.ROOT);
        try {
            return Duration.parse(value); // ISO-8601 (PT10M)
        } catch (DateTimeParseException e) {
            try {
                if (value.endsWith("MS")) {
                    return Duration.ofMillis(Long.parseLong(value.substring(0, value.length() - 2)));
                } else if (value.endsWith("H")) {
                    return Duration.ofHours(Long.parseLong(value.substring(0, value.length() - 1)));
                } else if (value.endsWith("M")) {
                    return Duration.ofMinutes(Long.parseLong(value.substring(0, value.length() - 1)));
                } else if (value.endsWith("S")) {
                    return Duration.ofSeconds(Long.parseLong(value.substring(0, value.length() - 1)));
                }
            } catch (NumberFormatException nfe) {
                throw new InvalidConfigurationException("Invalid duration: " + s, nfe);
            }
            throw new InvalidConfigurationException("Invalid duration: " + s, e);
        }
    }
}
