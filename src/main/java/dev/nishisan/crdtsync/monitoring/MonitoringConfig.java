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
import dev.nishisan.crdtsync.common.PeriodicWorker;
import dev.nishisan.crdtsync.metrics.MetricsCollector;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable settings of a {@link MonitoringCoordinator}.
 */
public final class MonitoringConfig {

    public static final int DEFAULT_REPORT_WINDOW_HOURS = 24;
    public static final Duration DEFAULT_REPORT_INTERVAL = Duration.ofMinutes(1);

    private final int historyCapacity;
    private final Duration sampleInterval;
    private final int reportWindowHours;
    private final Duration stopTimeout;
    private final boolean defaultRules;
    private final boolean loggingListener;
    private final Set<String> disabledRules;
    private final Map<String, Duration> cooldownOverrides;
    private final Map<String, AlertSeverity> severityOverrides;
    private final Path reportPath;
    private final Duration reportInterval;

    private MonitoringConfig(Builder builder) {
        this.historyCapacity = builder.historyCapacity;
        this.sampleInterval = builder.sampleInterval;
        this.reportWindowHours = builder.reportWindowHours;
        this.stopTimeout = builder.stopTimeout;
        this.defaultRules = builder.defaultRules;
        this.loggingListener = builder.loggingListener;
        this.disabledRules = Set.copyOf(builder.disabledRules);
        this.cooldownOverrides = Map.copyOf(builder.cooldownOverrides);
        this.severityOverrides = Map.copyOf(builder.severityOverrides);
        this.reportPath = builder.reportPath;
        this.reportInterval = builder.reportInterval;
    }

    public static MonitoringConfig defaults() {
        return builder().build();
    }

    public int historyCapacity() {
        return historyCapacity;
    }

    public Duration sampleInterval() {
        return sampleInterval;
    }

    public int reportWindowHours() {
        return reportWindowHours;
    }

    public Duration stopTimeout() {
        return stopTimeout;
    }

    public boolean defaultRules() {
        return defaultRules;
    }

    public boolean loggingListener() {
        return loggingListener;
    }

    public Set<String> disabledRules() {
        return disabledRules;
    }

    public Map<String, Duration> cooldownOverrides() {
        return cooldownOverrides;
    }

    public Map<String, AlertSeverity> severityOverrides() {
        return severityOverrides;
    }

    /**
     * @return file the YAML health report is written to, or {@code null} when
     *         report writing is off
     */
    public Path reportPath() {
        return reportPath;
    }

    public Duration reportInterval() {
        return reportInterval;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link MonitoringConfig}.
     */
    public static final class Builder {
        private int historyCapacity = MetricsCollector.DEFAULT_HISTORY_CAPACITY;
        private Duration sampleInterval = MetricsCollector.DEFAULT_SAMPLE_INTERVAL;
        private int reportWindowHours = DEFAULT_REPORT_WINDOW_HOURS;
        private Duration stopTimeout = PeriodicWorker.DEFAULT_STOP_TIMEOUT;
        private boolean defaultRules = true;
        private boolean loggingListener = true;
        private final Set<String> disabledRules = new LinkedHashSet<>();
        private final Map<String, Duration> cooldownOverrides = new LinkedHashMap<>();
        private final Map<String, AlertSeverity> severityOverrides = new LinkedHashMap<>();
        private Path reportPath;
        private Duration reportInterval = DEFAULT_REPORT_INTERVAL;

        private Builder() {
        }

        public Builder historyCapacity(int historyCapacity) {
            if (historyCapacity <= 0) {
                throw new IllegalArgumentException("historyCapacity must be > 0");
            }
            this.historyCapacity = historyCapacity;
            return this;
        }

        public Builder sampleInterval(Duration sampleInterval) {
            this.sampleInterval = positive(sampleInterval, "sampleInterval");
            return this;
        }

        public Builder reportWindowHours(int reportWindowHours) {
            if (reportWindowHours <= 0) {
                throw new IllegalArgumentException("reportWindowHours must be > 0");
            }
            this.reportWindowHours = reportWindowHours;
            return this;
        }

        public Builder stopTimeout(Duration stopTimeout) {
            this.stopTimeout = positive(stopTimeout, "stopTimeout");
            return this;
        }

        public Builder defaultRules(boolean defaultRules) {
            this.defaultRules = defaultRules;
            return this;
        }

        public Builder loggingListener(boolean loggingListener) {
            this.loggingListener = loggingListener;
            return this;
        }

        public Builder disableRule(String name) {
            disabledRules.add(Objects.requireNonNull(name, "name"));
            return this;
        }

        public Builder ruleCooldown(String name, Duration cooldown) {
            cooldownOverrides.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(cooldown, "cooldown"));
            return this;
        }

        public Builder ruleSeverity(String name, AlertSeverity severity) {
            severityOverrides.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(severity, "severity"));
            return this;
        }

        public Builder reportPath(Path reportPath) {
            this.reportPath = reportPath;
            return this;
        }

        public Builder reportInterval(Duration reportInterval) {
            this.reportInterval = positive(reportInterval, "reportInterval");
            return this;
        }

        public MonitoringConfig build() {
            return new MonitoringConfig(this);
        }

        private static Duration positive(Duration value, String name) {
            Objects.requireNonNull(value, name);
            if (value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }
    }
}
