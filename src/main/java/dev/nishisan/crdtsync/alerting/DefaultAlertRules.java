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

package dev.nishisan.crdtsync.alerting;

import java.time.Duration;
import java.util.List;

/**
 * Preset rules registered by default on every monitoring coordinator.
 */
public final class DefaultAlertRules {

    /** Failed syncs above 20% of all syncs in the sample. */
    public static final String HIGH_SYNC_FAILURE_RATE = "high_sync_failure_rate";
    /** Replication overhead above 25%. */
    public static final String PERFORMANCE_DEGRADATION = "performance_degradation";
    /** Replica agreement below 0.9. */
    public static final String DATA_CONSISTENCY_LOW = "data_consistency_low";
    /** More than 20 conflicts detected in the sample. */
    public static final String HIGH_CONFLICT_RATE = "high_conflict_rate";

    private DefaultAlertRules() {
    }

    public static AlertRule highSyncFailureRate() {
        return new AlertRule(HIGH_SYNC_FAILURE_RATE,
                s -> s.syncFailureRate() > 0.2,
                AlertSeverity.HIGH,
                Duration.ofMinutes(10),
                "sync failure rate above 20%",
                true);
    }

    public static AlertRule performanceDegradation() {
        return new AlertRule(PERFORMANCE_DEGRADATION,
                s -> s.performanceImpactPercent() > 25.0,
                AlertSeverity.MEDIUM,
                Duration.ofMinutes(15),
                "performance impact above 25%",
                true);
    }

    public static AlertRule dataConsistencyLow() {
        return new AlertRule(DATA_CONSISTENCY_LOW,
                s -> s.dataConsistencyScore() < 0.9,
                AlertSeverity.HIGH,
                Duration.ofMinutes(5),
                "data consistency score below 0.9",
                true);
    }

    public static AlertRule highConflictRate() {
        return new AlertRule(HIGH_CONFLICT_RATE,
                s -> s.conflictsDetected() > 20,
                AlertSeverity.MEDIUM,
                Duration.ofMinutes(30),
                "more than 20 conflicts detected",
                true);
    }

    /**
     * @return all presets, in registration order
     */
    public static List<AlertRule> all() {
        return List.of(highSyncFailureRate(), performanceDegradation(), dataConsistencyLow(), highConflictRate());
    }
}
