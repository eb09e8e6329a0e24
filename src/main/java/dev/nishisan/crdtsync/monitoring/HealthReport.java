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

import dev.nishisan.crdtsync.alerting.AlertingSummary;
import dev.nishisan.crdtsync.metrics.ConflictAnalysis;
import dev.nishisan.crdtsync.metrics.HealthScore;
import dev.nishisan.crdtsync.metrics.SyncPerformanceTrend;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time report combining the health score, windowed aggregates,
 * recommendations and alerting state.
 *
 * @param timestamp            when the report was generated
 * @param overallHealthScore   composite score in [0,100]
 * @param healthStatus         band of the score
 * @param scoreBreakdown       score components
 * @param syncPerformanceTrend sync aggregate of the report window
 * @param conflictAnalysis     conflict aggregate of the report window
 * @param recommendations      suggested actions, never empty
 * @param alertingSummary      rule and alert counts
 */
public record HealthReport(
        Instant timestamp,
        double overallHealthScore,
        HealthStatus healthStatus,
        HealthScore scoreBreakdown,
        SyncPerformanceTrend syncPerformanceTrend,
        ConflictAnalysis conflictAnalysis,
        List<String> recommendations,
        AlertingSummary alertingSummary) {

    public HealthReport {
        recommendations = List.copyOf(recommendations);
    }
}
