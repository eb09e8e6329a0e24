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

import dev.nishisan.crdtsync.metrics.ConflictAnalysis;
import dev.nishisan.crdtsync.metrics.SyncPerformanceTrend;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a health score and the windowed aggregates into operator advice.
 * Aggregates without data contribute nothing.
 */
public final class RecommendationEngine {

    static final String LOW_HEALTH = "Overall health below optimal - investigate sync and conflict issues";
    static final String LOW_SYNC_SUCCESS = "Sync success rate low - check network connectivity and peer health";
    static final String SLOW_SYNC = "Sync operations slow - consider enabling compression or reducing batch sizes";
    static final String LOW_RESOLUTION = "Conflict resolution rate low - review resolution strategies";
    static final String MANUAL_INTERVENTIONS =
            "High manual interventions - consider updating automatic resolution rules";
    static final String HIGH_BANDWIDTH = "High bandwidth usage - enable delta compression";
    static final String OPTIMAL = "System operating optimally - no immediate actions required";

    private RecommendationEngine() {
    }

    public static List<String> recommend(double healthScore, SyncPerformanceTrend sync, ConflictAnalysis conflicts) {
        List<String> recommendations = new ArrayList<>();
        if (healthScore < 85.0) {
            recommendations.add(LOW_HEALTH);
        }
        if (sync.hasData()) {
            if (sync.successRate() < 0.9) {
                recommendations.add(LOW_SYNC_SUCCESS);
            }
            if (sync.averageDurationMs() > 1000.0) {
                recommendations.add(SLOW_SYNC);
            }
        }
        if (conflicts.hasData()) {
            if (conflicts.resolutionRate() < 0.8) {
                recommendations.add(LOW_RESOLUTION);
            }
            if (conflicts.manualInterventions() > 5) {
                recommendations.add(MANUAL_INTERVENTIONS);
            }
        }
        if (sync.hasData() && sync.totalBandwidthMb() > 100.0) {
            recommendations.add(HIGH_BANDWIDTH);
        }
        if (recommendations.isEmpty()) {
            recommendations.add(OPTIMAL);
        }
        return recommendations;
    }
}
