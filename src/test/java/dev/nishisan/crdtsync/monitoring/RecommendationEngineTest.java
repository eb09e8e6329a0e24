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
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RecommendationEngineTest {

    private static SyncPerformanceTrend trend(double successRate, double avgMs, double bandwidthMb) {
        return new SyncPerformanceTrend(true, 24, 100, (int) (successRate * 100), 100 - (int) (successRate * 100),
                successRate, avgMs, bandwidthMb, 2.5);
    }

    private static ConflictAnalysis analysis(double resolutionRate, int manual) {
        return new ConflictAnalysis(true, 24, 10, (int) (resolutionRate * 10), resolutionRate, 20.0,
                Map.of("counter", 10), Map.of("merge", 10), manual);
    }

    @Test
    void healthySystemGetsOptimalAdvice() {
        List<String> advice = RecommendationEngine.recommend(97.0, trend(0.99, 200, 5), analysis(1.0, 0));

        assertEquals(List.of(RecommendationEngine.OPTIMAL), advice);
    }

    @Test
    void everyProblemProducesItsRecommendation() {
        List<String> advice = RecommendationEngine.recommend(60.0, trend(0.5, 2500, 300), analysis(0.5, 8));

        assertEquals(List.of(
                RecommendationEngine.LOW_HEALTH,
                RecommendationEngine.LOW_SYNC_SUCCESS,
                RecommendationEngine.SLOW_SYNC,
                RecommendationEngine.LOW_RESOLUTION,
                RecommendationEngine.MANUAL_INTERVENTIONS,
                RecommendationEngine.HIGH_BANDWIDTH), advice);
    }

    @Test
    void sectionsWithoutDataAreIgnored() {
        List<String> advice = RecommendationEngine.recommend(100.0,
                SyncPerformanceTrend.noData(24), ConflictAnalysis.noData(24));

        assertEquals(List.of(RecommendationEngine.OPTIMAL), advice);
    }

    @Test
    void boundariesDoNotTrigger() {
        List<String> advice = RecommendationEngine.recommend(85.0, trend(0.9, 1000, 100), analysis(0.8, 5));

        assertEquals(List.of(RecommendationEngine.OPTIMAL), advice);
    }

    @Test
    void healthBandsFollowScore() {
        assertEquals(HealthStatus.EXCELLENT, HealthStatus.fromScore(95.0));
        assertEquals(HealthStatus.GOOD, HealthStatus.fromScore(94.9));
        assertEquals(HealthStatus.WARNING, HealthStatus.fromScore(70.0));
        assertEquals(HealthStatus.CRITICAL, HealthStatus.fromScore(69.9));
    }
}
