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

package dev.nishisan.crdtsync.metrics;

/**
 * Composite health score and the components it was weighted from. All
 * values are in [0,100].
 *
 * @param overall           weighted total
 * @param sync              sync success component
 * @param conflict          conflict resolution component
 * @param performance       performance impact component
 * @param consistency       data consistency component
 * @param samplesConsidered number of health samples used
 */
public record HealthScore(
        double overall,
        double sync,
        double conflict,
        double performance,
        double consistency,
        int samplesConsidered) {

    static final double SYNC_WEIGHT = 0.3;
    static final double CONFLICT_WEIGHT = 0.2;
    static final double PERFORMANCE_WEIGHT = 0.3;
    static final double CONSISTENCY_WEIGHT = 0.2;

    static HealthScore healthy() {
        return new HealthScore(100.0, 100.0, 100.0, 100.0, 100.0, 0);
    }

    static HealthScore weighted(double sync, double conflict, double performance, double consistency, int samples) {
        double overall = sync * SYNC_WEIGHT
                + conflict * CONFLICT_WEIGHT
                + performance * PERFORMANCE_WEIGHT
                + consistency * CONSISTENCY_WEIGHT;
        return new HealthScore(Math.min(100.0, Math.max(0.0, overall)), sync, conflict, performance, consistency,
                samples);
    }
}
