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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Conflict aggregate over a time window.
 *
 * @param hasData                 {@code false} when the window held no conflicts
 * @param windowHours             window length
 * @param totalConflicts          conflicts detected in the window
 * @param resolvedConflicts       conflicts with a recorded resolution
 * @param resolutionRate          resolved over total
 * @param averageResolutionTimeMs mean resolution duration of resolved conflicts
 * @param conflictTypes           count per conflict type
 * @param resolutionStrategies    count per resolution strategy
 * @param manualInterventions     conflicts that needed manual intervention
 */
public record ConflictAnalysis(
        boolean hasData,
        int windowHours,
        int totalConflicts,
        int resolvedConflicts,
        double resolutionRate,
        double averageResolutionTimeMs,
        Map<String, Integer> conflictTypes,
        Map<String, Integer> resolutionStrategies,
        int manualInterventions) {

    public ConflictAnalysis {
        conflictTypes = Collections.unmodifiableMap(new LinkedHashMap<>(conflictTypes));
        resolutionStrategies = Collections.unmodifiableMap(new LinkedHashMap<>(resolutionStrategies));
    }

    public static ConflictAnalysis noData(int windowHours) {
        return new ConflictAnalysis(false, windowHours, 0, 0, 0.0, 0.0, Map.of(), Map.of(), 0);
    }
}
