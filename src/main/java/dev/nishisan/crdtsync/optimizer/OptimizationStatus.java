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

package dev.nishisan.crdtsync.optimizer;

import dev.nishisan.crdtsync.perf.PerformanceSummary;

/**
 * Snapshot of the optimizer state.
 *
 * @param enabled              optimization switched on
 * @param schedulerActive      sync loop running
 * @param monitorActive        resource sampler running
 * @param performanceSummary   summary over all measured operations
 * @param queueDepth           scheduled syncs waiting
 * @param pendingConflictCount conflicts waiting for the next batch
 * @param completedSyncs       syncs that succeeded
 * @param failedSyncs          syncs that failed
 * @param compressionFallbacks deltas encoded with a fallback codec
 */
public record OptimizationStatus(
        boolean enabled,
        boolean schedulerActive,
        boolean monitorActive,
        PerformanceSummary performanceSummary,
        int queueDepth,
        int pendingConflictCount,
        long completedSyncs,
        long failedSyncs,
        long compressionFallbacks) {
}
