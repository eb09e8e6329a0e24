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
 * Sync attempt aggregate over a time window.
 *
 * @param hasData                 {@code false} when the window held no attempts
 * @param windowHours             window length
 * @param totalSyncs              attempts in the window
 * @param successfulSyncs         successful attempts
 * @param failedSyncs             failed attempts
 * @param successRate             successful over total
 * @param averageDurationMs       mean duration of successful attempts
 * @param totalBandwidthMb        bytes sent in megabytes
 * @param averageCompressionRatio mean compression ratio
 */
public record SyncPerformanceTrend(
        boolean hasData,
        int windowHours,
        int totalSyncs,
        int successfulSyncs,
        int failedSyncs,
        double successRate,
        double averageDurationMs,
        double totalBandwidthMb,
        double averageCompressionRatio) {

    public static SyncPerformanceTrend noData(int windowHours) {
        return new SyncPerformanceTrend(false, windowHours, 0, 0, 0, 0.0, 0.0, 0.0, 0.0);
    }
}
