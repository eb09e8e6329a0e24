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

package dev.nishisan.crdtsync.perf;

import java.time.Instant;
import java.util.Objects;

/**
 * Measurement of one instrumented operation.
 *
 * @param operationType    operation label, e.g. {@code delta_compression}
 * @param latencyMs        wall-clock duration
 * @param memoryUsageMb    heap growth during the operation, never negative
 * @param cpuUsagePercent  CPU time of the calling thread relative to wall time
 * @param timestamp        when the operation finished
 * @param success          {@code false} if the operation threw
 * @param payloadSizeBytes size of the operation result when known, otherwise 0
 */
public record PerformanceSample(
        String operationType,
        double latencyMs,
        double memoryUsageMb,
        double cpuUsagePercent,
        Instant timestamp,
        boolean success,
        long payloadSizeBytes) {

    public PerformanceSample {
        Objects.requireNonNull(operationType, "operationType");
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
