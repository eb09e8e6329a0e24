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

/**
 * Aggregate over the performance history, optionally restricted to one
 * operation type. {@link #noData(String)} stands for an empty history.
 *
 * @param operationType filter applied, or {@code null} for all operations
 * @param hasData       {@code false} when no sample matched
 * @param count         number of samples
 * @param successRate   fraction of successful samples
 * @param latency       latency statistics in milliseconds
 * @param memory        memory statistics in megabytes
 * @param cpu           CPU statistics in percent
 */
public record PerformanceSummary(
        String operationType,
        boolean hasData,
        int count,
        double successRate,
        Latency latency,
        Usage memory,
        Usage cpu) {

    /**
     * @param avgMs mean latency
     * @param minMs minimum latency
     * @param maxMs maximum latency
     * @param p95Ms 95th percentile latency
     */
    public record Latency(double avgMs, double minMs, double maxMs, double p95Ms) {
        static final Latency EMPTY = new Latency(0, 0, 0, 0);
    }

    /**
     * @param avg  mean value
     * @param peak maximum value
     */
    public record Usage(double avg, double peak) {
        static final Usage EMPTY = new Usage(0, 0);
    }

    public static PerformanceSummary noData(String operationType) {
        return new PerformanceSummary(operationType, false, 0, 0.0, Latency.EMPTY, Usage.EMPTY, Usage.EMPTY);
    }
}
