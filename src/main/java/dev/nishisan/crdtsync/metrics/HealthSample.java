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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Objects;

/**
 * Point-in-time health reading of the replication layer.
 *
 * <p>
 * Property names in the JSON form are the ones consumed by the metrics
 * export.
 * </p>
 *
 * @param timestamp                when the sample was taken
 * @param syncStatus               free-form status label, e.g. {@code healthy}
 * @param activePeers              peers currently reachable
 * @param totalOperations          operations applied since start
 * @param successfulSyncs          successful sync attempts in the sample period
 * @param failedSyncs              failed sync attempts in the sample period
 * @param conflictsDetected        conflicts detected in the sample period
 * @param conflictsResolved        conflicts resolved in the sample period
 * @param averageSyncTimeMs        mean sync duration
 * @param partitionResilience      partition tolerance indicator in [0,1]
 * @param dataConsistencyScore     replica agreement indicator in [0,1]
 * @param performanceImpactPercent overhead of replication on the host
 */
@JsonPropertyOrder({"timestamp", "sync_status", "active_peers", "total_operations", "successful_syncs",
        "failed_syncs", "conflicts_detected", "conflicts_resolved", "average_sync_time_ms",
        "network_partition_resilience", "data_consistency_score", "performance_impact_percent"})
public record HealthSample(
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("sync_status") String syncStatus,
        @JsonProperty("active_peers") int activePeers,
        @JsonProperty("total_operations") long totalOperations,
        @JsonProperty("successful_syncs") long successfulSyncs,
        @JsonProperty("failed_syncs") long failedSyncs,
        @JsonProperty("conflicts_detected") long conflictsDetected,
        @JsonProperty("conflicts_resolved") long conflictsResolved,
        @JsonProperty("average_sync_time_ms") double averageSyncTimeMs,
        @JsonProperty("network_partition_resilience") double partitionResilience,
        @JsonProperty("data_consistency_score") double dataConsistencyScore,
        @JsonProperty("performance_impact_percent") double performanceImpactPercent) {

    public HealthSample {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(syncStatus, "syncStatus");
    }

    /**
     * @return failed syncs over all syncs, 0 when there were none
     */
    public double syncFailureRate() {
        long total = successfulSyncs + failedSyncs;
        return (double) failedSyncs / Math.max(1L, total);
    }

    public static Builder builder(Instant timestamp) {
        return new Builder(timestamp);
    }

    /**
     * Builder for {@link HealthSample}, defaulting to a healthy idle reading.
     */
    public static final class Builder {
        private final Instant timestamp;
        private String syncStatus = "healthy";
        private int activePeers;
        private long totalOperations;
        private long successfulSyncs;
        private long failedSyncs;
        private long conflictsDetected;
        private long conflictsResolved;
        private double averageSyncTimeMs;
        private double partitionResilience = 1.0;
        private double dataConsistencyScore = 1.0;
        private double performanceImpactPercent;

        private Builder(Instant timestamp) {
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        }

        public Builder syncStatus(String syncStatus) {
            this.syncStatus = Objects.requireNonNull(syncStatus, "syncStatus");
            return this;
        }

        public Builder activePeers(int activePeers) {
            this.activePeers = activePeers;
            return this;
        }

        public Builder totalOperations(long totalOperations) {
            this.totalOperations = totalOperations;
            return this;
        }

        public Builder syncs(long successful, long failed) {
            this.successfulSyncs = successful;
            this.failedSyncs = failed;
            return this;
        }

        public Builder conflicts(long detected, long resolved) {
            this.conflictsDetected = detected;
            this.conflictsResolved = resolved;
            return this;
        }

        public Builder averageSyncTimeMs(double averageSyncTimeMs) {
            this.averageSyncTimeMs = averageSyncTimeMs;
            return this;
        }

        public Builder partitionResilience(double partitionResilience) {
            this.partitionResilience = partitionResilience;
            return this;
        }

        public Builder dataConsistencyScore(double dataConsistencyScore) {
            this.dataConsistencyScore = dataConsistencyScore;
            return this;
        }

        public Builder performanceImpactPercent(double performanceImpactPercent) {
            this.performanceImpactPercent = performanceImpactPercent;
            return this;
        }

        public HealthSample build() {
            return new HealthSample(timestamp, syncStatus, activePeers, totalOperations, successfulSyncs,
                    failedSyncs, conflictsDetected, conflictsResolved, averageSyncTimeMs, partitionResilience,
                    dataConsistencyScore, performanceImpactPercent);
        }
    }
}
