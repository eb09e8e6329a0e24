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

package dev.nishisan.crdtsync.conflict;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A conflict detected by the replication engine.
 *
 * <p>
 * Created at detection time and updated exactly once when it is resolved; a
 * second {@link #markResolved(Instant, boolean)} is rejected. Property names
 * match the metrics export format.
 * </p>
 */
@JsonPropertyOrder({"conflict_id", "conflict_type", "detection_time", "resolution_time", "resolution_strategy",
        "involved_nodes", "resolution_duration_ms", "success", "manual_intervention"})
public final class ConflictRecord {

    private final String conflictId;
    private final String conflictType;
    private final Instant detectedAt;
    private final String resolutionStrategy;
    private final List<String> involvedPeers;
    private final boolean manualIntervention;

    private Instant resolvedAt;
    private Double resolutionDurationMs;
    private boolean success;

    public ConflictRecord(String conflictId,
            String conflictType,
            Instant detectedAt,
            String resolutionStrategy,
            List<String> involvedPeers,
            boolean manualIntervention) {
        this.conflictId = Objects.requireNonNull(conflictId, "conflictId");
        this.conflictType = Objects.requireNonNull(conflictType, "conflictType");
        this.detectedAt = Objects.requireNonNull(detectedAt, "detectedAt");
        this.resolutionStrategy = Objects.requireNonNull(resolutionStrategy, "resolutionStrategy");
        this.involvedPeers = List.copyOf(Objects.requireNonNull(involvedPeers, "involvedPeers"));
        this.manualIntervention = manualIntervention;
    }

    /**
     * Creates a conflict that is already resolved, as reported by an engine
     * that resolves conflicts itself.
     */
    public static ConflictRecord resolved(String conflictId,
            String conflictType,
            Instant detectedAt,
            Instant resolvedAt,
            String resolutionStrategy,
            List<String> involvedPeers,
            boolean success,
            boolean manualIntervention) {
        ConflictRecord record = new ConflictRecord(conflictId, conflictType, detectedAt, resolutionStrategy,
                involvedPeers, manualIntervention);
        record.markResolved(resolvedAt, success);
        return record;
    }

    /**
     * Records the resolution outcome.
     *
     * @param resolvedAt resolution time, not before detection
     * @param success    whether the resolution succeeded
     * @throws IllegalStateException if the conflict was already resolved
     */
    public synchronized void markResolved(Instant resolvedAt, boolean success) {
        Objects.requireNonNull(resolvedAt, "resolvedAt");
        if (this.resolvedAt != null) {
            throw new IllegalStateException("Conflict " + conflictId + " already resolved at " + this.resolvedAt);
        }
        if (resolvedAt.isBefore(detectedAt)) {
            throw new IllegalArgumentException("resolvedAt precedes detectedAt for conflict " + conflictId);
        }
        this.resolvedAt = resolvedAt;
        this.resolutionDurationMs = Duration.between(detectedAt, resolvedAt).toNanos() / 1_000_000.0;
        this.success = success;
    }

    @JsonProperty("conflict_id")
    public String conflictId() {
        return conflictId;
    }

    @JsonProperty("conflict_type")
    public String conflictType() {
        return conflictType;
    }

    @JsonProperty("detection_time")
    public Instant detectedAt() {
        return detectedAt;
    }

    @JsonProperty("resolution_time")
    public synchronized Instant resolvedAt() {
        return resolvedAt;
    }

    @JsonProperty("resolution_strategy")
    public String resolutionStrategy() {
        return resolutionStrategy;
    }

    @JsonProperty("involved_nodes")
    public List<String> involvedPeers() {
        return involvedPeers;
    }

    @JsonProperty("resolution_duration_ms")
    public synchronized Double resolutionDurationMs() {
        return resolutionDurationMs;
    }

    @JsonProperty("success")
    public synchronized boolean success() {
        return success;
    }

    @JsonProperty("manual_intervention")
    public boolean manualIntervention() {
        return manualIntervention;
    }

    @JsonIgnore
    public synchronized boolean isResolved() {
        return resolvedAt != null;
    }

    @Override
    public String toString() {
        return "ConflictRecord[" + conflictId + ", type=" + conflictType + ", detectedAt=" + detectedAt
                + ", resolved=" + isResolved() + "]";
    }
}
