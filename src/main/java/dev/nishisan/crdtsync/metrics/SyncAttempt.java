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
 * Outcome of one sync attempt with a peer.
 *
 * @param peerId           remote peer
 * @param durationMs       attempt duration
 * @param opsSent          operations pushed to the peer
 * @param opsReceived      operations pulled from the peer
 * @param bandwidthBytes   bytes put on the wire
 * @param compressionRatio ratio of the transmitted delta
 * @param success          transport outcome
 * @param timestamp        when the attempt finished
 * @param error            failure description, {@code null} on success
 */
@JsonPropertyOrder({"peer_node", "sync_duration_ms", "operations_sent", "operations_received",
        "bandwidth_used_bytes", "compression_ratio", "success", "timestamp", "error_message"})
public record SyncAttempt(
        @JsonProperty("peer_node") String peerId,
        @JsonProperty("sync_duration_ms") double durationMs,
        @JsonProperty("operations_sent") long opsSent,
        @JsonProperty("operations_received") long opsReceived,
        @JsonProperty("bandwidth_used_bytes") long bandwidthBytes,
        @JsonProperty("compression_ratio") double compressionRatio,
        @JsonProperty("success") boolean success,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("error_message") String error) {

    public SyncAttempt {
        Objects.requireNonNull(peerId, "peerId");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static SyncAttempt succeeded(String peerId, double durationMs, long opsSent, long bandwidthBytes,
            double compressionRatio, Instant timestamp) {
        return new SyncAttempt(peerId, durationMs, opsSent, 0L, bandwidthBytes, compressionRatio, true,
                timestamp, null);
    }

    public static SyncAttempt failed(String peerId, double durationMs, String error, Instant timestamp) {
        return new SyncAttempt(peerId, durationMs, 0L, 0L, 0L, 1.0, false, timestamp, error);
    }
}
