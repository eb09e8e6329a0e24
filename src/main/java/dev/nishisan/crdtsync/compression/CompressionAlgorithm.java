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

package dev.nishisan.crdtsync.compression;

import java.util.Locale;

/**
 * Compression strategies applied to outgoing deltas, ordered from the
 * cheapest to the strongest.
 */
public enum CompressionAlgorithm {
    /** Payload is sent as serialized. */
    NONE("none"),
    /** Speed-optimized codec for medium payloads. */
    FAST("fast"),
    /** Ratio-optimized codec for large payloads. */
    HIGH_RATIO("high-ratio");

    private final String wireName;

    CompressionAlgorithm(String wireName) {
        this.wireName = wireName;
    }

    /**
     * @return the name used on the wire and in configuration files
     */
    public String wireName() {
        return wireName;
    }

    /**
     * The codec to try when this one is unavailable. {@code NONE} has no
     * fallback and returns itself.
     *
     * @return the next-best algorithm
     */
    public CompressionAlgorithm fallback() {
        switch (this) {
            case FAST:
                return HIGH_RATIO;
            case HIGH_RATIO:
            case NONE:
            default:
                return NONE;
        }
    }

    /**
     * Parses either the wire name ({@code high-ratio}) or the enum name
     * ({@code HIGH_RATIO}).
     *
     * @param value the name
     * @return the algorithm
     * @throws IllegalArgumentException for unknown names
     */
    public static CompressionAlgorithm fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Compression algorithm name is empty");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (CompressionAlgorithm algorithm : values()) {
            if (algorithm.wireName.equals(normalized)
                    || algorithm.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("Unknown compression algorithm: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
