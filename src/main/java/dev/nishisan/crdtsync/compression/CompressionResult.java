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
import java.util.Objects;

/**
 * Outcome of compressing one delta.
 *
 * @param originalSize      serialized size in bytes
 * @param compressedSize    size of {@code data}
 * @param compressionRatio  {@code originalSize / compressedSize}, exactly 1.0
 *                          for {@link CompressionAlgorithm#NONE}
 * @param compressionTimeMs serialization plus encoding time
 * @param algorithm         the codec actually used, never the requested one
 *                          when a fallback happened
 * @param data              the encoded bytes
 */
public record CompressionResult(
        int originalSize,
        int compressedSize,
        double compressionRatio,
        double compressionTimeMs,
        CompressionAlgorithm algorithm,
        byte[] data) {

    public CompressionResult {
        Objects.requireNonNull(algorithm, "algorithm");
        Objects.requireNonNull(data, "data");
    }

    static CompressionResult of(int originalSize, byte[] data, double compressionTimeMs,
            CompressionAlgorithm algorithm) {
        double ratio;
        if (algorithm == CompressionAlgorithm.NONE || data.length == 0) {
            ratio = 1.0;
        } else {
            ratio = (double) originalSize / data.length;
        }
        return new CompressionResult(originalSize, data.length, ratio, compressionTimeMs, algorithm, data);
    }

    /**
     * @return bytes saved by compressing, negative when the codec expanded the
     *         payload
     */
    public int savedBytes() {
        return originalSize - compressedSize;
    }

    @Override
    public String toString() {
        return "CompressionResult[algorithm=" + algorithm
                + ", originalSize=" + originalSize
                + ", compressedSize=" + compressedSize
                + ", ratio=" + String.format(Locale.ROOT, "%.2f", compressionRatio)
                + ", timeMs=" + String.format(Locale.ROOT, "%.3f", compressionTimeMs) + "]";
    }
}
