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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Chooses and applies a compression codec to outgoing CRDT deltas.
 *
 * <h2>Algorithm selection</h2>
 * <ul>
 * <li>payload &lt; 1 KiB: {@link CompressionAlgorithm#NONE}</li>
 * <li>1 KiB to 10 KiB: {@link CompressionAlgorithm#FAST}</li>
 * <li>10 KiB and above: {@link CompressionAlgorithm#HIGH_RATIO}</li>
 * </ul>
 *
 * <p>
 * Deltas are serialized to UTF-8 JSON with Jackson before encoding. When the
 * requested codec is missing, reports itself unavailable or fails while
 * encoding, the compressor walks the {@link CompressionAlgorithm#fallback()}
 * chain and records the codec it actually used in the
 * {@link CompressionResult}. {@link CompressionAlgorithm#NONE} is always
 * registered, so compression itself never fails for a serializable payload.
 * </p>
 */
public final class DeltaCompressor {

    private static final Logger LOGGER = Logger.getLogger(DeltaCompressor.class.getName());

    /** Payloads at or above this size use {@link CompressionAlgorithm#FAST}. */
    public static final int DEFAULT_FAST_THRESHOLD_BYTES = 1024;
    /** Payloads at or above this size use {@link CompressionAlgorithm#HIGH_RATIO}. */
    public static final int DEFAULT_HIGH_RATIO_THRESHOLD_BYTES = 10240;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static {
        MAPPER.findAndRegisterModules();
    }

    private final Map<CompressionAlgorithm, CompressionCodec> codecs;
    private final int fastThresholdBytes;
    private final int highRatioThresholdBytes;
    private final AtomicLong degradedCount = new AtomicLong();

    private DeltaCompressor(Builder builder) {
        this.codecs = new EnumMap<>(builder.codecs);
        this.codecs.put(CompressionAlgorithm.NONE, new IdentityCodec());
        this.fastThresholdBytes = builder.fastThresholdBytes;
        this.highRatioThresholdBytes = builder.highRatioThresholdBytes;
    }

    /**
     * @return a compressor with the default codecs and thresholds
     */
    public static DeltaCompressor defaults() {
        return builder().build();
    }

    /**
     * Pure size-based strategy selection.
     *
     * @param payloadSizeBytes serialized payload size
     * @return the preferred algorithm for that size
     */
    public CompressionAlgorithm selectAlgorithm(long payloadSizeBytes) {
        if (payloadSizeBytes < fastThresholdBytes) {
            return CompressionAlgorithm.NONE;
        }
        if (payloadSizeBytes < highRatioThresholdBytes) {
            return CompressionAlgorithm.FAST;
        }
        return CompressionAlgorithm.HIGH_RATIO;
    }

    /**
     * Serializes a delta to UTF-8 JSON.
     *
     * @param payload the delta
     * @return the serialized bytes
     * @throws DeltaCodecException if the payload cannot be serialized
     */
    public byte[] serialize(Object payload) {
        try {
            return MAPPER.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new DeltaCodecException(CompressionAlgorithm.NONE, "Delta is not serializable", e);
        }
    }

    /**
     * Compresses a delta with the algorithm chosen by
     * {@link #selectAlgorithm(long)} for its serialized size.
     *
     * @param payload the delta
     * @return the compression result
     */
    public CompressionResult compress(Object payload) {
        long start = System.nanoTime();
        byte[] serialized = serialize(payload);
        return encode(serialized, selectAlgorithm(serialized.length), start);
    }

    /**
     * Serializes and compresses a delta with the requested algorithm, degrading
     * when the codec is not usable.
     *
     * @param payload   the delta
     * @param algorithm requested algorithm
     * @return the compression result
     */
    public CompressionResult compress(Object payload, CompressionAlgorithm algorithm) {
        Objects.requireNonNull(algorithm, "algorithm");
        long start = System.nanoTime();
        byte[] serialized = serialize(payload);
        return encode(serialized, algorithm, start);
    }

    /**
     * Compresses an already serialized delta.
     *
     * @param serialized JSON bytes from {@link #serialize(Object)}
     * @param algorithm  requested algorithm
     * @return the compression result
     */
    public CompressionResult compressSerialized(byte[] serialized, CompressionAlgorithm algorithm) {
        Objects.requireNonNull(serialized, "serialized");
        Objects.requireNonNull(algorithm, "algorithm");
        return encode(serialized, algorithm, System.nanoTime());
    }

    private CompressionResult encode(byte[] serialized, CompressionAlgorithm requested, long startNanos) {
        CompressionAlgorithm candidate = requested;
        while (true) {
            CompressionCodec codec = codecs.get(candidate);
            if (codec == null || !codec.isAvailable()) {
                CompressionAlgorithm next = candidate.fallback();
                CompressionAlgorithm unavailable = candidate;
                LOGGER.fine(() -> "Codec " + unavailable + " unavailable, falling back to " + next);
                degradedCount.incrementAndGet();
                candidate = next;
                continue;
            }
            try {
                byte[] encoded = codec.encode(serialized);
                double elapsedMs = (System.nanoTime() - startNanos) / 1_000_000.0;
                return CompressionResult.of(serialized.length, encoded, elapsedMs, candidate);
            } catch (DeltaCodecException e) {
                if (candidate == CompressionAlgorithm.NONE) {
                    throw e;
                }
                LOGGER.log(Level.WARNING, "Codec " + candidate + " failed, falling back to " + candidate.fallback(), e);
                degradedCount.incrementAndGet();
                candidate = candidate.fallback();
            }
        }
    }

    /**
     * Decodes a delta without a target type. JSON objects come back as
     * {@link Map}s and arrays as {@link java.util.List}s. Numbers are
     * normalized: integral values as {@link Integer} when they fit, otherwise
     * {@link Long} or {@link java.math.BigInteger}, and floating point values as
     * {@link Double}. A payload built only from those types round-trips
     * exactly; for deltas carrying {@code long} counters or {@code float}
     * weights use {@link #decompress(byte[], CompressionAlgorithm, Class)} or
     * {@link #decompress(byte[], CompressionAlgorithm, TypeReference)}.
     *
     * @param data      encoded bytes
     * @param algorithm the algorithm recorded in the {@link CompressionResult}
     * @return the decoded delta
     */
    public Object decompress(byte[] data, CompressionAlgorithm algorithm) {
        return decompress(data, algorithm, Object.class);
    }

    /**
     * Exact inverse of {@link #compress(Object, CompressionAlgorithm)} for a
     * payload of the given type.
     *
     * @param data      encoded bytes
     * @param algorithm the algorithm the bytes were encoded with
     * @param type      target type
     * @param <T>       target type
     * @return the decoded delta
     */
    public <T> T decompress(byte[] data, CompressionAlgorithm algorithm, Class<T> type) {
        Objects.requireNonNull(type, "type");
        byte[] decoded = decode(data, algorithm);
        try {
            return MAPPER.readValue(decoded, type);
        } catch (IOException e) {
            throw new DeltaCodecException(algorithm, "Decoded delta is not valid JSON", e);
        }
    }

    /**
     * Same as {@link #decompress(byte[], CompressionAlgorithm, Class)} for
     * generic targets such as {@code Map<String, Long>}.
     */
    public <T> T decompress(byte[] data, CompressionAlgorithm algorithm, TypeReference<T> type) {
        Objects.requireNonNull(type, "type");
        byte[] decoded = decode(data, algorithm);
        try {
            return MAPPER.readValue(decoded, type);
        } catch (IOException e) {
            throw new DeltaCodecException(algorithm, "Decoded delta is not valid JSON", e);
        }
    }

    private byte[] decode(byte[] data, CompressionAlgorithm algorithm) {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(algorithm, "algorithm");
        CompressionCodec codec = codecs.get(algorithm);
        if (codec == null || !codec.isAvailable()) {
            throw new DeltaCodecException(algorithm, "Codec " + algorithm + " is not available for decoding");
        }
        return codec.decode(data);
    }

    /**
     * @param algorithm the algorithm
     * @return {@code true} if a usable codec is registered for it
     */
    public boolean isAvailable(CompressionAlgorithm algorithm) {
        CompressionCodec codec = codecs.get(algorithm);
        return codec != null && codec.isAvailable();
    }

    /**
     * @return number of times a codec was skipped in favour of its fallback
     */
    public long degradedCount() {
        return degradedCount.get();
    }

    public int fastThresholdBytes() {
        return fastThresholdBytes;
    }

    public int highRatioThresholdBytes() {
        return highRatioThresholdBytes;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link DeltaCompressor}.
     */
    public static final class Builder {
        private final Map<CompressionAlgorithm, CompressionCodec> codecs = new EnumMap<>(CompressionAlgorithm.class);
        private int fastThresholdBytes = DEFAULT_FAST_THRESHOLD_BYTES;
        private int highRatioThresholdBytes = DEFAULT_HIGH_RATIO_THRESHOLD_BYTES;

        private Builder() {
            codecs.put(CompressionAlgorithm.FAST, new DeflateCodec());
            codecs.put(CompressionAlgorithm.HIGH_RATIO, new GzipCodec());
        }

        /**
         * Registers or replaces the codec for its algorithm. The
         * {@link CompressionAlgorithm#NONE} codec cannot be replaced.
         *
         * @param codec the codec
         * @return this builder
         */
        public Builder codec(CompressionCodec codec) {
            Objects.requireNonNull(codec, "codec");
            if (codec.algorithm() != CompressionAlgorithm.NONE) {
                codecs.put(codec.algorithm(), codec);
            }
            return this;
        }

        /**
         * Removes the codec for an algorithm, as if it were not installed.
         *
         * @param algorithm the algorithm
         * @return this builder
         */
        public Builder withoutCodec(CompressionAlgorithm algorithm) {
            codecs.remove(Objects.requireNonNull(algorithm, "algorithm"));
            return this;
        }

        public Builder fastThresholdBytes(int bytes) {
            if (bytes < 0) {
                throw new IllegalArgumentException("fastThresholdBytes must be >= 0");
            }
            this.fastThresholdBytes = bytes;
            return this;
        }

        public Builder highRatioThresholdBytes(int bytes) {
            if (bytes < 0) {
                throw new IllegalArgumentException("highRatioThresholdBytes must be >= 0");
            }
            this.highRatioThresholdBytes = bytes;
            return this;
        }

        public DeltaCompressor build() {
            if (highRatioThresholdBytes < fastThresholdBytes) {
                throw new IllegalArgumentException("highRatioThresholdBytes must be >= fastThresholdBytes");
            }
            return new DeltaCompressor(this);
        }
    }
}
