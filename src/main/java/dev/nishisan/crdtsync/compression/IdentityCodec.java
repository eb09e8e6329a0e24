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

import java.util.Arrays;

/**
 * Pass-through codec for {@link CompressionAlgorithm#NONE}.
 */
public final class IdentityCodec implements CompressionCodec {

    @Override
    public CompressionAlgorithm algorithm() {
        return CompressionAlgorithm.NONE;
    }

    @Override
    public byte[] encode(byte[] input) {
        return Arrays.copyOf(input, input.length);
    }

    @Override
    public byte[] decode(byte[] input) {
        return Arrays.copyOf(input, input.length);
    }
}
