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

package dev.nishisan.crdtsync.optimizer;

import java.util.Objects;
import java.util.Optional;

/**
 * Provides the delta to send to a peer when its scheduled sync runs.
 */
@FunctionalInterface
public interface DeltaSource {

    /**
     * @param peerId destination peer
     * @return the pending delta, or empty when the peer is up to date
     * @throws Exception if the delta cannot be produced
     */
    Optional<PendingDelta> pendingDelta(String peerId) throws Exception;

    /**
     * @return a source that never has anything to send
     */
    static DeltaSource none() {
        return peerId -> Optional.empty();
    }

    /**
     * Delta payload together with the number of operations it carries.
     *
     * @param payload        JSON-serializable delta
     * @param operationCount operations in the delta
     */
    record PendingDelta(Object payload, int operationCount) {
        public PendingDelta {
            Objects.requireNonNull(payload, "payload");
        }
    }
}
