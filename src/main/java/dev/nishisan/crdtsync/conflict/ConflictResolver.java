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

import java.util.List;

/**
 * Resolves a batch of conflicts of the same type. Supplied by the replication
 * engine, which owns the actual merge semantics.
 */
@FunctionalInterface
public interface ConflictResolver {

    /**
     * @param conflictType type shared by every conflict of the group
     * @param conflicts    the group, ordered by detection time
     * @throws Exception if the group cannot be resolved
     */
    void resolve(String conflictType, List<ConflictRecord> conflicts) throws Exception;
}
