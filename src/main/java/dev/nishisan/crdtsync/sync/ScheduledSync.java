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

package dev.nishisan.crdtsync.sync;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * Entry of the {@link LazySynchronizer} queue. Ordered by due time, then by
 * scheduling order.
 *
 * @param dueTime  when the sync becomes eligible
 * @param peerId   target peer
 * @param priority priority used to compute the interval
 * @param sequence monotonically increasing scheduling sequence
 */
public record ScheduledSync(Instant dueTime, String peerId, SyncPriority priority, long sequence)
        implements Comparable<ScheduledSync> {

    private static final Comparator<ScheduledSync> ORDER = Comparator
            .comparing(ScheduledSync::dueTime)
            .thenComparingLong(ScheduledSync::sequence);

    public ScheduledSync {
        Objects.requireNonNull(dueTime, "dueTime");
        Objects.requireNonNull(peerId, "peerId");
        Objects.requireNonNull(priority, "priority");
    }

    @Override
    public int compareTo(ScheduledSync other) {
        return ORDER.compare(this, other);
    }
}
