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

import dev.nishisan.crdtsync.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class LazySynchronizerTest {

    private ScheduledExecutorService scheduler;
    private MutableClock clock;
    private List<String> synced;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
        synced = new CopyOnWriteArrayList<>();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    private LazySynchronizer.Builder builder(PeerSyncHandler handler) {
        return LazySynchronizer.builder("node-a", scheduler, handler).clock(clock);
    }

    private LazySynchronizer recording() {
        return builder((peer, priority) -> synced.add(peer)).build();
    }

    @Test
    void intervalFollowsActivityBands() {
        LazySynchronizer sync = recording();
        assertEquals(Duration.ofSeconds(120), sync.computeInterval(0, SyncPriority.NORMAL));
        assertEquals(Duration.ofSeconds(60), sync.computeInterval(7, SyncPriority.NORMAL));
        assertEquals(Duration.ofSeconds(30), sync.computeInterval(50, SyncPriority.NORMAL));
        assertEquals(Duration.ofSeconds(15), sync.computeInterval(500, SyncPriority.NORMAL));
    }

    @Test
    void priorityScalesInterval() {
        LazySynchronizer sync = recording();
        assertEquals(Duration.ofMillis(1500), sync.computeInterval(500, SyncPriority.CRITICAL));
        assertEquals(Duration.ofMillis(7500), sync.computeInterval(500, SyncPriority.HIGH));
        assertEquals(Duration.ofSeconds(240), sync.computeInterval(0, SyncPriority.LOW));
    }

    @Test
    void intervalIsAlwaysWithinBounds() {
        LazySynchronizer sync = builder((peer, priority) -> {
        }).baseInterval(Duration.ofHours(1)).build();
        LazySynchronizer fast = builder((peer, priority) -> {
        }).baseInterval(Duration.ofSeconds(1)).build();
        long[] activities = {0, 4, 5, 10, 11, 100, 101, 10_000};
        for (SyncPriority priority : SyncPriority.values()) {
            for (long activity : activities) {
                for (LazySynchronizer s : List.of(sync, fast)) {
                    Duration interval = s.computeInterval(activity, priority);
                    assertTrue(interval.compareTo(Duration.ofSeconds(1)) >= 0, interval::toString);
                    assertTrue(interval.compareTo(Duration.ofSeconds(3600)) <= 0, interval::toString);
                }
            }
        }
        assertEquals(Duration.ofSeconds(3600), sync.computeInterval(0, SyncPriority.LOW));
        assertEquals(Duration.ofSeconds(1), fast.computeInterval(500, SyncPriority.CRITICAL));
    }

    @Test
    void runsSyncOnceDueAndResetsActivity() {
        LazySynchronizer sync = recording();
        sync.recordActivity("peer-1", 50);
        sync.recordActivity("peer-1", 70);
        assertEquals(120, sync.activityCount("peer-1"));

        ScheduledSync entry = sync.scheduleSync("peer-1", SyncPriority.NORMAL);
        assertEquals(Instant.parse("2025-01-01T00:00:15Z"), entry.dueTime());
        assertEquals(1, sync.queueDepth());

        assertEquals(0, sync.runDueSyncs(clock.instant().plusSeconds(14)));
        clock.advance(Duration.ofSeconds(15));
        assertEquals(1, sync.runDueSyncs(clock.instant()));

        assertEquals(List.of("peer-1"), synced);
        assertEquals(0, sync.activityCount("peer-1"));
        assertEquals(0, sync.queueDepth());
        assertEquals(1, sync.completedSyncs());
        assertEquals(clock.instant(), sync.lastSyncTime("peer-1").orElseThrow());
    }

    @Test
    void failedSyncIsCountedAndStillResetsActivity() {
        LazySynchronizer sync = builder((peer, priority) -> {
            throw new IllegalStateException("peer unreachable");
        }).build();
        sync.recordActivity("peer-1", 20);
        sync.scheduleSync("peer-1", SyncPriority.CRITICAL);

        assertEquals(1, sync.runDueSyncs(clock.instant().plusSeconds(3600)));

        assertEquals(1, sync.failedSyncs());
        assertEquals(0, sync.completedSyncs());
        assertEquals(0, sync.activityCount("peer-1"));
        assertTrue(sync.lastSyncTime("peer-1").isEmpty());
    }

    @Test
    void dueEntriesRunInDueThenInsertionOrder() {
        LazySynchronizer sync = recording();
        sync.scheduleSync("slow", SyncPriority.LOW);
        sync.scheduleSync("first", SyncPriority.NORMAL);
        sync.scheduleSync("second", SyncPriority.NORMAL);
        sync.scheduleSync("urgent", SyncPriority.CRITICAL);

        List<ScheduledSync> pending = sync.pendingSyncs();
        assertEquals(List.of("urgent", "first", "second", "slow"), pending.stream().map(ScheduledSync::peerId).toList());

        sync.runDueSyncs(clock.instant().plus(Duration.ofHours(1)));
        assertEquals(List.of("urgent", "first", "second", "slow"), synced);
    }

    @Test
    void backgroundLoopPerformsDueSyncs() {
        LazySynchronizer sync = builder((peer, priority) -> synced.add(peer))
                .pollInterval(Duration.ofMillis(10))
                .build();
        sync.scheduleSync("peer-1", SyncPriority.HIGH);
        sync.start();
        try {
            assertTrue(sync.isRunning());
            clock.advance(Duration.ofMinutes(5));
            await("scheduled sync executed").atMost(5, TimeUnit.SECONDS).until(() -> sync.completedSyncs() == 1);
            assertEquals(List.of("peer-1"), synced);
        } finally {
            assertTrue(sync.stop());
        }
        assertFalse(sync.isRunning());
    }

    @Test
    void rejectsNegativeActivity() {
        LazySynchronizer sync = recording();
        assertThrows(IllegalArgumentException.class, () -> sync.recordActivity("peer-1", -1));
    }

    @Test
    void rejectsInvertedBounds() {
        assertThrows(IllegalArgumentException.class, () -> builder((peer, priority) -> {
        }).minInterval(Duration.ofMinutes(10)).maxInterval(Duration.ofMinutes(1)).build());
    }

    @Test
    void mapsActivityLevelsToPriorities() {
        assertEquals(SyncPriority.HIGH, SyncPriority.fromActivityLevel("high"));
        assertEquals(SyncPriority.NORMAL, SyncPriority.fromActivityLevel("normal"));
        assertEquals(SyncPriority.LOW, SyncPriority.fromActivityLevel("LOW"));
        assertEquals(SyncPriority.NORMAL, SyncPriority.fromActivityLevel("bursty"));
        assertEquals(SyncPriority.NORMAL, SyncPriority.fromActivityLevel(null));
    }
}
