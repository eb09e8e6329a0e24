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

import dev.nishisan.crdtsync.common.PeriodicWorker;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-peer adaptive sync scheduler.
 *
 * <p>
 * Callers record replication activity per peer and schedule syncs; the
 * interval until the sync is due shrinks with activity and priority:
 * </p>
 * <ol>
 * <li>start from the base interval (60s)</li>
 * <li>activity &gt; 100: divide by 4; activity &gt; 10: divide by 2;
 * activity &lt; 5: multiply by 2</li>
 * <li>multiply by the {@link SyncPriority#intervalFactor() priority
 * factor}</li>
 * <li>clamp to [1s, 3600s]</li>
 * </ol>
 *
 * <p>
 * A single background loop polls the queue every {@code pollInterval}, runs
 * the {@link PeerSyncHandler} for every due entry and resets the peer's
 * activity counter once the sync completes, whether it succeeded or not. The
 * queue is the only state shared between schedulers and the loop and is
 * guarded by a lock.
 * </p>
 */
public final class LazySynchronizer extends PeriodicWorker {

    private static final Logger LOGGER = Logger.getLogger(LazySynchronizer.class.getName());

    static final long HIGH_ACTIVITY_THRESHOLD = 100;
    static final long MEDIUM_ACTIVITY_THRESHOLD = 10;
    static final long LOW_ACTIVITY_THRESHOLD = 5;

    private final String nodeId;
    private final PeerSyncHandler handler;
    private final Clock clock;
    private final Duration baseInterval;
    private final Duration minInterval;
    private final Duration maxInterval;

    private final Map<String, Long> activityCounters = new ConcurrentHashMap<>();
    private final Map<String, Instant> lastSyncTimes = new ConcurrentHashMap<>();
    private final ReentrantLock queueLock = new ReentrantLock();
    private final PriorityQueue<ScheduledSync> queue = new PriorityQueue<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong completedSyncs = new AtomicLong();
    private final AtomicLong failedSyncs = new AtomicLong();

    private LazySynchronizer(Builder builder) {
        super("lazy-synchronizer[" + builder.nodeId + "]", builder.scheduler, builder.pollInterval,
                builder.stopTimeout);
        this.nodeId = builder.nodeId;
        this.handler = Objects.requireNonNull(builder.handler, "handler");
        this.clock = builder.clock;
        this.baseInterval = builder.baseInterval;
        this.minInterval = builder.minInterval;
        this.maxInterval = builder.maxInterval;
    }

    /**
     * Adds to a peer's activity counter.
     *
     * @param peerId        the peer
     * @param activityCount operations observed, must be non-negative
     */
    public void recordActivity(String peerId, long activityCount) {
        Objects.requireNonNull(peerId, "peerId");
        if (activityCount < 0) {
            throw new IllegalArgumentException("activityCount must be >= 0");
        }
        activityCounters.merge(peerId, activityCount, Long::sum);
    }

    /**
     * @param peerId the peer
     * @return activity recorded since the last completed sync with the peer
     */
    public long activityCount(String peerId) {
        return activityCounters.getOrDefault(peerId, 0L);
    }

    /**
     * Computes the delay before the next sync with a peer.
     *
     * @param activityCount activity since the last sync
     * @param priority      sync priority
     * @return an interval within [minInterval, maxInterval]
     */
    public Duration computeInterval(long activityCount, SyncPriority priority) {
        Objects.requireNonNull(priority, "priority");
        double intervalMs = baseInterval.toMillis();
        if (activityCount > HIGH_ACTIVITY_THRESHOLD) {
            intervalMs /= 4;
        } else if (activityCount > MEDIUM_ACTIVITY_THRESHOLD) {
            intervalMs /= 2;
        } else if (activityCount < LOW_ACTIVITY_THRESHOLD) {
            intervalMs *= 2;
        }
        intervalMs *= priority.intervalFactor();
        double clamped = Math.max(minInterval.toMillis(), Math.min(maxInterval.toMillis(), intervalMs));
        return Duration.ofMillis(Math.round(clamped));
    }

    /**
     * Schedules a sync with a peer, due after the adaptive interval.
     *
     * @param peerId   the peer
     * @param priority sync priority
     * @return the queued entry
     */
    public ScheduledSync scheduleSync(String peerId, SyncPriority priority) {
        Objects.requireNonNull(peerId, "peerId");
        Objects.requireNonNull(priority, "priority");
        long activity = activityCount(peerId);
        Duration interval = computeInterval(activity, priority);
        ScheduledSync entry = new ScheduledSync(clock.instant().plus(interval), peerId, priority,
                sequence.incrementAndGet());
        queueLock.lock();
        try {
            queue.add(entry);
        } finally {
            queueLock.unlock();
        }
        LOGGER.fine(() -> "Scheduled " + priority + " sync with " + peerId + " in " + interval
                + " (activity: " + activity + ")");
        return entry;
    }

    /**
     * @return number of queued syncs
     */
    public int queueDepth() {
        queueLock.lock();
        try {
            return queue.size();
        } finally {
            queueLock.unlock();
        }
    }

    /**
     * @return queued syncs in due order
     */
    public List<ScheduledSync> pendingSyncs() {
        List<ScheduledSync> copy;
        queueLock.lock();
        try {
            copy = new ArrayList<>(queue);
        } finally {
            queueLock.unlock();
        }
        copy.sort(null);
        return copy;
    }

    /**
     * @param peerId the peer
     * @return time of the last successful sync with the peer
     */
    public Optional<Instant> lastSyncTime(String peerId) {
        return Optional.ofNullable(lastSyncTimes.get(peerId));
    }

    public long completedSyncs() {
        return completedSyncs.get();
    }

    public long failedSyncs() {
        return failedSyncs.get();
    }

    public String nodeId() {
        return nodeId;
    }

    @Override
    protected void tick() {
        List<ScheduledSync> due = drainDue(clock.instant());
        for (int i = 0; i < due.size(); i++) {
            if (isStopping()) {
                requeue(due.subList(i, due.size()));
                return;
            }
            perform(due.get(i));
        }
    }

    /**
     * Runs every entry that is due at {@code now} on the calling thread.
     * Package-private for testing.
     *
     * @param now reference time
     * @return number of syncs executed
     */
    int runDueSyncs(Instant now) {
        List<ScheduledSync> due = drainDue(now);
        due.forEach(this::perform);
        return due.size();
    }

    private List<ScheduledSync> drainDue(Instant now) {
        List<ScheduledSync> due = new ArrayList<>();
        queueLock.lock();
        try {
            while (!queue.isEmpty() && !queue.peek().dueTime().isAfter(now)) {
                due.add(queue.poll());
            }
        } finally {
            queueLock.unlock();
        }
        return due;
    }

    private void requeue(List<ScheduledSync> entries) {
        queueLock.lock();
        try {
            queue.addAll(entries);
        } finally {
            queueLock.unlock();
        }
    }

    private void perform(ScheduledSync entry) {
        String peerId = entry.peerId();
        try {
            handler.sync(peerId, entry.priority());
            lastSyncTimes.put(peerId, clock.instant());
            completedSyncs.incrementAndGet();
            LOGGER.fine(() -> "Completed " + entry.priority() + " sync with " + peerId);
        } catch (Exception e) {
            failedSyncs.incrementAndGet();
            LOGGER.log(Level.WARNING, "Sync failed with " + peerId, e);
        } finally {
            activityCounters.put(peerId, 0L);
        }
    }

    public static Builder builder(String nodeId, ScheduledExecutorService scheduler, PeerSyncHandler handler) {
        return new Builder(nodeId, scheduler, handler);
    }

    /**
     * Builder for {@link LazySynchronizer}.
     */
    public static final class Builder {
        private final String nodeId;
        private final ScheduledExecutorService scheduler;
        private final PeerSyncHandler handler;
        private Clock clock = Clock.systemUTC();
        private Duration pollInterval = Duration.ofSeconds(1);
        private Duration baseInterval = Duration.ofSeconds(60);
        private Duration minInterval = Duration.ofSeconds(1);
        private Duration maxInterval = Duration.ofSeconds(3600);
        private Duration stopTimeout = DEFAULT_STOP_TIMEOUT;

        private Builder(String nodeId, ScheduledExecutorService scheduler, PeerSyncHandler handler) {
            this.nodeId = Objects.requireNonNull(nodeId, "nodeId");
            this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
            this.handler = Objects.requireNonNull(handler, "handler");
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
            return this;
        }

        public Builder baseInterval(Duration baseInterval) {
            this.baseInterval = Objects.requireNonNull(baseInterval, "baseInterval");
            return this;
        }

        public Builder minInterval(Duration minInterval) {
            this.minInterval = Objects.requireNonNull(minInterval, "minInterval");
            return this;
        }

        public Builder maxInterval(Duration maxInterval) {
            this.maxInterval = Objects.requireNonNull(maxInterval, "maxInterval");
            return this;
        }

        public Builder stopTimeout(Duration stopTimeout) {
            this.stopTimeout = Objects.requireNonNull(stopTimeout, "stopTimeout");
            return this;
        }

        public LazySynchronizer build() {
            if (minInterval.compareTo(maxInterval) > 0) {
                throw new IllegalArgumentException("minInterval must not exceed maxInterval");
            }
            return new LazySynchronizer(this);
        }
    }
}
