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

import java.io.Closeable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Accumulates detected conflicts and hands them to resolvers in batches.
 *
 * <p>
 * A batch is flushed either when it reaches {@code batchSize} (synchronously,
 * on the thread adding the last conflict) or when the one-shot deadline armed
 * by its first conflict expires, whichever comes first. Each batch is flushed
 * exactly once: taking the batch, clearing the pending list and cancelling the
 * deadline happen atomically, and a deadline only acts on the batch generation
 * it was armed for.
 * </p>
 *
 * <p>
 * On flush, conflicts are grouped by type and each group, sorted by detection
 * time, is passed to the resolver registered for that type (or the default
 * resolver). Resolvers run outside the lock; a failing resolver does not stop
 * the remaining groups.
 * </p>
 *
 * <p>
 * Once the scheduler is shut down no deadline can be armed, so every added
 * conflict is resolved on the calling thread.
 * </p>
 */
public final class ConflictBatcher implements Closeable {

    private static final Logger LOGGER = Logger.getLogger(ConflictBatcher.class.getName());

    /** Default number of conflicts that triggers an immediate flush. */
    public static final int DEFAULT_BATCH_SIZE = 10;
    /** Default time a partial batch waits before being flushed. */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private final int batchSize;
    private final Duration timeout;
    private final ScheduledExecutorService scheduler;
    private final Map<String, ConflictResolver> resolvers = new ConcurrentHashMap<>();
    private volatile ConflictResolver defaultResolver;

    private final Object lock = new Object();
    private final List<ConflictRecord> pending = new ArrayList<>();
    private ScheduledFuture<?> deadline;
    private long generation;

    private final AtomicLong flushCount = new AtomicLong();
    private final AtomicLong resolvedGroups = new AtomicLong();
    private final AtomicLong failedGroups = new AtomicLong();

    private ConflictBatcher(Builder builder) {
        this.batchSize = builder.batchSize;
        this.timeout = builder.timeout;
        this.scheduler = builder.scheduler;
        this.defaultResolver = builder.defaultResolver;
        this.resolvers.putAll(builder.resolvers);
    }

    /**
     * Registers the resolver for a conflict type, replacing any previous one.
     *
     * @param conflictType the type
     * @param resolver     the resolver
     */
    public void registerResolver(String conflictType, ConflictResolver resolver) {
        resolvers.put(Objects.requireNonNull(conflictType, "conflictType"),
                Objects.requireNonNull(resolver, "resolver"));
    }

    /**
     * Sets the resolver used for types without a dedicated one.
     *
     * @param resolver the resolver, or {@code null} to clear it
     */
    public void setDefaultResolver(ConflictResolver resolver) {
        this.defaultResolver = resolver;
    }

    /**
     * Adds a conflict to the current batch. Returns after resolving the batch
     * when this conflict filled it, or when the scheduler no longer accepts a
     * deadline for it.
     *
     * @param conflict the conflict
     */
    public void addConflict(ConflictRecord conflict) {
        Objects.requireNonNull(conflict, "conflict");
        List<ConflictRecord> batch = null;
        String trigger = "size";
        synchronized (lock) {
            pending.add(conflict);
            if (pending.size() == 1 && !armDeadline()) {
                batch = takeBatch();
                trigger = "scheduler unavailable";
            } else if (pending.size() >= batchSize) {
                batch = takeBatch();
            }
        }
        if (batch != null) {
            resolveBatch(batch, trigger);
        }
    }

    /**
     * Flushes the pending batch now. A no-op when nothing is pending.
     *
     * @return number of conflicts flushed
     */
    public int flush() {
        List<ConflictRecord> batch;
        synchronized (lock) {
            if (pending.isEmpty()) {
                return 0;
            }
            batch = takeBatch();
        }
        resolveBatch(batch, "manual");
        return batch.size();
    }

    private void onDeadline(long armedGeneration) {
        List<ConflictRecord> batch;
        synchronized (lock) {
            if (armedGeneration != generation || pending.isEmpty()) {
                return;
            }
            batch = takeBatch();
        }
        resolveBatch(batch, "timeout");
    }

    // caller holds lock; false when the scheduler rejected the deadline
    private boolean armDeadline() {
        long armedGeneration = generation;
        try {
            deadline = scheduler.schedule(() -> onDeadline(armedGeneration), timeout.toMillis(),
                    TimeUnit.MILLISECONDS);
            return true;
        } catch (RejectedExecutionException e) {
            LOGGER.log(Level.FINE, "Deadline rejected by scheduler, resolving conflict immediately", e);
            return false;
        }
    }

    // caller holds lock
    private List<ConflictRecord> takeBatch() {
        List<ConflictRecord> snapshot = new ArrayList<>(pending);
        pending.clear();
        generation++;
        if (deadline != null) {
            deadline.cancel(false);
            deadline = null;
        }
        flushCount.incrementAndGet();
        return snapshot;
    }

    private void resolveBatch(List<ConflictRecord> batch, String trigger) {
        Map<String, List<ConflictRecord>> groups = groupByType(batch);
        LOGGER.fine(() -> "Flushing " + batch.size() + " conflicts in " + groups.size() + " groups (trigger: "
                + trigger + ")");
        for (Map.Entry<String, List<ConflictRecord>> group : groups.entrySet()) {
            String conflictType = group.getKey();
            List<ConflictRecord> conflicts = group.getValue();
            ConflictResolver resolver = resolvers.getOrDefault(conflictType, defaultResolver);
            if (resolver == null) {
                failedGroups.incrementAndGet();
                LOGGER.warning(() -> "No resolver registered for " + conflictType + ", " + conflicts.size()
                        + " conflicts left unresolved");
                continue;
            }
            try {
                LOGGER.info(() -> "Resolving batch of " + conflicts.size() + " " + conflictType + " conflicts");
                resolver.resolve(conflictType, conflicts);
                resolvedGroups.incrementAndGet();
            } catch (Exception e) {
                failedGroups.incrementAndGet();
                LOGGER.log(Level.WARNING, "Failed to resolve " + conflictType + " conflicts", e);
            }
        }
    }

    static Map<String, List<ConflictRecord>> groupByType(List<ConflictRecord> batch) {
        Map<String, List<ConflictRecord>> groups = new LinkedHashMap<>();
        for (ConflictRecord conflict : batch) {
            groups.computeIfAbsent(conflict.conflictType(), k -> new ArrayList<>()).add(conflict);
        }
        groups.values().forEach(list -> list.sort(Comparator.comparing(ConflictRecord::detectedAt)));
        return groups;
    }

    /**
     * @return conflicts waiting for the next flush
     */
    public int pendingCount() {
        synchronized (lock) {
            return pending.size();
        }
    }

    /**
     * @return number of batches flushed so far
     */
    public long flushCount() {
        return flushCount.get();
    }

    public long resolvedGroups() {
        return resolvedGroups.get();
    }

    public long failedGroups() {
        return failedGroups.get();
    }

    public int batchSize() {
        return batchSize;
    }

    public Duration timeout() {
        return timeout;
    }

    /**
     * Cancels the deadline and flushes whatever is pending.
     */
    @Override
    public void close() {
        flush();
    }

    public static Builder builder(ScheduledExecutorService scheduler) {
        return new Builder(scheduler);
    }

    /**
     * Builder for {@link ConflictBatcher}.
     */
    public static final class Builder {
        private final ScheduledExecutorService scheduler;
        private final Map<String, ConflictResolver> resolvers = new LinkedHashMap<>();
        private ConflictResolver defaultResolver;
        private int batchSize = DEFAULT_BATCH_SIZE;
        private Duration timeout = DEFAULT_TIMEOUT;

        private Builder(ScheduledExecutorService scheduler) {
            this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        }

        public Builder batchSize(int batchSize) {
            if (batchSize < 1) {
                throw new IllegalArgumentException("batchSize must be >= 1");
            }
            this.batchSize = batchSize;
            return this;
        }

        public Builder timeout(Duration timeout) {
            Objects.requireNonNull(timeout, "timeout");
            if (timeout.isNegative()) {
                throw new IllegalArgumentException("timeout must not be negative");
            }
            this.timeout = timeout;
            return this;
        }

        public Builder resolver(String conflictType, ConflictResolver resolver) {
            resolvers.put(Objects.requireNonNull(conflictType, "conflictType"),
                    Objects.requireNonNull(resolver, "resolver"));
            return this;
        }

        public Builder defaultResolver(ConflictResolver resolver) {
            this.defaultResolver = resolver;
            return this;
        }

        public ConflictBatcher build() {
            return new ConflictBatcher(this);
        }
    }
}
