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

package dev.nishisan.crdtsync.common;

import java.io.Closeable;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base class for the background loops of this library. Each worker runs its
 * {@link #tick()} on a shared {@link ScheduledExecutorService} with a fixed
 * delay between runs.
 *
 * <p>
 * {@link #stop()} signals the loop to exit, cancels the schedule and waits for
 * an in-flight tick for at most the configured stop timeout. A tick that does
 * not finish in time is abandoned: it keeps running on its pool thread but the
 * caller is released.
 * </p>
 */
public abstract class PeriodicWorker implements Closeable {

    private static final Logger LOGGER = Logger.getLogger(PeriodicWorker.class.getName());

    /** Default time {@link #stop()} waits for an in-flight tick. */
    public static final Duration DEFAULT_STOP_TIMEOUT = Duration.ofSeconds(5);

    private final String workerName;
    private final ScheduledExecutorService scheduler;
    private final Duration interval;
    private final Duration stopTimeout;
    private final ReentrantLock tickLock = new ReentrantLock();
    private volatile boolean running;
    private volatile ScheduledFuture<?> task;

    protected PeriodicWorker(String workerName,
            ScheduledExecutorService scheduler,
            Duration interval,
            Duration stopTimeout) {
        this.workerName = Objects.requireNonNull(workerName, "workerName");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.stopTimeout = Objects.requireNonNull(stopTimeout, "stopTimeout");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException(workerName + " interval must be positive");
        }
    }

    /**
     * Starts the loop. Calling it on a running worker has no effect.
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        long periodMs = Math.max(1L, interval.toMillis());
        task = scheduler.scheduleWithFixedDelay(this::runTick, 0L, periodMs, TimeUnit.MILLISECONDS);
        LOGGER.info(() -> workerName + " started (interval " + interval + ")");
    }

    /**
     * Stops the loop and waits, bounded by the stop timeout, for a running tick.
     *
     * @return {@code true} if the loop is fully quiescent, {@code false} if an
     *         in-flight tick was abandoned
     */
    public boolean stop() {
        ScheduledFuture<?> current;
        synchronized (this) {
            if (!running) {
                return true;
            }
            running = false;
            current = task;
            task = null;
        }
        if (current != null) {
            current.cancel(false);
        }
        try {
            if (tickLock.tryLock(stopTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                tickLock.unlock();
                LOGGER.info(() -> workerName + " stopped");
                return true;
            }
            LOGGER.warning(() -> workerName + " did not stop within " + stopTimeout + ", abandoning in-flight work");
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * @return {@code true} once {@link #stop()} has been requested; long ticks
     *         should check it between units of work
     */
    protected boolean isStopping() {
        return !running;
    }

    protected String workerName() {
        return workerName;
    }

    private void runTick() {
        if (!running) {
            return;
        }
        tickLock.lock();
        try {
            if (!running) {
                return;
            }
            tick();
        } catch (Throwable t) {
            LOGGER.log(Level.WARNING, workerName + " tick failed", t);
        } finally {
            tickLock.unlock();
        }
    }

    /**
     * One iteration of the loop. Exceptions are logged and the loop continues.
     *
     * @throws Exception any failure of this iteration
     */
    protected abstract void tick() throws Exception;

    @Override
    public void close() {
        stop();
    }
}
