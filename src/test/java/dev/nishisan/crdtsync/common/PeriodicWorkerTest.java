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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class PeriodicWorkerTest {

    private ScheduledExecutorService scheduler;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newScheduledThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void keepsRunningAfterFailingTick() {
        AtomicInteger ticks = new AtomicInteger();
        PeriodicWorker worker = new PeriodicWorker("failing", scheduler, Duration.ofMillis(10),
                PeriodicWorker.DEFAULT_STOP_TIMEOUT) {
            @Override
            protected void tick() {
                ticks.incrementAndGet();
                throw new IllegalStateException("boom");
            }
        };
        worker.start();
        await("several ticks").atMost(5, TimeUnit.SECONDS).until(() -> ticks.get() >= 3);
        assertTrue(worker.stop());
        assertFalse(worker.isRunning());
    }

    @Test
    void stopAbandonsTickThatOutlivesTimeout() throws InterruptedException {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        PeriodicWorker worker = new PeriodicWorker("stuck", scheduler, Duration.ofSeconds(60),
                Duration.ofMillis(100)) {
            @Override
            protected void tick() throws InterruptedException {
                entered.countDown();
                release.await();
            }
        };
        worker.start();
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        long start = System.nanoTime();
        assertFalse(worker.stop());
        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) < 5000);
        release.countDown();
    }

    @Test
    void rejectsNonPositiveInterval() {
        assertThrows(IllegalArgumentException.class, () -> new PeriodicWorker("zero", scheduler, Duration.ZERO,
                PeriodicWorker.DEFAULT_STOP_TIMEOUT) {
            @Override
            protected void tick() {
            }
        });
    }
}
