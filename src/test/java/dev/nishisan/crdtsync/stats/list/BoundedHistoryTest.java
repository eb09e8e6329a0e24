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

package dev.nishisan.crdtsync.stats.list;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class BoundedHistoryTest {

    @Test
    void evictsOldestOnceFull() {
        BoundedHistory<Integer> history = new BoundedHistory<>("test", 3);
        for (int i = 1; i <= 5; i++) {
            history.add(i);
        }
        assertEquals(List.of(3, 4, 5), history.snapshot());
        assertEquals(2, history.getEvictedCount());
        assertEquals(5, history.getLastAddedElement());
    }

    @Test
    void tailReturnsNewestOldestFirst() {
        BoundedHistory<Integer> history = new BoundedHistory<>("test", 10);
        for (int i = 1; i <= 6; i++) {
            history.add(i);
        }
        assertEquals(List.of(4, 5, 6), history.tail(3));
        assertEquals(List.of(1, 2, 3, 4, 5, 6), history.tail(20));
        assertTrue(history.tail(0).isEmpty());
    }

    @Test
    void filterKeepsOrder() {
        BoundedHistory<Integer> history = new BoundedHistory<>("test", 10);
        for (int i = 1; i <= 6; i++) {
            history.add(i);
        }
        assertEquals(List.of(2, 4, 6), history.filter(i -> i % 2 == 0));
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new BoundedHistory<>("test", 0));
    }

    @Test
    void concurrentAddsNeverExceedCapacity() throws InterruptedException {
        BoundedHistory<Integer> history = new BoundedHistory<>("test", 100);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch done = new CountDownLatch(4);
        for (int t = 0; t < 4; t++) {
            pool.execute(() -> {
                for (int i = 0; i < 1000; i++) {
                    history.add(i);
                }
                done.countDown();
            });
        }
        assertTrue(done.await(10, TimeUnit.SECONDS));
        pool.shutdownNow();
        assertEquals(100, history.size());
        assertEquals(3900, history.getEvictedCount());
    }
}
