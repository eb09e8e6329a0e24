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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Thread-safe, append-only ring buffer. Once {@code capacity} is reached the
 * oldest element is evicted for every new one. All read operations return
 * detached copies ordered from oldest to newest.
 *
 * @param <E> element type
 */
public class BoundedHistory<E> {

    private static final Logger logger = LoggerFactory.getLogger(BoundedHistory.class);

    private final ArrayDeque<E> internalList;
    private final int capacity;
    private final String name;
    private final ReentrantLock lock = new ReentrantLock();
    private E lastAddedElement;
    private long evictedCount;

    public BoundedHistory(String name, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive.");
        }
        this.capacity = capacity;
        this.name = Objects.requireNonNull(name, "name");
        this.internalList = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    public boolean add(E element) {
        Objects.requireNonNull(element, "element");
        lock.lock();
        try {
            if (internalList.size() == capacity) {
                internalList.removeFirst();
                if (evictedCount++ == 0) {
                    logger.debug("History [{}] reached capacity {}, evicting oldest entries", name, capacity);
                }
            }
            this.lastAddedElement = element;
            return internalList.add(element);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return every element currently held, oldest first
     */
    public List<E> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(internalList);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @param filter element filter
     * @return matching elements, oldest first
     */
    public List<E> filter(Predicate<? super E> filter) {
        Objects.requireNonNull(filter, "filter");
        List<E> result = new ArrayList<>();
        lock.lock();
        try {
            for (E element : internalList) {
                if (filter.test(element)) {
                    result.add(element);
                }
            }
        } finally {
            lock.unlock();
        }
        return result;
    }

    /**
     * Returns up to {@code count} of the most recent elements, still ordered
     * oldest first.
     *
     * @param count maximum number of elements
     * @return the trailing elements
     */
    public List<E> tail(int count) {
        if (count <= 0) {
            return List.of();
        }
        lock.lock();
        try {
            int skip = Math.max(0, internalList.size() - count);
            List<E> result = new ArrayList<>(Math.min(count, internalList.size()));
            Iterator<E> it = internalList.iterator();
            for (int i = 0; it.hasNext(); i++) {
                E element = it.next();
                if (i >= skip) {
                    result.add(element);
                }
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return internalList.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public void clear() {
        lock.lock();
        try {
            internalList.clear();
            lastAddedElement = null;
        } finally {
            lock.unlock();
        }
    }

    public String getName() {
        return name;
    }

    public int getCapacity() {
        return capacity;
    }

    public E getLastAddedElement() {
        lock.lock();
        try {
            return lastAddedElement;
        } finally {
            lock.unlock();
        }
    }

    public long getEvictedCount() {
        lock.lock();
        try {
            return evictedCount;
        } finally {
            lock.unlock();
        }
    }
}
