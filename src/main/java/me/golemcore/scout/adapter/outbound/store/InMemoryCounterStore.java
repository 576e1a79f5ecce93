/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.scout.adapter.outbound.store;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.scout.port.outbound.CounterStorePort;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process counter store for single-instance deployments and tests.
 *
 * <p>
 * All access to the table goes through one lock, so increment and decrement
 * are atomic with respect to each other. Each key may carry an expiry
 * deadline that is checked on every access; an optional background sweeper
 * evicts expired keys that are never touched again.
 *
 * <p>
 * Decrement floors at zero and removes the key when it reaches zero.
 */
@Slf4j
public class InMemoryCounterStore implements CounterStorePort {

    private static final String BACKEND_NAME = "memory";

    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Counter> counters = new HashMap<>();
    private ExpirySweeper sweeper;

    public InMemoryCounterStore(Clock clock) {
        this.clock = clock;
    }

    /**
     * Starts the background eviction of expired keys.
     */
    public void startSweeper(Duration interval) {
        if (sweeper == null) {
            sweeper = new ExpirySweeper("counter-store-sweeper", interval, this::evictExpired);
        }
    }

    public void shutdown() {
        if (sweeper != null) {
            sweeper.shutdown();
            sweeper = null;
        }
    }

    @Override
    public long increment(String key) {
        lock.lock();
        try {
            Counter counter = liveCounter(key);
            if (counter == null) {
                counter = new Counter();
                counters.put(key, counter);
            }
            counter.value++;
            return counter.value;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long decrement(String key) {
        lock.lock();
        try {
            Counter counter = liveCounter(key);
            if (counter == null) {
                return 0;
            }
            long next = Math.max(0, counter.value - 1);
            if (next == 0) {
                counters.remove(key);
            } else {
                counter.value = next;
            }
            return next;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public OptionalLong get(String key) {
        lock.lock();
        try {
            Counter counter = liveCounter(key);
            return counter != null ? OptionalLong.of(counter.value) : OptionalLong.empty();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void delete(String key) {
        lock.lock();
        try {
            counters.remove(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void expire(String key, Duration ttl) {
        lock.lock();
        try {
            Counter counter = liveCounter(key);
            if (counter != null) {
                counter.expiresAt = clock.instant().plus(ttl);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String getBackendName() {
        return BACKEND_NAME;
    }

    /**
     * Removes every expired key.
     *
     * @return number of keys removed
     */
    public int evictExpired() {
        lock.lock();
        try {
            Instant now = clock.instant();
            int removed = 0;
            Iterator<Counter> it = counters.values().iterator();
            while (it.hasNext()) {
                if (it.next().isExpired(now)) {
                    it.remove();
                    removed++;
                }
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of keys currently held, expired or not.
     */
    int rawSize() {
        lock.lock();
        try {
            return counters.size();
        } finally {
            lock.unlock();
        }
    }

    // Caller must hold the lock.
    private Counter liveCounter(String key) {
        Counter counter = counters.get(key);
        if (counter != null && counter.isExpired(clock.instant())) {
            counters.remove(key);
            return null;
        }
        return counter;
    }

    private static final class Counter {
        private long value;
        private Instant expiresAt;

        private boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }
}
