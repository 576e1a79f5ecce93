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
import me.golemcore.scout.port.outbound.CacheStorePort;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process TTL cache used when no distributed backend is configured.
 *
 * <p>
 * Entries carry an absolute expiry; a read at or after it removes the entry
 * and reports absence.
 */
@Slf4j
public class InMemoryCacheStore implements CacheStorePort {

    private static final String BACKEND_NAME = "memory";

    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, CacheEntry> entries = new HashMap<>();
    private ExpirySweeper sweeper;

    public InMemoryCacheStore(Clock clock) {
        this.clock = clock;
    }

    public void startSweeper(Duration interval) {
        if (sweeper == null) {
            sweeper = new ExpirySweeper("cache-store-sweeper", interval, this::evictExpired);
        }
    }

    public void shutdown() {
        if (sweeper != null) {
            sweeper.shutdown();
            sweeper = null;
        }
    }

    @Override
    public Optional<String> get(String key) {
        lock.lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry == null) {
                return Optional.empty();
            }
            if (entry.isExpired(clock.instant())) {
                entries.remove(key);
                return Optional.empty();
            }
            return Optional.of(entry.value());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        lock.lock();
        try {
            entries.put(key, new CacheEntry(value, clock.instant().plus(ttl)));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void delete(String key) {
        lock.lock();
        try {
            entries.remove(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int deleteByPrefix(String prefix) {
        lock.lock();
        try {
            int removed = 0;
            Iterator<String> it = entries.keySet().iterator();
            while (it.hasNext()) {
                if (it.next().startsWith(prefix)) {
                    it.remove();
                    removed++;
                }
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long size() {
        lock.lock();
        try {
            Instant now = clock.instant();
            return entries.values().stream().filter(e -> !e.isExpired(now)).count();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String getBackendName() {
        return BACKEND_NAME;
    }

    public int evictExpired() {
        lock.lock();
        try {
            Instant now = clock.instant();
            int removed = 0;
            Iterator<CacheEntry> it = entries.values().iterator();
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

    private record CacheEntry(String value, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
