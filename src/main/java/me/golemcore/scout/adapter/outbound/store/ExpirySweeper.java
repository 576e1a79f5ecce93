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

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.IntSupplier;

/**
 * Daemon thread that periodically evicts expired keys from an in-process
 * store. Reads already treat expired keys as absent; the sweep only bounds
 * memory.
 */
@Slf4j
final class ExpirySweeper {

    private final ScheduledExecutorService executor;

    ExpirySweeper(String threadName, Duration interval, IntSupplier evictExpired) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
        long periodMillis = Math.max(1L, interval.toMillis());
        executor.scheduleAtFixedRate(() -> {
            try {
                int evicted = evictExpired.getAsInt();
                if (evicted > 0) {
                    log.debug("[Store] {} evicted {} expired keys", threadName, evicted);
                }
            } catch (RuntimeException e) {
                log.warn("[Store] {} sweep failed: {}", threadName, e.getMessage());
            }
        }, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
    }

    void shutdown() {
        executor.shutdownNow();
    }
}
