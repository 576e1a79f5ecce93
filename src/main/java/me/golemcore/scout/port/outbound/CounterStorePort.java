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

package me.golemcore.scout.port.outbound;

import java.time.Duration;
import java.util.OptionalLong;

/**
 * Port for atomic per-key counters with expiry, used for quota accounting.
 *
 * <p>
 * Implementations must report an unreachable backend by throwing
 * {@link me.golemcore.scout.domain.exception.BackendUnavailableException}
 * rather than returning zero, so that callers can apply their own failure
 * policy.
 */
public interface CounterStorePort {

    /**
     * Atomically increments the counter, creating it at 1 when absent.
     */
    long increment(String key);

    /**
     * Atomically decrements the counter and returns the new value.
     */
    long decrement(String key);

    /**
     * Returns the current value, or empty when the key is absent or expired.
     */
    OptionalLong get(String key);

    void delete(String key);

    /**
     * (Re)sets the key's time to live. No-op when the key is absent.
     */
    void expire(String key, Duration ttl);

    /**
     * Short backend name for status reporting (e.g. "memory", "redis").
     */
    String getBackendName();
}
