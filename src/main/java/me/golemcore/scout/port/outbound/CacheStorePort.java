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
import java.util.Optional;

/**
 * Port for a string key-value store with per-entry time to live.
 *
 * <p>
 * A read past an entry's expiry behaves exactly like a read of an absent key.
 */
public interface CacheStorePort {

    Optional<String> get(String key);

    /**
     * Writes the value, replacing any previous entry wholesale.
     */
    void set(String key, String value, Duration ttl);

    void delete(String key);

    /**
     * Removes every entry whose key starts with the prefix.
     *
     * @return number of entries removed
     */
    int deleteByPrefix(String prefix);

    /**
     * Number of live entries.
     */
    long size();

    String getBackendName();
}
