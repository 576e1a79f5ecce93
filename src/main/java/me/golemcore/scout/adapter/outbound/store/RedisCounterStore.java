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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.scout.domain.exception.BackendUnavailableException;
import me.golemcore.scout.port.outbound.CounterStorePort;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.OptionalLong;

/**
 * Counter store backed by Redis {@code INCR}/{@code DECR}.
 *
 * <p>
 * Every Redis failure, including a {@code null} reply where a value is
 * required, is rethrown as {@link BackendUnavailableException}. A decrement
 * that lands at or below zero deletes the key and reports zero, matching the
 * in-process store.
 */
@RequiredArgsConstructor
@Slf4j
public class RedisCounterStore implements CounterStorePort {

    private static final String BACKEND_NAME = "redis";

    private final StringRedisTemplate redisTemplate;

    @Override
    public long increment(String key) {
        Long value = call("INCR", key, () -> redisTemplate.opsForValue().increment(key));
        return requireValue("INCR", key, value);
    }

    @Override
    public long decrement(String key) {
        long value = requireValue("DECR", key, call("DECR", key, () -> redisTemplate.opsForValue().decrement(key)));
        if (value <= 0) {
            delete(key);
            return 0;
        }
        return value;
    }

    @Override
    public OptionalLong get(String key) {
        String raw = call("GET", key, () -> redisTemplate.opsForValue().get(key));
        if (raw == null) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(raw));
        } catch (NumberFormatException e) {
            throw new BackendUnavailableException("Counter key " + key + " holds a non-numeric value", e);
        }
    }

    @Override
    public void delete(String key) {
        call("DEL", key, () -> redisTemplate.delete(key));
    }

    @Override
    public void expire(String key, Duration ttl) {
        call("EXPIRE", key, () -> redisTemplate.expire(key, ttl));
    }

    @Override
    public String getBackendName() {
        return BACKEND_NAME;
    }

    private <T> T call(String command, String key, RedisCall<T> action) {
        try {
            return action.execute();
        } catch (RuntimeException e) {
            log.debug("[Store] Redis {} {} failed: {}", command, key, e.getMessage());
            throw new BackendUnavailableException("Redis " + command + " failed for key " + key, e);
        }
    }

    private static long requireValue(String command, String key, Long value) {
        if (value == null) {
            throw new BackendUnavailableException("Redis " + command + " returned no value for key " + key, null);
        }
        return value;
    }

    @FunctionalInterface
    interface RedisCall<T> {
        T execute();
    }
}
