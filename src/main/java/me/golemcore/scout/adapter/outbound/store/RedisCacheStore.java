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
import me.golemcore.scout.port.outbound.CacheStorePort;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Cache store backed by Redis string values with native {@code SET ... EX}
 * expiry.
 */
@RequiredArgsConstructor
@Slf4j
public class RedisCacheStore implements CacheStorePort {

    private static final String BACKEND_NAME = "redis";

    private final StringRedisTemplate redisTemplate;

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(key));
        } catch (RuntimeException e) {
            throw unavailable("GET", key, e);
        }
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        try {
            redisTemplate.opsForValue().set(key, value, ttl);
        } catch (RuntimeException e) {
            throw unavailable("SET", key, e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            redisTemplate.delete(key);
        } catch (RuntimeException e) {
            throw unavailable("DEL", key, e);
        }
    }

    @Override
    public int deleteByPrefix(String prefix) {
        try {
            Set<String> keys = redisTemplate.keys(prefix + "*");
            if (keys == null || keys.isEmpty()) {
                return 0;
            }
            Long deleted = redisTemplate.delete(keys);
            return deleted != null ? deleted.intValue() : 0;
        } catch (RuntimeException e) {
            throw unavailable("KEYS", prefix + "*", e);
        }
    }

    @Override
    public long size() {
        try {
            Long size = redisTemplate.execute((RedisCallback<Long>) connection -> connection.serverCommands().dbSize());
            return size != null ? size : 0L;
        } catch (RuntimeException e) {
            throw unavailable("DBSIZE", "", e);
        }
    }

    @Override
    public String getBackendName() {
        return BACKEND_NAME;
    }

    private static BackendUnavailableException unavailable(String command, String key, RuntimeException cause) {
        log.debug("[Store] Redis {} {} failed: {}", command, key, cause.getMessage());
        return new BackendUnavailableException("Redis " + command + " failed for key " + key, cause);
    }
}
