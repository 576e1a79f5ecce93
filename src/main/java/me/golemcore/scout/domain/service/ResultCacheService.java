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

package me.golemcore.scout.domain.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.scout.domain.model.CacheNamespace;
import me.golemcore.scout.domain.model.CacheStats;
import me.golemcore.scout.infrastructure.config.ScoutProperties;
import me.golemcore.scout.port.outbound.CacheStorePort;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Map;
import java.util.Optional;

/**
 * Cache-aside helper over the {@link CacheStorePort}.
 *
 * <p>
 * Keys have the form {@code <namespace>:<16 hex chars>}, where the digest is
 * the SHA-256 of the namespace followed by the canonical JSON of the key
 * parameters. Canonical JSON sorts map keys and drops null values, so two
 * parameter maps with equal content always produce the same key.
 *
 * <p>
 * Values are stored as JSON. Caching never affects correctness: backend and
 * (de)serialization failures are logged and read as a miss or a dropped
 * write. When {@code scout.cache.enabled=false} every read misses and every
 * write is skipped.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class ResultCacheService {

    private static final int DIGEST_PREFIX_LENGTH = 16;

    private final CacheStorePort cacheStore;
    private final ObjectMapper objectMapper;
    private final ScoutProperties.CacheProperties cacheProperties;
    private final ObjectMapper canonicalMapper;

    public ResultCacheService(CacheStorePort cacheStore, ObjectMapper objectMapper, ScoutProperties properties) {
        this.cacheStore = cacheStore;
        this.objectMapper = objectMapper;
        this.cacheProperties = properties.getCache();
        this.canonicalMapper = JsonMapper.builder()
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .defaultPropertyInclusion(JsonInclude.Value.construct(
                        JsonInclude.Include.NON_NULL, JsonInclude.Include.NON_NULL))
                .build();
    }

    public boolean isEnabled() {
        return cacheProperties.isEnabled();
    }

    public <T> Optional<T> get(String namespace, Map<String, ?> keyParams, Class<T> type) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        String key = null;
        try {
            key = deriveKey(namespace, keyParams);
            Optional<String> raw = cacheStore.get(key);
            if (raw.isEmpty()) {
                log.debug("[Cache] Miss {}", key);
                return Optional.empty();
            }
            log.debug("[Cache] Hit {}", key);
            return Optional.of(objectMapper.readValue(raw.get(), type));
        } catch (JsonProcessingException e) {
            log.warn("[Cache] Unreadable entry {}, treating as miss: {}", key, e.getOriginalMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("[Cache] Read failed for {}, treating as miss: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    public <T> void set(String namespace, Map<String, ?> keyParams, T value) {
        set(namespace, keyParams, value, null);
    }

    /**
     * Writes the value under the derived key.
     *
     * @param ttlOverride
     *            time to live, or {@code null} for the namespace default
     */
    public <T> void set(String namespace, Map<String, ?> keyParams, T value, Duration ttlOverride) {
        if (!isEnabled() || value == null) {
            return;
        }
        String key = null;
        try {
            key = deriveKey(namespace, keyParams);
            Duration ttl = ttlOverride != null ? ttlOverride : defaultTtl(namespace);
            cacheStore.set(key, objectMapper.writeValueAsString(value), ttl);
            log.debug("[Cache] Stored {} (ttl {}s)", key, ttl.toSeconds());
        } catch (JsonProcessingException e) {
            log.warn("[Cache] Could not serialize value for {}, write dropped: {}", key, e.getOriginalMessage());
        } catch (RuntimeException e) {
            log.warn("[Cache] Write failed for {}, dropped: {}", key, e.getMessage());
        }
    }

    public void invalidate(String namespace, Map<String, ?> keyParams) {
        if (!isEnabled()) {
            return;
        }
        try {
            cacheStore.delete(deriveKey(namespace, keyParams));
        } catch (RuntimeException e) {
            log.warn("[Cache] Invalidate failed in {}: {}", namespace, e.getMessage());
        }
    }

    /**
     * Removes every entry whose key starts with the given namespace prefix.
     *
     * @return number of entries removed
     */
    public int invalidatePattern(String namespacePrefix) {
        if (!isEnabled()) {
            return 0;
        }
        try {
            int removed = cacheStore.deleteByPrefix(namespacePrefix);
            log.info("[Cache] Invalidated {} entries with prefix '{}'", removed, namespacePrefix);
            return removed;
        } catch (RuntimeException e) {
            log.warn("[Cache] Pattern invalidate failed for '{}': {}", namespacePrefix, e.getMessage());
            return 0;
        }
    }

    /**
     * Derives the store key for the namespace and parameters.
     *
     * @throws IllegalArgumentException
     *             if the parameters cannot be serialized
     */
    public String deriveKey(String namespace, Map<String, ?> keyParams) {
        String canonical;
        try {
            canonical = canonicalMapper.writeValueAsString(keyParams != null ? keyParams : Map.of());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cache key parameters are not serializable", e);
        }
        byte[] digest = sha256(namespace + canonical);
        String hex = HexFormat.of().formatHex(digest);
        return namespace + ":" + hex.substring(0, DIGEST_PREFIX_LENGTH);
    }

    public Duration defaultTtl(String namespace) {
        ScoutProperties.TtlProperties ttl = cacheProperties.getTtl();
        if (CacheNamespace.EVIDENCE.getKey().equals(namespace)) {
            return ttl.getEvidence();
        }
        if (CacheNamespace.JOB_SEARCH.getKey().equals(namespace)) {
            return ttl.getJobSearch();
        }
        if (CacheNamespace.RESEARCH.getKey().equals(namespace)) {
            return ttl.getResearch();
        }
        return ttl.getDefaultTtl();
    }

    public CacheStats getStats() {
        long keys;
        try {
            keys = cacheStore.size();
        } catch (RuntimeException e) {
            log.warn("[Cache] Could not read cache size: {}", e.getMessage());
            keys = -1;
        }
        return new CacheStats(cacheStore.getBackendName(), keys);
    }

    private static byte[] sha256(String input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
